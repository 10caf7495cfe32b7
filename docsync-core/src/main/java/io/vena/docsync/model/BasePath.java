package io.vena.docsync.model;

import java.util.ArrayList;
import java.util.List;

import static java.util.Collections.unmodifiableList;

/**
 * An immutable list of string segments, ordered segment by segment.
 */
public abstract class BasePath<B extends BasePath<B>> implements Comparable<B> {
	final List<String> segments;

	BasePath(List<String> segments) {
		this.segments = unmodifiableList(segments);
	}

	abstract B createPathWithSegments(List<String> segments);

	public abstract String canonicalString();

	public String getSegment(int index) {
		return segments.get(index);
	}

	public List<String> segments() {
		return segments;
	}

	public int length() {
		return segments.size();
	}

	public boolean isEmpty() {
		return segments.isEmpty();
	}

	public String getFirstSegment() {
		return segments.get(0);
	}

	public String getLastSegment() {
		return segments.get(segments.size() - 1);
	}

	public B append(String segment) {
		List<String> newSegments = new ArrayList<>(segments);
		newSegments.add(segment);
		return createPathWithSegments(newSegments);
	}

	public B append(B path) {
		List<String> newSegments = new ArrayList<>(segments);
		newSegments.addAll(path.segments);
		return createPathWithSegments(newSegments);
	}

	public B popFirst() {
		return popFirst(1);
	}

	public B popFirst(int count) {
		if (count > length()) {
			throw new IllegalArgumentException("Can't pop " + count + " segments from " + this);
		}
		return createPathWithSegments(new ArrayList<>(segments.subList(count, length())));
	}

	public B popLast() {
		if (isEmpty()) {
			throw new IllegalStateException("Can't pop from an empty path");
		}
		return createPathWithSegments(new ArrayList<>(segments.subList(0, length() - 1)));
	}

	public boolean isPrefixOf(B other) {
		if (length() > other.length()) {
			return false;
		}
		for (int i = 0; i < length(); i++) {
			if (!getSegment(i).equals(other.getSegment(i))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return true if <code>other</code> is this path plus exactly one more segment.
	 */
	public boolean isImmediateParentOf(B other) {
		return length() + 1 == other.length() && isPrefixOf(other);
	}

	@Override
	public int compareTo(B other) {
		int limit = Math.min(length(), other.length());
		for (int i = 0; i < limit; i++) {
			int cmp = getSegment(i).compareTo(other.getSegment(i));
			if (cmp != 0) {
				return cmp;
			}
		}
		return Integer.compare(length(), other.length());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return segments.equals(((BasePath<?>) o).segments);
	}

	@Override
	public int hashCode() {
		return 37 * getClass().hashCode() + segments.hashCode();
	}

	@Override
	public String toString() {
		return canonicalString();
	}
}
