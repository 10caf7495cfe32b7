package io.vena.docsync.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * An index over the documents of a collection group, configured explicitly by the application.
 *
 * @param indexId assigned by the {@code IndexManager}; {@link #UNKNOWN_ID} until then
 * @param indexState how far the backfiller has progressed
 */
public record FieldIndex(int indexId, String collectionGroup, List<Segment> segments, IndexState indexState) {
	public static final int UNKNOWN_ID = -1;
	public static final IndexState INITIAL_STATE = new IndexState(0, IndexOffset.NONE);

	/**
	 * Orders indexes by their definition, ignoring id and state.
	 */
	public static final Comparator<FieldIndex> SEMANTIC_COMPARATOR = (left, right) -> {
		int cmp = left.collectionGroup.compareTo(right.collectionGroup);
		if (cmp != 0) {
			return cmp;
		}
		for (int i = 0; i < Math.min(left.segments.size(), right.segments.size()); i++) {
			cmp = left.segments.get(i).compareTo(right.segments.get(i));
			if (cmp != 0) {
				return cmp;
			}
		}
		return Integer.compare(left.segments.size(), right.segments.size());
	};

	public FieldIndex {
		segments = List.copyOf(segments);
	}

	public static FieldIndex create(String collectionGroup, List<Segment> segments) {
		return new FieldIndex(UNKNOWN_ID, collectionGroup, segments, INITIAL_STATE);
	}

	public FieldIndex withIndexId(int newId) {
		return new FieldIndex(newId, collectionGroup, segments, indexState);
	}

	public FieldIndex withIndexState(IndexState newState) {
		return new FieldIndex(indexId, collectionGroup, segments, newState);
	}

	public @Nullable Segment getArraySegment() {
		for (Segment segment: segments) {
			if (segment.kind() == Segment.Kind.CONTAINS) {
				return segment;
			}
		}
		return null;
	}

	public List<Segment> getDirectionalSegments() {
		List<Segment> result = new ArrayList<>();
		for (Segment segment: segments) {
			if (segment.kind() != Segment.Kind.CONTAINS) {
				result.add(segment);
			}
		}
		return result;
	}

	public record Segment(FieldPath fieldPath, Kind kind) implements Comparable<Segment> {
		public enum Kind {
			ASCENDING,
			DESCENDING,
			CONTAINS
		}

		public static Segment ascending(String fieldPath) {
			return new Segment(FieldPath.fromDotSeparatedString(fieldPath), Kind.ASCENDING);
		}

		public static Segment descending(String fieldPath) {
			return new Segment(FieldPath.fromDotSeparatedString(fieldPath), Kind.DESCENDING);
		}

		public static Segment contains(String fieldPath) {
			return new Segment(FieldPath.fromDotSeparatedString(fieldPath), Kind.CONTAINS);
		}

		@Override
		public int compareTo(Segment other) {
			int cmp = fieldPath.compareTo(other.fieldPath);
			return cmp != 0 ? cmp : kind.compareTo(other.kind);
		}
	}

	/**
	 * @param sequenceNumber increases each time the backfiller processes this index's collection group
	 */
	public record IndexState(long sequenceNumber, IndexOffset offset) { }
}
