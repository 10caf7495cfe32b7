package io.vena.docsync.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.pcollections.TreePMap;
import org.pcollections.TreePSet;

/**
 * An immutable set of documents ordered by a query's comparator, with lookup by key.
 */
public final class DocumentSet implements Iterable<Document> {
	private final TreePMap<DocumentKey, Document> keyIndex;
	private final TreePSet<Document> sortedSet;

	private DocumentSet(TreePMap<DocumentKey, Document> keyIndex, TreePSet<Document> sortedSet) {
		this.keyIndex = keyIndex;
		this.sortedSet = sortedSet;
	}

	/**
	 * Ties in <code>comparator</code> are broken by key.
	 */
	public static DocumentSet emptySet(Comparator<Document> comparator) {
		Comparator<Document> adjusted = (left, right) -> {
			int cmp = comparator.compare(left, right);
			return cmp != 0 ? cmp : Document.KEY_COMPARATOR.compare(left, right);
		};
		return new DocumentSet(TreePMap.empty(), TreePSet.empty(adjusted));
	}

	public int size() {
		return keyIndex.size();
	}

	public boolean isEmpty() {
		return keyIndex.isEmpty();
	}

	public boolean contains(DocumentKey key) {
		return keyIndex.containsKey(key);
	}

	public @Nullable Document getDocument(DocumentKey key) {
		return keyIndex.get(key);
	}

	public @Nullable Document getFirstDocument() {
		return sortedSet.isEmpty() ? null : sortedSet.first();
	}

	public @Nullable Document getLastDocument() {
		return sortedSet.isEmpty() ? null : sortedSet.last();
	}

	/**
	 * @return the document sorting immediately before the one with the given key,
	 * or null if there is none or the key is absent.
	 */
	public @Nullable Document getPredecessor(DocumentKey key) {
		Document document = keyIndex.get(key);
		if (document == null) {
			return null;
		}
		return sortedSet.lower(document);
	}

	public int indexOf(DocumentKey key) {
		Document document = keyIndex.get(key);
		if (document == null) {
			return -1;
		}
		return sortedSet.headSet(document).size();
	}

	/**
	 * Replaces any existing document with the same key.
	 */
	public DocumentSet add(Document document) {
		DocumentSet removed = remove(document.key());
		return new DocumentSet(
			removed.keyIndex.plus(document.key(), document),
			removed.sortedSet.plus(document));
	}

	public DocumentSet remove(DocumentKey key) {
		Document document = keyIndex.get(key);
		if (document == null) {
			return this;
		}
		return new DocumentSet(keyIndex.minus(key), sortedSet.minus(document));
	}

	public List<Document> toList() {
		return new ArrayList<>(sortedSet);
	}

	@Override
	public Iterator<Document> iterator() {
		return sortedSet.iterator();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof DocumentSet)) return false;
		DocumentSet other = (DocumentSet) o;
		if (size() != other.size()) {
			return false;
		}
		Iterator<Document> these = iterator();
		Iterator<Document> those = other.iterator();
		while (these.hasNext()) {
			if (!these.next().equals(those.next())) {
				return false;
			}
		}
		return true;
	}

	@Override
	public int hashCode() {
		int result = 0;
		for (Document document: this) {
			result = 31 * result + document.key().hashCode();
			result = 31 * result + document.data().hashCode();
		}
		return result;
	}

	@Override
	public String toString() {
		return toList().toString();
	}
}
