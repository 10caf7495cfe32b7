package io.vena.docsync.model;

import java.util.Comparator;

/**
 * A position in the stream of cached documents ordered by read time and key,
 * plus the largest mutation batch already accounted for.
 * Used to resume index backfills and to find documents that changed after a query was last run.
 */
public record IndexOffset(SnapshotVersion readTime, DocumentKey documentKey, int largestBatchId) implements Comparable<IndexOffset> {
	public static final int INITIAL_LARGEST_BATCH_ID = -1;
	public static final IndexOffset NONE = new IndexOffset(SnapshotVersion.NONE, DocumentKey.empty(), INITIAL_LARGEST_BATCH_ID);

	public static final Comparator<MutableDocument> DOCUMENT_COMPARATOR = (left, right) -> fromDocument(left).compareTo(fromDocument(right));

	public static IndexOffset create(SnapshotVersion readTime, int largestBatchId) {
		return new IndexOffset(readTime, DocumentKey.empty(), largestBatchId);
	}

	/**
	 * @return the smallest offset after every document read at <code>readTime</code>.
	 */
	public static IndexOffset createSuccessor(SnapshotVersion readTime, int largestBatchId) {
		SnapshotVersion successor = new SnapshotVersion(readTime.timestamp().plusNanos(1));
		return new IndexOffset(successor, DocumentKey.empty(), largestBatchId);
	}

	public static IndexOffset fromDocument(Document document) {
		return new IndexOffset(document.readTime(), document.key(), INITIAL_LARGEST_BATCH_ID);
	}

	@Override
	public int compareTo(IndexOffset other) {
		int cmp = readTime.compareTo(other.readTime);
		if (cmp != 0) return cmp;
		cmp = documentKey.compareTo(other.documentKey);
		if (cmp != 0) return cmp;
		return Integer.compare(largestBatchId, other.largestBatchId);
	}
}
