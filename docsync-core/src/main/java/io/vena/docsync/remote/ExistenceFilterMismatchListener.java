package io.vena.docsync.remote;

/**
 * Observes every existence filter that disagreed with the locally known documents of a target.
 * Called on the async queue; implementations must return quickly.
 */
public interface ExistenceFilterMismatchListener {
	/**
	 * @param localCacheCount the number of documents the client believed matched the target
	 * @param existenceFilterCount the number the backend reported
	 * @param bloomFilter what happened with the bloom filter sent along with the count
	 */
	record ExistenceFilterMismatchInfo(int targetId, int localCacheCount, int existenceFilterCount, BloomFilterOutcome bloomFilter) { }

	enum BloomFilterOutcome {
		/** The backend sent no bloom filter. */
		ABSENT,
		/** The bloom filter could not be decoded. */
		MALFORMED,
		/** Removing the keys missing from the filter reconciled the counts. */
		APPLIED,
		/** The counts still differed after applying the filter, so the target is re-listened. */
		FALSE_POSITIVE,
	}

	void onExistenceFilterMismatch(ExistenceFilterMismatchInfo info);

	ExistenceFilterMismatchListener NONE = info -> { };
}
