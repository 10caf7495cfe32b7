package io.vena.docsync.local;

/**
 * Why a target is being listened to.
 */
public enum QueryPurpose {
	/** A query an application listener asked for. */
	LISTEN,

	/** The query is re-listened because its existence filter did not match, without a bloom filter to help. */
	EXISTENCE_FILTER_MISMATCH,

	/** The query is re-listened because its existence filter did not match even after applying the bloom filter. */
	EXISTENCE_FILTER_MISMATCH_BLOOM,

	/** A single-document query to find out whether a document in limbo still exists. */
	LIMBO_RESOLUTION,
}
