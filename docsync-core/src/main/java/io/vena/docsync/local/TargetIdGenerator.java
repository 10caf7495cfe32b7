package io.vena.docsync.local;

/**
 * Generates target ids from two disjoint sequences, so ids allocated by the local cache
 * never collide with ids the sync engine allocates for limbo resolution:
 * even numbers for the target cache and odd numbers for the sync engine.
 */
public final class TargetIdGenerator {
	private static final int QUERY_CACHE_ID = 0;
	private static final int SYNC_ENGINE_ID = 1;
	private static final int RESERVED_BITS = 1;

	private int nextId;

	private TargetIdGenerator(int generatorId, int seed) {
		this.nextId = (seed & ~SYNC_ENGINE_ID) | generatorId;
	}

	/**
	 * @param after the highest target id in use; the first id returned is greater
	 */
	public static TargetIdGenerator forTargetCache(int after) {
		TargetIdGenerator generator = new TargetIdGenerator(QUERY_CACHE_ID, after);
		generator.nextId();
		return generator;
	}

	public static TargetIdGenerator forSyncEngine() {
		return new TargetIdGenerator(SYNC_ENGINE_ID, 1);
	}

	public int nextId() {
		int result = nextId;
		nextId += 1 << RESERVED_BITS;
		return result;
	}
}
