package io.vena.docsync.local;

import io.vena.docsync.core.Query;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.MutationBatch;
import io.vena.docsync.util.ByteString;
import java.time.Instant;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * The durable queue of a single user's writes that the backend has not yet acknowledged,
 * in the order they were made.
 *
 * <p>
 * All methods must be called inside a transaction of the owning {@link Persistence}.
 */
public interface MutationQueue {
	/**
	 * Prepares the queue for use, after a restart or a change of user.
	 */
	void start();

	boolean isEmpty();

	/**
	 * Records the stream token of the acknowledgement of <code>batch</code>,
	 * which must be the first batch in the queue.
	 */
	void acknowledgeBatch(MutationBatch batch, ByteString streamToken);

	ByteString getLastStreamToken();

	void setLastStreamToken(ByteString streamToken);

	/**
	 * Assigns the next batch id and appends the batch. Requires a read-write transaction.
	 */
	MutationBatch addMutationBatch(Instant localWriteTime, List<Mutation> baseMutations, List<Mutation> mutations);

	@Nullable MutationBatch lookupMutationBatch(int batchId);

	/**
	 * @return the first batch with an id greater than <code>batchId</code>, or null if none.
	 */
	@Nullable MutationBatch getNextMutationBatchAfterBatchId(int batchId);

	/**
	 * @return {@link MutationBatch#UNKNOWN} if the queue is empty.
	 */
	int getHighestUnacknowledgedBatchId();

	List<MutationBatch> getAllMutationBatches();

	List<MutationBatch> getAllMutationBatchesAffectingDocumentKey(DocumentKey documentKey);

	List<MutationBatch> getAllMutationBatchesAffectingDocumentKeys(Iterable<DocumentKey> documentKeys);

	/**
	 * @return every batch that might affect the results of <code>query</code>; possibly more.
	 */
	List<MutationBatch> getAllMutationBatchesAffectingQuery(Query query);

	/**
	 * Removes <code>batch</code>, which must be the first batch in the queue.
	 *
	 * @throws IllegalStateException if it is not
	 */
	void removeMutationBatch(MutationBatch batch);

	/**
	 * Verifies the invariants that must hold when the queue is empty:
	 * no document references remain.
	 *
	 * @throws IllegalStateException if they do not
	 */
	void performConsistencyCheck();

	boolean containsKey(DocumentKey key);
}
