package io.vena.docsync.local.memory;

import io.vena.docsync.core.Query;
import io.vena.docsync.local.DocumentReference;
import io.vena.docsync.local.IndexManager;
import io.vena.docsync.local.MutationQueue;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.ResourcePath;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.MutationBatch;
import io.vena.docsync.util.ByteString;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;
import org.pcollections.TreePSet;

final class MemoryMutationQueue implements MutationQueue {
	private final MemoryPersistence persistence;
	private final IndexManager indexManager;

	/**
	 * Batches in id order. Ids are consecutive, so a batch's index is its id minus the first id.
	 */
	private final List<MutationBatch> queue = new ArrayList<>();

	private TreePSet<DocumentReference> batchesByDocumentKey = TreePSet.empty(DocumentReference.BY_KEY);
	private int nextBatchId = 1;
	private ByteString lastStreamToken = ByteString.EMPTY;

	MemoryMutationQueue(MemoryPersistence persistence, IndexManager indexManager) {
		this.persistence = persistence;
		this.indexManager = indexManager;
	}

	@Override
	public void start() {
		if (isEmpty()) {
			nextBatchId = 1;
		}
	}

	@Override
	public boolean isEmpty() {
		return queue.isEmpty();
	}

	@Override
	public void acknowledgeBatch(MutationBatch batch, ByteString streamToken) {
		int batchIndex = indexOfExistingBatchId(batch.batchId(), "acknowledged");
		if (batchIndex != 0) {
			throw new IllegalStateException("Can only acknowledge the first batch in the mutation queue");
		}
		lastStreamToken = streamToken;
	}

	@Override
	public ByteString getLastStreamToken() {
		return lastStreamToken;
	}

	@Override
	public void setLastStreamToken(ByteString streamToken) {
		this.lastStreamToken = streamToken;
	}

	@Override
	public MutationBatch addMutationBatch(Instant localWriteTime, List<Mutation> baseMutations, List<Mutation> mutations) {
		int batchId = nextBatchId;
		nextBatchId += 1;
		if (!queue.isEmpty()) {
			MutationBatch prior = queue.get(queue.size() - 1);
			if (prior.batchId() >= batchId) {
				throw new IllegalStateException("Mutation batch ids must be monotonically increasing");
			}
		}
		MutationBatch batch = new MutationBatch(batchId, localWriteTime, baseMutations, mutations);
		queue.add(batch);
		for (Mutation mutation: mutations) {
			batchesByDocumentKey = batchesByDocumentKey.plus(new DocumentReference(mutation.key(), batchId));
			indexManager.addToCollectionParentIndex(mutation.key().getCollectionPath());
		}
		return batch;
	}

	@Override
	public @Nullable MutationBatch lookupMutationBatch(int batchId) {
		int index = indexOfBatchId(batchId);
		if (index < 0 || index >= queue.size()) {
			return null;
		}
		MutationBatch batch = queue.get(index);
		if (batch.batchId() != batchId) {
			throw new IllegalStateException("Unexpected batch id " + batch.batchId() + " at the position of " + batchId);
		}
		return batch;
	}

	@Override
	public @Nullable MutationBatch getNextMutationBatchAfterBatchId(int batchId) {
		int rawIndex = indexOfBatchId(batchId + 1);
		int index = rawIndex < 0 ? 0 : rawIndex;
		return queue.size() > index ? queue.get(index) : null;
	}

	@Override
	public int getHighestUnacknowledgedBatchId() {
		return queue.isEmpty() ? MutationBatch.UNKNOWN : nextBatchId - 1;
	}

	@Override
	public List<MutationBatch> getAllMutationBatches() {
		return Collections.unmodifiableList(new ArrayList<>(queue));
	}

	@Override
	public List<MutationBatch> getAllMutationBatchesAffectingDocumentKey(DocumentKey documentKey) {
		List<MutationBatch> result = new ArrayList<>();
		for (DocumentReference reference: referencesFrom(documentKey)) {
			if (!documentKey.equals(reference.key())) {
				break;
			}
			MutationBatch batch = lookupMutationBatch(reference.id());
			if (batch == null) {
				throw new IllegalStateException("Batches in the index must exist in the main table");
			}
			result.add(batch);
		}
		return result;
	}

	@Override
	public List<MutationBatch> getAllMutationBatchesAffectingDocumentKeys(Iterable<DocumentKey> documentKeys) {
		SortedSet<Integer> uniqueBatchIds = new TreeSet<>();
		for (DocumentKey key: documentKeys) {
			for (DocumentReference reference: referencesFrom(key)) {
				if (!key.equals(reference.key())) {
					break;
				}
				uniqueBatchIds.add(reference.id());
			}
		}
		return lookupMutationBatches(uniqueBatchIds);
	}

	@Override
	public List<MutationBatch> getAllMutationBatchesAffectingQuery(Query query) {
		if (query.isCollectionGroupQuery()) {
			throw new IllegalArgumentException("Collection group queries must be split into collection queries first");
		}
		ResourcePath prefix = query.path();
		int immediateChildrenPathLength = prefix.length() + 1;
		ResourcePath startPath = prefix;
		if (!DocumentKey.isDocumentKey(startPath)) {
			startPath = startPath.append("");
		}
		SortedSet<Integer> uniqueBatchIds = new TreeSet<>();
		for (DocumentReference reference: referencesFrom(DocumentKey.fromPath(startPath))) {
			ResourcePath rowKeyPath = reference.key().path();
			if (!prefix.isPrefixOf(rowKeyPath)) {
				break;
			}
			if (rowKeyPath.length() == immediateChildrenPathLength) {
				uniqueBatchIds.add(reference.id());
			}
		}
		return lookupMutationBatches(uniqueBatchIds);
	}

	@Override
	public void removeMutationBatch(MutationBatch batch) {
		int batchIndex = indexOfExistingBatchId(batch.batchId(), "removed");
		if (batchIndex != 0) {
			throw new IllegalStateException("Can only remove the first entry of the mutation queue");
		}
		queue.remove(0);
		for (Mutation mutation: batch.mutations()) {
			DocumentKey key = mutation.key();
			persistence.getReferenceDelegate().removeMutationReference(key);
			batchesByDocumentKey = batchesByDocumentKey.minus(new DocumentReference(key, batch.batchId()));
		}
	}

	@Override
	public void performConsistencyCheck() {
		if (queue.isEmpty() && !batchesByDocumentKey.isEmpty()) {
			throw new IllegalStateException("Document leak: mutation references remain when the queue is empty");
		}
	}

	@Override
	public boolean containsKey(DocumentKey key) {
		SortedSet<DocumentReference> references = referencesFrom(key);
		return !references.isEmpty() && references.first().key().equals(key);
	}

	private SortedSet<DocumentReference> referencesFrom(DocumentKey key) {
		return batchesByDocumentKey.tailSet(new DocumentReference(key, Integer.MIN_VALUE));
	}

	private List<MutationBatch> lookupMutationBatches(SortedSet<Integer> batchIds) {
		List<MutationBatch> result = new ArrayList<>();
		for (Integer batchId: batchIds) {
			MutationBatch batch = lookupMutationBatch(batchId);
			if (batch != null) {
				result.add(batch);
			}
		}
		return result;
	}

	private int indexOfBatchId(int batchId) {
		if (queue.isEmpty()) {
			return 0;
		}
		return batchId - queue.get(0).batchId();
	}

	private int indexOfExistingBatchId(int batchId, String action) {
		int index = indexOfBatchId(batchId);
		if (index < 0 || index >= queue.size()) {
			throw new IllegalStateException("Batches must exist to be " + action);
		}
		return index;
	}
}
