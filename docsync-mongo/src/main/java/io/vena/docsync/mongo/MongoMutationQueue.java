package io.vena.docsync.mongo;

import io.vena.docsync.auth.User;
import io.vena.docsync.core.Query;
import io.vena.docsync.local.IndexManager;
import io.vena.docsync.local.MutationQueue;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.MutationBatch;
import io.vena.docsync.util.ByteString;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.gt;
import static com.mongodb.client.model.Filters.in;
import static com.mongodb.client.model.Sorts.ascending;
import static com.mongodb.client.model.Sorts.descending;

/**
 * One MongoDB document per mutation batch, holding the batch and the keys it writes.
 * Batch ids are unique per user and increase across restarts,
 * but unlike the in-memory queue they need not be consecutive.
 */
final class MongoMutationQueue implements MutationQueue {
	private final MongoPersistence persistence;
	private final TransactionalCollection batches;
	private final TransactionalCollection queues;
	private final BsonFormat format;
	private final IndexManager indexManager;
	private final String uid;
	private int nextBatchId = 1;

	MongoMutationQueue(MongoPersistence persistence, TransactionalCollection batches, TransactionalCollection queues, BsonFormat format, User user, IndexManager indexManager) {
		this.persistence = persistence;
		this.batches = batches;
		this.queues = queues;
		this.format = format;
		this.indexManager = indexManager;
		this.uid = user.storageKey();
	}

	@Override
	public void start() {
		// Ids are never reused, even across users
		BsonDocument highest = batches.findFirst(new BsonDocument(), descending("batchId"));
		nextBatchId = highest == null ? 1 : highest.getInt32("batchId").getValue() + 1;
		LOGGER.debug("Started mutation queue for \"{}\" at batch {}", uid, nextBatchId);
	}

	@Override
	public boolean isEmpty() {
		return !batches.exists(eq("uid", uid));
	}

	@Override
	public void acknowledgeBatch(MutationBatch batch, ByteString streamToken) {
		checkIsFirst(batch, "acknowledged", "Can only acknowledge the first batch in the mutation queue");
		setLastStreamToken(streamToken);
	}

	@Override
	public ByteString getLastStreamToken() {
		BsonDocument queue = queues.findById(new BsonString(uid));
		return queue == null ? ByteString.EMPTY : format.decodeBytes(queue.get("lastStreamToken"));
	}

	@Override
	public void setLastStreamToken(ByteString streamToken) {
		queues.upsert(new BsonDocument()
			.append("_id", new BsonString(uid))
			.append("lastStreamToken", format.encodeBytes(streamToken)));
	}

	@Override
	public MutationBatch addMutationBatch(Instant localWriteTime, List<Mutation> baseMutations, List<Mutation> mutations) {
		int batchId = nextBatchId;
		nextBatchId += 1;
		MutationBatch batch = new MutationBatch(batchId, localWriteTime, baseMutations, mutations);
		Set<String> keys = new TreeSet<>();
		Set<String> collections = new TreeSet<>();
		for (Mutation mutation: mutations) {
			keys.add(mutation.key().path().canonicalString());
			collections.add(mutation.key().getCollectionPath().canonicalString());
			indexManager.addToCollectionParentIndex(mutation.key().getCollectionPath());
		}
		batches.insert(new BsonDocument()
			.append("uid", new BsonString(uid))
			.append("batchId", new BsonInt32(batchId))
			.append("localWriteTime", format.encodeInstant(localWriteTime))
			.append("baseMutations", format.encodeMutations(baseMutations))
			.append("mutations", format.encodeMutations(mutations))
			.append("keys", strings(keys))
			.append("collections", strings(collections)));
		LOGGER.trace("Added batch {} for \"{}\"", batchId, uid);
		return batch;
	}

	@Override
	public @Nullable MutationBatch lookupMutationBatch(int batchId) {
		List<BsonDocument> found = batches.find(and(eq("uid", uid), eq("batchId", batchId)));
		return found.isEmpty() ? null : format.decodeMutationBatch(found.get(0));
	}

	@Override
	public @Nullable MutationBatch getNextMutationBatchAfterBatchId(int batchId) {
		BsonDocument found = batches.findFirst(and(eq("uid", uid), gt("batchId", batchId)), ascending("batchId"));
		return found == null ? null : format.decodeMutationBatch(found);
	}

	@Override
	public int getHighestUnacknowledgedBatchId() {
		BsonDocument found = batches.findFirst(eq("uid", uid), descending("batchId"));
		return found == null ? MutationBatch.UNKNOWN : found.getInt32("batchId").getValue();
	}

	@Override
	public List<MutationBatch> getAllMutationBatches() {
		return decodeAll(batches.find(eq("uid", uid), ascending("batchId")));
	}

	@Override
	public List<MutationBatch> getAllMutationBatchesAffectingDocumentKey(DocumentKey documentKey) {
		return decodeAll(batches.find(and(eq("uid", uid), eq("keys", documentKey.path().canonicalString())), ascending("batchId")));
	}

	@Override
	public List<MutationBatch> getAllMutationBatchesAffectingDocumentKeys(Iterable<DocumentKey> documentKeys) {
		Set<String> keys = new TreeSet<>();
		for (DocumentKey key: documentKeys) {
			keys.add(key.path().canonicalString());
		}
		if (keys.isEmpty()) {
			return List.of();
		}
		return decodeAll(batches.find(and(eq("uid", uid), in("keys", keys)), ascending("batchId")));
	}

	@Override
	public List<MutationBatch> getAllMutationBatchesAffectingQuery(Query query) {
		if (query.isCollectionGroupQuery()) {
			throw new IllegalArgumentException("Collection group queries must be split into collection queries first");
		}
		return decodeAll(batches.find(and(eq("uid", uid), eq("collections", query.path().canonicalString())), ascending("batchId")));
	}

	@Override
	public void removeMutationBatch(MutationBatch batch) {
		checkIsFirst(batch, "removed", "Can only remove the first entry of the mutation queue");
		batches.deleteMany(and(eq("uid", uid), eq("batchId", batch.batchId())));
		for (Mutation mutation: batch.mutations()) {
			persistence.getReferenceDelegate().removeMutationReference(mutation.key());
		}
	}

	/**
	 * Document references live inside the batch documents, so they leave the queue along with their batch.
	 */
	@Override
	public void performConsistencyCheck() {
	}

	@Override
	public boolean containsKey(DocumentKey key) {
		return batches.exists(and(eq("uid", uid), eq("keys", key.path().canonicalString())));
	}

	private void checkIsFirst(MutationBatch batch, String action, String misorderedMessage) {
		BsonDocument first = batches.findFirst(eq("uid", uid), ascending("batchId"));
		if (first == null || lookupMutationBatch(batch.batchId()) == null) {
			throw new IllegalStateException("Batches must exist to be " + action);
		}
		if (first.getInt32("batchId").getValue() != batch.batchId()) {
			throw new IllegalStateException(misorderedMessage);
		}
	}

	private List<MutationBatch> decodeAll(List<BsonDocument> found) {
		List<MutationBatch> result = new ArrayList<>();
		for (BsonDocument doc: found) {
			result.add(format.decodeMutationBatch(doc));
		}
		return result;
	}

	private static BsonArray strings(Set<String> values) {
		BsonArray result = new BsonArray();
		for (String value: values) {
			result.add(new BsonString(value));
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MongoMutationQueue.class);
}
