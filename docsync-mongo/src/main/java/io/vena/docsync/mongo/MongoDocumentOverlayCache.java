package io.vena.docsync.mongo;

import io.vena.docsync.auth.User;
import io.vena.docsync.local.DocumentOverlayCache;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.ResourcePath;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.Overlay;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.jetbrains.annotations.Nullable;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.gt;
import static com.mongodb.client.model.Filters.in;
import static com.mongodb.client.model.Sorts.ascending;

/**
 * One MongoDB document per overlay, identified by user and document key.
 */
final class MongoDocumentOverlayCache implements DocumentOverlayCache {
	private final TransactionalCollection collection;
	private final BsonFormat format;
	private final String uid;

	MongoDocumentOverlayCache(TransactionalCollection collection, BsonFormat format, User user) {
		this.collection = collection;
		this.format = format;
		this.uid = user.storageKey();
	}

	@Override
	public @Nullable Overlay getOverlay(DocumentKey key) {
		BsonDocument found = collection.findById(idFor(key));
		return found == null ? null : decode(found);
	}

	@Override
	public Map<DocumentKey, Overlay> getOverlays(SortedSet<DocumentKey> keys) {
		Map<DocumentKey, Overlay> result = new HashMap<>();
		if (keys.isEmpty()) {
			return result;
		}
		BsonArray ids = new BsonArray();
		for (DocumentKey key: keys) {
			ids.add(idFor(key));
		}
		putAll(result, collection.find(in("_id", ids)));
		return result;
	}

	@Override
	public void saveOverlays(int largestBatchId, Map<DocumentKey, Mutation> overlays) {
		for (Map.Entry<DocumentKey, Mutation> entry: overlays.entrySet()) {
			DocumentKey key = entry.getKey();
			collection.upsert(new BsonDocument()
				.append("_id", idFor(key))
				.append("uid", new BsonString(uid))
				.append("collectionPath", format.encodePath(key.getCollectionPath()))
				.append("collectionGroup", new BsonString(key.getCollectionGroup()))
				.append("largestBatchId", new BsonInt32(largestBatchId))
				.append("mutation", format.encodeMutation(entry.getValue())));
		}
	}

	@Override
	public void removeOverlaysForBatchId(int batchId) {
		collection.deleteMany(and(eq("uid", uid), eq("largestBatchId", batchId)));
	}

	@Override
	public Map<DocumentKey, Overlay> getOverlays(ResourcePath collectionPath, int sinceBatchId) {
		Map<DocumentKey, Overlay> result = new HashMap<>();
		putAll(result, collection.find(and(
			eq("uid", uid),
			eq("collectionPath", collectionPath.canonicalString()),
			gt("largestBatchId", sinceBatchId))));
		return result;
	}

	@Override
	public Map<DocumentKey, Overlay> getOverlays(String collectionGroup, int sinceBatchId, int count) {
		List<BsonDocument> found = collection.find(and(
				eq("uid", uid),
				eq("collectionGroup", collectionGroup),
				gt("largestBatchId", sinceBatchId)),
			ascending("largestBatchId"));
		Map<DocumentKey, Overlay> result = new HashMap<>();
		int currentBatchId = Integer.MIN_VALUE;
		for (BsonDocument doc: found) {
			Overlay overlay = decode(doc);
			if (overlay.largestBatchId() != currentBatchId && result.size() >= count) {
				break;
			}
			currentBatchId = overlay.largestBatchId();
			result.put(overlay.key(), overlay);
		}
		return result;
	}

	private BsonDocument idFor(DocumentKey key) {
		return new BsonDocument()
			.append("uid", new BsonString(uid))
			.append("key", format.encodeKey(key));
	}

	private void putAll(Map<DocumentKey, Overlay> result, List<BsonDocument> found) {
		for (BsonDocument doc: found) {
			Overlay overlay = decode(doc);
			result.put(overlay.key(), overlay);
		}
	}

	private Overlay decode(BsonDocument doc) {
		return new Overlay(doc.getInt32("largestBatchId").getValue(), format.decodeMutation(doc.getDocument("mutation")));
	}
}
