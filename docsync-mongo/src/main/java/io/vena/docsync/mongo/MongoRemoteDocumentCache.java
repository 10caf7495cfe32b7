package io.vena.docsync.mongo;

import io.vena.docsync.core.Query;
import io.vena.docsync.local.IndexManager;
import io.vena.docsync.local.RemoteDocumentCache;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.IndexOffset;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.SnapshotVersion;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonInt64;
import org.bson.BsonString;
import org.jetbrains.annotations.Nullable;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.gte;
import static com.mongodb.client.model.Filters.in;
import static io.vena.docsync.mongo.BsonFormat.RemoteDocumentFields.collectionGroup;
import static io.vena.docsync.mongo.BsonFormat.RemoteDocumentFields.collectionPath;
import static io.vena.docsync.mongo.BsonFormat.RemoteDocumentFields.document;
import static io.vena.docsync.mongo.BsonFormat.RemoteDocumentFields.readTimeSeconds;
import static java.util.Objects.requireNonNull;

/**
 * One MongoDB document per cached document, keyed by its path.
 * The collection path and group are stored alongside so queries can select candidates;
 * filters and offsets are then applied in memory.
 */
final class MongoRemoteDocumentCache implements RemoteDocumentCache {
	private final TransactionalCollection collection;
	private final BsonFormat format;
	private @Nullable IndexManager indexManager;

	MongoRemoteDocumentCache(TransactionalCollection collection, BsonFormat format) {
		this.collection = collection;
		this.format = format;
	}

	@Override
	public void setIndexManager(IndexManager indexManager) {
		this.indexManager = indexManager;
	}

	@Override
	public void add(MutableDocument doc, SnapshotVersion readTime) {
		if (SnapshotVersion.NONE.equals(readTime)) {
			throw new IllegalArgumentException("Cannot add a document when the remote version is zero");
		}
		MutableDocument stored = doc.mutableCopy().setReadTime(readTime);
		collection.upsert(new BsonDocument()
			.append("_id", format.encodeKey(doc.key()))
			.append(collectionPath.name(), format.encodePath(doc.key().getCollectionPath()))
			.append(collectionGroup.name(), new BsonString(doc.key().getCollectionGroup()))
			.append(readTimeSeconds.name(), new BsonInt64(readTime.timestamp().getEpochSecond()))
			.append(document.name(), format.encodeDocument(stored)));
		requireNonNull(indexManager, "indexManager").addToCollectionParentIndex(doc.key().getCollectionPath());
	}

	@Override
	public void removeAll(Collection<DocumentKey> keys) {
		if (keys.isEmpty()) {
			return;
		}
		collection.deleteMany(in("_id", encodeKeys(keys)));
	}

	@Override
	public MutableDocument get(DocumentKey key) {
		BsonDocument found = collection.findById(format.encodeKey(key));
		return found == null ? MutableDocument.newInvalidDocument(key) : decode(found);
	}

	@Override
	public Map<DocumentKey, MutableDocument> getAll(Iterable<DocumentKey> keys) {
		List<DocumentKey> keyList = new ArrayList<>();
		Map<DocumentKey, MutableDocument> result = new HashMap<>();
		for (DocumentKey key: keys) {
			keyList.add(key);
			result.put(key, MutableDocument.newInvalidDocument(key));
		}
		if (!keyList.isEmpty()) {
			for (BsonDocument found: collection.find(in("_id", encodeKeys(keyList)))) {
				MutableDocument doc = decode(found);
				result.put(doc.key(), doc);
			}
		}
		return result;
	}

	@Override
	public Map<DocumentKey, MutableDocument> getAll(String group, IndexOffset offset, int limit) {
		List<MutableDocument> candidates = new ArrayList<>();
		long offsetSeconds = offset.readTime().timestamp().getEpochSecond();
		for (BsonDocument found: collection.find(and(eq(collectionGroup.name(), group), gte(readTimeSeconds.name(), offsetSeconds)))) {
			MutableDocument doc = decode(found);
			if (IndexOffset.fromDocument(doc).compareTo(offset) > 0) {
				candidates.add(doc);
			}
		}
		candidates.sort(IndexOffset.DOCUMENT_COMPARATOR);
		Map<DocumentKey, MutableDocument> result = new HashMap<>();
		for (MutableDocument doc: candidates) {
			if (result.size() >= limit) {
				break;
			}
			result.put(doc.key(), doc);
		}
		return result;
	}

	@Override
	public Map<DocumentKey, MutableDocument> getDocumentsMatchingQuery(Query query, IndexOffset offset, Set<DocumentKey> mutatedKeys) {
		Map<DocumentKey, MutableDocument> result = new HashMap<>();
		long offsetSeconds = offset.readTime().timestamp().getEpochSecond();
		for (BsonDocument found: collection.find(and(eq(collectionPath.name(), format.encodePath(query.path())), gte(readTimeSeconds.name(), offsetSeconds)))) {
			MutableDocument doc = decode(found);
			if (IndexOffset.fromDocument(doc).compareTo(offset) <= 0) {
				continue;
			}
			if (!mutatedKeys.contains(doc.key()) && !query.matches(doc)) {
				continue;
			}
			result.put(doc.key(), doc);
		}
		return result;
	}

	private MutableDocument decode(BsonDocument found) {
		return format.decodeDocument(format.decodeKey(found.get("_id")), found.getDocument(document.name()));
	}

	private BsonArray encodeKeys(Collection<DocumentKey> keys) {
		BsonArray result = new BsonArray();
		for (DocumentKey key: keys) {
			result.add(format.encodeKey(key));
		}
		return result;
	}
}
