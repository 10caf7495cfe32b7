package io.vena.docsync.mongo;

import io.vena.docsync.core.Target;
import io.vena.docsync.local.IndexEntry;
import io.vena.docsync.local.IndexManager;
import io.vena.docsync.local.TargetIndexMatcher;
import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldIndex;
import io.vena.docsync.model.IndexOffset;
import io.vena.docsync.model.ResourcePath;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Sorts.ascending;
import static com.mongodb.client.model.Sorts.descending;

/**
 * Keeps the collection parent index, the field index definitions, and their entries in MongoDB.
 * Index entries are matched in memory with {@link TargetIndexMatcher}, like the in-memory index manager does;
 * MongoDB only narrows the candidates to one index.
 */
final class MongoIndexManager implements IndexManager {
	private final TransactionalCollection collectionParents;
	private final TransactionalCollection fieldIndexes;
	private final TransactionalCollection indexEntries;
	private final BsonFormat format;

	MongoIndexManager(TransactionalCollection collectionParents, TransactionalCollection fieldIndexes, TransactionalCollection indexEntries, BsonFormat format) {
		this.collectionParents = collectionParents;
		this.fieldIndexes = fieldIndexes;
		this.indexEntries = indexEntries;
		this.format = format;
	}

	@Override
	public void start() {
	}

	@Override
	public void addToCollectionParentIndex(ResourcePath collectionPath) {
		String collectionId = collectionPath.getLastSegment();
		ResourcePath parentPath = collectionPath.popLast();
		collectionParents.upsert(new BsonDocument()
			.append("_id", new BsonDocument()
				.append("collectionId", new BsonString(collectionId))
				.append("parent", format.encodePath(parentPath)))
			.append("collectionId", new BsonString(collectionId))
			.append("parent", format.encodePath(parentPath)));
	}

	@Override
	public List<ResourcePath> getCollectionParents(String collectionId) {
		TreeSet<ResourcePath> result = new TreeSet<>();
		for (BsonDocument doc: collectionParents.find(eq("collectionId", collectionId))) {
			result.add(format.decodePath(doc.get("parent")));
		}
		return new ArrayList<>(result);
	}

	@Override
	public void addFieldIndex(FieldIndex index) {
		BsonDocument highest = fieldIndexes.findFirst(new BsonDocument(), descending("_id"));
		int nextIndexId = highest == null ? 1 : highest.getInt32("_id").getValue() + 1;
		FieldIndex stored = index.withIndexId(nextIndexId);
		fieldIndexes.insert(format.encodeFieldIndex(stored));
		LOGGER.debug("Added field index {}", stored);
	}

	@Override
	public void deleteFieldIndex(FieldIndex index) {
		fieldIndexes.deleteMany(eq("_id", index.indexId()));
		indexEntries.deleteMany(eq("indexId", index.indexId()));
		LOGGER.debug("Deleted field index {}", index);
	}

	@Override
	public Collection<FieldIndex> getFieldIndexes(String collectionGroup) {
		return decodeAll(fieldIndexes.find(eq("collectionGroup", collectionGroup), ascending("_id")));
	}

	@Override
	public Collection<FieldIndex> getFieldIndexes() {
		return decodeAll(fieldIndexes.find(new BsonDocument(), ascending("collectionGroup", "_id")));
	}

	@Override
	public @Nullable String getNextCollectionGroupToUpdate() {
		String result = null;
		long lowestSequenceNumber = Long.MAX_VALUE;
		for (FieldIndex index: getFieldIndexes()) {
			if (index.indexState().sequenceNumber() < lowestSequenceNumber) {
				lowestSequenceNumber = index.indexState().sequenceNumber();
				result = index.collectionGroup();
			}
		}
		return result;
	}

	@Override
	public void updateCollectionGroup(String collectionGroup, IndexOffset offset) {
		BsonDocument highest = fieldIndexes.findFirst(new BsonDocument(), descending("sequenceNumber"));
		long sequenceNumber = highest == null ? 1 : highest.getInt64("sequenceNumber").getValue() + 1;
		for (FieldIndex index: getFieldIndexes(collectionGroup)) {
			fieldIndexes.upsert(format.encodeFieldIndex(index.withIndexState(new FieldIndex.IndexState(sequenceNumber, offset))));
		}
	}

	@Override
	public void updateIndexEntries(Map<DocumentKey, ? extends Document> documents) {
		for (Map.Entry<DocumentKey, ? extends Document> entry: documents.entrySet()) {
			DocumentKey key = entry.getKey();
			for (FieldIndex index: getFieldIndexes(key.getCollectionGroup())) {
				List<IndexEntry> newEntries = TargetIndexMatcher.computeEntries(index, entry.getValue());
				BsonDocument id = new BsonDocument()
					.append("indexId", new BsonInt32(index.indexId()))
					.append("key", format.encodeKey(key));
				if (newEntries.isEmpty()) {
					indexEntries.deleteMany(eq("_id", id));
				} else {
					BsonArray encoded = new BsonArray();
					for (IndexEntry indexEntry: newEntries) {
						encoded.add(format.encodeIndexEntry(indexEntry));
					}
					indexEntries.upsert(new BsonDocument()
						.append("_id", id)
						.append("indexId", new BsonInt32(index.indexId()))
						.append("key", format.encodeKey(key))
						.append("entries", encoded));
				}
			}
		}
	}

	@Override
	public IndexType getIndexType(Target target) {
		TargetIndexMatcher matcher = new TargetIndexMatcher(target);
		FieldIndex index = matcher.selectIndex(getFieldIndexes(target.collectionGroupForIndex()));
		return index == null ? IndexType.NONE : matcher.coverage(index);
	}

	@Override
	public @Nullable List<DocumentKey> getDocumentsMatchingTarget(Target target) {
		TargetIndexMatcher matcher = new TargetIndexMatcher(target);
		FieldIndex index = matcher.selectIndex(getFieldIndexes(target.collectionGroupForIndex()));
		if (index == null) {
			return null;
		}
		TreeMap<DocumentKey, List<IndexEntry>> entriesByKey = new TreeMap<>();
		for (BsonDocument doc: indexEntries.find(eq("indexId", index.indexId()))) {
			DocumentKey key = format.decodeKey(doc.get("key"));
			List<IndexEntry> entries = new ArrayList<>();
			for (BsonValue encoded: doc.getArray("entries")) {
				entries.add(format.decodeIndexEntry(index.indexId(), key, encoded.asDocument()));
			}
			entriesByKey.put(key, entries);
		}
		List<DocumentKey> result = new ArrayList<>();
		for (Map.Entry<DocumentKey, List<IndexEntry>> entry: entriesByKey.entrySet()) {
			if (!isInScope(target, entry.getKey())) {
				continue;
			}
			for (IndexEntry indexEntry: entry.getValue()) {
				if (matcher.entryMatches(index, indexEntry)) {
					result.add(entry.getKey());
					break;
				}
			}
		}
		LOGGER.trace("Index {} matched {} documents for {}", index.indexId(), result.size(), target);
		return result;
	}

	private static boolean isInScope(Target target, DocumentKey key) {
		if (target.collectionGroup() != null) {
			return target.path().isPrefixOf(key.path());
		} else {
			return target.path().isImmediateParentOf(key.path());
		}
	}

	@Override
	public IndexOffset getMinOffset(Target target) {
		TargetIndexMatcher matcher = new TargetIndexMatcher(target);
		FieldIndex index = matcher.selectIndex(getFieldIndexes(target.collectionGroupForIndex()));
		return index == null ? IndexOffset.NONE : index.indexState().offset();
	}

	@Override
	public IndexOffset getMinOffset(String collectionGroup) {
		IndexOffset result = null;
		for (FieldIndex index: getFieldIndexes(collectionGroup)) {
			IndexOffset offset = index.indexState().offset();
			if (result == null || offset.compareTo(result) < 0) {
				result = offset;
			}
		}
		return result == null ? IndexOffset.NONE : result;
	}

	private List<FieldIndex> decodeAll(List<BsonDocument> found) {
		List<FieldIndex> result = new ArrayList<>();
		for (BsonDocument doc: found) {
			result.add(format.decodeFieldIndex(doc));
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MongoIndexManager.class);
}
