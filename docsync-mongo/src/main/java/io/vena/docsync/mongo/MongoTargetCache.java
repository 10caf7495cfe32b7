package io.vena.docsync.mongo;

import io.vena.docsync.core.Target;
import io.vena.docsync.local.ReferenceDelegate;
import io.vena.docsync.local.TargetCache;
import io.vena.docsync.local.TargetData;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.SnapshotVersion;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Consumer;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonString;
import org.jetbrains.annotations.Nullable;

import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Sorts.ascending;

/**
 * Targets live in one collection keyed by target id, and their matching keys in another,
 * one MongoDB document per (target, key) pair.
 * The highest ids and the last remote snapshot version are kept in a single metadata document,
 * so they survive the removal of the targets that set them.
 */
final class MongoTargetCache implements TargetCache {
	private final MongoPersistence persistence;
	private final TransactionalCollection targets;
	private final TransactionalCollection targetDocuments;
	private final TransactionalCollection metadata;
	private final BsonFormat format;

	static final String GLOBALS_ID = "targetGlobals";

	MongoTargetCache(MongoPersistence persistence, TransactionalCollection targets, TransactionalCollection targetDocuments, TransactionalCollection metadata, BsonFormat format) {
		this.persistence = persistence;
		this.targets = targets;
		this.targetDocuments = targetDocuments;
		this.metadata = metadata;
		this.format = format;
	}

	@Override
	public int getHighestTargetId() {
		return globals().getInt32("highestTargetId").getValue();
	}

	@Override
	public long getHighestListenSequenceNumber() {
		return globals().getInt64("highestListenSequenceNumber").getValue();
	}

	@Override
	public long getTargetCount() {
		return targets.count(new BsonDocument());
	}

	@Override
	public void forEachTarget(Consumer<TargetData> consumer) {
		for (BsonDocument doc: targets.find(new BsonDocument(), ascending("_id"))) {
			consumer.accept(format.decodeTargetData(doc));
		}
	}

	@Override
	public SnapshotVersion getLastRemoteSnapshotVersion() {
		return format.decodeVersion(globals().getDocument("lastRemoteSnapshotVersion"));
	}

	@Override
	public void setLastRemoteSnapshotVersion(SnapshotVersion snapshotVersion) {
		BsonDocument globals = globals();
		globals.put("lastRemoteSnapshotVersion", format.encodeVersion(snapshotVersion));
		metadata.upsert(globals);
	}

	@Override
	public void addTargetData(TargetData targetData) {
		if (targets.findById(new BsonInt32(targetData.targetId())) != null || getTargetData(targetData.target()) != null) {
			throw new IllegalStateException("Target already cached: " + targetData.target());
		}
		updateTargetData(targetData);
	}

	@Override
	public void updateTargetData(TargetData targetData) {
		targets.upsert(format.encodeTargetData(targetData));
		BsonDocument globals = globals();
		if (targetData.targetId() > globals.getInt32("highestTargetId").getValue()) {
			globals.put("highestTargetId", new BsonInt32(targetData.targetId()));
		}
		if (targetData.sequenceNumber() > globals.getInt64("highestListenSequenceNumber").getValue()) {
			globals.put("highestListenSequenceNumber", new BsonInt64(targetData.sequenceNumber()));
		}
		metadata.upsert(globals);
	}

	@Override
	public void removeTargetData(TargetData targetData) {
		targets.deleteMany(eq("_id", targetData.targetId()));
		targetDocuments.deleteMany(eq("targetId", targetData.targetId()));
	}

	@Override
	public @Nullable TargetData getTargetData(Target target) {
		for (BsonDocument doc: targets.find(eq("canonicalId", target.canonicalId()))) {
			TargetData candidate = format.decodeTargetData(doc);
			if (candidate.target().equals(target)) {
				return candidate;
			}
		}
		return null;
	}

	@Override
	public void addMatchingKeys(Set<DocumentKey> keys, int targetId) {
		ReferenceDelegate referenceDelegate = persistence.getReferenceDelegate();
		for (DocumentKey key: keys) {
			targetDocuments.upsert(new BsonDocument()
				.append("_id", idFor(key, targetId))
				.append("targetId", new BsonInt32(targetId))
				.append("key", format.encodeKey(key)));
			referenceDelegate.addReference(key);
		}
	}

	@Override
	public void removeMatchingKeys(Set<DocumentKey> keys, int targetId) {
		ReferenceDelegate referenceDelegate = persistence.getReferenceDelegate();
		for (DocumentKey key: keys) {
			targetDocuments.deleteMany(eq("_id", idFor(key, targetId)));
			referenceDelegate.removeReference(key);
		}
	}

	@Override
	public SortedSet<DocumentKey> getMatchingKeysForTargetId(int targetId) {
		SortedSet<DocumentKey> result = new TreeSet<>();
		for (BsonDocument doc: targetDocuments.find(eq("targetId", targetId))) {
			result.add(format.decodeKey(doc.get("key")));
		}
		return result;
	}

	@Override
	public boolean containsKey(DocumentKey key) {
		return targetDocuments.exists(eq("key", format.encodeKey(key)));
	}

	private BsonDocument idFor(DocumentKey key, int targetId) {
		return new BsonDocument()
			.append("targetId", new BsonInt32(targetId))
			.append("key", format.encodeKey(key));
	}

	private BsonDocument globals() {
		BsonDocument found = metadata.findById(new BsonString(GLOBALS_ID));
		if (found != null) {
			return found;
		}
		return new BsonDocument()
			.append("_id", new BsonString(GLOBALS_ID))
			.append("highestTargetId", new BsonInt32(0))
			.append("highestListenSequenceNumber", new BsonInt64(0))
			.append("lastRemoteSnapshotVersion", format.encodeVersion(SnapshotVersion.NONE));
	}
}
