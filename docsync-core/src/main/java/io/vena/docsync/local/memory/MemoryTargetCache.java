package io.vena.docsync.local.memory;

import io.vena.docsync.core.Target;
import io.vena.docsync.local.ReferenceDelegate;
import io.vena.docsync.local.ReferenceSet;
import io.vena.docsync.local.TargetCache;
import io.vena.docsync.local.TargetData;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.SnapshotVersion;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;

final class MemoryTargetCache implements TargetCache {
	private final MemoryPersistence persistence;
	private final Map<Target, TargetData> targets = new HashMap<>();
	private final ReferenceSet references = new ReferenceSet();
	private int highestTargetId;
	private long highestSequenceNumber;
	private SnapshotVersion lastRemoteSnapshotVersion = SnapshotVersion.NONE;

	MemoryTargetCache(MemoryPersistence persistence) {
		this.persistence = persistence;
	}

	@Override
	public int getHighestTargetId() {
		return highestTargetId;
	}

	@Override
	public long getHighestListenSequenceNumber() {
		return highestSequenceNumber;
	}

	@Override
	public long getTargetCount() {
		return targets.size();
	}

	@Override
	public void forEachTarget(Consumer<TargetData> consumer) {
		targets.values().forEach(consumer);
	}

	@Override
	public SnapshotVersion getLastRemoteSnapshotVersion() {
		return lastRemoteSnapshotVersion;
	}

	@Override
	public void setLastRemoteSnapshotVersion(SnapshotVersion snapshotVersion) {
		this.lastRemoteSnapshotVersion = snapshotVersion;
	}

	@Override
	public void addTargetData(TargetData targetData) {
		if (targets.containsKey(targetData.target())) {
			throw new IllegalStateException("Target already cached: " + targetData.target());
		}
		updateTargetData(targetData);
	}

	@Override
	public void updateTargetData(TargetData targetData) {
		targets.put(targetData.target(), targetData);
		highestTargetId = Math.max(highestTargetId, targetData.targetId());
		highestSequenceNumber = Math.max(highestSequenceNumber, targetData.sequenceNumber());
	}

	@Override
	public void removeTargetData(TargetData targetData) {
		targets.remove(targetData.target());
		references.removeReferencesForId(targetData.targetId());
	}

	@Override
	public @Nullable TargetData getTargetData(Target target) {
		return targets.get(target);
	}

	@Override
	public void addMatchingKeys(Set<DocumentKey> keys, int targetId) {
		references.addReferences(keys, targetId);
		ReferenceDelegate referenceDelegate = persistence.getReferenceDelegate();
		for (DocumentKey key: keys) {
			referenceDelegate.addReference(key);
		}
	}

	@Override
	public void removeMatchingKeys(Set<DocumentKey> keys, int targetId) {
		references.removeReferences(keys, targetId);
		ReferenceDelegate referenceDelegate = persistence.getReferenceDelegate();
		for (DocumentKey key: keys) {
			referenceDelegate.removeReference(key);
		}
	}

	@Override
	public SortedSet<DocumentKey> getMatchingKeysForTargetId(int targetId) {
		return references.referencedKeysForId(targetId);
	}

	@Override
	public boolean containsKey(DocumentKey key) {
		return references.containsKey(key);
	}
}
