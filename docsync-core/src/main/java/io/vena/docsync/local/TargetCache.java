package io.vena.docsync.local;

import io.vena.docsync.core.Target;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.SnapshotVersion;
import java.util.Set;
import java.util.SortedSet;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;

/**
 * Targets the client has listened to, and the keys of the documents
 * the backend last reported as matching each one.
 */
public interface TargetCache {
	int getHighestTargetId();

	long getHighestListenSequenceNumber();

	long getTargetCount();

	void forEachTarget(Consumer<TargetData> consumer);

	/**
	 * @return the snapshot version of the last remote event applied, or {@link SnapshotVersion#NONE}.
	 */
	SnapshotVersion getLastRemoteSnapshotVersion();

	void setLastRemoteSnapshotVersion(SnapshotVersion snapshotVersion);

	/**
	 * @throws IllegalStateException if the target is already present
	 */
	void addTargetData(TargetData targetData);

	void updateTargetData(TargetData targetData);

	/**
	 * Removes the target along with its matching keys.
	 */
	void removeTargetData(TargetData targetData);

	@Nullable TargetData getTargetData(Target target);

	void addMatchingKeys(Set<DocumentKey> keys, int targetId);

	void removeMatchingKeys(Set<DocumentKey> keys, int targetId);

	SortedSet<DocumentKey> getMatchingKeysForTargetId(int targetId);

	boolean containsKey(DocumentKey key);
}
