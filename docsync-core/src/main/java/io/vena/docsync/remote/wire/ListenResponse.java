package io.vena.docsync.remote.wire;

import io.vena.docsync.exceptions.DocSyncException;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.value.ObjectValue;
import io.vena.docsync.util.ByteString;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A message on the listen stream. Each implementation is one of the backend's response kinds.
 */
public interface ListenResponse {
	enum TargetChangeType {
		NO_CHANGE,
		ADD,
		REMOVE,
		CURRENT,
		RESET,
	}

	/**
	 * @param targetIds the affected targets; empty means all of them
	 * @param readTime set, with no target ids, when all targets are consistent as of that time
	 * @param causeCode set when a target was removed because of an error
	 */
	record TargetChange(
		TargetChangeType type,
		List<Integer> targetIds,
		ByteString resumeToken,
		@Nullable SnapshotVersion readTime,
		@Nullable DocSyncException.Code causeCode,
		@Nullable String causeMessage
	) implements ListenResponse {
		public static TargetChange of(TargetChangeType type, List<Integer> targetIds, ByteString resumeToken, @Nullable SnapshotVersion readTime) {
			return new TargetChange(type, targetIds, resumeToken, readTime, null, null);
		}

		/**
		 * A global snapshot: every target is consistent as of <code>readTime</code>.
		 */
		public static TargetChange snapshot(SnapshotVersion readTime, ByteString resumeToken) {
			return new TargetChange(TargetChangeType.NO_CHANGE, List.of(), resumeToken, readTime, null, null);
		}

		public static TargetChange rejected(List<Integer> targetIds, DocSyncException.Code code, String message) {
			return new TargetChange(TargetChangeType.REMOVE, targetIds, ByteString.EMPTY, null, code, message);
		}
	}

	/**
	 * A document was created or updated.
	 */
	record DocumentChange(
		DocumentKey key,
		SnapshotVersion updateTime,
		ObjectValue fields,
		List<Integer> targetIds,
		List<Integer> removedTargetIds
	) implements ListenResponse { }

	/**
	 * A document was deleted.
	 */
	record DocumentDelete(DocumentKey key, SnapshotVersion readTime, List<Integer> removedTargetIds) implements ListenResponse { }

	/**
	 * A document stopped matching some targets, for reasons other than deletion.
	 */
	record DocumentRemove(DocumentKey key, SnapshotVersion readTime, List<Integer> removedTargetIds) implements ListenResponse { }

	/**
	 * The number of documents matching a target, for the client to check against what it has.
	 */
	record Filter(int targetId, int count, @Nullable BloomFilterMessage unchangedNames) implements ListenResponse { }
}
