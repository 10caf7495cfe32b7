package io.vena.docsync.remote;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.remote.wire.BloomFilterMessage;
import io.vena.docsync.util.ByteString;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A decoded message from the watch stream.
 */
public abstract class WatchChange {
	private WatchChange() { }

	/**
	 * A document's membership in some targets changed, and possibly its contents.
	 */
	public static final class DocumentChange extends WatchChange {
		private final List<Integer> updatedTargetIds;
		private final List<Integer> removedTargetIds;
		private final DocumentKey documentKey;
		private final @Nullable MutableDocument newDocument;

		/**
		 * @param newDocument the new state of the document, or null if only its target membership changed
		 */
		public DocumentChange(List<Integer> updatedTargetIds, List<Integer> removedTargetIds, DocumentKey documentKey, @Nullable MutableDocument newDocument) {
			this.updatedTargetIds = List.copyOf(updatedTargetIds);
			this.removedTargetIds = List.copyOf(removedTargetIds);
			this.documentKey = documentKey;
			this.newDocument = newDocument;
		}

		public List<Integer> updatedTargetIds() { return updatedTargetIds; }
		public List<Integer> removedTargetIds() { return removedTargetIds; }
		public DocumentKey documentKey() { return documentKey; }
		public @Nullable MutableDocument newDocument() { return newDocument; }

		@Override
		public String toString() {
			return "DocumentChange{updated=" + updatedTargetIds + ", removed=" + removedTargetIds
				+ ", key=" + documentKey + ", newDocument=" + newDocument + "}";
		}
	}

	/**
	 * The backend's count of the documents matching a target.
	 */
	public static final class ExistenceFilterWatchChange extends WatchChange {
		private final int targetId;
		private final int count;
		private final @Nullable BloomFilterMessage bloomFilter;

		public ExistenceFilterWatchChange(int targetId, int count, @Nullable BloomFilterMessage bloomFilter) {
			this.targetId = targetId;
			this.count = count;
			this.bloomFilter = bloomFilter;
		}

		public int targetId() { return targetId; }
		public int count() { return count; }
		public @Nullable BloomFilterMessage bloomFilter() { return bloomFilter; }

		@Override
		public String toString() {
			return "ExistenceFilterWatchChange{targetId=" + targetId + ", count=" + count
				+ ", bloomFilter=" + (bloomFilter != null) + "}";
		}
	}

	public enum WatchTargetChangeType {
		NO_CHANGE,
		ADDED,
		REMOVED,
		CURRENT,
		RESET,
	}

	/**
	 * A change in the state of some targets.
	 */
	public static final class WatchTargetChange extends WatchChange {
		private final WatchTargetChangeType changeType;
		private final List<Integer> targetIds;
		private final ByteString resumeToken;
		private final @Nullable Status cause;

		/**
		 * @param targetIds empty means every target
		 * @param cause set when targets were removed because of an error
		 */
		public WatchTargetChange(WatchTargetChangeType changeType, List<Integer> targetIds, ByteString resumeToken, @Nullable Status cause) {
			if (cause != null && changeType != WatchTargetChangeType.REMOVED) {
				throw new IllegalArgumentException("Cause set for target change of type " + changeType);
			}
			this.changeType = changeType;
			this.targetIds = List.copyOf(targetIds);
			this.resumeToken = resumeToken;
			this.cause = cause;
		}

		public WatchTargetChange(WatchTargetChangeType changeType, List<Integer> targetIds) {
			this(changeType, targetIds, ByteString.EMPTY, null);
		}

		public WatchTargetChangeType changeType() { return changeType; }
		public List<Integer> targetIds() { return targetIds; }
		public ByteString resumeToken() { return resumeToken; }
		public @Nullable Status cause() { return cause; }

		@Override
		public String toString() {
			return "WatchTargetChange{" + changeType + ", targetIds=" + targetIds + ", cause=" + cause + "}";
		}
	}
}
