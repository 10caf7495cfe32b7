package io.vena.docsync.remote;

import io.vena.docsync.local.TargetData;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.remote.WatchChange.DocumentChange;
import io.vena.docsync.remote.WatchChange.ExistenceFilterWatchChange;
import io.vena.docsync.remote.WatchChange.WatchTargetChange;
import io.vena.docsync.remote.WatchChange.WatchTargetChangeType;
import io.vena.docsync.remote.wire.ListenRequest;
import io.vena.docsync.remote.wire.ListenRequest.AddTarget;
import io.vena.docsync.remote.wire.ListenResponse;
import io.vena.docsync.util.AsyncQueue.TimerId;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * The listen stream: requests add and remove targets, and responses report changes to them.
 */
public class WatchStream extends AbstractStream<ListenRequest, ListenResponse, WatchStream.Callback> {
	public interface Callback extends AbstractStream.StreamCallback {
		/**
		 * @param snapshotVersion the version at which every target is consistent,
		 *                        or {@link SnapshotVersion#NONE} if this change does not complete a snapshot
		 */
		void onWatchChange(SnapshotVersion snapshotVersion, WatchChange watchChange);
	}

	WatchStream(Datastore datastore, Callback listener) {
		super(datastore, "Listen", TimerId.LISTEN_STREAM_CONNECTION_BACKOFF, TimerId.LISTEN_STREAM_IDLE, listener);
	}

	public void watch(TargetData targetData) {
		if (!isOpen()) {
			throw new IllegalStateException("Watching on a closed stream");
		}
		SnapshotVersion readTime = null;
		if (targetData.resumeToken().isEmpty() && targetData.snapshotVersion().compareTo(SnapshotVersion.NONE) > 0) {
			readTime = targetData.snapshotVersion();
		}
		writeRequest(ListenRequest.add(new AddTarget(
			targetData.targetId(),
			targetData.target(),
			targetData.resumeToken(),
			readTime,
			targetData.expectedCount(),
			purposeLabel(targetData)
		)));
	}

	public void unwatch(int targetId) {
		if (!isOpen()) {
			throw new IllegalStateException("Unwatching on a closed stream");
		}
		writeRequest(ListenRequest.remove(targetId));
	}

	private static @Nullable String purposeLabel(TargetData targetData) {
		switch (targetData.purpose()) {
			case LISTEN:
				return null;
			case EXISTENCE_FILTER_MISMATCH:
				return "existence-filter-mismatch";
			case EXISTENCE_FILTER_MISMATCH_BLOOM:
				return "existence-filter-mismatch-bloom";
			case LIMBO_RESOLUTION:
				return "limbo-document";
			default:
				throw new IllegalArgumentException("Unknown query purpose: " + targetData.purpose());
		}
	}

	@Override
	protected ConnectionStream<ListenRequest> startCall(CallCredentials credentials, StreamObserver<ListenResponse> observer) {
		return datastore.connection().openListenStream(credentials, observer);
	}

	@Override
	protected void onNext(ListenResponse response) {
		// A response means the connection works.
		backoff.reset();
		listener.onWatchChange(decodeVersion(response), decodeWatchChange(response));
	}

	static WatchChange decodeWatchChange(ListenResponse response) {
		if (response instanceof ListenResponse.TargetChange) {
			ListenResponse.TargetChange targetChange = (ListenResponse.TargetChange) response;
			Status cause = null;
			WatchTargetChangeType changeType;
			switch (targetChange.type()) {
				case NO_CHANGE:
					changeType = WatchTargetChangeType.NO_CHANGE;
					break;
				case ADD:
					changeType = WatchTargetChangeType.ADDED;
					break;
				case REMOVE:
					changeType = WatchTargetChangeType.REMOVED;
					if (targetChange.causeCode() != null) {
						cause = Status.of(targetChange.causeCode(), targetChange.causeMessage());
					}
					break;
				case CURRENT:
					changeType = WatchTargetChangeType.CURRENT;
					break;
				case RESET:
					changeType = WatchTargetChangeType.RESET;
					break;
				default:
					throw new IllegalArgumentException("Unknown target change type: " + targetChange.type());
			}
			return new WatchTargetChange(changeType, targetChange.targetIds(), targetChange.resumeToken(), cause);
		} else if (response instanceof ListenResponse.DocumentChange) {
			ListenResponse.DocumentChange change = (ListenResponse.DocumentChange) response;
			MutableDocument document = MutableDocument.newFoundDocument(change.key(), change.updateTime(), change.fields());
			return new DocumentChange(change.targetIds(), change.removedTargetIds(), change.key(), document);
		} else if (response instanceof ListenResponse.DocumentDelete) {
			ListenResponse.DocumentDelete delete = (ListenResponse.DocumentDelete) response;
			MutableDocument document = MutableDocument.newNoDocument(delete.key(), delete.readTime());
			return new DocumentChange(List.of(), delete.removedTargetIds(), delete.key(), document);
		} else if (response instanceof ListenResponse.DocumentRemove) {
			ListenResponse.DocumentRemove remove = (ListenResponse.DocumentRemove) response;
			return new DocumentChange(List.of(), remove.removedTargetIds(), remove.key(), null);
		} else if (response instanceof ListenResponse.Filter) {
			ListenResponse.Filter filter = (ListenResponse.Filter) response;
			return new ExistenceFilterWatchChange(filter.targetId(), filter.count(), filter.unchangedNames());
		} else {
			throw new IllegalArgumentException("Unknown listen response: " + response);
		}
	}

	/**
	 * Only a target change for every target carries a consistent snapshot version.
	 */
	static SnapshotVersion decodeVersion(ListenResponse response) {
		if (!(response instanceof ListenResponse.TargetChange)) {
			return SnapshotVersion.NONE;
		}
		ListenResponse.TargetChange targetChange = (ListenResponse.TargetChange) response;
		if (!targetChange.targetIds().isEmpty() || targetChange.readTime() == null) {
			return SnapshotVersion.NONE;
		}
		return targetChange.readTime();
	}
}
