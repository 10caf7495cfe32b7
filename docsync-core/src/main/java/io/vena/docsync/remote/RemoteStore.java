package io.vena.docsync.remote;

import io.vena.docsync.core.OnlineState;
import io.vena.docsync.exceptions.LostPrimaryLeaseException;
import io.vena.docsync.local.LocalStore;
import io.vena.docsync.local.QueryPurpose;
import io.vena.docsync.local.TargetData;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.mutation.MutationBatch;
import io.vena.docsync.model.mutation.MutationBatchResult;
import io.vena.docsync.model.mutation.MutationResult;
import io.vena.docsync.remote.WatchChange.DocumentChange;
import io.vena.docsync.remote.WatchChange.ExistenceFilterWatchChange;
import io.vena.docsync.remote.WatchChange.WatchTargetChange;
import io.vena.docsync.remote.WatchChange.WatchTargetChangeType;
import io.vena.docsync.util.AsyncQueue;
import io.vena.docsync.util.ByteString;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the watch and write streams: starts them when there is something to listen to or
 * write, restarts them after errors, and reports what they deliver to a {@link RemoteStoreCallback}.
 *
 * <p>
 * All methods must be called on the async queue.
 */
public final class RemoteStore implements WatchChangeAggregator.TargetMetadataProvider {
	/**
	 * Implemented by the sync engine.
	 */
	public interface RemoteStoreCallback {
		void handleRemoteEvent(RemoteEvent remoteEvent);

		/**
		 * The backend refused to listen to a target, for example for lack of permission.
		 */
		void handleRejectedListen(int targetId, Status error);

		void handleSuccessfulWrite(MutationBatchResult successfulWrite);

		/**
		 * The backend refused a batch permanently.
		 */
		void handleRejectedWrite(int batchId, Status error);

		void handleOnlineStateChange(OnlineState onlineState);

		/**
		 * @return the keys matching the target as of the last remote event, as seen by the views
		 */
		Set<DocumentKey> getRemoteKeysForTarget(int targetId);
	}

	private final RemoteStoreCallback remoteStoreCallback;
	private final LocalStore localStore;
	private final Datastore datastore;
	private final AsyncQueue asyncQueue;
	private final ExistenceFilterMismatchListener mismatchListener;
	private final int maxPendingWrites;

	/**
	 * Every target being listened to, whether or not the watch stream is open.
	 * Resume tokens are kept up to date for re-listening after reconnects.
	 */
	private final Map<Integer, TargetData> listenTargets = new HashMap<>();

	private final OnlineStateTracker onlineStateTracker;
	private final WatchStream watchStream;
	private final WriteStream writeStream;

	private boolean networkEnabled = false;

	/**
	 * A client sharing durable persistence with others only uses the network while it holds the primary lease.
	 */
	private boolean primary = true;

	/**
	 * Exists only while the watch stream is started.
	 */
	private @Nullable WatchChangeAggregator watchChangeAggregator;

	/**
	 * Batches sent, or about to be sent, on the write stream, in batch id order.
	 * Responses acknowledge them from the head.
	 */
	private final Deque<MutationBatch> writePipeline = new ArrayDeque<>();

	public RemoteStore(RemoteStoreCallback remoteStoreCallback, LocalStore localStore, Datastore datastore, ExistenceFilterMismatchListener mismatchListener) {
		this.remoteStoreCallback = remoteStoreCallback;
		this.localStore = localStore;
		this.datastore = datastore;
		this.asyncQueue = datastore.asyncQueue();
		this.mismatchListener = mismatchListener;
		this.maxPendingWrites = datastore.settings().maxPendingWrites();

		onlineStateTracker = new OnlineStateTracker(asyncQueue,
			datastore.settings().maxWatchStreamFailures(),
			datastore.settings().onlineStateTimeoutMS(),
			remoteStoreCallback::handleOnlineStateChange);

		watchStream = datastore.createWatchStream(new WatchStream.Callback() {
			@Override
			public void onOpen() {
				handleWatchStreamOpen();
			}

			@Override
			public void onWatchChange(SnapshotVersion snapshotVersion, WatchChange watchChange) {
				handleWatchChange(snapshotVersion, watchChange);
			}

			@Override
			public void onClose(Status status) {
				handleWatchStreamClose(status);
			}
		});

		writeStream = datastore.createWriteStream(new WriteStream.Callback() {
			@Override
			public void onOpen() {
				handleWriteStreamOpen();
			}

			@Override
			public void onHandshakeComplete() {
				handleWriteStreamHandshakeComplete();
			}

			@Override
			public void onWriteResponse(SnapshotVersion commitVersion, List<MutationResult> results) {
				handleWriteStreamMutationResults(commitVersion, results);
			}

			@Override
			public void onClose(Status status) {
				handleWriteStreamClose(status);
			}
		});
	}

	public void start() {
		enableNetwork();
	}

	public void enableNetwork() {
		asyncQueue.verifyIsCurrentThread();
		networkEnabled = true;

		if (canUseNetwork()) {
			LOGGER.debug("Enabling network");
			writeStream.setLastStreamToken(localStore.getLastStreamToken());

			if (shouldStartWatchStream()) {
				startWatchStream();
			} else {
				onlineStateTracker.updateState(OnlineState.UNKNOWN);
			}

			// Sends anything written while offline.
			fillWritePipeline();
		}
	}

	/**
	 * Stops both streams. Targets and pending batches are remembered and resumed by {@link #enableNetwork()}.
	 */
	public void disableNetwork() {
		asyncQueue.verifyIsCurrentThread();
		LOGGER.debug("Disabling network");
		networkEnabled = false;
		disableNetworkInternal();
		onlineStateTracker.updateState(OnlineState.OFFLINE);
	}

	private void disableNetworkInternal() {
		watchStream.stop();
		writeStream.stop();

		if (!writePipeline.isEmpty()) {
			LOGGER.debug("Stopping write stream with {} pending writes", writePipeline.size());
			writePipeline.clear();
		}

		cleanUpWatchStreamState();
	}

	public void shutdown() {
		asyncQueue.verifyIsCurrentThread();
		LOGGER.debug("Shutting down");
		networkEnabled = false;
		disableNetworkInternal();
		onlineStateTracker.updateState(OnlineState.UNKNOWN);
	}

	/**
	 * Reopens both streams with the new user's credentials.
	 */
	public void handleCredentialChange() {
		asyncQueue.verifyIsCurrentThread();
		if (canUseNetwork()) {
			LOGGER.info("Restarting streams for new credential");
			restartNetwork();
		}
	}

	public void handlePrimaryStateChange(boolean isPrimary) {
		asyncQueue.verifyIsCurrentThread();
		if (isPrimary && !primary) {
			resumeTargetsFromLocalStore();
		}
		primary = isPrimary;
		if (isPrimary && networkEnabled) {
			enableNetwork();
		} else if (!isPrimary) {
			disableNetworkInternal();
			onlineStateTracker.updateState(OnlineState.UNKNOWN);
		}
	}

	/**
	 * Watch responses received just before losing the lease may not have been applied locally,
	 * so targets resume from the tokens the local store has rather than the latest ones seen.
	 */
	private void resumeTargetsFromLocalStore() {
		for (Map.Entry<Integer, TargetData> entry: listenTargets.entrySet()) {
			TargetData current = entry.getValue();
			TargetData local = localStore.getTargetData(current.target());
			if (local != null && local.targetId() == current.targetId()) {
				entry.setValue(current.withResumeToken(local.resumeToken(), local.snapshotVersion()));
			} else {
				entry.setValue(current.withResumeToken(ByteString.EMPTY, SnapshotVersion.NONE));
			}
		}
	}

	private void restartNetwork() {
		networkEnabled = false;
		disableNetworkInternal();
		onlineStateTracker.updateState(OnlineState.UNKNOWN);
		enableNetwork();
	}

	public boolean canUseNetwork() {
		return networkEnabled && primary;
	}

	// Watch

	/**
	 * Starts listening to a target, opening the watch stream if necessary. Listening to a
	 * target already being listened to has no effect.
	 */
	public void listen(TargetData targetData) {
		asyncQueue.verifyIsCurrentThread();
		int targetId = targetData.targetId();
		if (listenTargets.containsKey(targetId)) {
			return;
		}

		listenTargets.put(targetId, targetData);

		if (shouldStartWatchStream()) {
			startWatchStream();
		} else if (watchStream.isOpen()) {
			sendWatchRequest(targetData);
		}
	}

	public void stopListening(int targetId) {
		asyncQueue.verifyIsCurrentThread();
		TargetData targetData = listenTargets.remove(targetId);
		if (targetData == null) {
			throw new IllegalStateException("Stopping to listen to unknown target " + targetId);
		}

		if (watchStream.isOpen()) {
			sendUnwatchRequest(targetId);
		}

		if (listenTargets.isEmpty()) {
			if (watchStream.isOpen()) {
				watchStream.markIdle();
			} else if (canUseNetwork()) {
				// The stream never connected, and no longer needs to.
				onlineStateTracker.updateState(OnlineState.UNKNOWN);
			}
		}
	}

	private void sendWatchRequest(TargetData targetData) {
		watchChangeAggregator().recordPendingTargetRequest(targetData.targetId());
		if (!targetData.resumeToken().isEmpty() || targetData.snapshotVersion().compareTo(SnapshotVersion.NONE) > 0) {
			// Lets the backend send a bloom filter if its count differs.
			int expectedCount = getRemoteKeysForTarget(targetData.targetId()).size();
			targetData = targetData.withExpectedCount(expectedCount);
		}
		watchStream.watch(targetData);
	}

	private void sendUnwatchRequest(int targetId) {
		watchChangeAggregator().recordPendingTargetRequest(targetId);
		watchStream.unwatch(targetId);
	}

	private boolean shouldStartWatchStream() {
		return canUseNetwork() && !watchStream.isStarted() && !listenTargets.isEmpty();
	}

	private void cleanUpWatchStreamState() {
		watchChangeAggregator = null;
	}

	private void startWatchStream() {
		if (!shouldStartWatchStream()) {
			throw new IllegalStateException("Starting watch stream that should not be started");
		}
		watchChangeAggregator = new WatchChangeAggregator(this, datastore.settings().databaseId(), mismatchListener);
		watchStream.start();
		onlineStateTracker.handleWatchStreamStart();
	}

	private WatchChangeAggregator watchChangeAggregator() {
		if (watchChangeAggregator == null) {
			throw new IllegalStateException("Watch stream is not started");
		}
		return watchChangeAggregator;
	}

	private void handleWatchStreamOpen() {
		for (TargetData targetData: listenTargets.values()) {
			sendWatchRequest(targetData);
		}
	}

	private void handleWatchChange(SnapshotVersion snapshotVersion, WatchChange watchChange) {
		// Any response means the backend is reachable.
		onlineStateTracker.updateState(OnlineState.ONLINE);

		if (watchChange instanceof WatchTargetChange) {
			WatchTargetChange targetChange = (WatchTargetChange) watchChange;
			if (targetChange.changeType() == WatchTargetChangeType.REMOVED && targetChange.cause() != null) {
				// Nothing else on the stream is affected.
				processTargetError(targetChange);
				return;
			}
			watchChangeAggregator().handleTargetChange(targetChange);
		} else if (watchChange instanceof DocumentChange) {
			watchChangeAggregator().handleDocumentChange((DocumentChange) watchChange);
		} else if (watchChange instanceof ExistenceFilterWatchChange) {
			watchChangeAggregator().handleExistenceFilter((ExistenceFilterWatchChange) watchChange);
		} else {
			throw new IllegalArgumentException("Unknown watch change: " + watchChange);
		}

		if (!snapshotVersion.equals(SnapshotVersion.NONE)) {
			SnapshotVersion lastRemoteSnapshotVersion = localStore.getLastRemoteSnapshotVersion();
			if (snapshotVersion.compareTo(lastRemoteSnapshotVersion) >= 0) {
				raiseWatchSnapshot(snapshotVersion);
			}
		}
	}

	private void handleWatchStreamClose(Status status) {
		if (status.isOk()) {
			LOGGER.debug("Watch stream closed");
		}

		cleanUpWatchStreamState();

		if (shouldStartWatchStream()) {
			if (!status.isOk()) {
				onlineStateTracker.handleWatchStreamFailure(status);
			}
			startWatchStream();
		} else {
			// Nothing to listen to, so nothing to learn about connectivity.
			onlineStateTracker.updateState(OnlineState.UNKNOWN);
		}
	}

	private void raiseWatchSnapshot(SnapshotVersion snapshotVersion) {
		if (snapshotVersion.equals(SnapshotVersion.NONE)) {
			throw new IllegalArgumentException("Can't raise a snapshot without a version");
		}
		RemoteEvent remoteEvent = watchChangeAggregator().createRemoteEvent(snapshotVersion);

		for (Map.Entry<Integer, TargetChange> entry: remoteEvent.targetChanges().entrySet()) {
			TargetChange targetChange = entry.getValue();
			if (!targetChange.resumeToken().isEmpty()) {
				int targetId = entry.getKey();
				TargetData targetData = listenTargets.get(targetId);
				if (targetData != null) {
					listenTargets.put(targetId, targetData.withResumeToken(targetChange.resumeToken(), snapshotVersion));
				}
			}
		}

		for (Map.Entry<Integer, QueryPurpose> entry: remoteEvent.targetMismatches().entrySet()) {
			int targetId = entry.getKey();
			TargetData targetData = listenTargets.get(targetId);
			if (targetData == null) {
				continue;
			}

			// The token would resume into the same mismatch, so the target is listened to from scratch.
			listenTargets.put(targetId, targetData.withResumeToken(ByteString.EMPTY, targetData.snapshotVersion()));
			sendUnwatchRequest(targetId);

			TargetData requeryTargetData = new TargetData(targetData.target(), targetId, targetData.sequenceNumber(), entry.getValue());
			sendWatchRequest(requeryTargetData);
		}

		remoteStoreCallback.handleRemoteEvent(remoteEvent);
	}

	private void processTargetError(WatchTargetChange targetChange) {
		Status cause = targetChange.cause();
		for (Integer targetId: targetChange.targetIds()) {
			if (listenTargets.containsKey(targetId)) {
				LOGGER.debug("Listen to target {} rejected: {}", targetId, cause);
				listenTargets.remove(targetId);
				if (watchChangeAggregator != null) {
					watchChangeAggregator.removeTarget(targetId);
				}
				remoteStoreCallback.handleRejectedListen(targetId, cause);
			}
		}
	}

	// Write

	/**
	 * Moves batches from the local mutation queue into the write pipeline until it is full,
	 * starting the write stream if necessary.
	 */
	public void fillWritePipeline() {
		asyncQueue.verifyIsCurrentThread();
		int lastBatchIdRetrieved = writePipeline.isEmpty() ? MutationBatch.UNKNOWN : writePipeline.getLast().batchId();
		while (canAddToWritePipeline()) {
			MutationBatch batch = localStore.getNextMutationBatch(lastBatchIdRetrieved);
			if (batch == null) {
				if (writePipeline.isEmpty()) {
					writeStream.markIdle();
				}
				break;
			}
			addToWritePipeline(batch);
			lastBatchIdRetrieved = batch.batchId();
		}

		if (shouldStartWriteStream()) {
			writeStream.start();
		}
	}

	private boolean canAddToWritePipeline() {
		return canUseNetwork() && writePipeline.size() < maxPendingWrites;
	}

	int writePipelineSize() {
		return writePipeline.size();
	}

	private void addToWritePipeline(MutationBatch batch) {
		writePipeline.add(batch);
		if (writeStream.isOpen() && writeStream.isHandshakeComplete()) {
			writeStream.writeMutations(batch.mutations());
		}
	}

	private boolean shouldStartWriteStream() {
		return canUseNetwork() && !writeStream.isStarted() && !writePipeline.isEmpty();
	}

	private void handleWriteStreamOpen() {
		writeStream.writeHandshake();
	}

	private void handleWriteStreamHandshakeComplete() {
		try {
			localStore.setLastStreamToken(writeStream.lastStreamToken());
		} catch (LostPrimaryLeaseException e) {
			LOGGER.debug("Not resending writes: {}", e.getMessage());
			handlePrimaryStateChange(false);
			return;
		}

		// Resends everything not yet acknowledged on the previous stream.
		for (MutationBatch batch: writePipeline) {
			writeStream.writeMutations(batch.mutations());
		}
	}

	private void handleWriteStreamMutationResults(SnapshotVersion commitVersion, List<MutationResult> results) {
		MutationBatch batch = writePipeline.poll();
		if (batch == null) {
			throw new IllegalStateException("Write response with an empty write pipeline");
		}
		MutationBatchResult batchResult = MutationBatchResult.create(batch, commitVersion, results, writeStream.lastStreamToken());
		remoteStoreCallback.handleSuccessfulWrite(batchResult);

		fillWritePipeline();
	}

	private void handleWriteStreamClose(Status status) {
		if (!status.isOk() && !writePipeline.isEmpty()) {
			if (writeStream.isHandshakeComplete()) {
				handleWriteError(status);
			} else {
				handleWriteHandshakeError(status);
			}
		}

		if (shouldStartWriteStream()) {
			writeStream.start();
		}
	}

	private void handleWriteHandshakeError(Status status) {
		if (Datastore.isPermanentError(status)) {
			LOGGER.debug("Write stream error before handshake completed; resetting stream token {}: {}",
				writeStream.lastStreamToken(), status);
			writeStream.setLastStreamToken(ByteString.EMPTY);
			try {
				localStore.setLastStreamToken(ByteString.EMPTY);
			} catch (LostPrimaryLeaseException e) {
				LOGGER.debug("Stream token not reset: {}", e.getMessage());
				handlePrimaryStateChange(false);
			}
		}
	}

	private void handleWriteError(Status status) {
		if (Datastore.isPermanentWriteError(status)) {
			MutationBatch batch = writePipeline.poll();
			LOGGER.debug("Batch {} rejected: {}", batch.batchId(), status);

			// The error is this batch's fault, not the connection's, so the next one goes out right away.
			writeStream.inhibitBackoff();

			remoteStoreCallback.handleRejectedWrite(batch.batchId(), status);

			fillWritePipeline();
		}
	}

	// TargetMetadataProvider

	@Override
	public Set<DocumentKey> getRemoteKeysForTarget(int targetId) {
		return remoteStoreCallback.getRemoteKeysForTarget(targetId);
	}

	@Override
	public @Nullable TargetData getTargetDataForTarget(int targetId) {
		return listenTargets.get(targetId);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(RemoteStore.class);
}
