package io.vena.docsync.core;

import io.vena.docsync.auth.User;
import io.vena.docsync.bundle.BundleElement;
import io.vena.docsync.bundle.BundleLoader;
import io.vena.docsync.bundle.BundleMetadata;
import io.vena.docsync.bundle.BundleSource;
import io.vena.docsync.bundle.LoadBundleTask;
import io.vena.docsync.bundle.LoadBundleTaskProgress;
import io.vena.docsync.exceptions.DocSyncException;
import io.vena.docsync.exceptions.LostPrimaryLeaseException;
import io.vena.docsync.local.ListenSequence;
import io.vena.docsync.local.LocalDocumentsResult;
import io.vena.docsync.local.LocalStore;
import io.vena.docsync.local.LocalViewChanges;
import io.vena.docsync.local.QueryPurpose;
import io.vena.docsync.local.QueryResult;
import io.vena.docsync.local.ReferenceSet;
import io.vena.docsync.local.TargetData;
import io.vena.docsync.local.TargetIdGenerator;
import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.MutationBatch;
import io.vena.docsync.model.mutation.MutationBatchResult;
import io.vena.docsync.remote.RemoteEvent;
import io.vena.docsync.remote.RemoteStore;
import io.vena.docsync.remote.Status;
import io.vena.docsync.remote.TargetChange;
import io.vena.docsync.util.ByteString;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.docsync.exceptions.DocSyncException.Code.CANCELLED;
import static io.vena.docsync.exceptions.DocSyncException.Code.INVALID_ARGUMENT;

/**
 * Connects the local cache to the backend on behalf of the application's queries and writes.
 *
 * <p>
 * Each query being listened to has a {@link View}, and each distinct target one listen on the
 * watch stream. Whenever local writes, backend changes or acknowledgements change documents,
 * every view is recomputed and the resulting snapshots are passed to the {@link SyncEngineCallback}.
 *
 * <p>
 * Documents a view shows that the backend doesn't report are in limbo. For each one, a
 * single-document target is listened to until the backend says whether it exists. At most
 * <code>maxConcurrentLimboResolutions</code> of these run at once; the rest wait in a queue.
 *
 * <p>
 * All methods must be called on the async queue.
 */
public final class SyncEngine implements RemoteStore.RemoteStoreCallback {
	/**
	 * Implemented by the {@link EventManager}.
	 */
	public interface SyncEngineCallback {
		void onViewSnapshots(List<ViewSnapshot> snapshots);

		void onError(Query query, Status error);

		void handleOnlineStateChange(OnlineState onlineState);
	}

	/**
	 * Tracks whether the limbo target for a document has delivered it, since the target's
	 * remote keys have to be answered without a view.
	 */
	private static final class LimboResolution {
		private final DocumentKey key;
		private boolean receivedDocument;

		LimboResolution(DocumentKey key) {
			this.key = key;
		}
	}

	private final LocalStore localStore;
	private final RemoteStore remoteStore;
	private final int maxConcurrentLimboResolutions;

	private final Map<Query, QueryView> queryViewsByQuery = new HashMap<>();
	private final Map<Integer, List<Query>> queriesByTarget = new HashMap<>();

	/**
	 * Limbo documents waiting for a free resolution slot, in the order they entered limbo.
	 */
	private final LinkedHashSet<DocumentKey> enqueuedLimboResolutions = new LinkedHashSet<>();
	private final Map<DocumentKey, Integer> activeLimboTargetsByKey = new HashMap<>();
	private final Map<Integer, LimboResolution> activeLimboResolutionsByTarget = new HashMap<>();

	/**
	 * Which views each limbo document is in limbo for.
	 */
	private final ReferenceSet limboDocumentRefs = new ReferenceSet();

	/**
	 * Write futures by user and batch. A user's futures are kept when another user signs in,
	 * and complete if the batch is acknowledged or rejected once the user is back.
	 */
	private final Map<User, Map<Integer, CompletableFuture<Void>>> mutationUserCallbacks = new HashMap<>();

	/**
	 * <code>waitForPendingWrites</code> futures, by the highest batch id pending when they were registered.
	 */
	private final Map<Integer, List<CompletableFuture<Void>>> pendingWritesCallbacks = new HashMap<>();

	private final TargetIdGenerator targetIdGenerator = TargetIdGenerator.forSyncEngine();

	private User currentUser;
	private @Nullable SyncEngineCallback syncEngineListener;

	public SyncEngine(LocalStore localStore, RemoteStore remoteStore, User initialUser, int maxConcurrentLimboResolutions) {
		this.localStore = localStore;
		this.remoteStore = remoteStore;
		this.currentUser = initialUser;
		this.maxConcurrentLimboResolutions = maxConcurrentLimboResolutions;
	}

	public void setCallback(SyncEngineCallback callback) {
		syncEngineListener = callback;
	}

	private SyncEngineCallback listener(String method) {
		if (syncEngineListener == null) {
			throw new IllegalStateException("Trying to call " + method + " before setting callback");
		}
		return syncEngineListener;
	}

	/**
	 * Starts listening to a query, raising its first snapshot from the local cache.
	 *
	 * @param shouldListenToRemote false to rely on another client to keep the cache up to date
	 * @return the target id the query is listened to with
	 */
	public int listen(Query query, boolean shouldListenToRemote) {
		SyncEngineCallback callback = listener("listen");
		if (queryViewsByQuery.containsKey(query)) {
			throw new IllegalStateException("Already listening to query " + query);
		}

		TargetData targetData = localStore.allocateTarget(query.toTarget());
		ViewSnapshot viewSnapshot = initializeViewAndComputeSnapshot(query, targetData.targetId(), targetData.resumeToken());
		callback.onViewSnapshots(Collections.singletonList(viewSnapshot));

		if (shouldListenToRemote) {
			remoteStore.listen(targetData);
		}
		return targetData.targetId();
	}

	private ViewSnapshot initializeViewAndComputeSnapshot(Query query, int targetId, ByteString resumeToken) {
		QueryResult queryResult = localStore.executeQuery(query, true);

		// A query sharing its target with another starts out just as synced.
		ViewSnapshot.SyncState currentTargetSyncState = ViewSnapshot.SyncState.NONE;
		List<Query> existingQueries = queriesByTarget.get(targetId);
		if (existingQueries != null) {
			Query mirrorQuery = existingQueries.get(0);
			currentTargetSyncState = queryViewsByQuery.get(mirrorQuery).view().syncState();
		}
		TargetChange synthesizedCurrentChange = TargetChange.createSynthesizedTargetChangeForCurrentChange(
			currentTargetSyncState == ViewSnapshot.SyncState.SYNCED, resumeToken);

		View view = new View(query, queryResult.remoteKeys());
		View.DocumentChanges viewDocChanges = view.computeDocChanges(queryResult.documents());
		ViewChange viewChange = view.applyChanges(viewDocChanges, synthesizedCurrentChange);
		updateTrackedLimboDocuments(viewChange.limboChanges(), targetId);

		queryViewsByQuery.put(query, new QueryView(query, targetId, view));
		queriesByTarget.computeIfAbsent(targetId, id -> new ArrayList<>(1)).add(query);

		ViewSnapshot snapshot = viewChange.snapshot();
		if (snapshot == null) {
			throw new IllegalStateException("First view of " + query + " produced no snapshot");
		}
		return snapshot;
	}

	/**
	 * Stops listening to a query, releasing its target if no other query uses it.
	 *
	 * @param shouldUnlistenToRemote false if another client still needs the target
	 */
	public void stopListening(Query query, boolean shouldUnlistenToRemote) {
		listener("stopListening");

		QueryView queryView = queryViewsByQuery.remove(query);
		if (queryView == null) {
			throw new IllegalStateException("Trying to stop listening to a query not found: " + query);
		}

		int targetId = queryView.targetId();
		List<Query> targetQueries = queriesByTarget.get(targetId);
		targetQueries.remove(query);

		if (targetQueries.isEmpty()) {
			localStore.releaseTarget(targetId);
			if (shouldUnlistenToRemote) {
				remoteStore.stopListening(targetId);
			}
			removeAndCleanupTarget(targetId, Status.OK);
		}
	}

	/**
	 * Applies the mutations locally and queues them to be sent.
	 *
	 * @param userTask completes when the backend acknowledges the batch,
	 *                 or exceptionally when it rejects it
	 */
	public void writeMutations(List<Mutation> mutations, CompletableFuture<Void> userTask) {
		listener("writeMutations");

		LocalDocumentsResult result = localStore.writeLocally(mutations);
		LOGGER.debug("Wrote batch {} locally", result.batchId());
		addUserCallback(result.batchId(), userTask);

		emitNewSnapsAndNotifyLocalStore(result.documents(), null);
		remoteStore.fillWritePipeline();
	}

	private void addUserCallback(int batchId, CompletableFuture<Void> userTask) {
		mutationUserCallbacks.computeIfAbsent(currentUser, user -> new HashMap<>()).put(batchId, userTask);
	}

	@Override
	public void handleRemoteEvent(RemoteEvent event) {
		listener("handleRemoteEvent");

		for (Map.Entry<Integer, TargetChange> entry: event.targetChanges().entrySet()) {
			LimboResolution limboResolution = activeLimboResolutionsByTarget.get(entry.getKey());
			if (limboResolution != null) {
				TargetChange targetChange = entry.getValue();
				if (targetChange.documentChangeCount() > 1) {
					throw new IllegalStateException("Limbo resolution for a single document contains multiple changes");
				}
				if (!targetChange.addedDocuments().isEmpty()) {
					limboResolution.receivedDocument = true;
				} else if (!targetChange.modifiedDocuments().isEmpty()) {
					if (!limboResolution.receivedDocument) {
						throw new IllegalStateException("Received change for limbo target document without add");
					}
				} else if (!targetChange.removedDocuments().isEmpty()) {
					if (!limboResolution.receivedDocument) {
						throw new IllegalStateException("Received remove for limbo target document without add");
					}
					limboResolution.receivedDocument = false;
				}
			}
		}

		ignoreIfPrimaryLeaseLoss("Apply remote event", () -> {
			Map<DocumentKey, Document> changes = localStore.applyRemoteEvent(event);
			emitNewSnapsAndNotifyLocalStore(changes, event);
		});
	}

	@Override
	public void handleOnlineStateChange(OnlineState onlineState) {
		SyncEngineCallback callback = listener("handleOnlineStateChange");
		List<ViewSnapshot> newViewSnapshots = new ArrayList<>();
		for (QueryView queryView: queryViewsByQuery.values()) {
			ViewChange viewChange = queryView.view().applyOnlineStateChange(onlineState);
			if (!viewChange.limboChanges().isEmpty()) {
				throw new IllegalStateException("Online state change produced limbo changes");
			}
			if (viewChange.snapshot() != null) {
				newViewSnapshots.add(viewChange.snapshot());
			}
		}
		callback.onViewSnapshots(newViewSnapshots);
		callback.handleOnlineStateChange(onlineState);
	}

	@Override
	public Set<DocumentKey> getRemoteKeysForTarget(int targetId) {
		LimboResolution limboResolution = activeLimboResolutionsByTarget.get(targetId);
		if (limboResolution != null && limboResolution.receivedDocument) {
			return Collections.singleton(limboResolution.key);
		}
		Set<DocumentKey> remoteKeys = new TreeSet<>();
		List<Query> queries = queriesByTarget.get(targetId);
		if (queries != null) {
			for (Query query: queries) {
				remoteKeys.addAll(queryViewsByQuery.get(query).view().syncedDocuments());
			}
		}
		return remoteKeys;
	}

	@Override
	public void handleRejectedListen(int targetId, Status error) {
		listener("handleRejectedListen");

		LimboResolution limboResolution = activeLimboResolutionsByTarget.get(targetId);
		if (limboResolution != null) {
			// The document can't be read, so it is removed from the views as if it had been deleted.
			DocumentKey limboKey = limboResolution.key;
			LOGGER.debug("Limbo resolution of {} rejected: {}", limboKey, error);
			activeLimboTargetsByKey.remove(limboKey);
			activeLimboResolutionsByTarget.remove(targetId);
			pumpEnqueuedLimboResolutions();

			Map<DocumentKey, MutableDocument> documentUpdates = Map.of(limboKey, MutableDocument.newNoDocument(limboKey, SnapshotVersion.NONE));
			RemoteEvent event = new RemoteEvent(SnapshotVersion.NONE, Map.of(), Map.of(), documentUpdates, Set.of(limboKey));
			handleRemoteEvent(event);
		} else {
			localStore.releaseTarget(targetId);
			removeAndCleanupTarget(targetId, error);
		}
	}

	@Override
	public void handleSuccessfulWrite(MutationBatchResult mutationBatchResult) {
		listener("handleSuccessfulWrite");

		int batchId = mutationBatchResult.batch().batchId();
		LOGGER.debug("Batch {} acknowledged", batchId);
		notifyUser(batchId, null);
		resolvePendingWriteTasks(batchId);

		ignoreIfPrimaryLeaseLoss("Acknowledge batch", () -> {
			Map<DocumentKey, Document> changes = localStore.acknowledgeBatch(mutationBatchResult);
			emitNewSnapsAndNotifyLocalStore(changes, null);
		});
	}

	@Override
	public void handleRejectedWrite(int batchId, Status status) {
		listener("handleRejectedWrite");

		ignoreIfPrimaryLeaseLoss("Reject batch", () -> {
			Map<DocumentKey, Document> changes = localStore.rejectBatch(batchId);
			if (!changes.isEmpty()) {
				DocumentKey firstKey = new TreeSet<>(changes.keySet()).first();
				logErrorIfInteresting(status, "Write failed at " + firstKey);
			}

			notifyUser(batchId, status);
			resolvePendingWriteTasks(batchId);
			emitNewSnapsAndNotifyLocalStore(changes, null);
		});
	}

	/**
	 * Another client sharing the persistence took the lease, and with it the job of applying
	 * backend responses. The response is dropped and this client stops using the network.
	 */
	private void ignoreIfPrimaryLeaseLoss(String operation, Runnable action) {
		try {
			action.run();
		} catch (LostPrimaryLeaseException e) {
			LOGGER.debug("{} skipped: {}", operation, e.getMessage());
			handlePrimaryStateChange(false);
		}
	}

	/**
	 * Completes the future once every batch pending now is acknowledged or rejected.
	 */
	public void registerPendingWritesTask(CompletableFuture<Void> userTask) {
		if (!remoteStore.canUseNetwork()) {
			LOGGER.debug("The network is disabled. Pending writes will not be acknowledged until the network is enabled");
		}

		int largestPendingBatchId = localStore.getHighestUnacknowledgedBatchId();
		if (largestPendingBatchId == MutationBatch.UNKNOWN) {
			userTask.complete(null);
			return;
		}
		pendingWritesCallbacks.computeIfAbsent(largestPendingBatchId, id -> new ArrayList<>()).add(userTask);
	}

	private void resolvePendingWriteTasks(int batchId) {
		List<CompletableFuture<Void>> tasks = pendingWritesCallbacks.remove(batchId);
		if (tasks != null) {
			for (CompletableFuture<Void> task: tasks) {
				task.complete(null);
			}
		}
	}

	private void failOutstandingPendingWritesAwaitingTasks() {
		for (List<CompletableFuture<Void>> tasks: pendingWritesCallbacks.values()) {
			for (CompletableFuture<Void> task: tasks) {
				task.completeExceptionally(new DocSyncException("Waiting for pending writes was cancelled because the user changed", CANCELLED));
			}
		}
		pendingWritesCallbacks.clear();
	}

	private void notifyUser(int batchId, @Nullable Status status) {
		Map<Integer, CompletableFuture<Void>> userTasks = mutationUserCallbacks.get(currentUser);
		if (userTasks == null) {
			return;
		}
		CompletableFuture<Void> userTask = userTasks.remove(batchId);
		if (userTask != null) {
			if (status == null) {
				userTask.complete(null);
			} else {
				userTask.completeExceptionally(status.asException());
			}
		}
	}

	private void removeAndCleanupTarget(int targetId, Status status) {
		List<Query> queries = queriesByTarget.remove(targetId);
		if (queries != null) {
			for (Query query: queries) {
				queryViewsByQuery.remove(query);
				if (!status.isOk()) {
					listener("removeAndCleanupTarget").onError(query, status);
					logErrorIfInteresting(status, "Listen for " + query + " failed");
				}
			}
		}

		SortedSet<DocumentKey> limboKeys = limboDocumentRefs.removeReferencesForId(targetId);
		for (DocumentKey key: limboKeys) {
			if (!limboDocumentRefs.containsKey(key)) {
				removeLimboTarget(key);
			}
		}
	}

	private void removeLimboTarget(DocumentKey key) {
		enqueuedLimboResolutions.remove(key);
		Integer targetId = activeLimboTargetsByKey.remove(key);
		if (targetId != null) {
			LOGGER.debug("Stopping limbo resolution of {}", key);
			remoteStore.stopListening(targetId);
			activeLimboResolutionsByTarget.remove(targetId);
			pumpEnqueuedLimboResolutions();
		}
	}

	/**
	 * Recomputes every view from the changed documents, raises the resulting snapshots, and
	 * pins the documents now shown.
	 */
	private void emitNewSnapsAndNotifyLocalStore(Map<DocumentKey, Document> changes, @Nullable RemoteEvent remoteEvent) {
		List<ViewSnapshot> newSnapshots = new ArrayList<>();
		List<LocalViewChanges> documentChangesInAllViews = new ArrayList<>();

		for (QueryView queryView: queryViewsByQuery.values()) {
			View view = queryView.view();
			View.DocumentChanges viewDocChanges = view.computeDocChanges(changes);
			if (viewDocChanges.needsRefill()) {
				// The changes pushed documents out of a limit query; find their replacements.
				QueryResult queryResult = localStore.executeQuery(queryView.query(), false);
				viewDocChanges = view.computeDocChanges(queryResult.documents(), viewDocChanges);
			}

			TargetChange targetChange = remoteEvent == null ? null : remoteEvent.targetChanges().get(queryView.targetId());
			boolean targetIsPendingReset = remoteEvent != null && remoteEvent.targetMismatches().containsKey(queryView.targetId());
			ViewChange viewChange = view.applyChanges(viewDocChanges, true, targetChange, targetIsPendingReset);
			updateTrackedLimboDocuments(viewChange.limboChanges(), queryView.targetId());

			ViewSnapshot snapshot = viewChange.snapshot();
			if (snapshot != null) {
				newSnapshots.add(snapshot);
				documentChangesInAllViews.add(LocalViewChanges.fromViewSnapshot(queryView.targetId(), snapshot));
			}
		}

		listener("emitNewSnapsAndNotifyLocalStore").onViewSnapshots(newSnapshots);
		localStore.notifyLocalViewChanges(documentChangesInAllViews);
	}

	private void updateTrackedLimboDocuments(List<LimboDocumentChange> limboChanges, int targetId) {
		for (LimboDocumentChange limboChange: limboChanges) {
			DocumentKey key = limboChange.key();
			switch (limboChange.type()) {
				case ADDED:
					limboDocumentRefs.addReference(key, targetId);
					trackLimboChange(key);
					break;
				case REMOVED:
					LOGGER.debug("Document no longer in limbo: {}", key);
					limboDocumentRefs.removeReference(key, targetId);
					if (!limboDocumentRefs.containsKey(key)) {
						removeLimboTarget(key);
					}
					break;
				default:
					throw new IllegalArgumentException("Unknown limbo change type: " + limboChange.type());
			}
		}
	}

	private void trackLimboChange(DocumentKey key) {
		if (!activeLimboTargetsByKey.containsKey(key) && enqueuedLimboResolutions.add(key)) {
			LOGGER.debug("New document in limbo: {}", key);
			pumpEnqueuedLimboResolutions();
		}
	}

	/**
	 * Starts limbo resolutions from the queue until the limit of concurrent ones is reached.
	 */
	private void pumpEnqueuedLimboResolutions() {
		while (!enqueuedLimboResolutions.isEmpty() && activeLimboTargetsByKey.size() < maxConcurrentLimboResolutions) {
			Iterator<DocumentKey> iterator = enqueuedLimboResolutions.iterator();
			DocumentKey key = iterator.next();
			iterator.remove();

			int limboTargetId = targetIdGenerator.nextId();
			activeLimboResolutionsByTarget.put(limboTargetId, new LimboResolution(key));
			activeLimboTargetsByKey.put(key, limboTargetId);
			LOGGER.debug("Resolving limbo document {} with target {}", key, limboTargetId);
			remoteStore.listen(new TargetData(
				Query.atPath(key.path()).toTarget(),
				limboTargetId,
				ListenSequence.INVALID,
				QueryPurpose.LIMBO_RESOLUTION));
		}
	}

	Map<DocumentKey, Integer> getActiveLimboDocumentResolutions() {
		return new LinkedHashMap<>(activeLimboTargetsByKey);
	}

	List<DocumentKey> getEnqueuedLimboDocumentResolutions() {
		return new ArrayList<>(enqueuedLimboResolutions);
	}

	/**
	 * Switches the local cache to the new user's pending writes and restarts the streams
	 * with the new credentials.
	 */
	public void handleCredentialChange(User user) {
		boolean userChanged = !currentUser.equals(user);
		currentUser = user;

		if (userChanged) {
			LOGGER.debug("User changed to {}", user);
			failOutstandingPendingWritesAwaitingTasks();
			Map<DocumentKey, Document> changes = localStore.handleUserChange(user);
			emitNewSnapsAndNotifyLocalStore(changes, null);
		}

		remoteStore.handleCredentialChange();
	}

	/**
	 * A client sharing durable persistence stops using the network when it loses the primary
	 * lease. On regaining it, its views are resynchronized with whatever the primary wrote in the meantime.
	 */
	public void handlePrimaryStateChange(boolean isPrimary) {
		if (isPrimary) {
			List<ViewSnapshot> newSnapshots = new ArrayList<>();
			for (QueryView queryView: queryViewsByQuery.values()) {
				QueryResult queryResult = localStore.executeQuery(queryView.query(), true);
				ViewChange viewChange = queryView.view().synchronizeWithPersistedState(queryResult);
				updateTrackedLimboDocuments(viewChange.limboChanges(), queryView.targetId());
				if (viewChange.snapshot() != null) {
					newSnapshots.add(viewChange.snapshot());
				}
			}
			listener("handlePrimaryStateChange").onViewSnapshots(newSnapshots);
		}
		remoteStore.handlePrimaryStateChange(isPrimary);
	}

	/**
	 * Reads a bundle and saves its documents and named queries, reporting progress on the task.
	 * Closes the source.
	 */
	public void loadBundle(BundleSource bundleSource, LoadBundleTask resultTask) {
		try {
			BundleMetadata bundleMetadata = bundleSource.getBundleMetadata();
			if (localStore.hasNewerBundle(bundleMetadata)) {
				LOGGER.debug("Bundle {} already loaded", bundleMetadata.bundleId());
				resultTask.setResult(LoadBundleTaskProgress.forSuccess(bundleMetadata));
				return;
			}

			resultTask.updateProgress(LoadBundleTaskProgress.forInitial(bundleMetadata));

			BundleLoader bundleLoader = new BundleLoader(localStore, bundleMetadata);
			long currentBytesRead = 0;
			BundleElement bundleElement;
			while ((bundleElement = bundleSource.getNextElement()) != null) {
				long oldBytesRead = currentBytesRead;
				currentBytesRead = bundleSource.getBytesRead();
				LoadBundleTaskProgress progress = bundleLoader.addElement(bundleElement, currentBytesRead - oldBytesRead);
				if (progress != null) {
					resultTask.updateProgress(progress);
				}
			}

			Map<DocumentKey, Document> changes = bundleLoader.applyChanges();
			emitNewSnapsAndNotifyLocalStore(changes, null);
			LOGGER.debug("Loaded bundle {} with {} documents", bundleMetadata.bundleId(), bundleMetadata.totalDocuments());
			resultTask.setResult(LoadBundleTaskProgress.forSuccess(bundleMetadata));
		} catch (IOException | RuntimeException e) {
			LOGGER.warn("Unable to load bundle", e);
			resultTask.setException(new DocSyncException("Bundle failed to load", INVALID_ARGUMENT, e));
		} finally {
			try {
				bundleSource.close();
			} catch (IOException e) {
				LOGGER.warn("Unable to close bundle source", e);
			}
		}
	}

	/**
	 * Errors the application can fix, like missing permissions, are worth a warning;
	 * the rest are part of normal operation.
	 */
	private static void logErrorIfInteresting(Status error, String context) {
		if (error.code() == DocSyncException.Code.FAILED_PRECONDITION
			|| error.code() == DocSyncException.Code.PERMISSION_DENIED) {
			LOGGER.warn("{}: {}", context, error);
		} else {
			LOGGER.debug("{}: {}", context, error);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SyncEngine.class);
}
