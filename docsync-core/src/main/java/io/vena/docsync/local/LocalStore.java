package io.vena.docsync.local;

import io.vena.docsync.DocSyncSettings;
import io.vena.docsync.auth.User;
import io.vena.docsync.bundle.BundleCallback;
import io.vena.docsync.bundle.BundleMetadata;
import io.vena.docsync.bundle.NamedQuery;
import io.vena.docsync.core.Query;
import io.vena.docsync.core.Target;
import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldIndex;
import io.vena.docsync.model.IndexOffset;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.OverlayedDocument;
import io.vena.docsync.model.ResourcePath;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.MutationBatch;
import io.vena.docsync.model.mutation.MutationBatchResult;
import io.vena.docsync.model.mutation.PatchMutation;
import io.vena.docsync.model.mutation.Precondition;
import io.vena.docsync.model.value.ObjectValue;
import io.vena.docsync.remote.RemoteEvent;
import io.vena.docsync.remote.TargetChange;
import io.vena.docsync.util.ByteString;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.docsync.local.TransactionMode.READ_ONLY;
import static io.vena.docsync.local.TransactionMode.READ_WRITE;
import static io.vena.docsync.local.TransactionMode.READ_WRITE_PRIMARY;

/**
 * The local cache as the rest of the engine sees it.
 *
 * <p>
 * The cache holds three kinds of state:
 * <ul>
 *     <li>
 *         the user's pending writes, as mutation batches and the overlays computed from them;
 *     </li>
 *     <li>
 *         the documents most recently received from the backend, which never include pending writes;
 *     </li>
 *     <li>
 *         the targets being listened to, with their resume tokens and matching keys.
 *     </li>
 * </ul>
 * What the application sees is always the overlay applied to the remote document,
 * so remote updates can never silently discard a pending write.
 *
 * <p>
 * Every operation runs in its own {@link Persistence#runTransaction transaction}.
 * Instances are not thread-safe; they are used from the async queue only.
 */
public final class LocalStore implements BundleCallback {
	private final Persistence persistence;
	private final DocSyncSettings settings;
	private final QueryEngine queryEngine;
	private final RemoteDocumentCache remoteDocuments;
	private final TargetCache targetCache;
	private final BundleCache bundleCache;

	private IndexManager indexManager;
	private MutationQueue mutationQueue;
	private DocumentOverlayCache documentOverlayCache;
	private LocalDocumentsView localDocuments;

	/**
	 * Keys pinned by active views, so documents an application is looking at stay cached
	 * even after their targets stop matching them.
	 */
	private final ReferenceSet localViewReferences = new ReferenceSet();

	/**
	 * The targets currently listened to, with their latest in-memory state,
	 * which may be newer than what was persisted.
	 */
	private final Map<Integer, TargetData> targetDataByTarget = new HashMap<>();
	private final Map<Target, Integer> targetIdByTarget = new HashMap<>();

	private TargetIdGenerator targetIdGenerator;

	public LocalStore(Persistence persistence, QueryEngine queryEngine, User initialUser, DocSyncSettings settings) {
		if (!persistence.isStarted()) {
			throw new IllegalStateException("LocalStore was passed an unstarted persistence implementation");
		}
		this.persistence = persistence;
		this.settings = settings;
		this.queryEngine = queryEngine;
		this.remoteDocuments = persistence.getRemoteDocumentCache();
		this.targetCache = persistence.getTargetCache();
		this.bundleCache = persistence.getBundleCache();
		persistence.getReferenceDelegate().setInMemoryPins(localViewReferences);
		initializeUserComponents(initialUser);
	}

	private void initializeUserComponents(User user) {
		indexManager = persistence.getIndexManager(user);
		mutationQueue = persistence.getMutationQueue(user, indexManager);
		documentOverlayCache = persistence.getDocumentOverlayCache(user);
		localDocuments = new LocalDocumentsView(remoteDocuments, mutationQueue, documentOverlayCache, indexManager);
		remoteDocuments.setIndexManager(indexManager);
		queryEngine.initialize(localDocuments, indexManager);
	}

	public void start() {
		persistence.runTransaction("Start LocalStore", READ_WRITE, () -> {
			mutationQueue.start();
			indexManager.start();
			targetIdGenerator = TargetIdGenerator.forTargetCache(targetCache.getHighestTargetId());
		});
	}

	/**
	 * Switches to the pending writes of <code>user</code>.
	 *
	 * @return the local view of every document affected by the pending writes of either user
	 */
	public Map<DocumentKey, Document> handleUserChange(User user) {
		List<MutationBatch> oldBatches = persistence.runTransaction("Read batches of previous user", READ_ONLY,
			() -> mutationQueue.getAllMutationBatches());

		initializeUserComponents(user);

		return persistence.runTransaction("Start mutation queue of new user", READ_WRITE, () -> {
			mutationQueue.start();
			indexManager.start();
			List<MutationBatch> newBatches = mutationQueue.getAllMutationBatches();

			Set<DocumentKey> changedKeys = new TreeSet<>();
			for (List<MutationBatch> batches: List.of(oldBatches, newBatches)) {
				for (MutationBatch batch: batches) {
					changedKeys.addAll(batch.getKeys());
				}
			}
			return localDocuments.getDocuments(changedKeys);
		});
	}

	/**
	 * Adds a batch of writes to the mutation queue and applies it to the local view.
	 */
	public LocalDocumentsResult writeLocally(List<Mutation> mutations) {
		Instant localWriteTime = Instant.now();
		Set<DocumentKey> keys = new TreeSet<>();
		for (Mutation mutation: mutations) {
			keys.add(mutation.key());
		}

		return persistence.runTransaction("Locally write mutations", READ_WRITE, () -> {
			Map<DocumentKey, MutableDocument> remoteDocs = remoteDocuments.getAll(keys);
			Set<DocumentKey> docsWithoutRemoteVersion = new HashSet<>();
			for (Map.Entry<DocumentKey, MutableDocument> entry: remoteDocs.entrySet()) {
				if (!entry.getValue().isValidDocument()) {
					docsWithoutRemoteVersion.add(entry.getKey());
				}
			}
			Map<DocumentKey, OverlayedDocument> overlayedDocuments = localDocuments.getOverlayedDocuments(remoteDocs);

			// Transforms like increment depend on the value they are applied to.
			// Recording that value as a base mutation lets the local view be recomputed
			// after the remote document changes underneath.
			List<Mutation> baseMutations = new ArrayList<>();
			for (Mutation mutation: mutations) {
				ObjectValue baseValue = mutation.extractTransformBaseValue(overlayedDocuments.get(mutation.key()).document());
				if (baseValue != null) {
					baseMutations.add(new PatchMutation(mutation.key(), baseValue, baseValue.getFieldMask(), Precondition.exists(true)));
				}
			}

			MutationBatch batch = mutationQueue.addMutationBatch(localWriteTime, baseMutations, mutations);
			Map<DocumentKey, Mutation> overlays = batch.applyToLocalDocumentSet(overlayedDocuments, docsWithoutRemoteVersion);
			documentOverlayCache.saveOverlays(batch.batchId(), overlays);
			LOGGER.debug("Wrote batch {} affecting {} documents", batch.batchId(), keys.size());
			return LocalDocumentsResult.fromOverlayedDocuments(batch.batchId(), overlayedDocuments);
		});
	}

	/**
	 * Applies the backend's acknowledgement of the first batch in the queue to the cached
	 * remote documents and removes the batch.
	 *
	 * @return the local view of every document the batch wrote
	 */
	public Map<DocumentKey, Document> acknowledgeBatch(MutationBatchResult batchResult) {
		return persistence.runTransaction("Acknowledge batch", READ_WRITE_PRIMARY, () -> {
			MutationBatch batch = batchResult.batch();
			mutationQueue.acknowledgeBatch(batch, batchResult.streamToken());
			applyWriteToRemoteDocuments(batchResult);
			mutationQueue.performConsistencyCheck();
			documentOverlayCache.removeOverlaysForBatchId(batch.batchId());
			localDocuments.recalculateAndSaveOverlays(batch.getKeys());
			return localDocuments.getDocuments(batch.getKeys());
		});
	}

	private void applyWriteToRemoteDocuments(MutationBatchResult batchResult) {
		MutationBatch batch = batchResult.batch();
		for (DocumentKey key: batch.getKeys()) {
			MutableDocument doc = remoteDocuments.get(key);
			SnapshotVersion ackVersion = batchResult.docVersions().get(key);
			if (ackVersion == null) {
				throw new IllegalStateException("Batch result has no version for " + key);
			}
			if (doc.version().compareTo(ackVersion) < 0) {
				batch.applyToRemoteDocument(doc, batchResult);
				if (doc.isValidDocument()) {
					remoteDocuments.add(doc, batchResult.commitVersion());
				}
			}
		}
		mutationQueue.removeMutationBatch(batch);
	}

	/**
	 * Removes a batch the backend refused.
	 *
	 * @return the local view of every document the batch would have written
	 */
	public Map<DocumentKey, Document> rejectBatch(int batchId) {
		return persistence.runTransaction("Reject batch", READ_WRITE_PRIMARY, () -> {
			MutationBatch toReject = mutationQueue.lookupMutationBatch(batchId);
			if (toReject == null) {
				throw new IllegalStateException("Attempt to reject nonexistent batch " + batchId);
			}
			mutationQueue.removeMutationBatch(toReject);
			mutationQueue.performConsistencyCheck();
			documentOverlayCache.removeOverlaysForBatchId(batchId);
			localDocuments.recalculateAndSaveOverlays(toReject.getKeys());
			return localDocuments.getDocuments(toReject.getKeys());
		});
	}

	/**
	 * @return {@link MutationBatch#UNKNOWN} if there are no pending writes.
	 */
	public int getHighestUnacknowledgedBatchId() {
		return persistence.runTransaction("Get highest unacknowledged batch id", READ_ONLY,
			() -> mutationQueue.getHighestUnacknowledgedBatchId());
	}

	/**
	 * @return the first pending batch after <code>afterBatchId</code>, or null if there is none.
	 */
	public @Nullable MutationBatch getNextMutationBatch(int afterBatchId) {
		return persistence.runTransaction("Get next mutation batch", READ_ONLY,
			() -> mutationQueue.getNextMutationBatchAfterBatchId(afterBatchId));
	}

	public ByteString getLastStreamToken() {
		return persistence.runTransaction("Get last stream token", READ_ONLY,
			() -> mutationQueue.getLastStreamToken());
	}

	public void setLastStreamToken(ByteString streamToken) {
		persistence.runTransaction("Set stream token", READ_WRITE_PRIMARY,
			() -> mutationQueue.setLastStreamToken(streamToken));
	}

	/**
	 * Updates the cached targets and remote documents from a watch snapshot.
	 *
	 * @return the local view of every document the event changed
	 */
	public Map<DocumentKey, Document> applyRemoteEvent(RemoteEvent remoteEvent) {
		SnapshotVersion remoteVersion = remoteEvent.snapshotVersion();
		RemoteEventResult result = persistence.runTransaction("Apply remote event", READ_WRITE_PRIMARY, () -> {
			Map<Integer, TargetData> updatedTargetData = new HashMap<>();
			long sequenceNumber = persistence.getReferenceDelegate().getCurrentSequenceNumber();
			for (Map.Entry<Integer, TargetChange> entry: remoteEvent.targetChanges().entrySet()) {
				int targetId = entry.getKey();
				TargetChange change = entry.getValue();
				TargetData oldTargetData = targetDataByTarget.get(targetId);
				if (oldTargetData == null) {
					// No longer listening
					continue;
				}

				targetCache.removeMatchingKeys(change.removedDocuments(), targetId);
				targetCache.addMatchingKeys(change.addedDocuments(), targetId);

				TargetData newTargetData = oldTargetData.withSequenceNumber(sequenceNumber);
				if (remoteEvent.targetMismatches().containsKey(targetId)) {
					newTargetData = newTargetData
						.withResumeToken(ByteString.EMPTY, SnapshotVersion.NONE)
						.withLastLimboFreeSnapshotVersion(SnapshotVersion.NONE);
				} else if (!change.resumeToken().isEmpty()) {
					newTargetData = newTargetData.withResumeToken(change.resumeToken(), remoteVersion);
				}
				updatedTargetData.put(targetId, newTargetData);

				if (shouldPersistTargetData(oldTargetData, newTargetData, change)) {
					targetCache.updateTargetData(newTargetData);
				}
			}

			Map<DocumentKey, MutableDocument> documentUpdates = remoteEvent.documentUpdates();
			for (DocumentKey key: documentUpdates.keySet()) {
				if (remoteEvent.resolvedLimboDocuments().contains(key)) {
					persistence.getReferenceDelegate().updateLimboDocument(key);
				}
			}
			DocumentChangeResult changeResult = populateDocumentChangeBuffer(documentUpdates);

			if (!remoteVersion.equals(SnapshotVersion.NONE)) {
				SnapshotVersion lastRemoteVersion = targetCache.getLastRemoteSnapshotVersion();
				if (remoteVersion.compareTo(lastRemoteVersion) < 0) {
					throw new IllegalStateException("Watch stream reverted to previous snapshot " + remoteVersion
						+ " from " + lastRemoteVersion);
				}
				targetCache.setLastRemoteSnapshotVersion(remoteVersion);
			}

			Map<DocumentKey, Document> changedDocuments =
				localDocuments.getLocalViewOfDocuments(changeResult.changedDocuments(), changeResult.existenceChangedKeys());
			return new RemoteEventResult(changedDocuments, updatedTargetData);
		});

		// After commit; attempts may be retried.
		targetDataByTarget.putAll(result.updatedTargetData());
		return result.changedDocuments();
	}

	private record RemoteEventResult(Map<DocumentKey, Document> changedDocuments, Map<Integer, TargetData> updatedTargetData) { }

	private record DocumentChangeResult(Map<DocumentKey, MutableDocument> changedDocuments, Set<DocumentKey> existenceChangedKeys) { }

	/**
	 * Writes the given remote documents to the cache where they are newer than the cached ones.
	 * A document at an equal version replaces a cached one with pending writes,
	 * since the pending writes must have been acknowledged by then.
	 * A missing document at {@link SnapshotVersion#NONE} is an authoritative deletion
	 * and is removed from the cache.
	 */
	private DocumentChangeResult populateDocumentChangeBuffer(Map<DocumentKey, MutableDocument> documents) {
		Map<DocumentKey, MutableDocument> changedDocs = new HashMap<>();
		List<DocumentKey> removedDocs = new ArrayList<>();
		Set<DocumentKey> existenceChangedKeys = new HashSet<>();

		Map<DocumentKey, MutableDocument> existingDocs = remoteDocuments.getAll(documents.keySet());
		for (Map.Entry<DocumentKey, MutableDocument> entry: documents.entrySet()) {
			DocumentKey key = entry.getKey();
			MutableDocument doc = entry.getValue();
			MutableDocument existingDoc = existingDocs.get(key);

			if (doc.isFoundDocument() != existingDoc.isFoundDocument()) {
				existenceChangedKeys.add(key);
			}

			if (doc.isNoDocument() && doc.version().equals(SnapshotVersion.NONE)) {
				removedDocs.add(key);
				changedDocs.put(key, doc.mutableCopy());
			} else if (!existingDoc.isValidDocument()
				|| doc.version().compareTo(existingDoc.version()) > 0
				|| (doc.version().compareTo(existingDoc.version()) == 0 && existingDoc.hasPendingWrites())) {
				if (doc.readTime().equals(SnapshotVersion.NONE)) {
					throw new IllegalStateException("Cannot add a document without a read time: " + key);
				}
				remoteDocuments.add(doc, doc.readTime());
				changedDocs.put(key, doc.mutableCopy());
			} else {
				LOGGER.debug("Ignoring outdated update for {}. Current version: {}, update version: {}",
					key, existingDoc.version(), doc.version());
			}
		}
		remoteDocuments.removeAll(removedDocs);
		return new DocumentChangeResult(changedDocs, existenceChangedKeys);
	}

	/**
	 * A new resume token is persisted right away when it is the target's first,
	 * when the persisted one is too old to resume from, or when documents changed.
	 * Otherwise, it stays in memory, and a restart resumes from the older token.
	 */
	static boolean shouldPersistTargetData(TargetData oldTargetData, TargetData newTargetData, TargetChange change, long resumeTokenMaxAgeMS) {
		if (newTargetData.resumeToken().isEmpty()) {
			return false;
		}
		if (oldTargetData.resumeToken().isEmpty()) {
			return true;
		}
		long ageMicros = newTargetData.snapshotVersion().toMicros() - oldTargetData.snapshotVersion().toMicros();
		if (ageMicros >= TimeUnit.MILLISECONDS.toMicros(resumeTokenMaxAgeMS)) {
			return true;
		}
		return change.documentChangeCount() > 0;
	}

	private boolean shouldPersistTargetData(TargetData oldTargetData, TargetData newTargetData, TargetChange change) {
		return shouldPersistTargetData(oldTargetData, newTargetData, change, settings.resumeTokenMaxAgeMS());
	}

	/**
	 * Pins and unpins the documents views added and removed, and records the snapshot
	 * at which each view that is not from cache had no documents in limbo.
	 */
	public void notifyLocalViewChanges(List<LocalViewChanges> viewChanges) {
		persistence.runTransaction("Notify local view changes", READ_WRITE, () -> {
			for (LocalViewChanges viewChange: viewChanges) {
				int targetId = viewChange.targetId();
				localViewReferences.addReferences(viewChange.added(), targetId);
				for (DocumentKey key: viewChange.removed()) {
					persistence.getReferenceDelegate().removeReference(key);
				}
				localViewReferences.removeReferences(viewChange.removed(), targetId);

				if (!viewChange.fromCache()) {
					TargetData targetData = targetDataByTarget.get(targetId);
					if (targetData == null) {
						throw new IllegalStateException("Can't set limbo-free snapshot version for unknown target " + targetId);
					}
					// Not persisted: after a restart, the previous results are simply not reused
					targetDataByTarget.put(targetId, targetData.withLastLimboFreeSnapshotVersion(targetData.snapshotVersion()));
				}
			}
		});
	}

	/**
	 * @return the local view of the document; an invalid document if nothing is known about it.
	 */
	public Document readDocument(DocumentKey key) {
		return persistence.runTransaction("Read document", READ_ONLY, () -> localDocuments.getDocument(key));
	}

	/**
	 * Starts tracking a target, reusing its cached data from an earlier listen if there is any.
	 */
	public TargetData allocateTarget(Target target) {
		TargetData targetData = persistence.runTransaction("Allocate target", READ_WRITE, () -> {
			TargetData cached = targetCache.getTargetData(target);
			if (cached != null) {
				return cached;
			}
			TargetData allocated = new TargetData(target, targetIdGenerator.nextId(),
				persistence.getReferenceDelegate().getCurrentSequenceNumber(), QueryPurpose.LISTEN);
			targetCache.addTargetData(allocated);
			return allocated;
		});

		int targetId = targetData.targetId();
		if (!targetDataByTarget.containsKey(targetId)) {
			LOGGER.debug("Allocated target {} for {}", targetId, target);
			targetDataByTarget.put(targetId, targetData);
			targetIdByTarget.put(target, targetId);
		}
		return targetDataByTarget.get(targetId);
	}

	/**
	 * @return the data of the target, or null if it was never allocated.
	 */
	public @Nullable TargetData getTargetData(Target target) {
		Integer targetId = targetIdByTarget.get(target);
		if (targetId != null) {
			return targetDataByTarget.get(targetId);
		}
		return persistence.runTransaction("Get target data", READ_ONLY, () -> targetCache.getTargetData(target));
	}

	/**
	 * Stops tracking a target. Documents no longer referenced by anything are removed from the cache.
	 */
	public void releaseTarget(int targetId) {
		TargetData targetData = targetDataByTarget.get(targetId);
		if (targetData == null) {
			throw new IllegalStateException("Tried to release nonexistent target " + targetId);
		}
		SortedSet<DocumentKey> pinnedKeys = localViewReferences.removeReferencesForId(targetId);
		persistence.runTransaction("Release target", READ_WRITE, () -> {
			for (DocumentKey key: pinnedKeys) {
				persistence.getReferenceDelegate().removeReference(key);
			}
			persistence.getReferenceDelegate().removeTarget(targetData);
		});
		targetDataByTarget.remove(targetId);
		targetIdByTarget.remove(targetData.target());
		LOGGER.debug("Released target {}", targetId);
	}

	/**
	 * @param usePreviousResults whether the results of the last listen may be reused
	 */
	public QueryResult executeQuery(Query query, boolean usePreviousResults) {
		return persistence.runTransaction("Execute query", READ_ONLY, () -> {
			TargetData targetData = getTargetDataInTransaction(query.toTarget());
			SnapshotVersion lastLimboFreeSnapshotVersion = SnapshotVersion.NONE;
			Set<DocumentKey> remoteKeys = new TreeSet<>();
			if (targetData != null) {
				lastLimboFreeSnapshotVersion = targetData.lastLimboFreeSnapshotVersion();
				remoteKeys = targetCache.getMatchingKeysForTargetId(targetData.targetId());
			}
			Map<DocumentKey, Document> documents = queryEngine.getDocumentsMatchingQuery(query,
				usePreviousResults ? lastLimboFreeSnapshotVersion : SnapshotVersion.NONE,
				remoteKeys);
			return new QueryResult(documents, remoteKeys);
		});
	}

	private @Nullable TargetData getTargetDataInTransaction(Target target) {
		Integer targetId = targetIdByTarget.get(target);
		if (targetId != null) {
			return targetDataByTarget.get(targetId);
		}
		return targetCache.getTargetData(target);
	}

	/**
	 * @return the keys the backend last reported as matching the target.
	 */
	public SortedSet<DocumentKey> getRemoteDocumentKeys(int targetId) {
		return persistence.runTransaction("Get remote document keys", READ_ONLY,
			() -> targetCache.getMatchingKeysForTargetId(targetId));
	}

	public SnapshotVersion getLastRemoteSnapshotVersion() {
		return persistence.runTransaction("Get last remote snapshot version", READ_ONLY,
			() -> targetCache.getLastRemoteSnapshotVersion());
	}

	// Bundles

	/**
	 * @return true if a bundle with the same id, built at the same time or later, was already loaded.
	 */
	public boolean hasNewerBundle(BundleMetadata bundleMetadata) {
		return persistence.runTransaction("Has newer bundle", READ_ONLY, () -> {
			BundleMetadata cached = bundleCache.getBundleMetadata(bundleMetadata.bundleId());
			return cached != null && cached.createTime().compareTo(bundleMetadata.createTime()) >= 0;
		});
	}

	@Override
	public Map<DocumentKey, Document> applyBundledDocuments(Map<DocumentKey, MutableDocument> documents, String bundleId) {
		// A target holding every document of the bundle keeps them from being collected right away
		TargetData umbrellaTargetData = allocateTarget(newUmbrellaTarget(bundleId));
		int umbrellaTargetId = umbrellaTargetData.targetId();
		return persistence.runTransaction("Apply bundle documents", READ_WRITE, () -> {
			targetCache.removeMatchingKeys(targetCache.getMatchingKeysForTargetId(umbrellaTargetId), umbrellaTargetId);
			targetCache.addMatchingKeys(documents.keySet(), umbrellaTargetId);
			DocumentChangeResult result = populateDocumentChangeBuffer(documents);
			return localDocuments.getLocalViewOfDocuments(result.changedDocuments(), result.existenceChangedKeys());
		});
	}

	private static Target newUmbrellaTarget(String bundleId) {
		return Query.atPath(ResourcePath.fromString("__bundle__/docs/" + bundleId)).toTarget();
	}

	@Override
	public void saveBundle(BundleMetadata bundleMetadata) {
		persistence.runTransaction("Save bundle", READ_WRITE, () -> bundleCache.saveBundleMetadata(bundleMetadata));
	}

	/**
	 * Saves the query, and makes its documents the results of its target as of the bundle's read time,
	 * so a later listen to the query can resume from there.
	 */
	@Override
	public void saveNamedQuery(NamedQuery namedQuery, SortedSet<DocumentKey> documentKeys) {
		TargetData existingTargetData = allocateTarget(namedQuery.bundledQuery().toQuery().toTarget());
		int targetId = existingTargetData.targetId();
		TargetData newTargetData = persistence.runTransaction("Save named query", READ_WRITE, () -> {
			TargetData updated = null;
			if (namedQuery.readTime().compareTo(existingTargetData.snapshotVersion()) > 0) {
				updated = existingTargetData.withResumeToken(ByteString.EMPTY, namedQuery.readTime());
				targetCache.updateTargetData(updated);
				targetCache.removeMatchingKeys(targetCache.getMatchingKeysForTargetId(targetId), targetId);
				targetCache.addMatchingKeys(documentKeys, targetId);
			}
			bundleCache.saveNamedQuery(namedQuery);
			return updated;
		});
		if (newTargetData != null) {
			targetDataByTarget.put(targetId, newTargetData);
		}
	}

	public @Nullable NamedQuery getNamedQuery(String queryName) {
		return persistence.runTransaction("Get named query", READ_ONLY, () -> bundleCache.getNamedQuery(queryName));
	}

	// Indexes

	/**
	 * Makes the configured field indexes match <code>newFieldIndexes</code>,
	 * comparing indexes by collection group and segments only.
	 */
	public void configureFieldIndexes(List<FieldIndex> newFieldIndexes) {
		persistence.runTransaction("Configure indexes", READ_WRITE, () -> {
			SortedSet<FieldIndex> existing = new TreeSet<>(FieldIndex.SEMANTIC_COMPARATOR);
			existing.addAll(indexManager.getFieldIndexes());
			SortedSet<FieldIndex> wanted = new TreeSet<>(FieldIndex.SEMANTIC_COMPARATOR);
			wanted.addAll(newFieldIndexes);
			for (FieldIndex index: wanted) {
				if (!existing.contains(index)) {
					indexManager.addFieldIndex(index);
				}
			}
			for (FieldIndex index: existing) {
				if (!wanted.contains(index)) {
					indexManager.deleteFieldIndex(index);
				}
			}
		});
	}

	/**
	 * Adds index entries for up to {@link DocSyncSettings.Experimental#maxDocumentsToBackfill()} documents,
	 * visiting collection groups starting with the least recently updated.
	 *
	 * @return the number of documents processed
	 */
	public int backfillIndexes() {
		int maxDocumentsToProcess = settings.experimental().maxDocumentsToBackfill();
		return persistence.runTransaction("Backfill indexes", READ_WRITE_PRIMARY, () -> {
			Set<String> processedCollectionGroups = new HashSet<>();
			int documentsRemaining = maxDocumentsToProcess;
			while (documentsRemaining > 0) {
				String collectionGroup = indexManager.getNextCollectionGroupToUpdate();
				if (collectionGroup == null || !processedCollectionGroups.add(collectionGroup)) {
					break;
				}
				LOGGER.debug("Processing collection group {}", collectionGroup);
				documentsRemaining -= writeEntriesForCollectionGroup(collectionGroup, documentsRemaining);
			}
			return maxDocumentsToProcess - documentsRemaining;
		});
	}

	private int writeEntriesForCollectionGroup(String collectionGroup, int documentsRemaining) {
		IndexOffset existingOffset = indexManager.getMinOffset(collectionGroup);
		LocalDocumentsResult nextBatch = localDocuments.getNextDocuments(collectionGroup, existingOffset, documentsRemaining);
		indexManager.updateIndexEntries(nextBatch.documents());
		indexManager.updateCollectionGroup(collectionGroup, newOffset(existingOffset, nextBatch));
		return nextBatch.documents().size();
	}

	private static IndexOffset newOffset(IndexOffset existingOffset, LocalDocumentsResult lookupResult) {
		IndexOffset maxOffset = existingOffset;
		for (Document document: lookupResult.documents().values()) {
			IndexOffset offset = IndexOffset.fromDocument(document);
			if (offset.compareTo(maxOffset) > 0) {
				maxOffset = offset;
			}
		}
		return new IndexOffset(maxOffset.readTime(), maxOffset.documentKey(),
			Math.max(lookupResult.batchId(), existingOffset.largestBatchId()));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(LocalStore.class);
}
