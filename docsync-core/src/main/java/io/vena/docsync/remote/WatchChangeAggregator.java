package io.vena.docsync.remote;

import io.vena.docsync.core.DocumentViewChange;
import io.vena.docsync.core.Target;
import io.vena.docsync.local.QueryPurpose;
import io.vena.docsync.local.TargetData;
import io.vena.docsync.model.DatabaseId;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.remote.ExistenceFilterMismatchListener.BloomFilterOutcome;
import io.vena.docsync.remote.ExistenceFilterMismatchListener.ExistenceFilterMismatchInfo;
import io.vena.docsync.remote.WatchChange.DocumentChange;
import io.vena.docsync.remote.WatchChange.ExistenceFilterWatchChange;
import io.vena.docsync.remote.WatchChange.WatchTargetChange;
import io.vena.docsync.remote.wire.BloomFilterMessage;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates {@link WatchChange}s until the watch stream reports a consistent snapshot,
 * then turns them into a {@link RemoteEvent}.
 */
public final class WatchChangeAggregator {
	/**
	 * What the aggregator needs to know about targets from the rest of the client.
	 */
	public interface TargetMetadataProvider {
		/**
		 * @return the keys the local cache believes match the target as of the last remote event
		 */
		Set<DocumentKey> getRemoteKeysForTarget(int targetId);

		/**
		 * @return null if the target is no longer active
		 */
		@Nullable TargetData getTargetDataForTarget(int targetId);
	}

	private enum BloomFilterApplicationStatus {
		SUCCESS,
		SKIPPED,
		FALSE_POSITIVE,
	}

	private final TargetMetadataProvider targetMetadataProvider;
	private final DatabaseId databaseId;
	private final ExistenceFilterMismatchListener mismatchListener;

	private final Map<Integer, TargetState> targetStates = new HashMap<>();
	private Map<DocumentKey, MutableDocument> pendingDocumentUpdates = new HashMap<>();
	private Map<DocumentKey, Set<Integer>> pendingDocumentTargetMapping = new HashMap<>();
	private Map<Integer, QueryPurpose> pendingTargetResets = new HashMap<>();

	public WatchChangeAggregator(TargetMetadataProvider targetMetadataProvider, DatabaseId databaseId, ExistenceFilterMismatchListener mismatchListener) {
		this.targetMetadataProvider = targetMetadataProvider;
		this.databaseId = databaseId;
		this.mismatchListener = mismatchListener;
	}

	public void handleDocumentChange(DocumentChange documentChange) {
		MutableDocument document = documentChange.newDocument();
		DocumentKey documentKey = documentChange.documentKey();

		for (int targetId: documentChange.updatedTargetIds()) {
			if (document != null && document.isFoundDocument()) {
				addDocumentToTarget(targetId, document);
			} else {
				removeDocumentFromTarget(targetId, documentKey, document);
			}
		}

		for (int targetId: documentChange.removedTargetIds()) {
			removeDocumentFromTarget(targetId, documentKey, document);
		}
	}

	public void handleTargetChange(WatchTargetChange targetChange) {
		for (int targetId: getTargetIds(targetChange)) {
			TargetState targetState = ensureTargetState(targetId);
			switch (targetChange.changeType()) {
				case NO_CHANGE:
					if (isActiveTarget(targetId)) {
						targetState.updateResumeToken(targetChange.resumeToken());
					}
					break;
				case ADDED:
					// A response to a listen request. Changes received before it belong to an
					// earlier listen of the same target and are discarded.
					targetState.recordTargetResponse();
					if (!targetState.isPending()) {
						targetState.clearPendingChanges();
					}
					targetState.updateResumeToken(targetChange.resumeToken());
					break;
				case REMOVED:
					targetState.recordTargetResponse();
					if (!targetState.isPending()) {
						removeTarget(targetId);
					}
					if (targetChange.cause() != null) {
						throw new IllegalStateException("Target removal with an error must be handled by the remote store");
					}
					break;
				case CURRENT:
					if (isActiveTarget(targetId)) {
						targetState.markCurrent();
						targetState.updateResumeToken(targetChange.resumeToken());
					}
					break;
				case RESET:
					if (isActiveTarget(targetId)) {
						resetTarget(targetId);
						targetState.updateResumeToken(targetChange.resumeToken());
					}
					break;
				default:
					throw new IllegalArgumentException("Unknown target change type: " + targetChange.changeType());
			}
		}
	}

	/**
	 * An empty id list means every active target.
	 */
	private Collection<Integer> getTargetIds(WatchTargetChange targetChange) {
		List<Integer> targetIds = targetChange.targetIds();
		if (!targetIds.isEmpty()) {
			return targetIds;
		}
		List<Integer> activeIds = new ArrayList<>();
		for (Integer targetId: targetStates.keySet()) {
			if (isActiveTarget(targetId)) {
				activeIds.add(targetId);
			}
		}
		return activeIds;
	}

	public void handleExistenceFilter(ExistenceFilterWatchChange watchChange) {
		int targetId = watchChange.targetId();
		int expectedCount = watchChange.count();

		TargetData targetData = queryDataForActiveTarget(targetId);
		if (targetData == null) {
			return;
		}

		Target target = targetData.target();
		if (target.isDocumentQuery()) {
			if (expectedCount == 0) {
				// The document was deleted. Recording it as missing at version zero lets a
				// later query for it resolve without waiting for the backend.
				DocumentKey key = DocumentKey.fromPath(target.path());
				removeDocumentFromTarget(targetId, key, MutableDocument.newNoDocument(key, SnapshotVersion.NONE));
			} else if (expectedCount != 1) {
				throw new IllegalStateException("Single document existence filter with count: " + expectedCount);
			}
			return;
		}

		int currentCount = getCurrentDocumentCountForTarget(targetId);
		if (currentCount == expectedCount) {
			return;
		}

		BloomFilter bloomFilter = parseBloomFilter(watchChange);
		BloomFilterApplicationStatus status = bloomFilter == null
			? BloomFilterApplicationStatus.SKIPPED
			: applyBloomFilter(bloomFilter, watchChange, currentCount);

		if (status != BloomFilterApplicationStatus.SUCCESS) {
			LOGGER.debug("Existence filter mismatch on target {}: local {}, backend {}; resetting", targetId, currentCount, expectedCount);
			resetTarget(targetId);
			QueryPurpose purpose = status == BloomFilterApplicationStatus.FALSE_POSITIVE
				? QueryPurpose.EXISTENCE_FILTER_MISMATCH_BLOOM
				: QueryPurpose.EXISTENCE_FILTER_MISMATCH;
			pendingTargetResets.put(targetId, purpose);
		}

		BloomFilterOutcome outcome;
		if (watchChange.bloomFilter() == null) {
			outcome = BloomFilterOutcome.ABSENT;
		} else if (bloomFilter == null) {
			outcome = BloomFilterOutcome.MALFORMED;
		} else if (status == BloomFilterApplicationStatus.SUCCESS) {
			outcome = BloomFilterOutcome.APPLIED;
		} else {
			outcome = BloomFilterOutcome.FALSE_POSITIVE;
		}
		mismatchListener.onExistenceFilterMismatch(new ExistenceFilterMismatchInfo(targetId, currentCount, expectedCount, outcome));
	}

	private @Nullable BloomFilter parseBloomFilter(ExistenceFilterWatchChange watchChange) {
		BloomFilterMessage message = watchChange.bloomFilter();
		if (message == null) {
			return null;
		}
		try {
			return BloomFilter.create(message.bitmap(), message.padding(), message.hashCount());
		} catch (BloomFilter.BloomFilterCreateException e) {
			LOGGER.warn("Ignoring malformed bloom filter for target {}", watchChange.targetId(), e);
			return null;
		}
	}

	private BloomFilterApplicationStatus applyBloomFilter(BloomFilter bloomFilter, ExistenceFilterWatchChange watchChange, int currentCount) {
		if (bloomFilter.bitCount() == 0) {
			return BloomFilterApplicationStatus.SKIPPED;
		}
		int removedDocumentCount = filterRemovedDocuments(bloomFilter, watchChange.targetId());
		if (currentCount - removedDocumentCount == watchChange.count()) {
			return BloomFilterApplicationStatus.SUCCESS;
		} else {
			return BloomFilterApplicationStatus.FALSE_POSITIVE;
		}
	}

	/**
	 * Removes from the target every key the bloom filter says the backend no longer has.
	 *
	 * @return the number of keys removed
	 */
	private int filterRemovedDocuments(BloomFilter bloomFilter, int targetId) {
		Set<DocumentKey> existingKeys = targetMetadataProvider.getRemoteKeysForTarget(targetId);
		int removalCount = 0;
		for (DocumentKey key: existingKeys) {
			if (!bloomFilter.mightContain(key.fullName(databaseId))) {
				removeDocumentFromTarget(targetId, key, null);
				removalCount++;
			}
		}
		return removalCount;
	}

	public RemoteEvent createRemoteEvent(SnapshotVersion snapshotVersion) {
		Map<Integer, TargetChange> targetChanges = new HashMap<>();

		for (Map.Entry<Integer, TargetState> entry: targetStates.entrySet()) {
			int targetId = entry.getKey();
			TargetState targetState = entry.getValue();

			TargetData targetData = queryDataForActiveTarget(targetId);
			if (targetData != null) {
				if (targetState.isCurrent() && targetData.target().isDocumentQuery()) {
					// A current document target with no document means the document is gone.
					DocumentKey key = DocumentKey.fromPath(targetData.target().path());
					if (pendingDocumentUpdates.get(key) == null && !targetContainsDocument(targetId, key)) {
						removeDocumentFromTarget(targetId, key, MutableDocument.newNoDocument(key, snapshotVersion));
					}
				}

				if (targetState.hasPendingChanges()) {
					targetChanges.put(targetId, targetState.toTargetChange());
					targetState.clearPendingChanges();
				}
			}
		}

		Set<DocumentKey> resolvedLimboDocuments = new HashSet<>();
		for (Map.Entry<DocumentKey, Set<Integer>> entry: pendingDocumentTargetMapping.entrySet()) {
			boolean isOnlyLimboTarget = true;
			for (int targetId: entry.getValue()) {
				TargetData targetData = queryDataForActiveTarget(targetId);
				if (targetData != null && targetData.purpose() != QueryPurpose.LIMBO_RESOLUTION) {
					isOnlyLimboTarget = false;
					break;
				}
			}
			if (isOnlyLimboTarget) {
				resolvedLimboDocuments.add(entry.getKey());
			}
		}

		for (MutableDocument document: pendingDocumentUpdates.values()) {
			document.setReadTime(snapshotVersion);
		}

		RemoteEvent remoteEvent = new RemoteEvent(snapshotVersion, targetChanges, pendingTargetResets, pendingDocumentUpdates, resolvedLimboDocuments);

		pendingDocumentUpdates = new HashMap<>();
		pendingDocumentTargetMapping = new HashMap<>();
		pendingTargetResets = new HashMap<>();

		return remoteEvent;
	}

	private void addDocumentToTarget(int targetId, MutableDocument document) {
		if (!isActiveTarget(targetId)) {
			return;
		}

		DocumentViewChange.Type changeType = targetContainsDocument(targetId, document.key())
			? DocumentViewChange.Type.MODIFIED
			: DocumentViewChange.Type.ADDED;

		TargetState targetState = ensureTargetState(targetId);
		targetState.addDocumentChange(document.key(), changeType);

		pendingDocumentUpdates.put(document.key(), document);
		ensureDocumentTargetMapping(document.key()).add(targetId);
	}

	/**
	 * @param updatedDocument recorded as the document's new state if not null
	 */
	private void removeDocumentFromTarget(int targetId, DocumentKey key, @Nullable MutableDocument updatedDocument) {
		if (!isActiveTarget(targetId)) {
			return;
		}

		TargetState targetState = ensureTargetState(targetId);
		if (targetContainsDocument(targetId, key)) {
			targetState.addDocumentChange(key, DocumentViewChange.Type.REMOVED);
		} else {
			// The document may have been added and removed within this snapshot.
			targetState.removeDocumentChange(key);
		}

		ensureDocumentTargetMapping(key).add(targetId);

		if (updatedDocument != null) {
			pendingDocumentUpdates.put(key, updatedDocument);
		}
	}

	void removeTarget(int targetId) {
		targetStates.remove(targetId);
	}

	/**
	 * Forgets what the backend told us about the target's documents, so the next snapshot
	 * removes every key the local cache had for it.
	 */
	private void resetTarget(int targetId) {
		if (!isActiveTarget(targetId)) {
			throw new IllegalStateException("Resetting inactive target " + targetId);
		}
		targetStates.put(targetId, new TargetState());

		for (DocumentKey key: targetMetadataProvider.getRemoteKeysForTarget(targetId)) {
			removeDocumentFromTarget(targetId, key, null);
		}
	}

	private int getCurrentDocumentCountForTarget(int targetId) {
		TargetState targetState = ensureTargetState(targetId);
		TargetChange targetChange = targetState.toTargetChange();
		return targetMetadataProvider.getRemoteKeysForTarget(targetId).size()
			+ targetChange.addedDocuments().size()
			- targetChange.removedDocuments().size();
	}

	/**
	 * Called when a listen or unlisten request is sent, so changes for the target are ignored
	 * until the backend acknowledges it.
	 */
	public void recordPendingTargetRequest(int targetId) {
		ensureTargetState(targetId).recordPendingTargetRequest();
	}

	private TargetState ensureTargetState(int targetId) {
		return targetStates.computeIfAbsent(targetId, id -> new TargetState());
	}

	private Set<Integer> ensureDocumentTargetMapping(DocumentKey key) {
		return pendingDocumentTargetMapping.computeIfAbsent(key, k -> new HashSet<>());
	}

	private boolean isActiveTarget(int targetId) {
		return queryDataForActiveTarget(targetId) != null;
	}

	private @Nullable TargetData queryDataForActiveTarget(int targetId) {
		TargetState targetState = targetStates.get(targetId);
		if (targetState != null && targetState.isPending()) {
			return null;
		}
		return targetMetadataProvider.getTargetDataForTarget(targetId);
	}

	private boolean targetContainsDocument(int targetId, DocumentKey key) {
		return targetMetadataProvider.getRemoteKeysForTarget(targetId).contains(key);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(WatchChangeAggregator.class);
}
