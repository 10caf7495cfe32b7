package io.vena.docsync.core;

import io.vena.docsync.core.ViewSnapshot.SyncState;
import io.vena.docsync.local.QueryResult;
import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.DocumentSet;
import io.vena.docsync.remote.TargetChange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.pcollections.TreePSet;

import static io.vena.docsync.core.Query.LimitType.LIMIT_TO_FIRST;
import static io.vena.docsync.core.Query.LimitType.LIMIT_TO_LAST;

/**
 * The results of one query as the application sees them: the documents the backend says
 * match, combined with the local view of pending writes.
 *
 * <p>
 * Changes are applied in two steps. {@link #computeDocChanges} works out the new result set
 * without modifying the view; for a limit query it may report that documents just outside the
 * old results are needed to refill it. {@link #applyChanges} then commits the result and
 * produces the snapshot to raise.
 */
public class View {
	/**
	 * The outcome of {@link #computeDocChanges}, not yet applied.
	 */
	public static final class DocumentChanges {
		final DocumentSet documentSet;
		final DocumentViewChangeSet changeSet;
		final TreePSet<DocumentKey> mutatedKeys;
		private final boolean needsRefill;

		private DocumentChanges(DocumentSet documentSet, DocumentViewChangeSet changeSet, TreePSet<DocumentKey> mutatedKeys, boolean needsRefill) {
			this.documentSet = documentSet;
			this.changeSet = changeSet;
			this.mutatedKeys = mutatedKeys;
			this.needsRefill = needsRefill;
		}

		/**
		 * A limit query lost documents, or one moved past the limit, so documents that were
		 * outside the old results may belong in the new ones. The caller must run the query
		 * against the local cache and call {@link #computeDocChanges} again with this object.
		 */
		public boolean needsRefill() {
			return needsRefill;
		}
	}

	private final Query query;
	private SyncState syncState;

	/**
	 * Whether the backend has said this target is consistent. Reset when going offline.
	 */
	private boolean current;

	private DocumentSet documentSet;

	/**
	 * The keys the backend says match the query, whether or not pending writes agree.
	 */
	private TreePSet<DocumentKey> syncedDocuments;

	/**
	 * Documents in the results that the backend did not report, with no pending writes to explain them.
	 */
	private TreePSet<DocumentKey> limboDocuments;

	private TreePSet<DocumentKey> mutatedKeys;

	public View(Query query, Set<DocumentKey> remoteDocuments) {
		this.query = query;
		this.syncState = SyncState.NONE;
		this.documentSet = DocumentSet.emptySet(query.comparator());
		this.syncedDocuments = TreePSet.<DocumentKey>empty().plusAll(remoteDocuments);
		this.limboDocuments = TreePSet.empty();
		this.mutatedKeys = TreePSet.empty();
	}

	public Query query() {
		return query;
	}

	public SyncState syncState() {
		return syncState;
	}

	public Set<DocumentKey> limboDocuments() {
		return limboDocuments;
	}

	public Set<DocumentKey> syncedDocuments() {
		return syncedDocuments;
	}

	public DocumentChanges computeDocChanges(Map<DocumentKey, Document> docChanges) {
		return computeDocChanges(docChanges, null);
	}

	/**
	 * @param docChanges new local views of documents, which may or may not match the query
	 * @param previousChanges the result of an earlier call that needed a refill, to build upon
	 */
	public DocumentChanges computeDocChanges(Map<DocumentKey, Document> docChanges, @Nullable DocumentChanges previousChanges) {
		DocumentViewChangeSet changeSet = previousChanges != null ? previousChanges.changeSet : new DocumentViewChangeSet();
		DocumentSet oldDocumentSet = previousChanges != null ? previousChanges.documentSet : documentSet;
		TreePSet<DocumentKey> newMutatedKeys = previousChanges != null ? previousChanges.mutatedKeys : mutatedKeys;
		DocumentSet newDocumentSet = oldDocumentSet;
		boolean needsRefill = false;

		// Documents moving past these boundaries may have been replaced by ones outside the old results.
		Document lastDocInLimit = query.hasLimit() && query.limitType() == LIMIT_TO_FIRST && oldDocumentSet.size() == query.limit()
			? oldDocumentSet.getLastDocument()
			: null;
		Document firstDocInLimit = query.hasLimit() && query.limitType() == LIMIT_TO_LAST && oldDocumentSet.size() == query.limit()
			? oldDocumentSet.getFirstDocument()
			: null;

		for (Map.Entry<DocumentKey, Document> entry: docChanges.entrySet()) {
			DocumentKey key = entry.getKey();
			Document oldDoc = oldDocumentSet.getDocument(key);
			Document newDoc = query.matches(entry.getValue()) ? entry.getValue() : null;

			boolean oldDocHadPendingMutations = oldDoc != null && mutatedKeys.contains(oldDoc.key());

			// A committed mutation still counts as pending until the watch stream catches up,
			// but only for documents that were already known to have one.
			boolean newDocHasPendingMutations = newDoc != null
				&& (newDoc.hasLocalMutations() || (mutatedKeys.contains(newDoc.key()) && newDoc.hasCommittedMutations()));

			boolean changeApplied = false;
			if (oldDoc != null && newDoc != null) {
				boolean docsEqual = oldDoc.data().equals(newDoc.data());
				if (!docsEqual) {
					if (!shouldWaitForSyncedDocument(oldDoc, newDoc)) {
						changeSet.addChange(DocumentViewChange.create(DocumentViewChange.Type.MODIFIED, newDoc));
						changeApplied = true;

						if ((lastDocInLimit != null && query.comparator().compare(newDoc, lastDocInLimit) > 0)
							|| (firstDocInLimit != null && query.comparator().compare(newDoc, firstDocInLimit) < 0)) {
							needsRefill = true;
						}
					}
				} else if (oldDocHadPendingMutations != newDocHasPendingMutations) {
					changeSet.addChange(DocumentViewChange.create(DocumentViewChange.Type.METADATA, newDoc));
					changeApplied = true;
				}
			} else if (oldDoc == null && newDoc != null) {
				changeSet.addChange(DocumentViewChange.create(DocumentViewChange.Type.ADDED, newDoc));
				changeApplied = true;
			} else if (oldDoc != null) {
				changeSet.addChange(DocumentViewChange.create(DocumentViewChange.Type.REMOVED, oldDoc));
				changeApplied = true;
				if (lastDocInLimit != null || firstDocInLimit != null) {
					needsRefill = true;
				}
			}

			if (changeApplied) {
				if (newDoc != null) {
					newDocumentSet = newDocumentSet.add(newDoc);
					if (newDoc.hasLocalMutations()) {
						newMutatedKeys = newMutatedKeys.plus(newDoc.key());
					} else {
						newMutatedKeys = newMutatedKeys.minus(newDoc.key());
					}
				} else {
					newDocumentSet = newDocumentSet.remove(key);
					newMutatedKeys = newMutatedKeys.minus(key);
				}
			}
		}

		// Drop documents beyond the limit.
		if (query.hasLimit()) {
			for (long i = newDocumentSet.size() - query.limit(); i > 0; --i) {
				Document oldDoc = query.limitType() == LIMIT_TO_FIRST
					? newDocumentSet.getLastDocument()
					: newDocumentSet.getFirstDocument();
				newDocumentSet = newDocumentSet.remove(oldDoc.key());
				newMutatedKeys = newMutatedKeys.minus(oldDoc.key());
				changeSet.addChange(DocumentViewChange.create(DocumentViewChange.Type.REMOVED, oldDoc));
			}
		}

		if (needsRefill && previousChanges != null) {
			throw new IllegalStateException("View was refilled using documents that themselves needed refilling");
		}

		return new DocumentChanges(newDocumentSet, changeSet, newMutatedKeys, needsRefill);
	}

	/**
	 * Holds back a document whose write was acknowledged, until the watch stream sends the
	 * version containing it, so the view doesn't flicker back to the old contents.
	 */
	private boolean shouldWaitForSyncedDocument(Document oldDoc, Document newDoc) {
		return oldDoc.hasLocalMutations() && newDoc.hasCommittedMutations() && !newDoc.hasLocalMutations();
	}

	public ViewChange applyChanges(DocumentChanges docChanges) {
		return applyChanges(docChanges, true, null, false);
	}

	public ViewChange applyChanges(DocumentChanges docChanges, @Nullable TargetChange targetChange) {
		return applyChanges(docChanges, true, targetChange, false);
	}

	/**
	 * @param limboResolutionEnabled false if another client resolves limbo documents, so none are reported
	 * @param targetChange the backend's change to the target, if any
	 * @param targetIsPendingReset true if the target is about to be re-listened after an existence
	 *                             filter mismatch, so its results can't be considered synced
	 * @return the snapshot to raise, which is null if nothing visible changed,
	 * and the documents entering or leaving limbo
	 */
	public ViewChange applyChanges(DocumentChanges docChanges, boolean limboResolutionEnabled, @Nullable TargetChange targetChange, boolean targetIsPendingReset) {
		if (docChanges.needsRefill) {
			throw new IllegalStateException("Cannot apply changes that need a refill");
		}
		DocumentSet oldDocumentSet = documentSet;
		documentSet = docChanges.documentSet;
		mutatedKeys = docChanges.mutatedKeys;

		List<DocumentViewChange> viewChanges = docChanges.changeSet.getChanges();
		viewChanges.sort((first, second) -> {
			int typeComparison = Integer.compare(changeTypeOrder(first), changeTypeOrder(second));
			if (typeComparison != 0) {
				return typeComparison;
			}
			return query.comparator().compare(first.document(), second.document());
		});

		applyTargetChange(targetChange);
		List<LimboDocumentChange> limboDocumentChanges = limboResolutionEnabled && !targetIsPendingReset
			? computeLimboDocuments()
			: Collections.emptyList();
		boolean synced = limboDocuments.isEmpty() && current && !targetIsPendingReset;
		SyncState newSyncState = synced ? SyncState.SYNCED : SyncState.LOCAL;
		boolean syncStateChanged = newSyncState != syncState;
		syncState = newSyncState;

		ViewSnapshot snapshot = null;
		if (!viewChanges.isEmpty() || syncStateChanged) {
			boolean fromCache = newSyncState == SyncState.LOCAL;
			boolean hasCachedResults = targetChange != null && !targetChange.resumeToken().isEmpty();
			snapshot = new ViewSnapshot(query, docChanges.documentSet, oldDocumentSet, viewChanges,
				fromCache, docChanges.mutatedKeys, syncStateChanged, false, hasCachedResults);
		}
		return new ViewChange(snapshot, limboDocumentChanges);
	}

	/**
	 * Going offline makes every result possibly stale, so a synced view becomes local again.
	 */
	public ViewChange applyOnlineStateChange(OnlineState onlineState) {
		if (current && onlineState == OnlineState.OFFLINE) {
			current = false;
			return applyChanges(new DocumentChanges(documentSet, new DocumentViewChangeSet(), mutatedKeys, false), false, null, false);
		} else {
			return new ViewChange(null, Collections.emptyList());
		}
	}

	/**
	 * Replaces the view's idea of what the backend has with what the local cache has, for a
	 * client that was not tracking the target's remote changes itself.
	 */
	public ViewChange synchronizeWithPersistedState(QueryResult queryResult) {
		syncedDocuments = TreePSet.<DocumentKey>empty().plusAll(queryResult.remoteKeys());
		limboDocuments = TreePSet.empty();
		DocumentChanges docChanges = computeDocChanges(queryResult.documents());
		return applyChanges(docChanges, true, null, false);
	}

	private void applyTargetChange(@Nullable TargetChange targetChange) {
		if (targetChange != null) {
			syncedDocuments = syncedDocuments.plusAll(targetChange.addedDocuments());
			syncedDocuments = syncedDocuments.plusAll(targetChange.modifiedDocuments());
			syncedDocuments = syncedDocuments.minusAll(targetChange.removedDocuments());
			current = targetChange.current();
		}
	}

	/**
	 * Recomputes which results are in limbo. Only meaningful once the target is current,
	 * since before then the backend may simply not have sent them yet.
	 */
	private List<LimboDocumentChange> computeLimboDocuments() {
		if (!current) {
			return Collections.emptyList();
		}

		TreePSet<DocumentKey> oldLimboDocuments = limboDocuments;
		TreePSet<DocumentKey> newLimboDocuments = TreePSet.empty();
		for (Document doc: documentSet) {
			if (shouldBeInLimbo(doc.key())) {
				newLimboDocuments = newLimboDocuments.plus(doc.key());
			}
		}
		limboDocuments = newLimboDocuments;

		List<LimboDocumentChange> changes = new ArrayList<>(oldLimboDocuments.size() + newLimboDocuments.size());
		for (DocumentKey key: oldLimboDocuments) {
			if (!newLimboDocuments.contains(key)) {
				changes.add(new LimboDocumentChange(LimboDocumentChange.Type.REMOVED, key));
			}
		}
		for (DocumentKey key: newLimboDocuments) {
			if (!oldLimboDocuments.contains(key)) {
				changes.add(new LimboDocumentChange(LimboDocumentChange.Type.ADDED, key));
			}
		}
		return changes;
	}

	private boolean shouldBeInLimbo(DocumentKey key) {
		if (syncedDocuments.contains(key)) {
			return false;
		}
		Document doc = documentSet.getDocument(key);
		if (doc == null) {
			return false;
		}
		// Pending writes explain why the backend doesn't report it.
		return !doc.hasLocalMutations();
	}

	private static int changeTypeOrder(DocumentViewChange change) {
		switch (change.type()) {
			case REMOVED:
				return 0;
			case ADDED:
				return 1;
			case MODIFIED:
			case METADATA:
				return 2;
			default:
				throw new IllegalArgumentException("Unknown change type: " + change.type());
		}
	}
}
