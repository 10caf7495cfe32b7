package io.vena.docsync.core;

import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.DocumentSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The results of a query at one point in time, with the changes since the previous snapshot.
 *
 * @param oldDocuments the results of the previous snapshot
 * @param changes the differences between <code>oldDocuments</code> and <code>documents</code>,
 *                removals first, then additions, then modifications, each in query order
 * @param isFromCache true if the results may not match the backend's yet
 * @param mutatedKeys the keys of the results with pending writes
 * @param didSyncStateChange true if <code>isFromCache</code> changed since the previous snapshot
 * @param excludesMetadataChanges true if changes that only affect metadata were left out
 * @param hasCachedResults true if the target had a resume token, so results were previously synced
 */
public record ViewSnapshot(
	Query query,
	DocumentSet documents,
	DocumentSet oldDocuments,
	List<DocumentViewChange> changes,
	boolean isFromCache,
	Set<DocumentKey> mutatedKeys,
	boolean didSyncStateChange,
	boolean excludesMetadataChanges,
	boolean hasCachedResults
) {
	public enum SyncState {
		NONE,
		LOCAL,
		SYNCED,
	}

	public ViewSnapshot {
		changes = List.copyOf(changes);
		mutatedKeys = Set.copyOf(mutatedKeys);
	}

	/**
	 * A first snapshot, in which every document is an addition.
	 */
	public static ViewSnapshot fromInitialDocuments(Query query, DocumentSet documents, Set<DocumentKey> mutatedKeys, boolean fromCache, boolean excludesMetadataChanges, boolean hasCachedResults) {
		List<DocumentViewChange> viewChanges = new ArrayList<>();
		for (Document document: documents) {
			viewChanges.add(DocumentViewChange.create(DocumentViewChange.Type.ADDED, document));
		}
		return new ViewSnapshot(query, documents, DocumentSet.emptySet(query.comparator()), viewChanges,
			fromCache, mutatedKeys, true, excludesMetadataChanges, hasCachedResults);
	}

	public boolean hasPendingWrites() {
		return !mutatedKeys.isEmpty();
	}

	@Override
	public String toString() {
		return "ViewSnapshot(" + query + ", " + documents + ", " + oldDocuments + ", " + changes
			+ ", isFromCache=" + isFromCache + ", mutatedKeys=" + mutatedKeys.size()
			+ ", didSyncStateChange=" + didSyncStateChange
			+ ", excludesMetadataChanges=" + excludesMetadataChanges
			+ ", hasCachedResults=" + hasCachedResults + ")";
	}
}
