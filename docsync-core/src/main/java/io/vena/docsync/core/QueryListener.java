package io.vena.docsync.core;

import io.vena.docsync.EventListener;
import io.vena.docsync.exceptions.DocSyncException;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Decides which of a query's view snapshots one application listener gets to see,
 * according to its {@link ListenOptions}.
 */
public class QueryListener {
	private final Query query;
	private final ListenOptions options;
	private final EventListener<ViewSnapshot> listener;

	private boolean raisedInitialEvent = false;
	private OnlineState onlineState = OnlineState.UNKNOWN;
	private @Nullable ViewSnapshot snapshot;

	public QueryListener(Query query, ListenOptions options, EventListener<ViewSnapshot> listener) {
		this.query = query;
		this.options = options;
		this.listener = listener;
	}

	public Query query() {
		return query;
	}

	/**
	 * @return true if an event was raised
	 */
	public boolean onViewSnapshot(ViewSnapshot newSnapshot) {
		if (newSnapshot.changes().isEmpty() && !newSnapshot.didSyncStateChange()) {
			throw new IllegalArgumentException("A view snapshot must have changes or a sync state change");
		}

		boolean raisedEvent = false;
		if (!options.includeDocumentMetadataChanges()) {
			List<DocumentViewChange> documentChanges = new ArrayList<>();
			for (DocumentViewChange change: newSnapshot.changes()) {
				if (change.type() != DocumentViewChange.Type.METADATA) {
					documentChanges.add(change);
				}
			}
			newSnapshot = new ViewSnapshot(
				newSnapshot.query(),
				newSnapshot.documents(),
				newSnapshot.oldDocuments(),
				documentChanges,
				newSnapshot.isFromCache(),
				newSnapshot.mutatedKeys(),
				newSnapshot.didSyncStateChange(),
				true,
				newSnapshot.hasCachedResults());
		}

		if (!raisedInitialEvent) {
			if (shouldRaiseInitialEvent(newSnapshot, onlineState)) {
				raiseInitialEvent(newSnapshot);
				raisedEvent = true;
			}
		} else if (shouldRaiseEvent(newSnapshot)) {
			listener.onEvent(newSnapshot, null);
			raisedEvent = true;
		}

		snapshot = newSnapshot;
		return raisedEvent;
	}

	public void onError(DocSyncException error) {
		listener.onEvent(null, error);
	}

	/**
	 * A first snapshot held back while the client might be online is raised once it is known to be offline.
	 *
	 * @return true if an event was raised
	 */
	public boolean onOnlineStateChanged(OnlineState onlineState) {
		this.onlineState = onlineState;
		if (snapshot != null && !raisedInitialEvent && shouldRaiseInitialEvent(snapshot, onlineState)) {
			raiseInitialEvent(snapshot);
			return true;
		}
		return false;
	}

	private boolean shouldRaiseInitialEvent(ViewSnapshot snapshot, OnlineState onlineState) {
		if (!snapshot.isFromCache()) {
			return true;
		}

		boolean maybeOnline = onlineState != OnlineState.OFFLINE;
		if (options.waitForSyncWhenOnline() && maybeOnline) {
			return false;
		}

		// An empty result from cache is only worth showing if it was synced before or can't be improved on.
		return !snapshot.documents().isEmpty()
			|| snapshot.hasCachedResults()
			|| onlineState == OnlineState.OFFLINE;
	}

	private boolean shouldRaiseEvent(ViewSnapshot snapshot) {
		if (!snapshot.changes().isEmpty()) {
			return true;
		}

		boolean hasPendingWritesChanged = this.snapshot != null && this.snapshot.hasPendingWrites() != snapshot.hasPendingWrites();
		if (snapshot.didSyncStateChange() || hasPendingWritesChanged) {
			return options.includeQueryMetadataChanges();
		}

		return false;
	}

	private void raiseInitialEvent(ViewSnapshot snapshot) {
		ViewSnapshot initial = ViewSnapshot.fromInitialDocuments(
			snapshot.query(),
			snapshot.documents(),
			snapshot.mutatedKeys(),
			snapshot.isFromCache(),
			snapshot.excludesMetadataChanges(),
			snapshot.hasCachedResults());
		raisedInitialEvent = true;
		listener.onEvent(initial, null);
	}
}
