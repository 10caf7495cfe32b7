package io.vena.docsync.core;

import io.vena.docsync.EventListener;
import io.vena.docsync.remote.Status;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans out the sync engine's view snapshots to the application listeners of each query,
 * listening to a query only while at least one listener wants it.
 *
 * <p>
 * All methods must be called on the async queue.
 */
public final class EventManager implements SyncEngine.SyncEngineCallback {
	private static final class QueryListenersInfo {
		private final List<QueryListener> listeners = new ArrayList<>();
		private @Nullable ViewSnapshot viewSnapshot;
		private int targetId;
	}

	private final SyncEngine syncEngine;
	private final Map<Query, QueryListenersInfo> queries = new HashMap<>();
	private final Set<EventListener<Void>> snapshotsInSyncListeners = new LinkedHashSet<>();
	private OnlineState onlineState = OnlineState.UNKNOWN;

	public EventManager(SyncEngine syncEngine) {
		this.syncEngine = syncEngine;
		syncEngine.setCallback(this);
	}

	/**
	 * Starts listening to the query if this is its first listener. A later listener gets the
	 * latest snapshot right away.
	 *
	 * @return the target id of the query
	 */
	public int addQueryListener(QueryListener queryListener) {
		Query query = queryListener.query();

		QueryListenersInfo queryInfo = queries.get(query);
		boolean firstListen = queryInfo == null;
		if (firstListen) {
			queryInfo = new QueryListenersInfo();
			queries.put(query, queryInfo);
		}

		queryInfo.listeners.add(queryListener);

		boolean raisedEvent = queryListener.onOnlineStateChanged(onlineState);
		if (raisedEvent) {
			throw new IllegalStateException("A new listener raised an event without a snapshot");
		}

		if (queryInfo.viewSnapshot != null) {
			raisedEvent = queryListener.onViewSnapshot(queryInfo.viewSnapshot);
			if (raisedEvent) {
				raiseSnapshotsInSyncEvent();
			}
		}

		if (firstListen) {
			LOGGER.debug("First listener for {}", query);
			queryInfo.targetId = syncEngine.listen(query, true);
		}
		return queryInfo.targetId;
	}

	/**
	 * Stops listening to the query if this was its last listener. Removing a listener
	 * twice, or after its query failed, has no effect.
	 */
	public void removeQueryListener(QueryListener listener) {
		Query query = listener.query();
		QueryListenersInfo queryInfo = queries.get(query);
		if (queryInfo == null) {
			return;
		}
		queryInfo.listeners.remove(listener);
		if (queryInfo.listeners.isEmpty()) {
			LOGGER.debug("Last listener removed for {}", query);
			queries.remove(query);
			syncEngine.stopListening(query, true);
		}
	}

	@Override
	public void onViewSnapshots(List<ViewSnapshot> snapshotList) {
		boolean raisedEvent = false;
		for (ViewSnapshot viewSnapshot: snapshotList) {
			QueryListenersInfo info = queries.get(viewSnapshot.query());
			if (info != null) {
				for (QueryListener listener: new ArrayList<>(info.listeners)) {
					if (listener.onViewSnapshot(viewSnapshot)) {
						raisedEvent = true;
					}
				}
				info.viewSnapshot = viewSnapshot;
			}
		}
		if (raisedEvent) {
			raiseSnapshotsInSyncEvent();
		}
	}

	/**
	 * The query can't be listened to; its listeners get the error and are removed.
	 */
	@Override
	public void onError(Query query, Status error) {
		QueryListenersInfo info = queries.remove(query);
		if (info != null) {
			for (QueryListener listener: info.listeners) {
				listener.onError(error.asException());
			}
		}
	}

	@Override
	public void handleOnlineStateChange(OnlineState onlineState) {
		this.onlineState = onlineState;
		boolean raisedEvent = false;
		for (QueryListenersInfo info: queries.values()) {
			for (QueryListener listener: info.listeners) {
				if (listener.onOnlineStateChanged(onlineState)) {
					raisedEvent = true;
				}
			}
		}
		if (raisedEvent) {
			raiseSnapshotsInSyncEvent();
		}
	}

	/**
	 * The listener is called right away, then after each round of snapshots raised together.
	 */
	public void addSnapshotsInSyncListener(EventListener<Void> listener) {
		snapshotsInSyncListeners.add(listener);
		listener.onEvent(null, null);
	}

	public void removeSnapshotsInSyncListener(EventListener<Void> listener) {
		snapshotsInSyncListeners.remove(listener);
	}

	private void raiseSnapshotsInSyncEvent() {
		for (EventListener<Void> listener: snapshotsInSyncListeners) {
			listener.onEvent(null, null);
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EventManager.class);
}
