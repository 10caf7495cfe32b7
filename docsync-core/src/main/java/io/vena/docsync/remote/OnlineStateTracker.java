package io.vena.docsync.remote;

import io.vena.docsync.core.OnlineState;
import io.vena.docsync.util.AsyncQueue;
import io.vena.docsync.util.AsyncQueue.DelayedTask;
import io.vena.docsync.util.AsyncQueue.TimerId;
import io.vena.docsync.util.Listener;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether the client is {@link OnlineState#ONLINE online} from the health of the watch stream.
 *
 * <p>
 * Starting in {@link OnlineState#UNKNOWN}, the client goes offline if the watch stream fails
 * <code>maxWatchStreamFailures</code> times in a row, or takes longer than
 * <code>onlineStateTimeoutMS</code> to produce a first response.
 * Listeners then raise events from cache instead of waiting.
 */
final class OnlineStateTracker {
	private final AsyncQueue asyncQueue;
	private final Listener<OnlineState> onlineStateCallback;
	private final int maxWatchStreamFailures;
	private final long onlineStateTimeoutMS;

	private OnlineState state = OnlineState.UNKNOWN;
	private int watchStreamFailures = 0;
	private @Nullable DelayedTask onlineStateTimer;

	/**
	 * The degraded-connectivity warning is logged once; later occurrences are logged at debug.
	 */
	private boolean shouldWarnClientIsOffline = true;

	OnlineStateTracker(AsyncQueue asyncQueue, int maxWatchStreamFailures, long onlineStateTimeoutMS, Listener<OnlineState> onlineStateCallback) {
		this.asyncQueue = asyncQueue;
		this.maxWatchStreamFailures = maxWatchStreamFailures;
		this.onlineStateTimeoutMS = onlineStateTimeoutMS;
		this.onlineStateCallback = onlineStateCallback;
	}

	OnlineState state() {
		return state;
	}

	/**
	 * Called each time the watch stream is started, while the state is not yet known.
	 */
	void handleWatchStreamStart() {
		if (watchStreamFailures == 0) {
			setAndBroadcastState(OnlineState.UNKNOWN);

			if (onlineStateTimer != null) {
				throw new IllegalStateException("Online state timer already running");
			}
			onlineStateTimer = asyncQueue.enqueueAfterDelay(TimerId.ONLINE_STATE_TIMEOUT, onlineStateTimeoutMS, () -> {
				onlineStateTimer = null;
				if (state != OnlineState.UNKNOWN) {
					throw new IllegalStateException("Online state timer fired in state " + state);
				}
				logClientOfflineWarningIfNecessary("Backend didn't respond within " + onlineStateTimeoutMS / 1000 + " seconds");
				setAndBroadcastState(OnlineState.OFFLINE);
			});
		}
	}

	void handleWatchStreamFailure(Status status) {
		if (state == OnlineState.ONLINE) {
			// A stream that worked before gets another chance.
			setAndBroadcastState(OnlineState.UNKNOWN);
			if (watchStreamFailures != 0 || onlineStateTimer != null) {
				throw new IllegalStateException("Watch stream failure tracking was not reset while online");
			}
		} else {
			watchStreamFailures++;
			if (watchStreamFailures >= maxWatchStreamFailures) {
				clearOnlineStateTimer();
				logClientOfflineWarningIfNecessary("Connection failed " + maxWatchStreamFailures + " times. Most recent error: " + status);
				setAndBroadcastState(OnlineState.OFFLINE);
			}
		}
	}

	/**
	 * Sets the state directly: ONLINE on a watch response, OFFLINE when the network is disabled,
	 * UNKNOWN when there is nothing to listen to.
	 */
	void updateState(OnlineState newState) {
		clearOnlineStateTimer();
		watchStreamFailures = 0;

		if (newState == OnlineState.ONLINE) {
			shouldWarnClientIsOffline = false;
		}
		setAndBroadcastState(newState);
	}

	private void setAndBroadcastState(OnlineState newState) {
		if (newState != state) {
			LOGGER.debug("Online state {} -> {}", state, newState);
			state = newState;
			onlineStateCallback.onValue(newState);
		}
	}

	private void logClientOfflineWarningIfNecessary(String reason) {
		String message = "Could not reach the backend. " + reason
			+ ". The client will operate in offline mode until it is able to connect.";
		if (shouldWarnClientIsOffline) {
			LOGGER.warn(message);
			shouldWarnClientIsOffline = false;
		} else {
			LOGGER.debug(message);
		}
	}

	private void clearOnlineStateTimer() {
		if (onlineStateTimer != null) {
			onlineStateTimer.cancel();
			onlineStateTimer = null;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(OnlineStateTracker.class);
}
