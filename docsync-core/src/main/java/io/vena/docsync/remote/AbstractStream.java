package io.vena.docsync.remote;

import io.vena.docsync.DocSyncSettings;
import io.vena.docsync.exceptions.DocSyncException.Code;
import io.vena.docsync.util.AsyncQueue;
import io.vena.docsync.util.AsyncQueue.DelayedTask;
import io.vena.docsync.util.AsyncQueue.TimerId;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A stream to the backend that can be started, stopped and restarted any number of times,
 * reconnecting after errors with exponential backoff.
 *
 * <p>
 * All methods must be called on the {@link AsyncQueue}. Transport callbacks arrive on other
 * threads, so they are re-dispatched onto the queue, tagged with the value of
 * {@link #closeCount} when the underlying call was opened. Each close increments the count,
 * so callbacks belonging to an earlier call are dropped rather than misattributed to the
 * current one.
 *
 * <pre>
 * INITIAL -start-> STARTING -open-> OPEN -healthy-> HEALTHY
 *    ^                |               |                |
 *    |                +------error----+----------------+--> ERROR -start-> BACKOFF -timer-> STARTING
 *    +---stop or idle-------------------------------------------------------------------------+
 * </pre>
 *
 * @param <ReqT> the requests sent on the stream
 * @param <RespT> the responses received
 * @param <CallbackT> the listener notified of stream events
 */
public abstract class AbstractStream<ReqT, RespT, CallbackT extends AbstractStream.StreamCallback> {
	/**
	 * Notified on the async queue.
	 */
	public interface StreamCallback {
		void onOpen();

		/**
		 * @param status OK if the stream was closed on purpose
		 */
		void onClose(Status status);
	}

	public enum State {
		/**
		 * Not started, or stopped cleanly. {@link #start()} opens the stream right away.
		 */
		INITIAL,

		/**
		 * Credentials are being fetched or the transport is connecting.
		 */
		STARTING,

		OPEN,

		/**
		 * Open long enough that a later error is probably not caused by this client.
		 */
		HEALTHY,

		/**
		 * Closed by an error. {@link #start()} waits for the backoff delay first.
		 */
		ERROR,

		/**
		 * Waiting for the backoff timer before reconnecting.
		 */
		BACKOFF,
	}

	protected final Datastore datastore;
	protected final AsyncQueue asyncQueue;
	protected final CallbackT listener;
	final ExponentialBackoff backoff;

	private final String streamName;
	private final TimerId idleTimerId;
	private final DocSyncSettings settings;

	private State state = State.INITIAL;
	private long closeCount = 0;
	private @Nullable ConnectionStream<ReqT> call;
	private @Nullable DelayedTask idleTimer;
	private @Nullable DelayedTask healthCheck;

	AbstractStream(Datastore datastore, String streamName, TimerId connectionTimerId, TimerId idleTimerId, CallbackT listener) {
		this.datastore = datastore;
		this.asyncQueue = datastore.asyncQueue();
		this.settings = datastore.settings();
		this.streamName = streamName;
		this.idleTimerId = idleTimerId;
		this.listener = listener;
		DocSyncSettings.Backoff backoffSettings = settings.backoff();
		this.backoff = new ExponentialBackoff(asyncQueue, connectionTimerId,
			backoffSettings.initialDelayMS(), backoffSettings.backoffFactor(), backoffSettings.maxDelayMS(),
			backoffSettings.jitterFactor(), settings.testing().jitter());
	}

	public State state() {
		asyncQueue.verifyIsCurrentThread();
		return state;
	}

	/**
	 * @return true from {@link #start()} until the stream is closed, including while backing off
	 */
	public boolean isStarted() {
		asyncQueue.verifyIsCurrentThread();
		return state == State.STARTING || state == State.BACKOFF || isOpen();
	}

	/**
	 * @return true if requests can be sent
	 */
	public boolean isOpen() {
		asyncQueue.verifyIsCurrentThread();
		return state == State.OPEN || state == State.HEALTHY;
	}

	public void start() {
		asyncQueue.verifyIsCurrentThread();
		if (state == State.ERROR) {
			performBackoff();
			return;
		}
		if (state != State.INITIAL) {
			throw new IllegalStateException("Starting " + streamName + " stream in state " + state);
		}

		long generation = closeCount;
		state = State.STARTING;
		LOGGER.debug("Starting {} stream", streamName);
		datastore.fetchCredentials().whenComplete((credentials, error) -> asyncQueue.enqueueAndForget(() -> {
			if (generation != closeCount) {
				LOGGER.debug("Ignoring credentials for {} stream closed in the meantime", streamName);
				return;
			}
			if (error != null) {
				LOGGER.debug("Unable to fetch credentials for {} stream", streamName, error);
				handleServerClose(Status.fromThrowable(error));
				return;
			}
			call = startCall(credentials, new CallbackObserver(generation));
		}));
	}

	/**
	 * Closes the stream cleanly. The next {@link #start()} opens it immediately.
	 */
	public void stop() {
		asyncQueue.verifyIsCurrentThread();
		if (isStarted()) {
			close(State.INITIAL, Status.OK);
		}
	}

	/**
	 * After an error, lets the next {@link #start()} reconnect without waiting.
	 */
	public void inhibitBackoff() {
		asyncQueue.verifyIsCurrentThread();
		if (isStarted()) {
			throw new IllegalStateException("Can only inhibit backoff of a stopped stream");
		}
		state = State.INITIAL;
		backoff.reset();
	}

	/**
	 * Arms the idle timer, which closes the stream cleanly unless a request is sent first.
	 */
	public void markIdle() {
		if (isOpen() && idleTimer == null) {
			idleTimer = asyncQueue.enqueueAfterDelay(idleTimerId, settings.idleTimeoutMS(), this::handleIdleCloseTimer);
		}
	}

	private void handleIdleCloseTimer() {
		idleTimer = null;
		if (isOpen()) {
			LOGGER.debug("Closing idle {} stream", streamName);
			close(State.INITIAL, Status.OK);
		}
	}

	protected void writeRequest(ReqT request) {
		asyncQueue.verifyIsCurrentThread();
		LOGGER.trace("{} stream sending {}", streamName, request);
		cancelIdleCheck();
		if (call == null) {
			throw new IllegalStateException("Writing to " + streamName + " stream that is not open");
		}
		call.send(request);
	}

	/**
	 * @param finalState INITIAL for an intentional close, ERROR otherwise
	 */
	private void close(State finalState, Status status) {
		if (!isStarted()) {
			throw new IllegalStateException("Closing " + streamName + " stream that is not started");
		}
		if (finalState != State.ERROR && !status.isOk()) {
			throw new IllegalStateException("Can't close " + streamName + " stream cleanly with an error: " + status);
		}

		cancelIdleCheck();
		cancelHealthCheck();
		backoff.cancel();

		// Drops callbacks from the call being closed.
		closeCount++;

		Code code = status.code();
		if (code == Code.OK) {
			backoff.reset();
		} else if (code == Code.RESOURCE_EXHAUSTED) {
			LOGGER.debug("{} stream exhausted its quota; backing off the maximum delay", streamName);
			backoff.resetToMax();
		} else if (code == Code.UNAUTHENTICATED) {
			datastore.invalidateTokens();
		}

		if (finalState != State.ERROR) {
			tearDown();
		}

		if (call != null) {
			call.close();
			call = null;
		}

		LOGGER.debug("{} stream closed in state {} with {}", streamName, state, status);
		state = finalState;
		listener.onClose(status);
	}

	/**
	 * Last chance to send requests on a stream being closed cleanly.
	 */
	protected void tearDown() {
	}

	protected abstract ConnectionStream<ReqT> startCall(CallCredentials credentials, StreamObserver<RespT> observer);

	/**
	 * Handles one response from the backend, on the async queue.
	 */
	protected abstract void onNext(RespT response);

	private void performBackoff() {
		if (state != State.ERROR) {
			throw new IllegalStateException("Backing off " + streamName + " stream in state " + state);
		}
		state = State.BACKOFF;
		backoff.backoffAndRun(() -> {
			if (state != State.BACKOFF) {
				throw new IllegalStateException("Backoff of " + streamName + " stream elapsed in state " + state);
			}
			state = State.INITIAL;
			start();
		});
	}

	private void onOpen() {
		state = State.OPEN;
		LOGGER.debug("{} stream is open", streamName);
		healthCheck = asyncQueue.enqueueAfterDelay(TimerId.HEALTH_CHECK_TIMEOUT, settings.healthCheckTimeoutMS(), () -> {
			healthCheck = null;
			if (isOpen()) {
				state = State.HEALTHY;
			}
		});
		listener.onOpen();
	}

	void handleServerClose(Status status) {
		if (!isStarted()) {
			throw new IllegalStateException("Server closed " + streamName + " stream that is not started");
		}
		if (status.isOk()) {
			LOGGER.debug("{} stream closed by the backend", streamName);
		} else {
			LOGGER.debug("{} stream failed: {}", streamName, status);
		}
		close(State.ERROR, status);
	}

	private void cancelIdleCheck() {
		if (idleTimer != null) {
			idleTimer.cancel();
			idleTimer = null;
		}
	}

	private void cancelHealthCheck() {
		if (healthCheck != null) {
			healthCheck.cancel();
			healthCheck = null;
		}
	}

	/**
	 * Moves transport callbacks onto the async queue, dropping those for a call that has since been closed.
	 */
	private final class CallbackObserver implements StreamObserver<RespT> {
		private final long generation;

		CallbackObserver(long generation) {
			this.generation = generation;
		}

		@Override
		public void onOpen() {
			dispatch("open", AbstractStream.this::onOpen);
		}

		@Override
		public void onMessage(RespT response) {
			dispatch("message", () -> {
				LOGGER.trace("{} stream received {}", streamName, response);
				onNext(response);
			});
		}

		@Override
		public void onClose(Status status) {
			dispatch("close", () -> handleServerClose(status));
		}

		private void dispatch(String event, Runnable task) {
			asyncQueue.enqueueAndForget(() -> {
				if (generation == closeCount) {
					task.run();
				} else {
					LOGGER.trace("Dropping {} from a closed {} stream", event, streamName);
				}
			});
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AbstractStream.class);
}
