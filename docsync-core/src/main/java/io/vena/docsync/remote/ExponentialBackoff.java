package io.vena.docsync.remote;

import io.vena.docsync.util.AsyncQueue;
import io.vena.docsync.util.AsyncQueue.DelayedTask;
import io.vena.docsync.util.AsyncQueue.TimerId;
import java.util.function.DoubleSupplier;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Schedules retries on an {@link AsyncQueue} with exponentially growing, jittered delays.
 *
 * <p>
 * The first attempt after construction runs immediately, and the first after {@link #reset()}
 * waits the initial delay. Each later attempt waits for the current base delay, randomized by up to
 * <code>jitterFactor</code> of it in either direction,
 * less the time already elapsed since the previous attempt.
 * The base then grows by <code>backoffFactor</code>, between the initial and maximum delays.
 */
public final class ExponentialBackoff {
	private final AsyncQueue queue;
	private final TimerId timerId;
	private final long initialDelayMs;
	private final double backoffFactor;
	private final long maxDelayMs;
	private final double jitterFactor;
	private final DoubleSupplier jitter;

	private long currentBaseMs = 0;
	private long lastAttemptTime = System.currentTimeMillis();
	private @Nullable DelayedTask timerTask;

	public ExponentialBackoff(AsyncQueue queue, TimerId timerId, long initialDelayMs, double backoffFactor, long maxDelayMs, double jitterFactor, DoubleSupplier jitter) {
		this.queue = queue;
		this.timerId = timerId;
		this.initialDelayMs = initialDelayMs;
		this.backoffFactor = backoffFactor;
		this.maxDelayMs = maxDelayMs;
		this.jitterFactor = jitterFactor;
		this.jitter = jitter;
	}

	/**
	 * The next attempt will wait the initial delay.
	 */
	public void reset() {
		currentBaseMs = initialDelayMs;
	}

	/**
	 * The next attempt will wait the maximum delay, for errors like quota exhaustion
	 * that are unlikely to clear soon.
	 */
	public void resetToMax() {
		currentBaseMs = maxDelayMs;
	}

	/**
	 * Schedules <code>task</code> after the current delay, cancelling any attempt already scheduled.
	 */
	public void backoffAndRun(Runnable task) {
		cancel();

		long desiredDelayWithJitterMs = currentBaseMs + jitterDelayMs();
		long delaySoFarMs = Math.max(0, System.currentTimeMillis() - lastAttemptTime);
		long remainingDelayMs = Math.max(0, desiredDelayWithJitterMs - delaySoFarMs);

		if (currentBaseMs > 0) {
			LOGGER.debug("Backing off {} for {}ms (base delay {}ms, {}ms since last attempt)",
				timerId, remainingDelayMs, currentBaseMs, delaySoFarMs);
		}

		timerTask = queue.enqueueAfterDelay(timerId, remainingDelayMs, () -> {
			lastAttemptTime = System.currentTimeMillis();
			task.run();
		});

		currentBaseMs = (long) (currentBaseMs * backoffFactor);
		if (currentBaseMs < initialDelayMs) {
			currentBaseMs = initialDelayMs;
		} else if (currentBaseMs > maxDelayMs) {
			currentBaseMs = maxDelayMs;
		}
	}

	public void cancel() {
		if (timerTask != null) {
			timerTask.cancel();
			timerTask = null;
		}
	}

	long currentBaseMs() {
		return currentBaseMs;
	}

	/**
	 * @return a value in <code>[-jitterFactor * base, jitterFactor * base)</code>
	 */
	private long jitterDelayMs() {
		return (long) ((jitter.getAsDouble() - 0.5) * 2 * jitterFactor * currentBaseMs);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(ExponentialBackoff.class);
}
