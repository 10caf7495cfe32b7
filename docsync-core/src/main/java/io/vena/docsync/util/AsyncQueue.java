package io.vena.docsync.util;

import io.vena.docsync.exceptions.DocSyncException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.docsync.exceptions.DocSyncException.Code.FAILED_PRECONDITION;
import static java.util.Collections.synchronizedSet;
import static java.util.Comparator.comparingLong;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Runs all of the engine's work, one task at a time, on a single thread it owns.
 *
 * <p>
 * Everything except the enqueue methods must be called on that thread;
 * components call {@link #verifyIsCurrentThread()} to catch mistakes early.
 *
 * <p>
 * An exception escaping a task submitted with {@link #enqueueAndForget} is an internal error:
 * the queue logs it, records it, and refuses to run anything else.
 */
public final class AsyncQueue {
	private final String name;
	private final ScheduledThreadPoolExecutor executor;
	private volatile Thread thread;
	private volatile boolean isShuttingDown = false;
	private volatile @Nullable Throwable failure = null;

	/**
	 * Only accessed on the queue thread.
	 */
	private final List<DelayedTask> delayedTasks = new ArrayList<>();
	private final Set<TimerId> timerIdsToSkip = synchronizedSet(EnumSet.noneOf(TimerId.class));

	public enum TimerId {
		/**
		 * Matches every timer in {@link #runDelayedTasksUntil}.
		 */
		ALL,
		LISTEN_STREAM_IDLE,
		LISTEN_STREAM_CONNECTION_BACKOFF,
		WRITE_STREAM_IDLE,
		WRITE_STREAM_CONNECTION_BACKOFF,
		HEALTH_CHECK_TIMEOUT,
		ONLINE_STATE_TIMEOUT,
		CLIENT_METADATA_REFRESH,
		INDEX_BACKFILL,
		RETRY_TRANSACTION,
	}

	public AsyncQueue(String name) {
		this.name = name;
		this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
			Thread result = new Thread(runnable, "docsync-" + name + "-async");
			result.setDaemon(true);
			thread = result;
			return result;
		});
		executor.setRemoveOnCancelPolicy(true);
		executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
	}

	public String name() {
		return name;
	}

	/**
	 * A task scheduled to run later on the queue, which can be cancelled or,
	 * in tests, run early.
	 */
	public final class DelayedTask {
		private final TimerId timerId;
		private final long targetTimeMs;
		private final Runnable task;
		private @Nullable ScheduledFuture<?> scheduledFuture;

		private DelayedTask(TimerId timerId, long targetTimeMs, Runnable task) {
			this.timerId = timerId;
			this.targetTimeMs = targetTimeMs;
			this.task = task;
		}

		public TimerId timerId() {
			return timerId;
		}

		private void start(long delayMs) {
			scheduledFuture = executor.schedule(
				() -> runGuarded(timerId.name(), this::handleDelayElapsed),
				delayMs, MILLISECONDS);
		}

		/**
		 * Has no effect if the task has already run or been cancelled.
		 */
		public void cancel() {
			verifyIsCurrentThread();
			if (scheduledFuture != null) {
				scheduledFuture.cancel(false);
				markDone();
			}
		}

		private void handleDelayElapsed() {
			verifyIsCurrentThread();
			if (scheduledFuture != null) {
				scheduledFuture.cancel(false);
				markDone();
				task.run();
			}
		}

		private void markDone() {
			scheduledFuture = null;
			delayedTasks.remove(this);
		}
	}

	public <T> CompletableFuture<T> enqueue(Callable<T> task) {
		CompletableFuture<T> result = new CompletableFuture<>();
		if (isShuttingDown) {
			result.completeExceptionally(terminated());
			return result;
		}
		try {
			executor.execute(() -> {
				Throwable failed = failure;
				if (failed != null) {
					result.completeExceptionally(new IllegalStateException("AsyncQueue " + name + " has failed", failed));
					return;
				}
				try (var __ = MappedDiagnosticContext.setupMDC(name)) {
					result.complete(task.call());
				} catch (Throwable e) {
					result.completeExceptionally(e);
				}
			});
		} catch (RejectedExecutionException e) {
			result.completeExceptionally(terminated());
		}
		return result;
	}

	public CompletableFuture<Void> enqueue(Runnable task) {
		return enqueue(() -> {
			task.run();
			return null;
		});
	}

	public void enqueueAndForget(Runnable task) {
		if (isShuttingDown) {
			LOGGER.debug("Ignoring task submitted after shutdown of {}", name);
			return;
		}
		try {
			executor.execute(() -> runGuarded("task", task));
		} catch (RejectedExecutionException e) {
			LOGGER.debug("Ignoring task submitted after shutdown of {}", name);
		}
	}

	/**
	 * Runs <code>task</code> as the last task on this queue;
	 * everything submitted afterward is ignored.
	 */
	public CompletableFuture<Void> enqueueAndInitiateShutdown(Runnable task) {
		CompletableFuture<Void> result = new CompletableFuture<>();
		synchronized (this) {
			if (isShuttingDown) {
				result.complete(null);
				return result;
			}
			isShuttingDown = true;
		}
		LOGGER.debug("Shutting down AsyncQueue {}", name);
		executor.execute(() -> {
			try (var __ = MappedDiagnosticContext.setupMDC(name)) {
				task.run();
				result.complete(null);
			} catch (Throwable e) {
				result.completeExceptionally(e);
			}
		});
		executor.shutdown();
		return result;
	}

	public boolean isShuttingDown() {
		return isShuttingDown;
	}

	public DelayedTask enqueueAfterDelay(TimerId timerId, long delayMs, Runnable task) {
		verifyIsCurrentThread();
		long effectiveDelay = timerIdsToSkip.contains(timerId) ? 0 : delayMs;
		DelayedTask delayedTask = new DelayedTask(timerId, System.currentTimeMillis() + effectiveDelay, task);
		if (isShuttingDown) {
			LOGGER.debug("Not scheduling {} during shutdown of {}", timerId, name);
			return delayedTask;
		}
		try {
			delayedTask.start(effectiveDelay);
		} catch (RejectedExecutionException e) {
			LOGGER.debug("Not scheduling {} after shutdown of {}", timerId, name);
			return delayedTask;
		}
		delayedTasks.add(delayedTask);
		return delayedTask;
	}

	public void verifyIsCurrentThread() {
		Thread current = Thread.currentThread();
		if (current != thread) {
			throw new IllegalStateException("Expected to be on the AsyncQueue thread of " + name
				+ " but was on " + current.getName());
		}
	}

	/**
	 * Makes every future timer with the given id fire immediately. Test only.
	 */
	public void skipDelaysForTimerId(TimerId timerId) {
		timerIdsToSkip.add(timerId);
	}

	public boolean containsDelayedTask(TimerId timerId) {
		verifyIsCurrentThread();
		for (DelayedTask delayedTask: delayedTasks) {
			if (delayedTask.timerId == timerId) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Runs the pending delayed tasks in order of their target times,
	 * stopping after the first one with the given id. Test only.
	 */
	public void runDelayedTasksUntil(TimerId lastTimerId) throws InterruptedException {
		runSync(() -> {
			if (lastTimerId != TimerId.ALL && !containsDelayedTask(lastTimerId)) {
				throw new IllegalStateException("No delayed task with id " + lastTimerId);
			}
			List<DelayedTask> tasks = new ArrayList<>(delayedTasks);
			tasks.sort(comparingLong(t -> t.targetTimeMs));
			for (DelayedTask delayedTask: tasks) {
				delayedTask.handleDelayElapsed();
				if (lastTimerId != TimerId.ALL && delayedTask.timerId == lastTimerId) {
					break;
				}
			}
		});
	}

	/**
	 * Runs <code>task</code> on the queue and waits for it. Must not be called on the queue thread.
	 */
	public void runSync(Runnable task) throws InterruptedException {
		try {
			enqueue(task).get();
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			} else if (cause instanceof Error) {
				throw (Error) cause;
			} else {
				throw new IllegalStateException("Unexpected exception from task", cause);
			}
		}
	}

	private void runGuarded(String description, Runnable task) {
		if (failure != null) {
			LOGGER.trace("Skipping {} on failed queue {}", description, name);
			return;
		}
		try (var __ = MappedDiagnosticContext.setupMDC(name)) {
			task.run();
		} catch (Throwable e) {
			panic(e);
		}
	}

	private void panic(Throwable e) {
		failure = e;
		LOGGER.error("Internal error in {} on AsyncQueue {}; no further tasks will run", Thread.currentThread().getName(), name, e);
	}

	private static DocSyncException terminated() {
		return new DocSyncException("The client has already been terminated", FAILED_PRECONDITION);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AsyncQueue.class);
}
