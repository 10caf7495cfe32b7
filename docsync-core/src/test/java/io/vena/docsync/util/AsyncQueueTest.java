package io.vena.docsync.util;

import io.vena.docsync.exceptions.DocSyncException;
import io.vena.docsync.util.AsyncQueue.TimerId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static io.vena.docsync.exceptions.DocSyncException.Code.FAILED_PRECONDITION;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AsyncQueueTest {
	AsyncQueue queue;

	@BeforeEach
	void setup() {
		queue = new AsyncQueue("queue-test");
	}

	@AfterEach
	void teardown() {
		queue.enqueueAndInitiateShutdown(() -> { }).join();
	}

	@Test
	void tasksRunInSubmissionOrderOnQueueThread() throws Exception {
		List<Integer> order = new ArrayList<>();
		for (int i = 0; i < 10; i++) {
			int index = i;
			queue.enqueueAndForget(() -> {
				queue.verifyIsCurrentThread();
				order.add(index);
			});
		}
		Integer size = queue.enqueue(order::size).get();
		assertEquals(10, size);
		assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), order);
		assertThrows(IllegalStateException.class, queue::verifyIsCurrentThread);
	}

	@Test
	void enqueue_reportsTaskFailureToCaller() throws Exception {
		CompletableFuture<Object> failed = queue.enqueue(() -> {
			throw new IllegalArgumentException("bad input");
		});
		ExecutionException e = assertThrows(ExecutionException.class, failed::get);
		assertInstanceOf(IllegalArgumentException.class, e.getCause());

		assertEquals("still running", queue.enqueue(() -> "still running").get(), "A failed enqueue doesn't stop the queue");
	}

	@Test
	void failureOfFireAndForgetTask_stopsTheQueue() {
		queue.enqueueAndForget(() -> {
			throw new IllegalStateException("internal error");
		});
		ExecutionException e = assertThrows(ExecutionException.class, () -> queue.enqueue(() -> "never").get());
		assertInstanceOf(IllegalStateException.class, e.getCause());
	}

	@Test
	void afterShutdown_tasksAreRejected() throws Exception {
		List<String> ran = new ArrayList<>();
		queue.enqueueAndInitiateShutdown(() -> ran.add("shutdown")).get();
		assertTrue(queue.isShuttingDown());

		ExecutionException e = assertThrows(ExecutionException.class, () -> queue.enqueue(() -> ran.add("late")).get());
		DocSyncException cause = assertInstanceOf(DocSyncException.class, e.getCause());
		assertEquals(FAILED_PRECONDITION, cause.code());

		queue.enqueueAndForget(() -> ran.add("ignored"));
		assertEquals(List.of("shutdown"), ran);
		assertTrue(queue.enqueueAndInitiateShutdown(() -> ran.add("again")).isDone());
	}

	@Test
	void delayedTasks_canBeRunEarlyInOrder() throws Exception {
		List<TimerId> ran = new ArrayList<>();
		queue.runSync(() -> {
			queue.enqueueAfterDelay(TimerId.WRITE_STREAM_IDLE, 60_000, () -> ran.add(TimerId.WRITE_STREAM_IDLE));
			queue.enqueueAfterDelay(TimerId.LISTEN_STREAM_IDLE, 30_000, () -> ran.add(TimerId.LISTEN_STREAM_IDLE));
			queue.enqueueAfterDelay(TimerId.ONLINE_STATE_TIMEOUT, 90_000, () -> ran.add(TimerId.ONLINE_STATE_TIMEOUT));
		});

		queue.runDelayedTasksUntil(TimerId.WRITE_STREAM_IDLE);
		assertEquals(List.of(TimerId.LISTEN_STREAM_IDLE, TimerId.WRITE_STREAM_IDLE), ran);

		queue.runSync(() -> assertTrue(queue.containsDelayedTask(TimerId.ONLINE_STATE_TIMEOUT)));
		queue.runDelayedTasksUntil(TimerId.ALL);
		assertEquals(3, ran.size());
		queue.runSync(() -> assertFalse(queue.containsDelayedTask(TimerId.ONLINE_STATE_TIMEOUT)));
	}

	@Test
	void cancelledDelayedTask_neverRuns() throws Exception {
		List<String> ran = new ArrayList<>();
		queue.runSync(() -> {
			AsyncQueue.DelayedTask task = queue.enqueueAfterDelay(TimerId.HEALTH_CHECK_TIMEOUT, 10_000, () -> ran.add("timeout"));
			task.cancel();
			assertFalse(queue.containsDelayedTask(TimerId.HEALTH_CHECK_TIMEOUT));
		});
		assertThrows(IllegalStateException.class, () -> queue.runDelayedTasksUntil(TimerId.HEALTH_CHECK_TIMEOUT));
		assertTrue(ran.isEmpty());
	}

	@Test
	void skippedTimer_firesImmediately() throws Exception {
		CompletableFuture<String> fired = new CompletableFuture<>();
		queue.skipDelaysForTimerId(TimerId.INDEX_BACKFILL);
		queue.runSync(() -> queue.enqueueAfterDelay(TimerId.INDEX_BACKFILL, 3_600_000, () -> fired.complete("fired")));
		assertEquals("fired", fired.get());
	}
}
