package io.vena.docsync.remote;

import io.vena.docsync.DocSyncSettings;
import io.vena.docsync.auth.CredentialsProvider;
import io.vena.docsync.auth.User;
import io.vena.docsync.exceptions.DocSyncException.Code;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.remote.AbstractStream.State;
import io.vena.docsync.remote.wire.ListenRequest;
import io.vena.docsync.remote.wire.ListenResponse;
import io.vena.docsync.remote.wire.WriteRequest;
import io.vena.docsync.remote.wire.WriteResponse;
import io.vena.docsync.util.AsyncQueue;
import io.vena.docsync.util.AsyncQueue.TimerId;
import io.vena.docsync.util.ByteString;
import io.vena.docsync.util.Listener;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WatchStreamTest {
	static final long TIMEOUT_SECONDS = 10;

	AsyncQueue queue;
	RecordingConnection connection;
	CountingCredentialsProvider<User> authProvider;
	CountingCredentialsProvider<String> appCheckProvider;
	RecordingCallback callback;
	WatchStream stream;

	@BeforeEach
	void setup() {
		queue = new AsyncQueue("watch-stream-test");
		connection = new RecordingConnection();
		authProvider = new CountingCredentialsProvider<>("auth");
		appCheckProvider = new CountingCredentialsProvider<>("app-check");
		callback = new RecordingCallback();
		DocSyncSettings settings = DocSyncSettings.builder()
			.backoff(DocSyncSettings.Backoff.builder()
				.initialDelayMS(1_000)
				.maxDelayMS(60_000)
				.build())
			.testing(DocSyncSettings.Testing.builder()
				.jitter(() -> 0.5)
				.build())
			.build();
		Datastore datastore = new Datastore(connection, queue, settings, authProvider, appCheckProvider);
		stream = datastore.createWatchStream(callback);
	}

	@AfterEach
	void teardown() {
		queue.enqueueAndInitiateShutdown(() -> { }).join();
	}

	@Test
	void restartedStream_dropsCallbacksFromEarlierCall() throws Exception {
		StreamObserver<ListenResponse> first = startAndOpen();
		queue.runSync(stream::stop);
		assertEquals(1, connection.closedCalls.get());

		StreamObserver<ListenResponse> second = startAndOpen();
		first.onMessage(snapshot(10));
		first.onClose(Status.of(Code.UNAVAILABLE, "late close of the first call"));
		assertEquals(List.of(), onQueue(() -> new ArrayList<>(callback.changes)));
		assertEquals(List.of(Status.OK), onQueue(() -> new ArrayList<>(callback.closes)), "Only the stop was reported");
		assertEquals(State.OPEN, onQueue(stream::state));

		second.onMessage(snapshot(20));
		assertEquals(1, (int) onQueue(callback.changes::size));
		assertEquals(SnapshotVersion.ofMicros(20), onQueue(() -> callback.versions.get(0)));
	}

	@Test
	void credentialsForClosedStream_areIgnored() throws Exception {
		CompletableFuture<String> slowToken = new CompletableFuture<>();
		authProvider.nextToken = slowToken;
		queue.runSync(stream::start);
		queue.runSync(stream::stop);
		slowToken.complete("slow-token");

		StreamObserver<ListenResponse> observer = startAndOpen();
		assertEquals(1, connection.observers.size(), "The stopped start never opened a call");
		assertEquals(State.OPEN, onQueue(stream::state));
		observer.onMessage(snapshot(10));
		assertEquals(1, (int) onQueue(callback.changes::size));
	}

	@Test
	void resourceExhausted_backsOffTheMaximumDelay() throws Exception {
		StreamObserver<ListenResponse> observer = startAndOpen();
		observer.onClose(Status.of(Code.RESOURCE_EXHAUSTED, "quota exceeded"));
		assertEquals(State.ERROR, onQueue(stream::state));
		assertEquals(60_000L, (long) onQueue(stream.backoff::currentBaseMs));

		queue.runSync(stream::start);
		assertEquals(State.BACKOFF, onQueue(stream::state));
		assertTrue(onQueue(() -> queue.containsDelayedTask(TimerId.LISTEN_STREAM_CONNECTION_BACKOFF)));
		assertEquals(1, connection.observers.size(), "Reconnecting waits for the timer");

		queue.runDelayedTasksUntil(TimerId.LISTEN_STREAM_CONNECTION_BACKOFF);
		waitUntil(() -> connection.observers.size() == 2, "reconnect after backoff");
	}

	@Test
	void otherErrors_keepTheCurrentDelay() throws Exception {
		StreamObserver<ListenResponse> observer = startAndOpen();
		observer.onMessage(snapshot(10));
		observer.onClose(Status.of(Code.UNAVAILABLE, "connection reset"));
		assertEquals(State.ERROR, onQueue(stream::state));
		assertEquals(1_000L, (long) onQueue(stream.backoff::currentBaseMs), "A response resets the delay to the initial one");
		assertEquals(0, authProvider.invalidations.get());
	}

	@Test
	void unauthenticated_invalidatesTokens() throws Exception {
		StreamObserver<ListenResponse> observer = startAndOpen();
		assertEquals("auth-token-1", connection.credentials.get(0).authToken());

		observer.onClose(Status.of(Code.UNAUTHENTICATED, "token expired"));
		assertEquals(State.ERROR, onQueue(stream::state));
		assertEquals(1, authProvider.invalidations.get());
		assertEquals(1, appCheckProvider.invalidations.get());

		queue.runSync(stream::start);
		waitUntil(() -> connection.observers.size() == 2, "reconnect");
		assertEquals("auth-token-2", connection.credentials.get(1).authToken());
		assertEquals("app-check-token-2", connection.credentials.get(1).appCheckToken());
	}

	// Helpers

	StreamObserver<ListenResponse> startAndOpen() throws Exception {
		int previousCalls = connection.observers.size();
		queue.runSync(stream::start);
		waitUntil(() -> connection.observers.size() > previousCalls, "listen call opened");
		StreamObserver<ListenResponse> observer = connection.observers.get(previousCalls);
		observer.onOpen();
		waitUntil(() -> {
			try {
				return onQueue(stream::isOpen);
			} catch (Exception e) {
				throw new IllegalStateException(e);
			}
		}, "stream open");
		return observer;
	}

	/**
	 * Runs after every callback already dispatched to the queue.
	 */
	<T> T onQueue(Callable<T> task) throws Exception {
		return queue.enqueue(task).get(TIMEOUT_SECONDS, SECONDS);
	}

	static ListenResponse snapshot(long micros) {
		return ListenResponse.TargetChange.snapshot(SnapshotVersion.ofMicros(micros), ByteString.copyFromUtf8("token-" + micros));
	}

	static void waitUntil(BooleanSupplier condition, String description) throws InterruptedException {
		long deadline = System.nanoTime() + SECONDS.toNanos(TIMEOUT_SECONDS);
		while (!condition.getAsBoolean()) {
			if (System.nanoTime() > deadline) {
				throw new AssertionError("Timed out waiting for " + description);
			}
			MILLISECONDS.sleep(5);
		}
	}

	static final class RecordingConnection implements Connection {
		final List<StreamObserver<ListenResponse>> observers = new CopyOnWriteArrayList<>();
		final List<CallCredentials> credentials = new CopyOnWriteArrayList<>();
		final List<ListenRequest> sent = new CopyOnWriteArrayList<>();
		final AtomicInteger closedCalls = new AtomicInteger();

		@Override
		public ConnectionStream<ListenRequest> openListenStream(CallCredentials credentials, StreamObserver<ListenResponse> observer) {
			this.credentials.add(credentials);
			observers.add(observer);
			return new ConnectionStream<>() {
				@Override
				public void send(ListenRequest request) {
					sent.add(request);
				}

				@Override
				public void close() {
					closedCalls.incrementAndGet();
				}
			};
		}

		@Override
		public ConnectionStream<WriteRequest> openWriteStream(CallCredentials credentials, StreamObserver<WriteResponse> observer) {
			throw new UnsupportedOperationException("No write stream in these tests");
		}

		@Override
		public CompletableFuture<List<MutableDocument>> lookup(List<DocumentKey> keys, CallCredentials credentials) {
			return CompletableFuture.failedFuture(new UnsupportedOperationException("No lookups in these tests"));
		}
	}

	/**
	 * Hands out a new token after each invalidation.
	 */
	static final class CountingCredentialsProvider<T> implements CredentialsProvider<T> {
		final String prefix;
		final AtomicInteger invalidations = new AtomicInteger();
		volatile CompletableFuture<String> nextToken;

		CountingCredentialsProvider(String prefix) {
			this.prefix = prefix;
		}

		@Override
		public CompletableFuture<String> getToken() {
			CompletableFuture<String> result = nextToken;
			if (result != null) {
				nextToken = null;
				return result;
			}
			return CompletableFuture.completedFuture(prefix + "-token-" + (invalidations.get() + 1));
		}

		@Override
		public void invalidateToken() {
			invalidations.incrementAndGet();
		}

		@Override
		public void setChangeListener(Listener<T> changeListener) {
		}

		@Override
		public void removeChangeListener() {
		}
	}

	/**
	 * Only touched on the queue.
	 */
	static final class RecordingCallback implements WatchStream.Callback {
		final List<WatchChange> changes = new ArrayList<>();
		final List<SnapshotVersion> versions = new ArrayList<>();
		final List<Status> closes = new ArrayList<>();

		@Override
		public void onOpen() {
		}

		@Override
		public void onClose(Status status) {
			closes.add(status);
		}

		@Override
		public void onWatchChange(SnapshotVersion snapshotVersion, WatchChange watchChange) {
			versions.add(snapshotVersion);
			changes.add(watchChange);
		}
	}
}
