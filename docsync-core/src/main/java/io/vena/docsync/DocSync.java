package io.vena.docsync;

import io.vena.docsync.auth.CredentialsProvider;
import io.vena.docsync.auth.EmptyAppCheckTokenProvider;
import io.vena.docsync.auth.EmptyCredentialsProvider;
import io.vena.docsync.auth.User;
import io.vena.docsync.bundle.BundleSource;
import io.vena.docsync.bundle.LoadBundleTask;
import io.vena.docsync.bundle.NamedQuery;
import io.vena.docsync.core.EventManager;
import io.vena.docsync.core.ListenOptions;
import io.vena.docsync.core.OnlineState;
import io.vena.docsync.core.Query;
import io.vena.docsync.core.QueryListener;
import io.vena.docsync.core.SyncEngine;
import io.vena.docsync.core.View;
import io.vena.docsync.core.ViewSnapshot;
import io.vena.docsync.exceptions.DocSyncException;
import io.vena.docsync.local.IndexBackfiller;
import io.vena.docsync.local.LocalStore;
import io.vena.docsync.local.Persistence;
import io.vena.docsync.local.QueryEngine;
import io.vena.docsync.local.QueryResult;
import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldIndex;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.MutationBatchResult;
import io.vena.docsync.remote.Connection;
import io.vena.docsync.remote.Datastore;
import io.vena.docsync.remote.ExistenceFilterMismatchListener;
import io.vena.docsync.remote.RemoteEvent;
import io.vena.docsync.remote.RemoteStore;
import io.vena.docsync.remote.Status;
import io.vena.docsync.util.AsyncQueue;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.vena.docsync.exceptions.DocSyncException.Code.UNAVAILABLE;

/**
 * An offline-first client for a remote document database.
 *
 * <p>
 * Reads are answered from a local cache, which listens to the backend for changes.
 * Writes are applied to the cache right away, so listeners see them immediately, and are
 * sent to the backend in order whenever the client is online; they survive restarts
 * if the {@link Persistence} is durable.
 *
 * <p>
 * All of the engine's work happens on one internal thread. Listener events and the
 * completion of the returned futures happen on the <code>userExecutor</code>, which by
 * default is a single thread owned by this object, so a listener sees events in order.
 *
 * <p>
 * Create one with {@link #builder()}; only the <code>persistence</code> and the
 * <code>connection</code> are required.
 */
public final class DocSync {
	@Getter private final DocSyncSettings settings;
	private final AsyncQueue asyncQueue;
	private final Persistence persistence;
	private final Connection connection;
	private final CredentialsProvider<User> authProvider;
	private final CredentialsProvider<String> appCheckProvider;
	private final ExistenceFilterMismatchListener mismatchListener;
	private final Executor userExecutor;
	private final @Nullable ExecutorService ownedUserExecutor;

	/**
	 * Completes with the first user reported by the auth provider. The components
	 * can't be built until the user whose pending writes to load is known.
	 */
	private final CompletableFuture<User> firstUser = new CompletableFuture<>();

	// Only accessed on the async queue once initialized
	private LocalStore localStore;
	private Datastore datastore;
	private RemoteStore remoteStore;
	private SyncEngine syncEngine;
	private EventManager eventManager;
	private IndexBackfiller indexBackfiller;

	@Builder
	private DocSync(
		@Nullable DocSyncSettings settings,
		@NonNull Persistence persistence,
		@NonNull Connection connection,
		@Nullable CredentialsProvider<User> authProvider,
		@Nullable CredentialsProvider<String> appCheckProvider,
		@Nullable ExistenceFilterMismatchListener mismatchListener,
		@Nullable Executor userExecutor
	) {
		this.settings = settings == null ? DocSyncSettings.builder().build() : settings;
		this.settings.validate();
		this.persistence = persistence;
		this.connection = connection;
		this.authProvider = authProvider == null ? new EmptyCredentialsProvider() : authProvider;
		this.appCheckProvider = appCheckProvider == null ? new EmptyAppCheckTokenProvider() : appCheckProvider;
		this.mismatchListener = mismatchListener == null ? ExistenceFilterMismatchListener.NONE : mismatchListener;
		if (userExecutor == null) {
			String threadName = "docsync-" + this.settings.clientName() + "-user";
			this.ownedUserExecutor = Executors.newSingleThreadExecutor(runnable -> {
				Thread result = new Thread(runnable, threadName);
				result.setDaemon(true);
				return result;
			});
			this.userExecutor = ownedUserExecutor;
		} else {
			this.ownedUserExecutor = null;
			this.userExecutor = userExecutor;
		}
		this.asyncQueue = new AsyncQueue(this.settings.clientName());

		asyncQueue.enqueueAndForget(() -> initialize(firstUser.join()));
		this.authProvider.setChangeListener(user -> {
			if (!firstUser.complete(user)) {
				asyncQueue.enqueueAndForget(() -> {
					LOGGER.info("Credential changed; current user is {}", user);
					syncEngine.handleCredentialChange(user);
				});
			}
		});
		// App check tokens are attached to each new stream; nothing to do when they change.
		this.appCheckProvider.setChangeListener(token -> LOGGER.trace("App check token changed"));
	}

	private void initialize(User user) {
		LOGGER.debug("Initializing for user {}", user);
		persistence.start();
		localStore = new LocalStore(persistence, new QueryEngine(), user, settings);
		localStore.start();
		datastore = new Datastore(connection, asyncQueue, settings, authProvider, appCheckProvider);
		remoteStore = new RemoteStore(new RemoteStoreCallbackForwarder(), localStore, datastore, mismatchListener);
		syncEngine = new SyncEngine(localStore, remoteStore, user, settings.maxConcurrentLimboResolutions());
		eventManager = new EventManager(syncEngine);
		indexBackfiller = new IndexBackfiller(asyncQueue, localStore, settings);

		persistence.setPrimaryStateListener(isPrimary -> asyncQueue.enqueueAndForget(() -> {
			if (isPrimary) {
				LOGGER.info("Acquired primary lease; resuming network activity");
			} else {
				LOGGER.warn("Lost the primary lease to another client sharing the same persistence; network activity is suspended until it is regained");
			}
			syncEngine.handlePrimaryStateChange(isPrimary);
		}));

		remoteStore.start();
		indexBackfiller.start();
	}

	/**
	 * The remote store is built before the sync engine that handles its events.
	 */
	private final class RemoteStoreCallbackForwarder implements RemoteStore.RemoteStoreCallback {
		@Override
		public void handleRemoteEvent(RemoteEvent remoteEvent) {
			syncEngine.handleRemoteEvent(remoteEvent);
		}

		@Override
		public void handleRejectedListen(int targetId, Status error) {
			syncEngine.handleRejectedListen(targetId, error);
		}

		@Override
		public void handleSuccessfulWrite(MutationBatchResult successfulWrite) {
			syncEngine.handleSuccessfulWrite(successfulWrite);
		}

		@Override
		public void handleRejectedWrite(int batchId, Status error) {
			syncEngine.handleRejectedWrite(batchId, error);
		}

		@Override
		public void handleOnlineStateChange(OnlineState onlineState) {
			LOGGER.debug("Online state is now {}", onlineState);
			syncEngine.handleOnlineStateChange(onlineState);
		}

		@Override
		public Set<DocumentKey> getRemoteKeysForTarget(int targetId) {
			return syncEngine.getRemoteKeysForTarget(targetId);
		}
	}

	// Listening

	public ListenerRegistration listen(Query query, EventListener<ViewSnapshot> listener) {
		return listen(query, ListenOptions.defaults(), listener);
	}

	/**
	 * Raises a snapshot of the query's results now, and again whenever they change.
	 * After an error, the listener gets no more events.
	 */
	public ListenerRegistration listen(Query query, ListenOptions options, EventListener<ViewSnapshot> listener) {
		AsyncEventListener<ViewSnapshot> asyncListener = new AsyncEventListener<>(userExecutor, listener);
		QueryListener queryListener = new QueryListener(query, options, asyncListener);
		asyncQueue.enqueueAndForget(() -> eventManager.addQueryListener(queryListener));
		return () -> {
			asyncListener.mute();
			asyncQueue.enqueueAndForget(() -> eventManager.removeQueryListener(queryListener));
		};
	}

	/**
	 * The listener is called whenever all the snapshots raised together have been delivered,
	 * which is when listeners on different queries see a consistent state.
	 */
	public ListenerRegistration addSnapshotsInSyncListener(Runnable listener) {
		AsyncEventListener<Void> asyncListener = new AsyncEventListener<>(userExecutor, (value, error) -> listener.run());
		asyncQueue.enqueueAndForget(() -> eventManager.addSnapshotsInSyncListener(asyncListener));
		return () -> {
			asyncListener.mute();
			asyncQueue.enqueueAndForget(() -> eventManager.removeSnapshotsInSyncListener(asyncListener));
		};
	}

	// Writing

	/**
	 * Applies the mutations to the local cache atomically, and queues them for the backend.
	 *
	 * @return a future that completes when the backend acknowledges the write, which may be
	 * long after listeners have seen it; or exceptionally if the backend rejects it.
	 */
	public CompletableFuture<Void> write(List<Mutation> mutations) {
		CompletableFuture<Void> result = new CompletableFuture<>();
		asyncQueue.enqueue(() -> syncEngine.writeMutations(mutations, result))
			.whenComplete((v, e) -> {
				if (e != null) {
					result.completeExceptionally(e);
				}
			});
		return onUserExecutor(result);
	}

	/**
	 * @return a future that completes once every write made so far has been acknowledged or rejected.
	 * Fails with <code>CANCELLED</code> if the user changes first.
	 */
	public CompletableFuture<Void> waitForPendingWrites() {
		CompletableFuture<Void> result = new CompletableFuture<>();
		asyncQueue.enqueue(() -> syncEngine.registerPendingWritesTask(result))
			.whenComplete((v, e) -> {
				if (e != null) {
					result.completeExceptionally(e);
				}
			});
		return onUserExecutor(result);
	}

	// Reading

	/**
	 * @return the cached document, with any pending writes applied.
	 * Fails with <code>UNAVAILABLE</code> if the cache knows nothing about it.
	 */
	public CompletableFuture<Document> getDocumentFromLocalCache(DocumentKey key) {
		return onUserExecutor(asyncQueue.enqueue(() -> {
			Document document = localStore.readDocument(key);
			if (document.isFoundDocument() || document.isNoDocument()) {
				return document;
			} else {
				throw new DocSyncException("Failed to get document " + key + " from cache. (However, this document may exist on the server. Run again without setting source to CACHE to attempt to retrieve the document from the server.)", UNAVAILABLE);
			}
		}));
	}

	/**
	 * @return the query's results from the cache alone
	 */
	public CompletableFuture<ViewSnapshot> getDocumentsFromLocalCache(Query query) {
		return onUserExecutor(asyncQueue.enqueue(() -> {
			QueryResult queryResult = localStore.executeQuery(query, true);
			View view = new View(query, queryResult.remoteKeys());
			View.DocumentChanges viewDocChanges = view.computeDocChanges(queryResult.documents());
			return view.applyChanges(viewDocChanges).snapshot();
		}));
	}

	public CompletableFuture<Document> getDocument(DocumentKey key, Source source) {
		switch (source) {
			case CACHE:
				return getDocumentFromLocalCache(key);
			case SERVER:
				return onUserExecutor(getDocumentFromServer(key));
			case DEFAULT:
				return onUserExecutor(getDocumentFromServer(key).exceptionallyCompose(e -> {
					Throwable cause = unwrap(e);
					if (cause instanceof DocSyncException && ((DocSyncException) cause).code() == UNAVAILABLE) {
						LOGGER.debug("Backend unavailable; reading {} from cache", key);
						return asyncQueue.enqueue(() -> localStore.readDocument(key));
					}
					return CompletableFuture.failedFuture(cause);
				}));
			default:
				throw new IllegalArgumentException("Unknown source: " + source);
		}
	}

	private CompletableFuture<Document> getDocumentFromServer(DocumentKey key) {
		return asyncQueue.enqueue(() -> datastore.lookup(List.of(key)))
			.thenCompose(f -> f)
			.thenApply(documents -> {
				MutableDocument document = documents.get(0);
				if (!document.key().equals(key)) {
					throw new DocSyncException("Lookup of " + key + " returned " + document.key(), DocSyncException.Code.INTERNAL);
				}
				return document;
			});
	}

	// Network

	/**
	 * Resumes sending writes and listening to the backend after {@link #disableNetwork()}.
	 */
	public CompletableFuture<Void> enableNetwork() {
		return onUserExecutor(asyncQueue.enqueue(() -> {
			LOGGER.info("Enabling network");
			remoteStore.enableNetwork();
		}));
	}

	/**
	 * Stops all network activity. Reads come from the cache, and writes queue up until the
	 * network is enabled again.
	 */
	public CompletableFuture<Void> disableNetwork() {
		return onUserExecutor(asyncQueue.enqueue(() -> {
			LOGGER.info("Disabling network");
			remoteStore.disableNetwork();
		}));
	}

	// Bundles

	/**
	 * Loads a bundle of documents and named queries into the cache. Closes the source.
	 */
	public LoadBundleTask loadBundle(BundleSource bundleSource) {
		LoadBundleTask result = new LoadBundleTask();
		asyncQueue.enqueueAndForget(() -> syncEngine.loadBundle(bundleSource, result));
		return result;
	}

	/**
	 * @return the query saved under <code>queryName</code> by a loaded bundle, or null if there is none.
	 */
	public CompletableFuture<@Nullable Query> getNamedQuery(String queryName) {
		return onUserExecutor(asyncQueue.enqueue(() -> {
			NamedQuery namedQuery = localStore.getNamedQuery(queryName);
			return namedQuery == null ? null : namedQuery.bundledQuery().toQuery();
		}));
	}

	// Indexes

	public CompletableFuture<Void> configureFieldIndexes(List<FieldIndex> fieldIndexes) {
		return onUserExecutor(asyncQueue.enqueue(() -> localStore.configureFieldIndexes(fieldIndexes)));
	}

	// Lifecycle

	/**
	 * Stops all activity and releases the persistence. Pending writes stay in durable
	 * persistence for the next client. Every later call fails.
	 */
	public CompletableFuture<Void> shutdown() {
		LOGGER.info("Shutting down DocSync {}", settings.clientName());
		authProvider.removeChangeListener();
		appCheckProvider.removeChangeListener();
		CompletableFuture<Void> result = asyncQueue.enqueueAndInitiateShutdown(() -> {
			if (remoteStore != null) {
				remoteStore.shutdown();
				indexBackfiller.stop();
				persistence.shutdown();
			}
		});
		if (ownedUserExecutor != null) {
			return result.whenComplete((v, e) -> ownedUserExecutor.shutdown());
		}
		return result;
	}

	public boolean isShutdown() {
		return asyncQueue.isShuttingDown();
	}

	/**
	 * The async queue, for tests that need to run delayed tasks early.
	 */
	AsyncQueue asyncQueue() {
		return asyncQueue;
	}

	private <T> CompletableFuture<T> onUserExecutor(CompletableFuture<T> future) {
		CompletableFuture<T> result = new CompletableFuture<>();
		future.whenComplete((value, error) -> {
			Runnable completion = () -> {
				if (error == null) {
					result.complete(value);
				} else {
					result.completeExceptionally(unwrap(error));
				}
			};
			try {
				userExecutor.execute(completion);
			} catch (RejectedExecutionException e) {
				// User executor is gone after shutdown
				completion.run();
			}
		});
		return result;
	}

	private static Throwable unwrap(Throwable e) {
		if (e instanceof CompletionException && e.getCause() != null) {
			return e.getCause();
		}
		return e;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DocSync.class);
}
