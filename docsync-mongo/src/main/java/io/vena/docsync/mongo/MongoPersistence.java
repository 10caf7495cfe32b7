package io.vena.docsync.mongo;

import com.mongodb.ClientSessionOptions;
import com.mongodb.MongoException;
import com.mongodb.ReadConcern;
import com.mongodb.ReadPreference;
import com.mongodb.TransactionOptions;
import com.mongodb.WriteConcern;
import com.mongodb.client.ClientSession;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.IndexOptions;
import io.vena.docsync.DocSyncSettings;
import io.vena.docsync.auth.User;
import io.vena.docsync.exceptions.LostPrimaryLeaseException;
import io.vena.docsync.exceptions.PersistenceException;
import io.vena.docsync.local.BundleCache;
import io.vena.docsync.local.DocumentOverlayCache;
import io.vena.docsync.local.EagerReferenceDelegate;
import io.vena.docsync.local.IndexManager;
import io.vena.docsync.local.MutationQueue;
import io.vena.docsync.local.Persistence;
import io.vena.docsync.local.PrimaryStateListener;
import io.vena.docsync.local.ReferenceDelegate;
import io.vena.docsync.local.RemoteDocumentCache;
import io.vena.docsync.local.TargetCache;
import io.vena.docsync.local.Transaction;
import io.vena.docsync.local.TransactionMode;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.util.MappedDiagnosticContext;
import io.vena.docsync.util.MappedDiagnosticContext.MDCScope;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import org.bson.BsonDocument;
import org.bson.conversions.Bson;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.mongodb.MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL;
import static com.mongodb.MongoException.UNKNOWN_TRANSACTION_COMMIT_RESULT_LABEL;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Indexes.ascending;
import static io.vena.docsync.local.TransactionMode.READ_WRITE;
import static io.vena.docsync.local.TransactionMode.READ_WRITE_PRIMARY;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Keeps the local cache in a MongoDB database, so it survives restarts
 * and can be shared by several clients.
 *
 * <p>
 * Each {@link Persistence#runTransaction transaction} is a MongoDB multi-document transaction
 * in its own {@link ClientSession}, which requires a replica set.
 * Write conflicts between clients surface as
 * {@link io.vena.docsync.exceptions.TransientPersistenceException}s, and the transaction is retried.
 *
 * <p>
 * Of the clients sharing a database, only the holder of the {@link PrimaryLease} may run
 * {@link TransactionMode#READ_WRITE_PRIMARY} transactions. The lease is renewed every
 * {@link DocSyncSettings#leaseRefreshIntervalMS()}, and the {@link PrimaryStateListener}
 * is told whenever this client gains or loses it.
 */
public final class MongoPersistence extends Persistence {
	private final MongoClient mongoClient;
	private final MongoPersistenceSettings mongoSettings;
	private final MongoDatabase database;
	private final BsonFormat format = new BsonFormat();
	private final ThreadLocal<ClientSession> currentSession = new ThreadLocal<>();

	private final TransactionalCollection remoteDocuments;
	private final TransactionalCollection mutations;
	private final TransactionalCollection mutationQueues;
	private final TransactionalCollection overlays;
	private final TransactionalCollection targets;
	private final TransactionalCollection targetDocuments;
	private final TransactionalCollection collectionParents;
	private final TransactionalCollection fieldIndexes;
	private final TransactionalCollection indexEntries;
	private final TransactionalCollection bundles;
	private final TransactionalCollection namedQueries;
	private final TransactionalCollection metadata;

	private final Map<User, MongoMutationQueue> mutationQueuesByUser = new HashMap<>();
	private final Map<User, MongoDocumentOverlayCache> overlaysByUser = new HashMap<>();
	private final MongoIndexManager indexManager;
	private final MongoRemoteDocumentCache remoteDocumentCache;
	private final MongoTargetCache targetCache;
	private final MongoBundleCache bundleCache;
	private final ReferenceDelegate referenceDelegate;
	private final PrimaryLease lease;

	private volatile boolean started;
	private volatile boolean isPrimary;
	private volatile @Nullable PrimaryStateListener primaryStateListener;
	private @Nullable ScheduledExecutorService leaseRefresher;

	private static final AtomicLong identityCounter = new AtomicLong(1);

	public MongoPersistence(DocSyncSettings settings, MongoPersistenceSettings mongoSettings, MongoClient mongoClient) {
		super(settings);
		mongoSettings.validate();
		this.mongoClient = mongoClient;
		this.mongoSettings = mongoSettings;
		this.database = mongoClient.getDatabase(mongoSettings.database());

		this.remoteDocuments = collection("remote_documents");
		this.mutations = collection("mutations");
		this.mutationQueues = collection("mutation_queues");
		this.overlays = collection("document_overlays");
		this.targets = collection("targets");
		this.targetDocuments = collection("target_documents");
		this.collectionParents = collection("collection_parents");
		this.fieldIndexes = collection("field_indexes");
		this.indexEntries = collection("index_entries");
		this.bundles = collection("bundles");
		this.namedQueries = collection("named_queries");
		this.metadata = collection("metadata");

		this.indexManager = new MongoIndexManager(collectionParents, fieldIndexes, indexEntries, format);
		this.remoteDocumentCache = new MongoRemoteDocumentCache(remoteDocuments, format);
		this.targetCache = new MongoTargetCache(this, targets, targetDocuments, metadata, format);
		this.bundleCache = new MongoBundleCache(bundles, namedQueries, format);
		this.referenceDelegate = new EagerReferenceDelegate(this);
		this.lease = new PrimaryLease(metadata, mongoSettings.ownerId(), settings.leaseDurationMS(), mongoSettings.testing().clock());
	}

	private TransactionalCollection collection(String name) {
		return new TransactionalCollection(
			database.getCollection(mongoSettings.collectionPrefix() + name, BsonDocument.class),
			this::currentSession);
	}

	@Override
	public void start() {
		if (started) {
			throw new IllegalStateException("MongoPersistence double-started");
		}
		LOGGER.debug("Starting MongoDB persistence in database \"{}\" as {}", mongoSettings.database(), mongoSettings.ownerId());
		try {
			createCollectionsAndIndexes();
		} catch (MongoException e) {
			throw new PersistenceException("Unable to prepare database \"" + mongoSettings.database() + "\"", e);
		}
		started = true;
		isPrimary = runTransaction("Acquire primary lease", READ_WRITE, lease::tryAcquire);
		LOGGER.info("Started MongoDB persistence; primary: {}", isPrimary);

		ScheduledExecutorService refresher = Executors.newSingleThreadScheduledExecutor(runnable -> {
			Thread result = new Thread(runnable, "docsync-" + settings.clientName() + "-lease");
			result.setDaemon(true);
			return result;
		});
		long interval = settings.leaseRefreshIntervalMS();
		refresher.scheduleWithFixedDelay(this::refreshLease, interval, interval, MILLISECONDS);
		leaseRefresher = refresher;
	}

	/**
	 * MongoDB can't create collections inside a multi-document transaction on every version we support,
	 * so they are all created up front.
	 */
	private void createCollectionsAndIndexes() {
		List<String> existing = database.listCollectionNames().into(new ArrayList<>());
		for (TransactionalCollection collection: allCollections()) {
			if (!existing.contains(collection.name())) {
				database.createCollection(collection.name());
			}
		}
		index(mutations, ascending("uid", "batchId"), true);
		index(mutations, ascending("uid", "keys"), false);
		index(mutations, ascending("uid", "collections"), false);
		index(overlays, ascending("uid", "collectionPath"), false);
		index(overlays, ascending("uid", "collectionGroup", "largestBatchId"), false);
		index(remoteDocuments, ascending("collectionPath", "readTimeSeconds"), false);
		index(remoteDocuments, ascending("collectionGroup", "readTimeSeconds"), false);
		index(targets, ascending("canonicalId"), false);
		index(targetDocuments, ascending("targetId"), false);
		index(targetDocuments, ascending("key"), false);
		index(collectionParents, ascending("collectionId"), false);
		index(fieldIndexes, ascending("collectionGroup"), false);
		index(indexEntries, ascending("indexId"), false);
	}

	private void index(TransactionalCollection collection, Bson keys, boolean unique) {
		MongoCollection<BsonDocument> raw = database.getCollection(collection.name(), BsonDocument.class);
		raw.createIndex(keys, new IndexOptions().unique(unique));
	}

	private List<TransactionalCollection> allCollections() {
		return List.of(remoteDocuments, mutations, mutationQueues, overlays, targets, targetDocuments,
			collectionParents, fieldIndexes, indexEntries, bundles, namedQueries, metadata);
	}

	@Override
	public void shutdown() {
		if (!started) {
			throw new IllegalStateException("MongoPersistence shutdown without start");
		}
		if (leaseRefresher != null) {
			leaseRefresher.shutdownNow();
			leaseRefresher = null;
		}
		try {
			runTransaction("Release primary lease", READ_WRITE, lease::release);
		} catch (PersistenceException e) {
			LOGGER.warn("Unable to release primary lease; other clients must wait for it to expire", e);
		}
		started = false;
		LOGGER.debug("Shut down MongoDB persistence");
	}

	@Override
	public boolean isStarted() {
		return started;
	}

	@Override
	public MutationQueue getMutationQueue(User user, IndexManager indexManager) {
		return mutationQueuesByUser.computeIfAbsent(user, u -> new MongoMutationQueue(this, mutations, mutationQueues, format, u, indexManager));
	}

	@Override
	public DocumentOverlayCache getDocumentOverlayCache(User user) {
		return overlaysByUser.computeIfAbsent(user, u -> new MongoDocumentOverlayCache(overlays, format, u));
	}

	@Override
	public RemoteDocumentCache getRemoteDocumentCache() {
		return remoteDocumentCache;
	}

	@Override
	public TargetCache getTargetCache() {
		return targetCache;
	}

	@Override
	public IndexManager getIndexManager(User user) {
		return indexManager;
	}

	@Override
	public BundleCache getBundleCache() {
		return bundleCache;
	}

	@Override
	public ReferenceDelegate getReferenceDelegate() {
		return referenceDelegate;
	}

	@Override
	public void setPrimaryStateListener(PrimaryStateListener listener) {
		this.primaryStateListener = listener;
		listener.applyPrimaryState(isPrimary);
	}

	@Override
	public boolean mutationQueuesContainKey(DocumentKey key) {
		return mutations.exists(eq("keys", key.path().canonicalString()));
	}

	/**
	 * @return the session of the transaction running on this thread.
	 * @throws IllegalStateException if there is none
	 */
	ClientSession currentSession() {
		ClientSession session = currentSession.get();
		if (session == null) {
			throw new IllegalStateException("No active session");
		}
		return session;
	}

	@Override
	protected Transaction beginTransaction(String label, TransactionMode mode) {
		MongoTransaction transaction = new MongoTransaction(label, mode);
		if (mode == READ_WRITE_PRIMARY) {
			boolean acquired;
			try {
				acquired = lease.tryAcquire();
			} catch (RuntimeException e) {
				transaction.close();
				throw e;
			}
			if (!acquired) {
				transaction.close();
				updatePrimaryState(false);
				throw new LostPrimaryLeaseException("Transaction \"" + label + "\" requires the primary lease, which is held by another client");
			}
			updatePrimaryState(true);
		}
		return transaction;
	}

	private void refreshLease() {
		try {
			updatePrimaryState(runTransaction("Refresh primary lease", READ_WRITE, lease::tryAcquire));
		} catch (PersistenceException e) {
			LOGGER.warn("Unable to refresh primary lease", e);
		}
	}

	private void updatePrimaryState(boolean newState) {
		if (isPrimary == newState) {
			return;
		}
		isPrimary = newState;
		LOGGER.info("Primary state changed to {}", newState);
		PrimaryStateListener listener = primaryStateListener;
		if (listener != null) {
			listener.applyPrimaryState(newState);
		}
	}

	private final class MongoTransaction implements Transaction {
		private final String label;
		private final TransactionMode mode;
		private final String name;
		private final ClientSession session;
		private final MDCScope mdc;
		private boolean committed = false;

		MongoTransaction(String label, TransactionMode mode) {
			this.label = label;
			this.mode = mode;
			this.name = label + "-t" + identityCounter.getAndIncrement();
			ClientSessionOptions sessionOptions = ClientSessionOptions.builder()
				.causallyConsistent(true)
				.defaultTransactionOptions(TransactionOptions.builder()
					.writeConcern(WriteConcern.MAJORITY)
					.readConcern(ReadConcern.SNAPSHOT)
					.readPreference(ReadPreference.primary())
					.build())
				.build();
			try {
				this.session = mongoClient.startSession(sessionOptions);
			} catch (MongoException e) {
				throw TransactionalCollection.translate(e, "startSession");
			}
			session.startTransaction();
			currentSession.set(session);
			this.mdc = MappedDiagnosticContext.setupTransactionMDC(name);
			LOGGER.trace("Begin transaction {}", name);
		}

		@Override
		public String label() {
			return label;
		}

		@Override
		public TransactionMode mode() {
			return mode;
		}

		@Override
		public void commit() {
			for (int attempt = 1; ; attempt++) {
				try {
					session.commitTransaction();
					committed = true;
					LOGGER.trace("Commit transaction {}", name);
					return;
				} catch (MongoException e) {
					if (e.hasErrorLabel(UNKNOWN_TRANSACTION_COMMIT_RESULT_LABEL) && attempt < MAX_COMMIT_ATTEMPTS) {
						// Committing again is safe: MongoDB makes commitTransaction idempotent
						LOGGER.debug("Unknown commit result for transaction {}; retrying commit", name, e);
						continue;
					}
					if (e.hasErrorLabel(TRANSIENT_TRANSACTION_ERROR_LABEL)) {
						LOGGER.debug("Transient error committing transaction {}", name, e);
					}
					throw TransactionalCollection.translate(e, "commit of " + name);
				}
			}
		}

		@Override
		public void close() {
			try {
				if (!committed && session.hasActiveTransaction()) {
					LOGGER.trace("Abort transaction {}", name);
					session.abortTransaction();
				}
			} catch (MongoException e) {
				LOGGER.debug("Ignoring error aborting transaction {}; the server discards it anyway", name, e);
			} finally {
				session.close();
				currentSession.remove();
				mdc.close();
			}
		}
	}

	private static final int MAX_COMMIT_ATTEMPTS = 3;
	private static final Logger LOGGER = LoggerFactory.getLogger(MongoPersistence.class);
}
