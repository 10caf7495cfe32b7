package io.vena.docsync.local.memory;

import io.vena.docsync.DocSyncSettings;
import io.vena.docsync.auth.User;
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
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the local cache on the heap. Nothing survives the process,
 * and this client is always primary.
 *
 * <p>
 * Transactions do not roll back: a function that fails partway leaves its changes in place.
 */
public final class MemoryPersistence extends Persistence {
	private final Map<User, MemoryMutationQueue> mutationQueues = new HashMap<>();
	private final Map<User, MemoryDocumentOverlayCache> overlays = new HashMap<>();
	private final MemoryIndexManager indexManager = new MemoryIndexManager();
	private final MemoryTargetCache targetCache;
	private final MemoryRemoteDocumentCache remoteDocumentCache;
	private final MemoryBundleCache bundleCache = new MemoryBundleCache();
	private final ReferenceDelegate referenceDelegate;
	private boolean started;

	private static final AtomicLong identityCounter = new AtomicLong(1);

	public MemoryPersistence(DocSyncSettings settings) {
		super(settings);
		this.targetCache = new MemoryTargetCache(this);
		this.remoteDocumentCache = new MemoryRemoteDocumentCache();
		this.referenceDelegate = new EagerReferenceDelegate(this);
	}

	@Override
	public void start() {
		if (started) {
			throw new IllegalStateException("MemoryPersistence double-started");
		}
		started = true;
		LOGGER.debug("Started memory persistence");
	}

	@Override
	public void shutdown() {
		if (!started) {
			throw new IllegalStateException("MemoryPersistence shutdown without start");
		}
		started = false;
		LOGGER.debug("Shut down memory persistence");
	}

	@Override
	public boolean isStarted() {
		return started;
	}

	@Override
	public MutationQueue getMutationQueue(User user, IndexManager indexManager) {
		return mutationQueues.computeIfAbsent(user, u -> new MemoryMutationQueue(this, indexManager));
	}

	@Override
	public DocumentOverlayCache getDocumentOverlayCache(User user) {
		return overlays.computeIfAbsent(user, u -> new MemoryDocumentOverlayCache());
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
		listener.applyPrimaryState(true);
	}

	@Override
	public boolean mutationQueuesContainKey(DocumentKey key) {
		for (MemoryMutationQueue queue: mutationQueues.values()) {
			if (queue.containsKey(key)) {
				return true;
			}
		}
		return false;
	}

	@Override
	protected Transaction beginTransaction(String label, TransactionMode mode) {
		String name = label + "-m" + identityCounter.getAndIncrement();
		LOGGER.trace("Begin transaction {}", name);
		return new Transaction() {
			@Override public String label() { return label; }
			@Override public TransactionMode mode() { return mode; }
			@Override public void commit() { LOGGER.trace("Commit transaction {}", name); }
			@Override public void close() { }
		};
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MemoryPersistence.class);
}
