package io.vena.docsync.local;

import io.vena.docsync.auth.User;
import io.vena.docsync.model.DocumentKey;

/**
 * Passes everything through to another {@link Persistence}.
 * Tests override individual methods to inject failures.
 *
 * <p>
 * Transactions are begun by the downstream persistence, but nesting and retries
 * are tracked by this one, so callers must only use this one.
 */
public class ForwardingPersistence extends Persistence {
	protected final Persistence downstream;

	public ForwardingPersistence(Persistence downstream) {
		super(downstream.settings);
		this.downstream = downstream;
	}

	@Override
	public void start() {
		downstream.start();
	}

	@Override
	public void shutdown() {
		downstream.shutdown();
	}

	@Override
	public boolean isStarted() {
		return downstream.isStarted();
	}

	@Override
	public MutationQueue getMutationQueue(User user, IndexManager indexManager) {
		return downstream.getMutationQueue(user, indexManager);
	}

	@Override
	public DocumentOverlayCache getDocumentOverlayCache(User user) {
		return downstream.getDocumentOverlayCache(user);
	}

	@Override
	public RemoteDocumentCache getRemoteDocumentCache() {
		return downstream.getRemoteDocumentCache();
	}

	@Override
	public TargetCache getTargetCache() {
		return downstream.getTargetCache();
	}

	@Override
	public IndexManager getIndexManager(User user) {
		return downstream.getIndexManager(user);
	}

	@Override
	public BundleCache getBundleCache() {
		return downstream.getBundleCache();
	}

	@Override
	public ReferenceDelegate getReferenceDelegate() {
		return downstream.getReferenceDelegate();
	}

	@Override
	public void setPrimaryStateListener(PrimaryStateListener listener) {
		downstream.setPrimaryStateListener(listener);
	}

	@Override
	public boolean mutationQueuesContainKey(DocumentKey key) {
		return downstream.mutationQueuesContainKey(key);
	}

	@Override
	protected Transaction beginTransaction(String label, TransactionMode mode) {
		return downstream.beginTransaction(label, mode);
	}

	@Override
	public String toString() {
		return "ForwardingPersistence{" +
			"downstream=" + downstream +
			'}';
	}
}
