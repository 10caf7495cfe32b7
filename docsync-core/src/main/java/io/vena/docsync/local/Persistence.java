package io.vena.docsync.local;

import io.vena.docsync.DocSyncSettings;
import io.vena.docsync.auth.User;
import io.vena.docsync.exceptions.TransientPersistenceException;
import io.vena.docsync.model.DocumentKey;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The transactional store behind the local cache, and the factory for its component stores.
 *
 * <p>
 * Store methods may only be called from within {@link #runTransaction}.
 */
public abstract class Persistence {
	protected final DocSyncSettings settings;
	private final ThreadLocal<Transaction> currentTransaction = new ThreadLocal<>();

	protected Persistence(DocSyncSettings settings) {
		this.settings = settings;
	}

	public abstract void start();

	public abstract void shutdown();

	public abstract boolean isStarted();

	public abstract MutationQueue getMutationQueue(User user, IndexManager indexManager);

	public abstract DocumentOverlayCache getDocumentOverlayCache(User user);

	public abstract RemoteDocumentCache getRemoteDocumentCache();

	public abstract TargetCache getTargetCache();

	public abstract IndexManager getIndexManager(User user);

	public abstract BundleCache getBundleCache();

	public abstract ReferenceDelegate getReferenceDelegate();

	/**
	 * Registers the listener and immediately reports the current primary state to it.
	 */
	public abstract void setPrimaryStateListener(PrimaryStateListener listener);

	/**
	 * @return true if any user's mutation queue has a batch writing to <code>key</code>.
	 */
	public abstract boolean mutationQueuesContainKey(DocumentKey key);

	/**
	 * Starts the underlying transaction. Called at most once per thread at a time.
	 */
	protected abstract Transaction beginTransaction(String label, TransactionMode mode);

	/**
	 * Runs <code>function</code> in a transaction, retrying it after a {@link TransientPersistenceException}
	 * up to {@link DocSyncSettings#maxTransactionAttempts()} times in all.
	 * The function may therefore run more than once, and must not have effects outside the persistence.
	 *
	 * @throws IllegalStateException if called within another transaction
	 */
	public <T> T runTransaction(String label, TransactionMode mode, Supplier<T> function) {
		if (currentTransaction.get() != null) {
			throw new IllegalStateException("Cannot start transaction \"" + label
				+ "\" inside transaction \"" + currentTransaction.get().label() + "\"");
		}
		int maxAttempts = settings.maxTransactionAttempts();
		for (int attempt = 1; ; attempt++) {
			try (Transaction transaction = beginTransaction(label, mode)) {
				currentTransaction.set(transaction);
				try {
					getReferenceDelegate().onTransactionStarted();
					T result = function.get();
					getReferenceDelegate().onTransactionCommitted();
					transaction.commit();
					return result;
				} finally {
					currentTransaction.remove();
				}
			} catch (TransientPersistenceException e) {
				if (attempt >= maxAttempts) {
					LOGGER.warn("Transaction \"{}\" failed after {} attempts", label, attempt, e);
					throw e;
				}
				LOGGER.debug("Retrying transaction \"{}\" after attempt {}: {}", label, attempt, e.getMessage());
			}
		}
	}

	public void runTransaction(String label, TransactionMode mode, Runnable operation) {
		runTransaction(label, mode, () -> {
			operation.run();
			return null;
		});
	}

	/**
	 * @return the transaction running on this thread.
	 * @throws IllegalStateException if there is none
	 */
	protected Transaction currentTransaction() {
		Transaction transaction = currentTransaction.get();
		if (transaction == null) {
			throw new IllegalStateException("No active transaction");
		}
		return transaction;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Persistence.class);
}
