package io.vena.docsync.local;

/**
 * A unit of work against a {@link Persistence}.
 * Obtain one with {@link Persistence#runTransaction}; they are not nestable.
 *
 * <p>
 * Use this in a try-with-resources block so the transaction is released on every exit path.
 * Closing a transaction that was not committed abandons its changes where the
 * persistence supports that.
 */
public interface Transaction extends AutoCloseable {
	String label();

	TransactionMode mode();

	void commit();

	@Override
	void close();
}
