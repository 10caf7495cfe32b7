package io.vena.docsync.exceptions;

/**
 * Thrown from a transaction that requires the primary lease when another client holds it.
 * Recoverable: the engine suspends its network activity until the lease is acquired again.
 */
public class LostPrimaryLeaseException extends PersistenceException {
	public LostPrimaryLeaseException(String message) { super(message); }
}
