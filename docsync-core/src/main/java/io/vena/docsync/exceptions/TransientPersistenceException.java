package io.vena.docsync.exceptions;

/**
 * A {@link PersistenceException} that may succeed if the whole transaction is attempted again,
 * such as a write conflict between two clients sharing a durable cache.
 */
public class TransientPersistenceException extends PersistenceException {
	public TransientPersistenceException(String message) { super(message); }
	public TransientPersistenceException(String message, Throwable cause) { super(message, cause); }
}
