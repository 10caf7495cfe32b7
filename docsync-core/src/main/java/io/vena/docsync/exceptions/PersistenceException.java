package io.vena.docsync.exceptions;

/**
 * Indicates that the local cache could not complete an operation.
 */
public class PersistenceException extends RuntimeException {
	public PersistenceException(String message) { super(message); }
	public PersistenceException(String message, Throwable cause) { super(message, cause); }
	public PersistenceException(Throwable cause) { super(cause); }
}
