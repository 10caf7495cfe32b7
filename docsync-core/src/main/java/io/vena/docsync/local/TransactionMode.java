package io.vena.docsync.local;

public enum TransactionMode {
	READ_ONLY,
	READ_WRITE,

	/**
	 * Read-write, and only allowed in the client holding the primary lease.
	 * Used for anything that changes state derived from the backend.
	 */
	READ_WRITE_PRIMARY,
}
