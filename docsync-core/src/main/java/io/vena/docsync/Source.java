package io.vena.docsync;

/**
 * Where {@link DocSync#getDocument} reads from.
 */
public enum Source {
	/**
	 * The backend, falling back to the local cache if the backend can't be reached.
	 */
	DEFAULT,

	/**
	 * Only the backend. Fails if the client is offline.
	 */
	SERVER,

	/**
	 * Only the local cache. Fails if the document isn't cached.
	 */
	CACHE,
}
