package io.vena.docsync.core;

/**
 * Whether the client believes it can reach the backend.
 */
public enum OnlineState {
	/**
	 * The client is trying to connect and has not yet succeeded or failed enough to decide.
	 * Listeners wait for the backend before raising events.
	 */
	UNKNOWN,

	/**
	 * The watch stream received a message, so the backend is reachable.
	 */
	ONLINE,

	/**
	 * The client gave up waiting for the backend, or the network is disabled.
	 * Listeners raise events from cache immediately.
	 */
	OFFLINE,
}
