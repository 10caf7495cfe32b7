package io.vena.docsync;

/**
 * Returned when registering a listener; stops further events when removed.
 */
public interface ListenerRegistration {
	/**
	 * Idempotent.
	 */
	void remove();
}
