package io.vena.docsync.local;

/**
 * Notified when this client gains or loses the primary lease on a shared persistence.
 * May be called from any thread.
 */
public interface PrimaryStateListener {
	void applyPrimaryState(boolean isPrimary);
}
