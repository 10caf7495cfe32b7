package io.vena.docsync.util;

/**
 * Receives a stream of values, such as the current user from a credentials provider.
 */
public interface Listener<T> {
	void onValue(T value);
}
