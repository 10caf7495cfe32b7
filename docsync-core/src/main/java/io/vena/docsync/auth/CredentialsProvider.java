package io.vena.docsync.auth;

import io.vena.docsync.util.Listener;
import java.util.concurrent.CompletableFuture;
import org.jetbrains.annotations.Nullable;

/**
 * Supplies tokens attached to every stream opened against the backend,
 * and reports when the identity behind them changes.
 *
 * @param <T> what a change of identity reports: a {@link User} for authentication,
 *           a token string for app check
 */
public interface CredentialsProvider<T> {
	/**
	 * @return a future for the current token, which is null when there is none.
	 */
	CompletableFuture<@Nullable String> getToken();

	/**
	 * Marks the last token as rejected by the backend so the next {@link #getToken()} fetches a fresh one.
	 */
	void invalidateToken();

	/**
	 * Registers the single listener. Implementations call it once right away with the current value,
	 * and again on every change, from any thread.
	 */
	void setChangeListener(Listener<T> changeListener);

	void removeChangeListener();
}
