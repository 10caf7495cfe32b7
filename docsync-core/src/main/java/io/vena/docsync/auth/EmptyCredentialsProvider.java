package io.vena.docsync.auth;

import io.vena.docsync.util.Listener;
import java.util.concurrent.CompletableFuture;

/**
 * Always unauthenticated, with no token.
 */
public final class EmptyCredentialsProvider implements CredentialsProvider<User> {
	@Override
	public CompletableFuture<String> getToken() {
		return CompletableFuture.completedFuture(null);
	}

	@Override
	public void invalidateToken() {
	}

	@Override
	public void setChangeListener(Listener<User> changeListener) {
		changeListener.onValue(User.UNAUTHENTICATED);
	}

	@Override
	public void removeChangeListener() {
	}
}
