package io.vena.docsync.auth;

import io.vena.docsync.util.Listener;
import java.util.concurrent.CompletableFuture;

public final class EmptyAppCheckTokenProvider implements CredentialsProvider<String> {
	@Override
	public CompletableFuture<String> getToken() {
		return CompletableFuture.completedFuture(null);
	}

	@Override
	public void invalidateToken() {
	}

	@Override
	public void setChangeListener(Listener<String> changeListener) {
	}

	@Override
	public void removeChangeListener() {
	}
}
