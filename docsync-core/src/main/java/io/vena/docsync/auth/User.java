package io.vena.docsync.auth;

import org.jetbrains.annotations.Nullable;

/**
 * The identity whose pending writes and local overlays are in effect.
 * Each user has their own mutation queue; switching users swaps it.
 */
public record User(@Nullable String uid) {
	public static final User UNAUTHENTICATED = new User(null);

	public boolean isAuthenticated() {
		return uid != null;
	}

	/**
	 * @return the key under which this user's state is stored; the empty string when unauthenticated.
	 */
	public String storageKey() {
		return uid == null ? "" : uid;
	}

	@Override
	public String toString() {
		return isAuthenticated() ? "User(" + uid + ")" : "User(unauthenticated)";
	}
}
