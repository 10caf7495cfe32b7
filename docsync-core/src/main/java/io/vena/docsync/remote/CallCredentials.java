package io.vena.docsync.remote;

import org.jetbrains.annotations.Nullable;

/**
 * The tokens attached to a call or stream; either may be absent.
 */
public record CallCredentials(@Nullable String authToken, @Nullable String appCheckToken) {
	@Override
	public String toString() {
		// Never prints the tokens themselves
		return "CallCredentials{auth=" + (authToken != null) + ", appCheck=" + (appCheckToken != null) + "}";
	}
}
