package io.vena.docsync.remote;

import io.vena.docsync.exceptions.DocSyncException;
import io.vena.docsync.exceptions.DocSyncException.Code;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of a call or stream, as reported by the transport.
 */
public record Status(Code code, @Nullable String description, @Nullable Throwable cause) {
	public static final Status OK = new Status(Code.OK, null, null);

	public static Status of(Code code, String description) {
		return new Status(code, description, null);
	}

	/**
	 * Unwraps futures' wrapper exceptions, and takes the code of a {@link DocSyncException}.
	 */
	public static Status fromThrowable(Throwable throwable) {
		Throwable t = throwable;
		while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
			t = t.getCause();
		}
		if (t instanceof DocSyncException) {
			return new Status(((DocSyncException) t).code(), t.getMessage(), t);
		}
		return new Status(Code.UNKNOWN, t.toString(), t);
	}

	public boolean isOk() {
		return code == Code.OK;
	}

	public DocSyncException asException() {
		String message = description == null ? code.name() : description;
		if (cause == null) {
			return new DocSyncException(message, code);
		} else {
			return new DocSyncException(message, code, cause);
		}
	}

	@Override
	public String toString() {
		return description == null ? "Status{" + code + "}" : "Status{" + code + ": " + description + "}";
	}
}
