package io.vena.docsync.exceptions;

import lombok.Getter;

/**
 * The single unchecked exception type reported to users of the engine.
 * Futures returned by {@link io.vena.docsync.DocSync} complete exceptionally with this.
 */
@Getter
public class DocSyncException extends RuntimeException {
	private final Code code;

	public DocSyncException(String message, Code code) {
		super(message);
		this.code = code;
	}

	public DocSyncException(String message, Code code, Throwable cause) {
		super(message, cause);
		this.code = code;
	}

	/**
	 * The status codes used by the backend's RPC layer.
	 */
	public enum Code {
		OK(0),
		CANCELLED(1),
		UNKNOWN(2),
		INVALID_ARGUMENT(3),
		DEADLINE_EXCEEDED(4),
		NOT_FOUND(5),
		ALREADY_EXISTS(6),
		PERMISSION_DENIED(7),
		RESOURCE_EXHAUSTED(8),
		FAILED_PRECONDITION(9),
		ABORTED(10),
		OUT_OF_RANGE(11),
		UNIMPLEMENTED(12),
		INTERNAL(13),
		UNAVAILABLE(14),
		DATA_LOSS(15),
		UNAUTHENTICATED(16);

		private final int value;

		Code(int value) {
			this.value = value;
		}

		public int value() {
			return value;
		}

		public static Code fromValue(int value) {
			for (Code code: values()) {
				if (code.value == value) {
					return code;
				}
			}
			return UNKNOWN;
		}
	}
}
