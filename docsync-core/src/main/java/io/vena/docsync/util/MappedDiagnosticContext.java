package io.vena.docsync.util;

import org.slf4j.MDC;

import static io.vena.docsync.util.MdcKeys.CLIENT;
import static io.vena.docsync.util.MdcKeys.TRANSACTION;

public final class MappedDiagnosticContext {

	public static MDCScope setupMDC(String clientName) {
		MDCScope result = new MDCScope(CLIENT);
		MDC.put(CLIENT, clientName);
		return result;
	}

	public static MDCScope setupTransactionMDC(String transactionLabel) {
		MDCScope result = new MDCScope(TRANSACTION);
		MDC.put(TRANSACTION, transactionLabel);
		return result;
	}

	/**
	 * This is like {@link org.slf4j.MDC.MDCCloseable} except instead of
	 * deleting the MDC entry at the end, it restores it to its prior value,
	 * which allows us to nest these.
	 *
	 * <p>
	 * Use this in a try block that has no catch or finally clause:
	 * those would run after {@link #close()} and miss the diagnostic context.
	 */
	public static final class MDCScope implements AutoCloseable {
		private final String key;
		private final String oldValue;

		private MDCScope(String key) {
			this.key = key;
			this.oldValue = MDC.get(key);
		}

		@Override public void close() {
			if (oldValue == null) {
				MDC.remove(key);
			} else {
				MDC.put(key, oldValue);
			}
		}
	}

	private MappedDiagnosticContext() { }
}
