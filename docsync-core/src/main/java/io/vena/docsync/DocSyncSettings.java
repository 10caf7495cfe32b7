package io.vena.docsync;

import io.vena.docsync.model.DatabaseId;
import java.util.function.DoubleSupplier;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder
public class DocSyncSettings {
	/**
	 * Appears in thread names and in the <code>docsync.client</code> MDC entry.
	 */
	@Default String clientName = "docsync";
	@Default DatabaseId databaseId = DatabaseId.forProject("docsync");

	@Default int maxConcurrentLimboResolutions = 100;
	@Default long resumeTokenMaxAgeMS = 5 * 60 * 1000;
	@Default long onlineStateTimeoutMS = 10_000;
	@Default int maxWatchStreamFailures = 1;
	@Default long idleTimeoutMS = 60_000;
	@Default long healthCheckTimeoutMS = 10_000;
	@Default int maxPendingWrites = 10;
	@Default int maxTransactionAttempts = 3;

	@Default Backoff backoff = Backoff.builder().build();

	/**
	 * How often a durable cache shared between clients renews the primary lease.
	 */
	@Default long leaseRefreshIntervalMS = 4_000;
	@Default long leaseDurationMS = 5_000;

	@Default Experimental experimental = Experimental.builder().build();
	@Default Testing testing = Testing.builder().build();

	@Value
	@Builder
	public static class Backoff {
		@Default long initialDelayMS = 1_000;
		@Default double backoffFactor = 1.5;
		@Default long maxDelayMS = 60_000;

		/**
		 * Each delay is randomized by up to this fraction of the base delay, in either direction.
		 */
		@Default double jitterFactor = 0.5;
	}

	/**
	 * Settings with no guarantee of long-term support.
	 */
	@Value
	@Builder
	public static class Experimental {
		@Default boolean indexBackfillEnabled = true;
		@Default long indexBackfillInitialDelayMS = 15_000;
		@Default long indexBackfillRegularDelayMS = 60_000;
		@Default int maxDocumentsToBackfill = 50;
	}

	/**
	 * Settings not meant to be used in production.
	 */
	@Value
	@Builder
	public static class Testing {
		/**
		 * Source of uniformly distributed values in [0, 1) used to jitter backoff delays.
		 */
		@Default DoubleSupplier jitter = Math::random;
	}

	public void validate() {
		if (maxConcurrentLimboResolutions < 1) {
			throw new IllegalArgumentException("maxConcurrentLimboResolutions must be positive: " + maxConcurrentLimboResolutions);
		}
		if (maxPendingWrites < 1) {
			throw new IllegalArgumentException("maxPendingWrites must be positive: " + maxPendingWrites);
		}
		if (maxTransactionAttempts < 1) {
			throw new IllegalArgumentException("maxTransactionAttempts must be positive: " + maxTransactionAttempts);
		}
		if (backoff.backoffFactor() < 1.0) {
			throw new IllegalArgumentException("Backoff factor must be at least 1: " + backoff.backoffFactor());
		}
		if (backoff.initialDelayMS() > backoff.maxDelayMS()) {
			throw new IllegalArgumentException("Initial backoff delay " + backoff.initialDelayMS()
				+ " exceeds maximum " + backoff.maxDelayMS());
		}
		if (backoff.jitterFactor() < 0.0 || backoff.jitterFactor() > 1.0) {
			throw new IllegalArgumentException("Jitter factor must be between 0 and 1: " + backoff.jitterFactor());
		}
		if (leaseRefreshIntervalMS >= leaseDurationMS) {
			throw new IllegalArgumentException("Primary lease would expire before it is refreshed: refresh interval "
				+ leaseRefreshIntervalMS + "ms, duration " + leaseDurationMS + "ms");
		}
	}
}
