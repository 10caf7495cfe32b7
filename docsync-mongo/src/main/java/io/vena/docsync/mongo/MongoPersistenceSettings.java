package io.vena.docsync.mongo;

import java.time.Clock;
import java.util.UUID;
import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder
public class MongoPersistenceSettings {
	String database;

	/**
	 * Identifies this client as the holder of the primary lease.
	 * Clients sharing a database must use distinct ids.
	 */
	@Default String ownerId = UUID.randomUUID().toString();

	/**
	 * Prepended to the name of every collection, so several caches can share one database.
	 */
	@Default String collectionPrefix = "docsync_";

	@Default Testing testing = Testing.builder().build();

	/**
	 * Settings not meant to be used in production.
	 */
	@Value
	@Builder
	public static class Testing {
		/**
		 * Source of the current time for primary lease expiry.
		 */
		@Default Clock clock = Clock.systemUTC();
	}

	public void validate() {
		if (database == null || database.isEmpty()) {
			throw new IllegalArgumentException("Database name is required");
		}
		if (ownerId.isEmpty()) {
			throw new IllegalArgumentException("Owner id must not be empty");
		}
	}
}
