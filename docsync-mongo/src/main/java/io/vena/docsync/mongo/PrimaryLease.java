package io.vena.docsync.mongo;

import java.time.Clock;
import java.time.Instant;
import org.bson.BsonDateTime;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;

/**
 * The lease that makes one of the clients sharing a database the primary:
 * the only one allowed to apply changes that come from the backend.
 *
 * <p>
 * The lease is a single MongoDB document naming its owner and when it expires.
 * All methods must be called inside a transaction, so two clients
 * racing for an expired lease conflict, and one of them retries.
 */
final class PrimaryLease {
	private final TransactionalCollection metadata;
	private final String ownerId;
	private final long durationMS;
	private final Clock clock;

	static final String LEASE_ID = "primaryLease";

	PrimaryLease(TransactionalCollection metadata, String ownerId, long durationMS, Clock clock) {
		this.metadata = metadata;
		this.ownerId = ownerId;
		this.durationMS = durationMS;
		this.clock = clock;
	}

	/**
	 * Takes or extends the lease if it is ours, absent, or expired.
	 *
	 * @return true if this client holds the lease afterward
	 */
	boolean tryAcquire() {
		Instant now = clock.instant();
		BsonDocument lease = metadata.findById(new BsonString(LEASE_ID));
		if (lease != null && !isOwnedByUs(lease) && isLive(lease, now)) {
			LOGGER.trace("Primary lease held by {} until {}", lease.getString("owner").getValue(), expiry(lease));
			return false;
		}
		if (lease == null || !isOwnedByUs(lease)) {
			LOGGER.debug("Acquiring primary lease for {}", ownerId);
		}
		metadata.upsert(new BsonDocument()
			.append("_id", new BsonString(LEASE_ID))
			.append("owner", new BsonString(ownerId))
			.append("expiresAt", new BsonDateTime(now.plusMillis(durationMS).toEpochMilli())));
		return true;
	}

	/**
	 * Gives up the lease if we hold it, so another client need not wait for it to expire.
	 */
	void release() {
		long deleted = metadata.deleteMany(and(eq("_id", LEASE_ID), eq("owner", ownerId)));
		if (deleted != 0) {
			LOGGER.debug("Released primary lease for {}", ownerId);
		}
	}

	private boolean isOwnedByUs(BsonDocument lease) {
		return ownerId.equals(lease.getString("owner").getValue());
	}

	private static boolean isLive(BsonDocument lease, Instant now) {
		return expiry(lease).isAfter(now);
	}

	private static Instant expiry(BsonDocument lease) {
		return Instant.ofEpochMilli(lease.getDateTime("expiresAt").getValue());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PrimaryLease.class);
}
