package io.vena.docsync.model;

import java.time.Instant;

/**
 * A version assigned by the backend; {@link #NONE} sorts before all real versions.
 */
public record SnapshotVersion(Instant timestamp) implements Comparable<SnapshotVersion> {
	public static final SnapshotVersion NONE = new SnapshotVersion(Instant.EPOCH);

	public static SnapshotVersion ofMicros(long micros) {
		return new SnapshotVersion(Instant.EPOCH.plusNanos(micros * 1000));
	}

	public long toMicros() {
		return timestamp.getEpochSecond() * 1_000_000L + timestamp.getNano() / 1000;
	}

	@Override
	public int compareTo(SnapshotVersion other) {
		return timestamp.compareTo(other.timestamp);
	}

	@Override
	public String toString() {
		return "SnapshotVersion(" + timestamp + ")";
	}
}
