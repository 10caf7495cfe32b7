package io.vena.docsync.local;

/**
 * Hands out increasing sequence numbers recording when a target was last used.
 */
public final class ListenSequence {
	public static final long INVALID = -1;

	private long previousSequenceNumber;

	public ListenSequence(long startAfter) {
		this.previousSequenceNumber = startAfter;
	}

	public long next() {
		return ++previousSequenceNumber;
	}
}
