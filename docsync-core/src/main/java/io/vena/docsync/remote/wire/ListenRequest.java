package io.vena.docsync.remote.wire;

import io.vena.docsync.core.Target;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.util.ByteString;
import org.jetbrains.annotations.Nullable;

/**
 * A message on the listen stream: exactly one of <code>addTarget</code> and <code>removeTarget</code> is set.
 */
public record ListenRequest(@Nullable AddTarget addTarget, @Nullable Integer removeTarget) {
	/**
	 * Starts watching a target. Resumes from <code>resumeToken</code> if it is not empty,
	 * otherwise from <code>readTime</code> if it is set.
	 *
	 * @param expectedCount the number of documents the client believes match, when resuming;
	 *                      lets the backend send a bloom filter if it disagrees
	 * @param purpose free-form label for the backend's diagnostics, or null for a plain listen
	 */
	public record AddTarget(
		int targetId,
		Target target,
		ByteString resumeToken,
		@Nullable SnapshotVersion readTime,
		@Nullable Integer expectedCount,
		@Nullable String purpose
	) { }

	public static ListenRequest add(AddTarget addTarget) {
		return new ListenRequest(addTarget, null);
	}

	public static ListenRequest remove(int targetId) {
		return new ListenRequest(null, targetId);
	}
}
