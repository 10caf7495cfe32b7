package io.vena.docsync.local;

import io.vena.docsync.core.Target;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.util.ByteString;
import lombok.Value;
import lombok.With;
import org.jetbrains.annotations.Nullable;

/**
 * Everything the local cache remembers about a target between listens.
 */
@Value
@With
public class TargetData {
	Target target;
	int targetId;
	long sequenceNumber;
	QueryPurpose purpose;

	/**
	 * The latest snapshot version for which the backend sent a resume token.
	 */
	SnapshotVersion snapshotVersion;

	/**
	 * The latest snapshot at which the target's view had no documents in limbo.
	 * Results at this version can be reused by the query engine.
	 */
	SnapshotVersion lastLimboFreeSnapshotVersion;

	ByteString resumeToken;

	/**
	 * The number of documents the last existence filter reported, sent back when re-listening
	 * so the backend can return a filter on mismatch; null when unknown.
	 */
	@Nullable Integer expectedCount;

	public TargetData(Target target, int targetId, long sequenceNumber, QueryPurpose purpose, SnapshotVersion snapshotVersion, SnapshotVersion lastLimboFreeSnapshotVersion, ByteString resumeToken, @Nullable Integer expectedCount) {
		this.target = target;
		this.targetId = targetId;
		this.sequenceNumber = sequenceNumber;
		this.purpose = purpose;
		this.snapshotVersion = snapshotVersion;
		this.lastLimboFreeSnapshotVersion = lastLimboFreeSnapshotVersion;
		this.resumeToken = resumeToken;
		this.expectedCount = expectedCount;
	}

	public TargetData(Target target, int targetId, long sequenceNumber, QueryPurpose purpose) {
		this(target, targetId, sequenceNumber, purpose, SnapshotVersion.NONE, SnapshotVersion.NONE, ByteString.EMPTY, null);
	}

	/**
	 * A new token also clears the expected count, which only applies to the token it came with.
	 */
	public TargetData withResumeToken(ByteString resumeToken, SnapshotVersion snapshotVersion) {
		return new TargetData(target, targetId, sequenceNumber, purpose, snapshotVersion, lastLimboFreeSnapshotVersion, resumeToken, null);
	}
}
