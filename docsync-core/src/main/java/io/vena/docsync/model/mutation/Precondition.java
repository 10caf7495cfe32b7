package io.vena.docsync.model.mutation;

import io.vena.docsync.model.Document;
import io.vena.docsync.model.SnapshotVersion;
import org.jetbrains.annotations.Nullable;

/**
 * A condition the target document must satisfy for a mutation to apply.
 * At most one of {@link #updateTime} and {@link #exists} is set.
 */
public record Precondition(@Nullable SnapshotVersion updateTime, @Nullable Boolean exists) {
	public static final Precondition NONE = new Precondition(null, null);

	public Precondition {
		if (updateTime != null && exists != null) {
			throw new IllegalArgumentException("Precondition can specify \"exists\" or \"updateTime\" but not both");
		}
	}

	public static Precondition exists(boolean exists) {
		return new Precondition(null, exists);
	}

	public static Precondition updateTime(SnapshotVersion updateTime) {
		return new Precondition(updateTime, null);
	}

	public boolean isNone() {
		return updateTime == null && exists == null;
	}

	public boolean isValidFor(Document document) {
		if (updateTime != null) {
			return document.isFoundDocument() && document.version().equals(updateTime);
		} else if (exists != null) {
			return exists == document.isFoundDocument();
		} else {
			return true;
		}
	}
}
