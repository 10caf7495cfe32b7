package io.vena.docsync.model.value;

import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/**
 * Placeholder for a server timestamp that has not been assigned yet.
 * Only appears in documents with local mutations.
 *
 * @param localWriteTime when the mutation was written locally
 * @param previousValue the field's value before the mutation, if any
 */
public record ServerTimestampValue(Instant localWriteTime, @Nullable Value previousValue) implements Value {
	@Override
	public int typeOrder() {
		return Values.TYPE_ORDER_SERVER_TIMESTAMP;
	}

	@Override
	public String toString() {
		return "serverTimestamp(" + localWriteTime + ")";
	}
}
