package io.vena.docsync.model.mutation;

import io.vena.docsync.model.value.ServerTimestampValue;
import io.vena.docsync.model.value.Value;
import java.time.Instant;
import org.jetbrains.annotations.Nullable;

public final class ServerTimestampOperation implements TransformOperation {
	public static final ServerTimestampOperation INSTANCE = new ServerTimestampOperation();

	private ServerTimestampOperation() { }

	@Override
	public Value applyToLocalView(@Nullable Value previousValue, Instant localWriteTime) {
		return new ServerTimestampValue(localWriteTime, previousValue);
	}

	@Override
	public Value applyToRemoteDocument(@Nullable Value previousValue, @Nullable Value transformResult) {
		if (transformResult == null) {
			throw new IllegalStateException("Server timestamp transform requires a result from the server");
		}
		return transformResult;
	}

	@Override
	public @Nullable Value computeBaseValue(@Nullable Value previousValue) {
		return null;
	}

	@Override
	public String toString() {
		return "serverTimestamp";
	}
}
