package io.vena.docsync.remote.wire;

import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.util.ByteString;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A message on the write stream. The first one on each stream is the handshake,
 * with no stream token and no writes.
 *
 * @param streamToken the token of the last response received, acknowledging it
 */
public record WriteRequest(@Nullable ByteString streamToken, List<Mutation> writes) {
	public WriteRequest {
		writes = List.copyOf(writes);
	}

	public static WriteRequest handshake() {
		return new WriteRequest(null, List.of());
	}

	public boolean isHandshake() {
		return streamToken == null && writes.isEmpty();
	}
}
