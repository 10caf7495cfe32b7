package io.vena.docsync.remote.wire;

import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.mutation.MutationResult;
import io.vena.docsync.util.ByteString;
import java.util.List;

/**
 * The response to a handshake, with no results, or to a batch of writes, with one result per write.
 *
 * @param commitTime {@link SnapshotVersion#NONE} in the handshake response
 */
public record WriteResponse(ByteString streamToken, SnapshotVersion commitTime, List<MutationResult> writeResults) {
	public WriteResponse {
		writeResults = List.copyOf(writeResults);
	}
}
