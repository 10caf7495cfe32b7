package io.vena.docsync.model.mutation;

import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.value.Value;
import java.util.List;

/**
 * The server's response to a single mutation.
 *
 * @param version the commit version, or the document's update time for writes that changed it
 * @param transformResults one value per field transform of the mutation, in order
 */
public record MutationResult(SnapshotVersion version, List<Value> transformResults) {
	public MutationResult {
		transformResults = List.copyOf(transformResults);
	}
}
