package io.vena.docsync.model.mutation;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.util.ByteString;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static java.util.Collections.unmodifiableMap;

/**
 * The server's acknowledgement of a {@link MutationBatch}.
 *
 * @param docVersions the version each written document has after the commit
 */
public record MutationBatchResult(
	MutationBatch batch,
	SnapshotVersion commitVersion,
	List<MutationResult> mutationResults,
	ByteString streamToken,
	Map<DocumentKey, SnapshotVersion> docVersions
) {
	public static MutationBatchResult create(MutationBatch batch, SnapshotVersion commitVersion, List<MutationResult> mutationResults, ByteString streamToken) {
		if (batch.mutations().size() != mutationResults.size()) {
			throw new IllegalArgumentException("Mutations sent " + batch.mutations().size()
				+ " must equal results received " + mutationResults.size());
		}
		Map<DocumentKey, SnapshotVersion> docVersions = new TreeMap<>();
		List<Mutation> mutations = batch.mutations();
		for (int i = 0; i < mutations.size(); i++) {
			docVersions.put(mutations.get(i).key(), mutationResults.get(i).version());
		}
		return new MutationBatchResult(batch, commitVersion, List.copyOf(mutationResults), streamToken, unmodifiableMap(docVersions));
	}
}
