package io.vena.docsync.model.mutation;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.OverlayedDocument;
import io.vena.docsync.model.SnapshotVersion;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.jetbrains.annotations.Nullable;

/**
 * A group of mutations written together, and sent to the server as one atomic write.
 *
 * <p>
 * {@link #baseMutations()} are never sent: they pin the values that non-idempotent transforms
 * in {@link #mutations()} build on in the local view.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class MutationBatch {
	public static final int UNKNOWN = -1;

	private final int batchId;
	private final Instant localWriteTime;
	private final List<Mutation> baseMutations;
	private final List<Mutation> mutations;

	public MutationBatch(int batchId, Instant localWriteTime, List<Mutation> baseMutations, List<Mutation> mutations) {
		if (mutations.isEmpty()) {
			throw new IllegalArgumentException("Cannot create an empty mutation batch");
		}
		this.batchId = batchId;
		this.localWriteTime = localWriteTime;
		this.baseMutations = List.copyOf(baseMutations);
		this.mutations = List.copyOf(mutations);
	}

	public void applyToRemoteDocument(MutableDocument document, MutationBatchResult batchResult) {
		List<MutationResult> mutationResults = batchResult.mutationResults();
		if (mutationResults.size() != mutations.size()) {
			throw new IllegalArgumentException("Mismatch between mutations length (" + mutations.size()
				+ ") and results length (" + mutationResults.size() + ")");
		}
		for (int i = 0; i < mutations.size(); i++) {
			Mutation mutation = mutations.get(i);
			if (mutation.key().equals(document.key())) {
				mutation.applyToRemoteDocument(document, mutationResults.get(i));
			}
		}
	}

	/**
	 * @return the fields changed so far, or null if the document was replaced.
	 * @see Mutation#applyToLocalView
	 */
	public @Nullable FieldMask applyToLocalView(MutableDocument document, @Nullable FieldMask mutatedFields) {
		for (Mutation mutation: baseMutations) {
			if (mutation.key().equals(document.key())) {
				mutatedFields = mutation.applyToLocalView(document, mutatedFields, localWriteTime);
			}
		}
		for (Mutation mutation: mutations) {
			if (mutation.key().equals(document.key())) {
				mutatedFields = mutation.applyToLocalView(document, mutatedFields, localWriteTime);
			}
		}
		return mutatedFields;
	}

	/**
	 * Applies this batch to the given local views in place.
	 *
	 * @param documentsWithoutRemoteVersion keys whose local view comes from mutations alone;
	 *                                      their overlays are full sets or deletes rather than patches
	 * @return the overlay for each key whose local view now differs from its remote version
	 */
	public Map<DocumentKey, Mutation> applyToLocalDocumentSet(Map<DocumentKey, OverlayedDocument> documentMap, Set<DocumentKey> documentsWithoutRemoteVersion) {
		Map<DocumentKey, Mutation> overlays = new HashMap<>();
		for (DocumentKey key: getKeys()) {
			OverlayedDocument overlayedDocument = documentMap.get(key);
			MutableDocument document = overlayedDocument.document();
			FieldMask mutatedFields = applyToLocalView(document, overlayedDocument.mutatedFields());
			if (documentsWithoutRemoteVersion.contains(key)) {
				mutatedFields = null;
			}
			Mutation overlay = Mutation.calculateOverlayMutation(document, mutatedFields);
			if (overlay != null) {
				overlays.put(key, overlay);
			}
			if (!document.isValidDocument()) {
				document.convertToNoDocument(SnapshotVersion.NONE);
			}
		}
		return overlays;
	}

	public Set<DocumentKey> getKeys() {
		Set<DocumentKey> result = new TreeSet<>();
		for (Mutation mutation: mutations) {
			result.add(mutation.key());
		}
		return result;
	}
}
