package io.vena.docsync.model.mutation;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

public final class DeleteMutation extends Mutation {
	public DeleteMutation(DocumentKey key, Precondition precondition) {
		super(key, precondition, List.of());
	}

	@Override
	public void applyToRemoteDocument(MutableDocument document, MutationResult mutationResult) {
		verifyKeyMatches(document);
		if (!mutationResult.transformResults().isEmpty()) {
			throw new IllegalArgumentException("Transform results received by DeleteMutation");
		}
		document
			.convertToNoDocument(mutationResult.version())
			.setHasCommittedMutations();
	}

	@Override
	public @Nullable FieldMask applyToLocalView(MutableDocument document, @Nullable FieldMask previousMask, Instant localWriteTime) {
		verifyKeyMatches(document);
		if (precondition().isValidFor(document)) {
			document
				.convertToNoDocument(document.version())
				.setHasLocalMutations();
			return null;
		}
		return previousMask;
	}

	@Override
	public @Nullable FieldMask getFieldMask() {
		return null;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof DeleteMutation)) return false;
		return hasSameKeyAndPrecondition((DeleteMutation) o);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key(), precondition());
	}

	@Override
	public String toString() {
		return "DeleteMutation{key=" + key() + ", precondition=" + precondition() + "}";
	}
}
