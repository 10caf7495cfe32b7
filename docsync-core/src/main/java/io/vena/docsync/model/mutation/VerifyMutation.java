package io.vena.docsync.model.mutation;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Asserts its precondition on the server without changing the document.
 * If the precondition fails, the server rejects the whole batch.
 */
public final class VerifyMutation extends Mutation {
	public VerifyMutation(DocumentKey key, Precondition precondition) {
		super(key, precondition, List.of());
	}

	@Override
	public void applyToRemoteDocument(MutableDocument document, MutationResult mutationResult) {
		verifyKeyMatches(document);
	}

	@Override
	public @Nullable FieldMask applyToLocalView(MutableDocument document, @Nullable FieldMask previousMask, Instant localWriteTime) {
		verifyKeyMatches(document);
		return previousMask;
	}

	@Override
	public @Nullable FieldMask getFieldMask() {
		return null;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof VerifyMutation)) return false;
		return hasSameKeyAndPrecondition((VerifyMutation) o);
	}

	@Override
	public int hashCode() {
		return Objects.hash(key(), precondition());
	}

	@Override
	public String toString() {
		return "VerifyMutation{key=" + key() + ", precondition=" + precondition() + "}";
	}
}
