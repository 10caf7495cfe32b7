package io.vena.docsync.model.mutation;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.value.ObjectValue;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Replaces the entire contents of a document, creating it if necessary.
 */
public final class SetMutation extends Mutation {
	private final ObjectValue value;

	public SetMutation(DocumentKey key, ObjectValue value, Precondition precondition) {
		this(key, value, precondition, List.of());
	}

	public SetMutation(DocumentKey key, ObjectValue value, Precondition precondition, List<FieldTransform> fieldTransforms) {
		super(key, precondition, fieldTransforms);
		this.value = value;
	}

	public ObjectValue value() {
		return value;
	}

	@Override
	public void applyToRemoteDocument(MutableDocument document, MutationResult mutationResult) {
		verifyKeyMatches(document);
		ObjectValue newData = value.setAll(serverTransformResults(document.data(), mutationResult.transformResults()));
		document
			.convertToFoundDocument(mutationResult.version(), newData)
			.setHasCommittedMutations();
	}

	@Override
	public @Nullable FieldMask applyToLocalView(MutableDocument document, @Nullable FieldMask previousMask, Instant localWriteTime) {
		verifyKeyMatches(document);
		if (!precondition().isValidFor(document)) {
			return previousMask;
		}
		ObjectValue localValue = value.setAll(localTransformResults(localWriteTime, document));
		document
			.convertToFoundDocument(document.version(), localValue)
			.setHasLocalMutations();
		return null;
	}

	@Override
	public @Nullable FieldMask getFieldMask() {
		return null;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof SetMutation)) return false;
		SetMutation other = (SetMutation) o;
		return hasSameKeyAndPrecondition(other)
			&& value.equals(other.value)
			&& fieldTransforms().equals(other.fieldTransforms());
	}

	@Override
	public int hashCode() {
		return Objects.hash(key(), precondition(), value);
	}

	@Override
	public String toString() {
		return "SetMutation{key=" + key() + ", precondition=" + precondition() + ", value=" + value + ", transforms=" + fieldTransforms() + "}";
	}
}
