package io.vena.docsync.model.mutation;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldPath;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.value.ObjectValue;
import io.vena.docsync.model.value.Value;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;

/**
 * Changes the fields named by {@link #mask()} to their values in {@link #value()}.
 * A masked field absent from the value is deleted.
 */
public final class PatchMutation extends Mutation {
	private final ObjectValue value;
	private final FieldMask mask;

	public PatchMutation(DocumentKey key, ObjectValue value, FieldMask mask, Precondition precondition) {
		this(key, value, mask, precondition, List.of());
	}

	public PatchMutation(DocumentKey key, ObjectValue value, FieldMask mask, Precondition precondition, List<FieldTransform> fieldTransforms) {
		super(key, precondition, fieldTransforms);
		this.value = value;
		this.mask = mask;
	}

	public ObjectValue value() {
		return value;
	}

	public FieldMask mask() {
		return mask;
	}

	@Override
	public void applyToRemoteDocument(MutableDocument document, MutationResult mutationResult) {
		verifyKeyMatches(document);
		if (!precondition().isValidFor(document)) {
			// The server applied the patch to a document we don't have
			document.convertToUnknownDocument(mutationResult.version());
			return;
		}
		Map<FieldPath, Value> transformResults = serverTransformResults(document.data(), mutationResult.transformResults());
		ObjectValue newData = document.data().setAll(getPatch()).setAll(transformResults);
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
		Map<FieldPath, Value> transformResults = localTransformResults(localWriteTime, document);
		ObjectValue newData = document.data().setAll(getPatch()).setAll(transformResults);
		document
			.convertToFoundDocument(document.version(), newData)
			.setHasLocalMutations();
		if (previousMask == null) {
			return null;
		}
		Set<FieldPath> mergedMask = new TreeSet<>(previousMask.getMask());
		mergedMask.addAll(mask.getMask());
		for (FieldTransform transform: fieldTransforms()) {
			mergedMask.add(transform.fieldPath());
		}
		return FieldMask.fromSet(mergedMask);
	}

	@Override
	public FieldMask getFieldMask() {
		return mask;
	}

	private Map<FieldPath, @Nullable Value> getPatch() {
		Map<FieldPath, Value> result = new LinkedHashMap<>();
		for (FieldPath path: mask.getMask()) {
			if (!path.isEmpty()) {
				result.put(path, value.get(path));
			}
		}
		return result;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof PatchMutation)) return false;
		PatchMutation other = (PatchMutation) o;
		return hasSameKeyAndPrecondition(other)
			&& mask.equals(other.mask)
			&& value.equals(other.value)
			&& fieldTransforms().equals(other.fieldTransforms());
	}

	@Override
	public int hashCode() {
		return Objects.hash(key(), precondition(), value, mask);
	}

	@Override
	public String toString() {
		return "PatchMutation{key=" + key() + ", mask=" + mask + ", value=" + value + ", precondition=" + precondition() + ", transforms=" + fieldTransforms() + "}";
	}
}
