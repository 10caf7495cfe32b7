package io.vena.docsync.model.mutation;

import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldPath;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.value.ObjectValue;
import io.vena.docsync.model.value.Value;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

/**
 * A write to a single document.
 *
 * <p>
 * Mutations are applied in two situations. When a write is made locally,
 * {@link #applyToLocalView} computes the optimistic state the application sees.
 * When the server acknowledges a write, {@link #applyToRemoteDocument} computes the
 * committed state from the server's {@link MutationResult}.
 *
 * <p>
 * Applying a mutation to a document whose precondition doesn't hold leaves
 * the local view unchanged. On the server side, the precondition must have held,
 * or the write would have been rejected.
 */
public abstract class Mutation {
	private final DocumentKey key;
	private final Precondition precondition;
	private final List<FieldTransform> fieldTransforms;

	Mutation(DocumentKey key, Precondition precondition, List<FieldTransform> fieldTransforms) {
		this.key = key;
		this.precondition = precondition;
		this.fieldTransforms = List.copyOf(fieldTransforms);
	}

	public DocumentKey key() {
		return key;
	}

	public Precondition precondition() {
		return precondition;
	}

	public List<FieldTransform> fieldTransforms() {
		return fieldTransforms;
	}

	/**
	 * Updates <code>document</code> to reflect this mutation having been committed with <code>mutationResult</code>.
	 */
	public abstract void applyToRemoteDocument(MutableDocument document, MutationResult mutationResult);

	/**
	 * Updates <code>document</code> to its optimistic local state.
	 *
	 * @param previousMask the fields already changed by earlier mutations to the document,
	 *                     or null if an earlier mutation replaced the whole document
	 * @return the fields changed by this and earlier mutations, or null if the document was replaced
	 */
	public abstract @Nullable FieldMask applyToLocalView(MutableDocument document, @Nullable FieldMask previousMask, Instant localWriteTime);

	/**
	 * @return the fields this mutation changes, or null if it replaces the whole document.
	 */
	public abstract @Nullable FieldMask getFieldMask();

	/**
	 * Computes the single mutation that turns the remote version of <code>document</code>
	 * into its current local view.
	 *
	 * @param mask the fields changed locally, or null if the whole document was replaced
	 * @return null if the document has no local changes
	 */
	public static @Nullable Mutation calculateOverlayMutation(MutableDocument document, @Nullable FieldMask mask) {
		if (!document.hasLocalMutations() || (mask != null && mask.isEmpty())) {
			return null;
		}
		if (mask == null) {
			if (document.isNoDocument()) {
				return new DeleteMutation(document.key(), Precondition.NONE);
			} else {
				return new SetMutation(document.key(), document.data(), Precondition.NONE);
			}
		}
		ObjectValue documentValue = document.data();
		ObjectValue patchValue = ObjectValue.empty();
		Set<FieldPath> maskSet = new LinkedHashSet<>();
		for (FieldPath path: mask.getMask()) {
			if (maskSet.contains(path)) {
				continue;
			}
			// A deleted nested field is represented by patching its parent
			if (documentValue.get(path) == null && path.length() > 1) {
				path = path.popLast();
			}
			Value value = documentValue.get(path);
			if (value != null) {
				patchValue = patchValue.set(path, value);
			}
			maskSet.add(path);
		}
		return new PatchMutation(document.key(), patchValue, FieldMask.fromSet(maskSet), Precondition.NONE);
	}

	/**
	 * @return the values that non-idempotent transforms should build on, or null if there are none.
	 */
	public @Nullable ObjectValue extractTransformBaseValue(Document document) {
		ObjectValue baseObject = null;
		for (FieldTransform transform: fieldTransforms) {
			Value existingValue = document.field(transform.fieldPath());
			Value coercedValue = transform.operation().computeBaseValue(existingValue);
			if (coercedValue != null) {
				if (baseObject == null) {
					baseObject = ObjectValue.empty();
				}
				baseObject = baseObject.set(transform.fieldPath(), coercedValue);
			}
		}
		return baseObject;
	}

	void verifyKeyMatches(MutableDocument document) {
		if (!document.key().equals(key)) {
			throw new IllegalArgumentException("Can only apply a mutation to a document with the same key: " + key + " vs " + document.key());
		}
	}

	boolean hasSameKeyAndPrecondition(Mutation other) {
		return key.equals(other.key) && precondition.equals(other.precondition);
	}

	Map<FieldPath, Value> serverTransformResults(ObjectValue data, List<Value> serverResults) {
		if (serverResults.size() != fieldTransforms.size()) {
			throw new IllegalArgumentException("Server sent " + serverResults.size()
				+ " transform results for " + fieldTransforms.size() + " transforms");
		}
		Map<FieldPath, Value> result = new LinkedHashMap<>();
		for (int i = 0; i < fieldTransforms.size(); i++) {
			FieldTransform transform = fieldTransforms.get(i);
			Value previousValue = data.get(transform.fieldPath());
			result.put(transform.fieldPath(), transform.operation().applyToRemoteDocument(previousValue, serverResults.get(i)));
		}
		return result;
	}

	Map<FieldPath, Value> localTransformResults(Instant localWriteTime, MutableDocument document) {
		Map<FieldPath, Value> result = new LinkedHashMap<>();
		for (FieldTransform transform: fieldTransforms) {
			Value previousValue = document.field(transform.fieldPath());
			result.put(transform.fieldPath(), transform.operation().applyToLocalView(previousValue, localWriteTime));
		}
		return result;
	}
}
