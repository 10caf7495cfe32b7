package io.vena.docsync.model.mutation;

import io.vena.docsync.model.FieldPath;
import java.util.Set;
import java.util.TreeSet;

import static java.util.Collections.unmodifiableSet;

/**
 * The set of fields a patch touches. A mask covers a field if it contains that field or any of its ancestors.
 */
public final class FieldMask {
	public static final FieldMask EMPTY = new FieldMask(new TreeSet<>());

	private final Set<FieldPath> mask;

	private FieldMask(Set<FieldPath> mask) {
		this.mask = unmodifiableSet(mask);
	}

	public static FieldMask fromSet(Set<FieldPath> mask) {
		return new FieldMask(new TreeSet<>(mask));
	}

	public boolean covers(FieldPath fieldPath) {
		for (FieldPath path: mask) {
			if (path.isPrefixOf(fieldPath)) {
				return true;
			}
		}
		return false;
	}

	public Set<FieldPath> getMask() {
		return mask;
	}

	public boolean isEmpty() {
		return mask.isEmpty();
	}

	public FieldMask union(FieldMask other) {
		Set<FieldPath> result = new TreeSet<>(mask);
		result.addAll(other.mask);
		return new FieldMask(result);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof FieldMask)) return false;
		return mask.equals(((FieldMask) o).mask);
	}

	@Override
	public int hashCode() {
		return mask.hashCode();
	}

	@Override
	public String toString() {
		return "FieldMask" + mask;
	}
}
