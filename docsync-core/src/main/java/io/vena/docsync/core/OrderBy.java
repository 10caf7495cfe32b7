package io.vena.docsync.core;

import io.vena.docsync.model.Document;
import io.vena.docsync.model.FieldPath;
import io.vena.docsync.model.value.Value;
import io.vena.docsync.model.value.Values;

/**
 * One sort criterion of a query.
 */
public record OrderBy(Direction direction, FieldPath field) {
	public enum Direction {
		ASCENDING(1),
		DESCENDING(-1);

		private final int comparisonModifier;

		Direction(int comparisonModifier) {
			this.comparisonModifier = comparisonModifier;
		}

		int comparisonModifier() {
			return comparisonModifier;
		}
	}

	public static OrderBy ascending(FieldPath field) {
		return new OrderBy(Direction.ASCENDING, field);
	}

	public static OrderBy descending(FieldPath field) {
		return new OrderBy(Direction.DESCENDING, field);
	}

	int compare(Document left, Document right) {
		if (field.isKeyField()) {
			return direction.comparisonModifier() * left.key().compareTo(right.key());
		}
		Value leftValue = left.field(field);
		Value rightValue = right.field(field);
		if (leftValue == null || rightValue == null) {
			throw new IllegalStateException("Trying to compare documents on fields that don't exist: " + field);
		}
		return direction.comparisonModifier() * Values.compare(leftValue, rightValue);
	}

	String canonicalId() {
		return field.canonicalString() + (direction == Direction.ASCENDING ? "asc" : "desc");
	}

	@Override
	public String toString() {
		return (direction == Direction.ASCENDING ? "" : "-") + field.canonicalString();
	}
}
