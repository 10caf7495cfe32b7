package io.vena.docsync.core;

import io.vena.docsync.model.Document;
import io.vena.docsync.model.FieldPath;
import io.vena.docsync.model.value.ArrayValue;
import io.vena.docsync.model.value.NullValue;
import io.vena.docsync.model.value.ReferenceValue;
import io.vena.docsync.model.value.Value;
import io.vena.docsync.model.value.Values;
import java.util.EnumSet;
import java.util.Set;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Restricts a query to documents whose field compares to a value in a given way.
 *
 * <p>
 * Range comparisons only match values of the same type as {@link #value()},
 * treating integers and doubles as one type.
 */
@Getter
@EqualsAndHashCode
public final class FieldFilter {
	private final FieldPath field;
	private final Operator operator;
	private final Value value;

	public enum Operator {
		LESS_THAN("<"),
		LESS_THAN_OR_EQUAL("<="),
		EQUAL("=="),
		NOT_EQUAL("!="),
		GREATER_THAN(">"),
		GREATER_THAN_OR_EQUAL(">="),
		ARRAY_CONTAINS("array_contains"),
		ARRAY_CONTAINS_ANY("array_contains_any"),
		IN("in"),
		NOT_IN("not_in");

		private final String text;

		Operator(String text) {
			this.text = text;
		}

		@Override
		public String toString() {
			return text;
		}
	}

	private static final Set<Operator> INEQUALITY_OPERATORS = EnumSet.of(
		Operator.LESS_THAN, Operator.LESS_THAN_OR_EQUAL,
		Operator.GREATER_THAN, Operator.GREATER_THAN_OR_EQUAL,
		Operator.NOT_EQUAL, Operator.NOT_IN);

	private FieldFilter(FieldPath field, Operator operator, Value value) {
		this.field = field;
		this.operator = operator;
		this.value = value;
	}

	public static FieldFilter create(FieldPath field, Operator operator, Value value) {
		switch (operator) {
			case IN:
			case NOT_IN:
			case ARRAY_CONTAINS_ANY:
				if (!(value instanceof ArrayValue)) {
					throw new IllegalArgumentException("A non-empty array is required for '" + operator + "' filters");
				}
				break;
			default:
				break;
		}
		if (field.isKeyField() && !(value instanceof ReferenceValue) && !(value instanceof ArrayValue)) {
			throw new IllegalArgumentException("Filters on the document key need a reference value: " + value);
		}
		return new FieldFilter(field, operator, value);
	}

	public boolean isInequality() {
		return INEQUALITY_OPERATORS.contains(operator);
	}

	public boolean matches(Document document) {
		if (field.isKeyField()) {
			return matchesKey(document);
		}
		Value other = document.field(field);
		switch (operator) {
			case ARRAY_CONTAINS:
				return other instanceof ArrayValue && ((ArrayValue) other).contains(value);
			case ARRAY_CONTAINS_ANY:
				if (!(other instanceof ArrayValue)) {
					return false;
				}
				for (Value element: ((ArrayValue) other).values()) {
					if (((ArrayValue) value).contains(element)) {
						return true;
					}
				}
				return false;
			case IN:
				return other != null && ((ArrayValue) value).contains(other);
			case NOT_IN:
				return other != null
					&& !((ArrayValue) value).contains(NullValue.INSTANCE)
					&& !((ArrayValue) value).contains(other);
			case NOT_EQUAL:
				return other != null && !(other instanceof NullValue) && matchesComparison(Values.compare(other, value));
			default:
				return other != null
					&& other.typeOrder() == value.typeOrder()
					&& matchesComparison(Values.compare(other, value));
		}
	}

	private boolean matchesKey(Document document) {
		ReferenceValue documentReference = new ReferenceValue(document.key());
		switch (operator) {
			case IN:
				return ((ArrayValue) value).contains(documentReference);
			case NOT_IN:
				return !((ArrayValue) value).contains(documentReference);
			default:
				return matchesComparison(document.key().compareTo(((ReferenceValue) value).key()));
		}
	}

	boolean matchesComparison(int comparison) {
		switch (operator) {
			case LESS_THAN:
				return comparison < 0;
			case LESS_THAN_OR_EQUAL:
				return comparison <= 0;
			case EQUAL:
				return comparison == 0;
			case NOT_EQUAL:
				return comparison != 0;
			case GREATER_THAN:
				return comparison > 0;
			case GREATER_THAN_OR_EQUAL:
				return comparison >= 0;
			default:
				throw new IllegalStateException("Unknown comparison operator: " + operator);
		}
	}

	public String canonicalId() {
		return field.canonicalString() + operator + Values.canonicalId(value);
	}

	@Override
	public String toString() {
		return field.canonicalString() + " " + operator + " " + value;
	}
}
