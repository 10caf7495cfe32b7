package io.vena.docsync.model.mutation;

import io.vena.docsync.model.value.ArrayValue;
import io.vena.docsync.model.value.Value;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

/**
 * Adds or removes elements of an array field. The server does not return a result for these,
 * so the transform is re-applied when the write is acknowledged.
 */
@Getter
@EqualsAndHashCode
public abstract class ArrayTransformOperation implements TransformOperation {
	private final List<Value> elements;

	ArrayTransformOperation(List<Value> elements) {
		this.elements = List.copyOf(elements);
	}

	@Override
	public Value applyToLocalView(@Nullable Value previousValue, Instant localWriteTime) {
		return apply(previousValue);
	}

	@Override
	public Value applyToRemoteDocument(@Nullable Value previousValue, @Nullable Value transformResult) {
		return apply(previousValue);
	}

	@Override
	public @Nullable Value computeBaseValue(@Nullable Value previousValue) {
		return null;
	}

	protected abstract Value apply(@Nullable Value previousValue);

	static List<Value> coercedFieldValuesArray(@Nullable Value value) {
		if (value instanceof ArrayValue) {
			return new ArrayList<>(((ArrayValue) value).values());
		} else {
			return new ArrayList<>();
		}
	}

	/**
	 * Appends each element not already present.
	 */
	@EqualsAndHashCode(callSuper = true)
	public static final class Union extends ArrayTransformOperation {
		public Union(List<Value> elements) {
			super(elements);
		}

		@Override
		protected Value apply(@Nullable Value previousValue) {
			List<Value> result = coercedFieldValuesArray(previousValue);
			for (Value element: elements()) {
				if (!result.contains(element)) {
					result.add(element);
				}
			}
			return new ArrayValue(result);
		}

		@Override
		public String toString() {
			return "arrayUnion" + elements();
		}
	}

	/**
	 * Removes every occurrence of each element.
	 */
	@EqualsAndHashCode(callSuper = true)
	public static final class Remove extends ArrayTransformOperation {
		public Remove(List<Value> elements) {
			super(elements);
		}

		@Override
		protected Value apply(@Nullable Value previousValue) {
			List<Value> result = coercedFieldValuesArray(previousValue);
			result.removeAll(elements());
			return new ArrayValue(result);
		}

		@Override
		public String toString() {
			return "arrayRemove" + elements();
		}
	}
}
