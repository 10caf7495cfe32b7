package io.vena.docsync.model.mutation;

import io.vena.docsync.model.value.DoubleValue;
import io.vena.docsync.model.value.IntegerValue;
import io.vena.docsync.model.value.Value;
import io.vena.docsync.model.value.Values;
import java.time.Instant;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

/**
 * Adds {@link #operand} to a numeric field; a non-numeric field is treated as zero.
 * Integer sums saturate instead of overflowing.
 */
@Getter
@EqualsAndHashCode
public final class NumericIncrementOperation implements TransformOperation {
	private final Value operand;

	public NumericIncrementOperation(Value operand) {
		if (!Values.isNumber(operand)) {
			throw new IllegalArgumentException("NumericIncrementOperation expects a number operand: " + operand);
		}
		this.operand = operand;
	}

	@Override
	public Value applyToLocalView(@Nullable Value previousValue, Instant localWriteTime) {
		Value baseValue = computeBaseValue(previousValue);
		if (baseValue instanceof IntegerValue && operand instanceof IntegerValue) {
			return new IntegerValue(safeIncrement(((IntegerValue) baseValue).value(), ((IntegerValue) operand).value()));
		} else {
			return new DoubleValue(asDouble(baseValue) + asDouble(operand));
		}
	}

	@Override
	public Value applyToRemoteDocument(@Nullable Value previousValue, @Nullable Value transformResult) {
		if (transformResult == null) {
			throw new IllegalStateException("Numeric increment transform requires a result from the server");
		}
		return transformResult;
	}

	@Override
	public Value computeBaseValue(@Nullable Value previousValue) {
		return Values.isNumber(previousValue) ? previousValue : new IntegerValue(0);
	}

	private static long safeIncrement(long x, long y) {
		long result = x + y;
		// Overflow iff both arguments have the opposite sign of the result
		if (((x ^ result) & (y ^ result)) >= 0) {
			return result;
		}
		return result >= 0 ? Long.MIN_VALUE : Long.MAX_VALUE;
	}

	private static double asDouble(Value value) {
		if (value instanceof DoubleValue) {
			return ((DoubleValue) value).value();
		} else {
			return ((IntegerValue) value).value();
		}
	}

	@Override
	public String toString() {
		return "increment(" + operand + ")";
	}
}
