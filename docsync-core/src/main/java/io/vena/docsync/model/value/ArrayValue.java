package io.vena.docsync.model.value;

import java.util.ArrayList;
import java.util.List;

public record ArrayValue(List<Value> values) implements Value {
	public ArrayValue {
		values = List.copyOf(values);
	}

	public static ArrayValue of(Value... values) {
		return new ArrayValue(List.of(values));
	}

	public boolean contains(Value value) {
		return values.contains(value);
	}

	public ArrayValue plus(Value value) {
		List<Value> newValues = new ArrayList<>(values);
		newValues.add(value);
		return new ArrayValue(newValues);
	}

	@Override
	public int typeOrder() {
		return Values.TYPE_ORDER_ARRAY;
	}

	@Override
	public String toString() {
		return values.toString();
	}
}
