package io.vena.docsync.model.value;

public record IntegerValue(long value) implements Value {
	@Override
	public int typeOrder() {
		return Values.TYPE_ORDER_NUMBER;
	}

	@Override
	public String toString() {
		return Long.toString(value);
	}
}
