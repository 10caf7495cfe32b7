package io.vena.docsync.model.value;

public record NullValue() implements Value {
	public static final NullValue INSTANCE = new NullValue();

	@Override
	public int typeOrder() {
		return Values.TYPE_ORDER_NULL;
	}

	@Override
	public String toString() {
		return "null";
	}
}
