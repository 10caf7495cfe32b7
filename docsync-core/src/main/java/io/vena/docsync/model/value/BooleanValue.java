package io.vena.docsync.model.value;

public record BooleanValue(boolean value) implements Value {
	public static final BooleanValue TRUE = new BooleanValue(true);
	public static final BooleanValue FALSE = new BooleanValue(false);

	public static BooleanValue of(boolean value) {
		return value ? TRUE : FALSE;
	}

	@Override
	public int typeOrder() {
		return Values.TYPE_ORDER_BOOLEAN;
	}

	@Override
	public String toString() {
		return Boolean.toString(value);
	}
}
