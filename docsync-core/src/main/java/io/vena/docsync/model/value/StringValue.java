package io.vena.docsync.model.value;

import lombok.NonNull;

public record StringValue(@NonNull String value) implements Value {
	@Override
	public int typeOrder() {
		return Values.TYPE_ORDER_STRING;
	}

	@Override
	public String toString() {
		return value;
	}
}
