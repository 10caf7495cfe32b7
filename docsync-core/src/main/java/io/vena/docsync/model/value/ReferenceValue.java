package io.vena.docsync.model.value;

import io.vena.docsync.model.DocumentKey;
import lombok.NonNull;

public record ReferenceValue(@NonNull DocumentKey key) implements Value {
	@Override
	public int typeOrder() {
		return Values.TYPE_ORDER_REFERENCE;
	}

	@Override
	public String toString() {
		return "ref(" + key + ")";
	}
}
