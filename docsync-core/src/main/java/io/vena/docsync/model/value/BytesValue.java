package io.vena.docsync.model.value;

import io.vena.docsync.util.ByteString;
import lombok.NonNull;

public record BytesValue(@NonNull ByteString value) implements Value {
	@Override
	public int typeOrder() {
		return Values.TYPE_ORDER_BYTES;
	}

	@Override
	public String toString() {
		return value.toString();
	}
}
