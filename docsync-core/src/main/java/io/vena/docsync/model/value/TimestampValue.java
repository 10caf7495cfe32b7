package io.vena.docsync.model.value;

import java.time.Instant;

public record TimestampValue(Instant value) implements Value {
	@Override
	public int typeOrder() {
		return Values.TYPE_ORDER_TIMESTAMP;
	}

	@Override
	public String toString() {
		return value.toString();
	}
}
