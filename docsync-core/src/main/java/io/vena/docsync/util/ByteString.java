package io.vena.docsync.util;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

/**
 * An immutable sequence of bytes, used for resume tokens, stream tokens and bytes values.
 */
public final class ByteString implements Comparable<ByteString> {
	public static final ByteString EMPTY = new ByteString(new byte[0]);

	private final byte[] bytes;

	private ByteString(byte[] bytes) {
		this.bytes = bytes;
	}

	public static ByteString copyFrom(byte[] bytes) {
		if (bytes.length == 0) {
			return EMPTY;
		}
		return new ByteString(bytes.clone());
	}

	public static ByteString copyFromUtf8(String value) {
		return copyFrom(value.getBytes(StandardCharsets.UTF_8));
	}

	public static ByteString fromBase64(String encoded) {
		return copyFrom(Base64.getDecoder().decode(encoded));
	}

	public byte byteAt(int index) {
		return bytes[index];
	}

	public int size() {
		return bytes.length;
	}

	public boolean isEmpty() {
		return bytes.length == 0;
	}

	public byte[] toByteArray() {
		return bytes.clone();
	}

	public String toBase64() {
		return Base64.getEncoder().encodeToString(bytes);
	}

	public String toStringUtf8() {
		return new String(bytes, StandardCharsets.UTF_8);
	}

	@Override
	public int compareTo(ByteString other) {
		return Arrays.compareUnsigned(bytes, other.bytes);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof ByteString)) return false;
		return Arrays.equals(bytes, ((ByteString) o).bytes);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(bytes);
	}

	@Override
	public String toString() {
		return "<" + toBase64() + ">";
	}
}
