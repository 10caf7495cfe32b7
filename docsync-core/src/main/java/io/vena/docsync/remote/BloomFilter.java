package io.vena.docsync.remote;

import io.vena.docsync.util.ByteString;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Tests membership in the bloom filter the backend sends with an existence filter.
 *
 * <p>
 * Each value is hashed with MD5; the digest is read as two little-endian unsigned 64-bit
 * integers <code>h1</code> and <code>h2</code>, and the value's bits are
 * <code>(h1 + i * h2) mod bitCount</code> for <code>i</code> in <code>[0, hashCount)</code>.
 * Bit <code>n</code> is bit <code>n % 8</code> (least significant first) of byte <code>n / 8</code>.
 */
public final class BloomFilter {
	private final int bitCount;
	private final ByteString bitmap;
	private final int hashCount;

	private BloomFilter(ByteString bitmap, int padding, int hashCount) {
		this.bitmap = bitmap;
		this.hashCount = hashCount;
		this.bitCount = bitmap.size() * 8 - padding;
	}

	/**
	 * @throws BloomFilterCreateException if the parameters are inconsistent
	 */
	public static BloomFilter create(ByteString bitmap, int padding, int hashCount) throws BloomFilterCreateException {
		if (padding < 0 || padding >= 8) {
			throw new BloomFilterCreateException("Invalid padding: " + padding);
		}
		if (hashCount < 0) {
			throw new BloomFilterCreateException("Invalid hash count: " + hashCount);
		}
		if (bitmap.size() > 0 && hashCount == 0) {
			throw new BloomFilterCreateException("Invalid hash count: " + hashCount);
		}
		if (bitmap.size() == 0 && padding != 0) {
			throw new BloomFilterCreateException("Expected padding of 0 when bitmap length is 0, but got " + padding);
		}
		return new BloomFilter(bitmap, padding, hashCount);
	}

	public int bitCount() {
		return bitCount;
	}

	public int hashCount() {
		return hashCount;
	}

	/**
	 * @return false if <code>value</code> is certainly not in the filter;
	 * true if it probably is.
	 */
	public boolean mightContain(String value) {
		if (bitCount == 0) {
			return false;
		}
		byte[] digest = md5(value);
		long hash1 = getLongLittleEndian(digest, 0);
		long hash2 = getLongLittleEndian(digest, 8);
		for (int i = 0; i < hashCount; i++) {
			if (!isBitSet(bitIndex(hash1, hash2, i, bitCount))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return the position of the <code>hashIndex</code>th bit for a value with the given hashes.
	 */
	static int bitIndex(long hash1, long hash2, int hashIndex, int bitCount) {
		long combined = hash1 + hash2 * hashIndex;
		return (int) Long.remainderUnsigned(combined, bitCount);
	}

	static byte[] md5(String value) {
		try {
			return MessageDigest.getInstance("MD5").digest(value.getBytes(StandardCharsets.UTF_8));
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("MD5 is required of every Java platform", e);
		}
	}

	static long getLongLittleEndian(byte[] bytes, int offset) {
		long result = 0;
		for (int i = 0; i < 8; i++) {
			result |= (bytes[offset + i] & 0xFFL) << (i * 8);
		}
		return result;
	}

	private boolean isBitSet(int index) {
		byte b = bitmap.byteAt(index / 8);
		return (b & (0x01 << (index % 8))) != 0;
	}

	@Override
	public String toString() {
		return "BloomFilter{bitCount=" + bitCount + ", hashCount=" + hashCount + "}";
	}

	public static final class BloomFilterCreateException extends Exception {
		public BloomFilterCreateException(String message) {
			super(message);
		}
	}
}
