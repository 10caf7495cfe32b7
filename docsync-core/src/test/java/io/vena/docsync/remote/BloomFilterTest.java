package io.vena.docsync.remote;

import io.vena.docsync.remote.wire.BloomFilterMessage;
import io.vena.docsync.util.ByteString;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BloomFilterTest {

	@Test
	void insertedValues_areAlwaysReported() throws Exception {
		List<String> values = new ArrayList<>();
		for (int i = 0; i < 50; i++) {
			values.add("projects/p/databases/(default)/documents/rooms/" + i);
		}
		BloomFilterMessage message = filterOf(509, 5, values);
		BloomFilter filter = BloomFilter.create(message.bitmap(), message.padding(), message.hashCount());

		assertEquals(509, filter.bitCount());
		for (String value: values) {
			assertTrue(filter.mightContain(value), value);
		}
	}

	@Test
	void falsePositives_areRare() throws Exception {
		BloomFilterMessage message = filterOf(10_000, 7, List.of("a", "b", "c", "d", "e"));
		BloomFilter filter = BloomFilter.create(message.bitmap(), message.padding(), message.hashCount());

		int falsePositives = 0;
		for (int i = 0; i < 200; i++) {
			if (filter.mightContain("absent-" + i)) {
				falsePositives++;
			}
		}
		assertTrue(falsePositives < 5, "False positives: " + falsePositives);
	}

	@Test
	void emptyFilter_containsNothing() throws Exception {
		BloomFilter filter = BloomFilter.create(ByteString.EMPTY, 0, 0);
		assertEquals(0, filter.bitCount());
		assertFalse(filter.mightContain(""));
		assertFalse(filter.mightContain("a"));
	}

	@Test
	void invalidParameters_areRejected() {
		ByteString oneByte = ByteString.copyFrom(new byte[] { 1 });
		assertThrows(BloomFilter.BloomFilterCreateException.class, () -> BloomFilter.create(oneByte, -1, 1));
		assertThrows(BloomFilter.BloomFilterCreateException.class, () -> BloomFilter.create(oneByte, 8, 1));
		assertThrows(BloomFilter.BloomFilterCreateException.class, () -> BloomFilter.create(oneByte, 0, -1));
		assertThrows(BloomFilter.BloomFilterCreateException.class, () -> BloomFilter.create(oneByte, 0, 0));
		assertThrows(BloomFilter.BloomFilterCreateException.class, () -> BloomFilter.create(ByteString.EMPTY, 1, 1));
	}

	@Test
	void hashesAreLittleEndian() {
		byte[] bytes = { 1, 0, 0, 0, 0, 0, 0, (byte) 0x80 };
		assertEquals(0x8000_0000_0000_0001L, BloomFilter.getLongLittleEndian(bytes, 0));
	}

	@Test
	void bitIndex_treatsHashesAsUnsigned() {
		assertEquals(Long.remainderUnsigned(-1L, 10), BloomFilter.bitIndex(-1L, 0, 3, 10));
		assertTrue(BloomFilter.bitIndex(Long.MIN_VALUE, Long.MAX_VALUE, 5, 7) >= 0);
	}

	/**
	 * Builds the message a backend would send for a filter of <code>bitCount</code> bits holding <code>values</code>.
	 */
	static BloomFilterMessage filterOf(int bitCount, int hashCount, Collection<String> values) {
		int byteCount = (bitCount + 7) / 8;
		int padding = byteCount * 8 - bitCount;
		byte[] bitmap = new byte[byteCount];
		for (String value: values) {
			byte[] digest = BloomFilter.md5(value);
			long hash1 = BloomFilter.getLongLittleEndian(digest, 0);
			long hash2 = BloomFilter.getLongLittleEndian(digest, 8);
			for (int i = 0; i < hashCount; i++) {
				int index = BloomFilter.bitIndex(hash1, hash2, i, bitCount);
				bitmap[index / 8] |= (byte) (1 << (index % 8));
			}
		}
		return new BloomFilterMessage(ByteString.copyFrom(bitmap), padding, hashCount);
	}
}
