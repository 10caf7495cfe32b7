package io.vena.docsync.model.value;

import io.vena.docsync.util.ByteString;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

import static io.vena.docsync.TestUtil.key;
import static io.vena.docsync.TestUtil.map;
import static io.vena.docsync.TestUtil.wrap;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ValuesTest {
	/**
	 * Each group sorts before the next; values within a group compare equal.
	 */
	private static final List<List<Value>> ORDERED_GROUPS = List.of(
		List.of(NullValue.INSTANCE),
		List.of(BooleanValue.FALSE),
		List.of(BooleanValue.TRUE),
		List.of(new DoubleValue(Double.NaN)),
		List.of(new DoubleValue(Double.NEGATIVE_INFINITY)),
		List.of(new IntegerValue(Long.MIN_VALUE)),
		List.of(new IntegerValue(-1), new DoubleValue(-1.0)),
		List.of(new DoubleValue(-0.5)),
		List.of(new IntegerValue(0), new DoubleValue(0.0), new DoubleValue(-0.0)),
		List.of(new DoubleValue(0.5)),
		List.of(new IntegerValue(1), new DoubleValue(1.0)),
		List.of(new IntegerValue(Long.MAX_VALUE)),
		List.of(new DoubleValue(Double.POSITIVE_INFINITY)),
		List.of(new TimestampValue(Instant.ofEpochSecond(1))),
		List.of(new TimestampValue(Instant.ofEpochSecond(2))),
		List.of(new ServerTimestampValue(Instant.ofEpochSecond(1), null)),
		List.of(new StringValue("")),
		List.of(new StringValue("a")),
		List.of(new StringValue("b")),
		List.of(new BytesValue(ByteString.EMPTY)),
		List.of(new BytesValue(ByteString.copyFromUtf8("a"))),
		List.of(new ReferenceValue(key("a/a"))),
		List.of(new ReferenceValue(key("a/b"))),
		List.of(ArrayValue.of()),
		List.of(ArrayValue.of(new IntegerValue(1))),
		List.of(ArrayValue.of(new IntegerValue(1), new IntegerValue(2))),
		List.of(ArrayValue.of(new IntegerValue(2))),
		List.of(ObjectValue.empty()),
		List.of(wrap(map("a", 1))),
		List.of(wrap(map("a", 1, "b", 1))),
		List.of(wrap(map("a", 2))),
		List.of(wrap(map("b", 1)))
	);

	@Test
	void compare_ordersGroups() {
		for (int i = 0; i < ORDERED_GROUPS.size(); i++) {
			for (int j = 0; j < ORDERED_GROUPS.size(); j++) {
				for (Value left: ORDERED_GROUPS.get(i)) {
					for (Value right: ORDERED_GROUPS.get(j)) {
						int expected = Integer.compare(i, j);
						assertEquals(expected, Integer.signum(Values.compare(left, right)),
							"compare(" + left + ", " + right + ")");
					}
				}
			}
		}
	}

	@Test
	void compare_sortsShuffledValues() {
		List<Value> expected = new ArrayList<>();
		for (List<Value> group: ORDERED_GROUPS) {
			expected.add(group.get(0));
		}
		List<Value> shuffled = new ArrayList<>(expected);
		Collections.shuffle(shuffled, new Random(123));
		shuffled.sort(Values::compare);
		assertEquals(expected, shuffled);
	}

	@Test
	void compareMixed_largeMagnitudes() {
		assertThat(Values.compareMixed(0x1p63, Long.MAX_VALUE), greaterThan(0));
		assertThat(Values.compareMixed(-0x1p64, Long.MIN_VALUE), lessThan(0));
		assertEquals(0, Values.compareMixed(-0x1p63, Long.MIN_VALUE));
		assertThat(Values.compareMixed(1.5, 1), greaterThan(0));
		assertThat(Values.compareMixed(0.5, 1), lessThan(0));
	}

	@Test
	void fromJava_convertsPlainObjects() {
		ObjectValue value = Values.objectFromJava(map(
			"int", 1,
			"long", 2L,
			"double", 1.5,
			"string", "s",
			"bool", true,
			"null", null,
			"list", List.of(1, "two"),
			"nested", map("x", 1)));

		assertEquals(new IntegerValue(1), value.get("int"));
		assertEquals(new IntegerValue(2), value.get("long"));
		assertEquals(new DoubleValue(1.5), value.get("double"));
		assertEquals(new StringValue("s"), value.get("string"));
		assertEquals(BooleanValue.TRUE, value.get("bool"));
		assertEquals(NullValue.INSTANCE, value.get("null"));
		assertEquals(ArrayValue.of(new IntegerValue(1), new StringValue("two")), value.get("list"));
		assertEquals(Values.objectFromJava(map("x", 1)), value.get("nested"));
	}

	@Test
	void fromJava_rejectsUnsupported() {
		assertThrows(IllegalArgumentException.class, () -> Values.fromJava(new Object()));
	}

	@Test
	void canonicalId_distinguishesDifferentValues() {
		assertEquals(Values.canonicalId(wrap(map("a", List.of(1, 2)))), Values.canonicalId(wrap(map("a", List.of(1, 2)))));
		assertNotEquals(Values.canonicalId(wrap(map("a", List.of(1, 2)))), Values.canonicalId(wrap(map("a", List.of(2, 1)))));
		assertNotEquals(Values.canonicalId(wrap(map("a", 1))), Values.canonicalId(wrap(map("b", 1))));
	}
}
