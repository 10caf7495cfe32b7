package io.vena.docsync.model.mutation;

import io.vena.docsync.model.MutableDocument;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.IntStream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import static io.vena.docsync.TestUtil.deleteMutation;
import static io.vena.docsync.TestUtil.deletedDoc;
import static io.vena.docsync.TestUtil.doc;
import static io.vena.docsync.TestUtil.key;
import static io.vena.docsync.TestUtil.map;
import static io.vena.docsync.TestUtil.patchMutation;
import static io.vena.docsync.TestUtil.setMutation;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Applying a document's single overlay to its remote version must give the same local view
 * as replaying every pending mutation in order.
 */
class OverlayReplayTest {
	private static final String KEY = "rooms/r1";
	private static final Instant WRITE_TIME = Instant.parse("2023-01-01T00:00:00Z");
	private static final String[] FIELDS = { "a", "b", "n", "n.x", "n.y" };

	static IntStream seeds() {
		return IntStream.range(0, 200);
	}

	@ParameterizedTest
	@MethodSource("seeds")
	void overlayEqualsReplay(int seed) {
		Random random = new Random(seed);
		MutableDocument base = randomBase(random);
		List<Mutation> mutations = new ArrayList<>();
		int count = 1 + random.nextInt(6);
		for (int i = 0; i < count; i++) {
			mutations.add(randomMutation(random));
		}

		MutableDocument replayed = base.mutableCopy();
		FieldMask mask = FieldMask.EMPTY;
		for (Mutation mutation: mutations) {
			mask = mutation.applyToLocalView(replayed, mask, WRITE_TIME);
		}

		Mutation overlay = Mutation.calculateOverlayMutation(replayed, mask);
		MutableDocument overlaid = base.mutableCopy();
		if (overlay != null) {
			overlay.applyToLocalView(overlaid, FieldMask.EMPTY, WRITE_TIME);
		}

		String description = "Base " + base + " with mutations " + mutations + " and overlay " + overlay;
		assertEquals(replayed.isFoundDocument(), overlaid.isFoundDocument(), description);
		assertEquals(replayed.isNoDocument(), overlaid.isNoDocument(), description);
		assertEquals(replayed.data(), overlaid.data(), description);
	}

	private static MutableDocument randomBase(Random random) {
		switch (random.nextInt(3)) {
			case 0:
				return MutableDocument.newInvalidDocument(key(KEY));
			case 1:
				return deletedDoc(KEY, 1);
			default:
				return doc(KEY, 1, randomData(random));
		}
	}

	private static Mutation randomMutation(Random random) {
		switch (random.nextInt(4)) {
			case 0:
				return setMutation(KEY, randomData(random));
			case 1:
				return deleteMutation(KEY);
			default:
				Map<String, Object> patch = new LinkedHashMap<>();
				int fields = 1 + random.nextInt(2);
				for (int i = 0; i < fields; i++) {
					String field = FIELDS[random.nextInt(FIELDS.length)];
					if (patch.keySet().stream().anyMatch(f -> f.startsWith(field) || field.startsWith(f))) {
						continue;
					}
					patch.put(field, random.nextInt(4) == 0 ? null : random.nextInt(10));
				}
				return patchMutation(KEY, patch);
		}
	}

	private static Map<String, Object> randomData(Random random) {
		Map<String, Object> result = new LinkedHashMap<>();
		if (random.nextBoolean()) {
			result.put("a", random.nextInt(10));
		}
		if (random.nextBoolean()) {
			result.put("b", random.nextInt(10));
		}
		if (random.nextBoolean()) {
			result.put("n", random.nextBoolean() ? map("x", random.nextInt(10)) : random.nextInt(10));
		}
		return result;
	}
}
