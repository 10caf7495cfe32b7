package io.vena.docsync.model.mutation;

import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.value.IntegerValue;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static io.vena.docsync.TestUtil.deleteMutation;
import static io.vena.docsync.TestUtil.doc;
import static io.vena.docsync.TestUtil.field;
import static io.vena.docsync.TestUtil.key;
import static io.vena.docsync.TestUtil.map;
import static io.vena.docsync.TestUtil.mutationResult;
import static io.vena.docsync.TestUtil.patchMutation;
import static io.vena.docsync.TestUtil.setMutation;
import static io.vena.docsync.TestUtil.version;
import static io.vena.docsync.TestUtil.wrapObject;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MutationTest {
	private static final Instant WRITE_TIME = Instant.parse("2023-01-01T00:00:00Z");

	@Test
	void setThenUpdate_mergesFields() {
		MutableDocument document = MutableDocument.newInvalidDocument(key("rooms/r1"));
		FieldMask mask = FieldMask.EMPTY;
		mask = setMutation("rooms/r1", map("x", 1)).applyToLocalView(document, mask, WRITE_TIME);
		mask = patchMutation("rooms/r1", map("y", 2)).applyToLocalView(document, mask, WRITE_TIME);

		assertEquals(wrapObject(map("x", 1, "y", 2)), document.data());
		assertTrue(document.isFoundDocument());
		assertTrue(document.hasLocalMutations());
		assertNull(mask, "The set replaced the whole document");

		Mutation overlay = Mutation.calculateOverlayMutation(document, mask);
		assertEquals(new SetMutation(key("rooms/r1"), wrapObject(map("x", 1, "y", 2)), Precondition.NONE), overlay);
	}

	@Test
	void patchOfMissingDocument_hasNoEffect() {
		MutableDocument document = MutableDocument.newInvalidDocument(key("rooms/r1"));
		FieldMask mask = patchMutation("rooms/r1", map("y", 2)).applyToLocalView(document, FieldMask.EMPTY, WRITE_TIME);

		assertFalse(document.isValidDocument());
		assertFalse(document.hasLocalMutations());
		assertEquals(FieldMask.EMPTY, mask);
		assertNull(Mutation.calculateOverlayMutation(document, mask));
	}

	@Test
	void patchOfExistingDocument_accumulatesMask() {
		MutableDocument document = doc("rooms/r1", 1, map("a", 1, "b", 2));
		FieldMask mask = FieldMask.EMPTY;
		mask = patchMutation("rooms/r1", map("a", 10)).applyToLocalView(document, mask, WRITE_TIME);
		mask = patchMutation("rooms/r1", map("c", 30)).applyToLocalView(document, mask, WRITE_TIME);

		assertEquals(wrapObject(map("a", 10, "b", 2, "c", 30)), document.data());
		assertEquals(version(1), document.version(), "Local mutations don't change the version");
		assertEquals(FieldMask.fromSet(Set.of(field("a"), field("c"))), mask);

		Mutation overlay = Mutation.calculateOverlayMutation(document, mask);
		assertEquals(
			new PatchMutation(key("rooms/r1"), wrapObject(map("a", 10, "c", 30)), mask, Precondition.NONE),
			overlay);
	}

	@Test
	void deletedNestedField_overlayPatchesParent() {
		MutableDocument document = doc("rooms/r1", 1, map("a", map("b", 1, "c", 2)));
		FieldMask mask = patchMutation("rooms/r1", map("a.b", null)).applyToLocalView(document, FieldMask.EMPTY, WRITE_TIME);

		assertEquals(wrapObject(map("a", map("c", 2))), document.data());

		PatchMutation overlay = (PatchMutation) Mutation.calculateOverlayMutation(document, mask);
		assertEquals(FieldMask.fromSet(Set.of(field("a"))), overlay.mask());
		assertEquals(wrapObject(map("a", map("c", 2))), overlay.value());
	}

	@Test
	void deleteThenSet_recreatesDocument() {
		MutableDocument document = doc("rooms/r1", 1, map("a", 1));
		FieldMask mask = deleteMutation("rooms/r1").applyToLocalView(document, FieldMask.EMPTY, WRITE_TIME);
		assertTrue(document.isNoDocument());
		assertNull(mask);
		assertEquals(new DeleteMutation(key("rooms/r1"), Precondition.NONE), Mutation.calculateOverlayMutation(document, mask));

		mask = setMutation("rooms/r1", map("b", 2)).applyToLocalView(document, mask, WRITE_TIME);
		assertTrue(document.isFoundDocument());
		assertEquals(wrapObject(map("b", 2)), document.data());
	}

	@Test
	void increment_localThenRemote() {
		PatchMutation increment = new PatchMutation(key("counters/c1"), wrapObject(map()), FieldMask.EMPTY, Precondition.NONE,
			List.of(new FieldTransform(field("count"), new NumericIncrementOperation(new IntegerValue(2)))));

		MutableDocument local = doc("counters/c1", 1, map("count", 1));
		FieldMask mask = increment.applyToLocalView(local, FieldMask.EMPTY, WRITE_TIME);
		assertEquals(wrapObject(map("count", 3)), local.data());
		assertEquals(FieldMask.fromSet(Set.of(field("count"))), mask);

		MutableDocument remote = doc("counters/c1", 1, map("count", 1));
		increment.applyToRemoteDocument(remote, new MutationResult(version(5), List.of(new IntegerValue(10))));
		assertEquals(wrapObject(map("count", 10)), remote.data(), "The server's result wins");
		assertEquals(version(5), remote.version());
		assertTrue(remote.hasCommittedMutations());
	}

	@Test
	void increment_nonNumericBaseStartsAtZero() {
		PatchMutation increment = new PatchMutation(key("counters/c1"), wrapObject(map()), FieldMask.EMPTY, Precondition.NONE,
			List.of(new FieldTransform(field("count"), new NumericIncrementOperation(new IntegerValue(2)))));
		MutableDocument local = doc("counters/c1", 1, map("count", "many"));
		increment.applyToLocalView(local, FieldMask.EMPTY, WRITE_TIME);
		assertEquals(wrapObject(map("count", 2)), local.data());
	}

	@Test
	void patchAcknowledgedForUnknownDocument_becomesUnknown() {
		MutableDocument document = MutableDocument.newInvalidDocument(key("rooms/r1"));
		patchMutation("rooms/r1", map("y", 2)).applyToRemoteDocument(document, mutationResult(7));
		assertTrue(document.isUnknownDocument());
		assertEquals(version(7), document.version());
	}

	@Test
	void setAcknowledged_isCommitted() {
		MutableDocument document = MutableDocument.newInvalidDocument(key("rooms/r1"));
		setMutation("rooms/r1", map("x", 1)).applyToRemoteDocument(document, mutationResult(7));
		assertTrue(document.isFoundDocument());
		assertTrue(document.hasCommittedMutations());
		assertEquals(version(7), document.version());
		assertEquals(wrapObject(map("x", 1)), document.data());
	}

	@Test
	void updateTimePrecondition() {
		Precondition precondition = Precondition.updateTime(version(3));
		assertTrue(precondition.isValidFor(doc("rooms/r1", 3, map())));
		assertFalse(precondition.isValidFor(doc("rooms/r1", 4, map())));
		assertFalse(precondition.isValidFor(MutableDocument.newNoDocument(key("rooms/r1"), version(3))));
	}
}
