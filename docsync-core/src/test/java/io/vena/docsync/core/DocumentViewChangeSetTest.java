package io.vena.docsync.core;

import io.vena.docsync.model.MutableDocument;
import java.util.List;
import org.junit.jupiter.api.Test;

import static io.vena.docsync.TestUtil.doc;
import static io.vena.docsync.TestUtil.map;
import static io.vena.docsync.core.DocumentViewChange.Type.ADDED;
import static io.vena.docsync.core.DocumentViewChange.Type.METADATA;
import static io.vena.docsync.core.DocumentViewChange.Type.MODIFIED;
import static io.vena.docsync.core.DocumentViewChange.Type.REMOVED;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentViewChangeSetTest {
	final MutableDocument v1 = doc("rooms/a", 1, map("n", 1));
	final MutableDocument v2 = doc("rooms/a", 2, map("n", 2));
	final MutableDocument v3 = doc("rooms/a", 3, map("n", 3));

	@Test
	void distinctKeys_areKeptInKeyOrder() {
		MutableDocument b = doc("rooms/b", 1, map());
		DocumentViewChangeSet set = new DocumentViewChangeSet();
		set.addChange(DocumentViewChange.create(ADDED, b));
		set.addChange(DocumentViewChange.create(REMOVED, v1));
		assertEquals(List.of(
			DocumentViewChange.create(REMOVED, v1),
			DocumentViewChange.create(ADDED, b)
		), set.getChanges());
	}

	@Test
	void addedThenModified_isAddedWithLatestDocument() {
		assertCollapses(ADDED, MODIFIED, DocumentViewChange.create(ADDED, v2));
	}

	@Test
	void addedThenRemoved_disappears() {
		DocumentViewChangeSet set = new DocumentViewChangeSet();
		set.addChange(DocumentViewChange.create(ADDED, v1));
		set.addChange(DocumentViewChange.create(REMOVED, v2));
		assertTrue(set.getChanges().isEmpty());
	}

	@Test
	void modifiedThenModified_isModified() {
		assertCollapses(MODIFIED, MODIFIED, DocumentViewChange.create(MODIFIED, v2));
	}

	@Test
	void modifiedThenRemoved_isRemovedWithOldDocument() {
		assertCollapses(MODIFIED, REMOVED, DocumentViewChange.create(REMOVED, v1));
	}

	@Test
	void removedThenAdded_isModified() {
		assertCollapses(REMOVED, ADDED, DocumentViewChange.create(MODIFIED, v2));
	}

	@Test
	void metadataThenModified_isModified() {
		assertCollapses(METADATA, MODIFIED, DocumentViewChange.create(MODIFIED, v2));
	}

	@Test
	void modifiedThenMetadata_keepsModifiedWithLatestDocument() {
		assertCollapses(MODIFIED, METADATA, DocumentViewChange.create(MODIFIED, v2));
	}

	@Test
	void threeChanges_collapseToOne() {
		DocumentViewChangeSet set = new DocumentViewChangeSet();
		set.addChange(DocumentViewChange.create(ADDED, v1));
		set.addChange(DocumentViewChange.create(METADATA, v2));
		set.addChange(DocumentViewChange.create(MODIFIED, v3));
		assertEquals(List.of(DocumentViewChange.create(ADDED, v3)), set.getChanges());
	}

	@Test
	void impossibleSequences_throw() {
		assertThrows(IllegalStateException.class, () -> collapse(ADDED, ADDED));
		assertThrows(IllegalStateException.class, () -> collapse(REMOVED, REMOVED));
		assertThrows(IllegalStateException.class, () -> collapse(REMOVED, MODIFIED));
		assertThrows(IllegalStateException.class, () -> collapse(METADATA, ADDED));
	}

	private void assertCollapses(DocumentViewChange.Type first, DocumentViewChange.Type second, DocumentViewChange expected) {
		assertEquals(List.of(expected), collapse(first, second), first + " then " + second);
	}

	private List<DocumentViewChange> collapse(DocumentViewChange.Type first, DocumentViewChange.Type second) {
		DocumentViewChangeSet set = new DocumentViewChangeSet();
		set.addChange(DocumentViewChange.create(first, v1));
		set.addChange(DocumentViewChange.create(second, v2));
		return set.getChanges();
	}
}
