package io.vena.docsync.local;

import io.vena.docsync.model.DocumentKey;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

import static io.vena.docsync.TestUtil.key;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReferenceSetTest {
	final DocumentKey a = key("rooms/a");
	final DocumentKey b = key("rooms/b");

	@Test
	void keyStaysReferencedUntilLastContainerReleasesIt() {
		ReferenceSet references = new ReferenceSet();
		assertTrue(references.isEmpty());

		references.addReference(a, 1);
		references.addReference(a, 2);
		assertTrue(references.containsKey(a));
		assertFalse(references.containsKey(b));

		references.removeReference(a, 1);
		assertTrue(references.containsKey(a), "Still referenced by 2");

		references.removeReference(a, 2);
		assertFalse(references.containsKey(a));
		assertTrue(references.isEmpty());
	}

	@Test
	void removeReferencesForId_returnsTheReleasedKeys() {
		ReferenceSet references = new ReferenceSet();
		references.addReferences(List.of(a, b), 1);
		references.addReference(b, 2);

		assertEquals(Set.of(a, b), references.referencedKeysForId(1));
		assertEquals(Set.of(a, b), references.removeReferencesForId(1));
		assertFalse(references.containsKey(a));
		assertTrue(references.containsKey(b));
		assertTrue(references.referencedKeysForId(1).isEmpty());
		assertEquals(Set.of(b), references.referencedKeysForId(2));
	}

	@Test
	void addingTwice_isIdempotent() {
		ReferenceSet references = new ReferenceSet();
		references.addReference(a, 1);
		references.addReference(a, 1);
		references.removeReference(a, 1);
		assertFalse(references.containsKey(a));
	}

	@Test
	void removeAllReferences() {
		ReferenceSet references = new ReferenceSet();
		references.addReferences(List.of(a, b), 3);
		references.removeAllReferences();
		assertTrue(references.isEmpty());
		assertTrue(references.referencedKeysForId(3).isEmpty());
	}
}
