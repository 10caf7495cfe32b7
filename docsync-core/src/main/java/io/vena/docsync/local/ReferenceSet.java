package io.vena.docsync.local;

import io.vena.docsync.model.DocumentKey;
import java.util.SortedSet;
import java.util.TreeSet;
import org.pcollections.TreePSet;

/**
 * The set of (document key, container id) pairs, indexed both ways.
 * Used for the keys pinned by active views and for the keys of mutation batches and targets
 * in memory persistence.
 */
public final class ReferenceSet {
	private TreePSet<DocumentReference> referencesByKey = TreePSet.empty(DocumentReference.BY_KEY);
	private TreePSet<DocumentReference> referencesByTarget = TreePSet.empty(DocumentReference.BY_TARGET);

	public boolean isEmpty() {
		return referencesByKey.isEmpty();
	}

	public void addReference(DocumentKey key, int targetOrBatchId) {
		DocumentReference ref = new DocumentReference(key, targetOrBatchId);
		referencesByKey = referencesByKey.plus(ref);
		referencesByTarget = referencesByTarget.plus(ref);
	}

	public void addReferences(Iterable<DocumentKey> keys, int targetOrBatchId) {
		for (DocumentKey key: keys) {
			addReference(key, targetOrBatchId);
		}
	}

	public void removeReference(DocumentKey key, int targetOrBatchId) {
		removeReference(new DocumentReference(key, targetOrBatchId));
	}

	public void removeReferences(Iterable<DocumentKey> keys, int targetOrBatchId) {
		for (DocumentKey key: keys) {
			removeReference(key, targetOrBatchId);
		}
	}

	/**
	 * @return the keys that were referenced by the container.
	 */
	public SortedSet<DocumentKey> removeReferencesForId(int id) {
		SortedSet<DocumentKey> removed = new TreeSet<>();
		for (DocumentReference reference: referencesForId(id)) {
			removed.add(reference.key());
			removeReference(reference);
		}
		return removed;
	}

	public void removeAllReferences() {
		referencesByKey = TreePSet.empty(DocumentReference.BY_KEY);
		referencesByTarget = TreePSet.empty(DocumentReference.BY_TARGET);
	}

	public SortedSet<DocumentKey> referencedKeysForId(int id) {
		SortedSet<DocumentKey> result = new TreeSet<>();
		for (DocumentReference reference: referencesForId(id)) {
			result.add(reference.key());
		}
		return result;
	}

	public boolean containsKey(DocumentKey key) {
		DocumentReference lowest = referencesByKey.ceiling(new DocumentReference(key, Integer.MIN_VALUE));
		return lowest != null && lowest.key().equals(key);
	}

	private SortedSet<DocumentReference> referencesForId(int id) {
		DocumentReference start = new DocumentReference(DocumentKey.empty(), id);
		DocumentReference end = new DocumentReference(DocumentKey.empty(), id + 1);
		return referencesByTarget.subSet(start, end);
	}

	private void removeReference(DocumentReference ref) {
		referencesByKey = referencesByKey.minus(ref);
		referencesByTarget = referencesByTarget.minus(ref);
	}
}
