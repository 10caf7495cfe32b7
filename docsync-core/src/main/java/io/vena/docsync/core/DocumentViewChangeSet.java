package io.vena.docsync.core;

import io.vena.docsync.model.DocumentKey;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeMap;

import static io.vena.docsync.core.DocumentViewChange.Type.ADDED;
import static io.vena.docsync.core.DocumentViewChange.Type.METADATA;
import static io.vena.docsync.core.DocumentViewChange.Type.MODIFIED;
import static io.vena.docsync.core.DocumentViewChange.Type.REMOVED;

/**
 * Collapses successive changes to the same document into the single change between the first
 * and last states.
 */
public final class DocumentViewChangeSet {
	private final TreeMap<DocumentKey, DocumentViewChange> changes = new TreeMap<>();

	public void addChange(DocumentViewChange change) {
		DocumentKey key = change.document().key();
		DocumentViewChange old = changes.get(key);
		if (old == null) {
			changes.put(key, change);
			return;
		}

		DocumentViewChange.Type oldType = old.type();
		DocumentViewChange.Type newType = change.type();
		if (newType != ADDED && oldType == METADATA) {
			changes.put(key, change);
		} else if (newType == METADATA && oldType != REMOVED) {
			changes.put(key, DocumentViewChange.create(oldType, change.document()));
		} else if (newType == MODIFIED && oldType == MODIFIED) {
			changes.put(key, DocumentViewChange.create(MODIFIED, change.document()));
		} else if (newType == MODIFIED && oldType == ADDED) {
			changes.put(key, DocumentViewChange.create(ADDED, change.document()));
		} else if (newType == REMOVED && oldType == ADDED) {
			changes.remove(key);
		} else if (newType == REMOVED && oldType == MODIFIED) {
			changes.put(key, DocumentViewChange.create(REMOVED, old.document()));
		} else if (newType == ADDED && oldType == REMOVED) {
			changes.put(key, DocumentViewChange.create(MODIFIED, change.document()));
		} else {
			throw new IllegalStateException("Unsupported combination of changes: " + newType + " after " + oldType);
		}
	}

	public List<DocumentViewChange> getChanges() {
		return new ArrayList<>(changes.values());
	}
}
