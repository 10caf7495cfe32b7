package io.vena.docsync.local;

import io.vena.docsync.core.DocumentViewChange;
import io.vena.docsync.core.ViewSnapshot;
import io.vena.docsync.model.DocumentKey;
import java.util.Set;
import java.util.TreeSet;

/**
 * The keys a view added and removed in one snapshot, used to pin documents
 * an application is looking at so they are not collected.
 */
public record LocalViewChanges(int targetId, boolean fromCache, Set<DocumentKey> added, Set<DocumentKey> removed) {
	public static LocalViewChanges fromViewSnapshot(int targetId, ViewSnapshot snapshot) {
		Set<DocumentKey> addedKeys = new TreeSet<>();
		Set<DocumentKey> removedKeys = new TreeSet<>();
		for (DocumentViewChange docChange: snapshot.changes()) {
			switch (docChange.type()) {
				case ADDED:
					addedKeys.add(docChange.document().key());
					break;
				case REMOVED:
					removedKeys.add(docChange.document().key());
					break;
				default:
					break;
			}
		}
		return new LocalViewChanges(targetId, snapshot.isFromCache(), addedKeys, removedKeys);
	}
}
