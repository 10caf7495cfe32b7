package io.vena.docsync.local;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.value.Value;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * One document's row in a field index.
 *
 * @param directionalValues the values of the index's ascending and descending segments, in order
 * @param arrayValue one element of the array in the index's contains segment, or null if it has none
 */
public record IndexEntry(int indexId, DocumentKey documentKey, List<Value> directionalValues, @Nullable Value arrayValue) {
	public IndexEntry {
		directionalValues = List.copyOf(directionalValues);
	}
}
