package io.vena.docsync.local;

import io.vena.docsync.model.DocumentKey;
import java.util.Comparator;

/**
 * A reference to a document from a container with an integer id:
 * a target id, or a mutation batch id.
 */
public record DocumentReference(DocumentKey key, int id) {
	public static final Comparator<DocumentReference> BY_KEY = Comparator
		.comparing(DocumentReference::key)
		.thenComparingInt(DocumentReference::id);

	public static final Comparator<DocumentReference> BY_TARGET = Comparator
		.comparingInt(DocumentReference::id)
		.thenComparing(DocumentReference::key);
}
