package io.vena.docsync.core;

import io.vena.docsync.model.DocumentKey;

/**
 * A document entering or leaving limbo in a view.
 */
public record LimboDocumentChange(Type type, DocumentKey key) {
	public enum Type {
		ADDED,
		REMOVED,
	}
}
