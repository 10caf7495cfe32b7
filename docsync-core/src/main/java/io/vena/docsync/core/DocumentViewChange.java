package io.vena.docsync.core;

import io.vena.docsync.model.Document;

/**
 * How one document of a view changed between two snapshots.
 */
public record DocumentViewChange(Type type, Document document) {
	/**
	 * In the order changes of each type are reported within a snapshot.
	 */
	public enum Type {
		REMOVED,
		ADDED,
		MODIFIED,
		/** Only the document's pending-writes state changed. */
		METADATA,
	}

	public static DocumentViewChange create(Type type, Document document) {
		return new DocumentViewChange(type, document);
	}
}
