package io.vena.docsync.bundle;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.SnapshotVersion;
import java.util.List;

/**
 * @param exists false for a document the bundle reports as deleted; no {@link BundleDocument} follows
 * @param queries the names of the bundled queries whose results include this document
 */
public record BundledDocumentMetadata(DocumentKey key, SnapshotVersion readTime, boolean exists, List<String> queries) implements BundleElement {
	public BundledDocumentMetadata {
		queries = List.copyOf(queries);
	}
}
