package io.vena.docsync.bundle;

import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import java.util.Map;
import java.util.SortedSet;

/**
 * Where a {@link BundleLoader} saves what it read.
 */
public interface BundleCallback {
	/**
	 * @return the local view of every document whose cached version changed.
	 */
	Map<DocumentKey, Document> applyBundledDocuments(Map<DocumentKey, MutableDocument> documents, String bundleId);

	void saveNamedQuery(NamedQuery namedQuery, SortedSet<DocumentKey> documentKeys);

	void saveBundle(BundleMetadata bundleMetadata);
}
