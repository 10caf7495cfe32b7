package io.vena.docsync.bundle;

import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;

/**
 * Accumulates the elements of a bundle, then saves them all at once with {@link #applyChanges()}.
 */
public final class BundleLoader {
	private final BundleCallback bundleCallback;
	private final BundleMetadata bundleMetadata;
	private final List<NamedQuery> queries = new ArrayList<>();
	private final Map<DocumentKey, MutableDocument> documents = new TreeMap<>();
	private final Map<DocumentKey, BundledDocumentMetadata> documentsMetadata = new HashMap<>();

	private @Nullable BundledDocumentMetadata currentMetadata;
	private long bytesLoaded;

	public BundleLoader(BundleCallback bundleCallback, BundleMetadata bundleMetadata) {
		this.bundleCallback = bundleCallback;
		this.bundleMetadata = bundleMetadata;
	}

	/**
	 * @param byteSize the number of bytes the element took in the bundle
	 * @return new progress if the element completed a document, otherwise null
	 */
	public @Nullable LoadBundleTaskProgress addElement(BundleElement element, long byteSize) {
		if (element instanceof BundleMetadata) {
			throw new IllegalArgumentException("Unexpected bundle metadata element");
		}
		int beforeDocumentCount = documents.size();
		if (element instanceof NamedQuery) {
			queries.add((NamedQuery) element);
		} else if (element instanceof BundledDocumentMetadata) {
			BundledDocumentMetadata metadata = (BundledDocumentMetadata) element;
			documentsMetadata.put(metadata.key(), metadata);
			currentMetadata = metadata;
			if (!metadata.exists()) {
				documents.put(metadata.key(), MutableDocument.newNoDocument(metadata.key(), metadata.readTime()).setReadTime(metadata.readTime()));
				currentMetadata = null;
			}
		} else if (element instanceof BundleDocument) {
			BundleDocument bundleDocument = (BundleDocument) element;
			if (currentMetadata == null || !bundleDocument.key().equals(currentMetadata.key())) {
				throw new IllegalArgumentException("The document being added does not match the stored metadata: " + bundleDocument.key());
			}
			documents.put(bundleDocument.key(), bundleDocument.document().mutableCopy().setReadTime(currentMetadata.readTime()));
			currentMetadata = null;
		}
		bytesLoaded += byteSize;
		if (beforeDocumentCount == documents.size()) {
			return null;
		}
		return new LoadBundleTaskProgress(documents.size(), bundleMetadata.totalDocuments(),
			bytesLoaded, bundleMetadata.totalBytes(), LoadBundleTaskProgress.TaskState.RUNNING);
	}

	/**
	 * Saves the documents, named queries and bundle metadata.
	 *
	 * @return the local view of every changed document
	 * @throws IllegalStateException if the bundle was incomplete
	 */
	public Map<DocumentKey, Document> applyChanges() {
		if (currentMetadata != null) {
			throw new IllegalStateException("Bundled documents end with a document metadata element instead of a document");
		}
		if (bundleMetadata.totalDocuments() != documents.size()) {
			throw new IllegalStateException("Expected " + bundleMetadata.totalDocuments()
				+ " documents, but loaded " + documents.size());
		}
		Map<DocumentKey, Document> changes = bundleCallback.applyBundledDocuments(documents, bundleMetadata.bundleId());
		Map<String, SortedSet<DocumentKey>> queryDocumentMap = getQueryDocumentMapping();
		for (NamedQuery namedQuery: queries) {
			SortedSet<DocumentKey> keys = queryDocumentMap.getOrDefault(namedQuery.name(), new TreeSet<>());
			bundleCallback.saveNamedQuery(namedQuery, keys);
		}
		bundleCallback.saveBundle(bundleMetadata);
		return changes;
	}

	private Map<String, SortedSet<DocumentKey>> getQueryDocumentMapping() {
		Map<String, SortedSet<DocumentKey>> result = new HashMap<>();
		for (NamedQuery namedQuery: queries) {
			result.put(namedQuery.name(), new TreeSet<>());
		}
		for (BundledDocumentMetadata metadata: documentsMetadata.values()) {
			for (String query: metadata.queries()) {
				SortedSet<DocumentKey> matchingKeys = result.get(query);
				if (matchingKeys != null) {
					matchingKeys.add(metadata.key());
				}
			}
		}
		return result;
	}
}
