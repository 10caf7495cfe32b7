package io.vena.docsync.local;

import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.OverlayedDocument;
import java.util.Map;
import java.util.TreeMap;

import static java.util.Collections.unmodifiableMap;

/**
 * Local views of documents, with the id of the largest mutation batch reflected in them.
 */
public record LocalDocumentsResult(int batchId, Map<DocumentKey, Document> documents) {
	public static LocalDocumentsResult fromOverlayedDocuments(int batchId, Map<DocumentKey, OverlayedDocument> overlays) {
		Map<DocumentKey, Document> documents = new TreeMap<>();
		for (Map.Entry<DocumentKey, OverlayedDocument> entry: overlays.entrySet()) {
			documents.put(entry.getKey(), entry.getValue().document());
		}
		return new LocalDocumentsResult(batchId, unmodifiableMap(documents));
	}
}
