package io.vena.docsync.local;

import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import java.util.Map;
import java.util.Set;

/**
 * @param documents the local view of the documents that match the query
 * @param remoteKeys the keys the backend last reported as matching the query's target
 */
public record QueryResult(Map<DocumentKey, Document> documents, Set<DocumentKey> remoteKeys) {
}
