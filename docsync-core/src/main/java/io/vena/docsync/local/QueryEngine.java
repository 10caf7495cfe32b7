package io.vena.docsync.local;

import io.vena.docsync.core.Query;
import io.vena.docsync.core.Target;
import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.DocumentSet;
import io.vena.docsync.model.IndexOffset;
import io.vena.docsync.model.SnapshotVersion;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs queries against the local cache, reading as few documents as it can.
 *
 * <p>
 * Three strategies are tried in order:
 * <ol>
 *     <li>
 *         A configured field index serving the query supplies candidate keys, and only
 *         documents changed since the index was last backfilled are scanned.
 *     </li>
 *     <li>
 *         When the query's previous results were computed from a consistent snapshot with no
 *         documents in limbo, those results are re-read, and only documents changed since
 *         that snapshot are scanned.
 *     </li>
 *     <li>
 *         Otherwise, the whole collection is scanned.
 *     </li>
 * </ol>
 *
 * <p>
 * Limit queries need care: a local edit can move a document out of the limit, so a previously
 * unseen document must take its place. When that may have happened, a narrower strategy
 * gives way to a wider one.
 */
public final class QueryEngine {
	private LocalDocumentsView localDocumentsView;
	private IndexManager indexManager;
	private boolean initialized;

	public void initialize(LocalDocumentsView localDocumentsView, IndexManager indexManager) {
		this.localDocumentsView = localDocumentsView;
		this.indexManager = indexManager;
		this.initialized = true;
	}

	public Map<DocumentKey, Document> getDocumentsMatchingQuery(Query query, SnapshotVersion lastLimboFreeSnapshotVersion, Set<DocumentKey> remoteKeys) {
		if (!initialized) {
			throw new IllegalStateException("initialize() not called");
		}
		Map<DocumentKey, Document> result = performQueryUsingIndex(query);
		if (result != null) {
			return result;
		}
		result = performQueryUsingRemoteKeys(query, remoteKeys, lastLimboFreeSnapshotVersion);
		if (result != null) {
			return result;
		}
		return executeFullCollectionScan(query);
	}

	private @Nullable Map<DocumentKey, Document> performQueryUsingIndex(Query query) {
		if (query.matchesAllDocuments()) {
			return null;
		}
		Target target = query.toTarget();
		IndexManager.IndexType indexType = indexManager.getIndexType(target);
		if (indexType == IndexManager.IndexType.NONE) {
			return null;
		}
		if (query.hasLimit() && indexType == IndexManager.IndexType.PARTIAL) {
			// A partial index can return too many documents, or in the wrong order, so the limit is applied later
			return performQueryUsingIndex(query.limitToFirst(Target.NO_LIMIT));
		}

		List<DocumentKey> keys = indexManager.getDocumentsMatchingTarget(target);
		if (keys == null) {
			throw new IllegalStateException("Index type " + indexType + " but no index serves " + target);
		}
		Map<DocumentKey, Document> indexedDocuments = localDocumentsView.getDocuments(keys);
		IndexOffset offset = indexManager.getMinOffset(target);
		DocumentSet previousResults = applyQuery(query, indexedDocuments);
		if (needsRefill(query, keys.size(), previousResults, offset.readTime())) {
			return performQueryUsingIndex(query.limitToFirst(Target.NO_LIMIT));
		}
		LOGGER.debug("Using index for query {}", query);
		return appendRemainingResults(previousResults, query, offset);
	}

	private @Nullable Map<DocumentKey, Document> performQueryUsingRemoteKeys(Query query, Set<DocumentKey> remoteKeys, SnapshotVersion lastLimboFreeSnapshotVersion) {
		if (query.matchesAllDocuments()) {
			// Scanning the collection is cheaper than looking up every key
			return null;
		}
		if (lastLimboFreeSnapshotVersion.equals(SnapshotVersion.NONE)) {
			return null;
		}
		Map<DocumentKey, Document> documents = localDocumentsView.getDocuments(remoteKeys);
		DocumentSet previousResults = applyQuery(query, documents);
		if (needsRefill(query, remoteKeys.size(), previousResults, lastLimboFreeSnapshotVersion)) {
			return null;
		}
		LOGGER.debug("Re-using previous result from {} to execute query {}", lastLimboFreeSnapshotVersion, query);
		return appendRemainingResults(previousResults, query,
			IndexOffset.createSuccessor(lastLimboFreeSnapshotVersion, IndexOffset.INITIAL_LARGEST_BATCH_ID));
	}

	private DocumentSet applyQuery(Query query, Map<DocumentKey, Document> documents) {
		DocumentSet queryResults = DocumentSet.emptySet(query.comparator());
		for (Document document: documents.values()) {
			if (query.matches(document)) {
				queryResults = queryResults.add(document);
			}
		}
		return queryResults;
	}

	/**
	 * Decides whether a limit query's previous results can be trusted.
	 * They cannot if a document dropped out of them, or if the document at the edge of the
	 * limit was edited locally or changed after the results were computed,
	 * since a document not in the previous results may now sort before it.
	 *
	 * @param expectedDocumentCount the number of documents the previous results had
	 * @param sortedPreviousResults those of the previous results that still match
	 * @param limboFreeSnapshotVersion the snapshot at which the previous results were consistent
	 */
	boolean needsRefill(Query query, int expectedDocumentCount, DocumentSet sortedPreviousResults, SnapshotVersion limboFreeSnapshotVersion) {
		if (!query.hasLimit()) {
			return false;
		}
		if (expectedDocumentCount != sortedPreviousResults.size()) {
			return true;
		}
		Document documentAtLimitEdge = query.limitType() == Query.LimitType.LIMIT_TO_FIRST
			? sortedPreviousResults.getLastDocument()
			: sortedPreviousResults.getFirstDocument();
		if (documentAtLimitEdge == null) {
			return false;
		}
		return documentAtLimitEdge.hasPendingWrites()
			|| documentAtLimitEdge.version().compareTo(limboFreeSnapshotVersion) > 0;
	}

	private Map<DocumentKey, Document> executeFullCollectionScan(Query query) {
		LOGGER.debug("Using full collection scan to execute query {}", query);
		return localDocumentsView.getDocumentsMatchingQuery(query, IndexOffset.NONE);
	}

	/**
	 * Combines previous results with every matching document changed after <code>offset</code>.
	 */
	private Map<DocumentKey, Document> appendRemainingResults(Iterable<Document> previousResults, Query query, IndexOffset offset) {
		Map<DocumentKey, Document> remainingResults = localDocumentsView.getDocumentsMatchingQuery(query, offset);
		for (Document document: previousResults) {
			remainingResults.put(document.key(), document);
		}
		return remainingResults;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(QueryEngine.class);
}
