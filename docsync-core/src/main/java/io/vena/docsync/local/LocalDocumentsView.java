package io.vena.docsync.local;

import io.vena.docsync.core.Query;
import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.IndexOffset;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.OverlayedDocument;
import io.vena.docsync.model.ResourcePath;
import io.vena.docsync.model.mutation.FieldMask;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.MutationBatch;
import io.vena.docsync.model.mutation.Overlay;
import io.vena.docsync.model.mutation.PatchMutation;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;

/**
 * Computes what the application sees: the cached remote documents with the current user's
 * overlays applied on top.
 *
 * <p>
 * Must be used within a transaction.
 */
public final class LocalDocumentsView {
	private final RemoteDocumentCache remoteDocumentCache;
	private final MutationQueue mutationQueue;
	private final DocumentOverlayCache documentOverlayCache;
	private final IndexManager indexManager;

	public LocalDocumentsView(RemoteDocumentCache remoteDocumentCache, MutationQueue mutationQueue, DocumentOverlayCache documentOverlayCache, IndexManager indexManager) {
		this.remoteDocumentCache = remoteDocumentCache;
		this.mutationQueue = mutationQueue;
		this.documentOverlayCache = documentOverlayCache;
		this.indexManager = indexManager;
	}

	/**
	 * @return the local view of the document; an invalid document if nothing is known about it.
	 */
	public Document getDocument(DocumentKey key) {
		Overlay overlay = documentOverlayCache.getOverlay(key);
		MutableDocument fromOverlay = getBaseDocument(key, overlay);
		if (overlay != null) {
			overlay.mutation().applyToLocalView(fromOverlay, FieldMask.EMPTY, Instant.now());
		}
		return fromOverlay;
	}

	public Map<DocumentKey, Document> getDocuments(Iterable<DocumentKey> keys) {
		Map<DocumentKey, MutableDocument> docs = remoteDocumentCache.getAll(keys);
		return getLocalViewOfDocuments(docs, new HashSet<>());
	}

	/**
	 * Applies overlays to the given remote documents, in place.
	 *
	 * @param existenceStateChanged keys of documents that started or stopped existing remotely;
	 *                              their patch overlays are recomputed, since a precondition may now hold
	 */
	Map<DocumentKey, Document> getLocalViewOfDocuments(Map<DocumentKey, MutableDocument> docs, Set<DocumentKey> existenceStateChanged) {
		Map<DocumentKey, Overlay> overlays = new HashMap<>();
		populateOverlays(overlays, docs.keySet());
		Map<DocumentKey, Document> result = new TreeMap<>();
		for (Map.Entry<DocumentKey, OverlayedDocument> entry: computeViews(docs, overlays, existenceStateChanged).entrySet()) {
			result.put(entry.getKey(), entry.getValue().document());
		}
		return result;
	}

	/**
	 * Like {@link #getLocalViewOfDocuments}, also reporting which fields the overlays changed.
	 */
	Map<DocumentKey, OverlayedDocument> getOverlayedDocuments(Map<DocumentKey, MutableDocument> docs) {
		Map<DocumentKey, Overlay> overlays = new HashMap<>();
		populateOverlays(overlays, docs.keySet());
		return computeViews(docs, overlays, new HashSet<>());
	}

	private Map<DocumentKey, OverlayedDocument> computeViews(Map<DocumentKey, MutableDocument> docs, Map<DocumentKey, Overlay> overlays, Set<DocumentKey> existenceStateChanged) {
		Map<DocumentKey, MutableDocument> recalculateDocuments = new HashMap<>();
		Map<DocumentKey, FieldMask> mutatedFields = new HashMap<>();
		for (MutableDocument doc: docs.values()) {
			Overlay overlay = overlays.get(doc.key());
			// A missing overlay is recalculated too: a patch whose precondition failed before may hold now
			if (existenceStateChanged.contains(doc.key()) && (overlay == null || overlay.mutation() instanceof PatchMutation)) {
				recalculateDocuments.put(doc.key(), doc);
			} else if (overlay != null) {
				mutatedFields.put(doc.key(), overlay.mutation().getFieldMask());
				overlay.mutation().applyToLocalView(doc, overlay.mutation().getFieldMask(), Instant.now());
			} else {
				mutatedFields.put(doc.key(), FieldMask.EMPTY);
			}
		}
		mutatedFields.putAll(recalculateAndSaveOverlays(recalculateDocuments));
		Map<DocumentKey, OverlayedDocument> result = new HashMap<>();
		for (Map.Entry<DocumentKey, MutableDocument> entry: docs.entrySet()) {
			result.put(entry.getKey(), new OverlayedDocument(entry.getValue(), mutatedFields.get(entry.getKey())));
		}
		return result;
	}

	private void populateOverlays(Map<DocumentKey, Overlay> overlays, Set<DocumentKey> keys) {
		SortedSet<DocumentKey> missingOverlays = new TreeSet<>();
		for (DocumentKey key: keys) {
			if (!overlays.containsKey(key)) {
				missingOverlays.add(key);
			}
		}
		overlays.putAll(documentOverlayCache.getOverlays(missingOverlays));
	}

	/**
	 * Replays the mutation batches affecting the given documents onto them, in place,
	 * and saves the resulting overlay of each under the largest batch id that touched it.
	 *
	 * @return the fields changed per document, or null for documents that were replaced
	 */
	private Map<DocumentKey, FieldMask> recalculateAndSaveOverlays(Map<DocumentKey, MutableDocument> docs) {
		List<MutationBatch> batches = mutationQueue.getAllMutationBatchesAffectingDocumentKeys(docs.keySet());
		Map<DocumentKey, FieldMask> masks = new HashMap<>();
		TreeMap<Integer, Set<DocumentKey>> documentsByBatchId = new TreeMap<>();
		for (MutationBatch batch: batches) {
			for (DocumentKey key: batch.getKeys()) {
				MutableDocument baseDoc = docs.get(key);
				if (baseDoc == null) {
					continue;
				}
				FieldMask mask = masks.containsKey(key) ? masks.get(key) : FieldMask.EMPTY;
				mask = batch.applyToLocalView(baseDoc, mask);
				masks.put(key, mask);
				documentsByBatchId.computeIfAbsent(batch.batchId(), id -> new HashSet<>()).add(key);
			}
		}

		Set<DocumentKey> processed = new HashSet<>();
		for (Map.Entry<Integer, Set<DocumentKey>> entry: documentsByBatchId.descendingMap().entrySet()) {
			Map<DocumentKey, Mutation> overlays = new HashMap<>();
			for (DocumentKey key: entry.getValue()) {
				if (processed.add(key)) {
					Mutation mutation = Mutation.calculateOverlayMutation(docs.get(key), masks.get(key));
					if (mutation != null) {
						overlays.put(key, mutation);
					}
				}
			}
			documentOverlayCache.saveOverlays(entry.getKey(), overlays);
		}
		return masks;
	}

	/**
	 * Recomputes the overlays of the given documents from the mutation queue.
	 */
	void recalculateAndSaveOverlays(Set<DocumentKey> documentKeys) {
		recalculateAndSaveOverlays(remoteDocumentCache.getAll(documentKeys));
	}

	/**
	 * @param offset only documents read, and overlays written, after this offset are considered
	 */
	public Map<DocumentKey, Document> getDocumentsMatchingQuery(Query query, IndexOffset offset) {
		ResourcePath path = query.path();
		if (query.isDocumentQuery()) {
			return getDocumentsMatchingDocumentQuery(path);
		} else if (query.isCollectionGroupQuery()) {
			return getDocumentsMatchingCollectionGroupQuery(query, offset);
		} else {
			return getDocumentsMatchingCollectionQuery(query, offset);
		}
	}

	private Map<DocumentKey, Document> getDocumentsMatchingDocumentQuery(ResourcePath path) {
		Map<DocumentKey, Document> result = new TreeMap<>();
		Document doc = getDocument(DocumentKey.fromPath(path));
		if (doc.isFoundDocument()) {
			result.put(doc.key(), doc);
		}
		return result;
	}

	private Map<DocumentKey, Document> getDocumentsMatchingCollectionGroupQuery(Query query, IndexOffset offset) {
		String collectionId = query.collectionGroup();
		Map<DocumentKey, Document> results = new TreeMap<>();
		for (ResourcePath parent: indexManager.getCollectionParents(collectionId)) {
			if (!query.path().isPrefixOf(parent)) {
				continue;
			}
			Query collectionQuery = query.asCollectionQueryAtPath(parent.append(collectionId));
			results.putAll(getDocumentsMatchingCollectionQuery(collectionQuery, offset));
		}
		return results;
	}

	private Map<DocumentKey, Document> getDocumentsMatchingCollectionQuery(Query query, IndexOffset offset) {
		Map<DocumentKey, Overlay> overlays = documentOverlayCache.getOverlays(query.path(), offset.largestBatchId());
		Map<DocumentKey, MutableDocument> remoteDocuments = remoteDocumentCache.getDocumentsMatchingQuery(query, offset, overlays.keySet());
		if (offset.largestBatchId() != IndexOffset.INITIAL_LARGEST_BATCH_ID) {
			// Documents read after the offset may still carry older overlays
			populateOverlays(overlays, remoteDocuments.keySet());
		}

		// Documents might match only because of their overlay
		for (DocumentKey key: overlays.keySet()) {
			if (!remoteDocuments.containsKey(key)) {
				remoteDocuments.put(key, MutableDocument.newInvalidDocument(key));
			}
		}

		Map<DocumentKey, Document> results = new TreeMap<>();
		for (Map.Entry<DocumentKey, MutableDocument> docEntry: remoteDocuments.entrySet()) {
			Overlay overlay = overlays.get(docEntry.getKey());
			if (overlay != null) {
				overlay.mutation().applyToLocalView(docEntry.getValue(), FieldMask.EMPTY, Instant.now());
			}
			if (query.matches(docEntry.getValue())) {
				results.put(docEntry.getKey(), docEntry.getValue());
			}
		}
		return results;
	}

	/**
	 * @return up to about <code>count</code> documents of the collection group, with overlays applied,
	 * that were read or locally written after <code>offset</code>. Used by index backfill.
	 */
	LocalDocumentsResult getNextDocuments(String collectionGroup, IndexOffset offset, int count) {
		Map<DocumentKey, MutableDocument> docs = remoteDocumentCache.getAll(collectionGroup, offset, count);
		Map<DocumentKey, Overlay> overlays = count - docs.size() > 0
			? documentOverlayCache.getOverlays(collectionGroup, offset.largestBatchId(), count - docs.size())
			: new HashMap<>();

		int largestBatchId = IndexOffset.INITIAL_LARGEST_BATCH_ID;
		for (Overlay overlay: overlays.values()) {
			if (!docs.containsKey(overlay.key())) {
				docs.put(overlay.key(), getBaseDocument(overlay.key(), overlay));
			}
			largestBatchId = Math.max(largestBatchId, overlay.largestBatchId());
		}

		populateOverlays(overlays, docs.keySet());
		return LocalDocumentsResult.fromOverlayedDocuments(largestBatchId, computeViews(docs, overlays, new HashSet<>()));
	}

	/**
	 * A patch applies on top of the remote document, while sets and deletes replace it entirely.
	 */
	private MutableDocument getBaseDocument(DocumentKey key, @Nullable Overlay overlay) {
		return (overlay == null || overlay.mutation() instanceof PatchMutation)
			? remoteDocumentCache.get(key)
			: MutableDocument.newInvalidDocument(key);
	}
}
