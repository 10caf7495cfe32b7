package io.vena.docsync.local.memory;

import io.vena.docsync.core.Query;
import io.vena.docsync.local.IndexManager;
import io.vena.docsync.local.RemoteDocumentCache;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.IndexOffset;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.ResourcePath;
import io.vena.docsync.model.SnapshotVersion;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.pcollections.TreePMap;

import static java.util.Objects.requireNonNull;

final class MemoryRemoteDocumentCache implements RemoteDocumentCache {
	private TreePMap<DocumentKey, MutableDocument> docs = TreePMap.empty();
	private @Nullable IndexManager indexManager;

	@Override
	public void setIndexManager(IndexManager indexManager) {
		this.indexManager = indexManager;
	}

	@Override
	public void add(MutableDocument document, SnapshotVersion readTime) {
		if (SnapshotVersion.NONE.equals(readTime)) {
			throw new IllegalArgumentException("Cannot add a document when the remote version is zero");
		}
		docs = docs.plus(document.key(), document.mutableCopy().setReadTime(readTime));
		requireNonNull(indexManager, "indexManager").addToCollectionParentIndex(document.key().getCollectionPath());
	}

	@Override
	public void removeAll(Collection<DocumentKey> keys) {
		docs = docs.minusAll(keys);
	}

	@Override
	public MutableDocument get(DocumentKey key) {
		MutableDocument doc = docs.get(key);
		return doc != null ? doc.mutableCopy() : MutableDocument.newInvalidDocument(key);
	}

	@Override
	public Map<DocumentKey, MutableDocument> getAll(Iterable<DocumentKey> keys) {
		Map<DocumentKey, MutableDocument> result = new HashMap<>();
		for (DocumentKey key: keys) {
			result.put(key, get(key));
		}
		return result;
	}

	@Override
	public Map<DocumentKey, MutableDocument> getAll(String collectionGroup, IndexOffset offset, int limit) {
		List<MutableDocument> candidates = new ArrayList<>();
		for (MutableDocument document: docs.values()) {
			if (document.key().hasCollectionId(collectionGroup)
				&& IndexOffset.fromDocument(document).compareTo(offset) > 0) {
				candidates.add(document);
			}
		}
		candidates.sort(IndexOffset.DOCUMENT_COMPARATOR);
		Map<DocumentKey, MutableDocument> result = new HashMap<>();
		for (MutableDocument document: candidates) {
			if (result.size() >= limit) {
				break;
			}
			result.put(document.key(), document.mutableCopy());
		}
		return result;
	}

	@Override
	public Map<DocumentKey, MutableDocument> getDocumentsMatchingQuery(Query query, IndexOffset offset, Set<DocumentKey> mutatedKeys) {
		Map<DocumentKey, MutableDocument> result = new HashMap<>();
		ResourcePath collectionPath = query.path();
		DocumentKey prefix = DocumentKey.fromPath(collectionPath.append(""));
		for (Map.Entry<DocumentKey, MutableDocument> entry: docs.tailMap(prefix, true).entrySet()) {
			DocumentKey key = entry.getKey();
			if (!collectionPath.isPrefixOf(key.path())) {
				break;
			}
			if (key.path().length() > collectionPath.length() + 1) {
				// Documents in subcollections
				continue;
			}
			MutableDocument document = entry.getValue();
			if (IndexOffset.fromDocument(document).compareTo(offset) <= 0) {
				continue;
			}
			if (!mutatedKeys.contains(key) && !query.matches(document)) {
				continue;
			}
			result.put(key, document.mutableCopy());
		}
		return result;
	}
}
