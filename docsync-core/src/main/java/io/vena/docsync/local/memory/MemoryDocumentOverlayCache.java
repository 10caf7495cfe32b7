package io.vena.docsync.local.memory;

import io.vena.docsync.local.DocumentOverlayCache;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.ResourcePath;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.Overlay;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import org.jetbrains.annotations.Nullable;
import org.pcollections.TreePMap;

final class MemoryDocumentOverlayCache implements DocumentOverlayCache {
	private TreePMap<DocumentKey, Overlay> overlays = TreePMap.empty();
	private final Map<Integer, Set<DocumentKey>> overlayByBatchId = new HashMap<>();

	@Override
	public @Nullable Overlay getOverlay(DocumentKey key) {
		return overlays.get(key);
	}

	@Override
	public Map<DocumentKey, Overlay> getOverlays(SortedSet<DocumentKey> keys) {
		Map<DocumentKey, Overlay> result = new HashMap<>();
		for (DocumentKey key: keys) {
			Overlay overlay = getOverlay(key);
			if (overlay != null) {
				result.put(key, overlay);
			}
		}
		return result;
	}

	@Override
	public void saveOverlays(int largestBatchId, Map<DocumentKey, Mutation> overlays) {
		for (Map.Entry<DocumentKey, Mutation> entry: overlays.entrySet()) {
			saveOverlay(largestBatchId, entry.getValue());
		}
	}

	private void saveOverlay(int largestBatchId, Mutation mutation) {
		Overlay existing = overlays.get(mutation.key());
		if (existing != null) {
			overlayByBatchId.get(existing.largestBatchId()).remove(mutation.key());
		}
		overlays = overlays.plus(mutation.key(), new Overlay(largestBatchId, mutation));
		overlayByBatchId.computeIfAbsent(largestBatchId, id -> new HashSet<>()).add(mutation.key());
	}

	@Override
	public void removeOverlaysForBatchId(int batchId) {
		Set<DocumentKey> keys = overlayByBatchId.remove(batchId);
		if (keys != null) {
			overlays = overlays.minusAll(keys);
		}
	}

	@Override
	public Map<DocumentKey, Overlay> getOverlays(ResourcePath collection, int sinceBatchId) {
		Map<DocumentKey, Overlay> result = new HashMap<>();
		int immediateChildrenPathLength = collection.length() + 1;
		DocumentKey prefix = DocumentKey.fromPath(collection.append(""));
		for (Overlay overlay: overlays.tailMap(prefix, true).values()) {
			DocumentKey key = overlay.key();
			if (!collection.isPrefixOf(key.path())) {
				break;
			}
			if (key.path().length() != immediateChildrenPathLength) {
				continue;
			}
			if (overlay.largestBatchId() > sinceBatchId) {
				result.put(key, overlay);
			}
		}
		return result;
	}

	@Override
	public Map<DocumentKey, Overlay> getOverlays(String collectionGroup, int sinceBatchId, int count) {
		SortedMap<Integer, Map<DocumentKey, Overlay>> batchIdToOverlays = new TreeMap<>();
		for (Overlay overlay: overlays.values()) {
			DocumentKey key = overlay.key();
			if (!key.getCollectionGroup().equals(collectionGroup)) {
				continue;
			}
			if (overlay.largestBatchId() > sinceBatchId) {
				batchIdToOverlays.computeIfAbsent(overlay.largestBatchId(), id -> new HashMap<>()).put(key, overlay);
			}
		}
		Map<DocumentKey, Overlay> result = new HashMap<>();
		for (Map<DocumentKey, Overlay> overlaysForBatch: batchIdToOverlays.values()) {
			result.putAll(overlaysForBatch);
			if (result.size() >= count) {
				break;
			}
		}
		return result;
	}
}
