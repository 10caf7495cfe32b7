package io.vena.docsync.local;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.ResourcePath;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.Overlay;
import java.util.Map;
import java.util.SortedSet;
import org.jetbrains.annotations.Nullable;

/**
 * One user's net local mutation per document, so reads need not replay the mutation queue.
 */
public interface DocumentOverlayCache {
	@Nullable Overlay getOverlay(DocumentKey key);

	/**
	 * @return overlays for the keys that have one.
	 */
	Map<DocumentKey, Overlay> getOverlays(SortedSet<DocumentKey> keys);

	/**
	 * Replaces the overlay of each key in <code>overlays</code>.
	 */
	void saveOverlays(int largestBatchId, Map<DocumentKey, Mutation> overlays);

	void removeOverlaysForBatchId(int batchId);

	/**
	 * @return overlays of documents directly in <code>collection</code> whose largest batch id
	 * is greater than <code>sinceBatchId</code>.
	 */
	Map<DocumentKey, Overlay> getOverlays(ResourcePath collection, int sinceBatchId);

	/**
	 * @return overlays in the collection group whose largest batch id is greater than
	 * <code>sinceBatchId</code>, in batch order. Returns whole batches, so possibly more than
	 * <code>count</code>.
	 */
	Map<DocumentKey, Overlay> getOverlays(String collectionGroup, int sinceBatchId, int count);
}
