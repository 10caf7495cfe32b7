package io.vena.docsync.local;

import io.vena.docsync.core.Target;
import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldIndex;
import io.vena.docsync.model.IndexOffset;
import io.vena.docsync.model.ResourcePath;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

/**
 * Maintains the collection parent index, used by collection group queries,
 * and the configured field indexes, used by the query engine.
 */
public interface IndexManager {
	enum IndexType {
		/** No index covers the target. */
		NONE,
		/** An index narrows the candidates, but the results must still be filtered. */
		PARTIAL,
		/** An index covers every filter and ordering of the target. */
		FULL,
	}

	void start();

	/**
	 * Records that documents exist under <code>collectionPath</code>.
	 */
	void addToCollectionParentIndex(ResourcePath collectionPath);

	/**
	 * @return the paths of every parent of a collection with id <code>collectionId</code>, sorted.
	 */
	List<ResourcePath> getCollectionParents(String collectionId);

	void addFieldIndex(FieldIndex index);

	void deleteFieldIndex(FieldIndex index);

	Collection<FieldIndex> getFieldIndexes(String collectionGroup);

	Collection<FieldIndex> getFieldIndexes();

	/**
	 * @return the indexed collection group that was backfilled least recently, or null if there are no indexes.
	 */
	@Nullable String getNextCollectionGroupToUpdate();

	/**
	 * Records that every index in the collection group is up to date as of <code>offset</code>.
	 */
	void updateCollectionGroup(String collectionGroup, IndexOffset offset);

	/**
	 * Replaces the entries of the given documents in every index on their collection group.
	 */
	void updateIndexEntries(Map<DocumentKey, ? extends Document> documents);

	IndexType getIndexType(Target target);

	/**
	 * @return the keys whose index entries match the target, or null if no index serves it.
	 */
	@Nullable List<DocumentKey> getDocumentsMatchingTarget(Target target);

	/**
	 * @return the oldest offset to which the indexes serving <code>target</code> are up to date.
	 */
	IndexOffset getMinOffset(Target target);

	IndexOffset getMinOffset(String collectionGroup);
}
