package io.vena.docsync.local;

import io.vena.docsync.core.Query;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.IndexOffset;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.SnapshotVersion;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * The latest version of each document received from the backend,
 * independent of any local writes.
 *
 * <p>
 * Returned documents, and the maps holding them, are copies the caller may modify.
 */
public interface RemoteDocumentCache {
	void setIndexManager(IndexManager indexManager);

	/**
	 * Adds or replaces the cached version of <code>document</code>.
	 *
	 * @param readTime the snapshot at which the document was read; must not be {@link SnapshotVersion#NONE}
	 */
	void add(MutableDocument document, SnapshotVersion readTime);

	void removeAll(Collection<DocumentKey> keys);

	/**
	 * @return the cached document, or an invalid document if there is none.
	 */
	MutableDocument get(DocumentKey documentKey);

	/**
	 * @return an entry for every key, invalid where nothing is cached.
	 */
	Map<DocumentKey, MutableDocument> getAll(Iterable<DocumentKey> documentKeys);

	/**
	 * @return up to <code>limit</code> documents in the collection group read after <code>offset</code>,
	 * in {@link IndexOffset} order.
	 */
	Map<DocumentKey, MutableDocument> getAll(String collectionGroup, IndexOffset offset, int limit);

	/**
	 * @return the documents in the query's collection read after <code>offset</code> that either
	 * match the query or are among <code>mutatedKeys</code> (and so might match once overlays are applied).
	 */
	Map<DocumentKey, MutableDocument> getDocumentsMatchingQuery(Query query, IndexOffset offset, Set<DocumentKey> mutatedKeys);
}
