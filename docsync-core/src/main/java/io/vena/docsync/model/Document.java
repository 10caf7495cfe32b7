package io.vena.docsync.model;

import io.vena.docsync.model.value.ObjectValue;
import io.vena.docsync.model.value.Value;
import java.util.Comparator;
import org.jetbrains.annotations.Nullable;

/**
 * A read-only view of a cached document.
 */
public interface Document {
	Comparator<Document> KEY_COMPARATOR = Comparator.comparing(Document::key);

	DocumentKey key();

	/**
	 * The version at which the backend last changed this document,
	 * or {@link SnapshotVersion#NONE} for documents with local mutations.
	 */
	SnapshotVersion version();

	/**
	 * The snapshot version at which this document was read from the backend.
	 */
	SnapshotVersion readTime();

	ObjectValue data();

	@Nullable Value field(FieldPath path);

	/**
	 * @return false for the placeholder used when nothing at all is known about a document.
	 */
	boolean isValidDocument();

	boolean isFoundDocument();

	/**
	 * @return true if the document is known not to exist.
	 */
	boolean isNoDocument();

	/**
	 * @return true if the document is known to exist but its contents are not:
	 * a patch was acknowledged for a document that isn't cached.
	 */
	boolean isUnknownDocument();

	boolean hasLocalMutations();

	boolean hasCommittedMutations();

	default boolean hasPendingWrites() {
		return hasLocalMutations() || hasCommittedMutations();
	}

	MutableDocument mutableCopy();
}
