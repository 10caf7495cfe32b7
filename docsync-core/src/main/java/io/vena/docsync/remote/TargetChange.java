package io.vena.docsync.remote;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.util.ByteString;
import java.util.SortedSet;
import java.util.TreeSet;

import static java.util.Collections.unmodifiableSortedSet;

/**
 * What changed for one target in a {@link RemoteEvent}.
 *
 * @param current true if the target is now consistent with the backend
 * @param addedDocuments keys that started matching the target
 * @param modifiedDocuments keys that already matched and still do, but whose contents changed
 * @param removedDocuments keys that stopped matching the target
 */
public record TargetChange(
	ByteString resumeToken,
	boolean current,
	SortedSet<DocumentKey> addedDocuments,
	SortedSet<DocumentKey> modifiedDocuments,
	SortedSet<DocumentKey> removedDocuments
) {
	public TargetChange {
		addedDocuments = unmodifiableSortedSet(new TreeSet<>(addedDocuments));
		modifiedDocuments = unmodifiableSortedSet(new TreeSet<>(modifiedDocuments));
		removedDocuments = unmodifiableSortedSet(new TreeSet<>(removedDocuments));
	}

	/**
	 * A change that only updates the resume token and the current flag.
	 */
	public static TargetChange createSynthesizedTargetChangeForCurrentChange(boolean isCurrent, ByteString resumeToken) {
		return new TargetChange(resumeToken, isCurrent, new TreeSet<>(), new TreeSet<>(), new TreeSet<>());
	}

	public int documentChangeCount() {
		return addedDocuments.size() + modifiedDocuments.size() + removedDocuments.size();
	}
}
