package io.vena.docsync.local;

import io.vena.docsync.model.DocumentKey;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes a document from the remote document cache as soon as the last reference to it is
 * released: at the end of the transaction that released it, provided no target,
 * mutation batch, or view still references it.
 */
public final class EagerReferenceDelegate implements ReferenceDelegate {
	private final Persistence persistence;
	private @Nullable ReferenceSet inMemoryPins;
	// Per thread: transactions may also run outside the async queue
	private final ThreadLocal<Set<DocumentKey>> orphanedDocuments = new ThreadLocal<>();

	public EagerReferenceDelegate(Persistence persistence) {
		this.persistence = persistence;
	}

	@Override
	public void setInMemoryPins(ReferenceSet inMemoryPins) {
		this.inMemoryPins = inMemoryPins;
	}

	@Override
	public void addReference(DocumentKey key) {
		orphaned().remove(key);
	}

	@Override
	public void removeReference(DocumentKey key) {
		orphaned().add(key);
	}

	@Override
	public void removeMutationReference(DocumentKey key) {
		orphaned().add(key);
	}

	@Override
	public void removeTarget(TargetData targetData) {
		TargetCache targetCache = persistence.getTargetCache();
		for (DocumentKey key: targetCache.getMatchingKeysForTargetId(targetData.targetId())) {
			orphaned().add(key);
		}
		targetCache.removeTargetData(targetData);
	}

	@Override
	public void updateLimboDocument(DocumentKey key) {
		orphaned().add(key);
	}

	@Override
	public long getCurrentSequenceNumber() {
		return ListenSequence.INVALID;
	}

	@Override
	public void onTransactionStarted() {
		orphanedDocuments.set(new HashSet<>());
	}

	@Override
	public void onTransactionCommitted() {
		List<DocumentKey> toRemove = new ArrayList<>();
		for (DocumentKey key: orphaned()) {
			if (!isReferenced(key)) {
				toRemove.add(key);
			}
		}
		if (!toRemove.isEmpty()) {
			LOGGER.trace("Collecting {} unreferenced documents", toRemove.size());
			persistence.getRemoteDocumentCache().removeAll(toRemove);
		}
		orphanedDocuments.remove();
	}

	private boolean isReferenced(DocumentKey key) {
		return persistence.getTargetCache().containsKey(key)
			|| (inMemoryPins != null && inMemoryPins.containsKey(key))
			|| persistence.mutationQueuesContainKey(key);
	}

	private Set<DocumentKey> orphaned() {
		Set<DocumentKey> result = orphanedDocuments.get();
		if (result == null) {
			throw new IllegalStateException("Reference changes are only allowed inside a transaction");
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(EagerReferenceDelegate.class);
}
