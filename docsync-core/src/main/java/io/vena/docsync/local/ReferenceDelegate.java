package io.vena.docsync.local;

import io.vena.docsync.model.DocumentKey;

/**
 * Decides when a cached document is no longer needed.
 * A document stays cached while a target, a mutation batch, or an active view references it.
 */
public interface ReferenceDelegate {
	/**
	 * Sets the references held by active views, which live outside the persistence.
	 */
	void setInMemoryPins(ReferenceSet inMemoryPins);

	void addReference(DocumentKey key);

	void removeReference(DocumentKey key);

	void removeMutationReference(DocumentKey key);

	void removeTarget(TargetData targetData);

	/**
	 * Called when a limbo document is resolved, so it can be collected if nothing else references it.
	 */
	void updateLimboDocument(DocumentKey key);

	long getCurrentSequenceNumber();

	void onTransactionStarted();

	void onTransactionCommitted();
}
