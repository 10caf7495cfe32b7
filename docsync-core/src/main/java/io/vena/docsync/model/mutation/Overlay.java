package io.vena.docsync.model.mutation;

import io.vena.docsync.model.DocumentKey;

/**
 * The net effect of all pending local mutations to one document.
 *
 * @param largestBatchId the newest batch that contributed to {@link #mutation}
 */
public record Overlay(int largestBatchId, Mutation mutation) {
	public DocumentKey key() {
		return mutation.key();
	}
}
