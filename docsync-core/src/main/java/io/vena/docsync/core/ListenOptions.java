package io.vena.docsync.core;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

/**
 * What a query listener wants to hear about besides changes to its results.
 */
@Value
@Builder
public class ListenOptions {
	/**
	 * Raise events when only a document's pending-writes state changes.
	 */
	@Default boolean includeDocumentMetadataChanges = false;

	/**
	 * Raise events when only the snapshot's from-cache or pending-writes state changes.
	 */
	@Default boolean includeQueryMetadataChanges = false;

	/**
	 * Don't raise a first event from cache while the client might be online.
	 */
	@Default boolean waitForSyncWhenOnline = false;

	public static ListenOptions defaults() {
		return builder().build();
	}

	public static ListenOptions includingMetadataChanges() {
		return builder()
			.includeDocumentMetadataChanges(true)
			.includeQueryMetadataChanges(true)
			.build();
	}
}
