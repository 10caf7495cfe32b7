package io.vena.docsync.bundle;

import io.vena.docsync.model.SnapshotVersion;

/**
 * @param createTime the snapshot at which the bundle was built; a bundle is only applied
 *                   if it is newer than a previously loaded bundle with the same id
 */
public record BundleMetadata(
	String bundleId,
	int version,
	SnapshotVersion createTime,
	int totalDocuments,
	long totalBytes
) implements BundleElement {
}
