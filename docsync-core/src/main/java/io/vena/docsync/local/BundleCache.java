package io.vena.docsync.local;

import io.vena.docsync.bundle.BundleMetadata;
import io.vena.docsync.bundle.NamedQuery;
import org.jetbrains.annotations.Nullable;

/**
 * Remembers which bundles were loaded, and the named queries they contained.
 */
public interface BundleCache {
	@Nullable BundleMetadata getBundleMetadata(String bundleId);

	void saveBundleMetadata(BundleMetadata metadata);

	@Nullable NamedQuery getNamedQuery(String queryName);

	void saveNamedQuery(NamedQuery query);
}
