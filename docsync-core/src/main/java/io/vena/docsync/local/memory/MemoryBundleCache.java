package io.vena.docsync.local.memory;

import io.vena.docsync.bundle.BundleMetadata;
import io.vena.docsync.bundle.NamedQuery;
import io.vena.docsync.local.BundleCache;
import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;

final class MemoryBundleCache implements BundleCache {
	private final Map<String, BundleMetadata> bundles = new HashMap<>();
	private final Map<String, NamedQuery> namedQueries = new HashMap<>();

	@Override
	public @Nullable BundleMetadata getBundleMetadata(String bundleId) {
		return bundles.get(bundleId);
	}

	@Override
	public void saveBundleMetadata(BundleMetadata metadata) {
		bundles.put(metadata.bundleId(), metadata);
	}

	@Override
	public @Nullable NamedQuery getNamedQuery(String queryName) {
		return namedQueries.get(queryName);
	}

	@Override
	public void saveNamedQuery(NamedQuery query) {
		namedQueries.put(query.name(), query);
	}
}
