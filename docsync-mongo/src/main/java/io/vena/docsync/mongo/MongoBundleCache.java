package io.vena.docsync.mongo;

import io.vena.docsync.bundle.BundleMetadata;
import io.vena.docsync.bundle.NamedQuery;
import io.vena.docsync.local.BundleCache;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.jetbrains.annotations.Nullable;

final class MongoBundleCache implements BundleCache {
	private final TransactionalCollection bundles;
	private final TransactionalCollection namedQueries;
	private final BsonFormat format;

	MongoBundleCache(TransactionalCollection bundles, TransactionalCollection namedQueries, BsonFormat format) {
		this.bundles = bundles;
		this.namedQueries = namedQueries;
		this.format = format;
	}

	@Override
	public @Nullable BundleMetadata getBundleMetadata(String bundleId) {
		BsonDocument found = bundles.findById(new BsonString(bundleId));
		return found == null ? null : format.decodeBundleMetadata(found);
	}

	@Override
	public void saveBundleMetadata(BundleMetadata metadata) {
		bundles.upsert(format.encodeBundleMetadata(metadata));
	}

	@Override
	public @Nullable NamedQuery getNamedQuery(String queryName) {
		BsonDocument found = namedQueries.findById(new BsonString(queryName));
		return found == null ? null : format.decodeNamedQuery(found);
	}

	@Override
	public void saveNamedQuery(NamedQuery query) {
		namedQueries.upsert(format.encodeNamedQuery(query));
	}
}
