package io.vena.docsync.bundle;

import io.vena.docsync.core.Query;
import io.vena.docsync.core.Target;

/**
 * A query as stored in a bundle: the target as written by the application,
 * and whether its limit applies to the first or last results.
 */
public record BundledQuery(Target target, Query.LimitType limitType) {
	public Query toQuery() {
		return new Query(target.path(), target.collectionGroup(), target.filters(), target.orderBys(),
			target.limit(), limitType, target.startAt(), target.endAt());
	}
}
