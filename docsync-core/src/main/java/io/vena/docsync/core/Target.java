package io.vena.docsync.core;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldPath;
import io.vena.docsync.model.ResourcePath;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * What the backend is asked to watch: a query after normalization, with limit-to-last
 * already turned into a limit on the reversed order.
 * Two queries that differ only in how they were written map to equal targets.
 */
public final class Target {
	public static final long NO_LIMIT = -1;

	private final ResourcePath path;
	private final @Nullable String collectionGroup;
	private final List<FieldFilter> filters;
	private final List<OrderBy> orderBys;
	private final long limit;
	private final @Nullable Bound startAt;
	private final @Nullable Bound endAt;

	private @Nullable String memoizedCanonicalId;

	public Target(ResourcePath path, @Nullable String collectionGroup, List<FieldFilter> filters, List<OrderBy> orderBys, long limit, @Nullable Bound startAt, @Nullable Bound endAt) {
		this.path = path;
		this.collectionGroup = collectionGroup;
		this.filters = List.copyOf(filters);
		this.orderBys = List.copyOf(orderBys);
		this.limit = limit;
		this.startAt = startAt;
		this.endAt = endAt;
	}

	public ResourcePath path() { return path; }
	public @Nullable String collectionGroup() { return collectionGroup; }
	public List<FieldFilter> filters() { return filters; }
	public List<OrderBy> orderBys() { return orderBys; }
	public long limit() { return limit; }
	public @Nullable Bound startAt() { return startAt; }
	public @Nullable Bound endAt() { return endAt; }

	public boolean hasLimit() {
		return limit != NO_LIMIT;
	}

	public boolean isDocumentQuery() {
		return DocumentKey.isDocumentKey(path) && collectionGroup == null && filters.isEmpty();
	}

	/**
	 * @return the collection id whose documents this target can match.
	 */
	public String collectionGroupForIndex() {
		return collectionGroup != null ? collectionGroup : path.getLastSegment();
	}

	public List<FieldFilter> getFieldFiltersForPath(FieldPath field) {
		List<FieldFilter> result = new ArrayList<>();
		for (FieldFilter filter: filters) {
			if (filter.field().equals(field)) {
				result.add(filter);
			}
		}
		return result;
	}

	public String canonicalId() {
		if (memoizedCanonicalId != null) {
			return memoizedCanonicalId;
		}
		StringBuilder builder = new StringBuilder();
		builder.append(path.canonicalString());
		if (collectionGroup != null) {
			builder.append("|cg:").append(collectionGroup);
		}
		builder.append("|f:");
		for (FieldFilter filter: filters) {
			builder.append(filter.canonicalId());
		}
		builder.append("|ob:");
		for (OrderBy orderBy: orderBys) {
			builder.append(orderBy.canonicalId());
		}
		if (hasLimit()) {
			builder.append("|l:").append(limit);
		}
		if (startAt != null) {
			builder.append("|lb:").append(startAt.inclusive() ? "b:" : "a:").append(startAt.positionString());
		}
		if (endAt != null) {
			builder.append("|ub:").append(endAt.inclusive() ? "a:" : "b:").append(endAt.positionString());
		}
		memoizedCanonicalId = builder.toString();
		return memoizedCanonicalId;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Target)) return false;
		Target other = (Target) o;
		return limit == other.limit
			&& path.equals(other.path)
			&& Objects.equals(collectionGroup, other.collectionGroup)
			&& filters.equals(other.filters)
			&& orderBys.equals(other.orderBys)
			&& Objects.equals(startAt, other.startAt)
			&& Objects.equals(endAt, other.endAt);
	}

	@Override
	public int hashCode() {
		return Objects.hash(path, collectionGroup, filters, orderBys, limit, startAt, endAt);
	}

	@Override
	public String toString() {
		return "Target(" + canonicalId() + ")";
	}
}
