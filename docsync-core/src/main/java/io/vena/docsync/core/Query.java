package io.vena.docsync.core;

import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldPath;
import io.vena.docsync.model.ResourcePath;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.jetbrains.annotations.Nullable;

/**
 * An immutable description of a set of documents an application listens to or reads.
 *
 * <p>
 * The results are ordered by the explicit order-bys, then by any inequality fields
 * not already ordered, then by document key, in the direction of the last explicit order-by.
 */
public final class Query {
	public enum LimitType {
		LIMIT_TO_FIRST,
		LIMIT_TO_LAST
	}

	private static final OrderBy KEY_ORDERING_ASC = OrderBy.ascending(FieldPath.KEY_PATH);
	private static final OrderBy KEY_ORDERING_DESC = OrderBy.descending(FieldPath.KEY_PATH);

	private final ResourcePath path;
	private final @Nullable String collectionGroup;
	private final List<FieldFilter> filters;
	private final List<OrderBy> explicitSortOrder;
	private final long limit;
	private final LimitType limitType;
	private final @Nullable Bound startAt;
	private final @Nullable Bound endAt;

	private @Nullable List<OrderBy> memoizedNormalizedOrderBys;
	private @Nullable Target memoizedTarget;

	public Query(ResourcePath path, @Nullable String collectionGroup, List<FieldFilter> filters, List<OrderBy> explicitSortOrder, long limit, LimitType limitType, @Nullable Bound startAt, @Nullable Bound endAt) {
		this.path = path;
		this.collectionGroup = collectionGroup;
		this.filters = List.copyOf(filters);
		this.explicitSortOrder = List.copyOf(explicitSortOrder);
		this.limit = limit;
		this.limitType = limitType;
		this.startAt = startAt;
		this.endAt = endAt;
	}

	/**
	 * A query for every document in the collection at <code>path</code>,
	 * or for the single document if <code>path</code> is a document path.
	 */
	public static Query atPath(ResourcePath path) {
		return new Query(path, null, List.of(), List.of(), Target.NO_LIMIT, LimitType.LIMIT_TO_FIRST, null, null);
	}

	/**
	 * A query for every document in every collection with the given id, below <code>parent</code>.
	 */
	public static Query collectionGroup(ResourcePath parent, String collectionId) {
		return new Query(parent, collectionId, List.of(), List.of(), Target.NO_LIMIT, LimitType.LIMIT_TO_FIRST, null, null);
	}

	public ResourcePath path() { return path; }
	public @Nullable String collectionGroup() { return collectionGroup; }
	public List<FieldFilter> filters() { return filters; }
	public List<OrderBy> explicitOrderBy() { return explicitSortOrder; }
	public long limit() { return limit; }
	public LimitType limitType() { return limitType; }
	public @Nullable Bound startAt() { return startAt; }
	public @Nullable Bound endAt() { return endAt; }

	public boolean isDocumentQuery() {
		return DocumentKey.isDocumentKey(path) && collectionGroup == null && filters.isEmpty();
	}

	public boolean isCollectionGroupQuery() {
		return collectionGroup != null;
	}

	public boolean hasLimit() {
		return limit != Target.NO_LIMIT;
	}

	/**
	 * @return true if this query returns every document in its collection, in key order.
	 */
	public boolean matchesAllDocuments() {
		return filters.isEmpty()
			&& limit == Target.NO_LIMIT
			&& startAt == null
			&& endAt == null
			&& (explicitSortOrder.isEmpty()
				|| (explicitSortOrder.size() == 1 && explicitSortOrder.get(0).field().isKeyField()));
	}

	public Set<FieldPath> getInequalityFilterFields() {
		Set<FieldPath> result = new TreeSet<>();
		for (FieldFilter filter: filters) {
			if (filter.isInequality()) {
				result.add(filter.field());
			}
		}
		return result;
	}

	public Query filter(FieldFilter filter) {
		if (isDocumentQuery()) {
			throw new IllegalArgumentException("No filter is allowed for document query");
		}
		List<FieldFilter> updatedFilter = new ArrayList<>(filters);
		updatedFilter.add(filter);
		return new Query(path, collectionGroup, updatedFilter, explicitSortOrder, limit, limitType, startAt, endAt);
	}

	public Query orderBy(OrderBy order) {
		if (isDocumentQuery()) {
			throw new IllegalArgumentException("No ordering is allowed for document query");
		}
		List<OrderBy> updatedSortOrder = new ArrayList<>(explicitSortOrder);
		updatedSortOrder.add(order);
		return new Query(path, collectionGroup, filters, updatedSortOrder, limit, limitType, startAt, endAt);
	}

	public Query limitToFirst(long limit) {
		return new Query(path, collectionGroup, filters, explicitSortOrder, limit, LimitType.LIMIT_TO_FIRST, startAt, endAt);
	}

	public Query limitToLast(long limit) {
		return new Query(path, collectionGroup, filters, explicitSortOrder, limit, LimitType.LIMIT_TO_LAST, startAt, endAt);
	}

	public Query startAt(Bound bound) {
		return new Query(path, collectionGroup, filters, explicitSortOrder, limit, limitType, bound, endAt);
	}

	public Query endAt(Bound bound) {
		return new Query(path, collectionGroup, filters, explicitSortOrder, limit, limitType, startAt, bound);
	}

	/**
	 * Turns a collection group query into a query on one of its collections.
	 */
	public Query asCollectionQueryAtPath(ResourcePath collectionPath) {
		return new Query(collectionPath, null, filters, explicitSortOrder, limit, limitType, startAt, endAt);
	}

	public List<OrderBy> getNormalizedOrderBy() {
		if (memoizedNormalizedOrderBys == null) {
			List<OrderBy> result = new ArrayList<>(explicitSortOrder);
			Set<FieldPath> fieldsNormalized = new HashSet<>();
			for (OrderBy explicit: explicitSortOrder) {
				fieldsNormalized.add(explicit.field());
			}
			OrderBy.Direction lastDirection = explicitSortOrder.isEmpty()
				? OrderBy.Direction.ASCENDING
				: explicitSortOrder.get(explicitSortOrder.size() - 1).direction();
			for (FieldPath field: getInequalityFilterFields()) {
				if (!fieldsNormalized.contains(field) && !field.isKeyField()) {
					result.add(new OrderBy(lastDirection, field));
				}
			}
			if (!fieldsNormalized.contains(FieldPath.KEY_PATH)) {
				result.add(lastDirection == OrderBy.Direction.ASCENDING ? KEY_ORDERING_ASC : KEY_ORDERING_DESC);
			}
			memoizedNormalizedOrderBys = List.copyOf(result);
		}
		return memoizedNormalizedOrderBys;
	}

	public boolean matches(Document document) {
		return document.isFoundDocument()
			&& matchesPathAndCollectionGroup(document)
			&& matchesOrderBy(document)
			&& matchesFilters(document)
			&& matchesBounds(document);
	}

	private boolean matchesPathAndCollectionGroup(Document document) {
		ResourcePath documentPath = document.key().path();
		if (collectionGroup != null) {
			return document.key().hasCollectionId(collectionGroup) && path.isPrefixOf(documentPath);
		} else if (DocumentKey.isDocumentKey(path)) {
			return path.equals(documentPath);
		} else {
			return path.isImmediateParentOf(documentPath);
		}
	}

	/**
	 * A document lacking any order-by field is excluded from the results.
	 */
	private boolean matchesOrderBy(Document document) {
		for (OrderBy order: getNormalizedOrderBy()) {
			if (!order.field().isKeyField() && document.field(order.field()) == null) {
				return false;
			}
		}
		return true;
	}

	private boolean matchesFilters(Document document) {
		for (FieldFilter filter: filters) {
			if (!filter.matches(document)) {
				return false;
			}
		}
		return true;
	}

	private boolean matchesBounds(Document document) {
		if (startAt != null && !startAt.sortsBeforeDocument(getNormalizedOrderBy(), document)) {
			return false;
		}
		return endAt == null || endAt.sortsAfterDocument(getNormalizedOrderBy(), document);
	}

	public Comparator<Document> comparator() {
		List<OrderBy> orderBys = getNormalizedOrderBy();
		return (left, right) -> {
			for (OrderBy order: orderBys) {
				int comparison = order.compare(left, right);
				if (comparison != 0) {
					return comparison;
				}
			}
			return 0;
		};
	}

	public Target toTarget() {
		if (memoizedTarget == null) {
			if (limitType == LimitType.LIMIT_TO_FIRST) {
				memoizedTarget = new Target(path, collectionGroup, filters, getNormalizedOrderBy(), limit, startAt, endAt);
			} else {
				List<OrderBy> newOrderBy = new ArrayList<>();
				for (OrderBy orderBy: getNormalizedOrderBy()) {
					OrderBy.Direction flipped = orderBy.direction() == OrderBy.Direction.DESCENDING
						? OrderBy.Direction.ASCENDING
						: OrderBy.Direction.DESCENDING;
					newOrderBy.add(new OrderBy(flipped, orderBy.field()));
				}
				Bound newStartAt = endAt != null ? new Bound(endAt.position(), endAt.inclusive()) : null;
				Bound newEndAt = startAt != null ? new Bound(startAt.position(), startAt.inclusive()) : null;
				memoizedTarget = new Target(path, collectionGroup, filters, newOrderBy, limit, newStartAt, newEndAt);
			}
		}
		return memoizedTarget;
	}

	public String canonicalId() {
		return toTarget().canonicalId() + "|lt:" + limitType;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Query)) return false;
		Query other = (Query) o;
		return limitType == other.limitType && toTarget().equals(other.toTarget());
	}

	@Override
	public int hashCode() {
		return 31 * toTarget().hashCode() + limitType.hashCode();
	}

	@Override
	public String toString() {
		return "Query(target=" + toTarget() + ";limitType=" + limitType + ")";
	}
}
