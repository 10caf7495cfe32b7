package io.vena.docsync.local;

import io.vena.docsync.core.FieldFilter;
import io.vena.docsync.core.OrderBy;
import io.vena.docsync.core.Target;
import io.vena.docsync.local.IndexManager.IndexType;
import io.vena.docsync.model.Document;
import io.vena.docsync.model.FieldIndex;
import io.vena.docsync.model.FieldIndex.Segment;
import io.vena.docsync.model.FieldPath;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.value.ArrayValue;
import io.vena.docsync.model.value.ObjectValue;
import io.vena.docsync.model.value.Value;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jetbrains.annotations.Nullable;

import static io.vena.docsync.core.FieldFilter.Operator.ARRAY_CONTAINS;
import static io.vena.docsync.core.FieldFilter.Operator.ARRAY_CONTAINS_ANY;

/**
 * Decides whether a field index can answer a target, and evaluates the target's filters
 * against index entries.
 *
 * <p>
 * An index serves a target when every field it indexes is one the target filters or orders on.
 * Every document the target can match has those fields, so it has an entry in the index,
 * and the entries whose values pass the target's filters are a superset of the results.
 */
public final class TargetIndexMatcher {
	private final Target target;
	private final Set<FieldPath> arrayFilterFields = new LinkedHashSet<>();
	private final Set<FieldPath> otherFilterFields = new LinkedHashSet<>();
	private final Set<FieldPath> orderByFields = new LinkedHashSet<>();

	public TargetIndexMatcher(Target target) {
		this.target = target;
		for (FieldFilter filter: target.filters()) {
			if (filter.field().isKeyField()) {
				continue;
			}
			if (isArrayOperator(filter.operator())) {
				arrayFilterFields.add(filter.field());
			} else {
				otherFilterFields.add(filter.field());
			}
		}
		for (OrderBy orderBy: target.orderBys()) {
			if (!orderBy.field().isKeyField()) {
				orderByFields.add(orderBy.field());
			}
		}
	}

	public boolean servesTarget(FieldIndex index) {
		if (!index.collectionGroup().equals(target.collectionGroupForIndex())) {
			return false;
		}
		for (Segment segment: index.segments()) {
			FieldPath field = segment.fieldPath();
			if (segment.kind() == Segment.Kind.CONTAINS) {
				if (!arrayFilterFields.contains(field)) {
					return false;
				}
			} else if (!otherFilterFields.contains(field) && !orderByFields.contains(field) && !arrayFilterFields.contains(field)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return FULL if the index covers every field the target filters or orders on, PARTIAL otherwise.
	 * Only meaningful for an index that {@link #servesTarget serves} the target.
	 */
	public IndexType coverage(FieldIndex index) {
		Set<FieldPath> indexedFields = new LinkedHashSet<>();
		for (Segment segment: index.segments()) {
			indexedFields.add(segment.fieldPath());
		}
		if (indexedFields.containsAll(arrayFilterFields)
			&& indexedFields.containsAll(otherFilterFields)
			&& indexedFields.containsAll(orderByFields)) {
			return IndexType.FULL;
		}
		return IndexType.PARTIAL;
	}

	/**
	 * @return the serving index with the most segments, or null if none serves the target.
	 */
	public @Nullable FieldIndex selectIndex(Collection<FieldIndex> candidates) {
		FieldIndex result = null;
		for (FieldIndex candidate: candidates) {
			if (servesTarget(candidate) && (result == null || candidate.segments().size() > result.segments().size())) {
				result = candidate;
			}
		}
		return result;
	}

	/**
	 * @return true if the document behind <code>entry</code> might match the target.
	 */
	public boolean entryMatches(FieldIndex index, IndexEntry entry) {
		ObjectValue data = ObjectValue.empty();
		List<Segment> directionalSegments = index.getDirectionalSegments();
		for (int i = 0; i < directionalSegments.size(); i++) {
			data = data.set(directionalSegments.get(i).fieldPath(), entry.directionalValues().get(i));
		}
		Segment arraySegment = index.getArraySegment();
		if (arraySegment != null && entry.arrayValue() != null) {
			data = data.set(arraySegment.fieldPath(), ArrayValue.of(entry.arrayValue()));
		}
		MutableDocument partial = MutableDocument.newFoundDocument(entry.documentKey(), SnapshotVersion.NONE, data);
		for (FieldFilter filter: target.filters()) {
			if (!isIndexed(index, filter)) {
				continue;
			}
			if (!filter.matches(partial)) {
				return false;
			}
		}
		return true;
	}

	private static boolean isIndexed(FieldIndex index, FieldFilter filter) {
		for (Segment segment: index.segments()) {
			if (!segment.fieldPath().equals(filter.field())) {
				continue;
			}
			if (segment.kind() == Segment.Kind.CONTAINS) {
				if (isArrayOperator(filter.operator())) {
					return true;
				}
			} else {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return the rows of <code>document</code> in <code>index</code>: none if it lacks an indexed field,
	 * and one per distinct array element if the index has a contains segment.
	 */
	public static List<IndexEntry> computeEntries(FieldIndex index, Document document) {
		List<IndexEntry> result = new ArrayList<>();
		if (!document.isFoundDocument()) {
			return result;
		}
		List<Value> directionalValues = new ArrayList<>();
		for (Segment segment: index.getDirectionalSegments()) {
			Value value = document.field(segment.fieldPath());
			if (value == null) {
				return result;
			}
			directionalValues.add(value);
		}
		Segment arraySegment = index.getArraySegment();
		if (arraySegment == null) {
			result.add(new IndexEntry(index.indexId(), document.key(), directionalValues, null));
			return result;
		}
		Value arrayValue = document.field(arraySegment.fieldPath());
		if (!(arrayValue instanceof ArrayValue)) {
			return result;
		}
		for (Value element: new LinkedHashSet<>(((ArrayValue) arrayValue).values())) {
			result.add(new IndexEntry(index.indexId(), document.key(), directionalValues, element));
		}
		return result;
	}

	private static boolean isArrayOperator(FieldFilter.Operator operator) {
		return operator == ARRAY_CONTAINS || operator == ARRAY_CONTAINS_ANY;
	}
}
