package io.vena.docsync.core;

import io.vena.docsync.model.Document;
import io.vena.docsync.model.value.ReferenceValue;
import io.vena.docsync.model.value.Value;
import io.vena.docsync.model.value.Values;
import java.util.List;

/**
 * A cursor position, as values of the query's order-by fields.
 *
 * @param inclusive whether a document exactly at the position is part of the result
 */
public record Bound(List<Value> position, boolean inclusive) {
	public Bound {
		position = List.copyOf(position);
	}

	public boolean sortsBeforeDocument(List<OrderBy> orderBy, Document document) {
		int comparison = compareToDocument(orderBy, document);
		return inclusive ? comparison <= 0 : comparison < 0;
	}

	public boolean sortsAfterDocument(List<OrderBy> orderBy, Document document) {
		int comparison = compareToDocument(orderBy, document);
		return inclusive ? comparison >= 0 : comparison > 0;
	}

	private int compareToDocument(List<OrderBy> orderBy, Document document) {
		if (position.size() > orderBy.size()) {
			throw new IllegalArgumentException("Bound has more components than the query's orderBy");
		}
		int comparison = 0;
		for (int i = 0; i < position.size(); i++) {
			OrderBy orderByComponent = orderBy.get(i);
			Value component = position.get(i);
			if (orderByComponent.field().isKeyField()) {
				if (!(component instanceof ReferenceValue)) {
					throw new IllegalArgumentException("Bound has a non-key value where the key path is being used: " + component);
				}
				comparison = ((ReferenceValue) component).key().compareTo(document.key());
			} else {
				Value documentValue = document.field(orderByComponent.field());
				if (documentValue == null) {
					throw new IllegalStateException("Field should exist since document matched the orderBy already");
				}
				comparison = Values.compare(component, documentValue);
			}
			if (orderByComponent.direction() == OrderBy.Direction.DESCENDING) {
				comparison = -comparison;
			}
			if (comparison != 0) {
				break;
			}
		}
		return comparison;
	}

	String positionString() {
		StringBuilder builder = new StringBuilder();
		boolean first = true;
		for (Value value: position) {
			if (!first) {
				builder.append(',');
			}
			first = false;
			builder.append(Values.canonicalId(value));
		}
		return builder.toString();
	}
}
