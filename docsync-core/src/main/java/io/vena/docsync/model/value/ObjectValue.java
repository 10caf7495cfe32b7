package io.vena.docsync.model.value;

import io.vena.docsync.model.FieldPath;
import io.vena.docsync.model.mutation.FieldMask;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BiFunction;
import java.util.function.Function;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;
import org.jetbrains.annotations.Nullable;
import org.pcollections.TreePMap;

import static java.util.Objects.requireNonNull;

/**
 * An immutable map value: the data of a document, or a nested map field.
 * Entries are kept sorted by key, which is also the order used by {@link Values#compare}.
 *
 * <p>
 * The <code>set</code> and <code>delete</code> methods address nested fields by {@link FieldPath}
 * and return new values, creating intermediate maps as needed.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
@EqualsAndHashCode
public final class ObjectValue implements Value, Map<String, Value> {
	private final TreePMap<String, Value> contents;

	private static final ObjectValue EMPTY = new ObjectValue(TreePMap.empty());

	public static ObjectValue empty() {
		return EMPTY;
	}

	public static ObjectValue fromMap(Map<String, ? extends Value> entries) {
		TreePMap<String, Value> result = TreePMap.empty();
		for (Entry<String, ? extends Value> entry: entries.entrySet()) {
			result = result.plus(requireNonNull(entry.getKey()), requireNonNull(entry.getValue()));
		}
		return new ObjectValue(result);
	}

	@Override
	public int typeOrder() {
		return Values.TYPE_ORDER_MAP;
	}

	/**
	 * @return the value at <code>path</code>, or null if there is none.
	 * The empty path refers to this value itself.
	 */
	public @Nullable Value get(FieldPath path) {
		Value current = this;
		for (String segment: path.segments()) {
			if (current instanceof ObjectValue) {
				current = ((ObjectValue) current).contents.get(segment);
				if (current == null) {
					return null;
				}
			} else {
				return null;
			}
		}
		return current;
	}

	public ObjectValue set(FieldPath path, Value value) {
		if (path.isEmpty()) {
			throw new IllegalArgumentException("Cannot set field for empty path on ObjectValue");
		}
		String first = path.getFirstSegment();
		if (path.length() == 1) {
			return new ObjectValue(contents.plus(first, requireNonNull(value)));
		}
		Value child = contents.get(first);
		ObjectValue childObject = (child instanceof ObjectValue) ? (ObjectValue) child : EMPTY;
		return new ObjectValue(contents.plus(first, childObject.set(path.popFirst(), value)));
	}

	public ObjectValue delete(FieldPath path) {
		if (path.isEmpty()) {
			throw new IllegalArgumentException("Cannot delete field for empty path on ObjectValue");
		}
		String first = path.getFirstSegment();
		if (path.length() == 1) {
			return contents.containsKey(first) ? new ObjectValue(contents.minus(first)) : this;
		}
		Value child = contents.get(first);
		if (child instanceof ObjectValue) {
			return new ObjectValue(contents.plus(first, ((ObjectValue) child).delete(path.popFirst())));
		} else {
			return this;
		}
	}

	/**
	 * Applies every entry in order: a null value deletes the field.
	 */
	public ObjectValue setAll(Map<FieldPath, @Nullable Value> data) {
		ObjectValue result = this;
		for (Entry<FieldPath, Value> entry: data.entrySet()) {
			if (entry.getValue() == null) {
				result = result.delete(entry.getKey());
			} else {
				result = result.set(entry.getKey(), entry.getValue());
			}
		}
		return result;
	}

	/**
	 * @return the paths of all leaf fields. An empty nested map counts as a leaf.
	 */
	public FieldMask getFieldMask() {
		Set<FieldPath> fields = new TreeSet<>();
		collectLeafPaths(FieldPath.EMPTY_PATH, this, fields);
		return FieldMask.fromSet(fields);
	}

	private static void collectLeafPaths(FieldPath prefix, ObjectValue value, Set<FieldPath> result) {
		for (Entry<String, Value> entry: value.contents.entrySet()) {
			FieldPath path = prefix.append(entry.getKey());
			Value child = entry.getValue();
			if (child instanceof ObjectValue && !((ObjectValue) child).isEmpty()) {
				collectLeafPaths(path, (ObjectValue) child, result);
			} else {
				result.add(path);
			}
		}
	}

	@Override
	public String toString() {
		return contents.toString();
	}

	///////////////////////
	//
	//  Delegated
	//

	@Override public int size() { return contents.size(); }
	@Override public boolean isEmpty() { return contents.isEmpty(); }
	@Override public boolean containsKey(Object key) { return contents.containsKey(key); }
	@Override public boolean containsValue(Object value) { return contents.containsValue(value); }
	@Override public Value get(Object key) { return contents.get(key); }
	@Override public Set<String> keySet() { return contents.keySet(); }
	@Override public Collection<Value> values() { return contents.values(); }
	@Override public Set<Entry<String, Value>> entrySet() { return contents.entrySet(); }

	@Override public Value put(String key, Value value) { throw new UnsupportedOperationException(); }
	@Override public Value remove(Object key) { throw new UnsupportedOperationException(); }
	@Override public void putAll(Map<? extends String, ? extends Value> m) { throw new UnsupportedOperationException(); }
	@Override public void clear() { throw new UnsupportedOperationException(); }

	@Override public void replaceAll(BiFunction<? super String, ? super Value, ? extends Value> function) { throw new UnsupportedOperationException(); }
	@Override public Value putIfAbsent(String key, Value value) { throw new UnsupportedOperationException(); }
	@Override public boolean remove(Object key, Object value) { throw new UnsupportedOperationException(); }
	@Override public boolean replace(String key, Value oldValue, Value newValue) { throw new UnsupportedOperationException(); }
	@Override public Value replace(String key, Value value) { throw new UnsupportedOperationException(); }
	@Override public Value computeIfAbsent(String key, Function<? super String, ? extends Value> mappingFunction) { throw new UnsupportedOperationException(); }
	@Override public Value computeIfPresent(String key, BiFunction<? super String, ? super Value, ? extends Value> remappingFunction) { throw new UnsupportedOperationException(); }
	@Override public Value compute(String key, BiFunction<? super String, ? super Value, ? extends Value> remappingFunction) { throw new UnsupportedOperationException(); }
	@Override public Value merge(String key, Value value, BiFunction<? super Value, ? super Value, ? extends Value> remappingFunction) { throw new UnsupportedOperationException(); }
}
