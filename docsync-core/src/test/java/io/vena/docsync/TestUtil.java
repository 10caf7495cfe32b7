package io.vena.docsync;

import io.vena.docsync.core.FieldFilter;
import io.vena.docsync.core.OrderBy;
import io.vena.docsync.core.Query;
import io.vena.docsync.model.Document;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldPath;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.ResourcePath;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.mutation.DeleteMutation;
import io.vena.docsync.model.mutation.FieldMask;
import io.vena.docsync.model.mutation.MutationResult;
import io.vena.docsync.model.mutation.PatchMutation;
import io.vena.docsync.model.mutation.Precondition;
import io.vena.docsync.model.mutation.SetMutation;
import io.vena.docsync.model.value.ObjectValue;
import io.vena.docsync.model.value.Value;
import io.vena.docsync.model.value.Values;
import io.vena.docsync.remote.TargetChange;
import io.vena.docsync.util.ByteString;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Terse constructors for test fixtures.
 */
public final class TestUtil {
	public static DocumentKey key(String path) {
		return DocumentKey.fromPathString(path);
	}

	public static ResourcePath path(String path) {
		return ResourcePath.fromString(path);
	}

	public static FieldPath field(String path) {
		return FieldPath.fromDotSeparatedString(path);
	}

	public static SnapshotVersion version(long micros) {
		return SnapshotVersion.ofMicros(micros);
	}

	/**
	 * @param keysAndValues alternating field names and plain Java values
	 */
	public static Map<String, Object> map(Object... keysAndValues) {
		if (keysAndValues.length % 2 != 0) {
			throw new IllegalArgumentException("Expected alternating keys and values");
		}
		Map<String, Object> result = new LinkedHashMap<>();
		for (int i = 0; i < keysAndValues.length; i += 2) {
			result.put((String) keysAndValues[i], keysAndValues[i + 1]);
		}
		return result;
	}

	public static ObjectValue wrapObject(Map<String, ?> map) {
		return Values.objectFromJava(map);
	}

	public static Value wrap(Object value) {
		return Values.fromJava(value);
	}

	public static MutableDocument doc(String key, long version, Map<String, ?> data) {
		return MutableDocument.newFoundDocument(key(key), version(version), wrapObject(data))
			.setReadTime(version(version));
	}

	public static MutableDocument deletedDoc(String key, long version) {
		return MutableDocument.newNoDocument(key(key), version(version))
			.setReadTime(version(version));
	}

	public static SetMutation setMutation(String key, Map<String, ?> data) {
		return new SetMutation(key(key), wrapObject(data), Precondition.NONE);
	}

	/**
	 * Keys of <code>data</code> are dot-separated field paths. A null value deletes the field.
	 */
	public static PatchMutation patchMutation(String key, Map<String, ?> data) {
		ObjectValue value = ObjectValue.empty();
		Set<FieldPath> mask = new TreeSet<>();
		for (Map.Entry<String, ?> entry: data.entrySet()) {
			FieldPath path = field(entry.getKey());
			mask.add(path);
			if (entry.getValue() != null) {
				value = value.set(path, wrap(entry.getValue()));
			}
		}
		return new PatchMutation(key(key), value, FieldMask.fromSet(mask), Precondition.exists(true));
	}

	public static DeleteMutation deleteMutation(String key) {
		return new DeleteMutation(key(key), Precondition.NONE);
	}

	public static MutationResult mutationResult(long version) {
		return new MutationResult(version(version), List.of());
	}

	public static Query query(String path) {
		return Query.atPath(path(path));
	}

	public static FieldFilter filter(String field, FieldFilter.Operator operator, Object value) {
		return FieldFilter.create(field(field), operator, wrap(value));
	}

	public static OrderBy orderBy(String field) {
		return OrderBy.ascending(field(field));
	}

	public static OrderBy orderByDescending(String field) {
		return OrderBy.descending(field(field));
	}

	public static Map<DocumentKey, Document> docUpdates(MutableDocument... documents) {
		Map<DocumentKey, Document> result = new TreeMap<>();
		for (MutableDocument document: documents) {
			result.put(document.key(), document);
		}
		return result;
	}

	public static TargetChange targetChange(boolean current, String... addedKeys) {
		TreeSet<DocumentKey> added = new TreeSet<>();
		for (String addedKey: addedKeys) {
			added.add(key(addedKey));
		}
		return new TargetChange(ByteString.copyFromUtf8("resume"), current, added, new TreeSet<>(), new TreeSet<>());
	}

	private TestUtil() { }
}
