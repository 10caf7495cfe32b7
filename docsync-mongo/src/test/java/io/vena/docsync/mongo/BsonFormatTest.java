package io.vena.docsync.mongo;

import io.vena.docsync.core.Bound;
import io.vena.docsync.core.FieldFilter;
import io.vena.docsync.core.OrderBy;
import io.vena.docsync.core.Query;
import io.vena.docsync.local.QueryPurpose;
import io.vena.docsync.local.TargetData;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldPath;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.ResourcePath;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.mutation.ArrayTransformOperation;
import io.vena.docsync.model.mutation.DeleteMutation;
import io.vena.docsync.model.mutation.FieldMask;
import io.vena.docsync.model.mutation.FieldTransform;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.NumericIncrementOperation;
import io.vena.docsync.model.mutation.PatchMutation;
import io.vena.docsync.model.mutation.Precondition;
import io.vena.docsync.model.mutation.ServerTimestampOperation;
import io.vena.docsync.model.value.IntegerValue;
import io.vena.docsync.model.value.ObjectValue;
import io.vena.docsync.model.value.ServerTimestampValue;
import io.vena.docsync.model.value.StringValue;
import io.vena.docsync.model.value.Value;
import io.vena.docsync.model.value.Values;
import io.vena.docsync.util.ByteString;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BsonFormatTest {
	private final BsonFormat format = new BsonFormat();

	@Test
	void everyStoredValueKind() {
		ObjectValue fields = Values.objectFromJava(Map.of(
			"null", Arrays.asList((Object) null),
			"flag", true,
			"count", 42,
			"ratio", 0.5,
			"name", "Eros",
			"bytes", new byte[] { 1, 2, 3 },
			"when", Instant.ofEpochSecond(1_700_000_000L, 123_456_789),
			"owner", DocumentKey.fromPathString("users/alice"),
			"nested", Map.of("tags", List.of("a", "b"), "empty", Map.of())
		));
		assertEquals(fields, format.decodeFields(format.encodeFields(fields)));
	}

	@Test
	void integersStayIntegers() {
		// A double that happens to be whole must not come back as an integer, and vice versa
		Value integer = new IntegerValue(3);
		Value decimal = Values.fromJava(3.0);
		assertEquals(integer, format.decodeValue(format.encodeValue(integer)));
		assertEquals(decimal, format.decodeValue(format.encodeValue(decimal)));
	}

	@Test
	void fieldNamesMongoCannotStore() {
		ObjectValue fields = Values.objectFromJava(Map.of(
			"a.b", 1,
			"$where", 2,
			"100%", 3,
			"with space+plus", 4,
			"nul\u0000char", 5,
			"café 😀", 6
		));
		BsonDocument encoded = format.encodeFields(fields);
		for (String name: encoded.keySet()) {
			assertThat(name, not(containsString(".")));
			assertTrue(!name.startsWith("$"), "Field name must not start with $: " + name);
			assertTrue(name.indexOf(0) < 0, "Field name must not contain NUL: " + name);
		}
		assertEquals(fields, format.decodeFields(encoded));
	}

	@Test
	void pendingServerTimestampCannotBeStored() {
		assertThrows(IllegalArgumentException.class, () ->
			format.encodeValue(new ServerTimestampValue(Instant.EPOCH, null)));
	}

	@Test
	void documents() {
		DocumentKey key = DocumentKey.fromPathString("rooms/eros/messages/m1");
		MutableDocument found = MutableDocument.newFoundDocument(key, SnapshotVersion.ofMicros(1_000_001), Values.objectFromJava(Map.of("text", "hi")));
		found.setReadTime(SnapshotVersion.ofMicros(2_000_002));
		MutableDocument committed = MutableDocument.newUnknownDocument(key, SnapshotVersion.ofMicros(5));
		committed.setHasCommittedMutations();

		for (MutableDocument original: List.of(found, MutableDocument.newNoDocument(key, SnapshotVersion.ofMicros(3)), committed)) {
			MutableDocument decoded = format.decodeDocument(key, format.encodeDocument(original));
			assertEquals(original, decoded);
			assertEquals(original.readTime(), decoded.readTime());
			assertEquals(original.hasCommittedMutations(), decoded.hasCommittedMutations());
		}
	}

	@Test
	void mutationsWithTransforms() {
		DocumentKey key = DocumentKey.fromPathString("rooms/eros");
		Mutation patch = new PatchMutation(key,
			Values.objectFromJava(Map.of("name", "Eros", "odd.field", Map.of("x", 1))),
			FieldMask.fromSet(Set.of(FieldPath.of("name"), FieldPath.of("odd.field", "x"))),
			Precondition.exists(true),
			List.of(
				new FieldTransform(FieldPath.of("updated"), ServerTimestampOperation.INSTANCE),
				new FieldTransform(FieldPath.of("visits"), new NumericIncrementOperation(new IntegerValue(1))),
				new FieldTransform(FieldPath.of("tags"), new ArrayTransformOperation.Union(List.of(new StringValue("new")))),
				new FieldTransform(FieldPath.of("tags"), new ArrayTransformOperation.Remove(List.of(new StringValue("old"))))));
		Mutation delete = new DeleteMutation(key, Precondition.updateTime(SnapshotVersion.ofMicros(77)));

		BsonValue encoded = format.encodeMutations(List.of(patch, delete));
		assertEquals(List.of(patch, delete), format.decodeMutations(encoded.asArray()));
	}

	@Test
	void targetData() {
		Query query = Query.atPath(ResourcePath.fromString("rooms/r1/messages"))
			.filter(FieldFilter.create(FieldPath.of("score"), FieldFilter.Operator.GREATER_THAN, new IntegerValue(10)))
			.orderBy(OrderBy.descending(FieldPath.of("score")))
			.startAt(new Bound(List.of(new IntegerValue(100)), true))
			.limitToFirst(5);
		TargetData original = new TargetData(query.toTarget(), 7, 3, QueryPurpose.LISTEN,
			SnapshotVersion.ofMicros(9_000_000), SnapshotVersion.ofMicros(8_000_000),
			ByteString.copyFromUtf8("resume"), 12);

		BsonDocument encoded = format.encodeTargetData(original);
		assertEquals(7, encoded.getInt32("_id").getValue());
		assertEquals(original, format.decodeTargetData(encoded));
	}
}
