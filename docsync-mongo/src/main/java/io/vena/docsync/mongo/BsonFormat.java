package io.vena.docsync.mongo;

import io.vena.docsync.bundle.BundleMetadata;
import io.vena.docsync.bundle.BundledQuery;
import io.vena.docsync.bundle.NamedQuery;
import io.vena.docsync.core.Bound;
import io.vena.docsync.core.FieldFilter;
import io.vena.docsync.core.OrderBy;
import io.vena.docsync.core.Query;
import io.vena.docsync.core.Target;
import io.vena.docsync.local.IndexEntry;
import io.vena.docsync.local.QueryPurpose;
import io.vena.docsync.local.TargetData;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldIndex;
import io.vena.docsync.model.FieldPath;
import io.vena.docsync.model.IndexOffset;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.ResourcePath;
import io.vena.docsync.model.SnapshotVersion;
import io.vena.docsync.model.mutation.ArrayTransformOperation;
import io.vena.docsync.model.mutation.DeleteMutation;
import io.vena.docsync.model.mutation.FieldMask;
import io.vena.docsync.model.mutation.FieldTransform;
import io.vena.docsync.model.mutation.Mutation;
import io.vena.docsync.model.mutation.MutationBatch;
import io.vena.docsync.model.mutation.NumericIncrementOperation;
import io.vena.docsync.model.mutation.PatchMutation;
import io.vena.docsync.model.mutation.Precondition;
import io.vena.docsync.model.mutation.ServerTimestampOperation;
import io.vena.docsync.model.mutation.SetMutation;
import io.vena.docsync.model.mutation.TransformOperation;
import io.vena.docsync.model.mutation.VerifyMutation;
import io.vena.docsync.model.value.ArrayValue;
import io.vena.docsync.model.value.BooleanValue;
import io.vena.docsync.model.value.BytesValue;
import io.vena.docsync.model.value.DoubleValue;
import io.vena.docsync.model.value.IntegerValue;
import io.vena.docsync.model.value.NullValue;
import io.vena.docsync.model.value.ObjectValue;
import io.vena.docsync.model.value.ReferenceValue;
import io.vena.docsync.model.value.StringValue;
import io.vena.docsync.model.value.TimestampValue;
import io.vena.docsync.model.value.Value;
import io.vena.docsync.util.ByteString;
import java.io.UnsupportedEncodingException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.UnaryOperator;
import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.jetbrains.annotations.Nullable;

/**
 * Facilities to translate between in-DB and in-memory representations.
 *
 * <p>
 * Field values map onto the matching BSON scalar types where one exists.
 * Every {@link BsonDocument} in an encoded value is a wrapper with a single field
 * naming its kind ({@link #MAP}, {@link #TIMESTAMP} or {@link #REFERENCE}),
 * so a value can always be decoded without knowing its type in advance.
 */
final class BsonFormat {
	static final String MAP = "map";
	static final String TIMESTAMP = "timestamp";
	static final String REFERENCE = "reference";

	/**
	 * The fields of the documents in the remote document collection.
	 */
	enum RemoteDocumentFields {
		collectionPath,
		collectionGroup,
		readTimeSeconds,
		document,
	}

	//
	// Values
	//

	BsonValue encodeValue(Value value) {
		if (value instanceof NullValue) {
			return BsonNull.VALUE;
		} else if (value instanceof BooleanValue) {
			return BsonBoolean.valueOf(((BooleanValue) value).value());
		} else if (value instanceof IntegerValue) {
			return new BsonInt64(((IntegerValue) value).value());
		} else if (value instanceof DoubleValue) {
			return new BsonDouble(((DoubleValue) value).value());
		} else if (value instanceof StringValue) {
			return new BsonString(((StringValue) value).value());
		} else if (value instanceof BytesValue) {
			return new BsonBinary(((BytesValue) value).value().toByteArray());
		} else if (value instanceof ArrayValue) {
			BsonArray result = new BsonArray();
			for (Value element: ((ArrayValue) value).values()) {
				result.add(encodeValue(element));
			}
			return result;
		} else if (value instanceof ObjectValue) {
			return new BsonDocument(MAP, encodeFields((ObjectValue) value));
		} else if (value instanceof TimestampValue) {
			return new BsonDocument(TIMESTAMP, encodeInstant(((TimestampValue) value).value()));
		} else if (value instanceof ReferenceValue) {
			return new BsonDocument(REFERENCE, encodeKey(((ReferenceValue) value).key()));
		} else {
			// Server timestamps only ever exist in local views
			throw new IllegalArgumentException("Value cannot be stored: " + value.getClass().getSimpleName());
		}
	}

	Value decodeValue(BsonValue bson) {
		switch (bson.getBsonType()) {
			case NULL:
				return NullValue.INSTANCE;
			case BOOLEAN:
				return BooleanValue.of(bson.asBoolean().getValue());
			case INT32:
				return new IntegerValue(bson.asInt32().getValue());
			case INT64:
				return new IntegerValue(bson.asInt64().getValue());
			case DOUBLE:
				return new DoubleValue(bson.asDouble().getValue());
			case STRING:
				return new StringValue(bson.asString().getValue());
			case BINARY:
				return new BytesValue(ByteString.copyFrom(bson.asBinary().getData()));
			case ARRAY:
				List<Value> elements = new ArrayList<>();
				for (BsonValue element: bson.asArray()) {
					elements.add(decodeValue(element));
				}
				return new ArrayValue(elements);
			case DOCUMENT:
				return decodeWrappedValue(bson.asDocument());
			default:
				throw new IllegalArgumentException("Unexpected BSON type for a value: " + bson.getBsonType());
		}
	}

	private Value decodeWrappedValue(BsonDocument wrapper) {
		if (wrapper.size() != 1) {
			throw new IllegalArgumentException("Value wrapper must have exactly one field: " + wrapper.keySet());
		}
		String kind = wrapper.getFirstKey();
		switch (kind) {
			case MAP:
				return decodeFields(wrapper.getDocument(MAP));
			case TIMESTAMP:
				return new TimestampValue(decodeInstant(wrapper.getDocument(TIMESTAMP)));
			case REFERENCE:
				return new ReferenceValue(decodeKey(wrapper.get(REFERENCE)));
			default:
				throw new IllegalArgumentException("Unrecognized value wrapper: " + kind);
		}
	}

	BsonDocument encodeFields(ObjectValue value) {
		BsonDocument result = new BsonDocument();
		for (Map.Entry<String, Value> entry: value.entrySet()) {
			result.put(fieldNameSegment(entry.getKey()), encodeValue(entry.getValue()));
		}
		return result;
	}

	ObjectValue decodeFields(BsonDocument fields) {
		Map<String, Value> result = new LinkedHashMap<>();
		for (Map.Entry<String, BsonValue> entry: fields.entrySet()) {
			result.put(undottedFieldNameSegment(entry.getKey()), decodeValue(entry.getValue()));
		}
		return ObjectValue.fromMap(result);
	}

	//
	// Paths and versions
	//

	BsonString encodeKey(DocumentKey key) {
		return encodePath(key.path());
	}

	DocumentKey decodeKey(BsonValue bson) {
		return DocumentKey.fromPathString(bson.asString().getValue());
	}

	BsonString encodePath(ResourcePath path) {
		return new BsonString(path.canonicalString());
	}

	ResourcePath decodePath(BsonValue bson) {
		return ResourcePath.fromString(bson.asString().getValue());
	}

	BsonArray encodeFieldPath(FieldPath path) {
		BsonArray result = new BsonArray();
		for (String segment: path.segments()) {
			result.add(new BsonString(segment));
		}
		return result;
	}

	FieldPath decodeFieldPath(BsonValue bson) {
		List<String> segments = new ArrayList<>();
		for (BsonValue segment: bson.asArray()) {
			segments.add(segment.asString().getValue());
		}
		return FieldPath.fromSegments(segments);
	}

	BsonDocument encodeInstant(Instant instant) {
		return new BsonDocument()
			.append("seconds", new BsonInt64(instant.getEpochSecond()))
			.append("nanos", new BsonInt32(instant.getNano()));
	}

	Instant decodeInstant(BsonDocument bson) {
		return Instant.ofEpochSecond(bson.getInt64("seconds").getValue(), bson.getInt32("nanos").getValue());
	}

	BsonDocument encodeVersion(SnapshotVersion version) {
		return encodeInstant(version.timestamp());
	}

	SnapshotVersion decodeVersion(BsonDocument bson) {
		return new SnapshotVersion(decodeInstant(bson));
	}

	BsonBinary encodeBytes(ByteString bytes) {
		return new BsonBinary(bytes.toByteArray());
	}

	ByteString decodeBytes(BsonValue bson) {
		return ByteString.copyFrom(bson.asBinary().getData());
	}

	//
	// Documents
	//

	enum DocumentType {
		FOUND,
		NO_DOCUMENT,
		UNKNOWN,
		INVALID,
	}

	BsonDocument encodeDocument(MutableDocument document) {
		DocumentType type;
		if (document.isFoundDocument()) {
			type = DocumentType.FOUND;
		} else if (document.isNoDocument()) {
			type = DocumentType.NO_DOCUMENT;
		} else if (document.isUnknownDocument()) {
			type = DocumentType.UNKNOWN;
		} else {
			type = DocumentType.INVALID;
		}
		BsonDocument result = new BsonDocument()
			.append("type", new BsonString(type.name()))
			.append("version", encodeVersion(document.version()))
			.append("readTime", encodeVersion(document.readTime()))
			.append("hasCommittedMutations", BsonBoolean.valueOf(document.hasCommittedMutations()));
		if (document.isFoundDocument()) {
			result.append("fields", encodeFields(document.data()));
		}
		return result;
	}

	MutableDocument decodeDocument(DocumentKey key, BsonDocument bson) {
		SnapshotVersion version = decodeVersion(bson.getDocument("version"));
		MutableDocument result;
		switch (DocumentType.valueOf(bson.getString("type").getValue())) {
			case FOUND:
				result = MutableDocument.newFoundDocument(key, version, decodeFields(bson.getDocument("fields")));
				break;
			case NO_DOCUMENT:
				result = MutableDocument.newNoDocument(key, version);
				break;
			case UNKNOWN:
				result = MutableDocument.newUnknownDocument(key, version);
				break;
			default:
				result = MutableDocument.newInvalidDocument(key);
				break;
		}
		result.setReadTime(decodeVersion(bson.getDocument("readTime")));
		if (bson.getBoolean("hasCommittedMutations").getValue()) {
			result.setHasCommittedMutations();
		}
		return result;
	}

	//
	// Mutations
	//

	enum MutationType {
		SET,
		PATCH,
		DELETE,
		VERIFY,
	}

	BsonDocument encodeMutation(Mutation mutation) {
		BsonDocument result = new BsonDocument()
			.append("key", encodeKey(mutation.key()))
			.append("precondition", encodePrecondition(mutation.precondition()));
		if (mutation instanceof SetMutation) {
			result.append("type", new BsonString(MutationType.SET.name()));
			result.append("value", encodeFields(((SetMutation) mutation).value()));
		} else if (mutation instanceof PatchMutation) {
			PatchMutation patch = (PatchMutation) mutation;
			BsonArray mask = new BsonArray();
			for (FieldPath path: patch.mask().getMask()) {
				mask.add(encodeFieldPath(path));
			}
			result.append("type", new BsonString(MutationType.PATCH.name()));
			result.append("value", encodeFields(patch.value()));
			result.append("mask", mask);
		} else if (mutation instanceof DeleteMutation) {
			result.append("type", new BsonString(MutationType.DELETE.name()));
		} else if (mutation instanceof VerifyMutation) {
			result.append("type", new BsonString(MutationType.VERIFY.name()));
		} else {
			throw new IllegalArgumentException("Unexpected mutation type: " + mutation.getClass().getSimpleName());
		}
		if (!mutation.fieldTransforms().isEmpty()) {
			BsonArray transforms = new BsonArray();
			for (FieldTransform transform: mutation.fieldTransforms()) {
				transforms.add(encodeFieldTransform(transform));
			}
			result.append("transforms", transforms);
		}
		return result;
	}

	Mutation decodeMutation(BsonDocument bson) {
		DocumentKey key = decodeKey(bson.get("key"));
		Precondition precondition = decodePrecondition(bson.getDocument("precondition"));
		List<FieldTransform> transforms = new ArrayList<>();
		if (bson.containsKey("transforms")) {
			for (BsonValue transform: bson.getArray("transforms")) {
				transforms.add(decodeFieldTransform(transform.asDocument()));
			}
		}
		switch (MutationType.valueOf(bson.getString("type").getValue())) {
			case SET:
				return new SetMutation(key, decodeFields(bson.getDocument("value")), precondition, transforms);
			case PATCH:
				TreeSet<FieldPath> mask = new TreeSet<>();
				for (BsonValue path: bson.getArray("mask")) {
					mask.add(decodeFieldPath(path));
				}
				return new PatchMutation(key, decodeFields(bson.getDocument("value")), FieldMask.fromSet(mask), precondition, transforms);
			case DELETE:
				return new DeleteMutation(key, precondition);
			default:
				return new VerifyMutation(key, precondition);
		}
	}

	private BsonDocument encodePrecondition(Precondition precondition) {
		BsonDocument result = new BsonDocument();
		if (precondition.updateTime() != null) {
			result.append("updateTime", encodeVersion(precondition.updateTime()));
		}
		if (precondition.exists() != null) {
			result.append("exists", BsonBoolean.valueOf(precondition.exists()));
		}
		return result;
	}

	private Precondition decodePrecondition(BsonDocument bson) {
		if (bson.containsKey("updateTime")) {
			return Precondition.updateTime(decodeVersion(bson.getDocument("updateTime")));
		} else if (bson.containsKey("exists")) {
			return Precondition.exists(bson.getBoolean("exists").getValue());
		} else {
			return Precondition.NONE;
		}
	}

	private BsonDocument encodeFieldTransform(FieldTransform transform) {
		BsonDocument result = new BsonDocument("field", encodeFieldPath(transform.fieldPath()));
		TransformOperation operation = transform.operation();
		if (operation instanceof ServerTimestampOperation) {
			result.append("operation", new BsonString("serverTimestamp"));
		} else if (operation instanceof NumericIncrementOperation) {
			result.append("operation", new BsonString("increment"));
			result.append("operand", encodeValue(((NumericIncrementOperation) operation).operand()));
		} else if (operation instanceof ArrayTransformOperation.Union) {
			result.append("operation", new BsonString("arrayUnion"));
			result.append("elements", encodeValue(new ArrayValue(((ArrayTransformOperation) operation).elements())));
		} else if (operation instanceof ArrayTransformOperation.Remove) {
			result.append("operation", new BsonString("arrayRemove"));
			result.append("elements", encodeValue(new ArrayValue(((ArrayTransformOperation) operation).elements())));
		} else {
			throw new IllegalArgumentException("Unexpected transform: " + operation);
		}
		return result;
	}

	private FieldTransform decodeFieldTransform(BsonDocument bson) {
		FieldPath field = decodeFieldPath(bson.get("field"));
		String operation = bson.getString("operation").getValue();
		switch (operation) {
			case "serverTimestamp":
				return new FieldTransform(field, ServerTimestampOperation.INSTANCE);
			case "increment":
				return new FieldTransform(field, new NumericIncrementOperation(decodeValue(bson.get("operand"))));
			case "arrayUnion":
				return new FieldTransform(field, new ArrayTransformOperation.Union(decodeElements(bson)));
			case "arrayRemove":
				return new FieldTransform(field, new ArrayTransformOperation.Remove(decodeElements(bson)));
			default:
				throw new IllegalArgumentException("Unrecognized transform: " + operation);
		}
	}

	private List<Value> decodeElements(BsonDocument transform) {
		return ((ArrayValue) decodeValue(transform.getArray("elements"))).values();
	}

	BsonArray encodeMutations(List<Mutation> mutations) {
		BsonArray result = new BsonArray();
		for (Mutation mutation: mutations) {
			result.add(encodeMutation(mutation));
		}
		return result;
	}

	List<Mutation> decodeMutations(BsonArray bson) {
		List<Mutation> result = new ArrayList<>();
		for (BsonValue mutation: bson) {
			result.add(decodeMutation(mutation.asDocument()));
		}
		return result;
	}

	MutationBatch decodeMutationBatch(BsonDocument bson) {
		return new MutationBatch(
			bson.getInt32("batchId").getValue(),
			decodeInstant(bson.getDocument("localWriteTime")),
			decodeMutations(bson.getArray("baseMutations")),
			decodeMutations(bson.getArray("mutations")));
	}

	//
	// Targets
	//

	BsonDocument encodeTarget(Target target) {
		BsonArray filters = new BsonArray();
		for (FieldFilter filter: target.filters()) {
			filters.add(new BsonDocument()
				.append("field", encodeFieldPath(filter.field()))
				.append("operator", new BsonString(filter.operator().name()))
				.append("value", encodeValue(filter.value())));
		}
		BsonArray orderBys = new BsonArray();
		for (OrderBy orderBy: target.orderBys()) {
			orderBys.add(new BsonDocument()
				.append("field", encodeFieldPath(orderBy.field()))
				.append("direction", new BsonString(orderBy.direction().name())));
		}
		BsonDocument result = new BsonDocument()
			.append("path", encodePath(target.path()))
			.append("filters", filters)
			.append("orderBys", orderBys)
			.append("limit", new BsonInt64(target.limit()));
		if (target.collectionGroup() != null) {
			result.append("collectionGroup", new BsonString(target.collectionGroup()));
		}
		if (target.startAt() != null) {
			result.append("startAt", encodeBound(target.startAt()));
		}
		if (target.endAt() != null) {
			result.append("endAt", encodeBound(target.endAt()));
		}
		return result;
	}

	Target decodeTarget(BsonDocument bson) {
		List<FieldFilter> filters = new ArrayList<>();
		for (BsonValue filter: bson.getArray("filters")) {
			BsonDocument doc = filter.asDocument();
			filters.add(FieldFilter.create(
				decodeFieldPath(doc.get("field")),
				FieldFilter.Operator.valueOf(doc.getString("operator").getValue()),
				decodeValue(doc.get("value"))));
		}
		List<OrderBy> orderBys = new ArrayList<>();
		for (BsonValue orderBy: bson.getArray("orderBys")) {
			BsonDocument doc = orderBy.asDocument();
			orderBys.add(new OrderBy(
				OrderBy.Direction.valueOf(doc.getString("direction").getValue()),
				decodeFieldPath(doc.get("field"))));
		}
		return new Target(
			decodePath(bson.get("path")),
			bson.containsKey("collectionGroup") ? bson.getString("collectionGroup").getValue() : null,
			filters,
			orderBys,
			bson.getInt64("limit").getValue(),
			bson.containsKey("startAt") ? decodeBound(bson.getDocument("startAt")) : null,
			bson.containsKey("endAt") ? decodeBound(bson.getDocument("endAt")) : null);
	}

	private BsonDocument encodeBound(Bound bound) {
		return new BsonDocument()
			.append("position", encodeValue(new ArrayValue(bound.position())))
			.append("inclusive", BsonBoolean.valueOf(bound.inclusive()));
	}

	private Bound decodeBound(BsonDocument bson) {
		ArrayValue position = (ArrayValue) decodeValue(bson.getArray("position"));
		return new Bound(position.values(), bson.getBoolean("inclusive").getValue());
	}

	/**
	 * The <code>_id</code> is the target id; the canonical id is indexed for lookups by target.
	 */
	BsonDocument encodeTargetData(TargetData targetData) {
		BsonDocument result = new BsonDocument()
			.append("_id", new BsonInt32(targetData.targetId()))
			.append("canonicalId", new BsonString(targetData.target().canonicalId()))
			.append("target", encodeTarget(targetData.target()))
			.append("sequenceNumber", new BsonInt64(targetData.sequenceNumber()))
			.append("purpose", new BsonString(targetData.purpose().name()))
			.append("snapshotVersion", encodeVersion(targetData.snapshotVersion()))
			.append("lastLimboFreeSnapshotVersion", encodeVersion(targetData.lastLimboFreeSnapshotVersion()))
			.append("resumeToken", encodeBytes(targetData.resumeToken()));
		if (targetData.expectedCount() != null) {
			result.append("expectedCount", new BsonInt32(targetData.expectedCount()));
		}
		return result;
	}

	TargetData decodeTargetData(BsonDocument bson) {
		return new TargetData(
			decodeTarget(bson.getDocument("target")),
			bson.getInt32("_id").getValue(),
			bson.getInt64("sequenceNumber").getValue(),
			QueryPurpose.valueOf(bson.getString("purpose").getValue()),
			decodeVersion(bson.getDocument("snapshotVersion")),
			decodeVersion(bson.getDocument("lastLimboFreeSnapshotVersion")),
			decodeBytes(bson.get("resumeToken")),
			bson.containsKey("expectedCount") ? bson.getInt32("expectedCount").getValue() : null);
	}

	//
	// Bundles
	//

	BsonDocument encodeBundleMetadata(BundleMetadata metadata) {
		return new BsonDocument()
			.append("_id", new BsonString(metadata.bundleId()))
			.append("version", new BsonInt32(metadata.version()))
			.append("createTime", encodeVersion(metadata.createTime()))
			.append("totalDocuments", new BsonInt32(metadata.totalDocuments()))
			.append("totalBytes", new BsonInt64(metadata.totalBytes()));
	}

	BundleMetadata decodeBundleMetadata(BsonDocument bson) {
		return new BundleMetadata(
			bson.getString("_id").getValue(),
			bson.getInt32("version").getValue(),
			decodeVersion(bson.getDocument("createTime")),
			bson.getInt32("totalDocuments").getValue(),
			bson.getInt64("totalBytes").getValue());
	}

	BsonDocument encodeNamedQuery(NamedQuery query) {
		return new BsonDocument()
			.append("_id", new BsonString(query.name()))
			.append("target", encodeTarget(query.bundledQuery().target()))
			.append("limitType", new BsonString(query.bundledQuery().limitType().name()))
			.append("readTime", encodeVersion(query.readTime()));
	}

	NamedQuery decodeNamedQuery(BsonDocument bson) {
		BundledQuery bundledQuery = new BundledQuery(
			decodeTarget(bson.getDocument("target")),
			Query.LimitType.valueOf(bson.getString("limitType").getValue()));
		return new NamedQuery(bson.getString("_id").getValue(), bundledQuery, decodeVersion(bson.getDocument("readTime")));
	}

	//
	// Field indexes
	//

	BsonDocument encodeFieldIndex(FieldIndex index) {
		BsonArray segments = new BsonArray();
		for (FieldIndex.Segment segment: index.segments()) {
			segments.add(new BsonDocument()
				.append("field", encodeFieldPath(segment.fieldPath()))
				.append("kind", new BsonString(segment.kind().name())));
		}
		return new BsonDocument()
			.append("_id", new BsonInt32(index.indexId()))
			.append("collectionGroup", new BsonString(index.collectionGroup()))
			.append("segments", segments)
			.append("sequenceNumber", new BsonInt64(index.indexState().sequenceNumber()))
			.append("offset", encodeIndexOffset(index.indexState().offset()));
	}

	FieldIndex decodeFieldIndex(BsonDocument bson) {
		List<FieldIndex.Segment> segments = new ArrayList<>();
		for (BsonValue segment: bson.getArray("segments")) {
			BsonDocument doc = segment.asDocument();
			segments.add(new FieldIndex.Segment(
				decodeFieldPath(doc.get("field")),
				FieldIndex.Segment.Kind.valueOf(doc.getString("kind").getValue())));
		}
		FieldIndex.IndexState state = new FieldIndex.IndexState(
			bson.getInt64("sequenceNumber").getValue(),
			decodeIndexOffset(bson.getDocument("offset")));
		return new FieldIndex(bson.getInt32("_id").getValue(), bson.getString("collectionGroup").getValue(), segments, state);
	}

	BsonDocument encodeIndexOffset(IndexOffset offset) {
		return new BsonDocument()
			.append("readTime", encodeVersion(offset.readTime()))
			.append("key", encodeKey(offset.documentKey()))
			.append("largestBatchId", new BsonInt32(offset.largestBatchId()));
	}

	IndexOffset decodeIndexOffset(BsonDocument bson) {
		return new IndexOffset(
			decodeVersion(bson.getDocument("readTime")),
			decodeKey(bson.get("key")),
			bson.getInt32("largestBatchId").getValue());
	}

	BsonDocument encodeIndexEntry(IndexEntry entry) {
		BsonArray values = new BsonArray();
		for (Value value: entry.directionalValues()) {
			values.add(encodeValue(value));
		}
		BsonDocument result = new BsonDocument("values", values);
		if (entry.arrayValue() != null) {
			result.append("arrayValue", encodeValue(entry.arrayValue()));
		}
		return result;
	}

	IndexEntry decodeIndexEntry(int indexId, DocumentKey key, BsonDocument bson) {
		List<Value> values = new ArrayList<>();
		for (BsonValue value: bson.getArray("values")) {
			values.add(decodeValue(value));
		}
		@Nullable Value arrayValue = bson.containsKey("arrayValue") ? decodeValue(bson.get("arrayValue")) : null;
		return new IndexEntry(indexId, key, values, arrayValue);
	}

	//
	// Field names
	//

	static String fieldNameSegment(String segment) {
		return ENCODER.apply(segment);
	}

	static String undottedFieldNameSegment(String encodedSegment) {
		return DECODER.apply(encodedSegment);
	}

	private static final UnaryOperator<String> DECODER;
	private static final UnaryOperator<String> ENCODER;

	static {
		DECODER = s->{
			try {
				return URLDecoder.decode(s, StandardCharsets.UTF_8.name());
			} catch (UnsupportedEncodingException e) {
				throw new AssertionError(e);
			}
		};

		ENCODER = s->{
			// Selective percent-encoding of the characters MongoDB treats specially,
			// compatible with standard percent-decoding.
			StringBuilder sb = new StringBuilder();
			for (int i = 0; i < s.length(); ) {
				int cp = s.codePointAt(i);
				switch (cp) {
					case '%':
					case '+': case ' ': // Affected by URLDecoder
					case '$':
					case '.':
					case 0:
						appendPercentEncoded(sb, cp);
						break;
					default:
						sb.appendCodePoint(cp);
						break;
				}
				i += Character.charCount(cp);
			}
			return sb.toString();
		};
	}

	private static void appendPercentEncoded(StringBuilder sb, int cp) {
		sb
			.append('%')
			.append(hexCharForDigit(cp / 16))
			.append(hexCharForDigit(cp % 16));
	}

	private static char hexCharForDigit(int value) {
		if (value < 10) {
			return (char)('0' + value);
		} else {
			return (char)('A' + value - 10);
		}
	}
}
