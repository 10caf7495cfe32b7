package io.vena.docsync.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.BeanDescription;
import com.fasterxml.jackson.databind.DeserializationConfig;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.KeyDeserializer;
import com.fasterxml.jackson.databind.SerializationConfig;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.Deserializers;
import com.fasterxml.jackson.databind.jsontype.TypeDeserializer;
import com.fasterxml.jackson.databind.jsontype.TypeSerializer;
import com.fasterxml.jackson.databind.ser.Serializers;
import com.fasterxml.jackson.databind.type.MapType;
import io.vena.docsync.bundle.BundleDocument;
import io.vena.docsync.bundle.BundleElement;
import io.vena.docsync.bundle.BundleMetadata;
import io.vena.docsync.bundle.BundledDocumentMetadata;
import io.vena.docsync.bundle.BundledQuery;
import io.vena.docsync.bundle.NamedQuery;
import io.vena.docsync.core.Bound;
import io.vena.docsync.core.FieldFilter;
import io.vena.docsync.core.OrderBy;
import io.vena.docsync.core.Query;
import io.vena.docsync.core.Target;
import io.vena.docsync.model.DatabaseId;
import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.FieldPath;
import io.vena.docsync.model.MutableDocument;
import io.vena.docsync.model.ResourcePath;
import io.vena.docsync.model.SnapshotVersion;
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
import java.io.IOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

import static com.fasterxml.jackson.core.JsonToken.END_ARRAY;
import static com.fasterxml.jackson.core.JsonToken.END_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.FIELD_NAME;
import static com.fasterxml.jackson.core.JsonToken.START_ARRAY;
import static com.fasterxml.jackson.core.JsonToken.START_OBJECT;
import static com.fasterxml.jackson.core.JsonToken.VALUE_NULL;
import static com.fasterxml.jackson.core.JsonToken.VALUE_STRING;

/**
 * Provides JSON serialization of document {@link Value}s and {@link BundleElement}s using Jackson.
 *
 * <p>
 * Values use the typed form of the backend's REST API, like <code>{"integerValue": "1"}</code>
 * or <code>{"mapValue": {"fields": {...}}}</code>. Each bundle element is an object with a single
 * field naming its kind: <code>metadata</code>, <code>namedQuery</code>, <code>documentMetadata</code>
 * or <code>document</code>. Document names are fully qualified, so a module is tied to one database.
 */
public final class JacksonBundlePlugin {

	public DocSyncJacksonModule moduleFor(DatabaseId databaseId) {
		Codec codec = new Codec(databaseId);
		return new DocSyncJacksonModule() {
			@Override
			public void setupModule(SetupContext context) {
				context.addSerializers(new DocSyncSerializers(codec));
				context.addDeserializers(new DocSyncDeserializers(codec));
			}
		};
	}

	private static final class DocSyncSerializers extends Serializers.Base {
		private final Codec codec;

		DocSyncSerializers(Codec codec) {
			this.codec = codec;
		}

		@Override
		public JsonSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (Value.class.isAssignableFrom(theClass)) {
				return new JsonSerializer<Value>() {
					@Override
					public void serialize(Value value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
						codec.writeValue(value, gen);
					}
				};
			} else if (BundleElement.class.isAssignableFrom(theClass)) {
				return new JsonSerializer<BundleElement>() {
					@Override
					public void serialize(BundleElement value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
						codec.writeElement(value, gen);
					}
				};
			} else {
				return null;
			}
		}

		// ObjectValue is a Map, but Jackson's map handling would lose the value types

		@Override
		public JsonSerializer<?> findMapSerializer(SerializationConfig config, MapType type, BeanDescription beanDesc, JsonSerializer<Object> keySerializer, TypeSerializer elementTypeSerializer, JsonSerializer<Object> elementValueSerializer) {
			return findSerializer(config, type, beanDesc);
		}
	}

	private static final class DocSyncDeserializers extends Deserializers.Base {
		private final Codec codec;

		DocSyncDeserializers(Codec codec) {
			this.codec = codec;
		}

		@Override
		public JsonDeserializer<?> findBeanDeserializer(JavaType type, DeserializationConfig config, BeanDescription beanDesc) {
			Class<?> theClass = type.getRawClass();
			if (Value.class.isAssignableFrom(theClass)) {
				return new DocSyncDeserializer<Value>() {
					@Override
					public Value deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
						return checkedType(theClass, codec.readValue(p), p);
					}
				};
			} else if (BundleElement.class.isAssignableFrom(theClass)) {
				return new DocSyncDeserializer<BundleElement>() {
					@Override
					public BundleElement deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
						return checkedType(theClass, codec.readElement(p), p);
					}
				};
			} else {
				return null;
			}
		}

		@Override
		public JsonDeserializer<?> findMapDeserializer(MapType type, DeserializationConfig config, BeanDescription beanDesc, KeyDeserializer keyDeserializer, TypeDeserializer elementTypeDeserializer, JsonDeserializer<?> elementDeserializer) {
			return findBeanDeserializer(type, config, beanDesc);
		}

		private static <T> T checkedType(Class<?> expected, T actual, JsonParser p) throws JsonParseException {
			if (expected.isInstance(actual)) {
				return actual;
			} else {
				throw new JsonParseException(p, "Expected " + expected.getSimpleName() + "; found " + actual.getClass().getSimpleName());
			}
		}
	}

	/**
	 * Common properties all our deserializers have.
	 */
	private abstract static class DocSyncDeserializer<T> extends JsonDeserializer<T> {
		@Override public boolean isCachable() { return true; }
	}

	/**
	 * The reading and writing logic, bound to the database whose names appear in the JSON.
	 */
	static final class Codec {
		private final DatabaseId databaseId;

		Codec(DatabaseId databaseId) {
			this.databaseId = databaseId;
		}

		// Values

		void writeValue(Value value, JsonGenerator gen) throws IOException {
			gen.writeStartObject();
			if (value instanceof NullValue) {
				gen.writeNullField("nullValue");
			} else if (value instanceof BooleanValue) {
				gen.writeBooleanField("booleanValue", ((BooleanValue) value).value());
			} else if (value instanceof IntegerValue) {
				// int64 values are strings, as JSON numbers can't hold all of them
				gen.writeStringField("integerValue", Long.toString(((IntegerValue) value).value()));
			} else if (value instanceof DoubleValue) {
				double d = ((DoubleValue) value).value();
				if (Double.isNaN(d) || Double.isInfinite(d)) {
					gen.writeStringField("doubleValue", Double.toString(d));
				} else {
					gen.writeNumberField("doubleValue", d);
				}
			} else if (value instanceof TimestampValue) {
				gen.writeStringField("timestampValue", ((TimestampValue) value).value().toString());
			} else if (value instanceof StringValue) {
				gen.writeStringField("stringValue", ((StringValue) value).value());
			} else if (value instanceof BytesValue) {
				gen.writeStringField("bytesValue", ((BytesValue) value).value().toBase64());
			} else if (value instanceof ReferenceValue) {
				gen.writeStringField("referenceValue", ((ReferenceValue) value).key().fullName(databaseId));
			} else if (value instanceof ArrayValue) {
				gen.writeObjectFieldStart("arrayValue");
				gen.writeArrayFieldStart("values");
				for (Value element: ((ArrayValue) value).values()) {
					writeValue(element, gen);
				}
				gen.writeEndArray();
				gen.writeEndObject();
			} else if (value instanceof ObjectValue) {
				gen.writeObjectFieldStart("mapValue");
				gen.writeFieldName("fields");
				writeFields((ObjectValue) value, gen);
				gen.writeEndObject();
			} else {
				throw JsonMappingException.from(gen, "Value can't be stored in a bundle: " + value);
			}
			gen.writeEndObject();
		}

		private void writeFields(ObjectValue fields, JsonGenerator gen) throws IOException {
			gen.writeStartObject();
			for (Entry<String, Value> entry: fields.entrySet()) {
				gen.writeFieldName(entry.getKey());
				writeValue(entry.getValue(), gen);
			}
			gen.writeEndObject();
		}

		/**
		 * Leaves the parser sitting on the value's END_OBJECT token.
		 */
		Value readValue(JsonParser p) throws IOException {
			expect(START_OBJECT, p);
			if (p.nextToken() != FIELD_NAME) {
				throw new JsonParseException(p, "Value object must have exactly one field");
			}
			String kind = p.currentName();
			p.nextToken();
			Value result;
			switch (kind) {
				case "nullValue":
					result = NullValue.INSTANCE;
					break;
				case "booleanValue":
					result = BooleanValue.of(p.getBooleanValue());
					break;
				case "integerValue":
					result = new IntegerValue(readLong(p));
					break;
				case "doubleValue":
					if (p.currentToken() == VALUE_STRING) {
						result = new DoubleValue(parseDouble(p));
					} else {
						result = new DoubleValue(p.getDoubleValue());
					}
					break;
				case "timestampValue":
					result = new TimestampValue(readInstant(p));
					break;
				case "stringValue":
					result = new StringValue(p.getText());
					break;
				case "bytesValue":
					try {
						result = new BytesValue(ByteString.fromBase64(p.getText()));
					} catch (IllegalArgumentException e) {
						throw new JsonParseException(p, "Invalid base64 bytes", e);
					}
					break;
				case "referenceValue":
					result = new ReferenceValue(readDocumentName(p));
					break;
				case "arrayValue":
					result = readArray(p);
					break;
				case "mapValue":
					result = readMap(p);
					break;
				default:
					throw new JsonParseException(p, "Unrecognized value type: " + kind);
			}
			if (p.nextToken() != END_OBJECT) {
				throw new JsonParseException(p, "Value object must have exactly one field");
			}
			return result;
		}

		private ArrayValue readArray(JsonParser p) throws IOException {
			List<Value> values = new ArrayList<>();
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				if ("values".equals(p.currentName())) {
					expect(START_ARRAY, p);
					while (p.nextToken() != END_ARRAY) {
						values.add(readValue(p));
					}
				} else {
					throw new JsonParseException(p, "Unrecognized field in arrayValue: " + p.currentName());
				}
			}
			return new ArrayValue(values);
		}

		private ObjectValue readMap(JsonParser p) throws IOException {
			ObjectValue result = ObjectValue.empty();
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				if ("fields".equals(p.currentName())) {
					result = readFields(p);
				} else {
					throw new JsonParseException(p, "Unrecognized field in mapValue: " + p.currentName());
				}
			}
			return result;
		}

		private ObjectValue readFields(JsonParser p) throws IOException {
			Map<String, Value> fields = new TreeMap<>();
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				String name = p.currentName();
				p.nextValue();
				Value old = fields.put(name, readValue(p));
				if (old != null) {
					throw new JsonParseException(p, "Field appears twice: \"" + name + "\"");
				}
			}
			return ObjectValue.fromMap(fields);
		}

		// Bundle elements

		void writeElement(BundleElement element, JsonGenerator gen) throws IOException {
			gen.writeStartObject();
			if (element instanceof BundleMetadata) {
				gen.writeFieldName("metadata");
				writeMetadata((BundleMetadata) element, gen);
			} else if (element instanceof NamedQuery) {
				gen.writeFieldName("namedQuery");
				writeNamedQuery((NamedQuery) element, gen);
			} else if (element instanceof BundledDocumentMetadata) {
				gen.writeFieldName("documentMetadata");
				writeDocumentMetadata((BundledDocumentMetadata) element, gen);
			} else if (element instanceof BundleDocument) {
				gen.writeFieldName("document");
				writeDocument(((BundleDocument) element).document(), gen);
			} else {
				throw JsonMappingException.from(gen, "Unknown bundle element type: " + element.getClass().getSimpleName());
			}
			gen.writeEndObject();
		}

		BundleElement readElement(JsonParser p) throws IOException {
			if (p.currentToken() == null) {
				p.nextToken();
			}
			expect(START_OBJECT, p);
			if (p.nextToken() != FIELD_NAME) {
				throw new JsonParseException(p, "Bundle element must have exactly one field");
			}
			String kind = p.currentName();
			p.nextToken();
			BundleElement result;
			switch (kind) {
				case "metadata":
					result = readMetadata(p);
					break;
				case "namedQuery":
					result = readNamedQuery(p);
					break;
				case "documentMetadata":
					result = readDocumentMetadata(p);
					break;
				case "document":
					result = new BundleDocument(readDocument(p));
					break;
				default:
					throw new JsonParseException(p, "Unrecognized bundle element: " + kind);
			}
			if (p.nextToken() != END_OBJECT) {
				throw new JsonParseException(p, "Bundle element must have exactly one field");
			}
			return result;
		}

		private void writeMetadata(BundleMetadata metadata, JsonGenerator gen) throws IOException {
			gen.writeStartObject();
			gen.writeStringField("id", metadata.bundleId());
			gen.writeFieldName("createTime");
			writeTimestamp(metadata.createTime().timestamp(), gen);
			gen.writeNumberField("version", metadata.version());
			gen.writeNumberField("totalDocuments", metadata.totalDocuments());
			gen.writeStringField("totalBytes", Long.toString(metadata.totalBytes()));
			gen.writeEndObject();
		}

		private BundleMetadata readMetadata(JsonParser p) throws IOException {
			String id = null;
			SnapshotVersion createTime = null;
			int version = 0;
			int totalDocuments = 0;
			long totalBytes = 0;
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "id":
						id = p.getText();
						break;
					case "createTime":
						createTime = new SnapshotVersion(readInstant(p));
						break;
					case "version":
						version = (int) readLong(p);
						break;
					case "totalDocuments":
						totalDocuments = (int) readLong(p);
						break;
					case "totalBytes":
						totalBytes = readLong(p);
						break;
					default:
						throw new JsonParseException(p, "Unrecognized field in metadata: " + p.currentName());
				}
			}
			if (id == null) {
				throw new JsonParseException(p, "Missing 'id' field");
			} else if (createTime == null) {
				throw new JsonParseException(p, "Missing 'createTime' field");
			}
			return new BundleMetadata(id, version, createTime, totalDocuments, totalBytes);
		}

		private void writeNamedQuery(NamedQuery namedQuery, JsonGenerator gen) throws IOException {
			BundledQuery bundledQuery = namedQuery.bundledQuery();
			Target target = bundledQuery.target();
			gen.writeStartObject();
			gen.writeStringField("name", namedQuery.name());
			gen.writeObjectFieldStart("bundledQuery");
			ResourcePath parent = target.collectionGroup() != null ? target.path() : target.path().popLast();
			gen.writeStringField("parent", resourceName(parent));
			gen.writeFieldName("structuredQuery");
			writeStructuredQuery(target, gen);
			gen.writeStringField("limitType", bundledQuery.limitType() == Query.LimitType.LIMIT_TO_LAST ? "LAST" : "FIRST");
			gen.writeEndObject();
			gen.writeFieldName("readTime");
			writeTimestamp(namedQuery.readTime().timestamp(), gen);
			gen.writeEndObject();
		}

		private NamedQuery readNamedQuery(JsonParser p) throws IOException {
			String name = null;
			BundledQuery bundledQuery = null;
			SnapshotVersion readTime = null;
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "name":
						name = p.getText();
						break;
					case "bundledQuery":
						bundledQuery = readBundledQuery(p);
						break;
					case "readTime":
						readTime = new SnapshotVersion(readInstant(p));
						break;
					default:
						throw new JsonParseException(p, "Unrecognized field in namedQuery: " + p.currentName());
				}
			}
			if (name == null) {
				throw new JsonParseException(p, "Missing 'name' field");
			} else if (bundledQuery == null) {
				throw new JsonParseException(p, "Missing 'bundledQuery' field");
			} else if (readTime == null) {
				throw new JsonParseException(p, "Missing 'readTime' field");
			}
			return new NamedQuery(name, bundledQuery, readTime);
		}

		private BundledQuery readBundledQuery(JsonParser p) throws IOException {
			ResourcePath parent = null;
			StructuredQuery structuredQuery = null;
			Query.LimitType limitType = Query.LimitType.LIMIT_TO_FIRST;
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "parent":
						parent = parseResourceName(p.getText(), p);
						break;
					case "structuredQuery":
						structuredQuery = readStructuredQuery(p);
						break;
					case "limitType":
						switch (p.getText()) {
							case "FIRST":
								limitType = Query.LimitType.LIMIT_TO_FIRST;
								break;
							case "LAST":
								limitType = Query.LimitType.LIMIT_TO_LAST;
								break;
							default:
								throw new JsonParseException(p, "Unrecognized limitType: " + p.getText());
						}
						break;
					default:
						throw new JsonParseException(p, "Unrecognized field in bundledQuery: " + p.currentName());
				}
			}
			if (parent == null) {
				throw new JsonParseException(p, "Missing 'parent' field");
			} else if (structuredQuery == null) {
				throw new JsonParseException(p, "Missing 'structuredQuery' field");
			}
			return new BundledQuery(structuredQuery.toTarget(parent), limitType);
		}

		private void writeDocumentMetadata(BundledDocumentMetadata metadata, JsonGenerator gen) throws IOException {
			gen.writeStartObject();
			gen.writeStringField("name", metadata.key().fullName(databaseId));
			gen.writeFieldName("readTime");
			writeTimestamp(metadata.readTime().timestamp(), gen);
			gen.writeBooleanField("exists", metadata.exists());
			gen.writeArrayFieldStart("queries");
			for (String query: metadata.queries()) {
				gen.writeString(query);
			}
			gen.writeEndArray();
			gen.writeEndObject();
		}

		private BundledDocumentMetadata readDocumentMetadata(JsonParser p) throws IOException {
			DocumentKey key = null;
			SnapshotVersion readTime = null;
			boolean exists = false;
			List<String> queries = new ArrayList<>();
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "name":
						key = readDocumentName(p);
						break;
					case "readTime":
						readTime = new SnapshotVersion(readInstant(p));
						break;
					case "exists":
						exists = p.getBooleanValue();
						break;
					case "queries":
						expect(START_ARRAY, p);
						while (p.nextToken() != END_ARRAY) {
							queries.add(p.getText());
						}
						break;
					default:
						throw new JsonParseException(p, "Unrecognized field in documentMetadata: " + p.currentName());
				}
			}
			if (key == null) {
				throw new JsonParseException(p, "Missing 'name' field");
			} else if (readTime == null) {
				throw new JsonParseException(p, "Missing 'readTime' field");
			}
			return new BundledDocumentMetadata(key, readTime, exists, queries);
		}

		private void writeDocument(MutableDocument document, JsonGenerator gen) throws IOException {
			if (!document.isFoundDocument()) {
				throw JsonMappingException.from(gen, "Only existing documents can be bundled: " + document);
			}
			gen.writeStartObject();
			gen.writeStringField("name", document.key().fullName(databaseId));
			gen.writeFieldName("fields");
			writeFields(document.data(), gen);
			gen.writeFieldName("updateTime");
			writeTimestamp(document.version().timestamp(), gen);
			gen.writeEndObject();
		}

		private MutableDocument readDocument(JsonParser p) throws IOException {
			DocumentKey key = null;
			ObjectValue fields = ObjectValue.empty();
			SnapshotVersion updateTime = null;
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "name":
						key = readDocumentName(p);
						break;
					case "fields":
						fields = readFields(p);
						break;
					case "createTime":
						readInstant(p);
						break;
					case "updateTime":
						updateTime = new SnapshotVersion(readInstant(p));
						break;
					default:
						throw new JsonParseException(p, "Unrecognized field in document: " + p.currentName());
				}
			}
			if (key == null) {
				throw new JsonParseException(p, "Missing 'name' field");
			} else if (updateTime == null) {
				throw new JsonParseException(p, "Missing 'updateTime' field");
			}
			return MutableDocument.newFoundDocument(key, updateTime, fields);
		}

		// Queries

		private void writeStructuredQuery(Target target, JsonGenerator gen) throws IOException {
			String collectionId;
			if (target.collectionGroup() != null) {
				collectionId = target.collectionGroup();
			} else if (DocumentKey.isDocumentKey(target.path())) {
				throw JsonMappingException.from(gen, "Only collection queries can be bundled: " + target);
			} else {
				collectionId = target.path().getLastSegment();
			}
			gen.writeStartObject();

			gen.writeArrayFieldStart("from");
			gen.writeStartObject();
			gen.writeStringField("collectionId", collectionId);
			gen.writeBooleanField("allDescendants", target.collectionGroup() != null);
			gen.writeEndObject();
			gen.writeEndArray();

			if (target.filters().size() == 1) {
				gen.writeFieldName("where");
				writeFieldFilter(target.filters().get(0), gen);
			} else if (!target.filters().isEmpty()) {
				gen.writeObjectFieldStart("where");
				gen.writeObjectFieldStart("compositeFilter");
				gen.writeStringField("op", "AND");
				gen.writeArrayFieldStart("filters");
				for (FieldFilter filter: target.filters()) {
					writeFieldFilter(filter, gen);
				}
				gen.writeEndArray();
				gen.writeEndObject();
				gen.writeEndObject();
			}

			if (!target.orderBys().isEmpty()) {
				gen.writeArrayFieldStart("orderBy");
				for (OrderBy orderBy: target.orderBys()) {
					gen.writeStartObject();
					writeFieldReference(orderBy.field(), gen);
					gen.writeStringField("direction", orderBy.direction().name());
					gen.writeEndObject();
				}
				gen.writeEndArray();
			}

			if (target.startAt() != null) {
				gen.writeFieldName("startAt");
				writeCursor(target.startAt(), target.startAt().inclusive(), gen);
			}
			if (target.endAt() != null) {
				gen.writeFieldName("endAt");
				writeCursor(target.endAt(), !target.endAt().inclusive(), gen);
			}
			if (target.hasLimit()) {
				gen.writeNumberField("limit", target.limit());
			}
			gen.writeEndObject();
		}

		private void writeFieldFilter(FieldFilter filter, JsonGenerator gen) throws IOException {
			gen.writeStartObject();
			gen.writeObjectFieldStart("fieldFilter");
			writeFieldReference(filter.field(), gen);
			gen.writeStringField("op", filter.operator().name());
			gen.writeFieldName("value");
			writeValue(filter.value(), gen);
			gen.writeEndObject();
			gen.writeEndObject();
		}

		private void writeFieldReference(FieldPath field, JsonGenerator gen) throws IOException {
			gen.writeObjectFieldStart("field");
			gen.writeStringField("fieldPath", field.canonicalString());
			gen.writeEndObject();
		}

		private void writeCursor(Bound bound, boolean before, JsonGenerator gen) throws IOException {
			gen.writeStartObject();
			gen.writeArrayFieldStart("values");
			for (Value value: bound.position()) {
				writeValue(value, gen);
			}
			gen.writeEndArray();
			gen.writeBooleanField("before", before);
			gen.writeEndObject();
		}

		private StructuredQuery readStructuredQuery(JsonParser p) throws IOException {
			StructuredQuery result = new StructuredQuery();
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "from":
						expect(START_ARRAY, p);
						while (p.nextToken() != END_ARRAY) {
							if (result.collectionId != null) {
								throw new JsonParseException(p, "Queries must have exactly one 'from' entry");
							}
							readCollectionSelector(p, result);
						}
						break;
					case "where":
						readFilter(p, result.filters);
						break;
					case "orderBy":
						expect(START_ARRAY, p);
						while (p.nextToken() != END_ARRAY) {
							result.orderBys.add(readOrderBy(p));
						}
						break;
					case "startAt": {
						CursorJson cursor = readCursor(p);
						result.startAt = new Bound(cursor.values, cursor.before);
						break;
					}
					case "endAt": {
						CursorJson cursor = readCursor(p);
						result.endAt = new Bound(cursor.values, !cursor.before);
						break;
					}
					case "limit":
						if (p.currentToken() == START_OBJECT) {
							// Wrapped as {"value": n}
							while (p.nextToken() != END_OBJECT) {
								p.nextValue();
								result.limit = readLong(p);
							}
						} else {
							result.limit = readLong(p);
						}
						break;
					default:
						throw new JsonParseException(p, "Unrecognized field in structuredQuery: " + p.currentName());
				}
			}
			if (result.collectionId == null) {
				throw new JsonParseException(p, "Missing 'from' field");
			}
			return result;
		}

		private void readCollectionSelector(JsonParser p, StructuredQuery result) throws IOException {
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "collectionId":
						result.collectionId = p.getText();
						break;
					case "allDescendants":
						result.allDescendants = p.getBooleanValue();
						break;
					default:
						throw new JsonParseException(p, "Unrecognized field in 'from': " + p.currentName());
				}
			}
			if (result.collectionId == null) {
				throw new JsonParseException(p, "Missing 'collectionId' field");
			}
		}

		private void readFilter(JsonParser p, List<FieldFilter> result) throws IOException {
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "fieldFilter":
						result.add(readFieldFilter(p));
						break;
					case "unaryFilter":
						result.add(readUnaryFilter(p));
						break;
					case "compositeFilter":
						readCompositeFilter(p, result);
						break;
					default:
						throw new JsonParseException(p, "Unrecognized filter type: " + p.currentName());
				}
			}
		}

		private void readCompositeFilter(JsonParser p, List<FieldFilter> result) throws IOException {
			String op = null;
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "op":
						op = p.getText();
						break;
					case "filters":
						expect(START_ARRAY, p);
						while (p.nextToken() != END_ARRAY) {
							readFilter(p, result);
						}
						break;
					default:
						throw new JsonParseException(p, "Unrecognized field in compositeFilter: " + p.currentName());
				}
			}
			if (!"AND".equals(op)) {
				throw new JsonParseException(p, "Unsupported composite filter operator: " + op);
			}
		}

		private FieldFilter readFieldFilter(JsonParser p) throws IOException {
			FieldPath field = null;
			String op = null;
			Value value = null;
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "field":
						field = readFieldReference(p);
						break;
					case "op":
						op = p.getText();
						break;
					case "value":
						value = readValue(p);
						break;
					default:
						throw new JsonParseException(p, "Unrecognized field in fieldFilter: " + p.currentName());
				}
			}
			if (field == null || op == null || value == null) {
				throw new JsonParseException(p, "fieldFilter needs 'field', 'op' and 'value'");
			}
			try {
				return FieldFilter.create(field, FieldFilter.Operator.valueOf(op), value);
			} catch (IllegalArgumentException e) {
				throw new JsonParseException(p, "Invalid fieldFilter: " + e.getMessage(), e);
			}
		}

		private FieldFilter readUnaryFilter(JsonParser p) throws IOException {
			FieldPath field = null;
			String op = null;
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "field":
						field = readFieldReference(p);
						break;
					case "op":
						op = p.getText();
						break;
					default:
						throw new JsonParseException(p, "Unrecognized field in unaryFilter: " + p.currentName());
				}
			}
			if (field == null || op == null) {
				throw new JsonParseException(p, "unaryFilter needs 'field' and 'op'");
			}
			switch (op) {
				case "IS_NAN":
					return FieldFilter.create(field, FieldFilter.Operator.EQUAL, new DoubleValue(Double.NaN));
				case "IS_NULL":
					return FieldFilter.create(field, FieldFilter.Operator.EQUAL, NullValue.INSTANCE);
				case "IS_NOT_NAN":
					return FieldFilter.create(field, FieldFilter.Operator.NOT_EQUAL, new DoubleValue(Double.NaN));
				case "IS_NOT_NULL":
					return FieldFilter.create(field, FieldFilter.Operator.NOT_EQUAL, NullValue.INSTANCE);
				default:
					throw new JsonParseException(p, "Unrecognized unaryFilter operator: " + op);
			}
		}

		private OrderBy readOrderBy(JsonParser p) throws IOException {
			FieldPath field = null;
			OrderBy.Direction direction = OrderBy.Direction.ASCENDING;
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "field":
						field = readFieldReference(p);
						break;
					case "direction":
						try {
							direction = OrderBy.Direction.valueOf(p.getText());
						} catch (IllegalArgumentException e) {
							throw new JsonParseException(p, "Unrecognized direction: " + p.getText(), e);
						}
						break;
					default:
						throw new JsonParseException(p, "Unrecognized field in orderBy: " + p.currentName());
				}
			}
			if (field == null) {
				throw new JsonParseException(p, "Missing 'field' field");
			}
			return new OrderBy(direction, field);
		}

		private FieldPath readFieldReference(JsonParser p) throws IOException {
			FieldPath result = null;
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				if ("fieldPath".equals(p.currentName())) {
					result = parseFieldPath(p.getText(), p);
				} else {
					throw new JsonParseException(p, "Unrecognized field in field reference: " + p.currentName());
				}
			}
			if (result == null) {
				throw new JsonParseException(p, "Missing 'fieldPath' field");
			}
			return result;
		}

		private CursorJson readCursor(JsonParser p) throws IOException {
			CursorJson result = new CursorJson();
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "values":
						expect(START_ARRAY, p);
						while (p.nextToken() != END_ARRAY) {
							result.values.add(readValue(p));
						}
						break;
					case "before":
						result.before = p.getBooleanValue();
						break;
					default:
						throw new JsonParseException(p, "Unrecognized field in cursor: " + p.currentName());
				}
			}
			return result;
		}

		// Names and scalars

		private String resourceName(ResourcePath path) {
			return path.isEmpty() ? databaseId.documentsRoot() : databaseId.documentsRoot() + "/" + path.canonicalString();
		}

		private ResourcePath parseResourceName(String name, JsonParser p) throws JsonParseException {
			ResourcePath root = ResourcePath.fromString(databaseId.documentsRoot());
			ResourcePath path = ResourcePath.fromString(name);
			if (!root.isPrefixOf(path)) {
				throw new JsonParseException(p, "Name " + name + " is not in " + databaseId);
			}
			return path.popFirst(root.length());
		}

		private DocumentKey readDocumentName(JsonParser p) throws IOException {
			ResourcePath path = parseResourceName(p.getText(), p);
			if (path.isEmpty() || !DocumentKey.isDocumentKey(path)) {
				throw new JsonParseException(p, "Not a document name: " + p.getText());
			}
			return DocumentKey.fromPath(path);
		}

		private static void writeTimestamp(Instant instant, JsonGenerator gen) throws IOException {
			gen.writeStartObject();
			gen.writeStringField("seconds", Long.toString(instant.getEpochSecond()));
			gen.writeNumberField("nanos", instant.getNano());
			gen.writeEndObject();
		}

		/**
		 * Accepts an RFC 3339 string, or an object with <code>seconds</code> and <code>nanos</code>.
		 */
		private static Instant readInstant(JsonParser p) throws IOException {
			if (p.currentToken() == VALUE_STRING) {
				try {
					return Instant.parse(p.getText());
				} catch (DateTimeException e) {
					throw new JsonParseException(p, "Invalid timestamp: " + p.getText(), e);
				}
			}
			long seconds = 0;
			long nanos = 0;
			expect(START_OBJECT, p);
			while (p.nextToken() != END_OBJECT) {
				p.nextValue();
				switch (p.currentName()) {
					case "seconds":
						seconds = readLong(p);
						break;
					case "nanos":
						nanos = readLong(p);
						break;
					default:
						throw new JsonParseException(p, "Unrecognized field in timestamp: " + p.currentName());
				}
			}
			return Instant.ofEpochSecond(seconds, nanos);
		}

		/**
		 * 64-bit integers may be strings or numbers.
		 */
		private static long readLong(JsonParser p) throws IOException {
			if (p.currentToken() == VALUE_STRING) {
				try {
					return Long.parseLong(p.getText());
				} catch (NumberFormatException e) {
					throw new JsonParseException(p, "Invalid integer: " + p.getText(), e);
				}
			} else if (p.currentToken() == VALUE_NULL) {
				throw new JsonParseException(p, "Expected an integer");
			} else {
				return p.getLongValue();
			}
		}

		private static double parseDouble(JsonParser p) throws IOException {
			switch (p.getText()) {
				case "NaN":
					return Double.NaN;
				case "Infinity":
					return Double.POSITIVE_INFINITY;
				case "-Infinity":
					return Double.NEGATIVE_INFINITY;
				default:
					try {
						return Double.parseDouble(p.getText());
					} catch (NumberFormatException e) {
						throw new JsonParseException(p, "Invalid double: " + p.getText(), e);
					}
			}
		}
	}

	/**
	 * Inverse of {@link FieldPath#canonicalString()}: dot-separated segments,
	 * with backquotes around segments that aren't simple identifiers.
	 */
	static FieldPath parseFieldPath(String canonical, JsonParser p) throws JsonParseException {
		List<String> segments = new ArrayList<>();
		StringBuilder current = new StringBuilder();
		boolean quoted = false;
		for (int i = 0; i < canonical.length(); i++) {
			char c = canonical.charAt(i);
			if (quoted) {
				if (c == '\\') {
					if (++i == canonical.length()) {
						throw new JsonParseException(p, "Trailing escape in field path: " + canonical);
					}
					current.append(canonical.charAt(i));
				} else if (c == '`') {
					quoted = false;
				} else {
					current.append(c);
				}
			} else if (c == '`') {
				quoted = true;
			} else if (c == '.') {
				if (current.length() == 0) {
					throw new JsonParseException(p, "Empty segment in field path: " + canonical);
				}
				segments.add(current.toString());
				current.setLength(0);
			} else {
				current.append(c);
			}
		}
		if (quoted) {
			throw new JsonParseException(p, "Unterminated backquote in field path: " + canonical);
		} else if (current.length() == 0) {
			throw new JsonParseException(p, "Empty segment in field path: " + canonical);
		}
		segments.add(current.toString());
		return FieldPath.fromSegments(segments);
	}

	/**
	 * Accumulates the parts of a query as they're read.
	 */
	private static final class StructuredQuery {
		String collectionId;
		boolean allDescendants = false;
		final List<FieldFilter> filters = new ArrayList<>();
		final List<OrderBy> orderBys = new ArrayList<>();
		Bound startAt;
		Bound endAt;
		long limit = Target.NO_LIMIT;

		Target toTarget(ResourcePath parent) {
			if (allDescendants) {
				return new Target(parent, collectionId, filters, orderBys, limit, startAt, endAt);
			} else {
				return new Target(parent.append(collectionId), null, filters, orderBys, limit, startAt, endAt);
			}
		}
	}

	private static final class CursorJson {
		final List<Value> values = new ArrayList<>();
		boolean before = false;
	}

	public static void expect(JsonToken expected, JsonParser p) throws IOException {
		if (p.currentToken() != expected) {
			throw new JsonParseException(p, "Expected " + expected);
		}
	}
}
