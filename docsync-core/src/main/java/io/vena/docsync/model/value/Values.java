package io.vena.docsync.model.value;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.util.ByteString;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jetbrains.annotations.Nullable;

/**
 * Ordering, canonical ids and Java conversions for {@link Value}s.
 */
public final class Values {
	public static final int TYPE_ORDER_NULL = 0;
	public static final int TYPE_ORDER_BOOLEAN = 1;
	public static final int TYPE_ORDER_NUMBER = 2;
	public static final int TYPE_ORDER_TIMESTAMP = 3;
	public static final int TYPE_ORDER_SERVER_TIMESTAMP = 4;
	public static final int TYPE_ORDER_STRING = 5;
	public static final int TYPE_ORDER_BYTES = 6;
	public static final int TYPE_ORDER_REFERENCE = 7;
	public static final int TYPE_ORDER_ARRAY = 8;
	public static final int TYPE_ORDER_MAP = 9;

	private static final double TWO_TO_63 = 0x1p63;

	public static boolean isNumber(@Nullable Value value) {
		return value instanceof IntegerValue || value instanceof DoubleValue;
	}

	public static boolean isArray(@Nullable Value value) {
		return value instanceof ArrayValue;
	}

	public static boolean isNullValue(@Nullable Value value) {
		return value instanceof NullValue;
	}

	public static boolean isNanValue(@Nullable Value value) {
		return value instanceof DoubleValue && Double.isNaN(((DoubleValue) value).value());
	}

	/**
	 * Total order across all values. Values of different types order by type;
	 * integers and doubles are one type and compare numerically, with NaN first.
	 */
	public static int compare(Value left, Value right) {
		int leftType = left.typeOrder();
		int rightType = right.typeOrder();
		if (leftType != rightType) {
			return Integer.compare(leftType, rightType);
		}
		switch (leftType) {
			case TYPE_ORDER_NULL:
				return 0;
			case TYPE_ORDER_BOOLEAN:
				return Boolean.compare(((BooleanValue) left).value(), ((BooleanValue) right).value());
			case TYPE_ORDER_NUMBER:
				return compareNumbers(left, right);
			case TYPE_ORDER_TIMESTAMP:
				return ((TimestampValue) left).value().compareTo(((TimestampValue) right).value());
			case TYPE_ORDER_SERVER_TIMESTAMP:
				return ((ServerTimestampValue) left).localWriteTime().compareTo(((ServerTimestampValue) right).localWriteTime());
			case TYPE_ORDER_STRING:
				return ((StringValue) left).value().compareTo(((StringValue) right).value());
			case TYPE_ORDER_BYTES:
				return ((BytesValue) left).value().compareTo(((BytesValue) right).value());
			case TYPE_ORDER_REFERENCE:
				return ((ReferenceValue) left).key().compareTo(((ReferenceValue) right).key());
			case TYPE_ORDER_ARRAY:
				return compareArrays((ArrayValue) left, (ArrayValue) right);
			case TYPE_ORDER_MAP:
				return compareMaps((ObjectValue) left, (ObjectValue) right);
			default:
				throw new IllegalArgumentException("Invalid value type: " + leftType);
		}
	}

	private static int compareNumbers(Value left, Value right) {
		if (left instanceof DoubleValue) {
			double leftDouble = ((DoubleValue) left).value();
			if (right instanceof DoubleValue) {
				return compareDoubles(leftDouble, ((DoubleValue) right).value());
			} else {
				return compareMixed(leftDouble, ((IntegerValue) right).value());
			}
		} else {
			long leftLong = ((IntegerValue) left).value();
			if (right instanceof IntegerValue) {
				return Long.compare(leftLong, ((IntegerValue) right).value());
			} else {
				return -compareMixed(((DoubleValue) right).value(), leftLong);
			}
		}
	}

	/**
	 * Like {@link Double#compare} except that -0.0 equals 0.0. NaN sorts first.
	 */
	static int compareDoubles(double left, double right) {
		if (left < right) {
			return -1;
		} else if (left > right) {
			return 1;
		} else if (left == right) {
			return 0;
		} else if (Double.isNaN(left)) {
			return Double.isNaN(right) ? 0 : -1;
		} else {
			return 1;
		}
	}

	static int compareMixed(double doubleValue, long longValue) {
		if (Double.isNaN(doubleValue) || doubleValue < -TWO_TO_63) {
			return -1;
		}
		if (doubleValue >= TWO_TO_63) {
			return 1;
		}
		int cmp = Long.compare((long) doubleValue, longValue);
		if (cmp != 0) {
			return cmp;
		}
		return compareDoubles(doubleValue, (double) longValue);
	}

	private static int compareArrays(ArrayValue left, ArrayValue right) {
		List<Value> leftValues = left.values();
		List<Value> rightValues = right.values();
		int limit = Math.min(leftValues.size(), rightValues.size());
		for (int i = 0; i < limit; i++) {
			int cmp = compare(leftValues.get(i), rightValues.get(i));
			if (cmp != 0) {
				return cmp;
			}
		}
		return Integer.compare(leftValues.size(), rightValues.size());
	}

	private static int compareMaps(ObjectValue left, ObjectValue right) {
		Iterator<Map.Entry<String, Value>> leftEntries = left.entrySet().iterator();
		Iterator<Map.Entry<String, Value>> rightEntries = right.entrySet().iterator();
		while (leftEntries.hasNext() && rightEntries.hasNext()) {
			Map.Entry<String, Value> leftEntry = leftEntries.next();
			Map.Entry<String, Value> rightEntry = rightEntries.next();
			int keyCompare = leftEntry.getKey().compareTo(rightEntry.getKey());
			if (keyCompare != 0) {
				return keyCompare;
			}
			int valueCompare = compare(leftEntry.getValue(), rightEntry.getValue());
			if (valueCompare != 0) {
				return valueCompare;
			}
		}
		return Boolean.compare(leftEntries.hasNext(), rightEntries.hasNext());
	}

	/**
	 * A string that is equal for values that are {@link Object#equals equal}.
	 */
	public static String canonicalId(Value value) {
		StringBuilder builder = new StringBuilder();
		appendCanonicalId(builder, value);
		return builder.toString();
	}

	private static void appendCanonicalId(StringBuilder builder, Value value) {
		if (value instanceof StringValue) {
			builder.append(((StringValue) value).value());
		} else if (value instanceof TimestampValue) {
			Instant instant = ((TimestampValue) value).value();
			builder.append("time(").append(instant.getEpochSecond()).append(',').append(instant.getNano()).append(')');
		} else if (value instanceof BytesValue) {
			builder.append(((BytesValue) value).value().toBase64());
		} else if (value instanceof ReferenceValue) {
			builder.append(((ReferenceValue) value).key());
		} else if (value instanceof ArrayValue) {
			builder.append('[');
			boolean first = true;
			for (Value element: ((ArrayValue) value).values()) {
				if (!first) {
					builder.append(',');
				}
				first = false;
				appendCanonicalId(builder, element);
			}
			builder.append(']');
		} else if (value instanceof ObjectValue) {
			builder.append('{');
			boolean first = true;
			for (Map.Entry<String, Value> entry: ((ObjectValue) value).entrySet()) {
				if (!first) {
					builder.append(',');
				}
				first = false;
				builder.append(entry.getKey()).append(':');
				appendCanonicalId(builder, entry.getValue());
			}
			builder.append('}');
		} else {
			builder.append(value);
		}
	}

	/**
	 * Converts plain Java objects into values: null, {@link Boolean}, integral {@link Number}s,
	 * {@link Double}s and {@link Float}s, {@link String}, {@link Instant}, <code>byte[]</code>,
	 * {@link ByteString}, {@link DocumentKey}, {@link List}, and {@link Map} with string keys.
	 */
	public static Value fromJava(@Nullable Object object) {
		if (object == null) {
			return NullValue.INSTANCE;
		} else if (object instanceof Value) {
			return (Value) object;
		} else if (object instanceof Boolean) {
			return BooleanValue.of((Boolean) object);
		} else if (object instanceof Integer || object instanceof Long || object instanceof Short || object instanceof Byte) {
			return new IntegerValue(((Number) object).longValue());
		} else if (object instanceof Double || object instanceof Float) {
			return new DoubleValue(((Number) object).doubleValue());
		} else if (object instanceof String) {
			return new StringValue((String) object);
		} else if (object instanceof Instant) {
			return new TimestampValue((Instant) object);
		} else if (object instanceof byte[]) {
			return new BytesValue(ByteString.copyFrom((byte[]) object));
		} else if (object instanceof ByteString) {
			return new BytesValue((ByteString) object);
		} else if (object instanceof DocumentKey) {
			return new ReferenceValue((DocumentKey) object);
		} else if (object instanceof List) {
			List<Value> values = new ArrayList<>();
			for (Object element: (List<?>) object) {
				values.add(fromJava(element));
			}
			return new ArrayValue(values);
		} else if (object instanceof Map) {
			Map<String, Value> entries = new TreeMap<>();
			for (Map.Entry<?, ?> entry: ((Map<?, ?>) object).entrySet()) {
				if (!(entry.getKey() instanceof String)) {
					throw new IllegalArgumentException("Map keys must be strings: " + entry.getKey());
				}
				entries.put((String) entry.getKey(), fromJava(entry.getValue()));
			}
			return ObjectValue.fromMap(entries);
		} else {
			throw new IllegalArgumentException("Unsupported value type: " + object.getClass().getName());
		}
	}

	public static ObjectValue objectFromJava(Map<String, ?> map) {
		return (ObjectValue) fromJava(map);
	}

	private Values() { }
}
