package io.vena.docsync.model;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A path to a field within a document's data.
 * The special path {@link #KEY_PATH} stands for the document's key.
 */
public final class FieldPath extends BasePath<FieldPath> {
	public static final String KEY_FIELD_NAME = "__name__";
	public static final FieldPath KEY_PATH = new FieldPath(List.of(KEY_FIELD_NAME));
	public static final FieldPath EMPTY_PATH = new FieldPath(List.of());

	private static final Pattern SIMPLE_SEGMENT = Pattern.compile("[a-zA-Z_][a-zA-Z_0-9]*");

	private FieldPath(List<String> segments) {
		super(segments);
	}

	@Override
	FieldPath createPathWithSegments(List<String> segments) {
		return new FieldPath(segments);
	}

	public static FieldPath of(String... segments) {
		return new FieldPath(List.of(segments));
	}

	public static FieldPath fromSegments(List<String> segments) {
		return segments.isEmpty() ? EMPTY_PATH : new FieldPath(new ArrayList<>(segments));
	}

	/**
	 * Parses <code>a.b.c</code> into three segments. Backquotes are not interpreted;
	 * use {@link #of} for segments that contain dots.
	 */
	public static FieldPath fromDotSeparatedString(String path) {
		if (path.isEmpty() || path.startsWith(".") || path.endsWith(".") || path.contains("..")) {
			throw new IllegalArgumentException("Invalid field path: '" + path + "'");
		}
		return new FieldPath(List.of(path.split("\\.")));
	}

	public boolean isKeyField() {
		return equals(KEY_PATH);
	}

	@Override
	public String canonicalString() {
		StringBuilder builder = new StringBuilder();
		for (int i = 0; i < segments.size(); i++) {
			if (i > 0) {
				builder.append('.');
			}
			String segment = segments.get(i);
			if (SIMPLE_SEGMENT.matcher(segment).matches()) {
				builder.append(segment);
			} else {
				builder.append('`').append(segment.replace("\\", "\\\\").replace("`", "\\`")).append('`');
			}
		}
		return builder.toString();
	}
}
