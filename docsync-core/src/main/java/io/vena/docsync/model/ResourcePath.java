package io.vena.docsync.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A slash-separated path to a collection or document, relative to the database root.
 */
public final class ResourcePath extends BasePath<ResourcePath> {
	public static final ResourcePath EMPTY = new ResourcePath(List.of());

	private ResourcePath(List<String> segments) {
		super(segments);
	}

	@Override
	ResourcePath createPathWithSegments(List<String> segments) {
		return new ResourcePath(segments);
	}

	public static ResourcePath fromSegments(List<String> segments) {
		return segments.isEmpty() ? EMPTY : new ResourcePath(new ArrayList<>(segments));
	}

	public static ResourcePath fromString(String path) {
		if (path.contains("//")) {
			throw new IllegalArgumentException("Invalid path (" + path + "). Paths must not contain // in them.");
		}
		List<String> segments = new ArrayList<>();
		for (String segment: Arrays.asList(path.split("/"))) {
			if (!segment.isEmpty()) {
				segments.add(segment);
			}
		}
		return fromSegments(segments);
	}

	@Override
	public String canonicalString() {
		return String.join("/", segments);
	}
}
