package io.vena.docsync.model;

import java.util.Comparator;
import lombok.NonNull;

/**
 * Identifies a document: a resource path with an even number of segments.
 */
public final class DocumentKey implements Comparable<DocumentKey> {
	public static final String KEY_FIELD_NAME = FieldPath.KEY_FIELD_NAME;
	public static final Comparator<DocumentKey> COMPARATOR = DocumentKey::compareTo;

	private static final DocumentKey EMPTY = new DocumentKey(ResourcePath.EMPTY);

	private final ResourcePath path;

	private DocumentKey(ResourcePath path) {
		this.path = path;
	}

	public static DocumentKey empty() {
		return EMPTY;
	}

	public static DocumentKey fromPath(@NonNull ResourcePath path) {
		if (!isDocumentKey(path)) {
			throw new IllegalArgumentException("Not a document key path: " + path);
		}
		return new DocumentKey(path);
	}

	public static DocumentKey fromPathString(String path) {
		return fromPath(ResourcePath.fromString(path));
	}

	/**
	 * Accepts a fully-qualified name like <code>projects/p/databases/d/documents/rooms/r1</code>.
	 */
	public static DocumentKey fromName(String name) {
		ResourcePath resourceName = ResourcePath.fromString(name);
		if (resourceName.length() < 5 || !"projects".equals(resourceName.getSegment(0))
			|| !"databases".equals(resourceName.getSegment(2))
			|| !"documents".equals(resourceName.getSegment(4))) {
			throw new IllegalArgumentException("Not a fully-qualified document name: " + name);
		}
		return fromPath(resourceName.popFirst(5));
	}

	public static boolean isDocumentKey(ResourcePath path) {
		return path.length() % 2 == 0;
	}

	public ResourcePath path() {
		return path;
	}

	public ResourcePath getCollectionPath() {
		return path.popLast();
	}

	public String getCollectionGroup() {
		return path.getSegment(path.length() - 2);
	}

	public String getDocumentId() {
		return path.getLastSegment();
	}

	public boolean hasCollectionId(String collectionId) {
		return path.length() >= 2 && path.getSegment(path.length() - 2).equals(collectionId);
	}

	public String fullName(DatabaseId databaseId) {
		return databaseId.documentsRoot() + "/" + path.canonicalString();
	}

	@Override
	public int compareTo(DocumentKey other) {
		return path.compareTo(other.path);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof DocumentKey)) return false;
		return path.equals(((DocumentKey) o).path);
	}

	@Override
	public int hashCode() {
		return path.hashCode();
	}

	@Override
	public String toString() {
		return path.toString();
	}
}
