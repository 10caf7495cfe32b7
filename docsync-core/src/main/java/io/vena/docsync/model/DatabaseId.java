package io.vena.docsync.model;

/**
 * Identifies the backend database whose documents are cached.
 */
public record DatabaseId(String projectId, String databaseId) implements Comparable<DatabaseId> {
	public static final String DEFAULT_DATABASE_ID = "(default)";

	public static DatabaseId forProject(String projectId) {
		return new DatabaseId(projectId, DEFAULT_DATABASE_ID);
	}

	public static DatabaseId forDatabase(String projectId, String databaseId) {
		return new DatabaseId(projectId, databaseId);
	}

	/**
	 * @return the resource name prefix of every document in this database,
	 * as in <code>projects/p/databases/d/documents</code>.
	 */
	public String documentsRoot() {
		return "projects/" + projectId + "/databases/" + databaseId + "/documents";
	}

	@Override
	public int compareTo(DatabaseId other) {
		int cmp = projectId.compareTo(other.projectId);
		return cmp != 0 ? cmp : databaseId.compareTo(other.databaseId);
	}

	@Override
	public String toString() {
		return "DatabaseId(" + projectId + ", " + databaseId + ")";
	}
}
