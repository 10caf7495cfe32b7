package io.vena.docsync.bundle;

/**
 * A snapshot of the progress of loading a bundle.
 */
public record LoadBundleTaskProgress(
	int documentsLoaded,
	int totalDocuments,
	long bytesLoaded,
	long totalBytes,
	TaskState taskState
) {
	public enum TaskState {
		ERROR,
		RUNNING,
		SUCCESS,
	}

	public static LoadBundleTaskProgress forInitial(BundleMetadata metadata) {
		return new LoadBundleTaskProgress(0, metadata.totalDocuments(), 0, metadata.totalBytes(), TaskState.RUNNING);
	}

	public static LoadBundleTaskProgress forSuccess(BundleMetadata metadata) {
		return new LoadBundleTaskProgress(metadata.totalDocuments(), metadata.totalDocuments(),
			metadata.totalBytes(), metadata.totalBytes(), TaskState.SUCCESS);
	}

	public LoadBundleTaskProgress withError() {
		return new LoadBundleTaskProgress(documentsLoaded, totalDocuments, bytesLoaded, totalBytes, TaskState.ERROR);
	}
}
