package io.vena.docsync.bundle;

import io.vena.docsync.util.Listener;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.jetbrains.annotations.Nullable;

/**
 * The result of loading a bundle. Completes with the final progress once every document
 * and named query is saved, or exceptionally if the bundle could not be loaded.
 * Progress listeners see every intermediate state, the final one included.
 */
public final class LoadBundleTask extends CompletableFuture<LoadBundleTaskProgress> {
	private final Object lock = new Object();
	private final List<ProgressListener> listeners = new ArrayList<>();
	private @Nullable LoadBundleTaskProgress lastProgress;

	private record ProgressListener(Executor executor, Listener<LoadBundleTaskProgress> listener) {
		void raise(LoadBundleTaskProgress progress) {
			executor.execute(() -> listener.onValue(progress));
		}
	}

	/**
	 * If progress has already been reported, <code>listener</code> is called with the latest right away.
	 */
	public void addOnProgressListener(Executor executor, Listener<LoadBundleTaskProgress> listener) {
		ProgressListener progressListener = new ProgressListener(executor, listener);
		LoadBundleTaskProgress current;
		synchronized (lock) {
			listeners.add(progressListener);
			current = lastProgress;
		}
		if (current != null) {
			progressListener.raise(current);
		}
	}

	public void updateProgress(LoadBundleTaskProgress progress) {
		List<ProgressListener> toNotify;
		synchronized (lock) {
			lastProgress = progress;
			toNotify = new ArrayList<>(listeners);
		}
		toNotify.forEach(l -> l.raise(progress));
	}

	public void setResult(LoadBundleTaskProgress result) {
		updateProgress(result);
		complete(result);
	}

	public void setException(Exception exception) {
		LoadBundleTaskProgress errorProgress;
		synchronized (lock) {
			errorProgress = lastProgress == null
				? new LoadBundleTaskProgress(0, 0, 0, 0, LoadBundleTaskProgress.TaskState.ERROR)
				: lastProgress.withError();
		}
		updateProgress(errorProgress);
		completeExceptionally(exception);
	}
}
