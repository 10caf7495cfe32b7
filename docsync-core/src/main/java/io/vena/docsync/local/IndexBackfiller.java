package io.vena.docsync.local;

import io.vena.docsync.DocSyncSettings;
import io.vena.docsync.exceptions.LostPrimaryLeaseException;
import io.vena.docsync.util.AsyncQueue;
import io.vena.docsync.util.AsyncQueue.DelayedTask;
import io.vena.docsync.util.AsyncQueue.TimerId;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically adds index entries for documents cached before their index was configured,
 * a bounded number at a time.
 */
public final class IndexBackfiller {
	private final AsyncQueue asyncQueue;
	private final LocalStore localStore;
	private final DocSyncSettings.Experimental settings;
	private @Nullable DelayedTask backfillTask;

	public IndexBackfiller(AsyncQueue asyncQueue, LocalStore localStore, DocSyncSettings settings) {
		this.asyncQueue = asyncQueue;
		this.localStore = localStore;
		this.settings = settings.experimental();
	}

	/**
	 * Must be called on the async queue.
	 */
	public void start() {
		if (settings.indexBackfillEnabled()) {
			schedule(settings.indexBackfillInitialDelayMS());
		}
	}

	public void stop() {
		if (backfillTask != null) {
			backfillTask.cancel();
			backfillTask = null;
		}
	}

	private void schedule(long delayMS) {
		backfillTask = asyncQueue.enqueueAfterDelay(TimerId.INDEX_BACKFILL, delayMS, () -> {
			try {
				int documentsProcessed = localStore.backfillIndexes();
				LOGGER.debug("Documents written: {}", documentsProcessed);
			} catch (LostPrimaryLeaseException e) {
				LOGGER.debug("Ignoring backfill while not primary: {}", e.getMessage());
			}
			schedule(settings.indexBackfillRegularDelayMS());
		});
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(IndexBackfiller.class);
}
