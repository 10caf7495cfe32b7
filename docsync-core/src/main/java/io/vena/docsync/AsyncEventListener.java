package io.vena.docsync;

import io.vena.docsync.exceptions.DocSyncException;
import java.util.concurrent.Executor;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers events to an application listener on the application's executor, and stops
 * delivering them, including ones already dispatched, once {@link #mute()} is called.
 *
 * <p>
 * An exception thrown by the application listener is logged and otherwise ignored,
 * so that one misbehaving listener can't disrupt the others.
 */
final class AsyncEventListener<T> implements EventListener<T> {
	private final Executor executor;
	private final EventListener<T> eventListener;
	private volatile boolean muted = false;

	AsyncEventListener(Executor executor, EventListener<T> eventListener) {
		this.executor = executor;
		this.eventListener = eventListener;
	}

	@Override
	public void onEvent(@Nullable T value, @Nullable DocSyncException error) {
		executor.execute(() -> {
			if (muted) {
				LOGGER.trace("Dropping event for muted listener");
				return;
			}
			try {
				eventListener.onEvent(value, error);
			} catch (RuntimeException e) {
				LOGGER.error("Listener aborted due to exception: {}", e.getMessage(), e);
			}
		});
	}

	void mute() {
		muted = true;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AsyncEventListener.class);
}
