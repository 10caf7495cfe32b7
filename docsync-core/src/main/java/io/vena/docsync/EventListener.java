package io.vena.docsync;

import io.vena.docsync.exceptions.DocSyncException;
import org.jetbrains.annotations.Nullable;

/**
 * Receives the events of a listener registered with {@link DocSync}.
 * Exactly one of <code>value</code> and <code>error</code> is non-null, except for
 * events that carry no value, such as snapshots-in-sync.
 * An error is always the last event.
 */
public interface EventListener<T> {
	void onEvent(@Nullable T value, @Nullable DocSyncException error);
}
