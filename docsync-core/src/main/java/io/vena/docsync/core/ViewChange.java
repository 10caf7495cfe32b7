package io.vena.docsync.core;

import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of applying changes to a {@link View}.
 *
 * @param snapshot the new snapshot, or null if nothing visible changed
 */
public record ViewChange(@Nullable ViewSnapshot snapshot, List<LimboDocumentChange> limboChanges) {
	public ViewChange {
		limboChanges = List.copyOf(limboChanges);
	}
}
