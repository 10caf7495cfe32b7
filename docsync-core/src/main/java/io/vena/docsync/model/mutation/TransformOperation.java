package io.vena.docsync.model.mutation;

import io.vena.docsync.model.value.Value;
import java.time.Instant;
import org.jetbrains.annotations.Nullable;

/**
 * A change to a single field whose result depends on the field's previous value or on the server.
 */
public interface TransformOperation {
	/**
	 * @return the value the field takes in the local view before the server has responded.
	 */
	Value applyToLocalView(@Nullable Value previousValue, Instant localWriteTime);

	/**
	 * @return the value the field takes once the server has returned <code>transformResult</code>.
	 */
	Value applyToRemoteDocument(@Nullable Value previousValue, @Nullable Value transformResult);

	/**
	 * For non-idempotent transforms, the value to persist as the base for local computation,
	 * so the local view stays stable if the remote value changes before acknowledgement.
	 *
	 * @return null if the transform is idempotent
	 */
	@Nullable Value computeBaseValue(@Nullable Value previousValue);
}
