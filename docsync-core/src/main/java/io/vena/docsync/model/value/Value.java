package io.vena.docsync.model.value;

/**
 * A field value in a document.
 *
 * <p>
 * Implementations are immutable; {@link #equals} distinguishes integers from doubles,
 * while {@link Values#compare} orders them numerically.
 */
public interface Value {
	/**
	 * @return the position of this value's type in the cross-type ordering.
	 * @see Values#compare
	 */
	int typeOrder();
}
