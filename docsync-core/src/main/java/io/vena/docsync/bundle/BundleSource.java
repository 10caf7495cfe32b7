package io.vena.docsync.bundle;

import java.io.Closeable;
import java.io.IOException;
import org.jetbrains.annotations.Nullable;

/**
 * Supplies the elements of one bundle in order.
 */
public interface BundleSource extends Closeable {
	/**
	 * Reads the bundle's metadata, which must be its first element.
	 * Idempotent.
	 */
	BundleMetadata getBundleMetadata() throws IOException;

	/**
	 * @return the next element after the metadata, or null at the end of the bundle.
	 */
	@Nullable BundleElement getNextElement() throws IOException;

	/**
	 * @return the number of bytes consumed so far, metadata included.
	 */
	long getBytesRead();
}
