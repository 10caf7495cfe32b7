package io.vena.docsync.bundle;

import io.vena.docsync.model.SnapshotVersion;

/**
 * A query saved under a name, so an application can run it against the bundled results
 * without knowing how it was written.
 *
 * @param readTime the snapshot at which the bundled results were read
 */
public record NamedQuery(String name, BundledQuery bundledQuery, SnapshotVersion readTime) implements BundleElement {
}
