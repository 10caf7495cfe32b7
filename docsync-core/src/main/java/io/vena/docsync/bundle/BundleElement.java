package io.vena.docsync.bundle;

/**
 * One element read from a bundle: {@link BundleMetadata} first, then any number of
 * {@link NamedQuery}, {@link BundledDocumentMetadata} and {@link BundleDocument} elements.
 * A {@link BundleDocument} always directly follows the metadata for the same document.
 */
public interface BundleElement {
}
