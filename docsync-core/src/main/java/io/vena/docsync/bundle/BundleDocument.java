package io.vena.docsync.bundle;

import io.vena.docsync.model.DocumentKey;
import io.vena.docsync.model.MutableDocument;

public record BundleDocument(MutableDocument document) implements BundleElement {
	public DocumentKey key() {
		return document.key();
	}
}
