package io.vena.docsync.model;

import io.vena.docsync.model.mutation.FieldMask;
import org.jetbrains.annotations.Nullable;

/**
 * A local view of a document, plus the fields its overlay changed
 * (null if the overlay replaced the whole document).
 */
public record OverlayedDocument(MutableDocument document, @Nullable FieldMask mutatedFields) { }
