package io.vena.docsync.model.mutation;

import io.vena.docsync.model.FieldPath;

public record FieldTransform(FieldPath fieldPath, TransformOperation operation) { }
