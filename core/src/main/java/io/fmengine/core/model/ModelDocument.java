package io.fmengine.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Parser output: the declaration tree of a model plus its constraint lines.
 *
 * @param namespace   the {@code namespace} header value
 * @param root        the single root feature declaration
 * @param constraints constraint lines in source order (possibly empty)
 */
public record ModelDocument(String namespace, FeatureDeclaration root, List<ConstraintLine> constraints) {

    public ModelDocument {
        Objects.requireNonNull(namespace, "namespace must not be null");
        Objects.requireNonNull(root, "root must not be null");
        constraints = List.copyOf(constraints);
    }
}
