package io.fmengine.core.model;

import java.util.List;

/**
 * A group block under a feature declaration.
 *
 * @param kind     the declared group kind, or {@code null} when child features were written
 *                 directly under their parent without a keyword
 * @param children child declarations in order
 * @param line     1-based source line of the keyword, or of the first child for implicit groups
 */
public record GroupDeclaration(GroupKind kind, List<FeatureDeclaration> children, int line) {

    public GroupDeclaration {
        children = List.copyOf(children);
    }

    public boolean isImplicit() {
        return kind == null;
    }
}
