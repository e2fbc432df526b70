package io.fmengine.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A feature line of the {@code features} block together with its nested groups, exactly as
 * written. No semantic checks have been applied yet.
 *
 * @param name               the declared feature name
 * @param abstractFeature    whether the line carries the {@code abstract} annotation
 * @param recursiveReference the ancestor named by {@code rec}, or {@code null}
 * @param groups             nested group blocks in declaration order
 * @param line               1-based source line
 */
public record FeatureDeclaration(
        String name, boolean abstractFeature, String recursiveReference, List<GroupDeclaration> groups, int line) {

    public FeatureDeclaration {
        Objects.requireNonNull(name, "name must not be null");
        groups = List.copyOf(groups);
    }
}
