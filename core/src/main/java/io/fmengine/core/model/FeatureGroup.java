package io.fmengine.core.model;

import java.util.List;
import java.util.Objects;

/** A group of child features governed by one {@link GroupKind}. */
public record FeatureGroup(GroupKind kind, List<Feature> children) {

    public FeatureGroup {
        Objects.requireNonNull(kind, "kind must not be null");
        children = List.copyOf(children);
    }
}
