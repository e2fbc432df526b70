package io.fmengine.core.model;

import java.util.List;
import java.util.Objects;

/** A group of an expanded instance; children are arena ordinals. */
public record InstanceGroup(GroupKind kind, List<Integer> children) {

    public InstanceGroup {
        Objects.requireNonNull(kind, "kind must not be null");
        children = List.copyOf(children);
    }
}
