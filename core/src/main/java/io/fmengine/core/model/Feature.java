package io.fmengine.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A node of the built feature tree. Owns its groups, which own the child features.
 *
 * @param name               unique name within the model
 * @param abstractFeature    abstract features only group their children
 * @param recursiveReference name of the ancestor template this feature re-embeds, or {@code null}
 * @param groups             child groups in declaration order
 */
public record Feature(String name, boolean abstractFeature, String recursiveReference, List<FeatureGroup> groups) {

    public Feature {
        Objects.requireNonNull(name, "name must not be null");
        groups = List.copyOf(groups);
    }

    /** All children across all groups, in declaration order. */
    public List<Feature> children() {
        if (groups.isEmpty()) {
            return List.of();
        }
        List<Feature> children = new ArrayList<>();
        for (FeatureGroup group : groups) {
            children.addAll(group.children());
        }
        return Collections.unmodifiableList(children);
    }

    public boolean isRecursiveReference() {
        return recursiveReference != null;
    }

    public boolean isLeaf() {
        return groups.isEmpty();
    }
}
