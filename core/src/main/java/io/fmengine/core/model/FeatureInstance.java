package io.fmengine.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One node of an {@link ExpandedTree}. Instances live in an arena indexed by {@code ordinal}
 * (pre-order); relations to parent and children are ordinals, never object references, and no
 * instance refers back to the template it was cloned from.
 *
 * @param ordinal         arena slot, equal to the pre-order position
 * @param id              unique path id, e.g. {@code Expr/Operands/LExpr/Expr1/Connectives}
 * @param name            the feature name this instance was declared under
 * @param templateName    the declared feature whose shape this instance has; differs from
 *                        {@code name} only for expanded recursive references
 * @param depth           number of recursive instantiations on the path from the root
 * @param parent          parent ordinal, {@code -1} for the root
 * @param scope           index of the {@link ExpansionScope} the instance belongs to
 * @param abstractFeature whether the instance only groups its children
 * @param absent          a recursive reference cut off at the depth bound; never selectable
 * @param groups          child groups
 */
public record FeatureInstance(
        int ordinal,
        String id,
        String name,
        String templateName,
        int depth,
        int parent,
        int scope,
        boolean abstractFeature,
        boolean absent,
        List<InstanceGroup> groups) {

    public FeatureInstance {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(name, "name must not be null");
        groups = List.copyOf(groups);
    }

    /** Child ordinals across all groups, in declaration order. */
    public List<Integer> children() {
        if (groups.isEmpty()) {
            return List.of();
        }
        List<Integer> children = new ArrayList<>();
        for (InstanceGroup group : groups) {
            children.addAll(group.children());
        }
        return Collections.unmodifiableList(children);
    }

    public boolean isRoot() {
        return parent < 0;
    }

    public boolean isLeaf() {
        return groups.isEmpty();
    }
}
