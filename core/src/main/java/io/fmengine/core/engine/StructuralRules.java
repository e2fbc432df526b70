package io.fmengine.core.engine;

import io.fmengine.core.model.ExpandedTree;
import io.fmengine.core.model.FeatureInstance;
import io.fmengine.core.model.GroupKind;
import io.fmengine.core.model.InstanceGroup;
import io.fmengine.core.model.Violation;
import java.util.List;

/**
 * Tree and group rules anchored at one instance, over an ordinal-indexed assignment where
 * {@code null} means unbound. A rule is only judged once every instance it mentions is bound.
 * Shared by {@link ConfigurationValidator} and the enumeration search so both agree on validity.
 */
final class StructuralRules {

    private StructuralRules() {}

    /**
     * Checks the rules anchored at {@code instance}: root selection, parent selection, absent
     * references, the cardinality of each of its groups, and non-empty abstract features.
     *
     * @param sink receives every violation found; when {@code null} the check stops at the first
     * @return {@code true} if no rule is violated
     */
    static boolean check(ExpandedTree tree, FeatureInstance instance, Boolean[] values, List<Violation> sink) {
        Boolean self = values[instance.ordinal()];
        boolean ok = true;

        if (instance.isRoot() && Boolean.FALSE.equals(self)) {
            ok = report(sink, instance, Violation.Rule.ROOT_UNSELECTED, "The root feature must be selected");
            if (sink == null) return false;
        }
        if (instance.absent() && Boolean.TRUE.equals(self)) {
            ok = report(
                    sink,
                    instance,
                    Violation.Rule.ABSENT_SELECTED,
                    "Recursion bottoms out at depth " + tree.maxDepth() + "; this reference cannot be selected");
            if (sink == null) return false;
        }
        if (!instance.isRoot() && Boolean.TRUE.equals(self) && Boolean.FALSE.equals(values[instance.parent()])) {
            ok = report(
                    sink,
                    instance,
                    Violation.Rule.PARENT_UNSELECTED,
                    "Selected while parent '" + tree.instance(instance.parent()).id() + "' is not");
            if (sink == null) return false;
        }
        if (self == null || instance.isLeaf()) {
            return ok;
        }

        boolean allChildrenBound = true;
        boolean anyChildSelected = false;
        for (InstanceGroup group : instance.groups()) {
            int selected = 0;
            boolean groupBound = true;
            for (int child : group.children()) {
                Boolean value = values[child];
                if (value == null) {
                    groupBound = false;
                    continue;
                }
                if (value) {
                    selected++;
                }
                if (group.kind() == GroupKind.MANDATORY && !value.equals(self)) {
                    ok = report(
                            sink,
                            instance,
                            Violation.Rule.MANDATORY_CHILD,
                            "Mandatory child '" + tree.instance(child).id() + "' must be "
                                    + (self ? "selected" : "unselected") + " with its parent");
                    if (sink == null) return false;
                }
            }
            allChildrenBound &= groupBound;
            anyChildSelected |= selected > 0;
            if (!self) {
                continue;
            }
            switch (group.kind()) {
                case ALTERNATIVE -> {
                    if (selected > 1 || (groupBound && selected == 0)) {
                        ok = report(
                                sink,
                                instance,
                                Violation.Rule.ALTERNATIVE_CARDINALITY,
                                "Alternative group requires exactly one selected child, found " + selected);
                        if (sink == null) return false;
                    }
                }
                case OR -> {
                    if (groupBound && selected == 0) {
                        ok = report(
                                sink,
                                instance,
                                Violation.Rule.OR_CARDINALITY,
                                "Or group requires at least one selected child");
                        if (sink == null) return false;
                    }
                }
                case MANDATORY, OPTIONAL -> {
                    // per-child rules above
                }
            }
        }
        if (self && instance.abstractFeature() && allChildrenBound && !anyChildSelected) {
            ok = report(
                    sink,
                    instance,
                    Violation.Rule.ABSTRACT_WITHOUT_CHILD,
                    "Abstract feature is selected without any selected child");
        }
        return ok;
    }

    private static boolean report(List<Violation> sink, FeatureInstance at, Violation.Rule rule, String message) {
        if (sink != null) {
            sink.add(new Violation.Structural(at.id(), rule, message));
        }
        return false;
    }
}
