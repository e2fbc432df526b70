package io.fmengine.core.model;

import java.util.Objects;

/** One reason a configuration is invalid. Variants are known at compile time. */
public sealed interface Violation {

    String message();

    /** Structural rules implied by the feature tree. */
    enum Rule {
        ROOT_UNSELECTED,
        PARENT_UNSELECTED,
        MANDATORY_CHILD,
        ALTERNATIVE_CARDINALITY,
        OR_CARDINALITY,
        ABSENT_SELECTED,
        ABSTRACT_WITHOUT_CHILD
    }

    /**
     * A group or tree rule broken at one instance.
     *
     * @param instanceId the instance the rule is anchored at (the parent, for group rules)
     */
    record Structural(String instanceId, Rule rule, String message) implements Violation {
        public Structural {
            Objects.requireNonNull(instanceId, "instanceId must not be null");
            Objects.requireNonNull(rule, "rule must not be null");
        }
    }

    /** A cross-tree constraint that evaluates to false. */
    record ConstraintViolated(CompiledConstraint constraint) implements Violation {
        public ConstraintViolated {
            Objects.requireNonNull(constraint, "constraint must not be null");
        }

        @Override
        public String message() {
            return "Constraint violated: " + constraint;
        }
    }

    /** A configuration key that names no instance of the tree. */
    record UnknownFeature(String id) implements Violation {
        @Override
        public String message() {
            return "Unknown feature instance: " + id;
        }
    }
}
