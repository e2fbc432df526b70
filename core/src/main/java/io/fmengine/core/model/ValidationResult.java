package io.fmengine.core.model;

import java.util.List;

/**
 * Outcome of validating one configuration: the complete list of violations, empty when valid.
 * A normal return value, not a failure of the engine.
 */
public record ValidationResult(List<Violation> violations) {

    public static final ValidationResult VALID = new ValidationResult(List.of());

    public ValidationResult {
        violations = List.copyOf(violations);
    }

    public boolean isValid() {
        return violations.isEmpty();
    }

    /** Violations of the given structural rule. */
    public List<Violation.Structural> structural(Violation.Rule rule) {
        return violations.stream()
                .filter(Violation.Structural.class::isInstance)
                .map(Violation.Structural.class::cast)
                .filter(v -> v.rule() == rule)
                .toList();
    }

    public List<CompiledConstraint> violatedConstraints() {
        return violations.stream()
                .filter(Violation.ConstraintViolated.class::isInstance)
                .map(v -> ((Violation.ConstraintViolated) v).constraint())
                .toList();
    }
}
