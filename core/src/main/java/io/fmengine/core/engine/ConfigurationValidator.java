package io.fmengine.core.engine;

import io.fmengine.core.model.CompiledConstraint;
import io.fmengine.core.model.CompiledConstraints;
import io.fmengine.core.model.Configuration;
import io.fmengine.core.model.ExpandedTree;
import io.fmengine.core.model.FeatureInstance;
import io.fmengine.core.model.Truth;
import io.fmengine.core.model.ValidationResult;
import io.fmengine.core.model.Violation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks a full or partial {@link Configuration} against the structural rules of an
 * {@link ExpandedTree} and its compiled constraints.
 *
 * <p>Every violation is reported, never just the first. Instances missing from a partial
 * configuration are unbound: structural rules mentioning them are skipped, and constraints are
 * evaluated in three-valued logic where only a definite {@link Truth#FALSE} counts.
 *
 * <p>Thread-safe and stateless.
 */
public final class ConfigurationValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationValidator.class);

    public ValidationResult validate(
            ExpandedTree tree, CompiledConstraints constraints, Configuration configuration) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(constraints, "constraints must not be null");
        Objects.requireNonNull(configuration, "configuration must not be null");

        List<Violation> violations = new ArrayList<>();
        for (String id : configuration.asMap().keySet()) {
            if (tree.find(id).isEmpty()) {
                violations.add(new Violation.UnknownFeature(id));
            }
        }

        Boolean[] values = configuration.toAssignment(tree);
        for (FeatureInstance instance : tree.instances()) {
            StructuralRules.check(tree, instance, values, violations);
        }
        for (CompiledConstraint constraint : constraints) {
            if (constraint.evaluate(values) == Truth.FALSE) {
                violations.add(new Violation.ConstraintViolated(constraint));
            }
        }

        if (violations.isEmpty()) {
            return ValidationResult.VALID;
        }
        LOG.debug("Configuration has {} violations: {}", violations.size(), violations);
        return new ValidationResult(violations);
    }
}
