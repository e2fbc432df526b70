package io.fmengine.core.engine;

import io.fmengine.core.error.ConstraintCompileException;
import io.fmengine.core.error.ModelSyntaxException;
import io.fmengine.core.model.CompiledConstraint;
import io.fmengine.core.model.CompiledConstraints;
import io.fmengine.core.model.ConstraintLine;
import io.fmengine.core.model.ExpandedTree;
import io.fmengine.core.model.ExpansionScope;
import io.fmengine.core.model.FeatureInstance;
import io.fmengine.core.model.Formula;
import io.fmengine.core.spec.FormulaParser;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles textual cross-tree constraints against an {@link ExpandedTree}.
 *
 * <p>Each line is instantiated once in the root scope and once in every recursive scope whose
 * template declares at least one of the line's atoms. Atoms bind to the nearest enclosing
 * instance: the scope's own members first (the template name denotes the clone itself), then the
 * enclosing scopes outward. A copy compiled inside a recursive scope is guarded by the clone's
 * selection ({@code clone => formula}), so it only binds while that sub-tree is present.
 *
 * <p>Thread-safe and stateless.
 */
public final class ConstraintCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(ConstraintCompiler.class);

    /** Compiles the constraint lines carried by the tree's model. */
    public CompiledConstraints compile(ExpandedTree tree) {
        return compile(tree, tree.constraints());
    }

    /**
     * Compiles the given constraint lines.
     *
     * @throws ConstraintCompileException if a line is malformed or an atom does not resolve
     */
    public CompiledConstraints compile(ExpandedTree tree, List<ConstraintLine> lines) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(lines, "lines must not be null");
        List<CompiledConstraint> compiled = new ArrayList<>();
        for (ConstraintLine line : lines) {
            Formula parsed = parse(line);
            Set<String> names = parsed.atoms().stream()
                    .map(Formula.Atom::name)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            for (ExpansionScope scope : tree.scopes()) {
                if (!scope.isRoot() && names.stream().noneMatch(scope.members()::containsKey)) {
                    continue;
                }
                compiled.add(instantiate(tree, scope, line, parsed));
            }
        }
        LOG.debug(
                "Compiled {} constraint lines into {} scoped constraints over {} scopes",
                lines.size(),
                compiled.size(),
                tree.scopes().size());
        return new CompiledConstraints(compiled, tree.size());
    }

    private static Formula parse(ConstraintLine line) {
        try {
            return FormulaParser.parse(line.text(), line.line(), 0);
        } catch (ModelSyntaxException e) {
            throw new ConstraintCompileException(
                    "Malformed constraint '" + line.text() + "': " + e.detail(), e, line.line());
        }
    }

    private static CompiledConstraint instantiate(
            ExpandedTree tree, ExpansionScope scope, ConstraintLine line, Formula parsed) {
        Formula bound = parsed.mapAtoms(atom -> {
            FeatureInstance instance = resolve(tree, scope, atom.name())
                    .orElseThrow(() -> new ConstraintCompileException(
                            "Constraint '" + line.text() + "' references unknown feature '" + atom.name() + "'",
                            line.line(),
                            atom.name()));
            return new Formula.Atom(instance.id(), instance.ordinal());
        });
        FeatureInstance scopeRoot = tree.instance(scope.rootOrdinal());
        if (!scope.isRoot()) {
            bound = new Formula.Implies(new Formula.Atom(scopeRoot.id(), scopeRoot.ordinal()), bound);
        }
        return new CompiledConstraint(line.text(), line.line(), scopeRoot.id(), bound);
    }

    /** Nearest enclosing instance named {@code name}, searching outward from {@code scope}. */
    static Optional<FeatureInstance> resolve(ExpandedTree tree, ExpansionScope scope, String name) {
        ExpansionScope current = scope;
        while (current != null) {
            Optional<Integer> ordinal = current.member(name);
            if (ordinal.isPresent()) {
                return Optional.of(tree.instance(ordinal.get()));
            }
            current = current.isRoot() ? null : tree.scope(current.parentScope());
        }
        return Optional.empty();
    }
}
