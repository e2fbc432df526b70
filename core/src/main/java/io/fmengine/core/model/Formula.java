package io.fmengine.core.model;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Propositional formula over feature atoms. The variants are exactly the connectives of the
 * constraint language; all are known at compile time.
 *
 * <p>Parsed formulas carry unbound atoms (slot {@code -1}) naming features; compiled formulas carry
 * atoms bound to instance ordinals. Evaluation is a small interpreter over a {@link Valuation},
 * short-circuiting left to right.
 *
 * <p>Thread-safe and immutable.
 */
public sealed interface Formula {

    /** Supplies the truth value of a bound atom. */
    @FunctionalInterface
    interface Valuation {
        Truth valueOf(Atom atom);
    }

    Truth evaluate(Valuation valuation);

    /** Rebuilds this formula with every atom replaced by {@code binder}'s result. */
    Formula mapAtoms(UnaryOperator<Atom> binder);

    /** Collects the atoms of this formula, left to right. */
    void collectAtoms(Set<Atom> sink);

    /** The distinct atoms of this formula, left to right. */
    default Set<Atom> atoms() {
        Set<Atom> atoms = new LinkedHashSet<>();
        collectAtoms(atoms);
        return atoms;
    }

    /** Precedence used for minimal parenthesisation; higher binds tighter. */
    int precedence();

    /** Renders with the model's operator syntax. */
    String render();

    private static String wrap(Formula operand, int parentPrecedence) {
        return operand.precedence() <= parentPrecedence ? "(" + operand.render() + ")" : operand.render();
    }

    /**
     * A feature reference.
     *
     * @param name feature name when unbound, instance id when bound
     * @param slot instance ordinal, or {@code -1} while unbound
     */
    record Atom(String name, int slot) implements Formula {
        public Atom {
            Objects.requireNonNull(name, "name must not be null");
        }

        public static Atom unbound(String name) {
            return new Atom(name, -1);
        }

        public boolean isBound() {
            return slot >= 0;
        }

        @Override
        public Truth evaluate(Valuation valuation) {
            return valuation.valueOf(this);
        }

        @Override
        public Formula mapAtoms(UnaryOperator<Atom> binder) {
            return binder.apply(this);
        }

        @Override
        public void collectAtoms(Set<Atom> sink) {
            sink.add(this);
        }

        @Override
        public int precedence() {
            return 6;
        }

        @Override
        public String render() {
            return name;
        }
    }

    record Not(Formula operand) implements Formula {
        public Not {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public Truth evaluate(Valuation valuation) {
            return operand.evaluate(valuation).not();
        }

        @Override
        public Formula mapAtoms(UnaryOperator<Atom> binder) {
            return new Not(operand.mapAtoms(binder));
        }

        @Override
        public void collectAtoms(Set<Atom> sink) {
            operand.collectAtoms(sink);
        }

        @Override
        public int precedence() {
            return 5;
        }

        @Override
        public String render() {
            return "!" + wrap(operand, precedence() - 1);
        }
    }

    record And(Formula left, Formula right) implements Formula {
        public And {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public Truth evaluate(Valuation valuation) {
            Truth l = left.evaluate(valuation);
            if (l == Truth.FALSE) {
                return Truth.FALSE;
            }
            Truth r = right.evaluate(valuation);
            if (r == Truth.FALSE) {
                return Truth.FALSE;
            }
            return l == Truth.TRUE && r == Truth.TRUE ? Truth.TRUE : Truth.UNKNOWN;
        }

        @Override
        public Formula mapAtoms(UnaryOperator<Atom> binder) {
            return new And(left.mapAtoms(binder), right.mapAtoms(binder));
        }

        @Override
        public void collectAtoms(Set<Atom> sink) {
            left.collectAtoms(sink);
            right.collectAtoms(sink);
        }

        @Override
        public int precedence() {
            return 4;
        }

        @Override
        public String render() {
            return wrap(left, precedence() - 1) + " & " + wrap(right, precedence() - 1);
        }
    }

    record Or(Formula left, Formula right) implements Formula {
        public Or {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public Truth evaluate(Valuation valuation) {
            Truth l = left.evaluate(valuation);
            if (l == Truth.TRUE) {
                return Truth.TRUE;
            }
            Truth r = right.evaluate(valuation);
            if (r == Truth.TRUE) {
                return Truth.TRUE;
            }
            return l == Truth.FALSE && r == Truth.FALSE ? Truth.FALSE : Truth.UNKNOWN;
        }

        @Override
        public Formula mapAtoms(UnaryOperator<Atom> binder) {
            return new Or(left.mapAtoms(binder), right.mapAtoms(binder));
        }

        @Override
        public void collectAtoms(Set<Atom> sink) {
            left.collectAtoms(sink);
            right.collectAtoms(sink);
        }

        @Override
        public int precedence() {
            return 3;
        }

        @Override
        public String render() {
            return wrap(left, precedence() - 1) + " | " + wrap(right, precedence() - 1);
        }
    }

    record Implies(Formula left, Formula right) implements Formula {
        public Implies {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public Truth evaluate(Valuation valuation) {
            Truth l = left.evaluate(valuation);
            if (l == Truth.FALSE) {
                return Truth.TRUE;
            }
            Truth r = right.evaluate(valuation);
            if (r == Truth.TRUE) {
                return Truth.TRUE;
            }
            return l == Truth.TRUE && r == Truth.FALSE ? Truth.FALSE : Truth.UNKNOWN;
        }

        @Override
        public Formula mapAtoms(UnaryOperator<Atom> binder) {
            return new Implies(left.mapAtoms(binder), right.mapAtoms(binder));
        }

        @Override
        public void collectAtoms(Set<Atom> sink) {
            left.collectAtoms(sink);
            right.collectAtoms(sink);
        }

        @Override
        public int precedence() {
            return 2;
        }

        @Override
        public String render() {
            // right-associative: only a left operand of equal precedence needs parentheses
            return wrap(left, precedence()) + " => " + wrap(right, precedence() - 1);
        }
    }

    record BiImplication(Formula left, Formula right) implements Formula {
        public BiImplication {
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public Truth evaluate(Valuation valuation) {
            Truth l = left.evaluate(valuation);
            Truth r = right.evaluate(valuation);
            if (!l.isKnown() || !r.isKnown()) {
                return Truth.UNKNOWN;
            }
            return Truth.of(l == r);
        }

        @Override
        public Formula mapAtoms(UnaryOperator<Atom> binder) {
            return new BiImplication(left.mapAtoms(binder), right.mapAtoms(binder));
        }

        @Override
        public void collectAtoms(Set<Atom> sink) {
            left.collectAtoms(sink);
            right.collectAtoms(sink);
        }

        @Override
        public int precedence() {
            return 1;
        }

        @Override
        public String render() {
            return wrap(left, precedence() - 1) + " <=> " + wrap(right, precedence());
        }
    }
}
