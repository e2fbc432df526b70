package io.fmengine.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * One constraint line instantiated in one expansion scope, with every atom bound to an instance.
 *
 * <p>Thread-safe and immutable.
 */
public final class CompiledConstraint {

    private final String source;
    private final int line;
    private final String scopeId;
    private final Formula formula;
    private final int[] slots;

    /**
     * @param source  the constraint text as written
     * @param line    source line, {@code 0} when not from model text
     * @param scopeId id of the instance the scope hangs from
     * @param formula the bound formula
     */
    public CompiledConstraint(String source, int line, String scopeId, Formula formula) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.line = line;
        this.scopeId = Objects.requireNonNull(scopeId, "scopeId must not be null");
        this.formula = Objects.requireNonNull(formula, "formula must not be null");
        this.slots = formula.atoms().stream()
                .mapToInt(atom -> {
                    if (!atom.isBound()) {
                        throw new IllegalArgumentException("atom '" + atom.name() + "' is not bound");
                    }
                    return atom.slot();
                })
                .distinct()
                .toArray();
    }

    public String source() {
        return source;
    }

    public int line() {
        return line;
    }

    public String scopeId() {
        return scopeId;
    }

    public Formula formula() {
        return formula;
    }

    /** Instance ordinals referenced by the formula, without duplicates. */
    public int[] slots() {
        return slots.clone();
    }

    /** Whether every referenced instance has a value under {@code values} ({@code null} = unbound). */
    public boolean isFullyBound(Boolean[] values) {
        for (int slot : slots) {
            if (values[slot] == null) {
                return false;
            }
        }
        return true;
    }

    public Truth evaluate(Formula.Valuation valuation) {
        return formula.evaluate(valuation);
    }

    /** Evaluates against an ordinal-indexed assignment; unbound slots are {@code null}. */
    public Truth evaluate(Boolean[] values) {
        return formula.evaluate(atom -> Truth.of(values[atom.slot()]));
    }

    boolean references(int slot) {
        return Arrays.stream(slots).anyMatch(s -> s == slot);
    }

    @Override
    public String toString() {
        return formula.render() + " [" + scopeId + (line > 0 ? ", line " + line : "") + "]";
    }
}
