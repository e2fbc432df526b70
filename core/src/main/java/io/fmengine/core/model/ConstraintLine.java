package io.fmengine.core.model;

import java.util.Objects;

/**
 * One cross-tree constraint as written in the model's {@code constraints} block.
 *
 * @param text the formula text, trimmed
 * @param line 1-based line in the model text, or {@code 0} when supplied programmatically
 */
public record ConstraintLine(String text, int line) {

    public ConstraintLine {
        Objects.requireNonNull(text, "text must not be null");
    }

    /** A constraint that does not originate from model text. */
    public static ConstraintLine of(String text) {
        return new ConstraintLine(text, 0);
    }
}
