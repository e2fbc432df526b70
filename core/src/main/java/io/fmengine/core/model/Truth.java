package io.fmengine.core.model;

/** Three-valued truth for evaluating formulas over partial configurations (Kleene logic). */
public enum Truth {
    TRUE,
    FALSE,
    UNKNOWN;

    public static Truth of(boolean value) {
        return value ? TRUE : FALSE;
    }

    /** Maps {@code null} to {@link #UNKNOWN}. */
    public static Truth of(Boolean value) {
        return value == null ? UNKNOWN : of(value.booleanValue());
    }

    public Truth not() {
        return switch (this) {
            case TRUE -> FALSE;
            case FALSE -> TRUE;
            case UNKNOWN -> UNKNOWN;
        };
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
