package io.fmengine.core.error;

/**
 * Thrown when a cross-tree constraint cannot be compiled: the formula is malformed, or an atom
 * does not resolve to exactly one feature instance within its scope.
 */
public final class ConstraintCompileException extends FeatureModelException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final String unresolvedAtom;

    public ConstraintCompileException(String message, int line, String unresolvedAtom) {
        super(message, Stage.COMPILE);
        this.line = line;
        this.unresolvedAtom = unresolvedAtom;
    }

    public ConstraintCompileException(String message, Throwable cause, int line) {
        super(message, cause, Stage.COMPILE);
        this.line = line;
        this.unresolvedAtom = null;
    }

    /** Source line of the constraint in the model text, or {@code 0} for constraints given directly. */
    public int line() {
        return line;
    }

    /** The atom that failed to resolve, or {@code null} if the formula itself is malformed. */
    public String unresolvedAtom() {
        return unresolvedAtom;
    }
}
