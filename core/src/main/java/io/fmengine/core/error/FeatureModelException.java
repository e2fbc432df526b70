package io.fmengine.core.error;

/**
 * Abstract base for all engine pipeline failures. Never thrown directly: each pipeline stage
 * raises its own concrete subclass and stops immediately, since later stages assume a
 * well-formed predecessor.
 */
public abstract class FeatureModelException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline stage in which the error occurred. */
    public enum Stage {
        PARSE,
        BUILD,
        EXPAND,
        COMPILE
    }

    private final Stage stage;

    protected FeatureModelException(String message, Stage stage) {
        super(message);
        this.stage = stage;
    }

    protected FeatureModelException(String message, Throwable cause, Stage stage) {
        super(message, cause);
        this.stage = stage;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The stage in which the error occurred. */
    public Stage stage() {
        return stage;
    }
}
