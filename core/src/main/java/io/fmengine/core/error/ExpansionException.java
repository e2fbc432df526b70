package io.fmengine.core.error;

/** Thrown when a recursive reference names a feature that is not an ancestor of the referencing feature. */
public final class ExpansionException extends FeatureModelException {

    private static final long serialVersionUID = 1L;

    private final String referenceName;

    public ExpansionException(String message, String referenceName) {
        super(message, Stage.EXPAND);
        this.referenceName = referenceName;
    }

    /** The template name the reference pointed at, or {@code null} for non-reference failures. */
    public String referenceName() {
        return referenceName;
    }
}
