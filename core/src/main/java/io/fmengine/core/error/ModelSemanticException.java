package io.fmengine.core.error;

/** Thrown when a parsed model declares an invalid feature structure (duplicates, degenerate groups). */
public final class ModelSemanticException extends FeatureModelException {

    private static final long serialVersionUID = 1L;

    private final String featureName;
    private final String reason;

    public ModelSemanticException(String featureName, String reason) {
        super("Feature '" + featureName + "': " + reason, Stage.BUILD);
        this.featureName = featureName;
        this.reason = reason;
    }

    public String featureName() {
        return featureName;
    }

    public String reason() {
        return reason;
    }
}
