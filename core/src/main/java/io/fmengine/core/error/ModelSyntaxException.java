package io.fmengine.core.error;

/**
 * Thrown when model text is malformed: bad indentation, unknown group keyword or annotation,
 * missing sections, or an unterminated constraint expression. Line and column are 1-based.
 */
public final class ModelSyntaxException extends FeatureModelException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    public ModelSyntaxException(String message, int line, int column) {
        super(String.format("%d:%d: %s", line, column, message), Stage.PARSE);
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
