package io.fmengine.core.error;

/**
 * Thrown when engine configuration loading fails: missing file, invalid YAML, or an out-of-range
 * value in YAML or in an environment override.
 */
public class EngineConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public EngineConfigException(String message) {
        super(message);
    }

    public EngineConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
