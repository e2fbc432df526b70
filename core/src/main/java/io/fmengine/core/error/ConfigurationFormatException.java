package io.fmengine.core.error;

/** Thrown when a configuration document cannot be read or written. */
public class ConfigurationFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationFormatException(String message) {
        super(message);
    }

    public ConfigurationFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
