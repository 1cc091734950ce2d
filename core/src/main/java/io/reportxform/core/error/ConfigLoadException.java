package io.reportxform.core.error;

/** Thrown when compiler configuration or a sandbox rule file cannot be loaded. */
public final class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
