package io.reportxform.core.model;

/** Severity of a {@link ValidationMessage}. Only {@link #ERROR} blocks an artifact. */
public enum ValidationSeverity {
    INFO,
    WARNING,
    ERROR
}
