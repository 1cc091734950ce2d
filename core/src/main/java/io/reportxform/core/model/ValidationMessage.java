package io.reportxform.core.model;

import java.util.Objects;

/**
 * A single sandbox or schema finding.
 *
 * @param severity how serious the finding is
 * @param code     stable rule code, e.g. {@code SANDBOX001} or {@code FIELDS001}
 * @param message  human-readable description
 * @param location offending fragment or document path, or {@code null}
 */
public record ValidationMessage(ValidationSeverity severity, String code, String message, String location) {

    public ValidationMessage {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ValidationMessage error(String code, String message, String location) {
        return new ValidationMessage(ValidationSeverity.ERROR, code, message, location);
    }

    public static ValidationMessage warning(String code, String message, String location) {
        return new ValidationMessage(ValidationSeverity.WARNING, code, message, location);
    }

    public boolean isError() {
        return severity == ValidationSeverity.ERROR;
    }
}
