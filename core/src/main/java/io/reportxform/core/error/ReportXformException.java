package io.reportxform.core.error;

/**
 * Abstract base for all report-xform exceptions. Never thrown directly; use the per-item
 * {@link FieldCodeException} subclasses or the document-level {@link SandboxViolationException}
 * and {@link SchemaValidationException}.
 */
public abstract class ReportXformException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Pipeline phase in which the error occurred. */
    public enum Phase {
        COMPILE,
        VALIDATION,
        SYNTHESIS
    }

    private final String fieldCodeId;
    private final Phase phase;

    protected ReportXformException(String message, String fieldCodeId, Phase phase) {
        super(message);
        this.fieldCodeId = fieldCodeId;
        this.phase = phase;
    }

    protected ReportXformException(String message, Throwable cause, String fieldCodeId, Phase phase) {
        super(message, cause);
        this.fieldCodeId = fieldCodeId;
        this.phase = phase;
    }

    /** The field code that triggered the error, or {@code null} if not tied to one. */
    public String fieldCodeId() {
        return fieldCodeId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
