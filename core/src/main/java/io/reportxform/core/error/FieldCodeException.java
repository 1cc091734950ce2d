package io.reportxform.core.error;

/**
 * Abstract parent for per-item compile errors. A batch compile catches these and records a failed
 * result for the offending field code only. Carries the raw field-code text.
 */
public abstract class FieldCodeException extends ReportXformException {

    private static final long serialVersionUID = 1L;

    private final String rawText;

    protected FieldCodeException(String message, String fieldCodeId, String rawText) {
        super(message, fieldCodeId, Phase.COMPILE);
        this.rawText = rawText;
    }

    protected FieldCodeException(String message, Throwable cause, String fieldCodeId, String rawText) {
        super(message, cause, fieldCodeId, Phase.COMPILE);
        this.rawText = rawText;
    }

    /** The raw field-code text that could not be compiled. */
    public String rawText() {
        return rawText;
    }

    /**
     * Returns a copy of this exception bound to the given field code id. Parsers below the field-code
     * level do not know the id; the compiler attaches it on the way out.
     */
    public abstract FieldCodeException withFieldCodeId(String fieldCodeId);
}
