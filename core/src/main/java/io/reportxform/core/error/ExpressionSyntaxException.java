package io.reportxform.core.error;

/** Thrown when field-code or expression text is malformed. Never accompanied by a partial tree. */
public final class ExpressionSyntaxException extends FieldCodeException {

    private static final long serialVersionUID = 1L;

    private final Integer offset;

    public ExpressionSyntaxException(String message, String expression, Integer offset) {
        this(message, null, expression, offset);
    }

    public ExpressionSyntaxException(String message, String fieldCodeId, String expression, Integer offset) {
        super(message, fieldCodeId, expression);
        this.offset = offset;
    }

    /** The offending expression text (alias for {@link #rawText()}). */
    public String expression() {
        return rawText();
    }

    /** Zero-based character offset of the error within {@link #expression()}, or {@code null}. */
    public Integer offset() {
        return offset;
    }

    @Override
    public ExpressionSyntaxException withFieldCodeId(String fieldCodeId) {
        ExpressionSyntaxException copy = new ExpressionSyntaxException(getMessage(), fieldCodeId, rawText(), offset);
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
