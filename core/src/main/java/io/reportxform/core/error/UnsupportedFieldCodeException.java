package io.reportxform.core.error;

import io.reportxform.core.model.FieldCategory;

/**
 * Thrown when a field code's category is recognized but no expression shape exists for it (for
 * example {@code SEQ} or {@code TOC}). Distinct from {@link ExpressionSyntaxException} so callers
 * can skip such items without treating them as malformed.
 */
public final class UnsupportedFieldCodeException extends FieldCodeException {

    private static final long serialVersionUID = 1L;

    private final FieldCategory category;

    public UnsupportedFieldCodeException(FieldCategory category, String rawText) {
        this(category, null, rawText);
    }

    public UnsupportedFieldCodeException(FieldCategory category, String fieldCodeId, String rawText) {
        super("Unsupported field code type: " + category, fieldCodeId, rawText);
        this.category = category;
    }

    /** The category of the rejected field code. */
    public FieldCategory category() {
        return category;
    }

    @Override
    public UnsupportedFieldCodeException withFieldCodeId(String fieldCodeId) {
        UnsupportedFieldCodeException copy = new UnsupportedFieldCodeException(category, fieldCodeId, rawText());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
