package io.reportxform.core.error;

import io.reportxform.core.model.ValidationMessage;
import java.util.List;

/**
 * Thrown once at the end of a schema validation pass when the synthesized document breaks one or
 * more structural rules. Carries every collected message, never just the first.
 */
public final class SchemaValidationException extends ReportXformException {

    private static final long serialVersionUID = 1L;

    private final List<ValidationMessage> errors;

    public SchemaValidationException(List<ValidationMessage> errors) {
        super("Schema validation failed with " + errors.size() + " error(s)", null, Phase.SYNTHESIS);
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("errors must not be empty");
        }
        this.errors = List.copyOf(errors);
    }

    /** The validation messages, never empty. */
    public List<ValidationMessage> errors() {
        return errors;
    }
}
