package io.reportxform.core.model;

import java.util.List;

/**
 * Logic decomposed from a document's field codes.
 *
 * @param fieldCodes every field code, in document order
 * @param conditions extracted conditional branches, in id order
 * @param formulas   extracted calculation formulas
 * @param warnings   diagnostics for skipped items
 */
public record LogicExtractionResult(
        List<FieldCode> fieldCodes,
        List<ConditionalBranch> conditions,
        List<CalculationFormula> formulas,
        List<String> warnings) {

    public LogicExtractionResult {
        fieldCodes = List.copyOf(fieldCodes);
        conditions = List.copyOf(conditions);
        formulas = List.copyOf(formulas);
        warnings = List.copyOf(warnings);
    }

    /** A result with nothing extracted. */
    public static LogicExtractionResult empty() {
        return new LogicExtractionResult(List.of(), List.of(), List.of(), List.of());
    }
}
