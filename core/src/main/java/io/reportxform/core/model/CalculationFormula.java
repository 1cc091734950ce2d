package io.reportxform.core.model;

/**
 * A calculation formula extracted from a {@code =} field code.
 *
 * @param id               formula id ({@code formula_N})
 * @param rawExpression    the raw field-code text
 * @param parsedExpression the parsed tree
 * @param sourceLocation   id of the originating field code
 */
public record CalculationFormula(
        String id, String rawExpression, ExpressionNode parsedExpression, String sourceLocation) {}
