package io.reportxform.core.model;

import java.util.Objects;

/**
 * One branch of conditional logic extracted from an {@code IF} field code. Derived per analysis
 * pass and never mutated.
 *
 * @param id             branch id ({@code cond_N}, or a parent id plus a nesting suffix)
 * @param condition      the condition tree
 * @param trueValue      value when the condition holds
 * @param falseValue     value otherwise, or {@code null}
 * @param sourceLocation id of the originating field code
 */
public record ConditionalBranch(
        String id,
        ExpressionNode condition,
        ExpressionNode trueValue,
        ExpressionNode falseValue,
        String sourceLocation) {

    public ConditionalBranch {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(trueValue, "trueValue must not be null");
    }

    /** Creates a branch view over a conditional node. */
    public static ConditionalBranch of(String id, ExpressionNode.Conditional node, String sourceLocation) {
        return new ConditionalBranch(id, node.condition(), node.whenTrue(), node.whenFalse(), sourceLocation);
    }
}
