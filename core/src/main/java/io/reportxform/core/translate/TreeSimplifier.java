package io.reportxform.core.translate;

import io.reportxform.core.model.ExpressionNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Semantics-preserving rewrites applied to the tree before text generation:
 *
 * <ul>
 *   <li>a conditional whose condition is a boolean literal is replaced by the selected branch
 *       ({@code Nothing} when the false branch is absent);
 *   <li>a pair of logical negations is removed.
 * </ul>
 *
 * Subtrees that do not change are returned as the same instance.
 */
public final class TreeSimplifier {

    public ExpressionNode simplify(ExpressionNode node) {
        Objects.requireNonNull(node, "node must not be null");
        ExpressionNode rebuilt = simplifyChildren(node);

        if (rebuilt instanceof ExpressionNode.Conditional conditional
                && conditional.condition() instanceof ExpressionNode.Literal literal
                && literal.value() instanceof Boolean selector) {
            if (selector) {
                return conditional.whenTrue();
            }
            return conditional.whenFalse() == null ? ExpressionNode.literal(null) : conditional.whenFalse();
        }

        if (isNegation(rebuilt)) {
            ExpressionNode operand = ((ExpressionNode.UnaryOperation) rebuilt).operand();
            if (isNegation(operand)) {
                return ((ExpressionNode.UnaryOperation) operand).operand();
            }
        }
        return rebuilt;
    }

    private ExpressionNode simplifyChildren(ExpressionNode node) {
        List<ExpressionNode> children = node.children();
        if (children.isEmpty()) {
            return node;
        }
        List<ExpressionNode> simplified = new ArrayList<>(children.size());
        boolean changed = false;
        for (ExpressionNode child : children) {
            ExpressionNode next = simplify(child);
            changed |= next != child;
            simplified.add(next);
        }
        if (!changed) {
            return node;
        }
        return ExpressionNode.of(node.kind(), node.payload(), node.operator(), simplified);
    }

    private static boolean isNegation(ExpressionNode node) {
        return node instanceof ExpressionNode.UnaryOperation unary
                && (unary.operator() == null || unary.operator().equalsIgnoreCase("Not"));
    }
}
