package io.reportxform.core.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable expression tree parsed from a field code. The hierarchy is sealed: every node kind is
 * known at compile time and per-kind arity is checked when a node is built, so a malformed tree
 * (a binary node with three children, a conditional with one) can never reach the generator.
 *
 * <p>Besides the typed record components, every node exposes a uniform view ({@link #kind()},
 * {@link #payload()}, {@link #operator()}, {@link #children()}) for code that walks trees
 * generically.
 *
 * <p>Thread-safe and immutable. Subtrees may be shared freely between parents.
 */
public sealed interface ExpressionNode {

    /** The node kind. */
    NodeKind kind();

    /** Scalar payload: the literal value, a reference name, or a function/aggregate name. */
    default Object payload() {
        return null;
    }

    /** Operator symbol for binary and unary nodes, {@code null} otherwise. */
    default String operator() {
        return null;
    }

    /** Ordered child nodes; empty for leaves. */
    default List<ExpressionNode> children() {
        return List.of();
    }

    // ── Factories ──

    static Literal literal(Object value) {
        return new Literal(value);
    }

    static FieldReference field(String name) {
        return new FieldReference(name);
    }

    static ParameterReference parameter(String name) {
        return new ParameterReference(name);
    }

    static GlobalReference global(String name) {
        return new GlobalReference(name);
    }

    static BinaryOperation binary(String operator, ExpressionNode left, ExpressionNode right) {
        return new BinaryOperation(operator, left, right);
    }

    static UnaryOperation not(ExpressionNode operand) {
        return new UnaryOperation("Not", operand);
    }

    static FunctionCall call(String name, ExpressionNode... arguments) {
        return new FunctionCall(name, List.of(arguments));
    }

    static Conditional conditional(ExpressionNode condition, ExpressionNode whenTrue, ExpressionNode whenFalse) {
        return new Conditional(condition, whenTrue, whenFalse);
    }

    static Aggregate aggregate(String function, ExpressionNode... arguments) {
        return new Aggregate(function, List.of(arguments));
    }

    /**
     * Builds a node from its generic parts, enforcing the arity table.
     *
     * @throws IllegalArgumentException if the child count or payload does not fit the kind
     */
    static ExpressionNode of(NodeKind kind, Object payload, String operator, List<ExpressionNode> children) {
        Objects.requireNonNull(kind, "kind must not be null");
        List<ExpressionNode> kids = children == null ? List.of() : children;
        switch (kind) {
            case LITERAL:
                requireArity(kind, kids, 0, 0);
                return new Literal(payload);
            case FIELD_REFERENCE:
                requireArity(kind, kids, 0, 0);
                return new FieldReference(nameOf(kind, payload));
            case PARAMETER_REFERENCE:
                requireArity(kind, kids, 0, 0);
                return new ParameterReference(nameOf(kind, payload));
            case GLOBAL_REFERENCE:
                requireArity(kind, kids, 0, 0);
                return new GlobalReference(nameOf(kind, payload));
            case BINARY_OPERATION:
                requireArity(kind, kids, 2, 2);
                return new BinaryOperation(operator, kids.get(0), kids.get(1));
            case UNARY_OPERATION:
                requireArity(kind, kids, 1, 1);
                return new UnaryOperation(operator, kids.get(0));
            case FUNCTION_CALL:
                return new FunctionCall(nameOf(kind, payload), kids);
            case CONDITIONAL:
                requireArity(kind, kids, 2, 3);
                return new Conditional(kids.get(0), kids.get(1), kids.size() > 2 ? kids.get(2) : null);
            case AGGREGATE:
                return new Aggregate(nameOf(kind, payload), kids);
            default:
                throw new IllegalArgumentException("Unknown node kind: " + kind);
        }
    }

    private static void requireArity(NodeKind kind, List<ExpressionNode> children, int min, int max) {
        int n = children.size();
        if (n < min || n > max) {
            String expected = min == max ? "exactly " + min : min + " to " + max;
            throw new IllegalArgumentException(kind + " requires " + expected + " children, got " + n);
        }
    }

    private static String nameOf(NodeKind kind, Object payload) {
        if (payload == null || payload instanceof String) {
            return (String) payload;
        }
        throw new IllegalArgumentException(kind + " payload must be a name string, got: " + payload.getClass());
    }

    // ── Variants ──

    /**
     * A constant: {@code null}, a {@link String}, a {@link Boolean}, a {@link Number}, a {@link
     * LocalDate} or a {@link LocalDateTime} (only the date part is ever emitted).
     */
    record Literal(Object value) implements ExpressionNode {
        public Literal {
            if (value != null
                    && !(value instanceof String
                            || value instanceof Boolean
                            || value instanceof Number
                            || value instanceof LocalDate
                            || value instanceof LocalDateTime)) {
                throw new IllegalArgumentException("Unsupported literal type: " + value.getClass().getName());
            }
        }

        @Override
        public NodeKind kind() {
            return NodeKind.LITERAL;
        }

        @Override
        public Object payload() {
            return value;
        }
    }

    /** A data-set field; {@code name} may be {@code null} when extraction lost it. */
    record FieldReference(String name) implements ExpressionNode {
        @Override
        public NodeKind kind() {
            return NodeKind.FIELD_REFERENCE;
        }

        @Override
        public Object payload() {
            return name;
        }
    }

    /** A report parameter. */
    record ParameterReference(String name) implements ExpressionNode {
        @Override
        public NodeKind kind() {
            return NodeKind.PARAMETER_REFERENCE;
        }

        @Override
        public Object payload() {
            return name;
        }
    }

    /** A built-in global such as {@code PageNumber} or {@code ExecutionTime}. */
    record GlobalReference(String name) implements ExpressionNode {
        @Override
        public NodeKind kind() {
            return NodeKind.GLOBAL_REFERENCE;
        }

        @Override
        public Object payload() {
            return name;
        }
    }

    /** Two-operand operation. A {@code null} operator is rendered as equality. */
    record BinaryOperation(String operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {
        public BinaryOperation {
            Objects.requireNonNull(left, "left operand must not be null");
            Objects.requireNonNull(right, "right operand must not be null");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.BINARY_OPERATION;
        }

        @Override
        public List<ExpressionNode> children() {
            return List.of(left, right);
        }
    }

    /** Prefix operation. A {@code null} operator means logical negation. */
    record UnaryOperation(String operator, ExpressionNode operand) implements ExpressionNode {
        public UnaryOperation {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.UNARY_OPERATION;
        }

        @Override
        public List<ExpressionNode> children() {
            return List.of(operand);
        }
    }

    /** Call of a named function with positional arguments. */
    record FunctionCall(String name, List<ExpressionNode> arguments) implements ExpressionNode {
        public FunctionCall {
            arguments = copyArguments(arguments);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.FUNCTION_CALL;
        }

        @Override
        public Object payload() {
            return name;
        }

        @Override
        public List<ExpressionNode> children() {
            return arguments;
        }
    }

    /** Ternary choice; {@code whenFalse} is optional. */
    record Conditional(ExpressionNode condition, ExpressionNode whenTrue, ExpressionNode whenFalse)
            implements ExpressionNode {
        public Conditional {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(whenTrue, "whenTrue must not be null");
        }

        @Override
        public NodeKind kind() {
            return NodeKind.CONDITIONAL;
        }

        @Override
        public List<ExpressionNode> children() {
            return whenFalse == null ? List.of(condition, whenTrue) : List.of(condition, whenTrue, whenFalse);
        }
    }

    /**
     * Aggregate over a data region. The first argument is the aggregated expression, the optional
     * second one names the scope.
     */
    record Aggregate(String function, List<ExpressionNode> arguments) implements ExpressionNode {
        public Aggregate {
            arguments = copyArguments(arguments);
        }

        @Override
        public NodeKind kind() {
            return NodeKind.AGGREGATE;
        }

        @Override
        public Object payload() {
            return function;
        }

        @Override
        public List<ExpressionNode> children() {
            return arguments;
        }
    }

    private static List<ExpressionNode> copyArguments(List<ExpressionNode> arguments) {
        if (arguments == null) {
            return List.of();
        }
        List<ExpressionNode> copy = new ArrayList<>(arguments.size());
        for (ExpressionNode argument : arguments) {
            copy.add(Objects.requireNonNull(argument, "arguments must not contain null"));
        }
        return List.copyOf(copy);
    }
}
