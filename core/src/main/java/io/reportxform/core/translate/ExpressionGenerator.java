package io.reportxform.core.translate;

import io.reportxform.core.model.ConditionalBranch;
import io.reportxform.core.model.ExpressionNode;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders expression trees as report-expression text.
 *
 * <p>Output shape per node kind:
 *
 * <ul>
 *   <li>literals: {@code Nothing}, {@code "quoted"} with doubled quotes, {@code True}/{@code False},
 *       {@code #M/d/yyyy#}, numbers in plain notation;
 *   <li>references: {@code Fields!X.Value}, {@code Parameters!X.Value}, {@code Globals!X};
 *   <li>binary operations: always parenthesized;
 *   <li>unary operations: {@code op operand}, unparenthesized;
 *   <li>function calls: name translated through a fixed table, {@code CONCAT} rendered as a
 *       chain of {@code &};
 *   <li>conditionals: {@code IIf(c, a, b)}, {@code Nothing} for a missing false branch;
 *   <li>aggregates: {@code Fn(expr[, "scope"])}.
 * </ul>
 *
 * <p>Pure and deterministic: equal trees always yield identical text. Stateless and thread-safe.
 */
public final class ExpressionGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionGenerator.class);

    private static final DateTimeFormatter DATE_LITERAL = DateTimeFormatter.ofPattern("M/d/uuuu", Locale.ROOT);

    private static final String CONCAT = "CONCAT";

    private static final Map<String, String> OPERATORS = Map.ofEntries(
            Map.entry("=", "="),
            Map.entry("<>", "<>"),
            Map.entry("!=", "<>"),
            Map.entry("<", "<"),
            Map.entry(">", ">"),
            Map.entry("<=", "<="),
            Map.entry(">=", ">="),
            Map.entry("AND", "And"),
            Map.entry("OR", "Or"),
            Map.entry("NOT", "Not"),
            Map.entry("%", "Mod"),
            Map.entry("MOD", "Mod"));

    private static final Map<String, String> FUNCTIONS = Map.ofEntries(
            Map.entry("ISNULL", "IsNothing"),
            Map.entry("COALESCE", "If"),
            Map.entry("IFNULL", "If"),
            Map.entry("LENGTH", "Len"),
            Map.entry("LEN", "Len"),
            Map.entry("SUBSTRING", "Mid"),
            Map.entry("SUBSTR", "Mid"),
            Map.entry("UPPER", "UCase"),
            Map.entry("LOWER", "LCase"),
            Map.entry("TRIM", "Trim"),
            Map.entry("NOW", "Now"),
            Map.entry("GETDATE", "Now"),
            Map.entry("TODAY", "Today"),
            Map.entry("YEAR", "Year"),
            Map.entry("MONTH", "Month"),
            Map.entry("DAY", "Day"),
            Map.entry("FORMAT", "Format"));

    /**
     * Renders a complete expression, prefixed with {@code =}.
     */
    public String generate(ExpressionNode node) {
        Objects.requireNonNull(node, "node must not be null");
        String text = render(node);
        return text.startsWith("=") ? text : "=" + text;
    }

    /**
     * Renders a node without the leading {@code =}. Used for sub-expressions.
     */
    public String render(ExpressionNode node) {
        switch (node.kind()) {
            case LITERAL:
                return renderLiteral(((ExpressionNode.Literal) node).value());
            case FIELD_REFERENCE:
                return "Fields!" + nameOrUnknown(((ExpressionNode.FieldReference) node).name()) + ".Value";
            case PARAMETER_REFERENCE:
                return "Parameters!" + nameOrUnknown(((ExpressionNode.ParameterReference) node).name()) + ".Value";
            case GLOBAL_REFERENCE:
                return "Globals!" + nameOrUnknown(((ExpressionNode.GlobalReference) node).name());
            case BINARY_OPERATION:
                return renderBinary((ExpressionNode.BinaryOperation) node);
            case UNARY_OPERATION:
                return renderUnary((ExpressionNode.UnaryOperation) node);
            case FUNCTION_CALL:
                return renderCall((ExpressionNode.FunctionCall) node);
            case CONDITIONAL:
                return renderConditional((ExpressionNode.Conditional) node);
            case AGGREGATE:
                return renderAggregate((ExpressionNode.Aggregate) node);
            default:
                throw new IllegalStateException("Unhandled node kind: " + node.kind());
        }
    }

    /**
     * Renders a group of conditional branches as a single {@code Switch} call. The last branch's
     * false value, when present, becomes the {@code True} fallback pair.
     *
     * @throws IllegalArgumentException if {@code branches} is empty
     */
    public String generateSwitch(List<ConditionalBranch> branches) {
        Objects.requireNonNull(branches, "branches must not be null");
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("branches must not be empty");
        }
        StringJoiner pairs = new StringJoiner(", ", "=Switch(", ")");
        for (ConditionalBranch branch : branches) {
            pairs.add(render(branch.condition()));
            pairs.add(render(branch.trueValue()));
        }
        ExpressionNode fallback = branches.get(branches.size() - 1).falseValue();
        if (fallback != null) {
            pairs.add("True");
            pairs.add(render(fallback));
        }
        return pairs.toString();
    }

    // ── Per-kind rendering ──

    static String renderLiteral(Object value) {
        if (value == null) {
            return "Nothing";
        }
        if (value instanceof String s) {
            return '"' + s.replace("\"", "\"\"") + '"';
        }
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        if (value instanceof LocalDate d) {
            return '#' + DATE_LITERAL.format(d) + '#';
        }
        if (value instanceof LocalDateTime dt) {
            return '#' + DATE_LITERAL.format(dt.toLocalDate()) + '#';
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        return value.toString();
    }

    private String renderBinary(ExpressionNode.BinaryOperation node) {
        String op = node.operator() == null ? "=" : mapOperator(node.operator());
        return "(" + renderOperand(node.left()) + " " + op + " " + renderOperand(node.right()) + ")";
    }

    // Not binds looser than comparisons and arithmetic, so it needs its own parentheses here.
    private String renderOperand(ExpressionNode operand) {
        if (operand instanceof ExpressionNode.UnaryOperation unary
                && (unary.operator() == null || "Not".equalsIgnoreCase(mapOperator(unary.operator())))) {
            return "(" + render(operand) + ")";
        }
        return render(operand);
    }

    private String renderUnary(ExpressionNode.UnaryOperation node) {
        String op = node.operator() == null ? "Not" : mapOperator(node.operator());
        return op + " " + render(node.operand());
    }

    private String renderCall(ExpressionNode.FunctionCall node) {
        String name = node.name() == null ? "" : node.name();
        List<ExpressionNode> args = node.arguments();
        if (CONCAT.equalsIgnoreCase(name)) {
            if (args.isEmpty()) {
                return "\"\"";
            }
            // Left-folded so that the text reads back as the same chain of & operations.
            String folded = render(args.get(0));
            for (int i = 1; i < args.size(); i++) {
                folded = "(" + folded + " & " + render(args.get(i)) + ")";
            }
            return folded;
        }
        String target = FUNCTIONS.getOrDefault(name.toUpperCase(Locale.ROOT), name);
        StringJoiner joined = new StringJoiner(", ", target + "(", ")");
        args.forEach(arg -> joined.add(render(arg)));
        return joined.toString();
    }

    private String renderConditional(ExpressionNode.Conditional node) {
        String whenFalse = node.whenFalse() == null ? "Nothing" : render(node.whenFalse());
        return "IIf(" + render(node.condition()) + ", " + render(node.whenTrue()) + ", " + whenFalse + ")";
    }

    private String renderAggregate(ExpressionNode.Aggregate node) {
        String function = node.function() == null || node.function().isBlank() ? "Sum" : node.function();
        List<ExpressionNode> args = node.arguments();
        if (args.isEmpty()) {
            return function + "()";
        }
        StringBuilder out = new StringBuilder(function).append('(').append(render(args.get(0)));
        if (args.size() > 1) {
            ExpressionNode scope = args.get(1);
            if (scope instanceof ExpressionNode.Literal literal && literal.value() instanceof String) {
                out.append(", ").append(render(scope));
            } else {
                out.append(", ").append(renderLiteral(render(scope)));
            }
            if (args.size() > 2) {
                LOG.debug("Ignoring {} extra argument(s) of aggregate {}", args.size() - 2, function);
            }
        }
        return out.append(')').toString();
    }

    private static String mapOperator(String operator) {
        return OPERATORS.getOrDefault(operator.toUpperCase(Locale.ROOT), operator);
    }

    private static String nameOrUnknown(String name) {
        return name == null || name.isBlank() ? "Unknown" : name;
    }
}
