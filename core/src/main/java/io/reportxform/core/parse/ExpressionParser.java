package io.reportxform.core.parse;

import io.reportxform.core.error.ExpressionSyntaxException;
import io.reportxform.core.error.NestingDepthExceededException;
import io.reportxform.core.error.UnsupportedFieldCodeException;
import io.reportxform.core.model.ExpressionNode;
import io.reportxform.core.model.FieldCategory;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser over the field-code vocabulary. One instance parses one source string
 * and is discarded afterwards.
 *
 * <p>Operator precedence, lowest first:
 *
 * <pre>
 *   Or
 *   And
 *   Not                         (prefix)
 *   =  &lt;&gt;  !=  &lt;  &gt;  &lt;=  &gt;=
 *   &amp;
 *   +  -
 *   Mod  %
 *   *  /
 *   -                           (prefix)
 * </pre>
 *
 * All binary levels are left-associative. Nesting (parentheses, calls, braced fields, prefix
 * chains) is bounded by {@code maxDepth}.
 */
final class ExpressionParser {

    static final String DEFAULT_DATE_FORMAT = "yyyy-MM-dd";
    static final String DEFAULT_TIME_FORMAT = "HH:mm";

    private static final Set<String> COMPARISONS = Set.of("=", "<>", "!=", "<", ">", "<=", ">=");

    private static final Set<String> AGGREGATES =
            Set.of("SUM", "AVG", "COUNT", "COUNTDISTINCT", "MIN", "MAX", "FIRST", "LAST", "STDEV", "VAR");

    private static final Set<String> RESERVED = Set.of("AND", "OR", "NOT", "MOD");

    private final String source;
    private final List<Token> tokens;
    private final int maxDepth;
    private int pos;
    private int depth;

    ExpressionParser(String source, int maxDepth) {
        this.source = source;
        this.tokens = ExpressionLexer.tokenize(source);
        this.maxDepth = maxDepth;
    }

    /** Parses the whole source as a single expression. */
    ExpressionNode parseStandalone() {
        if (peek().is(Token.Type.EOF)) {
            throw syntaxError("Empty expression", peek());
        }
        ExpressionNode node = parseExpression();
        expect(Token.Type.EOF, "end of input");
        return node;
    }

    /**
     * Parses the whole source as a keyword-led field instruction, optionally wrapped in braces.
     *
     * @param expected the category the instruction must belong to
     * @param switches switches supplied out of band by the extraction stage; they override switches
     *                 found in the text
     */
    ExpressionNode parseInstruction(FieldCategory expected, Map<String, String> switches) {
        if (peek().is(Token.Type.EOF)) {
            throw syntaxError("Empty field code", peek());
        }
        ExpressionNode node;
        if (peek().is(Token.Type.LEFT_BRACE)) {
            advance();
            node = parseFieldBody(expected, switches);
            expect(Token.Type.RIGHT_BRACE, "'}'");
        } else {
            node = parseFieldBody(expected, switches);
        }
        expect(Token.Type.EOF, "end of field code");
        return node;
    }

    // ── Field instructions ──

    private ExpressionNode parseFieldBody(FieldCategory expected, Map<String, String> switches) {
        Token first = peek();
        if (first.isOperator("=")) {
            requireCategory(expected, FieldCategory.FORMULA, first);
            advance();
            return parseExpression();
        }
        if (expected == FieldCategory.FORMULA) {
            return parseExpression();
        }
        FieldCategory category = first.is(Token.Type.IDENTIFIER) ? keywordCategory(first.text()) : null;
        if (category == null) {
            if (expected == null && first.is(Token.Type.IDENTIFIER)) {
                throw new UnsupportedFieldCodeException(FieldCategory.UNSUPPORTED, source);
            }
            if (expected == null) {
                throw syntaxError("Expected a field instruction keyword but found " + describe(first), first);
            }
            throw syntaxError("Expected " + expected.keyword() + " instruction but found " + describe(first), first);
        }
        requireCategory(expected, category, first);
        switch (category) {
            case MERGE_FIELD:
                return parseMergeField(switches);
            case IF:
                return parseIf();
            case DATE:
                return parseDate(DEFAULT_DATE_FORMAT, switches);
            case TIME:
                return parseDate(DEFAULT_TIME_FORMAT, switches);
            case PAGE:
                advance();
                parseSwitches();
                return ExpressionNode.global("PageNumber");
            case NUM_PAGES:
                advance();
                parseSwitches();
                return ExpressionNode.global("TotalPages");
            default:
                throw new UnsupportedFieldCodeException(category, source);
        }
    }

    private void requireCategory(FieldCategory expected, FieldCategory actual, Token at) {
        if (expected != null && expected != actual) {
            throw syntaxError(
                    "Expected " + expected.keyword() + " instruction but found " + actual.keyword(), at);
        }
    }

    private ExpressionNode parseMergeField(Map<String, String> overrides) {
        advance(); // MERGEFIELD
        Token nameToken = advance();
        if (!nameToken.is(Token.Type.IDENTIFIER) && !nameToken.is(Token.Type.STRING)) {
            throw syntaxError("Unable to extract field name from MERGEFIELD", nameToken);
        }
        Map<String, String> switches = parseSwitches();
        switches.putAll(overrides);

        ExpressionNode node = ExpressionNode.field(nameToken.text());
        String picture = switches.containsKey("#") ? switches.get("#") : switches.get("@");
        if (picture != null) {
            node = ExpressionNode.call("FORMAT", node, ExpressionNode.literal(picture));
        }
        String caseFormat = switches.get("*");
        if ("Upper".equalsIgnoreCase(caseFormat)) {
            node = ExpressionNode.call("UPPER", node);
        } else if ("Lower".equalsIgnoreCase(caseFormat)) {
            node = ExpressionNode.call("LOWER", node);
        }
        return node;
    }

    private ExpressionNode parseIf() {
        Token keyword = advance(); // IF
        if (peek().is(Token.Type.LEFT_PAREN)) {
            // Function form: IF(cond, a, b)
            pos--;
            return parseExpression();
        }
        if (atFieldEnd()) {
            throw syntaxError("IF requires a condition and a true value", keyword);
        }
        ExpressionNode condition = parseExpression();
        if (atFieldEnd()) {
            throw syntaxError("IF requires a true value after the condition", peek());
        }
        ExpressionNode whenTrue = parseExpression();
        ExpressionNode whenFalse = atFieldEnd() ? null : parseExpression();
        parseSwitches();
        return ExpressionNode.conditional(condition, whenTrue, whenFalse);
    }

    private ExpressionNode parseDate(String defaultFormat, Map<String, String> overrides) {
        advance(); // DATE / TIME
        Map<String, String> switches = parseSwitches();
        switches.putAll(overrides);
        String format = switches.getOrDefault("@", defaultFormat);
        return ExpressionNode.call(
                "FORMAT", ExpressionNode.global("ExecutionTime"), ExpressionNode.literal(format));
    }

    private Map<String, String> parseSwitches() {
        Map<String, String> switches = new LinkedHashMap<>();
        while (peek().is(Token.Type.SWITCH)) {
            String key = advance().text();
            String value = null;
            if (peek().is(Token.Type.STRING) || peek().is(Token.Type.IDENTIFIER)) {
                value = advance().text();
            }
            switches.put(key, value);
        }
        return switches;
    }

    private boolean atFieldEnd() {
        Token next = peek();
        return next.is(Token.Type.EOF) || next.is(Token.Type.RIGHT_BRACE) || next.is(Token.Type.SWITCH);
    }

    private static FieldCategory keywordCategory(String word) {
        String upper = word.toUpperCase(Locale.ROOT);
        for (FieldCategory category : FieldCategory.values()) {
            if (upper.equals(category.keyword())) {
                return category;
            }
        }
        return null;
    }

    // ── Expressions ──

    private ExpressionNode parseExpression() {
        enter();
        try {
            return parseOr();
        } finally {
            depth--;
        }
    }

    private ExpressionNode parseOr() {
        ExpressionNode left = parseAnd();
        while (peek().isKeyword("Or")) {
            String op = advance().text();
            left = ExpressionNode.binary(op, left, parseAnd());
        }
        return left;
    }

    private ExpressionNode parseAnd() {
        ExpressionNode left = parseNot();
        while (peek().isKeyword("And")) {
            String op = advance().text();
            left = ExpressionNode.binary(op, left, parseNot());
        }
        return left;
    }

    private ExpressionNode parseNot() {
        if (peek().isKeyword("Not")) {
            advance();
            enter();
            try {
                return ExpressionNode.not(parseNot());
            } finally {
                depth--;
            }
        }
        return parseComparison();
    }

    private ExpressionNode parseComparison() {
        ExpressionNode left = parseConcat();
        while (peek().is(Token.Type.OPERATOR) && COMPARISONS.contains(peek().text())) {
            String op = advance().text();
            left = ExpressionNode.binary(op, left, parseConcat());
        }
        return left;
    }

    private ExpressionNode parseConcat() {
        ExpressionNode left = parseAdditive();
        while (peek().isOperator("&")) {
            String op = advance().text();
            left = ExpressionNode.binary(op, left, parseAdditive());
        }
        return left;
    }

    private ExpressionNode parseAdditive() {
        ExpressionNode left = parseModulo();
        while (peek().isOperator("+") || peek().isOperator("-")) {
            String op = advance().text();
            left = ExpressionNode.binary(op, left, parseModulo());
        }
        return left;
    }

    private ExpressionNode parseModulo() {
        ExpressionNode left = parseTerm();
        while (peek().isKeyword("Mod") || peek().isOperator("%")) {
            String op = advance().text();
            left = ExpressionNode.binary(op, left, parseTerm());
        }
        return left;
    }

    private ExpressionNode parseTerm() {
        ExpressionNode left = parseUnary();
        while (peek().isOperator("*") || peek().isOperator("/")) {
            String op = advance().text();
            left = ExpressionNode.binary(op, left, parseUnary());
        }
        return left;
    }

    private ExpressionNode parseUnary() {
        if (peek().isOperator("-")) {
            Token minus = advance();
            Token next = peek();
            if (next.is(Token.Type.NUMBER) && next.offset() == minus.offset() + 1) {
                advance();
                return ExpressionNode.literal(negate((Number) next.value()));
            }
            enter();
            try {
                return new ExpressionNode.UnaryOperation("-", parseUnary());
            } finally {
                depth--;
            }
        }
        return parsePrimary();
    }

    private ExpressionNode parsePrimary() {
        Token token = peek();
        switch (token.type()) {
            case STRING:
                advance();
                return ExpressionNode.literal(token.text());
            case NUMBER:
            case DATE:
                advance();
                return ExpressionNode.literal(token.value());
            case LEFT_PAREN: {
                advance();
                ExpressionNode inner = parseExpression();
                expect(Token.Type.RIGHT_PAREN, "')'");
                return inner;
            }
            case LEFT_BRACE: {
                advance();
                enter();
                try {
                    ExpressionNode nested = parseFieldBody(null, Map.of());
                    expect(Token.Type.RIGHT_BRACE, "'}'");
                    return nested;
                } finally {
                    depth--;
                }
            }
            case IDENTIFIER:
                return parseIdentifier();
            case EOF:
                throw syntaxError("Unexpected end of expression", token);
            default:
                throw syntaxError("Unexpected " + describe(token), token);
        }
    }

    private ExpressionNode parseIdentifier() {
        Token token = peek();
        String upper = token.text().toUpperCase(Locale.ROOT);
        if (RESERVED.contains(upper)) {
            throw syntaxError("Unexpected keyword '" + token.text() + "'", token);
        }
        switch (upper) {
            case "TRUE":
                advance();
                return ExpressionNode.literal(Boolean.TRUE);
            case "FALSE":
                advance();
                return ExpressionNode.literal(Boolean.FALSE);
            case "NOTHING":
            case "NULL":
                advance();
                return ExpressionNode.literal(null);
            case "MERGEFIELD":
                if (peekAt(1).is(Token.Type.IDENTIFIER) || peekAt(1).is(Token.Type.STRING)) {
                    return parseMergeField(Map.of());
                }
                break;
            default:
                break;
        }

        advance();
        if (peek().is(Token.Type.BANG)) {
            return parseCollectionReference(token);
        }
        StringBuilder name = new StringBuilder(token.text());
        while (peek().is(Token.Type.DOT) && peekAt(1).is(Token.Type.IDENTIFIER)) {
            advance();
            name.append('.').append(advance().text());
        }
        if (peek().is(Token.Type.LEFT_PAREN)) {
            return parseCall(name.toString(), token);
        }
        return ExpressionNode.field(name.toString());
    }

    private ExpressionNode parseCollectionReference(Token collection) {
        advance(); // !
        Token nameToken = advance();
        if (!nameToken.is(Token.Type.IDENTIFIER)) {
            throw syntaxError("Expected a name after '" + collection.text() + "!'", nameToken);
        }
        String name = nameToken.text();
        switch (collection.text().toUpperCase(Locale.ROOT)) {
            case "FIELDS":
                skipValueProperty();
                return ExpressionNode.field(name);
            case "PARAMETERS":
                skipValueProperty();
                return ExpressionNode.parameter(name);
            case "GLOBALS":
                return ExpressionNode.global(name);
            default:
                throw syntaxError("Unknown collection '" + collection.text() + "'", collection);
        }
    }

    private void skipValueProperty() {
        if (!peek().is(Token.Type.DOT)) {
            return;
        }
        Token property = peekAt(1);
        if (!property.isKeyword("Value")) {
            throw syntaxError("Unsupported property " + describe(property), property);
        }
        advance();
        advance();
    }

    private ExpressionNode parseCall(String name, Token nameToken) {
        advance(); // (
        enter();
        List<ExpressionNode> args = new ArrayList<>();
        try {
            if (!peek().is(Token.Type.RIGHT_PAREN)) {
                args.add(parseExpression());
                while (peek().is(Token.Type.COMMA)) {
                    advance();
                    args.add(parseExpression());
                }
            }
            expect(Token.Type.RIGHT_PAREN, "')' or ','");
        } finally {
            depth--;
        }

        String upper = name.toUpperCase(Locale.ROOT);
        if (upper.equals("IIF") || upper.equals("IF")) {
            if (args.size() < 2 || args.size() > 3) {
                throw syntaxError(name + " expects 2 or 3 arguments, got " + args.size(), nameToken);
            }
            return ExpressionNode.conditional(args.get(0), args.get(1), args.size() > 2 ? args.get(2) : null);
        }
        if (AGGREGATES.contains(upper)) {
            if (args.size() > 2) {
                throw syntaxError(
                        name + " accepts an expression and an optional scope, got " + args.size() + " arguments",
                        nameToken);
            }
            if (args.size() == 2 && !isStringLiteral(args.get(1))) {
                throw syntaxError(name + " scope must be a string literal", nameToken);
            }
            return new ExpressionNode.Aggregate(name, args);
        }
        return new ExpressionNode.FunctionCall(name, args);
    }

    private static Number negate(Number value) {
        if (value instanceof BigDecimal decimal) {
            return decimal.negate();
        }
        return -value.longValue();
    }

    private static boolean isStringLiteral(ExpressionNode node) {
        return node instanceof ExpressionNode.Literal literal && literal.value() instanceof String;
    }

    // ── Token plumbing ──

    private void enter() {
        if (++depth > maxDepth) {
            throw new NestingDepthExceededException(maxDepth, null, source);
        }
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAt(int ahead) {
        return tokens.get(Math.min(pos + ahead, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(pos);
        if (!token.is(Token.Type.EOF)) {
            pos++;
        }
        return token;
    }

    private void expect(Token.Type type, String what) {
        Token token = peek();
        if (!token.is(type)) {
            throw syntaxError("Expected " + what + " but found " + describe(token), token);
        }
        advance();
    }

    private ExpressionSyntaxException syntaxError(String message, Token at) {
        return new ExpressionSyntaxException(message, source, at.offset());
    }

    private static String describe(Token token) {
        if (token.is(Token.Type.EOF)) {
            return "end of input";
        }
        if (token.is(Token.Type.STRING)) {
            return "string \"" + token.text() + "\"";
        }
        return "'" + token.text() + "'";
    }
}
