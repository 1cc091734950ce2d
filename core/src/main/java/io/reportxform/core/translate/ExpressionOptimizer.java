package io.reportxform.core.translate;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Text-level rewrites over generated expressions. The passes, in order:
 *
 * <ol>
 *   <li>{@code ((X))} collapses to {@code (X)} when X holds no parentheses, repeated until stable;
 *   <li>{@code Not Not X} collapses to {@code X} (one pass);
 *   <li>{@code IIf(True, a, b)} folds to {@code a}, {@code IIf(False, a, b)} to {@code b} (one
 *       pass, folded text is not re-scanned). A branch with top-level spaces is wrapped in
 *       parentheses unless the conditional was the whole expression;
 *   <li>null-check simplification, currently the identity.
 * </ol>
 *
 * The sequence is repeated until the text stops changing, so {@code optimize} is idempotent.
 * Every pass shortens the text or leaves it alone, which bounds the repetition. Passes 1 and 2
 * never touch string-literal contents.
 *
 * <p>Stateless and thread-safe.
 */
public final class ExpressionOptimizer {

    private static final Logger LOG = LoggerFactory.getLogger(ExpressionOptimizer.class);

    private static final Pattern DOUBLE_PAREN = Pattern.compile("\\(\\(([^()]+)\\)\\)");
    private static final Pattern DOUBLE_NOT = Pattern.compile("\\bNot\\s+Not\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONSTANT_IIF =
            Pattern.compile("\\bIIf\\s*\\(\\s*(True|False)\\s*,", Pattern.CASE_INSENSITIVE);

    public String optimize(String expression) {
        if (expression == null || expression.isBlank()) {
            return expression;
        }
        String current = expression;
        String previous;
        do {
            previous = current;
            current = removeRedundantParentheses(current);
            current = collapseDoubleNegation(current);
            current = foldConstantConditions(current);
            current = simplifyNullChecks(current);
        } while (!current.equals(previous));

        if (!current.equals(expression)) {
            LOG.debug("Optimized expression '{}' -> '{}'", expression, current);
        }
        return current;
    }

    String removeRedundantParentheses(String expression) {
        return outsideStrings(expression, code -> {
            String result = code;
            String before;
            do {
                before = result;
                result = DOUBLE_PAREN.matcher(result).replaceAll("($1)");
            } while (!result.equals(before));
            return result;
        });
    }

    String collapseDoubleNegation(String expression) {
        return outsideStrings(expression, code -> DOUBLE_NOT.matcher(code).replaceAll(""));
    }

    String foldConstantConditions(String expression) {
        StringBuilder out = new StringBuilder(expression.length());
        Matcher matcher = CONSTANT_IIF.matcher(expression);
        int cursor = 0;
        while (cursor < expression.length() && matcher.find(cursor)) {
            if (insideString(expression, matcher.start())) {
                out.append(expression, cursor, matcher.end());
                cursor = matcher.end();
                continue;
            }
            List<String> args = new ArrayList<>();
            int close = splitArguments(expression, matcher.end(), args);
            if (close < 0 || args.size() != 2) {
                out.append(expression, cursor, matcher.end());
                cursor = matcher.end();
                continue;
            }
            boolean selector = matcher.group(1).equalsIgnoreCase("True");
            String branch = (selector ? args.get(0) : args.get(1)).strip();
            boolean wholeBody = matcher.start() == (expression.startsWith("=") ? 1 : 0)
                    && close == expression.length() - 1;
            out.append(expression, cursor, matcher.start());
            out.append(wholeBody || isSelfContained(branch) ? branch : "(" + branch + ")");
            cursor = close + 1;
        }
        out.append(expression, Math.min(cursor, expression.length()), expression.length());
        return out.toString();
    }

    /** True if the text has no whitespace outside string literals and parentheses. */
    private static boolean isSelfContained(String text) {
        int depth = 0;
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') {
                inString = !inString;
            } else if (inString) {
                continue;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (depth == 0 && Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }

    // Reserved for null-check simplification.
    String simplifyNullChecks(String expression) {
        return expression;
    }

    /**
     * Splits top-level comma-separated arguments starting at {@code start} up to the matching
     * closing parenthesis.
     *
     * @return the index of the closing parenthesis, or -1 if unbalanced
     */
    private static int splitArguments(String text, int start, List<String> args) {
        int depth = 0;
        boolean inString = false;
        int argStart = start;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        i++;
                    } else {
                        inString = false;
                    }
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                if (depth == 0) {
                    args.add(text.substring(argStart, i));
                    return i;
                }
                depth--;
            } else if (c == ',' && depth == 0) {
                args.add(text.substring(argStart, i));
                argStart = i + 1;
            }
        }
        return -1;
    }

    private static boolean insideString(String text, int index) {
        boolean inString = false;
        for (int i = 0; i < index; i++) {
            if (text.charAt(i) == '"') {
                inString = !inString;
            }
        }
        return inString;
    }

    /** Applies {@code rewrite} to every stretch of text that lies outside a string literal. */
    private static String outsideStrings(String text, UnaryOperator<String> rewrite) {
        if (text.indexOf('"') < 0) {
            return rewrite.apply(text);
        }
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            int quote = text.indexOf('"', i);
            if (quote < 0) {
                out.append(rewrite.apply(text.substring(i)));
                break;
            }
            out.append(rewrite.apply(text.substring(i, quote)));
            int end = quote + 1;
            while (end < text.length()) {
                if (text.charAt(end) == '"') {
                    if (end + 1 < text.length() && text.charAt(end + 1) == '"') {
                        end += 2;
                        continue;
                    }
                    break;
                }
                end++;
            }
            int stop = Math.min(end + 1, text.length());
            out.append(text, quote, stop);
            i = stop;
        }
        return out.toString();
    }
}
