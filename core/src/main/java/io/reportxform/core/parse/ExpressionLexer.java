package io.reportxform.core.parse;

import io.reportxform.core.error.ExpressionSyntaxException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits field-code text into {@link Token}s. Strings use doubled quotes for escaping; dates are
 * delimited by {@code #} and accept {@code M/d/yyyy} or ISO {@code yyyy-MM-dd}. A backslash
 * followed by one character is a field switch ({@code \@}, {@code \*}, {@code \#}).
 *
 * <p>Stateless; every call to {@link #tokenize(String)} works on its own buffer.
 */
final class ExpressionLexer {

    private static final DateTimeFormatter US_DATE = DateTimeFormatter.ofPattern("M/d/uuuu");

    private ExpressionLexer() {}

    static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int pos = 0;
        int length = source.length();
        while (pos < length) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '"') {
                pos = readString(source, pos, tokens);
            } else if (c == '#') {
                pos = readDate(source, pos, tokens);
            } else if (Character.isDigit(c)
                    || (c == '.' && pos + 1 < length && Character.isDigit(source.charAt(pos + 1)))) {
                pos = readNumber(source, pos, tokens);
            } else if (Character.isLetter(c) || c == '_') {
                int start = pos;
                while (pos < length && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                    pos++;
                }
                tokens.add(new Token(Token.Type.IDENTIFIER, source.substring(start, pos), null, start));
            } else {
                pos = readSymbol(source, pos, tokens);
            }
        }
        tokens.add(new Token(Token.Type.EOF, "", null, length));
        return tokens;
    }

    private static int readString(String source, int start, List<Token> tokens) {
        StringBuilder content = new StringBuilder();
        int pos = start + 1;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (c == '"') {
                if (pos + 1 < source.length() && source.charAt(pos + 1) == '"') {
                    content.append('"');
                    pos += 2;
                    continue;
                }
                tokens.add(new Token(Token.Type.STRING, content.toString(), null, start));
                return pos + 1;
            }
            content.append(c);
            pos++;
        }
        throw new ExpressionSyntaxException("Unterminated string literal", source, start);
    }

    private static int readDate(String source, int start, List<Token> tokens) {
        int end = source.indexOf('#', start + 1);
        if (end < 0) {
            throw new ExpressionSyntaxException("Unterminated date literal", source, start);
        }
        String text = source.substring(start + 1, end).strip();
        LocalDate date;
        try {
            date = text.contains("/") ? LocalDate.parse(text, US_DATE) : LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new ExpressionSyntaxException("Invalid date literal '#" + text + "#'", source, start);
        }
        tokens.add(new Token(Token.Type.DATE, text, date, start));
        return end + 1;
    }

    private static int readNumber(String source, int start, List<Token> tokens) {
        int pos = start;
        boolean decimal = false;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isDigit(c)) {
                pos++;
            } else if (c == '.' && !decimal && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1))) {
                decimal = true;
                pos++;
            } else {
                break;
            }
        }
        String text = source.substring(start, pos);
        Number value;
        if (decimal) {
            value = new BigDecimal(text);
        } else {
            try {
                value = Long.parseLong(text);
            } catch (NumberFormatException e) {
                value = new BigDecimal(text);
            }
        }
        tokens.add(new Token(Token.Type.NUMBER, text, value, start));
        return pos;
    }

    private static int readSymbol(String source, int pos, List<Token> tokens) {
        char c = source.charAt(pos);
        char next = pos + 1 < source.length() ? source.charAt(pos + 1) : '\0';
        switch (c) {
            case '<':
                if (next == '=' || next == '>') {
                    tokens.add(new Token(Token.Type.OPERATOR, "<" + next, null, pos));
                    return pos + 2;
                }
                tokens.add(new Token(Token.Type.OPERATOR, "<", null, pos));
                return pos + 1;
            case '>':
                if (next == '=') {
                    tokens.add(new Token(Token.Type.OPERATOR, ">=", null, pos));
                    return pos + 2;
                }
                tokens.add(new Token(Token.Type.OPERATOR, ">", null, pos));
                return pos + 1;
            case '!':
                if (next == '=') {
                    tokens.add(new Token(Token.Type.OPERATOR, "!=", null, pos));
                    return pos + 2;
                }
                tokens.add(new Token(Token.Type.BANG, "!", null, pos));
                return pos + 1;
            case '=':
            case '+':
            case '-':
            case '*':
            case '/':
            case '%':
            case '&':
                tokens.add(new Token(Token.Type.OPERATOR, String.valueOf(c), null, pos));
                return pos + 1;
            case '.':
                tokens.add(new Token(Token.Type.DOT, ".", null, pos));
                return pos + 1;
            case ',':
                tokens.add(new Token(Token.Type.COMMA, ",", null, pos));
                return pos + 1;
            case '(':
                tokens.add(new Token(Token.Type.LEFT_PAREN, "(", null, pos));
                return pos + 1;
            case ')':
                tokens.add(new Token(Token.Type.RIGHT_PAREN, ")", null, pos));
                return pos + 1;
            case '{':
                tokens.add(new Token(Token.Type.LEFT_BRACE, "{", null, pos));
                return pos + 1;
            case '}':
                tokens.add(new Token(Token.Type.RIGHT_BRACE, "}", null, pos));
                return pos + 1;
            case '\\':
                if (next == '\0' || Character.isWhitespace(next)) {
                    throw new ExpressionSyntaxException("Dangling switch marker", source, pos);
                }
                tokens.add(new Token(Token.Type.SWITCH, String.valueOf(next), null, pos));
                return pos + 2;
            default:
                throw new ExpressionSyntaxException("Unexpected character '" + c + "'", source, pos);
        }
    }
}
