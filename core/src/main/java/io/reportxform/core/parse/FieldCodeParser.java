package io.reportxform.core.parse;

import io.reportxform.core.error.ExpressionSyntaxException;
import io.reportxform.core.error.FieldCodeException;
import io.reportxform.core.error.UnsupportedFieldCodeException;
import io.reportxform.core.model.ExpressionNode;
import io.reportxform.core.model.FieldCode;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses field codes into {@link ExpressionNode} trees.
 *
 * <p>The parse is driven by the field code's category: a {@code MERGEFIELD} code must start with
 * {@code MERGEFIELD}, an {@code IF} code with {@code IF}, and so on. Categories without an
 * expression form ({@code SEQ}, {@code TOC}, {@code HYPERLINK} and unclassified codes) fail with
 * {@link UnsupportedFieldCodeException}. Every failure carries the field code id.
 *
 * <p>Stateless and thread-safe.
 */
public final class FieldCodeParser {

    private static final Logger LOG = LoggerFactory.getLogger(FieldCodeParser.class);

    /** Default bound on expression nesting. */
    public static final int DEFAULT_MAX_DEPTH = 32;

    private final int maxDepth;

    public FieldCodeParser() {
        this(DEFAULT_MAX_DEPTH);
    }

    /**
     * @param maxDepth maximum nesting of parentheses, calls, braced fields and prefix operators
     */
    public FieldCodeParser(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * Parses a field code.
     *
     * @throws ExpressionSyntaxException     if the text is not well-formed
     * @throws UnsupportedFieldCodeException if the category has no expression form
     * @throws io.reportxform.core.error.NestingDepthExceededException if nesting exceeds the bound
     */
    public ExpressionNode parse(FieldCode fieldCode) {
        Objects.requireNonNull(fieldCode, "fieldCode must not be null");
        try {
            switch (fieldCode.category()) {
                case MERGE_FIELD:
                case IF:
                case DATE:
                case TIME:
                case PAGE:
                case NUM_PAGES:
                case FORMULA:
                    ExpressionNode node = new ExpressionParser(fieldCode.rawText(), maxDepth)
                            .parseInstruction(fieldCode.category(), fieldCode.switches());
                    LOG.debug("Parsed field code '{}' ({}) -> {}", fieldCode.id(), fieldCode.category(), node.kind());
                    return node;
                default:
                    throw new UnsupportedFieldCodeException(fieldCode.category(), fieldCode.id(), fieldCode.rawText());
            }
        } catch (FieldCodeException e) {
            if (e.fieldCodeId() != null) {
                throw e;
            }
            throw e.withFieldCodeId(fieldCode.id());
        }
    }

    /**
     * Parses a bare expression such as {@code IIf(Fields!A.Value > 1, "x", "y")} or
     * {@code =Sum(Fields!Amount.Value)}. A single leading {@code =} is accepted.
     *
     * @throws ExpressionSyntaxException if the text is not a well-formed expression
     */
    public ExpressionNode parseExpression(String text) {
        Objects.requireNonNull(text, "text must not be null");
        String body = text.strip();
        if (body.startsWith("=")) {
            body = body.substring(1);
        }
        return new ExpressionParser(body, maxDepth).parseStandalone();
    }

    public int maxDepth() {
        return maxDepth;
    }
}
