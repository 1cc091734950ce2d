package io.reportxform.core.engine;

import io.reportxform.core.error.ReportXformException;
import io.reportxform.core.model.ExpressionNode;
import io.reportxform.core.model.FieldCode;
import io.reportxform.core.model.SandboxResult;
import java.util.Objects;

/**
 * Outcome of compiling one field code. Exactly one of two states:
 *
 * <ul>
 *   <li>{@link Type#SUCCESS}: {@code expression} holds the final expression text, {@code tree}
 *       the simplified tree, {@code sandbox} the sandbox findings.
 *   <li>{@link Type#FAILED}: {@code error} holds the reason.
 * </ul>
 */
public final class FieldCodeResult {

    /** The type of compilation outcome. */
    public enum Type {
        SUCCESS,
        FAILED
    }

    private final Type type;
    private final FieldCode fieldCode;
    private final ExpressionNode tree;
    private final String expression;
    private final SandboxResult sandbox;
    private final ReportXformException error;

    private FieldCodeResult(
            Type type,
            FieldCode fieldCode,
            ExpressionNode tree,
            String expression,
            SandboxResult sandbox,
            ReportXformException error) {
        this.type = type;
        this.fieldCode = fieldCode;
        this.tree = tree;
        this.expression = expression;
        this.sandbox = sandbox;
        this.error = error;
    }

    /** Creates a SUCCESS result. */
    public static FieldCodeResult success(
            FieldCode fieldCode, ExpressionNode tree, String expression, SandboxResult sandbox) {
        Objects.requireNonNull(fieldCode, "fieldCode must not be null");
        Objects.requireNonNull(tree, "tree must not be null for SUCCESS");
        Objects.requireNonNull(expression, "expression must not be null for SUCCESS");
        Objects.requireNonNull(sandbox, "sandbox must not be null for SUCCESS");
        return new FieldCodeResult(Type.SUCCESS, fieldCode, tree, expression, sandbox, null);
    }

    /** Creates a FAILED result. */
    public static FieldCodeResult failed(FieldCode fieldCode, ReportXformException error) {
        Objects.requireNonNull(fieldCode, "fieldCode must not be null");
        Objects.requireNonNull(error, "error must not be null for FAILED");
        return new FieldCodeResult(Type.FAILED, fieldCode, null, null, null, error);
    }

    public Type type() {
        return type;
    }

    public FieldCode fieldCode() {
        return fieldCode;
    }

    /** The simplified tree. Only valid when {@code type() == SUCCESS}. */
    public ExpressionNode tree() {
        return tree;
    }

    /** The optimized expression text, starting with {@code =}. Only valid when {@code type() == SUCCESS}. */
    public String expression() {
        return expression;
    }

    /** Sandbox findings. Only valid when {@code type() == SUCCESS}. */
    public SandboxResult sandbox() {
        return sandbox;
    }

    /** The failure. Only valid when {@code type() == FAILED}. */
    public ReportXformException error() {
        return error;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isFailed() {
        return type == Type.FAILED;
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "FieldCodeResult{SUCCESS, id=" + fieldCode.id() + ", expression=" + expression + "}";
        }
        return "FieldCodeResult{FAILED, id=" + fieldCode.id() + ", error=" + error.getMessage() + "}";
    }
}
