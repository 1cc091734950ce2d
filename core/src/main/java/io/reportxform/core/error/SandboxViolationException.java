package io.reportxform.core.error;

import java.util.List;

/**
 * Thrown when a generated expression breaks sandbox rules and the caller has asked for violations
 * to be fatal. Sandbox findings are informational unless escalated this way.
 */
public final class SandboxViolationException extends ReportXformException {

    private static final long serialVersionUID = 1L;

    private final String expression;
    private final List<String> violatedRules;

    public SandboxViolationException(String expression, List<String> violatedRules) {
        this(expression, violatedRules, null);
    }

    public SandboxViolationException(String expression, List<String> violatedRules, String fieldCodeId) {
        super(
                "Expression violates sandbox security rules: " + String.join(", ", violatedRules),
                fieldCodeId,
                Phase.VALIDATION);
        this.expression = expression;
        this.violatedRules = List.copyOf(violatedRules);
    }

    /** The expression that was rejected. */
    public String expression() {
        return expression;
    }

    /** The rules the expression violated, in detection order. */
    public List<String> violatedRules() {
        return violatedRules;
    }
}
