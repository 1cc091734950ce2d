package io.reportxform.core.translate;

/** What the compiler does with an expression that violates the sandbox rules. */
public enum SandboxPolicy {
    /** Attach the findings to the result and keep the expression. */
    REPORT,
    /** Fail the field code with a {@link io.reportxform.core.error.SandboxViolationException}. */
    REJECT
}
