package io.reportxform.core.model;

import java.util.List;

/**
 * Outcome of a sandbox check over one generated expression.
 *
 * @param valid      {@code true} when no rule was violated (warnings do not count)
 * @param messages   every finding, warnings included
 * @param violations human-readable list of the violated rules
 */
public record SandboxResult(boolean valid, List<ValidationMessage> messages, List<String> violations) {

    public SandboxResult {
        messages = List.copyOf(messages);
        violations = List.copyOf(violations);
    }

    /** A clean result with no findings. */
    public static SandboxResult clean() {
        return new SandboxResult(true, List.of(), List.of());
    }
}
