package io.reportxform.core.spi;

import io.reportxform.core.model.FieldCategory;
import java.util.List;

/**
 * Observability hooks for field-code compilation.
 *
 * <p>Adapters bridge these callbacks to whatever metrics or tracing system they use; the core has
 * no telemetry dependency. Events are immutable. Implementations must be thread-safe and
 * non-blocking. Exceptions thrown by a listener are caught and logged by the compiler and never
 * affect compilation.
 *
 * <p>All methods have empty defaults so implementations override only what they need.
 */
public interface CompilationListener {

    /** A listener that ignores every event. */
    CompilationListener NOOP = new CompilationListener() {};

    /** Called after a field code compiled to an expression. */
    default void onCompiled(CompiledEvent event) {}

    /** Called when a field code failed to compile. */
    default void onFailed(FailedEvent event) {}

    /** Called when a compiled expression violated the sandbox rules. */
    default void onSandboxViolation(SandboxViolationEvent event) {}

    // --- Event records ---

    /** A field code compiled successfully. */
    record CompiledEvent(String fieldCodeId, FieldCategory category, String expression, long durationNanos) {}

    /** A field code failed; {@code errorType} is the exception's simple class name. */
    record FailedEvent(String fieldCodeId, FieldCategory category, String errorType, String errorDetail) {}

    /** An expression matched sandbox rules. {@code rejected} is true under the reject policy. */
    record SandboxViolationEvent(String fieldCodeId, String expression, List<String> violations, boolean rejected) {

        public SandboxViolationEvent {
            violations = List.copyOf(violations);
        }
    }
}
