package io.reportxform.core.error;

/**
 * Thrown when conditional or expression nesting goes deeper than the configured maximum. Replaces
 * what would otherwise be an uncontrolled stack overflow on adversarial input.
 */
public final class NestingDepthExceededException extends FieldCodeException {

    private static final long serialVersionUID = 1L;

    private final int maxDepth;

    public NestingDepthExceededException(int maxDepth, String fieldCodeId, String rawText) {
        super("Nesting depth exceeds the configured maximum of " + maxDepth, fieldCodeId, rawText);
        this.maxDepth = maxDepth;
    }

    /** The limit that was exceeded. */
    public int maxDepth() {
        return maxDepth;
    }

    @Override
    public NestingDepthExceededException withFieldCodeId(String fieldCodeId) {
        NestingDepthExceededException copy = new NestingDepthExceededException(maxDepth, fieldCodeId, rawText());
        copy.setStackTrace(getStackTrace());
        return copy;
    }
}
