package io.prompty.core.error;

import io.prompty.core.model.Position;

/** Thrown when an execution exceeds one of its resource limits. Always fatal. */
public final class ResourceLimitException extends TemplateExecutionException {

    private static final long serialVersionUID = 1L;

    /** The limit that was exceeded. */
    public enum Limit {
        DEPTH,
        LOOP_ITERATIONS,
        OUTPUT_SIZE,
        EXECUTION_TIMEOUT,
        RESOLVER_TIMEOUT,
        FUNCTION_TIMEOUT
    }

    private final Limit limit;

    public ResourceLimitException(Limit limit, String detail, Position position, String tagName) {
        super(detail, position, tagName);
        this.limit = limit;
    }

    public Limit limit() {
        return limit;
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
