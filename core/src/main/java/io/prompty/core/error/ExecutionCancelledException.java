package io.prompty.core.error;

import io.prompty.core.model.Position;

/** Thrown when the caller's cancellation token is signalled during execution. Always fatal. */
public final class ExecutionCancelledException extends TemplateExecutionException {

    private static final long serialVersionUID = 1L;

    public ExecutionCancelledException(String detail, Position position, String tagName) {
        super(detail, position, tagName);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
