package io.prompty.core.error;

import io.prompty.core.model.Position;

/**
 * Abstract parent for errors raised while executing a template. Non-fatal errors are routed
 * through the active error strategy; fatal ones always abort the execution.
 */
public abstract class TemplateExecutionException extends PromptyException {

    private static final long serialVersionUID = 1L;

    private final String tagName;

    protected TemplateExecutionException(String detail, Position position, String tagName) {
        super(detail, position, Phase.EXECUTION);
        this.tagName = tagName;
    }

    protected TemplateExecutionException(String detail, Throwable cause, Position position, String tagName) {
        super(detail, cause, position, Phase.EXECUTION);
        this.tagName = tagName;
    }

    /** The tag being executed when the error occurred, or {@code null}. */
    public String tagName() {
        return tagName;
    }

    /** Fatal errors bypass the error strategy and always abort the execution. */
    public abstract boolean isFatal();
}
