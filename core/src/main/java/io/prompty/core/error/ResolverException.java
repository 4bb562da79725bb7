package io.prompty.core.error;

import io.prompty.core.model.Position;

/**
 * Thrown when a tag cannot be resolved: no resolver is registered for it, its attributes are
 * invalid, or the resolver itself failed (the failure is attached as cause).
 */
public final class ResolverException extends TemplateExecutionException {

    private static final long serialVersionUID = 1L;

    public ResolverException(String detail, Position position, String tagName) {
        super(detail, position, tagName);
    }

    public ResolverException(String detail, Throwable cause, Position position, String tagName) {
        super(detail, cause, position, tagName);
    }

    @Override
    public boolean isFatal() {
        return false;
    }
}
