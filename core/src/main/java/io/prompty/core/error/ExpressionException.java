package io.prompty.core.error;

import io.prompty.core.model.Position;

/**
 * Thrown when an {@code eval} expression cannot be parsed or evaluated. Errors raised inside the
 * evaluator carry no position; the executor re-anchors them on the owning tag via {@link #at}.
 */
public final class ExpressionException extends TemplateExecutionException {

    private static final long serialVersionUID = 1L;

    /** Category of expression failure. */
    public enum Kind {
        SYNTAX,
        TYPE_MISMATCH,
        UNKNOWN_FUNCTION,
        ARITY_MISMATCH,
        UNKNOWN_OPERATOR,
        FUNCTION_FAILED
    }

    private final Kind kind;

    public ExpressionException(Kind kind, String detail) {
        super(detail, Position.NONE, null);
        this.kind = kind;
    }

    public ExpressionException(Kind kind, String detail, Throwable cause) {
        super(detail, cause, Position.NONE, null);
        this.kind = kind;
    }

    private ExpressionException(ExpressionException original, Position position, String tagName) {
        super(original.detail(), original.getCause(), position, tagName);
        this.kind = original.kind;
    }

    public Kind kind() {
        return kind;
    }

    /** Returns a copy of this exception anchored at the given tag. */
    public ExpressionException at(Position position, String tagName) {
        return new ExpressionException(this, position, tagName);
    }

    @Override
    public boolean isFatal() {
        return false;
    }
}
