package io.prompty.core.error;

import io.prompty.core.model.Position;

/** Thrown when a token stream violates the structural rules of the template grammar. */
public final class ParseException extends TemplateParseException {

    private static final long serialVersionUID = 1L;

    /** Structural rule that was violated. */
    public enum Kind {
        UNEXPECTED_TOKEN,
        MISMATCHED_TAG,
        UNCLOSED_TAG,
        MISSING_ATTRIBUTE,
        INVALID_ATTRIBUTE,
        CONDITIONAL_ORDER,
        SWITCH_ORDER,
        AMBIGUOUS_CASE,
        INVALID_EXPRESSION,
        INHERITANCE
    }

    private final Kind kind;

    public ParseException(Kind kind, String detail, Position position, String source) {
        super(detail, position, source);
        this.kind = kind;
    }

    public ParseException(Kind kind, String detail, Throwable cause, Position position, String source) {
        super(detail, cause, position, source);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
