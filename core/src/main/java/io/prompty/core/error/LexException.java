package io.prompty.core.error;

import io.prompty.core.model.Position;

/** Thrown when template source cannot be tokenized, e.g. a tag that is never closed. */
public final class LexException extends TemplateParseException {

    private static final long serialVersionUID = 1L;

    public LexException(String detail, Position position, String source) {
        super(detail, position, source);
    }
}
