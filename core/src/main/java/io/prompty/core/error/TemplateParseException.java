package io.prompty.core.error;

import io.prompty.core.model.Position;

/**
 * Abstract parent for errors raised while turning source into a template. Parsing never recovers:
 * the first such error aborts it.
 */
public abstract class TemplateParseException extends PromptyException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected TemplateParseException(String detail, Position position, String source) {
        super(detail, position, Phase.PARSE);
        this.source = source;
    }

    protected TemplateParseException(String detail, Throwable cause, Position position, String source) {
        super(detail, cause, position, Phase.PARSE);
        this.source = source;
    }

    /** The offending source fragment, or {@code null} if not available. */
    public String source() {
        return source;
    }
}
