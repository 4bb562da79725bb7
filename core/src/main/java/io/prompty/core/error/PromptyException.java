package io.prompty.core.error;

import io.prompty.core.model.Position;

/**
 * Abstract base for all prompty exceptions. Never thrown directly; use the concrete subclasses
 * under {@link TemplateParseException}, {@link TemplateExecutionException} or
 * {@link RegistrationException}.
 *
 * <p>
 * {@link #getMessage()} appends the source position when one is known; {@link #detail()} returns
 * the bare description.
 */
public abstract class PromptyException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        EXECUTION,
        REGISTRATION
    }

    private final String detail;
    private final transient Position position;
    private final Phase phase;

    protected PromptyException(String detail, Position position, Phase phase) {
        super(render(detail, position));
        this.detail = detail;
        this.position = position == null ? Position.NONE : position;
        this.phase = phase;
    }

    protected PromptyException(String detail, Throwable cause, Position position, Phase phase) {
        super(render(detail, position), cause);
        this.detail = detail;
        this.position = position == null ? Position.NONE : position;
        this.phase = phase;
    }

    /** Human-readable error description without the position suffix. */
    public String detail() {
        return detail;
    }

    /** Where in the template source the error occurred, or {@link Position#NONE}. */
    public Position position() {
        return position;
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }

    private static String render(String detail, Position position) {
        if (position == null || !position.isKnown()) {
            return detail;
        }
        return detail + " at " + position;
    }
}
