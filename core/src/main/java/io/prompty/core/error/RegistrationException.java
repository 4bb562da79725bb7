package io.prompty.core.error;

import io.prompty.core.model.Position;

/**
 * Thrown when a resolver, function or template cannot be registered: the name is taken, uses the
 * reserved prefix, or is otherwise invalid.
 */
public final class RegistrationException extends PromptyException {

    private static final long serialVersionUID = 1L;

    private final String name;

    public RegistrationException(String detail, String name) {
        super(detail, Position.NONE, Phase.REGISTRATION);
        this.name = name;
    }

    public RegistrationException(String detail, Throwable cause, String name) {
        super(detail, cause, Position.NONE, Phase.REGISTRATION);
        this.name = name;
    }

    /** The name that could not be registered. */
    public String name() {
        return name;
    }
}
