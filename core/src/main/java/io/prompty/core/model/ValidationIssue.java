package io.prompty.core.model;

import java.util.Objects;

/** A single finding reported by template validation. */
public record ValidationIssue(Severity severity, String message, Position position) {

    public ValidationIssue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }

    @Override
    public String toString() {
        return position.isKnown()
                ? severity + " at " + position + ": " + message
                : severity + ": " + message;
    }
}
