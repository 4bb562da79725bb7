package io.prompty.core.model;

import java.util.Objects;

/** Body of a {@code prompty.raw} block, captured exactly as written. */
public record RawNode(String text, Position position) implements Node {

    public RawNode {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }
}
