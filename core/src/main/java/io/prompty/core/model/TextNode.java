package io.prompty.core.model;

import java.util.Objects;

/** Literal text emitted verbatim. Escaped delimiters have already been unescaped. */
public record TextNode(String text, Position position) implements Node {

    public TextNode {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }
}
