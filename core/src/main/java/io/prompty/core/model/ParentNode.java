package io.prompty.core.model;

import java.util.Objects;

/** A {@code prompty.parent} call: the content of the block definition being overridden. */
public record ParentNode(Position position) implements Node {

    public ParentNode {
        Objects.requireNonNull(position, "position must not be null");
    }
}
