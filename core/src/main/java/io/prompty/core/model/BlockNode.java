package io.prompty.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A named {@code prompty.block}. Renders its own body unless a template extending this one
 * supplies a block of the same name.
 *
 * @param name      block name, unique within its template
 * @param body      default content
 * @param rawSource exact source text of the block
 * @param position  location of the {@code block} tag
 */
public record BlockNode(String name, List<Node> body, String rawSource, Position position) implements Node {

    public BlockNode {
        Objects.requireNonNull(name, "name must not be null");
        body = List.copyOf(body);
        Objects.requireNonNull(rawSource, "rawSource must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }
}
