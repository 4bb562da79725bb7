package io.prompty.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A tag dispatched to a resolver at execution time.
 *
 * @param name        tag name as written
 * @param attributes  tag attributes in source order
 * @param children    body nodes; empty for self-closing tags
 * @param selfClosing whether the tag was written in self-closing form
 * @param rawSource   exact source text of the tag including its body and close tag
 * @param position    location of the opening delimiter
 */
public record TagNode(
        String name,
        Attributes attributes,
        List<Node> children,
        boolean selfClosing,
        String rawSource,
        Position position)
        implements Node {

    public TagNode {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(attributes, "attributes must not be null");
        children = List.copyOf(children);
        Objects.requireNonNull(rawSource, "rawSource must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }
}
