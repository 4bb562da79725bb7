package io.prompty.core.model;

import java.util.Objects;

/**
 * A {@code prompty.extends} declaration. Always the first significant node of its template.
 *
 * @param template   name of the registered parent template
 * @param attributes attributes of the tag
 * @param rawSource  exact source text of the tag
 * @param position   location of the tag
 */
public record ExtendsNode(String template, Attributes attributes, String rawSource, Position position)
        implements Node {

    public ExtendsNode {
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(attributes, "attributes must not be null");
        Objects.requireNonNull(rawSource, "rawSource must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }
}
