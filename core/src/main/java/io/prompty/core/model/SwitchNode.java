package io.prompty.core.model;

import io.prompty.core.expr.CompiledExpression;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@code prompty.switch} block. Cases are tried in order; the first match wins.
 *
 * @param expression  the switch expression, evaluated once
 * @param cases       cases in source order
 * @param defaultBody body of {@code prompty.casedefault}, or {@code null} if absent
 * @param attributes  attributes of the {@code switch} tag
 * @param rawSource   exact source text of the switch
 * @param position    location of the {@code switch} tag
 */
public record SwitchNode(
        CompiledExpression expression,
        List<SwitchCase> cases,
        List<Node> defaultBody,
        Attributes attributes,
        String rawSource,
        Position position)
        implements Node {

    public SwitchNode {
        Objects.requireNonNull(expression, "expression must not be null");
        cases = List.copyOf(cases);
        defaultBody = defaultBody == null ? null : List.copyOf(defaultBody);
        Objects.requireNonNull(attributes, "attributes must not be null");
        Objects.requireNonNull(rawSource, "rawSource must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }

    public Optional<List<Node>> fallback() {
        return Optional.ofNullable(defaultBody);
    }
}
