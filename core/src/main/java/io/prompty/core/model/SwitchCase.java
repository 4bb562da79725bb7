package io.prompty.core.model;

import io.prompty.core.expr.CompiledExpression;
import java.util.List;
import java.util.Objects;

/**
 * One {@code prompty.case} of a {@link SwitchNode}. Exactly one of {@code value} and
 * {@code condition} is set.
 */
public record SwitchCase(String value, CompiledExpression condition, List<Node> body, Position position) {

    public SwitchCase {
        if ((value == null) == (condition == null)) {
            throw new IllegalArgumentException("exactly one of value or condition must be set");
        }
        body = List.copyOf(body);
        Objects.requireNonNull(position, "position must not be null");
    }
}
