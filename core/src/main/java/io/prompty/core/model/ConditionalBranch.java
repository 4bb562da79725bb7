package io.prompty.core.model;

import io.prompty.core.expr.CompiledExpression;
import java.util.List;
import java.util.Objects;

/**
 * One branch of a {@link ConditionalNode}.
 *
 * @param condition compiled {@code eval} expression, or {@code null} for the {@code else} branch
 * @param body      nodes rendered when the branch is taken
 * @param position  location of the branch tag
 */
public record ConditionalBranch(CompiledExpression condition, List<Node> body, Position position) {

    public ConditionalBranch {
        body = List.copyOf(body);
        Objects.requireNonNull(position, "position must not be null");
    }

    public boolean isFallback() {
        return condition == null;
    }
}
