package io.prompty.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An {@code if}/{@code elseif}/{@code else} chain. At most one branch has no condition and it is
 * always the last one.
 *
 * @param branches   branches in source order
 * @param attributes attributes of the opening {@code if} tag, used for error handling
 * @param rawSource  exact source text of the whole chain
 * @param position   location of the opening {@code if} tag
 */
public record ConditionalNode(List<ConditionalBranch> branches, Attributes attributes, String rawSource, Position position)
        implements Node {

    public ConditionalNode {
        branches = List.copyOf(branches);
        if (branches.isEmpty()) {
            throw new IllegalArgumentException("branches must not be empty");
        }
        for (int i = 0; i < branches.size() - 1; i++) {
            if (branches.get(i).isFallback()) {
                throw new IllegalArgumentException("fallback branch must be last");
            }
        }
        Objects.requireNonNull(attributes, "attributes must not be null");
        Objects.requireNonNull(rawSource, "rawSource must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }
}
