package io.prompty.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A {@code prompty.for} loop.
 *
 * @param item           variable bound to the current element
 * @param index          variable bound to the zero-based index, or {@code null}
 * @param collectionPath dotted path of the collection to iterate
 * @param limit          user limit on iterations, or {@code -1} when absent
 * @param body           nodes rendered for each element
 * @param attributes     attributes of the {@code for} tag
 * @param rawSource      exact source text of the loop
 * @param position       location of the {@code for} tag
 */
public record LoopNode(
        String item,
        String index,
        String collectionPath,
        int limit,
        List<Node> body,
        Attributes attributes,
        String rawSource,
        Position position)
        implements Node {

    public LoopNode {
        Objects.requireNonNull(item, "item must not be null");
        Objects.requireNonNull(collectionPath, "collectionPath must not be null");
        if (limit < -1) {
            throw new IllegalArgumentException("limit must be -1 or non-negative, got: " + limit);
        }
        body = List.copyOf(body);
        Objects.requireNonNull(attributes, "attributes must not be null");
        Objects.requireNonNull(rawSource, "rawSource must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }

    public Optional<String> indexName() {
        return Optional.ofNullable(index);
    }

    public OptionalInt userLimit() {
        return limit < 0 ? OptionalInt.empty() : OptionalInt.of(limit);
    }
}
