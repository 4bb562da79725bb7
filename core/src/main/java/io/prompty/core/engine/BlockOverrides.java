package io.prompty.core.engine;

import io.prompty.core.model.BlockNode;
import io.prompty.core.model.Node;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Block definitions contributed by the templates of an extends chain, most derived first. Only
 * blocks at the root of an extending template count as overrides.
 */
final class BlockOverrides {

    static final BlockOverrides NONE = new BlockOverrides(Map.of());

    private final Map<String, List<List<Node>>> definitions;

    private BlockOverrides(Map<String, List<List<Node>>> definitions) {
        this.definitions = definitions;
    }

    /** Adds the root blocks of {@code childNodes} behind the definitions already collected. */
    BlockOverrides extendWith(List<Node> childNodes) {
        Map<String, List<List<Node>>> merged = new HashMap<>(definitions);
        for (Node node : childNodes) {
            if (node instanceof BlockNode block) {
                List<List<Node>> chain = new ArrayList<>(merged.getOrDefault(block.name(), List.of()));
                chain.add(block.body());
                merged.put(block.name(), List.copyOf(chain));
            }
        }
        return new BlockOverrides(Map.copyOf(merged));
    }

    /** Every definition of {@code block}, ending with the block's own body. */
    List<List<Node>> definitionsOf(BlockNode block) {
        List<List<Node>> chain = new ArrayList<>(definitions.getOrDefault(block.name(), List.of()));
        chain.add(block.body());
        return chain;
    }
}
