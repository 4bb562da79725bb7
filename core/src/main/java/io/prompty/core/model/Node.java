package io.prompty.core.model;

/**
 * A node of a parsed template. The set of variants is closed; the executor switches over them.
 * Nodes own their children and hold no reference to their parent.
 */
public sealed interface Node permits TextNode,
        TagNode,
        RawNode,
        ConditionalNode,
        LoopNode,
        SwitchNode,
        BlockNode,
        ExtendsNode,
        ParentNode {

    /** Where the node starts in template source. */
    Position position();
}
