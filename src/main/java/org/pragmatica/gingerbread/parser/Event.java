package org.pragmatica.gingerbread.parser;

import org.pragmatica.gingerbread.tree.NodeKind;

/**
 * Parser action recorded during the grammar walk and replayed into the tree by {@link Sink}.
 */
sealed interface Event {
    int NO_FORWARD_PARENT = -1;

    /**
     * Start of a node whose kind is not known yet, or a start already folded into a parent chain.
     */
    record Placeholder() implements Event {}

    /**
     * Start of a node. {@code forwardParent} is the index of a later start event whose node must
     * enclose this one, set by {@link CompletedMarker#precede(ParsingContext)}.
     */
    record StartNode(NodeKind kind, int forwardParent) implements Event {
        boolean hasForwardParent() {
            return forwardParent != NO_FORWARD_PARENT;
        }
    }

    /**
     * Consumption of the next non-trivia token.
     */
    record AddToken() implements Event {}

    record FinishNode() implements Event {}
}
