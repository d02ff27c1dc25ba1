package org.pragmatica.gingerbread.parser;

import org.pragmatica.gingerbread.tree.NodeKind;

/**
 * A node that has been opened but whose kind is not decided yet.
 */
public final class Marker {
    private final int pos;
    private boolean completed;

    Marker(int pos) {
        this.pos = pos;
        this.completed = false;
    }

    /**
     * Close the node as {@code kind}. Every token consumed since {@link ParsingContext#start()}
     * becomes a descendant of it.
     */
    public CompletedMarker complete(ParsingContext p, NodeKind kind) {
        if (completed) {
            throw new IllegalStateException("Marker at event " + pos + " completed twice");
        }
        completed = true;
        p.completeAt(pos, kind);
        return new CompletedMarker(pos);
    }
}
