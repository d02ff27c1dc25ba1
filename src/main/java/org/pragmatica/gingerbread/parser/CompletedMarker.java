package org.pragmatica.gingerbread.parser;

/**
 * A finished node, which can still be wrapped into a new parent with {@link #precede(ParsingContext)}.
 */
public record CompletedMarker(int pos) {

    /**
     * Open a new node that will enclose this one as its first child.
     *
     * <p>The enclosing start event comes later in the event log than this node's start, so the link
     * is recorded on this node and resolved by the sink.
     */
    public Marker precede(ParsingContext p) {
        return p.precede(pos);
    }
}
