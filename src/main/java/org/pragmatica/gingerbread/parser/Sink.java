package org.pragmatica.gingerbread.parser;

import org.pragmatica.gingerbread.lexer.Token;
import org.pragmatica.gingerbread.parser.Event.AddToken;
import org.pragmatica.gingerbread.parser.Event.FinishNode;
import org.pragmatica.gingerbread.parser.Event.Placeholder;
import org.pragmatica.gingerbread.parser.Event.StartNode;
import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxBuilder;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Replays parser events into a {@link SyntaxBuilder}, weaving the trivia back in.
 *
 * <p>Leading trivia goes to the enclosing node of whatever starts after it, trailing trivia stays
 * with the node of the token before it. Trivia left over at the end belongs to the root.
 */
final class Sink {
    private static final Placeholder CONSUMED = new Placeholder();

    private final List<Token> tokens;
    private final List<Event> events;
    private final SyntaxBuilder builder;
    private int cursor;

    Sink(byte[] text, List<Token> tokens, List<Event> events) {
        this.tokens = tokens;
        this.events = events;
        this.builder = SyntaxBuilder.create(text);
        this.cursor = 0;
    }

    SyntaxTree finish() {
        var kinds = new ArrayList<NodeKind>();
        for (int idx = 0; idx < events.size(); idx++) {
            var event = events.set(idx, CONSUMED);
            if (event instanceof StartNode start) {
                collectForwardParents(start, kinds);
                for (int i = kinds.size() - 1; i >= 0; i--) {
                    if (idx != 0) {
                        eatTrivia();
                    }
                    builder.startNode(kinds.get(i));
                }
                kinds.clear();
            } else if (event instanceof AddToken) {
                eatTrivia();
                addNextToken();
                eatTrivia();
            } else if (event instanceof FinishNode) {
                if (idx == events.size() - 1) {
                    eatTrivia();
                }
                builder.finishNode();
            }
        }
        return builder.finish();
    }

    /**
     * Node kinds of {@code start} and of every node chained to it through forward parents,
     * innermost first. Each chained start event is consumed so it is not replayed twice.
     */
    private void collectForwardParents(StartNode start, List<NodeKind> kinds) {
        kinds.add(start.kind());
        var current = start;
        while (current.hasForwardParent()) {
            var parent = events.set(current.forwardParent(), CONSUMED);
            if (!(parent instanceof StartNode next)) {
                throw new IllegalStateException("Forward parent " + current.forwardParent() + " is not a node start");
            }
            kinds.add(next.kind());
            current = next;
        }
    }

    private void eatTrivia() {
        while (cursor < tokens.size() && tokens.get(cursor).isTrivia()) {
            addNextToken();
        }
    }

    private void addNextToken() {
        var token = tokens.get(cursor++);
        builder.addToken(token.kind(), token.range());
    }
}
