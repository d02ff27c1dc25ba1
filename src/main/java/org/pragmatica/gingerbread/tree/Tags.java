package org.pragmatica.gingerbread.tree;

import org.pragmatica.gingerbread.lexer.TokenKind;

/**
 * Tag byte layout of the packed tree.
 *
 * <p>Token tags occupy {@code [0, TOKEN_KINDS)}, node tags start right after a one-slot gap,
 * and {@code 0xFF} marks the end of a node. The three ranges never overlap.
 */
final class Tags {
    static final int TOKEN_KINDS = TokenKind.values().length;
    static final int FIRST_NODE_TAG = TOKEN_KINDS + 1;
    static final int FINISH_NODE_TAG = 0xFF;

    static final int START_NODE_SIZE = 1 + 4 + 4 + 4;
    static final int ADD_TOKEN_SIZE = 1 + 4 + 4;
    static final int FINISH_NODE_SIZE = 1;

    private static final TokenKind[] TOKEN_VALUES = TokenKind.values();

    static {
        if (FIRST_NODE_TAG + NodeKind.values().length >= FINISH_NODE_TAG) {
            throw new ExceptionInInitializerError("Too many syntax kinds for a one-byte tag");
        }
    }

    private Tags() {}

    static byte nodeTag(NodeKind kind) {
        return (byte) (FIRST_NODE_TAG + kind.ordinal());
    }

    static byte tokenTag(TokenKind kind) {
        return (byte) kind.ordinal();
    }

    static boolean isStartNode(int tag) {
        return tag >= FIRST_NODE_TAG && tag != FINISH_NODE_TAG;
    }

    static boolean isAddToken(int tag) {
        return tag < TOKEN_KINDS;
    }

    static boolean isFinishNode(int tag) {
        return tag == FINISH_NODE_TAG;
    }

    static NodeKind nodeKind(int tag) {
        return NodeKind.fromOrdinal(tag - FIRST_NODE_TAG);
    }

    static TokenKind tokenKind(int tag) {
        return TOKEN_VALUES[tag];
    }

    static String camelCase(String constantName) {
        var sb = new StringBuilder(constantName.length());
        boolean upper = true;
        for (char c : constantName.toCharArray()) {
            if (c == '_') {
                upper = true;
                continue;
            }
            sb.append(upper ? c : Character.toLowerCase(c));
            upper = false;
        }
        return sb.toString();
    }
}
