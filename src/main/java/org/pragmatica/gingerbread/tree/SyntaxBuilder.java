package org.pragmatica.gingerbread.tree;

import org.pragmatica.gingerbread.lexer.TokenKind;

import java.util.Arrays;

/**
 * Append-only writer of the packed syntax tree.
 *
 * <p>The buffer starts with the input text, byte for byte. Node and token records follow it:
 * <pre>
 * StartNode:  tag | finishPos:u32 | start:u32 | end:u32
 * AddToken:   tag | start:u32 | end:u32
 * FinishNode: 0xFF
 * </pre>
 * All integers are little-endian. {@code finishPos} and {@code end} of a node are written as
 * placeholders and patched by {@link #finishNode()}.
 */
public final class SyntaxBuilder {
    private static final int FINISH_NODE_POS_PLACEHOLDER = 0;
    private static final int NO_ROOT = -1;

    private byte[] data;
    private int size;
    private int root;
    private int currentLen;
    private int[] openNodes;
    private int openCount;

    private SyntaxBuilder(byte[] text) {
        this.data = Arrays.copyOf(text, Math.max(16, text.length * 2 + 64));
        this.size = text.length;
        this.root = NO_ROOT;
        this.currentLen = 0;
        this.openNodes = new int[16];
        this.openCount = 0;
    }

    public static SyntaxBuilder create(byte[] text) {
        return new SyntaxBuilder(text);
    }

    public void startNode(NodeKind kind) {
        if (root == NO_ROOT) {
            root = size;
        } else if (openCount == 0) {
            throw new IllegalStateException("Tree already has a finished root node");
        }
        pushOpenNode(size);
        reserve(Tags.START_NODE_SIZE);
        data[size] = Tags.nodeTag(kind);
        writeInt(size + 1, FINISH_NODE_POS_PLACEHOLDER);
        writeInt(size + 5, currentLen);
        writeInt(size + 9, currentLen);
        size += Tags.START_NODE_SIZE;
    }

    public void addToken(TokenKind kind, TextRange range) {
        if (openCount == 0) {
            throw new IllegalStateException("Token " + kind + " added outside of any node");
        }
        currentLen = range.end();
        reserve(Tags.ADD_TOKEN_SIZE);
        data[size] = Tags.tokenTag(kind);
        writeInt(size + 1, range.start());
        writeInt(size + 5, range.end());
        size += Tags.ADD_TOKEN_SIZE;
    }

    public void finishNode() {
        if (openCount == 0) {
            throw new IllegalStateException("No open node to finish");
        }
        int startNodeIdx = openNodes[--openCount];
        int finishNodePos = size;

        reserve(Tags.FINISH_NODE_SIZE);
        data[size] = (byte) Tags.FINISH_NODE_TAG;
        size += Tags.FINISH_NODE_SIZE;

        writeInt(startNodeIdx + 1, finishNodePos);
        writeInt(startNodeIdx + 9, currentLen);
    }

    /**
     * Freeze the buffer into an immutable tree. Every started node must have been finished.
     */
    public SyntaxTree finish() {
        if (root == NO_ROOT) {
            throw new IllegalStateException("Tree has no root node");
        }
        if (openCount != 0) {
            throw new IllegalStateException(openCount + " node(s) left open");
        }
        return new SyntaxTree(Arrays.copyOf(data, size), root);
    }

    private void pushOpenNode(int idx) {
        if (openCount == openNodes.length) {
            openNodes = Arrays.copyOf(openNodes, openCount * 2);
        }
        openNodes[openCount++] = idx;
    }

    private void reserve(int additional) {
        if (size + additional > data.length) {
            data = Arrays.copyOf(data, Math.max(data.length * 2, size + additional));
        }
    }

    private void writeInt(int idx, int value) {
        data[idx] = (byte) value;
        data[idx + 1] = (byte) (value >>> 8);
        data[idx + 2] = (byte) (value >>> 16);
        data[idx + 3] = (byte) (value >>> 24);
    }
}
