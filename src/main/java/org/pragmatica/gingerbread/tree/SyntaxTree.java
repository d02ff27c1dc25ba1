package org.pragmatica.gingerbread.tree;

import org.pragmatica.gingerbread.lexer.TokenKind;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable packed syntax tree produced by {@link SyntaxBuilder#finish()}.
 *
 * <p>Nodes and tokens are addressed by their byte offset in the buffer, wrapped in
 * {@link SyntaxNode} and {@link SyntaxToken}. Those handles stay valid for the lifetime of the
 * tree and can be shared between threads freely, since the tree is never written again.
 */
public final class SyntaxTree {
    private final byte[] data;
    private final int root;

    SyntaxTree(byte[] data, int root) {
        this.data = data;
        this.root = root;
    }

    public SyntaxNode root() {
        return new SyntaxNode(root);
    }

    /**
     * Length in bytes of the UTF-8 encoded source text held at the head of the buffer.
     */
    public int textLength() {
        return root;
    }

    /**
     * Total size of the packed representation, text included.
     */
    public int byteSize() {
        return data.length;
    }

    public String text() {
        return text(0, root);
    }

    public String text(TextRange range) {
        return text(range.start(), range.end());
    }

    String text(int start, int end) {
        return new String(data, start, end - start, StandardCharsets.UTF_8);
    }

    // === Record access ===

    int tagAt(int idx) {
        return data[idx] & 0xFF;
    }

    boolean isStartNode(int idx) {
        return Tags.isStartNode(tagAt(idx));
    }

    boolean isAddToken(int idx) {
        return Tags.isAddToken(tagAt(idx));
    }

    boolean isFinishNode(int idx) {
        return Tags.isFinishNode(tagAt(idx));
    }

    NodeKind nodeKind(int idx) {
        checkStartNode(idx);
        return Tags.nodeKind(tagAt(idx));
    }

    int finishNodePos(int idx) {
        checkStartNode(idx);
        return readInt(idx + 1);
    }

    TextRange nodeRange(int idx) {
        checkStartNode(idx);
        return TextRange.of(readInt(idx + 5), readInt(idx + 9));
    }

    TokenKind tokenKind(int idx) {
        checkAddToken(idx);
        return Tags.tokenKind(tagAt(idx));
    }

    TextRange tokenRange(int idx) {
        checkAddToken(idx);
        return TextRange.of(readInt(idx + 1), readInt(idx + 5));
    }

    private int readInt(int idx) {
        return (data[idx] & 0xFF)
               | (data[idx + 1] & 0xFF) << 8
               | (data[idx + 2] & 0xFF) << 16
               | (data[idx + 3] & 0xFF) << 24;
    }

    private void checkStartNode(int idx) {
        if (idx < root || idx >= data.length || !isStartNode(idx)) {
            throw new IllegalArgumentException("No node starts at offset " + idx);
        }
    }

    private void checkAddToken(int idx) {
        if (idx < root || idx >= data.length || !isAddToken(idx)) {
            throw new IllegalArgumentException("No token starts at offset " + idx);
        }
    }

    // === Navigation ===

    List<SyntaxNode> children(int idx) {
        var result = new ArrayList<SyntaxNode>();
        int end = finishNodePos(idx);
        int i = idx + Tags.START_NODE_SIZE;
        while (i < end) {
            if (isStartNode(i)) {
                result.add(new SyntaxNode(i));
                i = finishNodePos(i) + Tags.FINISH_NODE_SIZE;
            } else {
                i += Tags.ADD_TOKEN_SIZE;
            }
        }
        return result;
    }

    List<SyntaxElement> childrenWithTokens(int idx) {
        var result = new ArrayList<SyntaxElement>();
        int end = finishNodePos(idx);
        int i = idx + Tags.START_NODE_SIZE;
        while (i < end) {
            if (isStartNode(i)) {
                result.add(new SyntaxNode(i));
                i = finishNodePos(i) + Tags.FINISH_NODE_SIZE;
            } else {
                result.add(new SyntaxToken(i));
                i += Tags.ADD_TOKEN_SIZE;
            }
        }
        return result;
    }

    List<SyntaxNode> descendants(int idx) {
        var result = new ArrayList<SyntaxNode>();
        int end = finishNodePos(idx);
        int i = idx;
        while (i < end) {
            if (isStartNode(i)) {
                result.add(new SyntaxNode(i));
                i += Tags.START_NODE_SIZE;
            } else if (isAddToken(i)) {
                i += Tags.ADD_TOKEN_SIZE;
            } else {
                i += Tags.FINISH_NODE_SIZE;
            }
        }
        return result;
    }

    List<SyntaxToken> descendantTokens(int idx) {
        var result = new ArrayList<SyntaxToken>();
        int end = finishNodePos(idx);
        int i = idx;
        while (i < end) {
            if (isStartNode(i)) {
                i += Tags.START_NODE_SIZE;
            } else if (isAddToken(i)) {
                result.add(new SyntaxToken(i));
                i += Tags.ADD_TOKEN_SIZE;
            } else {
                i += Tags.FINISH_NODE_SIZE;
            }
        }
        return result;
    }

    /**
     * Records carry no back references, so the parent is found by walking down from the root.
     */
    Optional<SyntaxNode> parentOf(int target) {
        var open = new ArrayDeque<Integer>();
        int i = root;
        while (i < data.length) {
            if (i == target) {
                return Optional.ofNullable(open.peek()).map(SyntaxNode::new);
            }
            if (isStartNode(i)) {
                open.push(i);
                i += Tags.START_NODE_SIZE;
            } else if (isAddToken(i)) {
                i += Tags.ADD_TOKEN_SIZE;
            } else {
                open.pop();
                i += Tags.FINISH_NODE_SIZE;
            }
        }
        return Optional.empty();
    }

    // === Debugging ===

    /**
     * Indented dump of the whole tree, one node or token per line.
     */
    public String debugTree() {
        var sb = new StringBuilder();
        int indentation = 0;
        int i = root;
        while (i < data.length) {
            if (isFinishNode(i)) {
                indentation--;
                i += Tags.FINISH_NODE_SIZE;
                continue;
            }
            sb.append("  ".repeat(indentation));
            if (isStartNode(i)) {
                sb.append(nodeKind(i).displayName())
                  .append('@')
                  .append(nodeRange(i))
                  .append('\n');
                indentation++;
                i += Tags.START_NODE_SIZE;
            } else {
                var range = tokenRange(i);
                sb.append(Tags.camelCase(tokenKind(i).name()))
                  .append('@')
                  .append(range)
                  .append(' ')
                  .append(quote(text(range)))
                  .append('\n');
                i += Tags.ADD_TOKEN_SIZE;
            }
        }
        return sb.toString();
    }

    private static String quote(String text) {
        var sb = new StringBuilder(text.length() + 2).append('"');
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public String toString() {
        return "SyntaxTree[textLength=" + root + ", byteSize=" + data.length + "]";
    }
}
