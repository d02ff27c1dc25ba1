package org.pragmatica.gingerbread.tree;

import java.util.List;
import java.util.Optional;

/**
 * Handle of an interior node: the offset of its StartNode record.
 *
 * <p>The handle itself holds no reference to the tree; every query takes the tree it came from.
 */
public record SyntaxNode(int offset) implements SyntaxElement {

    public NodeKind kind(SyntaxTree tree) {
        return tree.nodeKind(offset);
    }

    @Override
    public TextRange range(SyntaxTree tree) {
        return tree.nodeRange(offset);
    }

    /**
     * Full text of the node, trivia included.
     */
    @Override
    public String text(SyntaxTree tree) {
        return tree.text(range(tree));
    }

    public List<SyntaxNode> children(SyntaxTree tree) {
        return tree.children(offset);
    }

    public List<SyntaxElement> childrenWithTokens(SyntaxTree tree) {
        return tree.childrenWithTokens(offset);
    }

    /**
     * This node and every node below it, in pre-order.
     */
    public List<SyntaxNode> descendants(SyntaxTree tree) {
        return tree.descendants(offset);
    }

    /**
     * Every token below this node, in source order.
     */
    public List<SyntaxToken> descendantTokens(SyntaxTree tree) {
        return tree.descendantTokens(offset);
    }

    public Optional<SyntaxNode> parent(SyntaxTree tree) {
        return tree.parentOf(offset);
    }
}
