package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;
import org.pragmatica.gingerbread.tree.TextRange;

/**
 * Typed view of a syntax node. Wrappers hold only the node handle, so every accessor takes the
 * tree the node belongs to.
 */
public interface AstNode {
    SyntaxNode syntax();

    default TextRange range(SyntaxTree tree) {
        return syntax().range(tree);
    }

    default String text(SyntaxTree tree) {
        return syntax().text(tree);
    }
}
