package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.SyntaxToken;
import org.pragmatica.gingerbread.tree.SyntaxTree;
import org.pragmatica.gingerbread.tree.TextRange;

/**
 * Typed view of a syntax token.
 */
public interface AstToken {
    SyntaxToken syntax();

    default TextRange range(SyntaxTree tree) {
        return syntax().range(tree);
    }

    default String text(SyntaxTree tree) {
        return syntax().text(tree);
    }
}
