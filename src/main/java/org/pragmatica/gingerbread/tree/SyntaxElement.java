package org.pragmatica.gingerbread.tree;

/**
 * Either a node or a token, as returned by {@link SyntaxNode#childrenWithTokens(SyntaxTree)}.
 */
public sealed interface SyntaxElement permits SyntaxNode, SyntaxToken {

    /**
     * Byte offset of the record in the packed buffer.
     */
    int offset();

    TextRange range(SyntaxTree tree);

    String text(SyntaxTree tree);
}
