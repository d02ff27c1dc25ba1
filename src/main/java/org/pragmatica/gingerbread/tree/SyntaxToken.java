package org.pragmatica.gingerbread.tree;

import org.pragmatica.gingerbread.lexer.TokenKind;

import java.util.Optional;

/**
 * Handle of a token: the offset of its AddToken record.
 */
public record SyntaxToken(int offset) implements SyntaxElement {

    public TokenKind kind(SyntaxTree tree) {
        return tree.tokenKind(offset);
    }

    @Override
    public TextRange range(SyntaxTree tree) {
        return tree.tokenRange(offset);
    }

    @Override
    public String text(SyntaxTree tree) {
        return tree.text(range(tree));
    }

    public Optional<SyntaxNode> parent(SyntaxTree tree) {
        return tree.parentOf(offset);
    }
}
