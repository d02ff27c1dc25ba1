package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.SyntaxToken;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

/**
 * Binary operator token.
 */
public sealed interface Op extends AstToken permits Plus, Hyphen, Asterisk, Slash {

    static Optional<Op> cast(SyntaxToken token, SyntaxTree tree) {
        return switch (token.kind(tree)) {
            case PLUS -> Optional.of(new Plus(token));
            case HYPHEN -> Optional.of(new Hyphen(token));
            case ASTERISK -> Optional.of(new Asterisk(token));
            case SLASH -> Optional.of(new Slash(token));
            default -> Optional.empty();
        };
    }
}
