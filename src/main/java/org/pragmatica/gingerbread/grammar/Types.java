package org.pragmatica.gingerbread.grammar;

import org.pragmatica.gingerbread.lexer.TokenKind;
import org.pragmatica.gingerbread.parser.CompletedMarker;
import org.pragmatica.gingerbread.parser.ParsingContext;
import org.pragmatica.gingerbread.parser.TokenSet;
import org.pragmatica.gingerbread.tree.NodeKind;

final class Types {
    private Types() {}

    /**
     * {@code Ty = IDENT}. The node is produced even when the name is missing.
     */
    static CompletedMarker ty(ParsingContext p, TokenSet recoverySet) {
        var m = p.start();
        try (var ignored = p.expectedSyntaxName("type")) {
            p.expectWithRecoverySet(TokenKind.IDENT, recoverySet);
        }
        return m.complete(p, NodeKind.TY);
    }
}
