package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.NodeKind;
import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.Optional;

public record IntLiteral(SyntaxNode syntax) implements Expr {

    public static Optional<IntLiteral> cast(SyntaxNode node, SyntaxTree tree) {
        return node.kind(tree) == NodeKind.INT_LITERAL
               ? Optional.of(new IntLiteral(node))
               : Optional.empty();
    }

    public Optional<Int> value(SyntaxTree tree) {
        return Children.token(syntax, tree, Int::cast);
    }
}
