package org.pragmatica.gingerbread.ast;

import org.pragmatica.gingerbread.tree.SyntaxNode;
import org.pragmatica.gingerbread.tree.SyntaxToken;
import org.pragmatica.gingerbread.tree.SyntaxTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Child lookups shared by the node wrappers. Absent children are reported as empty, never as errors.
 */
final class Children {
    private Children() {}

    static <T> Optional<T> node(SyntaxNode parent,
                                SyntaxTree tree,
                                BiFunction<SyntaxNode, SyntaxTree, Optional<T>> cast) {
        for (var child : parent.children(tree)) {
            var typed = cast.apply(child, tree);
            if (typed.isPresent()) {
                return typed;
            }
        }
        return Optional.empty();
    }

    static <T> List<T> nodes(SyntaxNode parent,
                             SyntaxTree tree,
                             BiFunction<SyntaxNode, SyntaxTree, Optional<T>> cast) {
        var result = new ArrayList<T>();
        for (var child : parent.children(tree)) {
            cast.apply(child, tree).ifPresent(result::add);
        }
        return result;
    }

    static <T> Optional<T> token(SyntaxNode parent,
                                 SyntaxTree tree,
                                 BiFunction<SyntaxToken, SyntaxTree, Optional<T>> cast) {
        for (var child : parent.childrenWithTokens(tree)) {
            if (child instanceof SyntaxToken token) {
                var typed = cast.apply(token, tree);
                if (typed.isPresent()) {
                    return typed;
                }
            }
        }
        return Optional.empty();
    }
}
