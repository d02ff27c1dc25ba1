package org.pragmatica.gingerbread.lower;

import org.pragmatica.gingerbread.ast.Root;
import org.pragmatica.gingerbread.tree.SyntaxTree;

/**
 * Lowers the typed syntax tree into the arena based program representation, resolving every name
 * on the way.
 *
 * <p>Lowering never fails: unresolvable names are reported as {@link LowerError}s and replaced with
 * placeholders, so the returned program is always complete.
 */
public final class Lowering {
    private Lowering() {}

    public static LowerResult lower(Root root, SyntaxTree tree) {
        return lower(root, tree, InScope.empty());
    }

    /**
     * Lower {@code root} on top of the program and names of earlier calls. {@code inScope} is not
     * modified; the result holds extended copies.
     */
    public static LowerResult lower(Root root, SyntaxTree tree, InScope inScope) {
        return new LowerContext(tree, inScope).lowerRoot(root);
    }
}
