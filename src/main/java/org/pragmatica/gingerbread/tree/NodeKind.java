package org.pragmatica.gingerbread.tree;

/**
 * Kinds of interior nodes in the syntax tree.
 */
public enum NodeKind {
    ROOT,
    FNC_DEF,
    PARAM_LIST,
    PARAM,
    RET_TY,
    TY,
    LOCAL_DEF,
    EXPR_STMT,
    BIN_EXPR,
    BLOCK,
    FNC_CALL,
    ARG_LIST,
    ARG,
    INT_LITERAL,
    STRING_LITERAL,
    PAREN_EXPR,
    ERROR;

    private static final NodeKind[] VALUES = values();

    static NodeKind fromOrdinal(int ordinal) {
        return VALUES[ordinal];
    }

    /**
     * Name used by the debug tree dump, e.g. {@code BinExpr}.
     */
    public String displayName() {
        return Tags.camelCase(name());
    }
}
