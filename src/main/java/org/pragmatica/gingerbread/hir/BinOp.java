package org.pragmatica.gingerbread.hir;

public enum BinOp {
    ADD,
    SUB,
    MUL,
    DIV
}
