package org.pragmatica.gingerbread.hir;

public sealed interface Def {
    record Fnc(Idx<FncDef> id) implements Def {}
}
