package org.pragmatica.gingerbread.hir;

/**
 * Anything a variable reference can resolve to.
 */
public sealed interface VarDefId {
    record Local(Idx<LocalDef> id) implements VarDefId {}

    record Parameter(Idx<Param> id) implements VarDefId {}
}
