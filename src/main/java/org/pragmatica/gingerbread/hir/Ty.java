package org.pragmatica.gingerbread.hir;

public enum Ty {
    /**
     * Placeholder for a type that could not be resolved.
     */
    UNKNOWN,
    S32,
    STRING,
    UNIT
}
