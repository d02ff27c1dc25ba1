package org.pragmatica.gingerbread.hir;

public record Param(Ty ty) {}
