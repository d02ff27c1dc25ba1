package org.pragmatica.gingerbread.lower;

import org.pragmatica.gingerbread.hir.FncDef;
import org.pragmatica.gingerbread.hir.Idx;
import org.pragmatica.gingerbread.hir.Program;
import org.pragmatica.gingerbread.hir.VarDefId;

import java.util.Map;

/**
 * Everything defined by earlier lowering calls that a new call should see: the program built so
 * far and the top-level names bound in it.
 */
public record InScope(Program program, Map<String, Idx<FncDef>> fncNames, Map<String, VarDefId> varNames) {

    public InScope {
        fncNames = Map.copyOf(fncNames);
        varNames = Map.copyOf(varNames);
    }

    public static InScope empty() {
        return new InScope(Program.empty(), Map.of(), Map.of());
    }
}
