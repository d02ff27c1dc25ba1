package org.pragmatica.gingerbread.lower;

import org.pragmatica.gingerbread.hir.FncDef;
import org.pragmatica.gingerbread.hir.Idx;
import org.pragmatica.gingerbread.hir.Program;
import org.pragmatica.gingerbread.hir.VarDefId;

import java.util.List;
import java.util.Map;

/**
 * Output of {@link Lowering}.
 *
 * @param fncNames every function name visible at the top level after this call
 * @param varNames every variable name visible at the top level after this call
 */
public record LowerResult(Program program,
                          SourceMap sourceMap,
                          List<LowerError> errors,
                          Map<String, Idx<FncDef>> fncNames,
                          Map<String, VarDefId> varNames) {

    public LowerResult {
        errors = List.copyOf(errors);
        fncNames = Map.copyOf(fncNames);
        varNames = Map.copyOf(varNames);
    }

    /**
     * Seed for lowering the next unit on top of this one.
     */
    public InScope toInScope() {
        return new InScope(program, fncNames, varNames);
    }
}
