package org.pragmatica.gingerbread.hir;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ProgramTest {

    @Test
    void arenas_cannotBeGrownThroughProgram() {
        var exprs = Arena.<Expr>of(new Expr.IntLiteral(1));
        var program = new Program(Arena.create(), Arena.create(), Arena.create(), exprs,
                                  List.of(), List.of(), Optional.empty());

        exprs.alloc(new Expr.IntLiteral(2));
        program.exprs().alloc(new Expr.IntLiteral(3));
        program.params().alloc(new Param(Ty.S32));

        assertEquals(1, program.exprs().size());
        assertEquals(0, program.params().size());
        assertEquals(new Expr.IntLiteral(1), program.expr(Idx.of(0)));
    }

    @Test
    void equality_followsContents() {
        var first = new Program(Arena.create(), Arena.create(), Arena.of(new Param(Ty.STRING)), Arena.create(),
                                List.of(), List.of(), Optional.empty());
        var second = new Program(Arena.create(), Arena.create(), Arena.of(new Param(Ty.STRING)), Arena.create(),
                                 List.of(), List.of(), Optional.empty());

        assertEquals(first, second);
        assertNotEquals(Program.empty(), first);
    }
}
