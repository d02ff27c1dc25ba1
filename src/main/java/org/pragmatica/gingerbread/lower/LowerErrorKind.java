package org.pragmatica.gingerbread.lower;

/**
 * Name resolution failures.
 */
public sealed interface LowerErrorKind {
    String name();

    /**
     * Short category used as the diagnostic title.
     */
    String title();

    default String message() {
        return "`" + name() + "` has not been defined";
    }

    /**
     * A bare name matched neither a variable nor a function.
     */
    record UndefinedVarOrFnc(String name) implements LowerErrorKind {
        @Override
        public String title() {
            return "undefined variable or zero-parameter function";
        }
    }

    /**
     * A name applied to arguments matched no function.
     */
    record UndefinedFnc(String name) implements LowerErrorKind {
        @Override
        public String title() {
            return "undefined function";
        }
    }

    record UndefinedTy(String name) implements LowerErrorKind {
        @Override
        public String title() {
            return "undefined type";
        }
    }
}
