package org.pragmatica.gingerbread;

import org.pragmatica.gingerbread.lower.InScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Interactive session accumulating definitions line by line.
 *
 * <p>A session is an immutable value: {@link #feed(String)} returns the next session and leaves
 * this one untouched, so any earlier state can be resumed.
 */
public final class ReplSession {
    private static final Logger log = LoggerFactory.getLogger(ReplSession.class);

    private final Frontend frontend;
    private final InScope inScope;
    private final int linesFed;

    private ReplSession(Frontend frontend, InScope inScope, int linesFed) {
        this.frontend = frontend;
        this.inScope = inScope;
        this.linesFed = linesFed;
    }

    public static ReplSession start() {
        return start(Frontend.create());
    }

    public static ReplSession start(Frontend frontend) {
        return new ReplSession(frontend, InScope.empty(), 0);
    }

    /**
     * Outcome of feeding one line: its analysis and the session to continue with.
     */
    public record ReplStep(Analysis analysis, ReplSession next) {}

    /**
     * Analyse {@code line} with everything defined by earlier lines in scope.
     */
    public ReplStep feed(String line) {
        var analysis = frontend.replLine(line, inScope);
        var next = new ReplSession(frontend, analysis.lowerResult().toInScope(), linesFed + 1);
        if (log.isDebugEnabled()) {
            log.debug("Line {}: {} function name(s), {} variable name(s), {} expression(s) in scope",
                      next.linesFed,
                      next.inScope.fncNames().size(),
                      next.inScope.varNames().size(),
                      next.inScope.program().exprs().size());
        }
        return new ReplStep(analysis, next);
    }

    public InScope inScope() {
        return inScope;
    }

    public int linesFed() {
        return linesFed;
    }
}
