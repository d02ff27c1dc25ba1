package org.pragmatica.gingerbread.parser;

import org.pragmatica.gingerbread.lexer.Token;
import org.pragmatica.gingerbread.lexer.TokenKind;
import org.pragmatica.gingerbread.parser.Event.AddToken;
import org.pragmatica.gingerbread.parser.Event.FinishNode;
import org.pragmatica.gingerbread.parser.Event.Placeholder;
import org.pragmatica.gingerbread.parser.Event.StartNode;
import org.pragmatica.gingerbread.parser.SyntaxErrorKind.Missing;
import org.pragmatica.gingerbread.parser.SyntaxErrorKind.NestingTooDeep;
import org.pragmatica.gingerbread.parser.SyntaxErrorKind.Unexpected;
import org.pragmatica.gingerbread.tree.NodeKind;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable parsing state shared by the grammar rules of a single parse.
 *
 * <p>Rules look at the upcoming non-trivia token, consume it, and open or close nodes through
 * {@link Marker}s. Nothing is built directly: every action is recorded as an event and the tree
 * is assembled by {@link #finish(byte[])}.
 */
public final class ParsingContext {
    /**
     * Tokens that a failed {@code expect} never swallows, so the enclosing rule can resume on them.
     */
    public static final TokenSet DEFAULT_RECOVERY_SET = TokenSet.of(TokenKind.LET_KW,
                                                                    TokenKind.FNC_KW,
                                                                    TokenKind.SEMICOLON,
                                                                    TokenKind.R_BRACE);

    private final List<Token> tokens;
    private final Source source;
    private final ParserConfig config;
    private final List<Event> events;
    private final List<SyntaxError> errors;

    // Expected-syntax tracking, reset whenever a token is consumed
    private final Set<TokenKind> expectedKinds;
    private boolean trackingExpected;
    private String expectedSyntaxName;
    private int expectedSyntaxNamePosition;

    private int depth;

    private ParsingContext(List<Token> tokens, ParserConfig config) {
        this.tokens = tokens;
        this.source = new Source(tokens);
        this.config = config;
        this.events = new ArrayList<>();
        this.errors = new ArrayList<>();
        this.expectedKinds = new LinkedHashSet<>();
        this.trackingExpected = true;
        this.expectedSyntaxName = null;
        this.expectedSyntaxNamePosition = -1;
        this.depth = 0;
    }

    public static ParsingContext create(List<Token> tokens, ParserConfig config) {
        return new ParsingContext(tokens, config);
    }

    /**
     * Scope opened by one of the tracking methods; closing it restores the previous state.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    // === Node Construction ===

    public Marker start() {
        int pos = events.size();
        events.add(new Placeholder());
        return new Marker(pos);
    }

    void completeAt(int pos, NodeKind kind) {
        events.set(pos, new StartNode(kind, Event.NO_FORWARD_PARENT));
        events.add(new FinishNode());
    }

    Marker precede(int pos) {
        var marker = start();
        var event = events.get(pos);
        if (!(event instanceof StartNode startNode)) {
            throw new IllegalStateException("Event " + pos + " is not a completed node");
        }
        events.set(pos, new StartNode(startNode.kind(), events.size() - 1));
        return marker;
    }

    // === Token Access ===

    public boolean at(TokenKind kind) {
        if (trackingExpected) {
            expectedKinds.add(kind);
        }
        return source.peekKind()
                     .map(found -> found == kind)
                     .orElse(false);
    }

    public boolean atSet(TokenSet set) {
        if (trackingExpected) {
            expectedKinds.addAll(set.kinds());
        }
        return source.peekKind()
                     .map(set::contains)
                     .orElse(false);
    }

    public boolean atEof() {
        return source.peekKind().isEmpty();
    }

    /**
     * Kind of the upcoming non-trivia token without recording it as expected.
     */
    public Optional<TokenKind> peek() {
        return source.peekKind();
    }

    /**
     * Precondition check for rules entered only on a specific token. Does not record the kind as
     * expected.
     *
     * @throws IllegalStateException if the upcoming token is not of the given kind
     */
    public void requireAt(TokenKind kind) {
        var found = source.peekKind();
        if (found.filter(k -> k == kind).isEmpty()) {
            throw new IllegalStateException("Expected " + kind + " but found "
                                            + found.map(String::valueOf).orElse("end of input"));
        }
    }

    /**
     * Consume the upcoming token into the currently open node.
     *
     * @throws IllegalStateException at end of input
     */
    public void bump() {
        source.bump();
        expectedKinds.clear();
        events.add(new AddToken());
    }

    // === Expecting and Recovery ===

    public void expect(TokenKind kind) {
        expectWithRecoverySet(kind, TokenSet.EMPTY);
    }

    /**
     * Consume a token of the given kind, or record an error naming that kind. Tokens in
     * {@code recoverySet} or in {@link #DEFAULT_RECOVERY_SET} are left for the caller; anything else
     * is consumed into an {@link NodeKind#ERROR} node.
     */
    public void expectWithRecoverySet(TokenKind kind, TokenSet recoverySet) {
        if (at(kind)) {
            bump();
        } else {
            recordError(activeExpectedSyntaxName().orElseGet(() -> ExpectedSyntax.Unnamed.of(kind)), recoverySet);
        }
    }

    public Optional<CompletedMarker> error() {
        return errorWithRecoverySet(TokenSet.EMPTY);
    }

    /**
     * Report that the upcoming token starts none of the syntax checked for since the last consumed
     * token. The token is consumed unless it is a recovery token.
     */
    public Optional<CompletedMarker> errorWithRecoverySet(TokenSet recoverySet) {
        return recordError(currentExpectedSyntax(), recoverySet);
    }

    private Optional<CompletedMarker> recordError(ExpectedSyntax expectedSyntax, TokenSet recoverySet) {
        var upcoming = source.peekToken();
        if (upcoming.isEmpty() || isRecoveryToken(upcoming.get().kind(), recoverySet)) {
            errors.add(new SyntaxError(expectedSyntax, new Missing(missingOffset())));
            return Optional.empty();
        }
        var token = upcoming.get();
        errors.add(new SyntaxError(expectedSyntax, new Unexpected(token.kind(), token.range())));

        var m = start();
        bump();
        return Optional.of(m.complete(this, NodeKind.ERROR));
    }

    /**
     * Record the upcoming token as unexpected and consume it into an {@link NodeKind#ERROR} node,
     * even if it would normally be left for recovery. Guarantees progress in list rules.
     *
     * @throws IllegalStateException at end of input
     */
    public CompletedMarker consumeAsError() {
        var token = source.peekToken()
                          .orElseThrow(() -> new IllegalStateException("No token left to consume"));
        errors.add(new SyntaxError(currentExpectedSyntax(), new Unexpected(token.kind(), token.range())));

        var m = start();
        bump();
        return m.complete(this, NodeKind.ERROR);
    }

    private static boolean isRecoveryToken(TokenKind kind, TokenSet recoverySet) {
        return recoverySet.contains(kind) || DEFAULT_RECOVERY_SET.contains(kind);
    }

    private int missingOffset() {
        return source.lastTokenRange()
                     .map(range -> range.end())
                     .orElse(0);
    }

    private ExpectedSyntax currentExpectedSyntax() {
        return activeExpectedSyntaxName().orElseGet(() -> new ExpectedSyntax.Unnamed(List.copyOf(expectedKinds)));
    }

    private Optional<ExpectedSyntax> activeExpectedSyntaxName() {
        if (expectedSyntaxName != null && expectedSyntaxNamePosition == source.position()) {
            return Optional.of(new ExpectedSyntax.Named(expectedSyntaxName));
        }
        return Optional.empty();
    }

    /**
     * Checks made inside the returned scope do not show up in the expected-syntax label of
     * a later error.
     */
    public Scope disableExpectedTracking() {
        var previous = trackingExpected;
        trackingExpected = false;
        return () -> trackingExpected = previous;
    }

    /**
     * Errors reported before the next token is consumed describe the expected syntax as
     * {@code name} rather than by token kinds.
     */
    public Scope expectedSyntaxName(String name) {
        var previousName = expectedSyntaxName;
        var previousPosition = expectedSyntaxNamePosition;
        expectedSyntaxName = name;
        expectedSyntaxNamePosition = source.position();
        return () -> {
            expectedSyntaxName = previousName;
            expectedSyntaxNamePosition = previousPosition;
        };
    }

    // === Nesting ===

    public boolean isNestingTooDeep() {
        return depth >= config.maxNestingDepth();
    }

    public Scope nested() {
        depth++;
        return () -> depth--;
    }

    /**
     * Record a nesting error and skip the upcoming token, together with the whole group it opens
     * when it is an opening delimiter, without descending into it.
     */
    public Optional<CompletedMarker> errorNestingTooDeep() {
        var upcoming = source.peekToken();
        if (upcoming.isEmpty()) {
            return error();
        }
        errors.add(new SyntaxError(currentExpectedSyntax(), new NestingTooDeep(upcoming.get().range())));

        var m = start();
        int balance = 0;
        do {
            var kind = source.peekKind().orElseThrow();
            if (kind == TokenKind.L_PAREN || kind == TokenKind.L_BRACE) {
                balance++;
            } else if (kind == TokenKind.R_PAREN || kind == TokenKind.R_BRACE) {
                balance--;
            }
            bump();
        } while (balance > 0 && !atEof());
        return Optional.of(m.complete(this, NodeKind.ERROR));
    }

    // === Result ===

    /**
     * Build the tree from the recorded events. The context must not be used afterwards.
     */
    public Parse finish(byte[] text) {
        var tree = new Sink(text, tokens, events).finish();
        return new Parse(tree, List.copyOf(errors));
    }
}
