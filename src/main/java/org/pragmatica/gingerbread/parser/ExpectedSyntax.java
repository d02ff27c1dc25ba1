package org.pragmatica.gingerbread.parser;

import org.pragmatica.gingerbread.lexer.TokenKind;

import java.util.List;
import java.util.stream.Collectors;

/**
 * What the parser was looking for when it reported a syntax error.
 */
public sealed interface ExpectedSyntax {
    /**
     * Human-readable description, e.g. {@code expression} or {@code `=`}.
     */
    String describe();

    /**
     * Label supplied by a grammar rule for everything it could have started with.
     */
    record Named(String name) implements ExpectedSyntax {
        @Override
        public String describe() {
            return name;
        }
    }

    /**
     * The token kinds that were checked for since the last consumed token, in probing order.
     */
    record Unnamed(List<TokenKind> kinds) implements ExpectedSyntax {
        public Unnamed {
            kinds = List.copyOf(kinds);
        }

        public static Unnamed of(TokenKind... kinds) {
            return new Unnamed(List.of(kinds));
        }

        @Override
        public String describe() {
            if (kinds.isEmpty()) {
                return "nothing";
            }
            if (kinds.size() == 1) {
                return kinds.get(0).display();
            }
            var init = kinds.subList(0, kinds.size() - 1)
                            .stream()
                            .map(TokenKind::display)
                            .collect(Collectors.joining(", "));
            return init + " or " + kinds.get(kinds.size() - 1).display();
        }
    }
}
