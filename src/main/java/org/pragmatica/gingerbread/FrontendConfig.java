package org.pragmatica.gingerbread;

import org.pragmatica.gingerbread.parser.ParserConfig;

/**
 * Front end configuration options.
 */
public record FrontendConfig(ParserConfig parserConfig) {
    public static final FrontendConfig DEFAULT = new FrontendConfig(ParserConfig.DEFAULT);
}
