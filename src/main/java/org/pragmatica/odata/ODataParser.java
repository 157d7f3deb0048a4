package org.pragmatica.odata;

import io.vavr.control.Either;
import org.pragmatica.odata.error.ParseError;
import org.pragmatica.odata.parser.ParserConfig;
import org.pragmatica.odata.parser.ParserEngine;
import org.pragmatica.odata.parser.TokenParser;
import org.pragmatica.odata.tree.CommonExpr;
import org.pragmatica.odata.tree.Literal;
import org.pragmatica.odata.tree.Name;

/**
 * Entry point for parsing OData literals and names.
 *
 * <p>Example usage:
 * <pre>{@code
 * var literal = ODataParser.parseLiteral("2023-01-15T10:30:00Z").get();
 *
 * var strict = ODataParser.builder()
 *                         .bareDurationLiterals(false)
 *                         .build();
 * var text = strict.parseLiteral("'P1D'");   // a string literal
 * }</pre>
 */
public final class ODataParser {
    private static final TokenParser DEFAULT = create();

    private ODataParser() {}

    /**
     * Create a parser with the default configuration.
     */
    public static TokenParser create() {
        return create(ParserConfig.DEFAULT);
    }

    public static TokenParser create(ParserConfig config) {
        return ParserEngine.create(config);
    }

    /**
     * Parse a primitive literal with the default configuration.
     */
    public static Either<ParseError, Literal> parseLiteral(String input) {
        return DEFAULT.parseLiteral(input);
    }

    /**
     * Parse an identifier or qualified name.
     */
    public static Either<ParseError, Name> parseName(String input) {
        return DEFAULT.parseName(input);
    }

    /**
     * Parse a literal or a name with the default configuration.
     */
    public static Either<ParseError, CommonExpr> parse(String input) {
        return DEFAULT.parse(input);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean bareDurationLiterals = ParserConfig.DEFAULT.bareDurationLiterals();

        private Builder() {}

        public Builder bareDurationLiterals(boolean enabled) {
            this.bareDurationLiterals = enabled;
            return this;
        }

        public TokenParser build() {
            return create(new ParserConfig(bareDurationLiterals));
        }
    }
}
