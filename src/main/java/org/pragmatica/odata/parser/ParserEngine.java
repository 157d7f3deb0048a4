package org.pragmatica.odata.parser;

import io.vavr.control.Either;
import org.pragmatica.odata.error.ParseError;
import org.pragmatica.odata.tree.CommonExpr;
import org.pragmatica.odata.tree.Literal;
import org.pragmatica.odata.tree.Name;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

/**
 * Parsing engine. Applies the literal and name rules to a whole token and converts the outcome into an
 * {@link Either}.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public final class ParserEngine implements TokenParser {
    private static final Logger log = LoggerFactory.getLogger(ParserEngine.class);

    private final ParserConfig config;
    private final LiteralRules literalRules;

    private ParserEngine(ParserConfig config) {
        this.config = config;
        this.literalRules = LiteralRules.create(config);
    }

    public static ParserEngine create(ParserConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("Parser configuration must not be null");
        }
        return new ParserEngine(config);
    }

    @Override
    public ParserConfig config() {
        return config;
    }

    @Override
    public Either<ParseError, Literal> parseLiteral(String input) {
        return logged("literal", input, parseLiteral(Input.of(input)));
    }

    @Override
    public Either<ParseError, Name> parseName(String input) {
        return logged("name", input, parseName(Input.of(input)));
    }

    /**
     * Literal first. If both attempts fail, report the error which got further into the input, preferring the
     * literal error on a tie.
     */
    @Override
    public Either<ParseError, CommonExpr> parse(String input) {
        var start = Input.of(input);
        Either<ParseError, CommonExpr> literal = parseLiteral(start).map(CommonExpr::literal);
        if (literal.isRight()) {
            return logged("expression", input, literal);
        }
        Either<ParseError, CommonExpr> name = parseName(start).map(CommonExpr::name);
        if (name.isRight()) {
            return logged("expression", input, name);
        }
        var outcome = name.getLeft().location().offset() > literal.getLeft().location().offset()
                      ? name
                      : literal;
        return logged("expression", input, outcome);
    }

    private Either<ParseError, Literal> parseLiteral(Input input) {
        return complete(literalRules.parse(input), literal -> literal.kind() + " literal");
    }

    private Either<ParseError, Name> parseName(Input input) {
        return complete(NameRules.name(input), name -> "name '" + name.fullName() + "'");
    }

    private static <T> Either<ParseError, T> complete(ParseResult<T> result, Function<T, String> describe) {
        if (result instanceof ParseResult.Success<T> success) {
            var rest = success.rest();
            if (rest.isAtEnd()) {
                return Either.right(success.value());
            }
            return Either.left(new ParseError.TrailingInput(rest.location(), rest.rest(),
                                                            describe.apply(success.value())));
        }
        if (result instanceof ParseResult.Failure<T> failure) {
            return Either.left(failure.toError());
        }
        return Either.left(((ParseResult.CutFailure<T>) result).error());
    }

    private static <T> Either<ParseError, T> logged(String what, String input, Either<ParseError, T> outcome) {
        if (outcome.isRight()) {
            log.trace("Parsed {} '{}' as {}", what, input, outcome.get());
        } else {
            log.debug("Failed to parse {} '{}': {}", what, input, outcome.getLeft().message());
        }
        return outcome;
    }
}
