package org.pragmatica.odata.parser;

import io.vavr.control.Either;
import org.pragmatica.odata.error.ParseError;
import org.pragmatica.odata.tree.CommonExpr;
import org.pragmatica.odata.tree.Literal;
import org.pragmatica.odata.tree.Name;

/**
 * Parser interface - converts a single OData token into a typed value. The whole input must be consumed.
 */
public interface TokenParser {

    /**
     * Parse a primitive literal.
     */
    Either<ParseError, Literal> parseLiteral(String input);

    /**
     * Parse an identifier or qualified name.
     */
    Either<ParseError, Name> parseName(String input);

    /**
     * Parse a literal, or a name if the input is not a literal.
     */
    Either<ParseError, CommonExpr> parse(String input);

    ParserConfig config();
}
