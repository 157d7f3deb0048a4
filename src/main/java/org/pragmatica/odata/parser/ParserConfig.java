package org.pragmatica.odata.parser;

/**
 * Parser configuration options.
 *
 * @param bareDurationLiterals accept {@code 'P1D'} without the {@code duration} keyword. Such tokens then parse
 *                             as durations rather than strings.
 */
public record ParserConfig(
    boolean bareDurationLiterals
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        true
    );
}
