package org.pragmatica.odata.parser;

/**
 * Terminal matchers shared by the literal and name rules.
 */
public final class Terminals {
    private Terminals() {}

    public static ParseResult<String> text(Input input, String text) {
        return input.startsWith(text)
               ? ParseResult.success(text, input.advance(text.length()))
               : ParseResult.failure(input, "'" + text + "'");
    }

    /**
     * Case-insensitive match. The returned value is the text as written in the input.
     */
    public static ParseResult<String> textIgnoreCase(Input input, String text) {
        if (!input.startsWithIgnoreCase(text)) {
            return ParseResult.failure(input, "'" + text + "'");
        }
        var rest = input.advance(text.length());
        return ParseResult.success(input.textUpTo(rest), rest);
    }

    public static ParseResult<Character> character(Input input, char c) {
        return input.startsWith(c)
               ? ParseResult.success(c, input.advance(1))
               : ParseResult.failure(input, "'" + c + "'");
    }

    public static ParseResult<Character> characterIgnoreCase(Input input, char c) {
        if (!input.isAtEnd() && Character.toUpperCase(input.peek()) == Character.toUpperCase(c)) {
            return ParseResult.success(input.peek(), input.advance(1));
        }
        return ParseResult.failure(input, "'" + c + "'");
    }

    public static ParseResult<Character> oneOf(Input input, String chars) {
        if (!input.isAtEnd() && chars.indexOf(input.peek()) >= 0) {
            return ParseResult.success(input.peek(), input.advance(1));
        }
        return ParseResult.failure(input, "one of '" + chars + "'");
    }

    /**
     * Between {@code min} and {@code max} characters of the given class. Stops after {@code max} characters
     * even if more would match.
     */
    public static ParseResult<String> takeWhile(Input input, Chars.CharClass charClass, int min, int max,
                                                String expected) {
        int count = input.countWhile(charClass, max);
        if (count < min) {
            return ParseResult.failure(input.advance(count), expected);
        }
        var rest = input.advance(count);
        return ParseResult.success(input.textUpTo(rest), rest);
    }

    /**
     * One or more ASCII digits.
     */
    public static ParseResult<String> digits(Input input) {
        return takeWhile(input, Chars::isDigit, 1, Integer.MAX_VALUE, "digit");
    }

    /**
     * Exactly {@code count} ASCII digits.
     */
    public static ParseResult<String> digits(Input input, int count) {
        return takeWhile(input, Chars::isDigit, count, count, "digit");
    }
}
