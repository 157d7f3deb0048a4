package org.pragmatica.odata.parser;

/**
 * Character classes used by the literal and name grammars.
 */
public final class Chars {
    private Chars() {}

    @FunctionalInterface
    public interface CharClass {
        boolean test(char c);
    }

    /**
     * ASCII decimal digit. Unicode digits from other scripts are not accepted.
     */
    public static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    public static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /**
     * Identifier characters are tested by code point, so letters outside the Basic Multilingual Plane qualify.
     */
    public static boolean isIdentifierStart(int codePoint) {
        return Character.isLetter(codePoint) || codePoint == '_';
    }

    public static boolean isIdentifierPart(int codePoint) {
        return Character.isLetterOrDigit(codePoint) || codePoint == '_';
    }

    /**
     * URL-safe base64 alphabet plus the padding character.
     */
    public static boolean isBase64UrlChar(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || isDigit(c) || c == '-' || c == '_' || c == '=';
    }
}
