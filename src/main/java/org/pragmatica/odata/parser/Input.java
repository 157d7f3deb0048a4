package org.pragmatica.odata.parser;

import org.pragmatica.odata.tree.SourceLocation;

/**
 * Immutable view of the remaining input: the whole source plus the offset of the next unread character.
 *
 * <p>Parsers never mutate an input; advancing returns a new view, so a failed alternative leaves the caller's
 * view untouched.
 */
public record Input(String source, int offset) {

    public Input {
        if (source == null) {
            throw new IllegalArgumentException("Source must not be null");
        }
        if (offset < 0 || offset > source.length()) {
            throw new IllegalArgumentException("Offset " + offset + " outside of input of length " + source.length());
        }
    }

    public static Input of(String source) {
        return new Input(source, 0);
    }

    public boolean isAtEnd() {
        return offset >= source.length();
    }

    public int remaining() {
        return source.length() - offset;
    }

    public char peek() {
        return source.charAt(offset);
    }

    /**
     * Check whether the character {@code ahead} positions from here exists and satisfies the predicate.
     */
    public boolean matches(int ahead, Chars.CharClass charClass) {
        return offset + ahead < source.length() && charClass.test(source.charAt(offset + ahead));
    }

    /**
     * Code point starting at the current position. A surrogate pair counts as one code point.
     */
    public int codePoint() {
        return source.codePointAt(offset);
    }

    /**
     * Advance past the code point at the current position.
     */
    public Input advanceCodePoint() {
        return advance(Character.charCount(codePoint()));
    }

    public boolean startsWith(char c) {
        return !isAtEnd() && peek() == c;
    }

    public boolean startsWith(String text) {
        return source.startsWith(text, offset);
    }

    public boolean startsWithIgnoreCase(String text) {
        return source.regionMatches(true, offset, text, 0, text.length());
    }

    public Input advance(int count) {
        return new Input(source, offset + count);
    }

    /**
     * Number of consecutive characters from here (at most {@code max}) matching the predicate.
     */
    public int countWhile(Chars.CharClass charClass, int max) {
        int count = 0;
        while (count < max && offset + count < source.length() && charClass.test(source.charAt(offset + count))) {
            count++;
        }
        return count;
    }

    /**
     * Text between this view and a later one. The result is a fresh copy.
     */
    public String textUpTo(Input end) {
        return source.substring(offset, end.offset);
    }

    public String rest() {
        return source.substring(offset);
    }

    public SourceLocation location() {
        return SourceLocation.of(source, offset);
    }

    /**
     * Description of the next character for error messages.
     */
    public String found() {
        return isAtEnd() ? "end of input" : new String(Character.toChars(codePoint()));
    }

    @Override
    public String toString() {
        return "Input[" + offset + ": '" + rest() + "']";
    }
}
