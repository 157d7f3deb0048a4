package org.pragmatica.odata.error;

import org.pragmatica.odata.tree.SourceLocation;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    SourceLocation location();

    /**
     * Human-readable one-line description.
     */
    String message();

    Category category();

    /**
     * Number of source characters the error refers to, starting at {@link #location()}.
     */
    default int length() {
        return 1;
    }

    /**
     * Broad classification of parse errors.
     */
    enum Category {
        /**
         * Input matches none of the alternatives.
         */
        SYNTAX,
        /**
         * A prefix matched, but characters remain.
         */
        TRAILING_INPUT,
        /**
         * Lexically well-formed, semantically invalid.
         */
        DOMAIN
    }

    /**
     * Unexpected input error.
     */
    record UnexpectedInput(
    SourceLocation location,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected '" + found + "' at " + location + ", expected " + expected;
        }

        @Override
        public Category category() {
            return Category.SYNTAX;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location + ", expected " + expected;
        }

        @Override
        public Category category() {
            return Category.SYNTAX;
        }

        @Override
        public int length() {
            return 0;
        }
    }

    /**
     * A complete token was recognized but input remains after it.
     */
    record TrailingInput(
    SourceLocation location,
    String remainder,
    String matched) implements ParseError {
        @Override
        public String message() {
            return "Unexpected trailing input '" + remainder + "' at " + location + " after " + matched;
        }

        @Override
        public Category category() {
            return Category.TRAILING_INPUT;
        }

        @Override
        public int length() {
            return remainder.length();
        }
    }

    /**
     * Well-formed token with an invalid value, e.g. February 30th or an integer beyond 64 bits.
     */
    record InvalidValue(
    SourceLocation location,
    String kind,
    String token,
    String reason) implements ParseError {
        @Override
        public String message() {
            return "Invalid " + kind + " '" + token + "' at " + location + ": " + reason;
        }

        @Override
        public Category category() {
            return Category.DOMAIN;
        }

        @Override
        public int length() {
            return Math.max(1, token.length());
        }
    }
}
