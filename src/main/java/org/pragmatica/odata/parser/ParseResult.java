package org.pragmatica.odata.parser;

import org.pragmatica.odata.error.ParseError;

import java.util.Arrays;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Result of applying a rule at some input position - a value with the remaining input, or a failure.
 *
 * <p>A plain {@link Failure} lets an enclosing choice try its next alternative. A {@link CutFailure} is
 * committed: the rule recognized its token and found it invalid, so no other alternative is attempted.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    static <T> ParseResult<T> success(T value, Input rest) {
        return new Success<>(value, rest);
    }

    static <T> ParseResult<T> failure(Input at, String expected) {
        return new Failure<>(at, expected);
    }

    /**
     * Committed domain error for a token which is lexically well-formed but carries an invalid value.
     */
    static <T> ParseResult<T> invalid(Input at, String kind, String token, String reason) {
        return new CutFailure<>(new ParseError.InvalidValue(at.location(), kind, token, reason));
    }

    default <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()), success.rest());
        }
        return cast();
    }

    /**
     * Continue with the value and the remaining input. Failures pass through unchanged.
     */
    default <R> ParseResult<R> flatMap(BiFunction<? super T, Input, ParseResult<R>> next) {
        if (this instanceof Success<T> success) {
            return next.apply(success.value(), success.rest());
        }
        return cast();
    }

    /**
     * Try the alternative if this result is a plain failure. When both fail, the failure that got further wins.
     */
    default ParseResult<T> or(Supplier<ParseResult<T>> alternative) {
        if (!(this instanceof Failure<T> failure)) {
            return this;
        }
        var other = alternative.get();
        return other instanceof Failure<T> otherFailure
               ? failure.merge(otherFailure)
               : other;
    }

    /**
     * Turn a plain failure into a committed one.
     */
    default ParseResult<T> commit() {
        if (this instanceof Failure<T> failure) {
            return new CutFailure<>(failure.toError());
        }
        return this;
    }

    /**
     * Re-type a failed result.
     */
    @SuppressWarnings("unchecked")
    default <R> ParseResult<R> cast() {
        if (isSuccess()) {
            throw new IllegalStateException("Successful result can't be re-typed");
        }
        return (ParseResult<R>) (ParseResult<?>) this;
    }

    /**
     * Successful match with the value and the input following it.
     */
    record Success<T>(T value, Input rest) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * Failed parse - no match at the given position.
     */
    record Failure<T>(Input at, String expected) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        /**
         * Keep the failure which reached further into the input; on a tie combine the expectations.
         */
        public Failure<T> merge(Failure<T> other) {
            if (other.at.offset() != at.offset()) {
                return other.at.offset() > at.offset() ? other : this;
            }
            if (Arrays.asList(expected.split(" or ")).contains(other.expected)) {
                return this;
            }
            return new Failure<>(at, expected + " or " + other.expected);
        }

        public ParseError toError() {
            return at.isAtEnd()
                   ? new ParseError.UnexpectedEof(at.location(), expected)
                   : new ParseError.UnexpectedInput(at.location(), at.found(), expected);
        }
    }

    /**
     * Failure after the rule committed to its token - prevents backtracking to other alternatives.
     */
    record CutFailure<T>(ParseError error) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
