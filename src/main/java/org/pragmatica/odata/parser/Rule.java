package org.pragmatica.odata.parser;

import io.vavr.control.Option;

import java.util.function.Function;

/**
 * A parsing function from an input view to a result. Rules are stateless and may be shared between threads.
 */
@FunctionalInterface
public interface Rule<T> {

    ParseResult<T> parse(Input input);

    default <R> Rule<R> map(Function<? super T, ? extends R> mapper) {
        return input -> parse(input).map(mapper);
    }

    /**
     * Ordered choice: the other rule is tried from the same position only if this one fails without committing.
     */
    default Rule<T> or(Rule<T> other) {
        return input -> parse(input).or(() -> other.parse(input));
    }

    /**
     * Zero or one match. A plain failure becomes an empty value at the starting position.
     */
    default Rule<Option<T>> optional() {
        return input -> {
            var result = parse(input);
            if (result instanceof ParseResult.Failure) {
                return ParseResult.success(Option.none(), input);
            }
            return result.map(Option::some);
        };
    }
}
