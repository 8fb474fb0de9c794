package nl.nfi.yacc2ebnf.common.parse;

import nl.nfi.yacc2ebnf.common.parse.ParseResult.Failure;
import nl.nfi.yacc2ebnf.common.parse.ParseResult.Success;

import java.util.function.Function;

/**
 * A backtracking parser: consumes a prefix of the input and either produces a value together with
 * the remaining input, or fails without affecting the input seen by an enclosing alternative.
 */
@FunctionalInterface
public interface Parser<T> {

    ParseResult<T> parse(ParseInput input);

    default <R> Parser<R> map(final Function<? super T, ? extends R> mapper) {
        return input -> {
            final ParseResult<T> result = parse(input);
            if (result instanceof final Success<T> success) {
                return new Success<>(mapper.apply(success.value()), success.rest());
            }
            return ((Failure<T>) result).cast();
        };
    }

    default <R> Parser<R> then(final Function<? super T, Parser<R>> next) {
        return input -> {
            final ParseResult<T> result = parse(input);
            if (result instanceof final Success<T> success) {
                return next.apply(success.value()).parse(success.rest());
            }
            return ((Failure<T>) result).cast();
        };
    }

    // runs this, then next, keeping the value of next
    default <R> Parser<R> followedBy(final Parser<R> next) {
        return then(ignored -> next);
    }

    // runs this, then next, keeping the value of this
    default Parser<T> before(final Parser<?> next) {
        return then(value -> next.map(ignored -> value));
    }

    default Parser<T> or(final Parser<T> alternative) {
        return input -> {
            final ParseResult<T> first = parse(input);
            if (first instanceof Success<T>) {
                return first;
            }
            final ParseResult<T> second = alternative.parse(input);
            if (second instanceof Success<T>) {
                return second;
            }
            return ((Failure<T>) first).merge((Failure<T>) second);
        };
    }

    // replaces the expectation of a failure that did not get past the start position
    default Parser<T> label(final String expected) {
        return input -> {
            final ParseResult<T> result = parse(input);
            if (result instanceof final Failure<T> failure && failure.position().offset() <= input.offset()) {
                return new Failure<>(expected, input);
            }
            return result;
        };
    }
}
