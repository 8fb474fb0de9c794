package nl.nfi.yacc2ebnf.common.parse;

import nl.nfi.yacc2ebnf.common.parse.ParseResult.Failure;
import nl.nfi.yacc2ebnf.common.parse.ParseResult.Success;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.util.Collections.unmodifiableList;

public final class Parsers {

    private Parsers() {
    }

    public static <T> Parsed<T> run(final Parser<T> parser, final String text) throws ParseFailedException {
        final ParseResult<T> result = parser.parse(ParseInput.of(text));
        if (result instanceof final Success<T> success) {
            return new Parsed<>(success.value(), success.rest());
        }
        throw new ParseFailedException((Failure<T>) result);
    }

    public static <T> Parser<T> success(final T value) {
        return input -> new Success<>(value, input);
    }

    public static <T> Parser<T> failure(final String expected) {
        return input -> new Failure<>(expected, input);
    }

    // for recursive grammars, resolves the parser on first use
    public static <T> Parser<T> lazy(final Supplier<Parser<T>> supplier) {
        return input -> supplier.get().parse(input);
    }

    // stops at the first failure, or at the first success that did not consume anything
    public static <T> Parser<List<T>> many(final Parser<T> parser) {
        return input -> {
            final List<T> values = new ArrayList<>();
            ParseInput current = input;
            while (parser.parse(current) instanceof final Success<T> success && success.rest().offset() > current.offset()) {
                values.add(success.value());
                current = success.rest();
            }
            return new Success<>(unmodifiableList(values), current);
        };
    }

    public static <T> Parser<List<T>> some(final Parser<T> parser) {
        return parser.then(first -> many(parser).map(rest -> prepend(first, rest)));
    }

    public static <T> Parser<List<T>> sepBy1(final Parser<T> parser, final Parser<?> separator) {
        return parser.then(first -> many(separator.followedBy(parser)).map(rest -> prepend(first, rest)));
    }

    public static <T> Parser<Optional<T>> optional(final Parser<T> parser) {
        return parser.<Optional<T>>map(Optional::of).or(success(Optional.empty()));
    }

    // succeeds without consuming anything when parser would fail at this position
    public static Parser<Void> notFollowedBy(final Parser<?> parser, final String description) {
        return input -> parser.parse(input) instanceof Success<?>
                ? new Failure<>("not " + description, input)
                : new Success<>(null, input);
    }

    // white space, block comments (may span lines, not nested) and line comments
    public static Parser<Void> whitespace() {
        return input -> {
            final String text = input.text();
            int offset = input.offset();
            while (offset < text.length()) {
                if (Character.isWhitespace(text.charAt(offset))) {
                    offset++;
                } else if (text.startsWith("/*", offset)) {
                    final int end = text.indexOf("*/", offset + 2);
                    if (end < 0) {
                        break;
                    }
                    offset = end + 2;
                } else if (text.startsWith("//", offset)) {
                    final int end = text.indexOf('\n', offset);
                    offset = end < 0 ? text.length() : end + 1;
                } else {
                    break;
                }
            }
            return new Success<>(null, input.skipTo(offset));
        };
    }

    public static Parser<String> symbol(final String symbol) {
        final String expected = "'" + symbol + "'";
        return whitespace().<String>followedBy(input -> input.startsWith(symbol)
                ? new Success<>(symbol, input.advance(symbol.length()))
                : new Failure<>(expected, input));
    }

    // the pattern is anchored at the current position, after skipping white space
    public static Parser<String> token(final String description, final Pattern pattern) {
        return whitespace().<String>followedBy(input -> {
            final Matcher matcher = pattern.matcher(input.text()).region(input.offset(), input.text().length());
            if (matcher.lookingAt() && matcher.end() > input.offset()) {
                return new Success<>(matcher.group(), input.skipTo(matcher.end()));
            }
            return new Failure<>(description, input);
        });
    }

    public static Parser<Void> endOfInput() {
        return whitespace().<Void>followedBy(input -> input.atEnd()
                ? new Success<>(null, input)
                : new Failure<>("end of input", input));
    }

    // at end of input succeeds, otherwise fails with the reason the leftover does not match unit
    public static Parser<Void> endOfInputAfter(final Parser<?> unit) {
        return endOfInput().or(unit.followedBy(failure("end of input")));
    }

    private static <T> List<T> prepend(final T first, final List<T> rest) {
        final List<T> values = new ArrayList<>(rest.size() + 1);
        values.add(first);
        values.addAll(rest);
        return unmodifiableList(values);
    }
}
