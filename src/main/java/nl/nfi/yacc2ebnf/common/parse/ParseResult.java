package nl.nfi.yacc2ebnf.common.parse;

import static nl.nfi.yacc2ebnf.common.parse.ParseResult.Failure;
import static nl.nfi.yacc2ebnf.common.parse.ParseResult.Success;

public sealed interface ParseResult<T> permits Success, Failure {

    ParseInput position();

    record Success<T>(T value, ParseInput rest) implements ParseResult<T> {

        @Override
        public ParseInput position() {
            return rest;
        }
    }

    // expected describes what would have been accepted at the given position
    record Failure<T>(String expected, ParseInput position) implements ParseResult<T> {

        @SuppressWarnings("unchecked")
        public <R> Failure<R> cast() {
            return (Failure<R>) this;
        }

        // keep the failure that got furthest, merge expectations when both stopped at the same place
        public Failure<T> merge(final Failure<T> other) {
            if (other.position.offset() > position.offset()) {
                return other;
            }
            if (other.position.offset() < position.offset() || other.expected.equals(expected)) {
                return this;
            }
            return new Failure<>(expected + " or " + other.expected, position);
        }
    }
}
