package nl.nfi.yacc2ebnf.common.parse;

import nl.nfi.yacc2ebnf.common.parse.ParseResult.Failure;

public final class ParseFailedException extends Exception {

    private final transient Failure<?> failure;

    ParseFailedException(final Failure<?> failure) {
        super("expected %s at %d:%d".formatted(failure.expected(), failure.position().line(), failure.position().column()));
        this.failure = failure;
    }

    public String expected() {
        return failure.expected();
    }

    public ParseInput position() {
        return failure.position();
    }
}
