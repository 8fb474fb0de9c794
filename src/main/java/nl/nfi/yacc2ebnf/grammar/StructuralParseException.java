package nl.nfi.yacc2ebnf.grammar;

import nl.nfi.yacc2ebnf.common.parse.ParseFailedException;
import nl.nfi.yacc2ebnf.common.parse.ParseInput;

public final class StructuralParseException extends GrammarException {

    private static final int PREVIEW_LENGTH = 30;

    private final String expected;
    private final int line;
    private final int column;

    public StructuralParseException(final String sourceName, final String expected, final int line, final int column, final String found) {
        super(sourceName, "%d:%d: expected %s, found %s".formatted(line, column, expected, found.isEmpty() ? "end of input" : "'" + found + "'"));
        this.expected = expected;
        this.line = line;
        this.column = column;
    }

    public static StructuralParseException of(final String sourceName, final ParseFailedException cause) {
        final ParseInput position = cause.position();
        final StructuralParseException exception = new StructuralParseException(
                sourceName, cause.expected(), position.line(), position.column(), position.preview(PREVIEW_LENGTH)
        );
        exception.initCause(cause);
        return exception;
    }

    public String expected() {
        return expected;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
