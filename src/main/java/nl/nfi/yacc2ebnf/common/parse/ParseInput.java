package nl.nfi.yacc2ebnf.common.parse;

import static java.lang.Math.min;

// immutable view of the text with the position of the next unconsumed character
public record ParseInput(String text, int offset) {

    public ParseInput {
        if (offset < 0 || offset > text.length()) {
            throw new IllegalArgumentException("Offset %d outside of input of length %d".formatted(offset, text.length()));
        }
    }

    public static ParseInput of(final String text) {
        return new ParseInput(text, 0);
    }

    public boolean atEnd() {
        return offset == text.length();
    }

    public char current() {
        return text.charAt(offset);
    }

    public boolean startsWith(final String prefix) {
        return text.startsWith(prefix, offset);
    }

    public ParseInput advance(final int count) {
        return new ParseInput(text, offset + count);
    }

    public ParseInput skipTo(final int newOffset) {
        return new ParseInput(text, newOffset);
    }

    public String remainder() {
        return text.substring(offset);
    }

    // 1-based
    public int line() {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (text.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }

    // 1-based
    public int column() {
        final int lineStart = text.lastIndexOf('\n', offset - 1) + 1;
        return offset - lineStart + 1;
    }

    public String preview(final int maxLength) {
        final String rest = text.substring(offset, min(text.length(), offset + maxLength));
        final int newline = rest.indexOf('\n');
        return newline < 0 ? rest : rest.substring(0, newline);
    }
}
