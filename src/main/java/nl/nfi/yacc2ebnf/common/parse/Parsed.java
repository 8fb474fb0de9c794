package nl.nfi.yacc2ebnf.common.parse;

// outcome of a successful top-level parse, including anything the parser left unconsumed
public record Parsed<T>(T value, ParseInput rest) {

    public boolean isComplete() {
        return rest.remainder().isBlank();
    }

    public String leftoverPreview(final int maxLength) {
        return rest.skipTo(firstNonBlank()).preview(maxLength);
    }

    private int firstNonBlank() {
        final String text = rest.text();
        int offset = rest.offset();
        while (offset < text.length() && Character.isWhitespace(text.charAt(offset))) {
            offset++;
        }
        return offset;
    }
}
