package nl.nfi.yacc2ebnf.common.layout;

import nl.nfi.yacc2ebnf.common.layout.Doc.Concat;
import nl.nfi.yacc2ebnf.common.layout.Doc.Horizontal;
import nl.nfi.yacc2ebnf.common.layout.Doc.Text;
import nl.nfi.yacc2ebnf.common.layout.Doc.Vertical;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link Doc} as lines of at most a given width, as far as the words allow.
 * <p>
 * Horizontal separators are filled greedily: a separator becomes a line break when the chunk of text
 * up to the next separator would not fit on the current line anymore. Continuation lines are indented
 * by {@link #HANGING_INDENT} columns. Words are never split, so a single word wider than the width
 * still ends up on one (too long) line.
 */
public final class Layout {

    public static final int HANGING_INDENT = 4;

    private Layout() {
    }

    public static String render(final Doc doc, final int width) {
        if (width < 1) {
            throw new IllegalArgumentException("Layout width must be positive: %d".formatted(width));
        }
        final List<Token> tokens = new ArrayList<>();
        flatten(doc, tokens);
        return fill(tokens, width);
    }

    private sealed interface Token permits Word, Space, Newline {
    }

    private record Word(String text) implements Token {
    }

    private record Space() implements Token {
    }

    private record Newline() implements Token {
    }

    private static void flatten(final Doc doc, final List<Token> tokens) {
        if (doc instanceof final Text text) {
            if (!text.isEmpty()) {
                tokens.add(new Word(text.text()));
            }
        } else if (doc instanceof final Concat concat) {
            concat.parts().forEach(part -> flatten(part, tokens));
        } else if (doc instanceof final Horizontal horizontal) {
            separated(horizontal.parts(), new Space(), tokens);
        } else if (doc instanceof final Vertical vertical) {
            separated(vertical.parts(), new Newline(), tokens);
        }
    }

    private static void separated(final List<Doc> parts, final Token separator, final List<Token> tokens) {
        boolean first = true;
        for (final Doc part : parts) {
            if (part.isEmpty()) {
                continue;
            }
            if (!first) {
                tokens.add(separator);
            }
            flatten(part, tokens);
            first = false;
        }
    }

    private static String fill(final List<Token> tokens, final int width) {
        final StringBuilder output = new StringBuilder();
        int column = 0;
        for (int i = 0; i < tokens.size(); i++) {
            final Token token = tokens.get(i);
            if (token instanceof final Word word) {
                output.append(word.text());
                column += word.text().length();
            } else if (token instanceof Newline) {
                output.append('\n');
                column = 0;
            } else if (column + 1 + chunkLength(tokens, i + 1) <= width) {
                output.append(' ');
                column++;
            } else {
                output.append('\n').append(" ".repeat(HANGING_INDENT));
                column = HANGING_INDENT;
            }
        }
        return output.toString();
    }

    // length of the words directly following, up to the next place a line may be broken
    private static int chunkLength(final List<Token> tokens, final int from) {
        int length = 0;
        for (int i = from; i < tokens.size() && tokens.get(i) instanceof final Word word; i++) {
            length += word.text().length();
        }
        return length;
    }
}
