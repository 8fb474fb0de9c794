package nl.nfi.yacc2ebnf.common.layout;

import java.util.List;

import static nl.nfi.yacc2ebnf.common.layout.Doc.Concat;
import static nl.nfi.yacc2ebnf.common.layout.Doc.Horizontal;
import static nl.nfi.yacc2ebnf.common.layout.Doc.Text;
import static nl.nfi.yacc2ebnf.common.layout.Doc.Vertical;

// structural description of text, laid out to a width by Layout
public sealed interface Doc permits Text, Concat, Horizontal, Vertical {

    Doc EMPTY = new Text("");

    static Doc text(final String text) {
        return new Text(text);
    }

    static Doc concat(final Doc... parts) {
        return new Concat(List.of(parts));
    }

    static Doc hsep(final List<? extends Doc> parts) {
        return new Horizontal(List.copyOf(parts));
    }

    static Doc vcat(final List<? extends Doc> parts) {
        return new Vertical(List.copyOf(parts));
    }

    boolean isEmpty();

    record Text(String text) implements Doc {

        @Override
        public boolean isEmpty() {
            return text.isEmpty();
        }
    }

    // parts glued together without a separator
    record Concat(List<Doc> parts) implements Doc {

        @Override
        public boolean isEmpty() {
            return parts.stream().allMatch(Doc::isEmpty);
        }
    }

    // parts separated by a space, or by a line break when the line gets too long
    record Horizontal(List<Doc> parts) implements Doc {

        @Override
        public boolean isEmpty() {
            return parts.stream().allMatch(Doc::isEmpty);
        }
    }

    // parts on separate lines
    record Vertical(List<Doc> parts) implements Doc {

        @Override
        public boolean isEmpty() {
            return parts.stream().allMatch(Doc::isEmpty);
        }
    }
}
