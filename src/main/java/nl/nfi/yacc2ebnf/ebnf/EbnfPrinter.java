package nl.nfi.yacc2ebnf.ebnf;

import nl.nfi.yacc2ebnf.common.layout.Doc;
import nl.nfi.yacc2ebnf.common.layout.Layout;
import nl.nfi.yacc2ebnf.ebnf.model.Choice;
import nl.nfi.yacc2ebnf.ebnf.model.Item;
import nl.nfi.yacc2ebnf.ebnf.model.Primary;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Group;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Name;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Term;
import nl.nfi.yacc2ebnf.ebnf.model.Production;
import nl.nfi.yacc2ebnf.ebnf.model.Sequence;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import static nl.nfi.yacc2ebnf.common.layout.Doc.concat;
import static nl.nfi.yacc2ebnf.common.layout.Doc.hsep;
import static nl.nfi.yacc2ebnf.common.layout.Doc.text;
import static nl.nfi.yacc2ebnf.common.layout.Doc.vcat;

public final class EbnfPrinter {

    public static final String DEFINES = "::=";

    private final int width;

    private EbnfPrinter(final int width) {
        this.width = width;
    }

    public static EbnfPrinter withWidth(final int width) {
        if (width < 1) {
            throw new IllegalArgumentException("Output width must be positive: %d".formatted(width));
        }
        return new EbnfPrinter(width);
    }

    public void print(final List<Production> productions, final PrintStream output) {
        output.println(render(productions));
    }

    public String render(final List<Production> productions) {
        return Layout.render(vcat(productions.stream().map(EbnfPrinter::production).toList()), width);
    }

    // single line, regardless of length
    public static String toText(final Production production) {
        return Layout.render(production(production), Integer.MAX_VALUE);
    }

    static Doc production(final Production production) {
        return hsep(List.of(text(production.name()), text(DEFINES), choice(production.choice())));
    }

    static Doc choice(final Choice choice) {
        final List<Doc> parts = new ArrayList<>();
        for (final Sequence alternative : choice.alternatives()) {
            if (!parts.isEmpty()) {
                parts.add(text("|"));
            }
            parts.add(sequence(alternative));
        }
        return hsep(parts);
    }

    static Doc sequence(final Sequence sequence) {
        return hsep(sequence.items().stream().map(EbnfPrinter::item).toList());
    }

    static Doc item(final Item item) {
        return concat(primary(item.primary()), text(item.quantifier().symbol()));
    }

    static Doc primary(final Primary primary) {
        if (primary instanceof final Name name) {
            return text(name.name());
        }
        if (primary instanceof final Term term) {
            return text(term.text());
        }
        return concat(text("("), choice(((Group) primary).choice()), text(")"));
    }
}
