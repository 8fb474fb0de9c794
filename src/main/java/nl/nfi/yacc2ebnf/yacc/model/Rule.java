package nl.nfi.yacc2ebnf.yacc.model;

import java.util.List;

// one alternative of a production, possibly empty
public record Rule(List<Element> elements) {

    public Rule {
        elements = List.copyOf(elements);
    }

    public static Rule of(final Element... elements) {
        return new Rule(List.of(elements));
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }
}
