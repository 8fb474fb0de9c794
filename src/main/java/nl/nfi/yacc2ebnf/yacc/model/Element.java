package nl.nfi.yacc2ebnf.yacc.model;

import static java.util.Objects.requireNonNull;
import static nl.nfi.yacc2ebnf.yacc.model.Element.Literal;
import static nl.nfi.yacc2ebnf.yacc.model.Element.NonTerminal;

public sealed interface Element permits Literal, NonTerminal {

    // quoted token including its quotes, e.g. '+'
    record Literal(String text) implements Element {

        public Literal {
            requireNonNull(text);
        }
    }

    record NonTerminal(String name) implements Element {

        public NonTerminal {
            requireNonNull(name);
        }
    }
}
