package nl.nfi.yacc2ebnf.ebnf.model;

import static java.util.Objects.requireNonNull;

// a named choice, e.g. expr ::= term ('+' term)*
public record Production(String name, Choice choice) {

    public Production {
        requireNonNull(name);
        requireNonNull(choice);
    }
}
