package nl.nfi.yacc2ebnf.ebnf.model;

import static java.util.Objects.requireNonNull;

public record Item(Primary primary, Quantifier quantifier) {

    public Item {
        requireNonNull(primary);
        requireNonNull(quantifier);
    }

    public static Item of(final Primary primary) {
        return new Item(primary, Quantifier.NONE);
    }

    public boolean isQuantified() {
        return quantifier.isPresent();
    }
}
