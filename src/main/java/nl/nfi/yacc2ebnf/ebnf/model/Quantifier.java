package nl.nfi.yacc2ebnf.ebnf.model;

import java.util.Arrays;

public enum Quantifier {

    NONE(""),
    OPTIONAL("?"),
    ZERO_OR_MORE("*"),
    ONE_OR_MORE("+");

    private final String symbol;

    Quantifier(final String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isPresent() {
        return this != NONE;
    }

    public static Quantifier fromSymbol(final String symbol) {
        return Arrays.stream(values())
                .filter(quantifier -> quantifier.symbol.equals(symbol))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown quantifier: %s".formatted(symbol)));
    }
}
