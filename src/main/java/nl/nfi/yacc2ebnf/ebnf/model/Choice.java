package nl.nfi.yacc2ebnf.ebnf.model;

import java.util.List;

public record Choice(List<Sequence> alternatives) {

    public Choice {
        if (alternatives.isEmpty()) {
            throw new IllegalArgumentException("A choice needs at least one alternative");
        }
        alternatives = List.copyOf(alternatives);
    }

    public static Choice of(final Sequence... alternatives) {
        return new Choice(List.of(alternatives));
    }

    public int size() {
        return alternatives.size();
    }
}
