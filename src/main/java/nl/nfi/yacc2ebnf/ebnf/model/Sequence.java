package nl.nfi.yacc2ebnf.ebnf.model;

import java.util.List;

public record Sequence(List<Item> items) {

    public static final Sequence EMPTY = new Sequence(List.of());

    public Sequence {
        items = List.copyOf(items);
    }

    public static Sequence of(final Item... items) {
        return new Sequence(List.of(items));
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }
}
