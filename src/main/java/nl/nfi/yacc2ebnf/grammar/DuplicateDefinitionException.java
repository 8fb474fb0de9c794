package nl.nfi.yacc2ebnf.grammar;

public final class DuplicateDefinitionException extends GrammarException {

    private final String name;

    public DuplicateDefinitionException(final String sourceName, final String name) {
        super(sourceName, "non-terminal '%s' is defined more than once".formatted(name));
        this.name = name;
    }

    public String name() {
        return name;
    }
}
