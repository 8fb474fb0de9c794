package nl.nfi.yacc2ebnf.grammar;

public final class MultipleEmptyAlternativesException extends GrammarException {

    private final String name;
    private final int emptyRuleCount;

    public MultipleEmptyAlternativesException(final String sourceName, final String name, final int emptyRuleCount) {
        super(sourceName, "non-terminal '%s' has %d empty rules, at most one is allowed".formatted(name, emptyRuleCount));
        this.name = name;
        this.emptyRuleCount = emptyRuleCount;
    }

    public String name() {
        return name;
    }

    public int emptyRuleCount() {
        return emptyRuleCount;
    }
}
