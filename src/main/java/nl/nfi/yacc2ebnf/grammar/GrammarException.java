package nl.nfi.yacc2ebnf.grammar;

/**
 * A grammar file that could not be turned into a grammar. The message always starts with the name
 * of the offending source, so it can be reported on its own.
 */
public abstract sealed class GrammarException extends Exception
        permits StructuralParseException, DuplicateDefinitionException, MultipleEmptyAlternativesException {

    private final String sourceName;

    GrammarException(final String sourceName, final String message) {
        super(sourceName + ": " + message);
        this.sourceName = sourceName;
    }

    public String sourceName() {
        return sourceName;
    }
}
