package nl.nfi.yacc2ebnf;

import nl.nfi.yacc2ebnf.ebnf.EbnfParser;
import nl.nfi.yacc2ebnf.ebnf.EbnfPrinter;
import nl.nfi.yacc2ebnf.ebnf.model.Production;
import nl.nfi.yacc2ebnf.grammar.GrammarException;
import nl.nfi.yacc2ebnf.yacc.YaccParser;
import nl.nfi.yacc2ebnf.yacc.model.Grammar;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class Utils {

    public static Production production(final String ebnf) throws GrammarException {
        return productions(ebnf).get(0);
    }

    public static List<Production> productions(final String ebnf) throws GrammarException {
        return EbnfParser.parse("test.ebnf", ebnf).value();
    }

    public static Map<String, Production> productionMap(final String ebnf) throws GrammarException {
        final Map<String, Production> productions = new LinkedHashMap<>();
        for (final Production production : productions(ebnf)) {
            productions.put(production.name(), production);
        }
        return productions;
    }

    public static Grammar yacc(final String rules) throws GrammarException {
        return YaccParser.parse("test.y", rules);
    }

    public static String text(final Production production) {
        return EbnfPrinter.toText(production);
    }

    public static List<String> text(final List<Production> productions) {
        return productions.stream().map(EbnfPrinter::toText).toList();
    }
}
