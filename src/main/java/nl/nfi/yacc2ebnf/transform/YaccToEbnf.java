package nl.nfi.yacc2ebnf.transform;

import nl.nfi.yacc2ebnf.ebnf.model.Choice;
import nl.nfi.yacc2ebnf.ebnf.model.Item;
import nl.nfi.yacc2ebnf.ebnf.model.Primary;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Name;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Term;
import nl.nfi.yacc2ebnf.ebnf.model.Production;
import nl.nfi.yacc2ebnf.ebnf.model.Sequence;
import nl.nfi.yacc2ebnf.yacc.model.Element;
import nl.nfi.yacc2ebnf.yacc.model.Element.Literal;
import nl.nfi.yacc2ebnf.yacc.model.Element.NonTerminal;
import nl.nfi.yacc2ebnf.yacc.model.Grammar;
import nl.nfi.yacc2ebnf.yacc.model.Rule;

import java.util.List;
import java.util.Map;

// one-to-one mapping of YACC productions to EBNF, every rule becomes an alternative
public final class YaccToEbnf {

    // W3C EBNF strings have no escapes
    private static final Map<String, String> LITERAL_REWRITES = Map.of(
            "'\\\\'", "'\\'",
            "'\\''", "\"'\""
    );

    private YaccToEbnf() {
    }

    public static Production convert(final Grammar grammar, final String name) {
        return convert(name, grammar.getRules(name));
    }

    public static Production convert(final String name, final List<Rule> rules) {
        return new Production(name, new Choice(rules.stream().map(YaccToEbnf::sequence).toList()));
    }

    private static Sequence sequence(final Rule rule) {
        return new Sequence(rule.elements().stream().map(element -> Item.of(primary(element))).toList());
    }

    private static Primary primary(final Element element) {
        if (element instanceof final NonTerminal nonTerminal) {
            return new Name(nonTerminal.name());
        }
        final String text = ((Literal) element).text();
        return new Term(LITERAL_REWRITES.getOrDefault(text, text));
    }
}
