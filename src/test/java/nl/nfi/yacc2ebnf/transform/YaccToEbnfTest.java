package nl.nfi.yacc2ebnf.transform;

import nl.nfi.yacc2ebnf.ebnf.model.Choice;
import nl.nfi.yacc2ebnf.ebnf.model.Item;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Name;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Term;
import nl.nfi.yacc2ebnf.ebnf.model.Production;
import nl.nfi.yacc2ebnf.ebnf.model.Sequence;
import nl.nfi.yacc2ebnf.grammar.GrammarException;
import nl.nfi.yacc2ebnf.yacc.model.Grammar;
import org.junit.jupiter.api.Test;

import static nl.nfi.yacc2ebnf.Utils.text;
import static nl.nfi.yacc2ebnf.Utils.yacc;
import static org.assertj.core.api.Assertions.assertThat;

class YaccToEbnfTest {

    @Test
    void mapsRulesToAlternatives() throws GrammarException {
        final Grammar grammar = yacc("expr : expr '+' term | term | ;");

        assertThat(YaccToEbnf.convert(grammar, "expr")).isEqualTo(new Production("expr", Choice.of(
                Sequence.of(Item.of(new Name("expr")), Item.of(new Term("'+'")), Item.of(new Name("term"))),
                Sequence.of(Item.of(new Name("term"))),
                Sequence.EMPTY
        )));
    }

    @Test
    void keepsTrivialProductionsAsTheyAre() throws GrammarException {
        final Grammar grammar = yacc("sign : '+' | '-' ; arrow : '-' '>' ;");

        assertThat(text(YaccToEbnf.convert(grammar, "sign"))).isEqualTo("sign ::= '+' | '-'");
        assertThat(text(YaccToEbnf.convert(grammar, "arrow"))).isEqualTo("arrow ::= '-' '>'");
    }

    @Test
    void rewritesEscapedBackslashAndQuote() throws GrammarException {
        final Grammar grammar = yacc("escapes : '\\\\' | '\\'' | '\\n' ;");

        assertThat(text(YaccToEbnf.convert(grammar, "escapes"))).isEqualTo("escapes ::= '\\' | \"'\" | '\\n'");
    }
}
