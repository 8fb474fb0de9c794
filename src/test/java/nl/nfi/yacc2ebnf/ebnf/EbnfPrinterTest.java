package nl.nfi.yacc2ebnf.ebnf;

import nl.nfi.yacc2ebnf.ebnf.model.Choice;
import nl.nfi.yacc2ebnf.ebnf.model.Item;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Group;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Name;
import nl.nfi.yacc2ebnf.ebnf.model.Production;
import nl.nfi.yacc2ebnf.ebnf.model.Sequence;
import nl.nfi.yacc2ebnf.grammar.GrammarException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;

import static nl.nfi.yacc2ebnf.Utils.production;
import static nl.nfi.yacc2ebnf.Utils.productions;
import static nl.nfi.yacc2ebnf.Utils.text;
import static nl.nfi.yacc2ebnf.ebnf.model.Quantifier.ZERO_OR_MORE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EbnfPrinterTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "expr ::= term (('+' | '-') term)*",
            "opt ::= | 'x'",
            "digits ::= [0-9]+ ('.' [0-9]+)?",
            "ws ::= (#x20 | #x09)*"
    })
    void printsOnOneLine(final String ebnf) throws GrammarException {
        assertThat(text(production(ebnf))).isEqualTo(ebnf);
    }

    @Test
    void printsEmptyGroup() {
        final Production production = new Production("a", Choice.of(Sequence.of(new Item(new Group(Choice.of(Sequence.EMPTY)), ZERO_OR_MORE), Item.of(new Name("b")))));

        assertThat(text(production)).isEqualTo("a ::= ()* b");
    }

    @Test
    void stacksProductions() throws GrammarException {
        final List<Production> productions = productions("a ::= b 'x' b ::= 'y' | 'z'");

        assertThat(EbnfPrinter.withWidth(80).render(productions)).isEqualTo("a ::= b 'x'\nb ::= 'y' | 'z'");
    }

    @Test
    void wrapsToWidth() throws GrammarException {
        final Production production = production("statement ::= 'if' expression 'then' statement ('else' statement)?");

        assertThat(EbnfPrinter.withWidth(40).render(List.of(production))).isEqualTo("""
                statement ::= 'if' expression 'then'
                    statement ('else' statement)?""");
    }

    @Test
    void printsWithTrailingNewline() throws GrammarException {
        final ByteArrayOutputStream output = new ByteArrayOutputStream();
        EbnfPrinter.withWidth(80).print(productions("a ::= 'x'"), new PrintStream(output));

        assertThat(output.toString()).isEqualTo("a ::= 'x'" + System.lineSeparator());
    }

    @Test
    void widthMustBePositive() {
        assertThatThrownBy(() -> EbnfPrinter.withWidth(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
