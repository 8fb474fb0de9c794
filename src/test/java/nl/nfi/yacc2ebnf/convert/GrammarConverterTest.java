package nl.nfi.yacc2ebnf.convert;

import nl.nfi.yacc2ebnf.common.parse.Parsed;
import nl.nfi.yacc2ebnf.ebnf.EbnfParser;
import nl.nfi.yacc2ebnf.ebnf.model.Production;
import nl.nfi.yacc2ebnf.grammar.GrammarException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static nl.nfi.yacc2ebnf.Utils.text;
import static nl.nfi.yacc2ebnf.Utils.yacc;
import static org.assertj.core.api.Assertions.assertThat;

class GrammarConverterTest {

    static final String ASSIGNMENTS = """
            %token IDENTIFIER NUMBER
            %%
            program : statements ;
            statements : statement | statements statement ;
            statement : IDENTIFIER assign expression semi { store($1, $3); } ;
            assign : ':' '=' ;
            semi : ';' ;
            expression : term | expression addop term ;
            addop : '+' | '-' ;
            term : IDENTIFIER | NUMBER ;
            %%
            """;

    @TempDir
    Path tempWorkDir;

    @Test
    void printsConsumersBeforeWhatTheyUse() throws IOException, GrammarException {
        final Path grammar = write("assignments.y", ASSIGNMENTS);

        assertThat(GrammarConverter.forGrammar(grammar).render()).isEqualTo("""
                program ::= statements
                statements ::= statement | statements statement
                statement ::= IDENTIFIER ':' '=' expression ';'
                semi ::= ';'
                expression ::= term | expression ('+' | '-') term
                addop ::= '+' | '-'
                term ::= IDENTIFIER | NUMBER
                assign ::= ':' '='""");
    }

    @Test
    void inlinesTrivialTerminalDefinitions() throws IOException, GrammarException {
        final Path grammar = write("assignments.y", ASSIGNMENTS);
        final Path terminals = write("terminals.ebnf", """
                IDENTIFIER ::= [a-z] [a-z0-9]*
                NUMBER ::= [0-9]
                """);

        final List<Production> productions = GrammarConverter.forGrammar(grammar).terminals(terminals).convert();

        assertThat(text(productions)).contains("term ::= IDENTIFIER | [0-9]");
        assertThat(productions).extracting(Production::name).doesNotContain("IDENTIFIER", "NUMBER");
    }

    @Test
    void convertsWithoutOptimizing() throws IOException, GrammarException {
        final Path grammar = write("assignments.y", ASSIGNMENTS);

        final List<Production> productions = GrammarConverter.forGrammar(grammar)
                .settings(ConverterSettings.DEFAULT.optimize(false))
                .convert();

        assertThat(text(productions)).contains("statement ::= IDENTIFIER assign expression semi");
    }

    @Test
    void wrapsToConfiguredWidth() throws GrammarException {
        final String ebnf = GrammarConverter.forGrammar(yacc("expression : term | expression '+' term | expression '-' term ;"))
                .settings(ConverterSettings.DEFAULT.width(30))
                .render();

        assertThat(ebnf).isEqualTo("""
                expression ::= term |
                    expression '+' term |
                    expression '-' term""");
    }

    @Test
    void cyclesArePrintedInDiscoveryOrder() throws GrammarException {
        final List<Production> productions = GrammarConverter.forGrammar(yacc("""
                expr : expr '+' term | term ;
                term : term '*' factor | factor ;
                factor : NUMBER | '(' expr ')' ;
                """)).convert();

        assertThat(productions).extracting(Production::name).containsExactly("expr", "term", "factor");
    }

    // literal terminals only and no cycles
    @Test
    void printedGrammarParsesBack() throws GrammarException {
        final GrammarConverter converter = GrammarConverter.forGrammar(yacc("""
                date : day '-' month '-' year | month '/' day '/' year ;
                day : digit digit ;
                month : 'jan' | 'feb' | 'mar' | 'apr' | 'may' | 'jun' | 'jul' ;
                year : digit digit digit digit ;
                digit : '0' | '1' | '2' | '3' ;
                """)).settings(ConverterSettings.DEFAULT.width(40));
        final String ebnf = converter.render();

        final Parsed<List<Production>> reparsed = EbnfParser.parse("printed", ebnf);

        assertThat(reparsed.isComplete()).isTrue();
        assertThat(reparsed.value()).extracting(Production::name).containsExactly("date", "year", "month", "day", "digit");
        assertThat(ebnf.lines().filter(line -> line.contains("::="))).hasSize(5);
        assertThat(reparsed.value()).isEqualTo(converter.convert());
    }

    private Path write(final String fileName, final String content) throws IOException {
        final Path file = tempWorkDir.resolve(fileName);
        Files.writeString(file, content);
        return file;
    }
}
