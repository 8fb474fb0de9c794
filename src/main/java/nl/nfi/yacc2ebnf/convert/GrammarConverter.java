package nl.nfi.yacc2ebnf.convert;

import nl.nfi.yacc2ebnf.analysis.DependencyGraph;
import nl.nfi.yacc2ebnf.analysis.DependencyGraph.Component;
import nl.nfi.yacc2ebnf.ebnf.EbnfParser;
import nl.nfi.yacc2ebnf.ebnf.EbnfPrinter;
import nl.nfi.yacc2ebnf.ebnf.model.Production;
import nl.nfi.yacc2ebnf.grammar.GrammarException;
import nl.nfi.yacc2ebnf.transform.Optimizer;
import nl.nfi.yacc2ebnf.transform.YaccToEbnf;
import nl.nfi.yacc2ebnf.yacc.YaccParser;
import nl.nfi.yacc2ebnf.yacc.YaccSource;
import nl.nfi.yacc2ebnf.yacc.model.Grammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.file.Files.exists;
import static java.nio.file.Files.readString;

/**
 * Converts a YACC grammar to EBNF: optionally merged with EBNF definitions of its terminals, optimized
 * in dependency order and printed with the productions that build on others before the ones they use.
 */
public final class GrammarConverter {

    private static final Logger LOG = LoggerFactory.getLogger(GrammarConverter.class);

    private final Grammar grammar;
    private final Map<String, Production> terminals;
    private final ConverterSettings settings;

    private GrammarConverter(final Grammar grammar, final Map<String, Production> terminals, final ConverterSettings settings) {
        this.grammar = grammar;
        this.terminals = terminals;
        this.settings = settings;
    }

    public static GrammarConverter forGrammar(final Path yaccPath) throws IOException, GrammarException {
        return forGrammar(YaccParser.parse(yaccPath.toString(), YaccSource.readRules(yaccPath)));
    }

    public static GrammarConverter forGrammar(final Grammar grammar) {
        return new GrammarConverter(grammar, Map.of(), ConverterSettings.DEFAULT);
    }

    public GrammarConverter terminals(final Path ebnfPath) throws IOException, GrammarException {
        if (!exists(ebnfPath)) {
            throw new IllegalArgumentException("EBNF terminals file does not exist: %s".formatted(ebnfPath));
        }
        return terminals(EbnfParser.parse(ebnfPath.toString(), readString(ebnfPath)).value());
    }

    // a later definition of the same name replaces an earlier one
    public GrammarConverter terminals(final List<Production> productions) {
        final Map<String, Production> terminals = new LinkedHashMap<>();
        for (final Production production : productions) {
            terminals.put(production.name(), production);
        }
        return new GrammarConverter(grammar, Collections.unmodifiableMap(terminals), settings);
    }

    public GrammarConverter settings(final ConverterSettings settings) {
        return new GrammarConverter(grammar, terminals, settings);
    }

    public List<Production> convert() {
        final List<Component> components = DependencyGraph.of(grammar).components();
        LOG.debug("Found {} components in {} non-terminals", components.size(), grammar.size());

        final Map<String, Production> productions = settings.optimize()
                ? Optimizer.optimizeGrammar(grammar, components, terminals)
                : convertOnly();

        // visited leaves first, printed the other way around
        final List<String> order = new ArrayList<>();
        for (final Component component : components) {
            order.addAll(component.members());
        }
        Collections.reverse(order);

        return order.stream().map(productions::get).toList();
    }

    public String render() {
        return EbnfPrinter.withWidth(settings.width()).render(convert());
    }

    public void writeTo(final PrintStream output) {
        output.println(render());
    }

    private Map<String, Production> convertOnly() {
        final Map<String, Production> productions = new LinkedHashMap<>();
        for (final String name : grammar.names()) {
            productions.put(name, YaccToEbnf.convert(grammar, name));
        }
        return productions;
    }
}
