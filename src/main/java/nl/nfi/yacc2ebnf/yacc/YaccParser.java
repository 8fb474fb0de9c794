package nl.nfi.yacc2ebnf.yacc;

import nl.nfi.yacc2ebnf.common.parse.ParseFailedException;
import nl.nfi.yacc2ebnf.common.parse.ParseResult.Failure;
import nl.nfi.yacc2ebnf.common.parse.ParseResult.Success;
import nl.nfi.yacc2ebnf.common.parse.Parser;
import nl.nfi.yacc2ebnf.common.parse.Parsers;
import nl.nfi.yacc2ebnf.grammar.DuplicateDefinitionException;
import nl.nfi.yacc2ebnf.grammar.GrammarException;
import nl.nfi.yacc2ebnf.grammar.MultipleEmptyAlternativesException;
import nl.nfi.yacc2ebnf.grammar.StructuralParseException;
import nl.nfi.yacc2ebnf.yacc.model.Element;
import nl.nfi.yacc2ebnf.yacc.model.Element.Literal;
import nl.nfi.yacc2ebnf.yacc.model.Element.NonTerminal;
import nl.nfi.yacc2ebnf.yacc.model.Grammar;
import nl.nfi.yacc2ebnf.yacc.model.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static nl.nfi.yacc2ebnf.common.parse.Parsers.endOfInputAfter;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.many;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.notFollowedBy;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.optional;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.sepBy1;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.some;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.symbol;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.token;

/**
 * Parses the rules section of a YACC grammar (the text between the {@code %%} lines) into a {@link Grammar}.
 * <p>
 * Accepted syntax, with white space and comments allowed between all tokens:
 * <pre>
 *   grammar    := production+
 *   production := identifier ':' rule ('|' rule)* ';'?
 *   rule       := (identifier | literal | action | '%prec' token)*
 * </pre>
 * Actions are brace delimited blocks of arbitrary code; they and precedence markers are discarded.
 * Each non-terminal may be defined only once, and may have at most one empty rule.
 */
public final class YaccParser {

    private static final Logger LOG = LoggerFactory.getLogger(YaccParser.class);

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern QUOTED = Pattern.compile("'(?:[^'\\\\\\n]|\\\\.)+'|\"(?:[^\"\\\\\\n]|\\\\.)*\"");

    private static final Parser<String> NAME = token("identifier", IDENTIFIER);
    private static final Parser<String> LITERAL = token("quoted literal", QUOTED);

    // an identifier directly followed by ':' starts the next production
    private static final Parser<Element> ELEMENT = NAME.before(notFollowedBy(symbol(":"), "':'"))
            .<Element>map(NonTerminal::new)
            .or(LITERAL.map(Literal::new));

    private static final Parser<Optional<Element>> RULE_PART = ELEMENT.map(Optional::of)
            .or(actionBlock().map(ignored -> Optional.empty()))
            .or(symbol("%prec").followedBy(NAME.or(LITERAL)).map(ignored -> Optional.empty()));

    private static final Parser<Rule> RULE = many(RULE_PART)
            .map(parts -> new Rule(parts.stream().flatMap(Optional::stream).toList()));

    private static final Parser<ProductionSyntax> PRODUCTION = NAME.before(symbol(":"))
            .then(name -> sepBy1(RULE, symbol("|"))
                    .before(optional(symbol(";")))
                    .map(rules -> new ProductionSyntax(name, rules)));

    private static final Parser<List<ProductionSyntax>> GRAMMAR = some(PRODUCTION).before(endOfInputAfter(PRODUCTION));

    private YaccParser() {
    }

    public static Grammar parse(final String sourceName, final String text) throws GrammarException {
        final List<ProductionSyntax> productions;
        try {
            productions = Parsers.run(GRAMMAR, text).value();
        } catch (final ParseFailedException e) {
            throw StructuralParseException.of(sourceName, e);
        }

        final Grammar grammar = Grammar.empty();
        for (final ProductionSyntax production : productions) {
            if (grammar.defines(production.name())) {
                throw new DuplicateDefinitionException(sourceName, production.name());
            }
            final long emptyRuleCount = production.rules().stream().filter(Rule::isEmpty).count();
            if (emptyRuleCount > 1) {
                throw new MultipleEmptyAlternativesException(sourceName, production.name(), (int) emptyRuleCount);
            }
            grammar.addProduction(production.name(), production.rules());
        }

        LOG.debug("Parsed {} productions from {}", grammar.size(), sourceName);
        return grammar;
    }

    // skips a brace delimited block, counting nested braces
    private static Parser<Void> actionBlock() {
        return symbol("{").followedBy(input -> {
            final String text = input.text();
            int depth = 1;
            for (int offset = input.offset(); offset < text.length(); offset++) {
                final char c = text.charAt(offset);
                if (c == '{') {
                    depth++;
                } else if (c == '}' && --depth == 0) {
                    return new Success<>(null, input.skipTo(offset + 1));
                }
            }
            return new Failure<>("'}' closing the action block", input.skipTo(text.length()));
        });
    }

    private record ProductionSyntax(String name, List<Rule> rules) {
    }
}
