package nl.nfi.yacc2ebnf.ebnf;

import nl.nfi.yacc2ebnf.common.parse.ParseFailedException;
import nl.nfi.yacc2ebnf.common.parse.Parsed;
import nl.nfi.yacc2ebnf.common.parse.Parser;
import nl.nfi.yacc2ebnf.common.parse.Parsers;
import nl.nfi.yacc2ebnf.ebnf.model.Choice;
import nl.nfi.yacc2ebnf.ebnf.model.Item;
import nl.nfi.yacc2ebnf.ebnf.model.Primary;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Group;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Name;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Term;
import nl.nfi.yacc2ebnf.ebnf.model.Production;
import nl.nfi.yacc2ebnf.ebnf.model.Quantifier;
import nl.nfi.yacc2ebnf.ebnf.model.Sequence;
import nl.nfi.yacc2ebnf.grammar.StructuralParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Pattern;

import static nl.nfi.yacc2ebnf.common.parse.Parsers.lazy;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.many;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.notFollowedBy;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.optional;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.sepBy1;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.some;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.symbol;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.token;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.whitespace;

/**
 * Parses W3C style EBNF, e.g. the definitions of lexical terminals:
 * <pre>
 *   digit ::= [0-9]
 *   number ::= digit+ ('.' digit+)?
 * </pre>
 * Both {@code ::=} and {@code :} separate a name from its definition and a production may end with {@code ;}.
 * No grammar invariants are checked, the productions are taken as given.
 */
public final class EbnfParser {

    private static final Logger LOG = LoggerFactory.getLogger(EbnfParser.class);

    private static final int LEFTOVER_PREVIEW_LENGTH = 40;

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern LITERAL = Pattern.compile("'[^'\\n]*'|\"[^\"\\n]*\"|\\[\\^?\\]?[^\\]\\n]*\\]|#x[0-9a-fA-F]+");
    private static final Pattern QUANTIFIER = Pattern.compile("[?*+]");

    private static final Parser<String> NAME = token("identifier", IDENTIFIER);

    private static final Parser<Production> PRODUCTION = NAME
            .before(symbol("::=").or(symbol(":")))
            .then(name -> lazy(EbnfParser::choice)
                    .before(optional(symbol(";")))
                    .map(choice -> new Production(name, choice)));

    private static final Parser<List<Production>> GRAMMAR = some(PRODUCTION).before(whitespace());

    private EbnfParser() {
    }

    // a leftover that does not parse as a production is reported, not rejected
    public static Parsed<List<Production>> parse(final String sourceName, final String text) throws StructuralParseException {
        final Parsed<List<Production>> parsed;
        try {
            parsed = Parsers.run(GRAMMAR, text);
        } catch (final ParseFailedException e) {
            throw StructuralParseException.of(sourceName, e);
        }

        if (!parsed.isComplete()) {
            LOG.warn("Incomplete parse of {}, unconsumed input at {}:{}: {}", sourceName,
                    parsed.rest().line(), parsed.rest().column(), parsed.leftoverPreview(LEFTOVER_PREVIEW_LENGTH));
        }
        LOG.debug("Parsed {} productions from {}", parsed.value().size(), sourceName);
        return parsed;
    }

    private static Parser<Choice> choice() {
        return sepBy1(sequence(), symbol("|")).map(Choice::new);
    }

    private static Parser<Sequence> sequence() {
        return many(item()).map(Sequence::new);
    }

    private static Parser<Item> item() {
        return primary().then(primary -> optional(token("quantifier", QUANTIFIER))
                .map(quantifier -> new Item(primary, quantifier.map(Quantifier::fromSymbol).orElse(Quantifier.NONE))));
    }

    // a name followed by a separator is the start of the next production, not a reference
    private static Parser<Primary> primary() {
        return NAME.before(notFollowedBy(symbol(":"), "':' or '::='"))
                .<Primary>map(Name::new)
                .or(token("literal", LITERAL).map(Term::new))
                .or(symbol("(").followedBy(lazy(EbnfParser::choice)).before(symbol(")")).map(Group::new))
                .label("identifier, literal or '('");
    }
}
