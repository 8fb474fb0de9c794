package nl.nfi.yacc2ebnf.common.parse;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static nl.nfi.yacc2ebnf.common.parse.Parsers.endOfInput;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.many;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.notFollowedBy;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.optional;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.sepBy1;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.some;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.symbol;
import static nl.nfi.yacc2ebnf.common.parse.Parsers.token;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParsersTest {

    private static final Parser<String> WORD = token("word", Pattern.compile("[a-z]+"));

    @Test
    void skipsWhitespaceAndComments() throws ParseFailedException {
        final Parsed<List<String>> parsed = Parsers.run(many(WORD), " a /* b\n c */ d // e\n f ");

        assertThat(parsed.value()).containsExactly("a", "d", "f");
        assertThat(parsed.isComplete()).isTrue();
    }

    @Test
    void unterminatedCommentIsNotSkipped() throws ParseFailedException {
        final Parsed<List<String>> parsed = Parsers.run(many(WORD), "a /* b");

        assertThat(parsed.value()).containsExactly("a");
        assertThat(parsed.isComplete()).isFalse();
        assertThat(parsed.leftoverPreview(10)).isEqualTo("/* b");
    }

    @Test
    void alternativesBacktrack() throws ParseFailedException {
        final Parser<String> pair = WORD.before(symbol("=")).or(WORD.before(symbol(":")));

        assertThat(Parsers.run(pair, "key : value").value()).isEqualTo("key");
    }

    @Test
    void furthestFailureIsReported() {
        final Parser<String> assignment = WORD.before(symbol("=")).before(WORD).or(symbol("("));

        assertThatThrownBy(() -> Parsers.run(assignment, "key = 42"))
                .isInstanceOfSatisfying(ParseFailedException.class, e -> {
                    assertThat(e.expected()).isEqualTo("word");
                    assertThat(e.position().line()).isEqualTo(1);
                    assertThat(e.position().column()).isEqualTo(7);
                });
    }

    @Test
    void sameDepthFailuresAreMerged() {
        assertThatThrownBy(() -> Parsers.run(symbol("(").or(symbol("[")), "{"))
                .isInstanceOfSatisfying(ParseFailedException.class, e -> assertThat(e.expected()).isEqualTo("'(' or '['"));
    }

    @Test
    void separatedList() throws ParseFailedException {
        final Parsed<List<String>> parsed = Parsers.run(sepBy1(WORD, symbol(",")), "a, b ,c,");

        assertThat(parsed.value()).containsExactly("a", "b", "c");
        assertThat(parsed.rest().remainder()).isEqualTo(",");
    }

    @Test
    void someRequiresOne() {
        assertThatThrownBy(() -> Parsers.run(some(WORD), "42")).isInstanceOf(ParseFailedException.class);
    }

    @Test
    void optionalDoesNotConsumeOnFailure() throws ParseFailedException {
        final Parsed<Optional<String>> parsed = Parsers.run(optional(symbol(";")), "x");

        assertThat(parsed.value()).isEmpty();
        assertThat(parsed.rest().offset()).isZero();
    }

    @Test
    void notFollowedByLooksAhead() throws ParseFailedException {
        final Parser<String> reference = WORD.before(notFollowedBy(symbol(":"), "':'"));

        assertThat(Parsers.run(many(reference), "a b c: d").value()).containsExactly("a", "b");
    }

    @Test
    void endOfInputAfterTrailingWhitespace() throws ParseFailedException {
        assertThat(Parsers.run(WORD.before(endOfInput()), "word \n /* done */").value()).isEqualTo("word");
        assertThatThrownBy(() -> Parsers.run(WORD.before(endOfInput()), "word word"))
                .isInstanceOfSatisfying(ParseFailedException.class, e -> assertThat(e.expected()).isEqualTo("end of input"));
    }

    @Test
    void positionsAreOneBased() {
        final ParseInput input = new ParseInput("ab\ncd\nef", 4);

        assertThat(input.line()).isEqualTo(2);
        assertThat(input.column()).isEqualTo(2);
        assertThat(input.preview(10)).isEqualTo("d");
    }
}
