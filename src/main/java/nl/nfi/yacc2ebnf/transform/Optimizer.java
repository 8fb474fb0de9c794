package nl.nfi.yacc2ebnf.transform;

import nl.nfi.yacc2ebnf.analysis.DependencyGraph.Component;
import nl.nfi.yacc2ebnf.ebnf.model.Choice;
import nl.nfi.yacc2ebnf.ebnf.model.Item;
import nl.nfi.yacc2ebnf.ebnf.model.Primary;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Group;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Name;
import nl.nfi.yacc2ebnf.ebnf.model.Primary.Term;
import nl.nfi.yacc2ebnf.ebnf.model.Production;
import nl.nfi.yacc2ebnf.ebnf.model.Quantifier;
import nl.nfi.yacc2ebnf.ebnf.model.Sequence;
import nl.nfi.yacc2ebnf.yacc.model.Grammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simplifies productions by inlining references to trivial productions and then flattening groups
 * that have a single alternative into the enclosing sequence.
 * <p>
 * A production is trivial when it is either a choice between at most {@value #MAX_TRIVIAL_ALTERNATIVES}
 * single unquantified terminals, e.g. {@code sign ::= '+' | '-'}, or a single sequence of at most
 * {@value #MAX_TRIVIAL_SEQUENCE_LENGTH} unquantified names and terminals, e.g. {@code arrow ::= '-' '>'}.
 * Inlining replaces a reference by a group holding the referenced choice, flattening then removes the
 * group again where that does not change the meaning.
 */
public final class Optimizer {

    private static final Logger LOG = LoggerFactory.getLogger(Optimizer.class);

    public static final int MAX_TRIVIAL_ALTERNATIVES = 5;
    public static final int MAX_TRIVIAL_SEQUENCE_LENGTH = 3;

    // productions that references are resolved against
    private final Map<String, Production> productions;

    private Optimizer(final Map<String, Production> productions) {
        this.productions = productions;
    }

    public static Optimizer over(final Map<String, Production> productions) {
        return new Optimizer(productions);
    }

    /**
     * Converts and optimizes the productions of the grammar, one component at a time, leaves first.
     * All members of a component are inserted before any of them is optimized, so members of a cycle
     * see each other in their converted form.
     *
     * @param grammar    the grammar to convert
     * @param components the strongly connected components of the grammar, leaves first
     * @param terminals  productions defining names the grammar does not, taken as they are
     * @return the terminals, overridden and extended by the optimized productions of the grammar
     */
    public static Map<String, Production> optimizeGrammar(final Grammar grammar, final List<Component> components, final Map<String, Production> terminals) {
        final Map<String, Production> productions = new LinkedHashMap<>(terminals);
        for (final Component component : components) {
            for (final String name : component.members()) {
                productions.put(name, YaccToEbnf.convert(grammar, name));
            }
            final Optimizer optimizer = Optimizer.over(Map.copyOf(productions));
            for (final String name : component.members()) {
                productions.put(name, optimizer.optimize(productions.get(name)));
            }
            if (component.cyclic()) {
                LOG.debug("Optimized recursive component {}", component.members());
            }
        }
        return productions;
    }

    public Production optimize(final Production production) {
        return new Production(production.name(), flatten(inline(production.choice())));
    }

    public static boolean isTrivial(final Production production) {
        final List<Sequence> alternatives = production.choice().alternatives();
        final boolean fewTerminals = alternatives.size() <= MAX_TRIVIAL_ALTERNATIVES
                && alternatives.stream().allMatch(alternative -> alternative.size() == 1 && isPlainTerm(alternative.items().get(0)));
        final boolean shortSequence = alternatives.size() == 1
                && alternatives.get(0).size() <= MAX_TRIVIAL_SEQUENCE_LENGTH
                && alternatives.get(0).items().stream().allMatch(item -> isPlainTerm(item) || isPlainName(item));
        return fewTerminals || shortSequence;
    }

    private static boolean isPlainTerm(final Item item) {
        return !item.isQuantified() && item.primary() instanceof Term;
    }

    private static boolean isPlainName(final Item item) {
        return !item.isQuantified() && item.primary() instanceof Name;
    }

    Choice inline(final Choice choice) {
        return new Choice(choice.alternatives().stream()
                .map(alternative -> new Sequence(alternative.items().stream()
                        .map(item -> new Item(inline(item.primary()), item.quantifier()))
                        .toList()))
                .toList());
    }

    private Primary inline(final Primary primary) {
        if (primary instanceof final Name name) {
            final Production referenced = productions.get(name.name());
            return referenced != null && isTrivial(referenced) ? new Group(referenced.choice()) : primary;
        }
        if (primary instanceof final Group group) {
            return new Group(inline(group.choice()));
        }
        return primary;
    }

    Choice flatten(final Choice choice) {
        return new Choice(choice.alternatives().stream().map(this::flatten).toList());
    }

    private Sequence flatten(final Sequence sequence) {
        final List<Item> items = new ArrayList<>();
        for (final Item item : sequence.items()) {
            items.addAll(flatten(item));
        }
        return new Sequence(items);
    }

    // the items that replace the given one in its sequence
    private List<Item> flatten(final Item item) {
        if (!(item.primary() instanceof final Group group)) {
            return List.of(item);
        }
        if (group.choice().size() > 1) {
            return List.of(new Item(new Group(flatten(group.choice())), item.quantifier()));
        }

        final Sequence inner = flatten(group.choice().alternatives().get(0));
        if (inner.size() == 1) {
            final Item single = inner.items().get(0);
            if (!item.isQuantified() || !single.isQuantified()) {
                return List.of(new Item(single.primary(), combine(item.quantifier(), single.quantifier())));
            }
            // e.g. (x?)+ has no single quantifier equivalent
            return List.of(item);
        }
        if (!item.isQuantified()) {
            return inner.items();
        }
        return List.of(item);
    }

    private static Quantifier combine(final Quantifier outer, final Quantifier inner) {
        return outer.isPresent() ? outer : inner;
    }
}
