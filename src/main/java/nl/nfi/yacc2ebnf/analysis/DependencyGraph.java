package nl.nfi.yacc2ebnf.analysis;

import nl.nfi.yacc2ebnf.yacc.model.Element;
import nl.nfi.yacc2ebnf.yacc.model.Element.NonTerminal;
import nl.nfi.yacc2ebnf.yacc.model.Grammar;
import nl.nfi.yacc2ebnf.yacc.model.Rule;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.lang.Math.min;

/**
 * The "references" relation between the non-terminals of a grammar, and its strongly connected components.
 * <p>
 * Components are ordered leaves first: when a member of component A references a member of component B,
 * B comes before A. References to names the grammar does not define (tokens) are not part of the graph.
 */
public final class DependencyGraph {

    // in order of definition, each with its references in order of first occurrence
    private final Map<String, List<String>> references;

    private DependencyGraph(final Map<String, List<String>> references) {
        this.references = references;
    }

    public static DependencyGraph of(final Grammar grammar) {
        final Map<String, List<String>> references = new LinkedHashMap<>();
        for (final String name : grammar.names()) {
            final Set<String> referenced = new LinkedHashSet<>();
            for (final Rule rule : grammar.getRules(name)) {
                for (final Element element : rule.elements()) {
                    if (element instanceof final NonTerminal nonTerminal && grammar.defines(nonTerminal.name())) {
                        referenced.add(nonTerminal.name());
                    }
                }
            }
            references.put(name, List.copyOf(referenced));
        }
        return new DependencyGraph(references);
    }

    public List<String> referencesOf(final String name) {
        final List<String> referenced = references.get(name);
        if (referenced == null) {
            throw new IllegalArgumentException("Unknown non-terminal: %s".formatted(name));
        }
        return referenced;
    }

    // Tarjan's algorithm, which finishes a component only after every component it references
    public List<Component> components() {
        final Search search = new Search();
        for (final String name : references.keySet()) {
            if (!search.index.containsKey(name)) {
                search.visit(name);
            }
        }
        return Collections.unmodifiableList(search.components);
    }

    // members in the order they were popped from the search stack
    public record Component(List<String> members, boolean cyclic) {

        public Component {
            members = List.copyOf(members);
        }
    }

    private final class Search {

        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new LinkedHashSet<>();
        private final List<Component> components = new ArrayList<>();

        private void visit(final String name) {
            final int nameIndex = index.size();
            index.put(name, nameIndex);
            lowLink.put(name, nameIndex);
            stack.push(name);
            onStack.add(name);

            for (final String referenced : references.get(name)) {
                if (!index.containsKey(referenced)) {
                    visit(referenced);
                    lowLink.put(name, min(lowLink.get(name), lowLink.get(referenced)));
                } else if (onStack.contains(referenced)) {
                    lowLink.put(name, min(lowLink.get(name), index.get(referenced)));
                }
            }

            if (lowLink.get(name) == nameIndex) {
                final List<String> members = new ArrayList<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    members.add(member);
                } while (!member.equals(name));
                final boolean cyclic = members.size() > 1 || references.get(name).contains(name);
                components.add(new Component(members, cyclic));
            }
        }
    }
}
