package nl.nfi.yacc2ebnf.yacc.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class Grammar {

    // in order of definition
    private final Map<String, List<Rule>> productions;

    private Grammar(final Map<String, List<Rule>> productions) {
        this.productions = productions;
    }

    public static Grammar empty() {
        return new Grammar(new LinkedHashMap<>());
    }

    // callers check for duplicates, a second definition replaces the first
    public Grammar addProduction(final String name, final List<Rule> rules) {
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("Production needs at least one rule: %s".formatted(name));
        }
        productions.put(name, List.copyOf(rules));
        return this;
    }

    public boolean defines(final String name) {
        return productions.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(productions.keySet());
    }

    public List<Rule> getRules(final String name) {
        final List<Rule> rules = productions.get(name);
        if (rules == null) {
            throw new IllegalStateException("No production found for " + name);
        }
        return rules;
    }

    public int size() {
        return productions.size();
    }
}
