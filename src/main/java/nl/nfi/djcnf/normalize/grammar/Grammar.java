package nl.nfi.djcnf.normalize.grammar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;
import static nl.nfi.djcnf.normalize.grammar.Symbols.isNonTerminal;

/**
 * Immutable context-free grammar: a start nonterminal and, per nonterminal, a set of bodies.
 * <p>
 * A nonterminal may be mapped to an empty set of bodies (e.g. after all of its bodies were
 * removed). The start symbol always has an entry, an empty one signals an empty language.
 * Use {@link #builder(String)} to create new instances.
 */
public final class Grammar {

    private final String start;
    private final Map<String, Set<Body>> productions;

    private Grammar(final String start, final Map<String, Set<Body>> productions) {
        this.start = start;
        this.productions = productions;
    }

    public static Builder builder(final String start) {
        return new Builder(start);
    }

    public String start() {
        return start;
    }

    // nonterminals that have an entry, in insertion order
    public Set<String> nonTerminals() {
        return productions.keySet();
    }

    // nonterminals with an entry plus every nonterminal used in some body
    public Set<String> referencedNonTerminals() {
        final Set<String> referenced = new LinkedHashSet<>(productions.keySet());
        for (final Set<Body> bodies : productions.values()) {
            for (final Body body : bodies) {
                for (final String symbol : body.symbols()) {
                    if (isNonTerminal(symbol)) {
                        referenced.add(symbol);
                    }
                }
            }
        }
        return unmodifiableSet(referenced);
    }

    // empty for nonterminals without an entry
    public Set<Body> bodies(final String nonTerminal) {
        return productions.getOrDefault(nonTerminal, Collections.emptySet());
    }

    public Map<String, Set<Body>> productions() {
        return productions;
    }

    public int productionCount() {
        return productions.values().stream().mapToInt(Set::size).sum();
    }

    public boolean isEmptyLanguage() {
        return bodies(start).isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Grammar other)) {
            return false;
        }
        return start.equals(other.start) && productions.equals(other.productions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, productions);
    }

    @Override
    public String toString() {
        return GrammarFormatter.format(this);
    }

    public static final class Builder {

        private final String start;
        private final Map<String, Set<Body>> productions;

        private Builder(final String start) {
            if (!isNonTerminal(start)) {
                throw new IllegalArgumentException("Start symbol must be a nonterminal: %s".formatted(start));
            }
            this.start = start;
            this.productions = new LinkedHashMap<>();
            this.productions.put(start, new LinkedHashSet<>());
        }

        // registers the nonterminal, possibly without any body
        public Builder declare(final String nonTerminal) {
            if (!isNonTerminal(nonTerminal)) {
                throw new IllegalArgumentException("Not a nonterminal: %s".formatted(nonTerminal));
            }
            productions.computeIfAbsent(nonTerminal, k -> new LinkedHashSet<>());
            return this;
        }

        public Builder add(final String nonTerminal, final Body body) {
            declare(nonTerminal);
            productions.get(nonTerminal).add(body);
            return this;
        }

        public Builder addAll(final String nonTerminal, final Set<Body> bodies) {
            declare(nonTerminal);
            productions.get(nonTerminal).addAll(bodies);
            return this;
        }

        public Builder remove(final String nonTerminal, final Body body) {
            final Set<Body> bodies = productions.get(nonTerminal);
            if (bodies != null) {
                bodies.remove(body);
            }
            return this;
        }

        public Grammar build() {
            final Map<String, Set<Body>> copy = new LinkedHashMap<>();
            productions.forEach((nonTerminal, bodies) -> copy.put(nonTerminal, unmodifiableSet(new LinkedHashSet<>(bodies))));
            return new Grammar(start, unmodifiableMap(copy));
        }
    }
}
