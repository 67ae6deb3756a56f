package nl.nfi.djcnf.normalize.analysis;

import nl.nfi.djcnf.normalize.grammar.Body;
import nl.nfi.djcnf.normalize.grammar.Grammar;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;

import static nl.nfi.djcnf.normalize.analysis.FixedPoint.leastFixedPoint;
import static nl.nfi.djcnf.normalize.grammar.Symbols.isTerminal;

// the three derivability predicates of a grammar, each a least fixed point over its nonterminals
public final class GrammarAnalysis {

    private GrammarAnalysis() {
    }

    // A =>* ε
    public static SortedSet<String> nullable(final Grammar grammar) {
        final List<String> seed = grammar.nonTerminals().stream()
                .filter(nonTerminal -> grammar.bodies(nonTerminal).contains(Body.epsilon()))
                .toList();

        return leastFixedPoint(seed, grammar.nonTerminals(), (nonTerminal, nullable) ->
                grammar.bodies(nonTerminal).stream().anyMatch(body -> nullable.containsAll(body.symbols()))
        );
    }

    // A =>* w for some terminal string w (possibly empty)
    public static SortedSet<String> generating(final Grammar grammar) {
        return leastFixedPoint(List.of(), grammar.nonTerminals(), (nonTerminal, generating) ->
                grammar.bodies(nonTerminal).stream().anyMatch(body -> isGeneratedBy(body, generating))
        );
    }

    // S =>* αAβ
    public static SortedSet<String> reachable(final Grammar grammar) {
        return leastFixedPoint(List.of(grammar.start()), grammar.referencedNonTerminals(), (nonTerminal, reachable) ->
                reachable.stream()
                        .flatMap(from -> grammar.bodies(from).stream())
                        .anyMatch(body -> body.contains(nonTerminal))
        );
    }

    // every symbol is a terminal or one of the given nonterminals
    public static boolean isGeneratedBy(final Body body, final Set<String> generating) {
        for (final String symbol : body.symbols()) {
            if (!isTerminal(symbol) && !generating.contains(symbol)) {
                return false;
            }
        }
        return true;
    }
}
