package nl.nfi.djcnf.normalize.grammar;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

import static java.lang.String.join;
import static java.util.Comparator.comparing;
import static nl.nfi.djcnf.common.Formatting.EMPTY_SET;

public final class GrammarFormatter {

    // epsilon last, the rest alphabetically by printed form
    public static final Comparator<Body> BODY_ORDER = comparing(Body::isEpsilon).thenComparing(Body::toString);

    private GrammarFormatter() {
    }

    // start symbol first, then the other nonterminals sorted:
    //      S -> AB | a | ε
    //      A -> a
    //      B -> ∅
    public static String format(final Grammar grammar) {
        final List<String> order = new ArrayList<>(grammar.nonTerminals());
        order.sort(comparing((String nonTerminal) -> !nonTerminal.equals(grammar.start())).thenComparing(Comparator.<String>naturalOrder()));

        final List<String> lines = new ArrayList<>(order.size());
        for (final String nonTerminal : order) {
            lines.add(formatRule(nonTerminal, grammar.bodies(nonTerminal)));
        }
        return join("\n", lines);
    }

    public static String formatRule(final String nonTerminal, final Set<Body> bodies) {
        final String rhs = bodies.isEmpty() ? EMPTY_SET : formatAlternatives(bodies);
        return nonTerminal + " -> " + rhs;
    }

    public static String formatAlternatives(final Collection<Body> bodies) {
        return join(" | ", bodies.stream().sorted(BODY_ORDER).map(Body::toString).toList());
    }
}
