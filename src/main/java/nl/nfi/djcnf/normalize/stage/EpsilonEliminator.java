package nl.nfi.djcnf.normalize.stage;

import nl.nfi.djcnf.normalize.grammar.Body;
import nl.nfi.djcnf.normalize.grammar.Grammar;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static nl.nfi.djcnf.common.Formatting.toSetString;
import static nl.nfi.djcnf.normalize.analysis.GrammarAnalysis.nullable;
import static nl.nfi.djcnf.normalize.grammar.GrammarFormatter.formatAlternatives;

/**
 * Removes ε-productions. Each body is expanded into all variants that omit some subset of its
 * nullable occurrences; only the start symbol may keep ε, and only when {@code keepStartEpsilon}
 * is set.
 */
public final class EpsilonEliminator implements NormalizationStage {

    // a body with this many nullable occurrences would expand into more than 2^30 variants
    static final int MAX_NULLABLE_POSITIONS = 30;

    private final boolean keepStartEpsilon;

    private EpsilonEliminator(final boolean keepStartEpsilon) {
        this.keepStartEpsilon = keepStartEpsilon;
    }

    public static EpsilonEliminator keepingStartEpsilon(final boolean keepStartEpsilon) {
        return new EpsilonEliminator(keepStartEpsilon);
    }

    @Override
    public String name() {
        return "Eliminate ε-productions";
    }

    @Override
    public StageResult apply(final Grammar grammar) {
        final List<String> trace = new ArrayList<>();
        final Set<String> nullable = nullable(grammar);
        trace.add("Nullable set = " + toSetString(nullable));

        final String start = grammar.start();
        final Grammar.Builder result = Grammar.builder(start);

        for (final String head : grammar.nonTerminals()) {
            result.declare(head);

            for (final Body body : grammar.bodies(head)) {
                final List<Integer> positions = nullablePositions(body, nullable);
                if (positions.size() > MAX_NULLABLE_POSITIONS) {
                    throw new IllegalArgumentException("Too many nullable occurrences (%d, at most %d) in %s -> %s"
                            .formatted(positions.size(), MAX_NULLABLE_POSITIONS, head, body));
                }
                final Set<Body> generated = new LinkedHashSet<>();

                for (int mask = 0; mask < 1 << positions.size(); mask++) {
                    final Body candidate = body.withoutPositions(selected(positions, mask));
                    if (!candidate.isEpsilon()) {
                        generated.add(candidate);
                    } else if (head.equals(start) && keepStartEpsilon) {
                        generated.add(Body.epsilon());
                    }
                }

                if (!positions.isEmpty()) {
                    trace.add("%s -> %s  =>  %s".formatted(head, body, formatAlternatives(generated)));
                }
                result.addAll(head, generated);
            }
        }

        if (keepStartEpsilon && nullable.contains(start)) {
            result.add(start, Body.epsilon());
        }
        for (final String head : grammar.nonTerminals()) {
            if (!head.equals(start)) {
                result.remove(head, Body.epsilon());
            }
        }

        return new StageResult(name(), grammar, result.build(), trace);
    }

    private static List<Integer> nullablePositions(final Body body, final Set<String> nullable) {
        final List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < body.size(); i++) {
            if (nullable.contains(body.symbolAt(i))) {
                positions.add(i);
            }
        }
        return positions;
    }

    // the positions whose bit is set in the mask
    private static List<Integer> selected(final List<Integer> positions, final int mask) {
        final List<Integer> dropped = new ArrayList<>();
        for (int bit = 0; bit < positions.size(); bit++) {
            if ((mask >> bit & 1) == 1) {
                dropped.add(positions.get(bit));
            }
        }
        return dropped;
    }
}
