package nl.nfi.djcnf.normalize.stage;

import nl.nfi.djcnf.normalize.grammar.Body;
import nl.nfi.djcnf.normalize.grammar.Grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Collections.emptySet;
import static nl.nfi.djcnf.common.Formatting.toSetString;

/**
 * Removes unit productions (A -> B). Every nonterminal receives the non-unit bodies of all
 * nonterminals in its unit closure.
 */
public final class UnitProductionEliminator implements NormalizationStage {

    @Override
    public String name() {
        return "Eliminate unit productions";
    }

    @Override
    public StageResult apply(final Grammar grammar) {
        final List<String> trace = new ArrayList<>();
        final Map<String, Set<String>> closures = unitClosures(grammar);

        final Grammar.Builder result = Grammar.builder(grammar.start());
        for (final String head : grammar.nonTerminals()) {
            result.declare(head);
            for (final String member : closures.get(head)) {
                for (final Body body : grammar.bodies(member)) {
                    if (body.isUnit()) {
                        continue;
                    }
                    // ε is only allowed to remain at the start symbol
                    if (body.isEpsilon() && !head.equals(grammar.start())) {
                        continue;
                    }
                    result.add(head, body);
                }
            }
            trace.add("Unit closure(%s) = %s".formatted(head, toSetString(closures.get(head))));
        }

        return new StageResult(name(), grammar, result.build(), trace);
    }

    // A -> {B | A =>* B using unit productions only}, including A itself
    static Map<String, Set<String>> unitClosures(final Grammar grammar) {
        final Map<String, Set<String>> closures = new LinkedHashMap<>();
        for (final String nonTerminal : grammar.nonTerminals()) {
            closures.put(nonTerminal, new LinkedHashSet<>(List.of(nonTerminal)));
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (final String head : grammar.nonTerminals()) {
                final Set<String> closure = closures.get(head);
                for (final Body body : grammar.bodies(head)) {
                    if (body.isUnit() && closure.add(body.symbolAt(0))) {
                        changed = true;
                    }
                }
                for (final String member : List.copyOf(closure)) {
                    if (closure.addAll(closures.getOrDefault(member, emptySet()))) {
                        changed = true;
                    }
                }
            }
        }
        return closures;
    }
}
