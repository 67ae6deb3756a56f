package nl.nfi.djcnf.normalize.stage;

import nl.nfi.djcnf.normalize.grammar.Body;
import nl.nfi.djcnf.normalize.grammar.Grammar;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static nl.nfi.djcnf.common.Formatting.toSetString;
import static nl.nfi.djcnf.normalize.analysis.GrammarAnalysis.generating;
import static nl.nfi.djcnf.normalize.analysis.GrammarAnalysis.isGeneratedBy;
import static nl.nfi.djcnf.normalize.analysis.GrammarAnalysis.reachable;

/**
 * Keeps only nonterminals that are both generating and reachable from the start symbol.
 * <p>
 * Non-generating symbols are removed first; reachability is computed on what remains. The
 * start symbol is always kept, an empty set of bodies then denotes the empty language.
 */
public final class UselessSymbolRemover implements NormalizationStage {

    @Override
    public String name() {
        return "Remove useless symbols";
    }

    @Override
    public StageResult apply(final Grammar grammar) {
        final List<String> trace = new ArrayList<>();
        final String start = grammar.start();

        final Set<String> generating = generating(grammar);
        trace.add("Generating set = " + toSetString(generating));

        // the builder always holds the start symbol, so it is reinserted (empty) when it does not generate
        final Grammar.Builder generatingOnly = Grammar.builder(start);
        for (final String head : grammar.nonTerminals()) {
            if (!generating.contains(head)) {
                continue;
            }
            generatingOnly.declare(head);
            for (final Body body : grammar.bodies(head)) {
                if (isGeneratedBy(body, generating)) {
                    generatingOnly.add(head, body);
                }
            }
        }
        final Grammar intermediate = generatingOnly.build();

        final Set<String> reachable = reachable(intermediate);
        trace.add("Reachable set = " + toSetString(reachable));

        final Grammar.Builder result = Grammar.builder(start);
        for (final String head : intermediate.nonTerminals()) {
            if (reachable.contains(head)) {
                result.addAll(head, intermediate.bodies(head));
            }
        }
        final Grammar output = result.build();

        final Set<String> removed = new LinkedHashSet<>(grammar.nonTerminals());
        removed.removeAll(output.nonTerminals());
        trace.add("Removed nonterminals = " + toSetString(removed));
        if (output.isEmptyLanguage()) {
            trace.add("Language is empty: %s has no productions left".formatted(start));
        }

        return new StageResult(name(), grammar, output, trace);
    }
}
