package nl.nfi.djcnf.normalize.analysis;

import nl.nfi.djcnf.normalize.grammar.Grammar;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Random;
import java.util.Set;

import static nl.nfi.djcnf.Utils.grammar;
import static nl.nfi.djcnf.Utils.languages;
import static nl.nfi.djcnf.Utils.randomGrammar;
import static nl.nfi.djcnf.normalize.analysis.GrammarAnalysis.generating;
import static nl.nfi.djcnf.normalize.analysis.GrammarAnalysis.nullable;
import static nl.nfi.djcnf.normalize.analysis.GrammarAnalysis.reachable;
import static org.assertj.core.api.Assertions.assertThat;

class GrammarAnalysisTest {

    @Test
    void nullableFollowsChains() {
        final Grammar grammar = grammar(
                "S -> AB | ε",
                "A -> aA | ε",
                "B -> bB | ε"
        );
        assertThat(nullable(grammar)).containsExactly("A", "B", "S");
    }

    @Test
    void nullableNeedsEveryBodySymbolNullable() {
        final Grammar grammar = grammar(
                "S -> AC | Ab",
                "A -> B",
                "B -> ε",
                "C -> c"
        );
        assertThat(nullable(grammar)).containsExactly("A", "B");
    }

    @Test
    void nullableMatchesBoundedDerivations() {
        final Random random = new Random(7);
        for (int i = 0; i < 200; i++) {
            final Grammar grammar = randomGrammar(random);
            final Map<String, Set<String>> languages = languages(grammar, 0);

            for (final String nonTerminal : grammar.nonTerminals()) {
                assertThat(nullable(grammar).contains(nonTerminal))
                        .as("%s nullable in%n%s", nonTerminal, grammar)
                        .isEqualTo(languages.get(nonTerminal).contains(""));
            }
        }
    }

    @Test
    void generatingExcludesSelfRecursionWithoutExit() {
        final Grammar grammar = grammar(
                "S -> aS | A | D",
                "A -> a",
                "D -> Dd"
        );
        assertThat(generating(grammar)).containsExactly("A", "S");
    }

    @Test
    void epsilonBodyIsGenerating() {
        assertThat(generating(grammar("S -> ε"))).containsExactly("S");
    }

    @Test
    void reachableStartsAtStartSymbol() {
        final Grammar grammar = grammar(
                "S -> aA",
                "A -> B | a",
                "B -> b",
                "C -> c"
        );
        assertThat(reachable(grammar)).containsExactly("A", "B", "S");
    }

    @Test
    void reachableIncludesReferencedButUndefinedNonTerminals() {
        assertThat(reachable(grammar("S -> aX"))).containsExactly("S", "X");
    }
}
