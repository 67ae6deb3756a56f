package nl.nfi.djcnf.normalize.grammar;

import org.junit.jupiter.api.Test;

import static nl.nfi.djcnf.Utils.grammar;
import static org.assertj.core.api.Assertions.assertThat;

class GrammarFormatterTest {

    @Test
    void startFirstThenSortedWithEpsilonLast() {
        final Grammar grammar = grammar(
                "S -> ε | bB | AB",
                "B -> b",
                "A -> a | ε"
        );

        assertThat(GrammarFormatter.format(grammar)).isEqualTo("""
                S -> AB | bB | ε
                A -> a | ε
                B -> b""");
    }

    @Test
    void emptyBodySetPrintsAsEmptySet() {
        assertThat(GrammarFormatter.format(Grammar.builder("S").build())).isEqualTo("S -> ∅");
    }

    @Test
    void multiCharacterSymbolsAreSpaced() {
        final Grammar grammar = Grammar.builder("S")
                .add("S", Body.of("A", "Y1"))
                .add("Y1", Body.of("B", "C"))
                .build();

        assertThat(GrammarFormatter.format(grammar)).isEqualTo("""
                S -> A Y1
                Y1 -> BC""");
    }
}
