package nl.nfi.djcnf;

import nl.nfi.djcnf.normalize.grammar.Body;
import nl.nfi.djcnf.normalize.grammar.Grammar;
import nl.nfi.djcnf.normalize.grammar.GrammarReader;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeSet;

import static java.util.Collections.emptySet;
import static nl.nfi.djcnf.normalize.grammar.Symbols.isTerminal;

public final class Utils {

    public static final Path TEST_RESOURCES_PATH = Paths.get("src/test/resources").toAbsolutePath();

    public static Grammar grammar(final String... rules) {
        return GrammarReader.withDefaults().read("test", List.of(rules));
    }

    // all terminal strings of length <= maxLength derivable from the start symbol,
    // computed as the least solution of the grammar equations truncated at maxLength
    public static Set<String> language(final Grammar grammar, final int maxLength) {
        return languages(grammar, maxLength).getOrDefault(grammar.start(), emptySet());
    }

    public static Map<String, Set<String>> languages(final Grammar grammar, final int maxLength) {
        final Map<String, Set<String>> languages = new HashMap<>();
        for (final String nonTerminal : grammar.referencedNonTerminals()) {
            languages.put(nonTerminal, new TreeSet<>());
        }

        boolean changed = true;
        while (changed) {
            changed = false;
            for (final String head : grammar.nonTerminals()) {
                for (final Body body : grammar.bodies(head)) {
                    Set<String> yields = Set.of("");
                    for (final String symbol : body.symbols()) {
                        final Set<String> symbolYields = isTerminal(symbol) ? Set.of(symbol) : languages.get(symbol);
                        final Set<String> concatenated = new HashSet<>();
                        for (final String prefix : yields) {
                            for (final String suffix : symbolYields) {
                                if (prefix.length() + suffix.length() <= maxLength) {
                                    concatenated.add(prefix + suffix);
                                }
                            }
                        }
                        yields = concatenated;
                    }
                    if (languages.get(head).addAll(yields)) {
                        changed = true;
                    }
                }
            }
        }
        return languages;
    }

    // small random grammar over S, A, B, C, D and the terminals a, b
    public static Grammar randomGrammar(final Random random) {
        final String[] nonTerminals = {"S", "A", "B", "C", "D"};
        final String[] symbols = {"S", "A", "B", "C", "D", "a", "b", "a", "b"};

        final Grammar.Builder builder = Grammar.builder("S");
        for (final String nonTerminal : nonTerminals) {
            if (!nonTerminal.equals("S") && random.nextInt(5) == 0) {
                continue;
            }
            builder.declare(nonTerminal);
            final int bodyCount = random.nextInt(4);
            for (int i = 0; i < bodyCount; i++) {
                final int length = random.nextInt(4);
                final StringBuilder body = new StringBuilder();
                for (int j = 0; j < length; j++) {
                    body.append(symbols[random.nextInt(symbols.length)]);
                }
                builder.add(nonTerminal, Body.parse(body.toString()));
            }
        }
        return builder.build();
    }
}
