package nl.nfi.djcnf.normalize;

import nl.nfi.djcnf.common.ini.IniConfig;
import nl.nfi.djcnf.common.ini.IniSection;
import nl.nfi.djcnf.normalize.grammar.GrammarReader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

// settings read from an optional INI file:
//
//      [NORMALIZATION]
//      keep_start_epsilon = true
//
//      [INPUT]
//      epsilon_symbols = ["ε", "ϵ"]
//      default_grammar = grammar1.txt
public record NormalizerConfig(boolean keepStartEpsilon, Set<String> epsilonSymbols, String defaultGrammar) {

    public static final String NORMALIZATION_SECTION = "NORMALIZATION";
    public static final String INPUT_SECTION = "INPUT";
    public static final String DEFAULT_GRAMMAR = "grammar1.txt";

    public NormalizerConfig {
        epsilonSymbols = Set.copyOf(epsilonSymbols);
    }

    public static NormalizerConfig defaults() {
        return new NormalizerConfig(true, GrammarReader.DEFAULT_EPSILON_SYMBOLS, DEFAULT_GRAMMAR);
    }

    public static NormalizerConfig loadFrom(final Path path) throws IOException {
        return fromIni(IniConfig.loadFrom(path));
    }

    public static NormalizerConfig fromIni(final IniConfig iniConfig) {
        final NormalizerConfig defaults = defaults();

        final boolean keepStartEpsilon = iniConfig.hasKey(NORMALIZATION_SECTION, "keep_start_epsilon")
                ? iniConfig.getBoolean(NORMALIZATION_SECTION, "keep_start_epsilon")
                : defaults.keepStartEpsilon();

        Set<String> epsilonSymbols = defaults.epsilonSymbols();
        String defaultGrammar = defaults.defaultGrammar();
        if (iniConfig.hasSection(INPUT_SECTION)) {
            final IniSection input = iniConfig.getSection(INPUT_SECTION);
            if (input.hasKey("epsilon_symbols")) {
                epsilonSymbols = new LinkedHashSet<>(input.getStringList("epsilon_symbols"));
            }
            if (input.hasKey("default_grammar")) {
                defaultGrammar = input.getString("default_grammar");
            }
        }
        return new NormalizerConfig(keepStartEpsilon, epsilonSymbols, defaultGrammar);
    }

    public NormalizerConfig withKeepStartEpsilon(final boolean keepStartEpsilon) {
        return new NormalizerConfig(keepStartEpsilon, epsilonSymbols, defaultGrammar);
    }

    public GrammarReader reader() {
        return GrammarReader.withEpsilonSymbols(epsilonSymbols);
    }
}
