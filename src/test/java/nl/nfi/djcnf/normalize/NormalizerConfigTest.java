package nl.nfi.djcnf.normalize;

import nl.nfi.djcnf.common.ini.IniConfig;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static nl.nfi.djcnf.Utils.TEST_RESOURCES_PATH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NormalizerConfigTest {

    @Test
    void loadsFromFile() throws IOException {
        final NormalizerConfig config = NormalizerConfig.loadFrom(TEST_RESOURCES_PATH.resolve("no_start_epsilon.ini"));

        assertThat(config.keepStartEpsilon()).isFalse();
        assertThat(config.epsilonSymbols()).containsExactlyInAnyOrder("ε", "eps");
        assertThat(config.defaultGrammar()).isEqualTo("grammars/grammar1.txt");
    }

    @Test
    void missingKeysFallBackToDefaults() {
        final NormalizerConfig config = NormalizerConfig.fromIni(IniConfig.parse(List.of("[INPUT]", "default_grammar = g.txt")));

        assertThat(config.keepStartEpsilon()).isTrue();
        assertThat(config.epsilonSymbols()).containsExactlyInAnyOrder("ε", "ϵ");
        assertThat(config.defaultGrammar()).isEqualTo("g.txt");
    }

    @Test
    void missingFileIsRejected() {
        assertThatThrownBy(() -> NormalizerConfig.loadFrom(TEST_RESOURCES_PATH.resolve("missing.ini")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("INI config file path does not exist");
    }
}
