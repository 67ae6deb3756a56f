package nl.nfi.djcnf.normalize;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;
import static nl.nfi.djcnf.Utils.TEST_RESOURCES_PATH;
import static org.assertj.core.api.Assertions.assertThat;
import static picocli.CommandLine.ExitCode;

class CnfNormalizerCliTest {

    private static int run(final String... args) {
        return new CommandLine(new CnfNormalizerCli()).execute(args);
    }

    private static String grammarPath(final String name) {
        return TEST_RESOURCES_PATH.resolve("grammars").resolve(name).toString();
    }

    @Test
    void writesReportForEveryGrammar(@TempDir final Path tempDir) throws IOException {
        final Path output = tempDir.resolve("report.txt");

        final int exitCode = run("--output", output.toString(), grammarPath("grammar1.txt"), grammarPath("arithmetic.txt"));

        assertThat(exitCode).isEqualTo(ExitCode.OK);
        final String report = Files.readString(output, UTF_8);
        assertThat(report)
                .contains(">>> CFG #1, file: grammar1.txt <<<")
                .contains(">>> CFG #2, file: arithmetic.txt <<<")
                .contains("Nullable set = {A, B, S}")
                .contains("-- Step 4: Convert to CNF --");
    }

    @Test
    void dropsStartEpsilonOnRequest(@TempDir final Path tempDir) throws IOException {
        final Path output = tempDir.resolve("report.txt");

        final int exitCode = run("--no_start_epsilon", "--output", output.toString(), grammarPath("grammar1.txt"));

        assertThat(exitCode).isEqualTo(ExitCode.OK);
        final String report = Files.readString(output, UTF_8);
        final String cnf = report.substring(report.indexOf("-- Step 4: Convert to CNF --"));
        assertThat(cnf).doesNotContain("ε");
    }

    @Test
    void invalidGrammarFails(@TempDir final Path tempDir) {
        final Path output = tempDir.resolve("report.txt");

        assertThat(run("--output", output.toString(), grammarPath("invalid.txt"))).isEqualTo(ExitCode.SOFTWARE);
    }

    @Test
    void missingDefaultGrammarIsUsageError(@TempDir final Path tempDir) throws IOException {
        final Path config = tempDir.resolve("config.ini");
        Files.writeString(config, "[INPUT]\ndefault_grammar = " + tempDir.resolve("missing.txt") + "\n", UTF_8);

        assertThat(run("--config", config.toString())).isEqualTo(ExitCode.USAGE);
    }

    @Test
    void fallsBackToDefaultGrammar(@TempDir final Path tempDir) throws IOException {
        final Path config = tempDir.resolve("config.ini");
        final Path output = tempDir.resolve("report.txt");
        Files.writeString(config, "[INPUT]\ndefault_grammar = " + grammarPath("useless.txt") + "\n", UTF_8);

        final int exitCode = run("--config", config.toString(), "--output", output.toString());

        assertThat(exitCode).isEqualTo(ExitCode.OK);
        assertThat(Files.readString(output, UTF_8))
                .contains("file: useless.txt")
                .contains("Removed nonterminals = {C, D}");
    }
}
