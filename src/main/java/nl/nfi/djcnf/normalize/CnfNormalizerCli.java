package nl.nfi.djcnf.normalize;

import nl.nfi.djcnf.normalize.grammar.Grammar;
import nl.nfi.djcnf.normalize.grammar.GrammarReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.Files.isRegularFile;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;
import static picocli.CommandLine.Parameters;

@Command(name = "cnf_normalizer", description = "Removes ε-productions, unit productions and useless symbols, then converts to Chomsky Normal Form")
public class CnfNormalizerCli implements Callable<Integer> {

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "Grammar files, one rule per line (A -> body | body)")
    private List<String> grammarPaths = new ArrayList<>();

    @Option(names = {"--config"}, description = "INI file with normalization and input settings")
    private String configPath;

    @Option(names = {"--no_start_epsilon"}, description = "Do not keep S -> ε even when the start symbol is nullable")
    private boolean noStartEpsilon = false;

    @Option(names = {"--output"}, description = "The file to write the report to")
    private String outputPath = "-";

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    @Override
    public Integer call() throws Exception {
        // must be set before the first logger is created
        if (logPath != null) {
            System.setProperty("LOG_DIRECTORY_PATH", logPath);
        }
        final Logger log = LoggerFactory.getLogger(CnfNormalizerCli.class);

        try {
            NormalizerConfig config = configPath != null
                    ? NormalizerConfig.loadFrom(Paths.get(configPath))
                    : NormalizerConfig.defaults();
            if (noStartEpsilon) {
                config = config.withKeepStartEpsilon(false);
            }

            final List<Path> inputs = new ArrayList<>();
            grammarPaths.forEach(path -> inputs.add(Paths.get(path)));
            if (inputs.isEmpty()) {
                final Path fallback = Paths.get(config.defaultGrammar());
                if (!isRegularFile(fallback)) {
                    System.err.println("Error: no grammar file given and default '%s' not found".formatted(fallback));
                    return ExitCode.USAGE;
                }
                log.info("No grammar file given, using default: {}", fallback);
                inputs.add(fallback);
            }

            if (outputPath.equals("-")) {
                normalizeAll(inputs, config, System.out);
                return ExitCode.OK;
            }
            try (final PrintStream output = new PrintStream(new BufferedOutputStream(new FileOutputStream(Paths.get(outputPath).toFile())), false, UTF_8)) {
                normalizeAll(inputs, config, output);
            }
        }
        catch (final Throwable t) {
            log.error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }

        return ExitCode.OK;
    }

    private static void normalizeAll(final List<Path> inputs, final NormalizerConfig config, final PrintStream output) throws IOException {
        final GrammarReader reader = config.reader();
        final ReportWriter writer = ReportWriter.forOutput(output);

        int index = 1;
        for (final Path input : inputs) {
            final Grammar grammar = reader.read(input);
            final NormalizationReport report = CnfNormalizer.forGrammar(grammar)
                    .keepStartEpsilon(config.keepStartEpsilon())
                    .normalize();
            writer.write(index++, input.getFileName().toString(), report);
        }
    }
}
