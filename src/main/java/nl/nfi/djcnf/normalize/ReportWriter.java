package nl.nfi.djcnf.normalize;

import nl.nfi.djcnf.normalize.grammar.GrammarFormatter;
import nl.nfi.djcnf.normalize.stage.StageResult;

import java.io.PrintStream;

// writes a normalization report for humans:
//
//      >>> CFG #1, file: grammar1.txt <<<
//
//      -- Original grammar --
//      ...
public final class ReportWriter {

    private final PrintStream output;

    private ReportWriter(final PrintStream output) {
        this.output = output;
    }

    public static ReportWriter forOutput(final PrintStream output) {
        return new ReportWriter(output);
    }

    public void write(final int index, final String sourceName, final NormalizationReport report) {
        banner("CFG #%d, file: %s".formatted(index, sourceName));

        subBanner("Original grammar");
        output.println("Start symbol: " + report.original().start());
        output.println(GrammarFormatter.format(report.original()));

        int step = 1;
        for (final StageResult stage : report.stages()) {
            subBanner("Step %d: %s".formatted(step++, stage.stage()));
            stage.trace().forEach(output::println);
            output.println();
            output.println("Result:");
            output.println(GrammarFormatter.format(stage.output()));
        }

        if (report.emptyLanguage()) {
            output.println();
            output.println("Language is empty: the normalized grammar generates no strings");
        }
        output.flush();
    }

    private void banner(final String title) {
        output.println();
        output.println(">>> " + title + " <<<");
        output.println();
    }

    private void subBanner(final String title) {
        output.println();
        output.println("-- " + title + " --");
        output.println();
    }
}
