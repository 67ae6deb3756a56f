package nl.nfi.djcnf.main;

import nl.nfi.djcnf.normalize.CnfNormalizerCli;
import picocli.CommandLine;

public final class NormalizerMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new CnfNormalizerCli()).execute(args);
        System.exit(exitCode);
    }
}
