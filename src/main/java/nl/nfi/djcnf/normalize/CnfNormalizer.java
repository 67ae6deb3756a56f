package nl.nfi.djcnf.normalize;

import nl.nfi.djcnf.common.Timers.TimedResult;
import nl.nfi.djcnf.normalize.grammar.Grammar;
import nl.nfi.djcnf.normalize.grammar.GrammarReader;
import nl.nfi.djcnf.normalize.stage.CnfConverter;
import nl.nfi.djcnf.normalize.stage.EpsilonEliminator;
import nl.nfi.djcnf.normalize.stage.NormalizationStage;
import nl.nfi.djcnf.normalize.stage.StageResult;
import nl.nfi.djcnf.normalize.stage.UnitProductionEliminator;
import nl.nfi.djcnf.normalize.stage.UselessSymbolRemover;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static nl.nfi.djcnf.common.Timers.time;

public final class CnfNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(CnfNormalizer.class);

    private final Grammar grammar;
    private final boolean keepStartEpsilon;

    private CnfNormalizer(final Grammar grammar) {
        this(grammar, true);
    }

    private CnfNormalizer(final Grammar grammar, final boolean keepStartEpsilon) {
        this.grammar = grammar;
        this.keepStartEpsilon = keepStartEpsilon;
    }

    public static CnfNormalizer forGrammar(final Path grammarPath) throws IOException {
        return forGrammar(GrammarReader.withDefaults().read(grammarPath));
    }

    public static CnfNormalizer forGrammar(final Grammar grammar) {
        return new CnfNormalizer(grammar);
    }

    public CnfNormalizer keepStartEpsilon(final boolean keepStartEpsilon) {
        return new CnfNormalizer(grammar, keepStartEpsilon);
    }

    // ε-productions, unit productions, useless symbols, CNF: always in this order
    public List<NormalizationStage> stages() {
        return List.of(
                EpsilonEliminator.keepingStartEpsilon(keepStartEpsilon),
                new UnitProductionEliminator(),
                new UselessSymbolRemover(),
                new CnfConverter()
        );
    }

    public NormalizationReport normalize() {
        LOG.info("Normalizing: start {}, {} productions, keep start epsilon {}", grammar.start(), grammar.productionCount(), keepStartEpsilon);

        final List<StageResult> results = new ArrayList<>();
        Grammar current = grammar;
        for (final NormalizationStage stage : stages()) {
            final Grammar input = current;
            final TimedResult<StageResult> timed = time(() -> stage.apply(input));
            final StageResult result = timed.value();

            LOG.atDebug()
                    .addKeyValue("stage", stage.name())
                    .addKeyValue("duration", timed.duration())
                    .addKeyValue("productions", result.output().productionCount())
                    .log("Stage finished");

            results.add(result);
            current = result.output();
        }

        if (current.isEmptyLanguage()) {
            LOG.warn("Grammar generates the empty language: start symbol {} has no productions", current.start());
        }
        return new NormalizationReport(grammar, results);
    }
}
