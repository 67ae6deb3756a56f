package nl.nfi.djcnf.normalize;

import nl.nfi.djcnf.normalize.grammar.Grammar;
import nl.nfi.djcnf.normalize.stage.StageResult;

import java.util.List;

// input grammar, the result of every stage in execution order, and the final (CNF) grammar
public record NormalizationReport(Grammar original, List<StageResult> stages) {

    public NormalizationReport {
        stages = List.copyOf(stages);
    }

    public Grammar result() {
        return stages.isEmpty() ? original : stages.get(stages.size() - 1).output();
    }

    public StageResult stage(final String name) {
        return stages.stream()
                .filter(stage -> stage.stage().equals(name))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No stage found for " + name));
    }

    public boolean emptyLanguage() {
        return result().isEmptyLanguage();
    }
}
