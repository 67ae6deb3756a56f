package nl.nfi.djcnf.normalize.stage;

import nl.nfi.djcnf.normalize.grammar.Grammar;

// a pure transformation: never mutates its input, returns a new grammar and the facts it derived
public interface NormalizationStage {

    String name();

    StageResult apply(final Grammar grammar);
}
