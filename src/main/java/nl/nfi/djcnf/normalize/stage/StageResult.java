package nl.nfi.djcnf.normalize.stage;

import nl.nfi.djcnf.normalize.grammar.Grammar;

import java.util.List;

// output of a single stage, the trace holds human readable facts in the order they were derived, e.g.
//      Nullable set = {A, B, S}
//      S -> AB  =>  A | AB | B
public record StageResult(String stage, Grammar input, Grammar output, List<String> trace) {

    public StageResult {
        trace = List.copyOf(trace);
    }
}
