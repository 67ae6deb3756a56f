package nl.nfi.djcnf.normalize.stage;

import nl.nfi.djcnf.normalize.grammar.Body;
import nl.nfi.djcnf.normalize.grammar.Grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static nl.nfi.djcnf.normalize.grammar.Symbols.isTerminal;
import static nl.nfi.djcnf.normalize.grammar.Symbols.isUpperCaseLetter;

/**
 * Converts a grammar without unit productions and useless symbols into Chomsky Normal Form:
 * every body is a single terminal, two nonterminals, or ε at the start symbol.
 * <p>
 * First every terminal inside a body of two or more symbols is replaced by a nonterminal that
 * derives only that terminal, then bodies longer than two are split into chains of binary
 * productions.
 */
public final class CnfConverter implements NormalizationStage {

    private static final String LIFTER_PREFIX = "T";
    private static final String CHAIN_PREFIX = "Y";

    @Override
    public String name() {
        return "Convert to CNF";
    }

    @Override
    public StageResult apply(final Grammar grammar) {
        final List<String> trace = new ArrayList<>();
        final FreshSymbolAllocator allocator = FreshSymbolAllocator.seededWith(grammar.referencedNonTerminals());

        final Grammar lifted = liftTerminals(grammar, allocator, trace);
        final Grammar binary = binarize(lifted, allocator, trace);

        return new StageResult(name(), grammar, binary, trace);
    }

    private static Grammar liftTerminals(final Grammar grammar, final FreshSymbolAllocator allocator, final List<String> trace) {
        final String start = grammar.start();
        // terminal -> its lifter, one per terminal over the whole grammar
        final Map<String, String> lifters = new LinkedHashMap<>();
        final Grammar.Builder result = Grammar.builder(start);

        for (final String head : grammar.nonTerminals()) {
            result.declare(head);
            for (final Body body : grammar.bodies(head)) {
                if (body.isEpsilon()) {
                    if (head.equals(start)) {
                        result.add(head, body);
                    }
                    continue;
                }
                if (body.size() < 2) {
                    result.add(head, body);
                    continue;
                }

                final List<String> symbols = new ArrayList<>(body.size());
                for (final String symbol : body.symbols()) {
                    symbols.add(isTerminal(symbol)
                            ? lifters.computeIfAbsent(symbol, terminal -> lifterName(terminal, allocator))
                            : symbol);
                }
                result.add(head, new Body(symbols));
            }
        }

        lifters.forEach((terminal, lifter) -> {
            result.add(lifter, Body.of(terminal));
            trace.add("Terminal lift: %s -> %s".formatted(lifter, terminal));
        });
        return result.build();
    }

    // a -> A when A is still free, otherwise Ta1, Ta2, ...
    private static String lifterName(final String terminal, final FreshSymbolAllocator allocator) {
        final String upperCased = terminal.toUpperCase();
        if (isUpperCaseLetter(upperCased.charAt(0)) && allocator.claim(upperCased)) {
            return upperCased;
        }
        return allocator.fresh(LIFTER_PREFIX + terminal);
    }

    private static Grammar binarize(final Grammar grammar, final FreshSymbolAllocator allocator, final List<String> trace) {
        final Grammar.Builder result = Grammar.builder(grammar.start());

        for (final String head : grammar.nonTerminals()) {
            result.declare(head);
            for (final Body body : grammar.bodies(head)) {
                if (body.size() <= 2) {
                    result.add(head, body);
                    continue;
                }

                // A -> X1 X2 ... Xn  becomes  A -> X1 Y1, Y1 -> X2 Y2, ..., Yn-2 -> Xn-1 Xn
                String left = head;
                for (int i = 0; i < body.size() - 2; i++) {
                    final String chain = allocator.fresh(CHAIN_PREFIX);
                    final Body link = Body.of(body.symbolAt(i), chain);
                    result.add(left, link);
                    trace.add("Binary split: %s -> %s".formatted(left, link));
                    left = chain;
                }
                final Body last = Body.of(body.symbolAt(body.size() - 2), body.symbolAt(body.size() - 1));
                result.add(left, last);
                trace.add("Binary split: %s -> %s".formatted(left, last));
            }
        }
        return result.build();
    }
}
