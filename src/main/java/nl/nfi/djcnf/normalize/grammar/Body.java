package nl.nfi.djcnf.normalize.grammar;

import java.util.ArrayList;
import java.util.List;

import static java.lang.String.join;
import static nl.nfi.djcnf.normalize.grammar.Symbols.EPSILON;
import static nl.nfi.djcnf.normalize.grammar.Symbols.isNonTerminal;
import static nl.nfi.djcnf.normalize.grammar.Symbols.isTerminal;

// right hand side of a production, e.g. for S -> aSb:
//      symbols = [a, S, b]
// the empty body is epsilon
public record Body(List<String> symbols) {

    private static final Body EMPTY = new Body(List.of());

    public Body {
        symbols = List.copyOf(symbols);
    }

    public static Body epsilon() {
        return EMPTY;
    }

    public static Body of(final String... symbols) {
        return new Body(List.of(symbols));
    }

    // every character is a symbol, "aSb" -> [a, S, b]
    public static Body parse(final String characters) {
        final List<String> symbols = new ArrayList<>(characters.length());
        for (int i = 0; i < characters.length(); i++) {
            symbols.add(String.valueOf(characters.charAt(i)));
        }
        return new Body(symbols);
    }

    public int size() {
        return symbols.size();
    }

    public String symbolAt(final int position) {
        return symbols.get(position);
    }

    public boolean isEpsilon() {
        return symbols.isEmpty();
    }

    public boolean isUnit() {
        return symbols.size() == 1 && isNonTerminal(symbols.get(0));
    }

    public boolean isSingleTerminal() {
        return symbols.size() == 1 && isTerminal(symbols.get(0));
    }

    public boolean contains(final String symbol) {
        return symbols.contains(symbol);
    }

    public Body withoutPositions(final List<Integer> positions) {
        final List<String> kept = new ArrayList<>(symbols.size());
        for (int i = 0; i < symbols.size(); i++) {
            if (!positions.contains(i)) {
                kept.add(symbols.get(i));
            }
        }
        return new Body(kept);
    }

    @Override
    public String toString() {
        if (isEpsilon()) {
            return EPSILON;
        }
        final boolean singleCharacters = symbols.stream().allMatch(s -> s.length() == 1);
        return join(singleCharacters ? "" : " ", symbols);
    }
}
