package nl.nfi.djcnf.normalize.grammar;

// symbols are plain strings:
//      terminal:    a single lowercase letter or digit, e.g. a, 7
//      nonterminal: starts with an uppercase letter, e.g. S, or a minted name like Y1 or Ta1
// epsilon is never a symbol inside a body, it is the empty body
public final class Symbols {

    public static final String EPSILON = "ε";

    private Symbols() {
    }

    public static boolean isTerminal(final String symbol) {
        if (symbol.length() != 1) {
            return false;
        }
        final char c = symbol.charAt(0);
        return isLowerCaseLetter(c) || (c >= '0' && c <= '9');
    }

    public static boolean isNonTerminal(final String symbol) {
        return !symbol.isEmpty() && isUpperCaseLetter(symbol.charAt(0));
    }

    // single characters accepted in grammar files
    public static boolean isValidBodyCharacter(final char c) {
        return isLowerCaseLetter(c) || isUpperCaseLetter(c) || (c >= '0' && c <= '9');
    }

    public static boolean isUpperCaseLetter(final char c) {
        return c >= 'A' && c <= 'Z';
    }

    private static boolean isLowerCaseLetter(final char c) {
        return c >= 'a' && c <= 'z';
    }
}
