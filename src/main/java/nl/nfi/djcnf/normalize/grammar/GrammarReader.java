package nl.nfi.djcnf.normalize.grammar;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.Files.exists;
import static java.nio.file.Files.readAllLines;
import static nl.nfi.djcnf.normalize.grammar.Symbols.isValidBodyCharacter;

/**
 * Reads grammars written one rule per line:
 *
 * <pre>
 * # comment
 * S -> AB | ε
 * A -> aA | ε
 * </pre>
 *
 * The first left hand side is the start symbol, repeated left hand sides are merged.
 */
public final class GrammarReader {

    public static final Set<String> DEFAULT_EPSILON_SYMBOLS = Set.of("ε", "ϵ");

    private static final Pattern RULE = Pattern.compile("^\\s*([A-Z])\\s*->\\s*(.+?)\\s*$");

    private final Set<String> epsilonSymbols;

    private GrammarReader(final Set<String> epsilonSymbols) {
        this.epsilonSymbols = epsilonSymbols;
    }

    public static GrammarReader withDefaults() {
        return new GrammarReader(DEFAULT_EPSILON_SYMBOLS);
    }

    public static GrammarReader withEpsilonSymbols(final Set<String> epsilonSymbols) {
        if (epsilonSymbols.isEmpty()) {
            throw new IllegalArgumentException("At least one epsilon symbol is required");
        }
        return new GrammarReader(Set.copyOf(epsilonSymbols));
    }

    public Grammar read(final Path path) throws IOException {
        if (!exists(path)) {
            throw new IllegalArgumentException("Grammar file does not exist: %s".formatted(path));
        }
        return read(path.getFileName().toString(), readAllLines(path, UTF_8));
    }

    public Grammar read(final String sourceName, final List<String> lines) {
        Grammar.Builder builder = null;

        for (int index = 0; index < lines.size(); index++) {
            final int lineNumber = index + 1;
            final String line = lines.get(index).strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            final Matcher matcher = RULE.matcher(line);
            if (!matcher.matches()) {
                throw error(sourceName, lineNumber, "invalid syntax, expected 'A -> ...', got: %s".formatted(line));
            }

            final String head = matcher.group(1);
            if (builder == null) {
                builder = Grammar.builder(head);
            }
            builder.declare(head);

            for (final String alternative : matcher.group(2).split("\\|", -1)) {
                builder.add(head, parseBody(sourceName, lineNumber, alternative.strip()));
            }
        }

        if (builder == null) {
            throw new IllegalArgumentException("%s: no productions found".formatted(sourceName));
        }
        return builder.build();
    }

    private Body parseBody(final String sourceName, final int lineNumber, final String text) {
        if (text.isEmpty()) {
            throw error(sourceName, lineNumber, "empty body between '|'");
        }
        if (epsilonSymbols.contains(text)) {
            return Body.epsilon();
        }
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (!isValidBodyCharacter(c)) {
                throw error(sourceName, lineNumber, "invalid symbol '%c' in body '%s'".formatted(c, text));
            }
        }
        return Body.parse(text);
    }

    private static IllegalArgumentException error(final String sourceName, final int lineNumber, final String reason) {
        return new IllegalArgumentException("%s:%d: %s".formatted(sourceName, lineNumber, reason));
    }
}
