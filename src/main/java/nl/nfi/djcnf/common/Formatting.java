package nl.nfi.djcnf.common;

import java.util.Collection;
import java.util.TreeSet;

import static java.lang.String.join;

public final class Formatting {

    public static final String EMPTY_SET = "∅";

    private Formatting() {
    }

    // {A, B, S} (sorted), or ∅
    public static String toSetString(final Collection<String> values) {
        if (values.isEmpty()) {
            return EMPTY_SET;
        }
        return "{" + join(", ", new TreeSet<>(values)) + "}";
    }
}
