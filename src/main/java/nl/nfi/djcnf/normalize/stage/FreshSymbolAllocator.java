package nl.nfi.djcnf.normalize.stage;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

// hands out nonterminal names that never collide with names already in use, e.g.
//      used = {S, Y1}, fresh("Y") -> Y2, fresh("Y") -> Y3
// scoped to a single conversion, never shared
public final class FreshSymbolAllocator {

    private final Set<String> used;

    private FreshSymbolAllocator(final Collection<String> used) {
        this.used = new LinkedHashSet<>(used);
    }

    public static FreshSymbolAllocator seededWith(final Collection<String> used) {
        return new FreshSymbolAllocator(used);
    }

    // reserves the name if nobody has it yet
    public boolean claim(final String name) {
        return used.add(name);
    }

    public String fresh(final String base) {
        for (long i = 1; ; i++) {
            final String candidate = base + i;
            if (used.add(candidate)) {
                return candidate;
            }
        }
    }
}
