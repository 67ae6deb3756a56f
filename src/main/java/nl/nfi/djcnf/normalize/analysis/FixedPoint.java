package nl.nfi.djcnf.normalize.analysis;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.BiPredicate;

import static java.util.Collections.unmodifiableSet;
import static java.util.Collections.unmodifiableSortedSet;

public final class FixedPoint {

    private FixedPoint() {
    }

    /**
     * Computes the least set containing {@code seed} that is closed under {@code admission}.
     * <p>
     * Every sweep tests each candidate not yet in the set against the set as it currently is;
     * the computation ends after a sweep that admits nothing. Termination follows from the set
     * growing monotonically within the finite candidate collection.
     *
     * @param seed initial members
     * @param candidates members that may be admitted
     * @param admission decides, given a candidate and the current (read-only) set, whether to admit it
     * @return the fixed point, sorted
     */
    public static SortedSet<String> leastFixedPoint(final Collection<String> seed,
                                                    final Collection<String> candidates,
                                                    final BiPredicate<String, Set<String>> admission) {
        final Set<String> members = new LinkedHashSet<>(seed);
        final Set<String> view = unmodifiableSet(members);

        boolean changed = true;
        while (changed) {
            changed = false;
            for (final String candidate : candidates) {
                if (!members.contains(candidate) && admission.test(candidate, view)) {
                    members.add(candidate);
                    changed = true;
                }
            }
        }
        return unmodifiableSortedSet(new TreeSet<>(members));
    }
}
