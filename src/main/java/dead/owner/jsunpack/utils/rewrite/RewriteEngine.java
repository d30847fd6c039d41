package dead.owner.jsunpack.utils.rewrite;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Splices replacement sets into the text they were computed against
 */
public final class RewriteEngine {

    private static final Comparator<Replacement> DESCENDING =
            Comparator.comparingInt(Replacement::start).reversed();

    private RewriteEngine() {
    }

    /**
     * Apply every replacement to {@code text}, last offset first.
     *
     * @throws IllegalArgumentException if a span lies outside the text or two spans overlap
     */
    public static String apply(String text, Collection<Replacement> replacements) {
        List<Replacement> ordered = new ArrayList<>(replacements);
        ordered.sort(DESCENDING);

        StringBuilder builder = new StringBuilder(text);
        Replacement previous = null;
        for (Replacement replacement : ordered) {
            if (replacement.end() > text.length()) {
                throw new IllegalArgumentException("Replacement " + replacement
                        + " exceeds text length " + text.length());
            }
            if (previous != null && replacement.overlaps(previous)) {
                throw new IllegalArgumentException("Overlapping replacements " + replacement + " and " + previous);
            }
            // Everything already spliced starts at or after replacement.end(), offsets below stay valid
            builder.replace(replacement.start(), replacement.end(), replacement.text());
            previous = replacement;
        }
        return builder.toString();
    }

    /**
     * Merge two replacement sets computed against the same snapshot.
     * Secondary replacements overlapping any primary one are dropped.
     *
     * @return the merged set, primary replacements first
     */
    public static List<Replacement> merge(List<Replacement> primary, List<Replacement> secondary) {
        List<Replacement> merged = new ArrayList<>(primary);
        for (Replacement candidate : secondary) {
            if (primary.stream().noneMatch(candidate::overlaps)) {
                merged.add(candidate);
            }
        }
        return merged;
    }
}
