package dead.owner.jsunpack.utils.rewrite;

import lombok.NonNull;

/**
 * Span-addressed text substitution, valid only against the snapshot it was computed from.
 *
 * @param start first replaced character offset (inclusive)
 * @param end   end offset (exclusive)
 * @param text  text written in place of {@code [start, end)}
 */
public record Replacement(int start, int end, @NonNull String text) {

    public Replacement {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid replacement span [" + start + ", " + end + ")");
        }
    }

    public boolean overlaps(Replacement other) {
        return start < other.end && other.start < end;
    }
}
