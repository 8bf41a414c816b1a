package ai.proofs.proof;

/**
 * Reference from a justification to an earlier line or to a closed subproof.
 *
 * <p>A line citation has {@code first == last}; a subproof citation spans the subproof's first
 * and last line numbers.
 */
public record Citation(int first, int last) {
    public Citation {
        if (first < 1 || last < first) {
            throw new IllegalArgumentException("Invalid citation " + first + "-" + last);
        }
    }

    public static Citation line(int index) {
        return new Citation(index, index);
    }

    public static Citation range(int first, int last) {
        return new Citation(first, last);
    }

    public boolean isRange() {
        return first != last;
    }

    /**
     * Renders {@code 3} for a line and {@code 2-4} for a range.
     */
    @Override
    public String toString() {
        return isRange() ? first + "-" + last : Integer.toString(first);
    }
}
