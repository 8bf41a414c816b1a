package ai.proofs.prover.search;

import java.util.Comparator;

/**
 * Cost of a (partial) derivation, ordered lexicographically: fewer indirect-proof lines first,
 * then fewer lines overall.
 */
public record SearchCost(int indirectProofs, int lines) implements Comparable<SearchCost> {

    private static final Comparator<SearchCost> ORDER = Comparator
            .comparingInt(SearchCost::indirectProofs)
            .thenComparingInt(SearchCost::lines);

    @Override
    public int compareTo(SearchCost other) {
        return ORDER.compare(this, other);
    }

    public static SearchCost min(SearchCost a, SearchCost b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
