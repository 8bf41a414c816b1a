package ai.proofs.prover;

import ai.proofs.proof.Proof;
import ai.proofs.prover.search.SearchStats;

/**
 * A discovered proof together with the statistics of the search that found it.
 */
public record ProofSearchResult(Proof proof, SearchStats stats, long durationNanos) {

    public double durationMillis() {
        return durationNanos / 1_000_000.0;
    }
}
