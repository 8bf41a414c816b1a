package ai.proofs.prover.search;

import ai.proofs.logic.Formula;
import java.util.List;
import java.util.Objects;

/**
 * A closed subproof: the identities of its contents, opened by an assumption, and the goal it
 * reached.
 */
public record StoredSubproof(List<Integer> sequence, Formula goal) implements ProofObject {
    public StoredSubproof {
        sequence = List.copyOf(sequence);
        Objects.requireNonNull(goal, "goal");
    }
}
