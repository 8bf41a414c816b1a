package ai.proofs.prover.search;

import ai.proofs.logic.Formula;
import ai.proofs.logic.Rule;
import java.util.List;
import java.util.Objects;

/**
 * A line in the working proof: its formula, the rule that produced it and the arena identities
 * of the objects it cites.
 */
public record StoredLine(Formula formula, Rule rule, List<Integer> citations) implements ProofObject {
    public StoredLine {
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(rule, "rule");
        citations = List.copyOf(citations);
    }

    public boolean isPremiseOrAssumption() {
        return rule.isPremiseOrAssumption();
    }
}
