package ai.proofs.unit.helpers;

import ai.proofs.logic.Formula;
import ai.proofs.logic.Rule;
import ai.proofs.prover.search.Derivation;
import ai.proofs.prover.search.ProofStore;
import ai.proofs.prover.search.StoredLine;
import java.util.ArrayList;
import java.util.List;

/**
 * Factory for working derivations seeded with premise lines, as the prover seeds them.
 */
public final class Derivations {

    private Derivations() {
    }

    public static Derivation seeded(Formula goal, Formula... premises) {
        ProofStore store = new ProofStore();
        List<Integer> ids = new ArrayList<>();
        for (Formula premise : premises) {
            ids.add(store.addLine(premise, Rule.PREMISE));
        }
        return new Derivation(store, ids, goal);
    }

    /**
     * Formulas of the top-level lines in sequence order.
     */
    public static List<Formula> formulas(Derivation d) {
        List<Formula> out = new ArrayList<>();
        for (int id : d.sequence()) {
            StoredLine line = d.store().lineOrNull(id);
            if (line != null) {
                out.add(line.formula());
            }
        }
        return out;
    }

    public static StoredLine last(Derivation d) {
        return d.store().lineOrNull(d.lastId());
    }
}
