package ai.proofs.prover.search;

import ai.proofs.logic.Formula;
import ai.proofs.logic.TruthTable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive backtracking search for a derivation of the goal of one {@link Derivation}.
 *
 * <p>Each call to {@link #prove()} runs these phases in order:
 * <ol>
 *     <li>Enter the state in the {@link SearchMemo}; a dominated state fails immediately.</li>
 *     <li>Saturate with the deterministic {@link Eliminator} rules; success ends the call.</li>
 *     <li>Decompose the goal with the {@link Introducer}; success ends the call.</li>
 *     <li>Try five speculative branches, each on its own copy of the sequence: forced ¬E,
 *     forced →E, forced ↔E, ∨E case split, indirect proof.</li>
 *     <li>Adopt the cheapest successful branch (fewest indirect proofs, then fewest lines).</li>
 * </ol>
 *
 * <p>Failures are plain {@code false} results. A failed attempt never touches the caller's
 * sequence because every attempt works on a copy of it.
 *
 * <p>The memo is shared by every search spawned through {@link #branch(Derivation)}.
 * {@link #isolated(Derivation)} hands the new search a snapshot instead, for sibling attempts
 * (two conjunct orders, two ∨E cases) that must not dominate each other.
 */
public final class ProofSearch {

    private static final Logger log = LoggerFactory.getLogger(ProofSearch.class);

    private final Derivation derivation;
    private final SearchMemo memo;
    private final SearchStats stats;

    public ProofSearch(Derivation derivation, SearchMemo memo, SearchStats stats) {
        this.derivation = derivation;
        this.memo = memo;
        this.stats = stats;
    }

    public Derivation derivation() {
        return derivation;
    }

    /**
     * Searches for a derivation of the goal, extending this search's sequence on success.
     *
     * @return true if the goal was reached
     */
    public boolean prove() {
        if (!memo.enter(derivation)) {
            stats.stateDominated();
            return false;
        }
        stats.stateEntered();

        if (Eliminator.eliminate(this)) {
            return true;
        }
        if (Introducer.introduce(this)) {
            return true;
        }

        List<Derivation> branches = new ArrayList<>();
        speculate(branches, "forced ¬E", p -> Eliminator.forceNotElim(p) && p.prove());
        speculate(branches, "forced →E", p -> Eliminator.forceImpElim(p) && p.prove());
        speculate(branches, "forced ↔E", p -> Eliminator.forceIffElim(p) && p.prove());
        speculate(branches, "∨E", Eliminator::orElim);
        speculate(branches, "IP", Introducer::indirectProof);

        return derivation.commitBestBranch(branches);
    }

    private void speculate(List<Derivation> branches, String label, Predicate<ProofSearch> attempt) {
        ProofSearch copy = copy();
        stats.branchTried();
        if (attempt.test(copy)) {
            stats.branchSucceeded();
            branches.add(copy.derivation);
            if (log.isDebugEnabled()) {
                log.debug("Branch {} reached {} with cost {}", label, derivation.goal(), copy.derivation.cost());
            }
        }
    }

    /**
     * A search over a copy of this sequence, sharing the memo.
     */
    ProofSearch copy() {
        return new ProofSearch(derivation.copy(), memo, stats);
    }

    /**
     * A search over the given derivation sharing this search's memo.
     */
    ProofSearch branch(Derivation other) {
        return new ProofSearch(other, memo, stats);
    }

    /**
     * A search over the given derivation with a private snapshot of the memo.
     */
    ProofSearch isolated(Derivation other) {
        return new ProofSearch(other, memo.snapshot(), stats);
    }

    /**
     * Consults the truth-table oracle.
     */
    boolean isValid(Collection<Formula> premises, Formula conclusion) {
        stats.oracleCalled();
        return TruthTable.isValid(premises, conclusion);
    }
}
