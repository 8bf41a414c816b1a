package ai.proofs.prover.search;

import ai.proofs.logic.Formula;
import ai.proofs.logic.Rule;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The working sequence of one (sub)proof under construction: an ordered list of arena identities
 * and the goal formula the sequence is trying to reach.
 *
 * <p>While a subproof is being searched, its sequence starts with the whole enclosing sequence
 * (premises, earlier lines, closed subproofs) followed by its own assumption, so every formula the
 * subproof may use is visible in one list. {@link #tail(int)} cuts the enclosing prefix off again
 * when the subproof is closed.
 *
 * <p>{@link #copy()} duplicates the identity list only. The objects themselves live in the shared
 * {@link ProofStore} and are never changed, so a branch that fails simply drops its copy.
 */
public final class Derivation {

    private final ProofStore store;
    private final Formula goal;
    private List<Integer> sequence;

    public Derivation(ProofStore store, List<Integer> sequence, Formula goal) {
        this.store = Objects.requireNonNull(store, "store");
        this.sequence = new ArrayList<>(sequence);
        this.goal = Objects.requireNonNull(goal, "goal");
    }

    public Derivation copy() {
        return new Derivation(store, sequence, goal);
    }

    /**
     * A new derivation over a copy of this sequence aiming at a different goal.
     */
    public Derivation withGoal(Formula newGoal) {
        return new Derivation(store, sequence, newGoal);
    }

    /**
     * A new derivation over a copy of this sequence extended by the given identities.
     */
    public Derivation extendedWith(Formula newGoal, Integer... ids) {
        Derivation out = new Derivation(store, sequence, newGoal);
        Collections.addAll(out.sequence, ids);
        return out;
    }

    public ProofStore store() {
        return store;
    }

    public Formula goal() {
        return goal;
    }

    public List<Integer> sequence() {
        return Collections.unmodifiableList(sequence);
    }

    public int size() {
        return sequence.size();
    }

    public boolean isEmpty() {
        return sequence.isEmpty();
    }

    public int lastId() {
        return sequence.get(sequence.size() - 1);
    }

    public void append(int id) {
        sequence.add(id);
    }

    /**
     * Stores a new line and appends it to this sequence.
     *
     * @return the identity of the new line
     */
    public int appendLine(Formula formula, Rule rule, Integer... citations) {
        int id = store.addLine(formula, rule, citations);
        sequence.add(id);
        return id;
    }

    /**
     * Identities from position {@code from} to the end, i.e. this sequence without an enclosing
     * prefix of length {@code from}.
     */
    public List<Integer> tail(int from) {
        return new ArrayList<>(sequence.subList(from, sequence.size()));
    }

    /**
     * Replaces the contents of this sequence, keeping the goal.
     */
    public void setSequence(List<Integer> ids) {
        this.sequence = new ArrayList<>(ids);
    }

    /**
     * Formulas of the premise and assumption lines in this sequence.
     */
    public Set<Formula> assumptions() {
        Set<Formula> out = new HashSet<>();
        for (int id : sequence) {
            StoredLine line = store.lineOrNull(id);
            if (line != null && line.isPremiseOrAssumption()) {
                out.add(line.formula());
            }
        }
        return out;
    }

    /**
     * Formulas of every line directly in this sequence; contents of closed subproofs are not
     * available and are skipped.
     */
    public Set<Formula> formulas() {
        Set<Formula> out = new HashSet<>();
        for (int id : sequence) {
            StoredLine line = store.lineOrNull(id);
            if (line != null) {
                out.add(line.formula());
            }
        }
        return out;
    }

    /**
     * Every identity cited anywhere in this sequence, subproof contents included.
     */
    public Set<Integer> citations() {
        Set<Integer> out = new HashSet<>();
        collectCitations(sequence, out);
        return out;
    }

    private void collectCitations(List<Integer> ids, Set<Integer> out) {
        for (int id : ids) {
            ProofObject object = store.get(id);
            if (object instanceof StoredLine line) {
                out.addAll(line.citations());
            } else if (object instanceof StoredSubproof subproof) {
                collectCitations(subproof.sequence(), out);
            }
        }
    }

    public int lineCount() {
        return lineCount(store, sequence);
    }

    static int lineCount(ProofStore store, List<Integer> ids) {
        int count = 0;
        for (int id : ids) {
            ProofObject object = store.get(id);
            if (object instanceof StoredSubproof subproof) {
                count += lineCount(store, subproof.sequence());
            } else {
                count++;
            }
        }
        return count;
    }

    /**
     * Number of indirect-proof lines in this sequence, subproof contents included.
     */
    public int indirectProofCount() {
        return indirectProofCount(sequence);
    }

    private int indirectProofCount(List<Integer> ids) {
        int count = 0;
        for (int id : ids) {
            ProofObject object = store.get(id);
            if (object instanceof StoredSubproof subproof) {
                count += indirectProofCount(subproof.sequence());
            } else if (((StoredLine) object).rule() == Rule.INDIRECT_PROOF) {
                count++;
            }
        }
        return count;
    }

    public SearchCost cost() {
        return new SearchCost(indirectProofCount(), lineCount());
    }

    /**
     * Drops a trailing reiteration line and returns the identity it repeated, so the caller can
     * cite the original line directly. Otherwise returns the identity of the last object.
     */
    public int popReiteration() {
        int last = lastId();
        StoredLine line = store.lineOrNull(last);
        if (line != null && line.rule() == Rule.REITERATION) {
            sequence.remove(sequence.size() - 1);
            return line.citations().get(0);
        }
        return last;
    }

    /**
     * Adopts the sequence of the cheapest candidate, comparing {@link SearchCost}s; ties keep the
     * earliest candidate.
     *
     * @return false if there were no candidates
     */
    public boolean commitBestBranch(List<Derivation> candidates) {
        Derivation best = null;
        SearchCost bestCost = null;
        for (Derivation candidate : candidates) {
            SearchCost cost = candidate.cost();
            if (best == null || cost.compareTo(bestCost) < 0) {
                best = candidate;
                bestCost = cost;
            }
        }
        if (best == null) {
            return false;
        }
        setSequence(best.sequence);
        return true;
    }

    /**
     * Returns true if both derivations hold the same identities in the same order.
     */
    public boolean sameSequence(Derivation other) {
        return sequence.equals(other.sequence);
    }
}
