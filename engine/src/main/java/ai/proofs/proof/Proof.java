package ai.proofs.proof;

import ai.proofs.logic.Formula;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A finished natural-deduction proof in its externally numbered form.
 *
 * <p>The top-level entries begin with one {@code PR} line per premise, numbered {@code 1..k}.
 * Front ends render manually built and automatically discovered proofs through this same shape.
 */
public final class Proof {

    private final List<Formula> premises;
    private final Formula conclusion;
    private final List<ProofEntry> entries;

    public Proof(List<Formula> premises, Formula conclusion, List<ProofEntry> entries) {
        this.premises = List.copyOf(premises);
        this.conclusion = Objects.requireNonNull(conclusion, "conclusion");
        this.entries = List.copyOf(entries);
    }

    public List<Formula> getPremises() {
        return premises;
    }

    public Formula getConclusion() {
        return conclusion;
    }

    public List<ProofEntry> getEntries() {
        return entries;
    }

    /**
     * All lines in order, subproof contents included.
     */
    public List<Line> lines() {
        List<Line> out = new ArrayList<>();
        collectLines(entries, out);
        return out;
    }

    private static void collectLines(List<ProofEntry> entries, List<Line> out) {
        for (ProofEntry entry : entries) {
            if (entry instanceof Line line) {
                out.add(line);
            } else if (entry instanceof Subproof subproof) {
                collectLines(subproof.entries(), out);
            }
        }
    }

    public int lineCount() {
        return lines().size();
    }

    /**
     * Returns true iff every line checks out and the final top-level line is the conclusion.
     */
    public boolean isComplete() {
        if (entries.isEmpty()) {
            return false;
        }
        ProofEntry last = entries.get(entries.size() - 1);
        if (!(last instanceof Line line) || !line.formula().equals(conclusion)) {
            return false;
        }
        return ProofChecker.check(this).isEmpty();
    }

    @Override
    public String toString() {
        return new ProofFormatter(this).format();
    }
}
