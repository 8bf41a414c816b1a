package ai.proofs.proof;

import ai.proofs.logic.Formula;
import ai.proofs.logic.Rule;
import java.util.Objects;

/**
 * A numbered proof line.
 */
public record Line(int index, Formula formula, Justification justification) implements ProofEntry {
    public Line {
        Objects.requireNonNull(formula, "formula");
        Objects.requireNonNull(justification, "justification");
        if (index < 1) {
            throw new IllegalArgumentException("Line numbers start at 1: " + index);
        }
    }

    public Rule rule() {
        return justification.rule();
    }

    @Override
    public int firstIndex() {
        return index;
    }

    @Override
    public int lastIndex() {
        return index;
    }

    @Override
    public String toString() {
        return index + ". " + formula + " ; " + justification;
    }
}
