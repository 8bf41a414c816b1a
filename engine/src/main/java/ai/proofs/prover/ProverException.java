package ai.proofs.prover;

import ai.proofs.logic.Formula;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Base class for the recoverable outcomes of {@link NaturalDeductionProver#prove(List, Formula)}.
 */
public abstract class ProverException extends Exception {

    private final List<Formula> premises;
    private final Formula conclusion;

    protected ProverException(String message, List<Formula> premises, Formula conclusion) {
        super(message + ": " + describe(premises, conclusion));
        this.premises = List.copyOf(premises);
        this.conclusion = conclusion;
    }

    public List<Formula> getPremises() {
        return premises;
    }

    public Formula getConclusion() {
        return conclusion;
    }

    /**
     * Renders an argument as {@code P → Q, P ∴ Q}.
     */
    static String describe(List<Formula> premises, Formula conclusion) {
        String left = premises.stream().map(Formula::toString).collect(Collectors.joining(", "));
        return left.isEmpty() ? "∴ " + conclusion : left + " ∴ " + conclusion;
    }
}
