package ai.proofs.prover;

import ai.proofs.logic.Formula;
import java.util.List;

/**
 * The argument is valid but the search exhausted every branch.
 *
 * <p>Validity has already been confirmed when this is thrown, so it points at a gap in the rule
 * set rather than at a bad request.
 */
public class ProofNotFoundException extends ProverException {

    public ProofNotFoundException(List<Formula> premises, Formula conclusion) {
        super("Argument is valid, but no proof was found", premises, conclusion);
    }
}
