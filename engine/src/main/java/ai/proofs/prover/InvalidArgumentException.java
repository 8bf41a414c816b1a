package ai.proofs.prover;

import ai.proofs.logic.Formula;
import java.util.List;

/**
 * The conclusion does not follow from the premises, so no proof exists.
 */
public class InvalidArgumentException extends ProverException {

    public InvalidArgumentException(List<Formula> premises, Formula conclusion) {
        super("Invalid argument, no proof exists", premises, conclusion);
    }
}
