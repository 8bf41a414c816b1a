package ai.proofs.proof;

/**
 * An element of a proof sequence: either a numbered {@link Line} or a nested {@link Subproof}.
 */
public sealed interface ProofEntry permits Line, Subproof {

    /**
     * Number of the first line this entry covers.
     */
    int firstIndex();

    /**
     * Number of the last line this entry covers.
     */
    int lastIndex();
}
