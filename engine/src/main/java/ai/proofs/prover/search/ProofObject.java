package ai.proofs.prover.search;

/**
 * An object owned by a {@link ProofStore}: a derived line or a closed subproof.
 *
 * <p>Objects never hold references to one another, only arena identities.
 */
public sealed interface ProofObject permits StoredLine, StoredSubproof {
}
