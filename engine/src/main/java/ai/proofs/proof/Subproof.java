package ai.proofs.proof;

import java.util.List;

/**
 * A nested scope opened by an assumption line.
 */
public record Subproof(List<ProofEntry> entries) implements ProofEntry {
    public Subproof {
        entries = List.copyOf(entries);
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("Subproof must contain at least one entry");
        }
    }

    @Override
    public int firstIndex() {
        return entries.get(0).firstIndex();
    }

    @Override
    public int lastIndex() {
        return entries.get(entries.size() - 1).lastIndex();
    }

    /**
     * The citation that refers to this whole subproof.
     */
    public Citation toCitation() {
        return Citation.range(firstIndex(), lastIndex());
    }

    /**
     * The opening entry, which is the assumption line in a well-formed subproof.
     */
    public ProofEntry first() {
        return entries.get(0);
    }

    /**
     * The closing entry, which carries the formula the subproof established.
     */
    public ProofEntry last() {
        return entries.get(entries.size() - 1);
    }
}
