package ai.proofs.prover.search;

import ai.proofs.logic.Formula;
import ai.proofs.logic.Rule;
import java.util.ArrayList;
import java.util.List;

/**
 * Arena owning every line and subproof created during one top-level search.
 *
 * <p>An object's identity is its index in the arena. Identities increase in creation order and
 * are never reused, so a citation stays unambiguous after the sequences that mention it are
 * copied, abandoned or reordered. Sequences ({@link Derivation}) hold identities only, which makes
 * branching a matter of copying a list of integers.
 *
 * <p>Objects are immutable once stored; the only replacement is
 * {@link #replaceSubproof(int, List)}, used when a finished proof is pruned.
 */
public final class ProofStore {

    private final List<ProofObject> objects = new ArrayList<>();

    public int addLine(Formula formula, Rule rule, List<Integer> citations) {
        return add(new StoredLine(formula, rule, citations));
    }

    public int addLine(Formula formula, Rule rule, Integer... citations) {
        return addLine(formula, rule, List.of(citations));
    }

    public int addSubproof(List<Integer> sequence, Formula goal) {
        return add(new StoredSubproof(sequence, goal));
    }

    private int add(ProofObject object) {
        objects.add(object);
        return objects.size() - 1;
    }

    /**
     * Returns the object with the given identity.
     *
     * @throws IllegalStateException if no such object was ever stored
     */
    public ProofObject get(int id) {
        if (id < 0 || id >= objects.size()) {
            throw new IllegalStateException("Unknown proof object id " + id);
        }
        return objects.get(id);
    }

    /**
     * Returns the line with the given identity, or null if it identifies a subproof.
     */
    public StoredLine lineOrNull(int id) {
        return get(id) instanceof StoredLine line ? line : null;
    }

    /**
     * Returns the subproof with the given identity, or null if it identifies a line.
     */
    public StoredSubproof subproofOrNull(int id) {
        return get(id) instanceof StoredSubproof subproof ? subproof : null;
    }

    /**
     * Replaces the contents of a subproof, keeping its identity.
     */
    void replaceSubproof(int id, List<Integer> sequence) {
        StoredSubproof subproof = subproofOrNull(id);
        if (subproof == null) {
            throw new IllegalStateException("Not a subproof: " + id);
        }
        objects.set(id, new StoredSubproof(sequence, subproof.goal()));
    }

    public int size() {
        return objects.size();
    }
}
