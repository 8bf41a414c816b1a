package ai.proofs.prover.search;

import ai.proofs.proof.Citation;
import ai.proofs.proof.Justification;
import ai.proofs.proof.Line;
import ai.proofs.proof.ProofEntry;
import ai.proofs.proof.Subproof;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns an accepted working derivation into the externally numbered proof shape.
 *
 * <p>{@link #prune(Derivation)} drops every line and subproof that nothing cites, except premise
 * and assumption lines and the last object of each sequence. Removing a line can leave the lines
 * it cited uncited, so sweeps repeat over the whole tree until one removes nothing.
 *
 * <p>{@link #translate(ProofStore, List, int)} then numbers the lines from a starting offset and
 * rewrites each citation from arena identity to line number or subproof range.
 */
public final class PostProcessor {

    private PostProcessor() {
    }

    /**
     * Prunes the derivation in place and translates it, numbering from line 1.
     */
    public static List<ProofEntry> process(Derivation root) {
        prune(root);
        return translate(root.store(), root.sequence(), 1);
    }

    /**
     * Removes uncited objects until a sweep removes nothing.
     *
     * @return the number of objects removed
     */
    public static int prune(Derivation root) {
        ProofStore store = root.store();
        int total = 0;
        while (true) {
            Set<Integer> cited = root.citations();
            int[] removed = {0};
            root.setSequence(sweep(store, root.sequence(), cited, removed));
            total += removed[0];
            if (removed[0] == 0) {
                return total;
            }
        }
    }

    private static List<Integer> sweep(ProofStore store, List<Integer> ids, Set<Integer> cited, int[] removed) {
        List<Integer> kept = new ArrayList<>();
        for (int i = 0; i < ids.size(); i++) {
            int id = ids.get(i);
            boolean last = i == ids.size() - 1;
            ProofObject object = store.get(id);
            if (cited.contains(id) || last) {
                if (object instanceof StoredSubproof subproof) {
                    store.replaceSubproof(id, sweep(store, subproof.sequence(), cited, removed));
                }
                kept.add(id);
            } else if (object instanceof StoredLine line && line.isPremiseOrAssumption()) {
                kept.add(id);
            } else {
                removed[0]++;
            }
        }
        return kept;
    }

    /**
     * Numbers a pruned sequence starting at {@code start}.
     *
     * @throws IllegalStateException if a line cites an object that was not numbered before it
     */
    public static List<ProofEntry> translate(ProofStore store, List<Integer> ids, int start) {
        return translate(store, ids, start, new HashMap<>());
    }

    private static List<ProofEntry> translate(ProofStore store, List<Integer> ids, int start,
                                              Map<Integer, Citation> numbering) {
        List<ProofEntry> entries = new ArrayList<>();
        int index = start;
        for (int id : ids) {
            ProofObject object = store.get(id);
            if (object instanceof StoredLine line) {
                List<Citation> citations = new ArrayList<>();
                for (int cited : line.citations()) {
                    Citation citation = numbering.get(cited);
                    if (citation == null) {
                        throw new IllegalStateException("Line " + index + " cites unnumbered object " + cited);
                    }
                    citations.add(citation);
                }
                entries.add(new Line(index, line.formula(), new Justification(line.rule(), citations)));
                numbering.put(id, Citation.line(index));
                index++;
            } else if (object instanceof StoredSubproof subproof) {
                entries.add(new Subproof(translate(store, subproof.sequence(), index, numbering)));
                int count = Derivation.lineCount(store, subproof.sequence());
                numbering.put(id, Citation.range(index, index + count - 1));
                index += count;
            }
        }
        return entries;
    }
}
