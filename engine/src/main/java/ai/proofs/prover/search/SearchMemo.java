package ai.proofs.prover.search;

import ai.proofs.logic.Formula;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Dominance table keyed by (assumptions, goal).
 *
 * <p>For every state it records the best cost seen and the richest set of available formulas.
 * A state is dominated when an earlier visit to the same key was at most as expensive and had
 * every formula now available; searching it again cannot do better, so the caller fails fast.
 * This is what keeps the branch tree of one top-level search finite.
 *
 * <p>A memo is owned by one top-level search. {@link #snapshot()} gives a sibling branch a private
 * copy when its exploration must not count against the other sibling.
 */
public final class SearchMemo {

    private final Map<Key, Entry> seen;

    public SearchMemo() {
        this(new HashMap<>());
    }

    private SearchMemo(Map<Key, Entry> seen) {
        this.seen = seen;
    }

    /**
     * Records a visit to the state of the given derivation.
     *
     * @return false if the state is dominated by an earlier visit
     */
    public boolean enter(Derivation derivation) {
        Key key = new Key(Set.copyOf(derivation.assumptions()), derivation.goal());
        SearchCost cost = derivation.cost();
        Set<Formula> formulas = Set.copyOf(derivation.formulas());

        Entry previous = seen.get(key);
        if (previous != null) {
            if (previous.dominates(cost, formulas)) {
                return false;
            }
            cost = SearchCost.min(cost, previous.cost());
            if (previous.formulas().size() > formulas.size() && previous.formulas().containsAll(formulas)) {
                formulas = previous.formulas();
            }
        }
        seen.put(key, new Entry(cost, formulas));
        return true;
    }

    /**
     * An independent copy of the current table.
     */
    public SearchMemo snapshot() {
        return new SearchMemo(new HashMap<>(seen));
    }

    public int size() {
        return seen.size();
    }

    private record Key(Set<Formula> assumptions, Formula goal) {
    }

    private record Entry(SearchCost cost, Set<Formula> formulas) {
        boolean dominates(SearchCost otherCost, Set<Formula> otherFormulas) {
            return otherCost.compareTo(cost) >= 0 && formulas.containsAll(otherFormulas);
        }
    }
}
