package ai.proofs.logic;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Brute-force truth-table semantics for propositional formulas.
 *
 * <p>{@link #isValid(Collection, Formula)} is the sole source of logical ground truth for the
 * prover. It enumerates all {@code 2^n} assignments over the {@code n} atoms involved, so callers
 * only ever pass it the handful of formulas that make up one argument or one subgoal.
 */
public final class TruthTable {

    private TruthTable() {
    }

    /**
     * Collects the sorted set of atom names occurring in the given formulas.
     */
    public static SortedSet<String> atoms(Collection<Formula> formulas) {
        SortedSet<String> out = new TreeSet<>();
        for (Formula formula : formulas) {
            formula.collectAtoms(out);
        }
        return out;
    }

    /**
     * Evaluates a formula under an assignment. Falsum is always false.
     *
     * @throws IllegalArgumentException if an atom of the formula has no value in the assignment
     */
    public static boolean evaluate(Formula formula, Map<String, Boolean> assignment) {
        return switch (formula.connective()) {
            case ATOM -> {
                Boolean value = assignment.get(formula.name());
                if (value == null) {
                    throw new IllegalArgumentException("Unassigned atom: " + formula.name());
                }
                yield value;
            }
            case FALSUM -> false;
            case NOT -> !evaluate(formula.inner(), assignment);
            case AND -> evaluate(formula.left(), assignment) && evaluate(formula.right(), assignment);
            case OR -> evaluate(formula.left(), assignment) || evaluate(formula.right(), assignment);
            case IMP -> !evaluate(formula.left(), assignment) || evaluate(formula.right(), assignment);
            case IFF -> evaluate(formula.left(), assignment) == evaluate(formula.right(), assignment);
        };
    }

    /**
     * Returns true iff every assignment satisfying all premises also satisfies the conclusion.
     *
     * <p>Assignments are visited in lexicographic order over the sorted atoms: for assignment
     * number {@code i}, atom {@code j} takes bit {@code n-1-j} of {@code i}. The first
     * counter-model ends the enumeration. With no atoms at all, both sides are evaluated under the
     * empty assignment; premises that are false there make the argument vacuously valid.
     */
    public static boolean isValid(Collection<Formula> premises, Formula conclusion) {
        List<Formula> all = new ArrayList<>(premises);
        all.add(conclusion);
        List<String> atoms = new ArrayList<>(atoms(all));

        if (atoms.isEmpty()) {
            Map<String, Boolean> empty = Collections.emptyMap();
            return !allTrue(premises, empty) || evaluate(conclusion, empty);
        }

        int n = atoms.size();
        if (n >= Long.SIZE - 1) {
            throw new IllegalArgumentException("Too many atoms for a truth table: " + n);
        }
        Map<String, Boolean> assignment = new HashMap<>();
        for (long i = 0; i < (1L << n); i++) {
            for (int j = 0; j < n; j++) {
                assignment.put(atoms.get(j), (i & (1L << (n - 1 - j))) != 0);
            }
            if (allTrue(premises, assignment) && !evaluate(conclusion, assignment)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns true iff the formulas are jointly unsatisfiable.
     */
    public static boolean isInconsistent(Collection<Formula> formulas) {
        return isValid(formulas, Formula.falsum());
    }

    private static boolean allTrue(Collection<Formula> formulas, Map<String, Boolean> assignment) {
        for (Formula formula : formulas) {
            if (!evaluate(formula, assignment)) {
                return false;
            }
        }
        return true;
    }
}
