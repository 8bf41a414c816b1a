package ai.proofs.prover.search;

import ai.proofs.logic.Formula;
import ai.proofs.logic.Formula.Connective;
import ai.proofs.logic.Rule;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Elimination rules.
 *
 * <p>{@link #eliminate(ProofSearch)} saturates a sequence deterministically, in this priority:
 * <ol>
 *   <li>R: the goal is already present; closes the sequence</li>
 *   <li>X: ⊥ is present; closes the sequence with the goal</li>
 *   <li>¬E, ∧E, →E, ↔E: each adds one new line, then the scan restarts</li>
 * </ol>
 * Saturation never removes lines and never branches.
 *
 * <p>The remaining methods are speculative and are only run by {@link ProofSearch} on a copy of
 * the sequence: forced ¬E, forced →E and forced ↔E derive a missing premise of an elimination
 * first (each gated by the truth-table oracle), and ∨E splits on a disjunction.
 */
final class Eliminator {

    private Eliminator() {
    }

    /**
     * Applies elimination rules until the goal is reached or nothing applies.
     *
     * @return true if the goal was reached
     */
    static boolean eliminate(ProofSearch search) {
        Derivation d = search.derivation();
        while (true) {
            if (reiterate(d)) {
                return true;
            }
            if (explode(d)) {
                return true;
            }
            if (notElim(d) || andElim(d) || impElim(d) || iffElim(d)) {
                continue;
            }
            return false;
        }
    }

    /**
     * Succeeds if the last line already is a derived copy of the goal; otherwise reiterates the
     * first line carrying the goal.
     */
    static boolean reiterate(Derivation d) {
        ProofStore store = d.store();
        if (!d.isEmpty()) {
            StoredLine end = store.lineOrNull(d.lastId());
            if (end != null && end.formula().equals(d.goal()) && !end.isPremiseOrAssumption()) {
                return true;
            }
        }
        for (int id : d.sequence()) {
            StoredLine line = store.lineOrNull(id);
            if (line != null && line.formula().equals(d.goal())) {
                d.appendLine(d.goal(), Rule.REITERATION, id);
                return true;
            }
        }
        return false;
    }

    static boolean explode(Derivation d) {
        ProofStore store = d.store();
        for (int id : d.sequence()) {
            StoredLine line = store.lineOrNull(id);
            if (line != null && line.formula().isFalsum()) {
                d.appendLine(d.goal(), Rule.EXPLOSION, id);
                return true;
            }
        }
        return false;
    }

    static boolean notElim(Derivation d) {
        ProofStore store = d.store();
        for (int id : d.sequence()) {
            StoredLine negation = store.lineOrNull(id);
            if (negation == null || !negation.formula().is(Connective.NOT)) {
                continue;
            }
            Integer positive = findLine(d, negation.formula().inner());
            if (positive != null) {
                d.appendLine(Formula.falsum(), Rule.NOT_ELIM, id, positive);
                return true;
            }
        }
        return false;
    }

    static boolean andElim(Derivation d) {
        ProofStore store = d.store();
        Set<Formula> formulas = d.formulas();
        for (int id : d.sequence()) {
            StoredLine line = store.lineOrNull(id);
            if (line == null || !line.formula().is(Connective.AND)) {
                continue;
            }
            for (Formula conjunct : List.of(line.formula().left(), line.formula().right())) {
                if (!formulas.contains(conjunct)) {
                    d.appendLine(conjunct, Rule.AND_ELIM, id);
                    return true;
                }
            }
        }
        return false;
    }

    static boolean impElim(Derivation d) {
        ProofStore store = d.store();
        Set<Formula> formulas = d.formulas();
        for (int id : d.sequence()) {
            StoredLine line = store.lineOrNull(id);
            if (line == null || !line.formula().is(Connective.IMP)) {
                continue;
            }
            Formula conditional = line.formula();
            if (formulas.contains(conditional.right())) {
                continue;
            }
            Integer antecedent = findLine(d, conditional.left());
            if (antecedent != null) {
                d.appendLine(conditional.right(), Rule.IMP_ELIM, id, antecedent);
                return true;
            }
        }
        return false;
    }

    static boolean iffElim(Derivation d) {
        ProofStore store = d.store();
        Set<Formula> formulas = d.formulas();
        for (int id : d.sequence()) {
            StoredLine line = store.lineOrNull(id);
            if (line == null || !line.formula().is(Connective.IFF)) {
                continue;
            }
            Formula left = line.formula().left();
            Formula right = line.formula().right();
            boolean haveLeft = formulas.contains(left);
            boolean haveRight = formulas.contains(right);
            if (haveLeft && !haveRight) {
                d.appendLine(right, Rule.IFF_ELIM, id, findLine(d, left));
                return true;
            }
            if (haveRight && !haveLeft) {
                d.appendLine(left, Rule.IFF_ELIM, id, findLine(d, right));
                return true;
            }
        }
        return false;
    }

    /**
     * Case split: for every disjunction in scope, proves the goal once under each disjunct and
     * closes with ∨E. The cheapest split is committed.
     */
    static boolean orElim(ProofSearch search) {
        Derivation d = search.derivation();
        ProofStore store = d.store();
        Formula goal = d.goal();
        int n = d.size();
        List<Derivation> branches = new ArrayList<>();

        for (int id : new ArrayList<>(d.sequence())) {
            StoredLine line = store.lineOrNull(id);
            if (line == null || !line.formula().is(Connective.OR)) {
                continue;
            }

            int assumption1 = store.addLine(line.formula().left(), Rule.ASSUMPTION);
            Derivation case1 = d.extendedWith(goal, assumption1);
            if (!search.isolated(case1).prove()) {
                continue;
            }
            int subproof1 = store.addSubproof(case1.tail(n), goal);

            int assumption2 = store.addLine(line.formula().right(), Rule.ASSUMPTION);
            Derivation case2 = d.extendedWith(goal, subproof1, assumption2);
            if (!search.isolated(case2).prove()) {
                continue;
            }
            int subproof2 = store.addSubproof(case2.tail(n + 1), goal);

            Derivation branch = d.extendedWith(goal, subproof1, subproof2);
            branch.appendLine(goal, Rule.OR_ELIM, id, subproof1, subproof2);
            branches.add(branch);
        }
        return d.commitBestBranch(branches);
    }

    /**
     * When the assumptions are inconsistent, tries to derive the inner formula of each negation
     * in scope, so that ¬E can fire on the next saturation.
     */
    static boolean forceNotElim(ProofSearch search) {
        Derivation d = search.derivation();
        ProofStore store = d.store();
        if (!search.isValid(d.assumptions(), Formula.falsum())) {
            return false;
        }

        List<Derivation> branches = new ArrayList<>();
        for (int id : new ArrayList<>(d.sequence())) {
            StoredLine line = store.lineOrNull(id);
            if (line == null || !line.formula().is(Connective.NOT)) {
                continue;
            }
            Derivation branch = d.withGoal(line.formula().inner());
            if (search.branch(branch).prove()) {
                branch.popReiteration();
                if (!branch.sameSequence(d)) {
                    branches.add(branch);
                }
            }
        }
        return d.commitBestBranch(branches);
    }

    /**
     * Derives the missing antecedent of the first conditional whose antecedent follows from the
     * assumptions, so that →E can fire on the next saturation.
     */
    static boolean forceImpElim(ProofSearch search) {
        Derivation d = search.derivation();
        ProofStore store = d.store();
        Set<Formula> formulas = d.formulas();

        for (int id : new ArrayList<>(d.sequence())) {
            StoredLine line = store.lineOrNull(id);
            if (line == null || !line.formula().is(Connective.IMP)) {
                continue;
            }
            Formula conditional = line.formula();
            if (formulas.contains(conditional.right())) {
                continue;
            }
            if (!search.isValid(d.assumptions(), conditional.left())) {
                continue;
            }
            Derivation branch = d.withGoal(conditional.left());
            if (search.branch(branch).prove()) {
                branch.popReiteration();
                if (!branch.sameSequence(d)) {
                    d.setSequence(branch.sequence());
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * For a biconditional with neither side in scope but both sides following from the
     * assumptions, derives the cheaper side so that ↔E can fire on the next saturation.
     */
    static boolean forceIffElim(ProofSearch search) {
        Derivation d = search.derivation();
        ProofStore store = d.store();
        Set<Formula> formulas = d.formulas();

        for (int id : new ArrayList<>(d.sequence())) {
            StoredLine line = store.lineOrNull(id);
            if (line == null || !line.formula().is(Connective.IFF)) {
                continue;
            }
            Formula left = line.formula().left();
            Formula right = line.formula().right();
            if (formulas.contains(left) || formulas.contains(right)) {
                continue;
            }
            if (!search.isValid(d.assumptions(), left)) {
                continue;
            }

            List<Derivation> branches = new ArrayList<>();
            for (Formula side : List.of(left, right)) {
                Derivation branch = d.withGoal(side);
                if (search.isolated(branch).prove()) {
                    branch.popReiteration();
                    if (!branch.sameSequence(d)) {
                        branches.add(branch);
                    }
                }
            }
            if (d.commitBestBranch(branches)) {
                return true;
            }
        }
        return false;
    }

    private static Integer findLine(Derivation d, Formula formula) {
        ProofStore store = d.store();
        for (int id : d.sequence()) {
            StoredLine line = store.lineOrNull(id);
            if (line != null && line.formula().equals(formula)) {
                return id;
            }
        }
        return null;
    }
}
