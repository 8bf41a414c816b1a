package ai.proofs.prover.search;

import ai.proofs.logic.Formula;
import ai.proofs.logic.Rule;
import java.util.ArrayList;
import java.util.List;

/**
 * Goal-directed introduction rules, chosen by the main connective of the goal.
 *
 * <ul>
 *   <li>¬A: assume A, reach ⊥, close with ¬I</li>
 *   <li>A ∧ B: prove both conjuncts, in both orders, keep the cheaper; close with ∧I</li>
 *   <li>A ∨ B: reuse a disjunct already in scope, else prove a disjunct that follows from the
 *       assumptions; close with ∨I</li>
 *   <li>A → B: assume A, reach B, close with →I</li>
 *   <li>A ↔ B: one subproof per direction; close with ↔I</li>
 * </ul>
 * Atoms and ⊥ have no introduction rule. Indirect proof is not dispatched here; the search
 * controller tries it last as a speculative branch.
 */
final class Introducer {

    private Introducer() {
    }

    static boolean introduce(ProofSearch search) {
        Formula goal = search.derivation().goal();
        return switch (goal.connective()) {
            case NOT -> openAndClose(search, goal.inner(), Formula.falsum(), Rule.NOT_INTRO);
            case AND -> andIntro(search);
            case OR -> orIntro(search);
            case IMP -> openAndClose(search, goal.left(), goal.right(), Rule.IMP_INTRO);
            case IFF -> iffIntro(search);
            case ATOM, FALSUM -> false;
        };
    }

    /**
     * Assumes the negated goal and searches for ⊥.
     */
    static boolean indirectProof(ProofSearch search) {
        Formula goal = search.derivation().goal();
        return openAndClose(search, Formula.not(goal), Formula.falsum(), Rule.INDIRECT_PROOF);
    }

    /**
     * Opens a subproof on {@code assumption}, searches it for {@code target} and, on success,
     * appends the closed subproof plus a line deriving the goal by {@code rule}.
     */
    private static boolean openAndClose(ProofSearch search, Formula assumption, Formula target, Rule rule) {
        Derivation d = search.derivation();
        ProofStore store = d.store();
        int n = d.size();

        int assumptionId = store.addLine(assumption, Rule.ASSUMPTION);
        Derivation inner = d.extendedWith(target, assumptionId);
        if (!search.branch(inner).prove()) {
            return false;
        }
        int subproof = store.addSubproof(inner.tail(n), target);
        d.append(subproof);
        d.appendLine(d.goal(), rule, subproof);
        return true;
    }

    private static boolean andIntro(ProofSearch search) {
        Derivation d = search.derivation();
        Formula left = d.goal().left();
        Formula right = d.goal().right();
        List<Derivation> branches = new ArrayList<>();

        for (List<Formula> order : List.of(List.of(left, right), List.of(right, left))) {
            Derivation first = d.withGoal(order.get(0));
            if (!search.isolated(first).prove()) {
                continue;
            }
            int firstId = first.popReiteration();

            Derivation second = first.withGoal(order.get(1));
            if (!search.isolated(second).prove()) {
                continue;
            }
            int secondId = second.popReiteration();

            second.appendLine(d.goal(), Rule.AND_INTRO, firstId, secondId);
            branches.add(second);
        }
        return d.commitBestBranch(branches);
    }

    private static boolean orIntro(ProofSearch search) {
        Derivation d = search.derivation();
        ProofStore store = d.store();
        Formula left = d.goal().left();
        Formula right = d.goal().right();

        for (int id : d.sequence()) {
            StoredLine line = store.lineOrNull(id);
            if (line != null && (line.formula().equals(left) || line.formula().equals(right))) {
                d.appendLine(d.goal(), Rule.OR_INTRO, id);
                return true;
            }
        }

        List<Derivation> branches = new ArrayList<>();
        for (Formula disjunct : List.of(left, right)) {
            if (!search.isValid(d.assumptions(), disjunct)) {
                continue;
            }
            Derivation branch = d.withGoal(disjunct);
            if (search.branch(branch).prove()) {
                int disjunctId = branch.popReiteration();
                branch.appendLine(d.goal(), Rule.OR_INTRO, disjunctId);
                branches.add(branch);
            }
        }
        return d.commitBestBranch(branches);
    }

    private static boolean iffIntro(ProofSearch search) {
        Derivation d = search.derivation();
        ProofStore store = d.store();
        Formula left = d.goal().left();
        Formula right = d.goal().right();
        int n = d.size();

        int assumption1 = store.addLine(left, Rule.ASSUMPTION);
        Derivation forward = d.extendedWith(right, assumption1);
        if (!search.isolated(forward).prove()) {
            return false;
        }
        int subproof1 = store.addSubproof(forward.tail(n), right);

        int assumption2 = store.addLine(right, Rule.ASSUMPTION);
        Derivation backward = d.extendedWith(left, subproof1, assumption2);
        if (!search.isolated(backward).prove()) {
            return false;
        }
        int subproof2 = store.addSubproof(backward.tail(n + 1), left);

        d.append(subproof1);
        d.append(subproof2);
        d.appendLine(d.goal(), Rule.IFF_INTRO, subproof1, subproof2);
        return true;
    }
}
