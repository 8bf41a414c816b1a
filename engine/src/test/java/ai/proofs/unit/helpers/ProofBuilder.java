package ai.proofs.unit.helpers;

import ai.proofs.logic.Formula;
import ai.proofs.logic.Rule;
import ai.proofs.proof.Citation;
import ai.proofs.proof.Justification;
import ai.proofs.proof.Line;
import ai.proofs.proof.Proof;
import ai.proofs.proof.ProofEntry;
import ai.proofs.proof.Subproof;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fluent builder for hand-written numbered proofs.
 *
 * <p>Lines are numbered automatically. Citations are written the way they are displayed:
 * {@code "3"} for a line, {@code "2-4"} for a subproof.
 * <pre>{@code
 * Proof proof = ProofBuilder.proving(Q)
 *         .premise(imp(P, Q))
 *         .premise(P)
 *         .line(Q, Rule.IMP_ELIM, "1", "2")
 *         .build();
 * }</pre>
 *
 * <p>The builder does not validate anything; that is what the checker under test is for. Premises
 * of the resulting proof are the formulas of the {@code PR} lines added, unless set explicitly.
 */
public final class ProofBuilder {

    private final Formula conclusion;
    private final List<Formula> premises = new ArrayList<>();
    private List<Formula> declaredPremises;
    private final Deque<List<ProofEntry>> open = new ArrayDeque<>();
    private int next = 1;

    private ProofBuilder(Formula conclusion) {
        this.conclusion = conclusion;
        open.push(new ArrayList<>());
    }

    public static ProofBuilder proving(Formula conclusion) {
        return new ProofBuilder(conclusion);
    }

    /**
     * Overrides the premise list reported by the proof, independent of the {@code PR} lines.
     */
    public ProofBuilder declaredPremises(Formula... formulas) {
        this.declaredPremises = List.of(formulas);
        return this;
    }

    public ProofBuilder premise(Formula formula) {
        premises.add(formula);
        return line(formula, Rule.PREMISE);
    }

    public ProofBuilder line(Formula formula, Rule rule, String... citations) {
        List<Citation> parsed = new ArrayList<>();
        for (String citation : citations) {
            parsed.add(parse(citation));
        }
        open.peek().add(new Line(next++, formula, new Justification(rule, parsed)));
        return this;
    }

    /**
     * Opens a subproof whose first line assumes {@code formula}.
     */
    public ProofBuilder assume(Formula formula) {
        open.push(new ArrayList<>());
        return line(formula, Rule.ASSUMPTION);
    }

    public ProofBuilder close() {
        if (open.size() < 2) {
            throw new IllegalStateException("No open subproof");
        }
        List<ProofEntry> entries = open.pop();
        open.peek().add(new Subproof(entries));
        return this;
    }

    public Proof build() {
        if (open.size() != 1) {
            throw new IllegalStateException(open.size() - 1 + " subproof(s) still open");
        }
        List<Formula> reported = declaredPremises != null ? declaredPremises : premises;
        return new Proof(reported, conclusion, open.peek());
    }

    private static Citation parse(String citation) {
        int dash = citation.indexOf('-');
        if (dash < 0) {
            return Citation.line(Integer.parseInt(citation.trim()));
        }
        return Citation.range(
                Integer.parseInt(citation.substring(0, dash).trim()),
                Integer.parseInt(citation.substring(dash + 1).trim()));
    }
}
