package ai.proofs.unit.helpers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.proofs.logic.Rule;
import ai.proofs.proof.Citation;
import ai.proofs.proof.Line;
import ai.proofs.proof.Proof;
import ai.proofs.proof.ProofChecker;
import java.util.List;

/**
 * Assertions shared by the prover and catalogue tests.
 */
public final class ProofAssertions {

    private ProofAssertions() {
    }

    /**
     * Asserts that the checker accepts the proof and that it ends in its conclusion.
     */
    public static void assertSound(Proof proof) {
        List<String> problems = ProofChecker.check(proof);
        assertTrue(problems.isEmpty(), () -> "Checker rejected proof:\n" + proof + problems);
        assertTrue(proof.isComplete(), () -> "Proof does not end in its conclusion:\n" + proof);
    }

    /**
     * Asserts the premise block: one {@code PR} line per premise, numbered from 1, in order.
     */
    public static void assertPremiseBlock(Proof proof) {
        List<Line> lines = proof.lines();
        for (int i = 0; i < proof.getPremises().size(); i++) {
            Line line = lines.get(i);
            assertEquals(i + 1, line.index(), "Premise line number");
            assertEquals(Rule.PREMISE, line.rule(), "Premise rule at line " + (i + 1));
            assertEquals(proof.getPremises().get(i), line.formula(), "Premise formula at line " + (i + 1));
        }
    }

    /**
     * Asserts that every citation points strictly before the citing line.
     */
    public static void assertCitationsPrecede(Proof proof) {
        for (Line line : proof.lines()) {
            for (Citation citation : line.justification().citations()) {
                assertTrue(citation.last() < line.index(),
                        () -> "Line " + line.index() + " cites " + citation + " which does not precede it");
            }
        }
    }

    public static long countRule(Proof proof, Rule rule) {
        return proof.lines().stream().filter(l -> l.rule() == rule).count();
    }
}
