package ai.proofs.proof;

import static ai.proofs.logic.Formula.imp;
import static ai.proofs.unit.helpers.Formulas.P;
import static ai.proofs.unit.helpers.Formulas.Q;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ai.proofs.logic.Rule;
import ai.proofs.unit.helpers.ProofBuilder;
import java.util.List;
import org.junit.jupiter.api.Test;

class ProofFormatterTest {

    @Test
    void premisesAreSeparatedFromDerivedLines() {
        Proof proof = ProofBuilder.proving(Q)
                .premise(imp(P, Q))
                .premise(P)
                .line(Q, Rule.IMP_ELIM, "1", "2")
                .build();

        String expected = ""
                + " 1 │ P → Q   PR\n"
                + " 2 │ P       PR\n"
                + "   ├─────\n"
                + " 3 │ Q       →E, 1, 2\n";
        assertEquals(expected, new ProofFormatter(proof).format());
    }

    @Test
    void subproofsAreIndentedWithOneBarPerScope() {
        Proof proof = ProofBuilder.proving(imp(P, P))
                .assume(P)
                .line(P, Rule.REITERATION, "1")
                .close()
                .line(imp(P, P), Rule.IMP_INTRO, "1-2")
                .build();

        String expected = ""
                + " 1 │ │ P     AS\n"
                + "   │ ├─────\n"
                + " 2 │ │ P     R, 1\n"
                + " 3 │ P → P   →I, 1-2\n";
        assertEquals(expected, new ProofFormatter(proof).format());
    }

    @Test
    void emptyProofRendersAsEmptyString() {
        assertEquals("", new ProofFormatter(new Proof(List.of(), P, List.of())).format());
    }

    @Test
    void toStringUsesTheFormatter() {
        Proof proof = ProofBuilder.proving(P).premise(P).build();
        assertEquals(new ProofFormatter(proof).format(), proof.toString());
    }
}
