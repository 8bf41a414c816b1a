package ai.proofs.exercise;

import static ai.proofs.unit.helpers.ProofAssertions.assertCitationsPrecede;
import static ai.proofs.unit.helpers.ProofAssertions.assertPremiseBlock;
import static ai.proofs.unit.helpers.ProofAssertions.assertSound;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.proofs.logic.TruthTable;
import ai.proofs.proof.Proof;
import ai.proofs.prover.NaturalDeductionProver;
import ai.proofs.prover.ProverException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class ExerciseCatalogTest {

    @Test
    void namesAreUnique() {
        Set<String> names = new HashSet<>();
        for (Exercise exercise : ExerciseCatalog.all()) {
            assertTrue(names.add(exercise.name()), "Duplicate exercise " + exercise.name());
        }
    }

    @Test
    void everyExerciseIsValid() {
        for (Exercise exercise : ExerciseCatalog.all()) {
            assertTrue(TruthTable.isValid(exercise.premises(), exercise.conclusion()), exercise.toString());
        }
    }

    @Test
    void everyExerciseHasACheckedProof() throws ProverException {
        NaturalDeductionProver prover = new NaturalDeductionProver();
        for (Exercise exercise : ExerciseCatalog.all()) {
            Proof proof = prover.prove(exercise.premises(), exercise.conclusion());
            assertSound(proof);
            assertPremiseBlock(proof);
            assertCitationsPrecede(proof);
        }
    }

    @Test
    void lookupIgnoresCaseAndWhitespace() {
        assertEquals("modus-ponens", ExerciseCatalog.byName("  Modus-Ponens ").orElseThrow().name());
        assertTrue(ExerciseCatalog.byName("modus-morons").isEmpty());
    }

    @Test
    void selection() {
        assertEquals(ExerciseCatalog.all(), ExerciseCatalog.select(List.of()));
        assertEquals(List.of("identity", "explosion"),
                ExerciseCatalog.select(List.of("identity", "explosion")).stream().map(Exercise::name).toList());
        assertThrows(IllegalArgumentException.class, () -> ExerciseCatalog.select(List.of("nope")));
    }

    @Test
    void rendersAsAnArgument() {
        assertEquals("modus-ponens: P → Q, P ∴ Q", ExerciseCatalog.byName("modus-ponens").orElseThrow().toString());
        assertEquals("identity: ∴ P → P", ExerciseCatalog.byName("identity").orElseThrow().toString());
    }
}
