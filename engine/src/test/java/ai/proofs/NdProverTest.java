package ai.proofs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ai.proofs.config.ProverProperties;
import ai.proofs.exercise.ExerciseCatalog;
import ai.proofs.prover.NaturalDeductionProver;
import java.util.List;
import org.junit.jupiter.api.Test;

class NdProverTest {

    private NdProver app(ProverProperties properties) {
        return new NdProver(new NaturalDeductionProver(), properties);
    }

    @Test
    void defaultsProveTheWholeCatalogue() {
        ProverProperties properties = new ProverProperties();
        assertEquals(ProverProperties.Format.TEXT, properties.getFormat());
        assertEquals(ExerciseCatalog.all().size(), app(properties).runAll());
    }

    @Test
    void selectedExercisesInJsonWithStats() {
        ProverProperties properties = new ProverProperties();
        properties.setExercises(List.of("excluded-middle", "de-morgan"));
        properties.setFormat(ProverProperties.Format.JSON);
        properties.setStats(true);
        assertEquals(2, app(properties).runAll());
    }

    @Test
    void unknownExerciseNameFailsFast() {
        ProverProperties properties = new ProverProperties();
        properties.setExercises(List.of("no-such-exercise"));
        assertThrows(IllegalArgumentException.class, () -> app(properties).runAll());
    }
}
