package ai.proofs;

import ai.proofs.config.ProverProperties;
import ai.proofs.exercise.Exercise;
import ai.proofs.exercise.ExerciseCatalog;
import ai.proofs.proof.ProofFormatter;
import ai.proofs.proof.ProofJsonWriter;
import ai.proofs.prover.NaturalDeductionProver;
import ai.proofs.prover.ProofSearchResult;
import ai.proofs.prover.ProverException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NdProver implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(NdProver.class);

    private final NaturalDeductionProver prover;
    private final ProverProperties properties;
    private final ProofJsonWriter jsonWriter = new ProofJsonWriter();

    public NdProver(NaturalDeductionProver prover, ProverProperties properties) {
        this.prover = prover;
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(NdProver.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        runAll();
    }

    /**
     * Proves every selected exercise and logs each outcome.
     *
     * @return the number of exercises that were proved
     */
    public int runAll() {
        List<Exercise> exercises = ExerciseCatalog.select(properties.getExercises());
        int proved = 0;
        for (Exercise exercise : exercises) {
            if (solve(exercise)) {
                proved++;
            }
        }
        log.info("Proved {} of {} exercises", proved, exercises.size());
        return proved;
    }

    private boolean solve(Exercise exercise) {
        ProofSearchResult result;
        try {
            result = prover.search(exercise.premises(), exercise.conclusion());
        } catch (ProverException e) {
            log.warn("{}: {}", exercise.name(), e.getMessage());
            return false;
        }

        String rendered = switch (properties.getFormat()) {
            case TEXT -> new ProofFormatter(result.proof()).format();
            case JSON -> jsonWriter.write(result.proof());
        };
        log.info("{}\n{}", exercise, rendered);
        if (properties.isStats()) {
            log.info("{}: {} lines, {} ({} ms)",
                    exercise.name(),
                    result.proof().lineCount(),
                    result.stats(),
                    String.format("%.2f", result.durationMillis()));
        }
        return true;
    }
}
