package ai.proofs.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the command-line prover.
 *
 * Usage:
 * {@code java -jar nd-prover-engine.jar --prover.exercises=modus-ponens,de-morgan --prover.format=json}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "prover")
public class ProverProperties {

  /** Output format of a discovered proof. */
  public enum Format {
    TEXT,
    JSON
  }

  private List<String> exercises = new ArrayList<>();
  private Format format = Format.TEXT;
  private boolean stats;

  /**
   * Returns the names of the exercises to prove; empty means the whole catalogue.
   * @return exercise names
   */
  public List<String> getExercises() {
    return exercises;
  }

  public void setExercises(List<String> exercises) {
    this.exercises = exercises;
  }

  public Format getFormat() {
    return format;
  }

  public void setFormat(Format format) {
    this.format = format;
  }

  /**
   * Returns whether search statistics are logged with each proof.
   * @return true to log statistics
   */
  public boolean isStats() {
    return stats;
  }

  public void setStats(boolean stats) {
    this.stats = stats;
  }
}
