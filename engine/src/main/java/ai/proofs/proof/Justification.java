package ai.proofs.proof;

import ai.proofs.logic.Rule;
import java.util.List;
import java.util.Objects;

/**
 * The rule a line was derived by, together with the lines and subproofs it cites.
 */
public record Justification(Rule rule, List<Citation> citations) {
    public Justification {
        Objects.requireNonNull(rule, "rule");
        citations = List.copyOf(citations);
    }

    public static Justification of(Rule rule, Citation... citations) {
        return new Justification(rule, List.of(citations));
    }

    /**
     * Renders e.g. {@code →E, 1, 2} or {@code PR}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(rule.getSymbol());
        for (Citation citation : citations) {
            sb.append(", ").append(citation);
        }
        return sb.toString();
    }
}
