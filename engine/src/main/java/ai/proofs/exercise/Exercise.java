package ai.proofs.exercise;

import ai.proofs.logic.Formula;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A named argument: premises and the conclusion to derive from them.
 */
public record Exercise(String name, List<Formula> premises, Formula conclusion) {

    public Exercise {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(conclusion, "conclusion");
        premises = List.copyOf(premises);
    }

    @Override
    public String toString() {
        String left = premises.stream().map(Formula::toString).collect(Collectors.joining(", "));
        return name + ": " + (left.isEmpty() ? "" : left + " ") + "∴ " + conclusion;
    }
}
