package ai.proofs.logic;

import java.util.Optional;

/**
 * Registry of the natural-deduction rules a justification can name.
 *
 * <p>Declaration order is the registry order shown to users: the two line sources first, then
 * reiteration and explosion, then eliminations and introductions per connective, then indirect
 * proof.
 */
public enum Rule {
    PREMISE("PR"),
    ASSUMPTION("AS"),
    REITERATION("R"),
    EXPLOSION("X"),
    NOT_ELIM("¬E"),
    AND_ELIM("∧E"),
    OR_ELIM("∨E"),
    IMP_ELIM("→E"),
    IFF_ELIM("↔E"),
    NOT_INTRO("¬I"),
    AND_INTRO("∧I"),
    OR_INTRO("∨I"),
    IMP_INTRO("→I"),
    IFF_INTRO("↔I"),
    INDIRECT_PROOF("IP");

    private final String symbol;

    Rule(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Premise and assumption lines are the only lines that need no citation.
     */
    public boolean isPremiseOrAssumption() {
        return this == PREMISE || this == ASSUMPTION;
    }

    /**
     * Looks a rule up by its display symbol (e.g. {@code "→E"}), ignoring surrounding whitespace.
     */
    public static Optional<Rule> bySymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        String trimmed = symbol.trim();
        for (Rule rule : values()) {
            if (rule.symbol.equals(trimmed)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return symbol;
    }
}
