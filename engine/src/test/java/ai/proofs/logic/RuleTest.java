package ai.proofs.logic;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Rule")
class RuleTest {

    @Test
    void registryOrderIsStable() {
        List<String> symbols = Arrays.stream(Rule.values()).map(Rule::getSymbol).toList();
        assertEquals(List.of("PR", "AS", "R", "X", "¬E", "∧E", "∨E", "→E", "↔E",
                "¬I", "∧I", "∨I", "→I", "↔I", "IP"), symbols);
    }

    @Test
    void bySymbolFindsEveryRule() {
        for (Rule rule : Rule.values()) {
            assertEquals(Optional.of(rule), Rule.bySymbol(rule.getSymbol()), "Lookup of " + rule.name());
        }
    }

    @Test
    void bySymbolTrimsAndRejectsUnknown() {
        assertEquals(Optional.of(Rule.IMP_ELIM), Rule.bySymbol("  →E "));
        assertEquals(Optional.empty(), Rule.bySymbol("MP"));
        assertEquals(Optional.empty(), Rule.bySymbol(null));
    }

    @Test
    void onlyPremisesAndAssumptionsNeedNoCitation() {
        assertTrue(Rule.PREMISE.isPremiseOrAssumption());
        assertTrue(Rule.ASSUMPTION.isPremiseOrAssumption());
        assertFalse(Rule.REITERATION.isPremiseOrAssumption());
        assertFalse(Rule.INDIRECT_PROOF.isPremiseOrAssumption());
    }

    @Test
    void toStringIsTheSymbol() {
        assertEquals("↔I", Rule.IFF_INTRO.toString());
    }
}
