package ai.proofs.logic;

import static ai.proofs.logic.Formula.and;
import static ai.proofs.logic.Formula.atom;
import static ai.proofs.logic.Formula.falsum;
import static ai.proofs.logic.Formula.iff;
import static ai.proofs.logic.Formula.imp;
import static ai.proofs.logic.Formula.not;
import static ai.proofs.logic.Formula.or;
import static ai.proofs.unit.helpers.Formulas.P;
import static ai.proofs.unit.helpers.Formulas.Q;
import static ai.proofs.unit.helpers.Formulas.R;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.proofs.logic.Formula.Connective;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Formula")
class FormulaTest {

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        void blankAtomNameIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> atom("  "));
        }

        @Test
        void nullOperandsAreRejected() {
            assertThrows(NullPointerException.class, () -> atom(null));
            assertThrows(NullPointerException.class, () -> not(null));
            assertThrows(NullPointerException.class, () -> and(P, null));
            assertThrows(NullPointerException.class, () -> iff(null, Q));
        }

        @Test
        void falsumIsASingleton() {
            assertSame(falsum(), falsum());
            assertTrue(falsum().isFalsum());
            assertEquals(Connective.FALSUM, falsum().connective());
        }

        @Test
        void accessorsExposeOperands() {
            Formula f = imp(and(P, Q), not(R));
            assertEquals(Connective.IMP, f.connective());
            assertEquals(and(P, Q), f.left());
            assertEquals(not(R), f.right());
            assertEquals(R, f.right().inner());
            assertEquals("P", f.left().left().name());
        }

        @Test
        void wrongAccessorThrows() {
            assertThrows(IllegalStateException.class, () -> P.left());
            assertThrows(IllegalStateException.class, () -> P.inner());
            assertThrows(IllegalStateException.class, () -> not(P).right());
            assertThrows(IllegalStateException.class, () -> and(P, Q).name());
        }

        @Test
        void onlyBinaryConnectivesAreBinary() {
            assertTrue(Connective.AND.isBinary());
            assertTrue(Connective.IFF.isBinary());
            assertFalse(Connective.NOT.isBinary());
            assertFalse(Connective.ATOM.isBinary());
            assertFalse(Connective.FALSUM.isBinary());
        }
    }

    @Nested
    @DisplayName("Value semantics")
    class EqualityTests {

        @Test
        void structurallyEqualFormulasAreEqual() {
            Formula a = or(imp(P, Q), not(not(R)));
            Formula b = or(imp(atom("P"), atom("Q")), not(not(atom("R"))));
            assertEquals(a, b);
            assertEquals(a.hashCode(), b.hashCode());
        }

        @Test
        void connectiveAndOperandOrderMatter() {
            assertNotEquals(and(P, Q), or(P, Q));
            assertNotEquals(and(P, Q), and(Q, P));
            assertNotEquals(imp(P, Q), imp(Q, P));
            assertNotEquals(P, not(P));
        }

        @Test
        void formulasWorkAsSetMembers() {
            Set<Formula> set = new HashSet<>(List.of(and(P, Q), and(P, Q), falsum(), falsum()));
            assertEquals(2, set.size());
            assertTrue(set.contains(and(atom("P"), atom("Q"))));
        }
    }

    @Nested
    @DisplayName("Rendering")
    class RenderingTests {

        @Test
        void atomsAndFalsum() {
            assertEquals("P", P.toString());
            assertEquals("⊥", falsum().toString());
        }

        @Test
        void outermostParenthesesAreOmitted() {
            assertEquals("P ∧ Q", and(P, Q).toString());
            assertEquals("(P ∧ Q) → ¬R", imp(and(P, Q), not(R)).toString());
            assertEquals("P ↔ (Q ∨ R)", iff(P, or(Q, R)).toString());
        }

        @Test
        void negationBindsTightly() {
            assertEquals("¬¬P", not(not(P)).toString());
            assertEquals("¬(P → Q)", not(imp(P, Q)).toString());
        }
    }

    @Test
    void atomsAreCollectedSorted() {
        Formula f = imp(and(R, P), or(Q, not(P)));
        assertEquals(List.of("P", "Q", "R"), List.copyOf(f.atoms()));
        assertTrue(falsum().atoms().isEmpty());
    }
}
