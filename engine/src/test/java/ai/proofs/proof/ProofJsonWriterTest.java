package ai.proofs.proof;

import static ai.proofs.logic.Formula.imp;
import static ai.proofs.unit.helpers.Formulas.P;
import static ai.proofs.unit.helpers.Formulas.Q;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.proofs.logic.Rule;
import ai.proofs.unit.helpers.ProofBuilder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ProofJsonWriterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ProofJsonWriter writer = new ProofJsonWriter();

    @Test
    void writesArgumentAndFlatLines() throws Exception {
        Proof proof = ProofBuilder.proving(imp(Q, P))
                .premise(P)
                .assume(Q)
                .line(P, Rule.REITERATION, "1")
                .close()
                .line(imp(Q, P), Rule.IMP_INTRO, "2-3")
                .build();

        JsonNode root = MAPPER.readTree(writer.write(proof));

        assertEquals("P", root.get("premises").get(0).asText());
        assertEquals("Q → P", root.get("conclusion").asText());
        assertTrue(root.get("complete").asBoolean());

        JsonNode lines = root.get("lines");
        assertEquals(4, lines.size());
        assertEquals(0, lines.get(0).get("depth").asInt());
        assertEquals("PR", lines.get(0).get("rule").asText());
        assertEquals(1, lines.get(1).get("depth").asInt(), "Assumption sits inside one subproof");
        assertEquals("AS", lines.get(1).get("rule").asText());
        assertEquals("1", lines.get(2).get("citations").get(0).asText());

        JsonNode last = lines.get(3);
        assertEquals(4, last.get("line").asInt());
        assertEquals(0, last.get("depth").asInt());
        assertEquals("Q → P", last.get("formula").asText());
        assertEquals("→I", last.get("rule").asText());
        assertEquals("2-3", last.get("citations").get(0).asText());
    }

    @Test
    void incompleteProofIsFlagged() {
        Proof proof = ProofBuilder.proving(Q).premise(P).build();
        assertFalse(writer.toTree(proof).get("complete").asBoolean());
        assertEquals(0, writer.toTree(proof).get("lines").get(0).get("citations").size());
    }
}
