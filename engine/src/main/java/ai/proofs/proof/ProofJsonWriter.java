package ai.proofs.proof;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Serialises a {@link Proof} to JSON for front ends.
 *
 * <p>Shape:
 * <pre>{@code
 * {
 *   "premises": ["P → Q", "P"],
 *   "conclusion": "Q",
 *   "complete": true,
 *   "lines": [
 *     {"line": 1, "depth": 0, "formula": "P → Q", "rule": "PR", "citations": []},
 *     {"line": 3, "depth": 0, "formula": "Q", "rule": "→E", "citations": ["1", "2"]}
 *   ]
 * }
 * }</pre>
 * Subproof citations are rendered as ranges such as {@code "2-4"}; {@code depth} counts the open
 * subproofs around a line.
 */
public class ProofJsonWriter {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    /**
     * Builds the JSON tree for a proof.
     */
    public ObjectNode toTree(Proof proof) {
        ObjectNode root = OBJECT_MAPPER.createObjectNode();
        ArrayNode premises = root.putArray("premises");
        proof.getPremises().forEach(p -> premises.add(p.toString()));
        root.put("conclusion", proof.getConclusion().toString());
        root.put("complete", proof.isComplete());
        appendLines(proof.getEntries(), 0, root.putArray("lines"));
        return root;
    }

    /**
     * Serialises a proof to a compact JSON string.
     *
     * @throws IllegalStateException if Jackson fails to write the tree
     */
    public String write(Proof proof) {
        try {
            return OBJECT_MAPPER.writeValueAsString(toTree(proof));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise proof", e);
        }
    }

    private void appendLines(List<ProofEntry> entries, int depth, ArrayNode out) {
        for (ProofEntry entry : entries) {
            if (entry instanceof Line line) {
                ObjectNode node = out.addObject();
                node.put("line", line.index());
                node.put("depth", depth);
                node.put("formula", line.formula().toString());
                node.put("rule", line.rule().getSymbol());
                ArrayNode citations = node.putArray("citations");
                line.justification().citations().forEach(c -> citations.add(c.toString()));
            } else if (entry instanceof Subproof subproof) {
                appendLines(subproof.entries(), depth + 1, out);
            }
        }
    }
}
