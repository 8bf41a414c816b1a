package ai.proofs.proof;

import ai.proofs.logic.Rule;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link Proof} as a Fitch-style listing for console display.
 * <p>
 * Each line shows its number, one scope bar per open scope, the formula and the justification.
 * A horizontal rule under the premises and under each assumption marks where the derived part of
 * the scope begins. Justifications are aligned in a single column.
 * <pre>
 *  1 │ P → Q      PR
 *  2 │ P          PR
 *    ├─────
 *  3 │ Q          →E, 1, 2
 * </pre>
 */
public class ProofFormatter {
    /** Minimum gap between the widest formula cell and the justification column. */
    private static final int GAP = 3;

    private final Proof proof;

    public ProofFormatter(Proof proof) {
        this.proof = proof;
    }

    /**
     * Renders the whole proof; an empty proof renders as an empty string.
     */
    public String format() {
        List<Row> rows = new ArrayList<>();
        collect(proof.getEntries(), 1, rows);
        if (rows.isEmpty()) {
            return "";
        }

        int numberWidth = 0;
        int cellWidth = 0;
        for (Row row : rows) {
            numberWidth = Math.max(numberWidth, Integer.toString(row.line.index()).length());
            cellWidth = Math.max(cellWidth, bars(row.depth).length() + row.line.formula().toString().length());
        }

        StringBuilder sb = new StringBuilder();
        for (Row row : rows) {
            String number = Integer.toString(row.line.index());
            String cell = bars(row.depth) + row.line.formula();
            sb.append(" ".repeat(numberWidth - number.length() + 1)).append(number).append(' ');
            sb.append(cell);
            sb.append(" ".repeat(cellWidth - cell.length() + GAP));
            sb.append(row.line.justification()).append('\n');
            if (row.ruleBelow) {
                sb.append(" ".repeat(numberWidth + 2));
                sb.append(bars(row.depth - 1)).append("├─────").append('\n');
            }
        }
        return sb.toString();
    }

    private void collect(List<ProofEntry> entries, int depth, List<Row> rows) {
        int premiseCount = depth == 1 ? proof.getPremises().size() : 0;
        for (int i = 0; i < entries.size(); i++) {
            ProofEntry entry = entries.get(i);
            if (entry instanceof Line line) {
                boolean lastPremise = depth == 1 && premiseCount > 0 && i == premiseCount - 1;
                boolean assumption = depth > 1 && i == 0 && line.rule() == Rule.ASSUMPTION;
                rows.add(new Row(line, depth, lastPremise || assumption));
            } else if (entry instanceof Subproof subproof) {
                collect(subproof.entries(), depth + 1, rows);
            }
        }
    }

    private static String bars(int depth) {
        return "│ ".repeat(Math.max(0, depth));
    }

    private record Row(Line line, int depth, boolean ruleBelow) {
    }
}
