package ai.proofs.prover;

import ai.proofs.logic.Formula;
import ai.proofs.logic.Rule;
import ai.proofs.logic.TruthTable;
import ai.proofs.proof.Proof;
import ai.proofs.proof.ProofEntry;
import ai.proofs.prover.search.Derivation;
import ai.proofs.prover.search.PostProcessor;
import ai.proofs.prover.search.ProofSearch;
import ai.proofs.prover.search.ProofStore;
import ai.proofs.prover.search.SearchMemo;
import ai.proofs.prover.search.SearchStats;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Automated natural-deduction prover for classical propositional logic.
 *
 * <p>Given premises and a conclusion it either returns a complete proof or explains why there is
 * none:
 * <ol>
 *     <li>The truth-table oracle checks validity up front; invalid arguments are rejected without
 *     searching.</li>
 *     <li>A working derivation is seeded with one premise line per premise.</li>
 *     <li>{@link ProofSearch} extends it until the conclusion is reached.</li>
 *     <li>{@link PostProcessor} prunes unused lines and numbers the result, premises first.</li>
 * </ol>
 *
 * <p>Each call owns its arena, memo and statistics, so one instance may serve concurrent callers.
 * There is no time limit; callers that need one must impose it from outside.
 */
@Component
public class NaturalDeductionProver {

    private static final Logger log = LoggerFactory.getLogger(NaturalDeductionProver.class);

    /**
     * Returns true iff the conclusion follows from the premises.
     */
    public boolean isValid(List<Formula> premises, Formula conclusion) {
        return TruthTable.isValid(premises, conclusion);
    }

    /**
     * Finds a proof of the conclusion from the premises.
     *
     * @throws InvalidArgumentException if the argument is not valid
     * @throws ProofNotFoundException if the argument is valid but the search failed
     */
    public Proof prove(List<Formula> premises, Formula conclusion) throws ProverException {
        return search(premises, conclusion).proof();
    }

    /**
     * Same as {@link #prove(List, Formula)} but also reports search statistics.
     */
    public ProofSearchResult search(List<Formula> premises, Formula conclusion) throws ProverException {
        Objects.requireNonNull(premises, "premises");
        Objects.requireNonNull(conclusion, "conclusion");
        premises.forEach(p -> Objects.requireNonNull(p, "premise"));

        if (!TruthTable.isValid(premises, conclusion)) {
            if (log.isDebugEnabled()) {
                log.debug("Rejecting invalid argument {}", ProverException.describe(premises, conclusion));
            }
            throw new InvalidArgumentException(premises, conclusion);
        }

        ProofStore store = new ProofStore();
        List<Integer> sequence = new ArrayList<>();
        for (Formula premise : premises) {
            sequence.add(store.addLine(premise, Rule.PREMISE));
        }
        Derivation root = new Derivation(store, sequence, conclusion);
        SearchStats stats = new SearchStats();

        long startNanos = System.nanoTime();
        boolean found = new ProofSearch(root, new SearchMemo(), stats).prove();
        long durationNanos = System.nanoTime() - startNanos;

        if (!found) {
            log.warn("Search exhausted without a proof of valid argument {} ({})",
                    ProverException.describe(premises, conclusion), stats);
            throw new ProofNotFoundException(premises, conclusion);
        }

        List<ProofEntry> entries = PostProcessor.process(root);
        Proof proof = new Proof(premises, conclusion, entries);
        if (log.isDebugEnabled()) {
            log.debug("Proved {} in {} lines, {} objects stored, {} ({} ms)",
                    ProverException.describe(premises, conclusion),
                    proof.lineCount(),
                    store.size(),
                    stats,
                    durationNanos / 1_000_000);
        }
        return new ProofSearchResult(proof, stats, durationNanos);
    }
}
