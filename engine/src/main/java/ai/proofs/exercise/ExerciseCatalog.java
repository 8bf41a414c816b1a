package ai.proofs.exercise;

import static ai.proofs.logic.Formula.and;
import static ai.proofs.logic.Formula.atom;
import static ai.proofs.logic.Formula.falsum;
import static ai.proofs.logic.Formula.iff;
import static ai.proofs.logic.Formula.imp;
import static ai.proofs.logic.Formula.not;
import static ai.proofs.logic.Formula.or;

import ai.proofs.logic.Formula;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Built-in textbook arguments, all valid in classical propositional logic.
 *
 * <p>Names are lower-case and hyphenated so they can be listed in {@code prover.exercises}.
 */
public final class ExerciseCatalog {

    private static final Formula P = atom("P");
    private static final Formula Q = atom("Q");
    private static final Formula R = atom("R");

    private static final List<Exercise> EXERCISES = List.of(
            new Exercise("modus-ponens", List.of(imp(P, Q), P), Q),
            new Exercise("modus-tollens", List.of(imp(P, Q), not(Q)), not(P)),
            new Exercise("disjunctive-syllogism", List.of(or(P, Q), not(P)), Q),
            new Exercise("hypothetical-syllogism", List.of(imp(P, Q), imp(Q, R)), imp(P, R)),
            new Exercise("double-negation-elimination", List.of(not(not(P))), P),
            new Exercise("double-negation-introduction", List.of(P), not(not(P))),
            new Exercise("excluded-middle", List.of(), or(P, not(P))),
            new Exercise("explosion", List.of(P, not(P)), Q),
            new Exercise("falsum-elimination", List.of(falsum()), P),
            new Exercise("contraposition", List.of(imp(P, Q)), imp(not(Q), not(P))),
            new Exercise("and-commutativity", List.of(and(P, Q)), and(Q, P)),
            new Exercise("or-commutativity", List.of(or(P, Q)), or(Q, P)),
            new Exercise("iff-elimination", List.of(iff(P, Q), P), Q),
            new Exercise("iff-introduction", List.of(imp(P, Q), imp(Q, P)), iff(P, Q)),
            new Exercise("de-morgan", List.of(not(or(P, Q))), and(not(P), not(Q))),
            new Exercise("exportation", List.of(imp(and(P, Q), R)), imp(P, imp(Q, R))),
            new Exercise("distribution", List.of(and(P, or(Q, R))), or(and(P, Q), and(P, R))),
            new Exercise("identity", List.of(), imp(P, P)));

    private ExerciseCatalog() {
    }

    public static List<Exercise> all() {
        return EXERCISES;
    }

    public static Optional<Exercise> byName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String wanted = name.trim();
        return EXERCISES.stream().filter(e -> e.name().equalsIgnoreCase(wanted)).findFirst();
    }

    /**
     * Resolves a selection of names; an empty selection means every exercise.
     *
     * @throws IllegalArgumentException if a name is not in the catalogue
     */
    public static List<Exercise> select(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return EXERCISES;
        }
        List<Exercise> selected = new ArrayList<>();
        for (String name : names) {
            selected.add(byName(name).orElseThrow(
                    () -> new IllegalArgumentException("Unknown exercise: " + name)));
        }
        return selected;
    }
}
