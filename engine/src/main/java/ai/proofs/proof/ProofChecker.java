package ai.proofs.proof;

import ai.proofs.logic.Formula;
import ai.proofs.logic.Formula.Connective;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Verifies a numbered proof line by line.
 *
 * <p>The checker enforces:
 * <ul>
 *   <li>sequential numbering starting at 1</li>
 *   <li>placement: {@code PR} lines open the top-level sequence, one per premise and in order;
 *       {@code AS} appears exactly as the first line of each subproof</li>
 *   <li>Fitch scoping: a line may cite earlier lines of its own scope or of an enclosing scope,
 *       and subproofs that were closed earlier in such a scope</li>
 *   <li>the formula shape each rule demands of its citations and its result</li>
 * </ul>
 *
 * <p>Violations are reported as human-readable messages prefixed with the offending line number.
 */
public final class ProofChecker {

    private final Proof proof;
    private final List<String> problems = new ArrayList<>();
    private int nextIndex = 1;

    private ProofChecker(Proof proof) {
        this.proof = proof;
    }

    /**
     * Checks the proof and returns every violation found; an empty list means the proof is correct.
     */
    public static List<String> check(Proof proof) {
        ProofChecker checker = new ProofChecker(proof);
        checker.walk(proof.getEntries(), new Scope(), 0);
        List<Formula> premises = proof.getPremises();
        for (int i = proof.getEntries().size(); i < premises.size(); i++) {
            checker.problems.add("Missing premise " + (i + 1) + ": " + premises.get(i));
        }
        return List.copyOf(checker.problems);
    }

    private void walk(List<ProofEntry> entries, Scope scope, int depth) {
        for (int position = 0; position < entries.size(); position++) {
            ProofEntry entry = entries.get(position);
            if (entry instanceof Line line) {
                checkNumber(line);
                checkPlacement(line, position, depth);
                checkRule(line, scope);
                scope.lines.put(line.index(), line);
            } else if (entry instanceof Subproof subproof) {
                if (depth == 0 && position < proof.getPremises().size()) {
                    problems.add("Line " + subproof.firstIndex() + ": expected premise "
                            + proof.getPremises().get(position));
                }
                if (!(subproof.first() instanceof Line)) {
                    problems.add("Line " + subproof.firstIndex() + ": a subproof must open with an assumption");
                }
                walk(subproof.entries(), scope.copy(), depth + 1);
                scope.subproofs.put(subproof.toCitation(), subproof);
            }
        }
    }

    private void checkNumber(Line line) {
        if (line.index() != nextIndex) {
            problems.add("Line " + line.index() + ": expected line number " + nextIndex);
        }
        nextIndex = line.index() + 1;
    }

    private void checkPlacement(Line line, int position, int depth) {
        List<Formula> premises = proof.getPremises();
        boolean premiseSlot = depth == 0 && position < premises.size();
        switch (line.rule()) {
            case PREMISE -> {
                if (!premiseSlot) {
                    fail(line, "premises may only open the proof");
                } else if (!premises.get(position).equals(line.formula())) {
                    fail(line, "premise " + (position + 1) + " is " + premises.get(position));
                }
            }
            case ASSUMPTION -> {
                if (depth == 0 || position != 0) {
                    fail(line, "assumptions may only open a subproof");
                }
            }
            default -> {
                if (premiseSlot) {
                    fail(line, "expected premise " + premises.get(position));
                } else if (depth > 0 && position == 0) {
                    fail(line, "a subproof must open with an assumption");
                }
            }
        }
    }

    private void checkRule(Line line, Scope scope) {
        List<Citation> citations = line.justification().citations();
        Formula result = line.formula();
        switch (line.rule()) {
            case PREMISE, ASSUMPTION -> expect(line, citations.isEmpty(), "takes no citations");
            case REITERATION -> {
                Line source = singleLine(line, scope);
                if (source != null) {
                    expect(line, source.formula().equals(result), "must repeat line " + source.index());
                }
            }
            case EXPLOSION -> {
                Line source = singleLine(line, scope);
                if (source != null) {
                    expect(line, source.formula().isFalsum(), "must cite ⊥");
                }
            }
            case NOT_ELIM -> {
                List<Line> sources = lines(line, scope, 2);
                if (sources != null) {
                    Formula a = sources.get(0).formula();
                    Formula b = sources.get(1).formula();
                    expect(line, result.isFalsum() && (negates(a, b) || negates(b, a)),
                            "must derive ⊥ from a formula and its negation");
                }
            }
            case AND_ELIM -> {
                Line source = singleLine(line, scope);
                if (source != null) {
                    Formula f = source.formula();
                    expect(line, f.is(Connective.AND) && (f.left().equals(result) || f.right().equals(result)),
                            "must derive a conjunct of a cited conjunction");
                }
            }
            case OR_ELIM -> checkOrElim(line, scope);
            case IMP_ELIM -> {
                List<Line> sources = lines(line, scope, 2);
                if (sources != null) {
                    Formula a = sources.get(0).formula();
                    Formula b = sources.get(1).formula();
                    expect(line, detaches(a, b, result) || detaches(b, a, result),
                            "must derive the consequent of a cited conditional and its antecedent");
                }
            }
            case IFF_ELIM -> {
                List<Line> sources = lines(line, scope, 2);
                if (sources != null) {
                    Formula a = sources.get(0).formula();
                    Formula b = sources.get(1).formula();
                    expect(line, crosses(a, b, result) || crosses(b, a, result),
                            "must derive one side of a cited biconditional from the other");
                }
            }
            case NOT_INTRO -> {
                Subproof sub = singleSubproof(line, scope);
                if (sub != null) {
                    expect(line, result.is(Connective.NOT)
                                    && result.inner().equals(assumption(sub))
                                    && isFalsum(conclusionOf(sub)),
                            "must negate the assumption of a subproof ending in ⊥");
                }
            }
            case AND_INTRO -> {
                List<Line> sources = lines(line, scope, 2);
                if (sources != null) {
                    Formula a = sources.get(0).formula();
                    Formula b = sources.get(1).formula();
                    expect(line, result.is(Connective.AND)
                                    && ((result.left().equals(a) && result.right().equals(b))
                                    || (result.left().equals(b) && result.right().equals(a))),
                            "must conjoin the two cited lines");
                }
            }
            case OR_INTRO -> {
                Line source = singleLine(line, scope);
                if (source != null) {
                    Formula f = source.formula();
                    expect(line, result.is(Connective.OR)
                                    && (result.left().equals(f) || result.right().equals(f)),
                            "must have the cited line as a disjunct");
                }
            }
            case IMP_INTRO -> {
                Subproof sub = singleSubproof(line, scope);
                if (sub != null) {
                    expect(line, result.is(Connective.IMP)
                                    && result.left().equals(assumption(sub))
                                    && result.right().equals(conclusionOf(sub)),
                            "must join the assumption and conclusion of the cited subproof");
                }
            }
            case IFF_INTRO -> {
                List<Subproof> subs = subproofs(line, scope, 2);
                if (subs != null) {
                    expect(line, result.is(Connective.IFF)
                                    && (spans(subs.get(0), result.left(), result.right())
                                    && spans(subs.get(1), result.right(), result.left())
                                    || spans(subs.get(1), result.left(), result.right())
                                    && spans(subs.get(0), result.right(), result.left())),
                            "must cite one subproof in each direction");
                }
            }
            case INDIRECT_PROOF -> {
                Subproof sub = singleSubproof(line, scope);
                if (sub != null) {
                    Formula assumed = assumption(sub);
                    expect(line, assumed != null
                                    && assumed.is(Connective.NOT)
                                    && assumed.inner().equals(result)
                                    && isFalsum(conclusionOf(sub)),
                            "must cite a subproof assuming the negated result and ending in ⊥");
                }
            }
        }
    }

    private void checkOrElim(Line line, Scope scope) {
        List<Citation> citations = line.justification().citations();
        if (citations.size() != 3) {
            fail(line, "takes a disjunction and two subproofs");
            return;
        }
        Line disjunction = resolveLine(line, scope, citations.get(0));
        Subproof first = resolveSubproof(line, scope, citations.get(1));
        Subproof second = resolveSubproof(line, scope, citations.get(2));
        if (disjunction == null || first == null || second == null) {
            return;
        }
        Formula f = disjunction.formula();
        Formula result = line.formula();
        expect(line, f.is(Connective.OR)
                        && (spans(first, f.left(), result) && spans(second, f.right(), result)
                        || spans(first, f.right(), result) && spans(second, f.left(), result)),
                "must cite a disjunction and one subproof per disjunct reaching the result");
    }

    private static boolean negates(Formula negation, Formula other) {
        return negation.is(Connective.NOT) && negation.inner().equals(other);
    }

    private static boolean detaches(Formula conditional, Formula antecedent, Formula result) {
        return conditional.is(Connective.IMP)
                && conditional.left().equals(antecedent)
                && conditional.right().equals(result);
    }

    private static boolean crosses(Formula biconditional, Formula side, Formula result) {
        if (!biconditional.is(Connective.IFF)) {
            return false;
        }
        return biconditional.left().equals(side) && biconditional.right().equals(result)
                || biconditional.right().equals(side) && biconditional.left().equals(result);
    }

    private static boolean spans(Subproof sub, Formula assumed, Formula reached) {
        return assumed.equals(assumption(sub)) && reached.equals(conclusionOf(sub));
    }

    private static Formula assumption(Subproof sub) {
        return sub.first() instanceof Line line ? line.formula() : null;
    }

    private static boolean isFalsum(Formula formula) {
        return formula != null && formula.isFalsum();
    }

    private static Formula conclusionOf(Subproof sub) {
        return sub.last() instanceof Line line ? line.formula() : null;
    }

    private Line singleLine(Line line, Scope scope) {
        List<Line> sources = lines(line, scope, 1);
        return sources == null ? null : sources.get(0);
    }

    private Subproof singleSubproof(Line line, Scope scope) {
        List<Subproof> subs = subproofs(line, scope, 1);
        if (subs == null) {
            return null;
        }
        Subproof sub = subs.get(0);
        if (!(sub.last() instanceof Line)) {
            fail(line, "cited subproof must end with a line");
            return null;
        }
        return sub;
    }

    private List<Line> lines(Line line, Scope scope, int count) {
        List<Citation> citations = line.justification().citations();
        if (citations.size() != count) {
            fail(line, "expects " + count + " line citation(s)");
            return null;
        }
        List<Line> out = new ArrayList<>();
        for (Citation citation : citations) {
            Line source = resolveLine(line, scope, citation);
            if (source == null) {
                return null;
            }
            out.add(source);
        }
        return out;
    }

    private List<Subproof> subproofs(Line line, Scope scope, int count) {
        List<Citation> citations = line.justification().citations();
        if (citations.size() != count) {
            fail(line, "expects " + count + " subproof citation(s)");
            return null;
        }
        List<Subproof> out = new ArrayList<>();
        for (Citation citation : citations) {
            Subproof source = resolveSubproof(line, scope, citation);
            if (source == null) {
                return null;
            }
            out.add(source);
        }
        return out;
    }

    private Line resolveLine(Line line, Scope scope, Citation citation) {
        Line source = citation.isRange() ? null : scope.lines.get(citation.first());
        if (source == null) {
            fail(line, "line " + citation + " is not accessible");
        }
        return source;
    }

    private Subproof resolveSubproof(Line line, Scope scope, Citation citation) {
        Subproof source = scope.subproofs.get(citation);
        if (source == null) {
            fail(line, "subproof " + citation + " is not accessible");
        }
        return source;
    }

    private void expect(Line line, boolean condition, String message) {
        if (!condition) {
            fail(line, line.rule().getSymbol() + " " + message);
        }
    }

    private void fail(Line line, String message) {
        problems.add("Line " + line.index() + ": " + message);
    }

    /**
     * Lines and closed subproofs visible at the current point.
     */
    private static final class Scope {
        private final Map<Integer, Line> lines = new HashMap<>();
        private final Map<Citation, Subproof> subproofs = new HashMap<>();

        Scope copy() {
            Scope scope = new Scope();
            scope.lines.putAll(lines);
            scope.subproofs.putAll(subproofs);
            return scope;
        }
    }
}
