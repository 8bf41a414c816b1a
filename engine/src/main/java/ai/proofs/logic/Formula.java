package ai.proofs.logic;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Immutable propositional formula.
 *
 * <p>A formula is one of seven variants, identified by its {@link Connective}:
 * <ul>
 *   <li>{@link Connective#ATOM}: a named proposition such as {@code P}</li>
 *   <li>{@link Connective#FALSUM}: the absurdity constant {@code ⊥}</li>
 *   <li>{@link Connective#NOT}: a negation holding one inner formula</li>
 *   <li>{@link Connective#AND}, {@link Connective#OR}, {@link Connective#IMP},
 *       {@link Connective#IFF}: binary connectives holding an ordered left/right pair</li>
 * </ul>
 *
 * <p>Equality is structural: two formulas are equal iff they have the same connective, the same
 * atom name and equal children. The hash code is computed once at construction.
 *
 * <p>Instances are built bottom-up through the static factories and may be shared freely.
 */
public final class Formula {

    private static final Formula FALSUM = new Formula(Connective.FALSUM, null, null, null);

    /**
     * The main connective of a formula. Switching over this enum is the only way the engine
     * dispatches on formula shape.
     */
    public enum Connective {
        ATOM(""),
        FALSUM("⊥"),
        NOT("¬"),
        AND("∧"),
        OR("∨"),
        IMP("→"),
        IFF("↔");

        private final String symbol;

        Connective(String symbol) {
            this.symbol = symbol;
        }

        /**
         * Returns the display symbol, empty for atoms.
         */
        public String getSymbol() {
            return symbol;
        }

        /**
         * Returns true for the four two-place connectives.
         */
        public boolean isBinary() {
            return this == AND || this == OR || this == IMP || this == IFF;
        }
    }

    private final Connective connective;
    /** Atom name; null for every other variant. */
    private final String name;
    /** Left operand of a binary connective, or the operand of a negation. */
    private final Formula left;
    /** Right operand of a binary connective; null otherwise. */
    private final Formula right;
    private final int hash;

    private Formula(Connective connective, String name, Formula left, Formula right) {
        this.connective = connective;
        this.name = name;
        this.left = left;
        this.right = right;
        this.hash = Objects.hash(connective, name, left, right);
    }

    /**
     * Creates an atomic proposition.
     *
     * @param name the proposition name, e.g. {@code "P"}
     * @throws IllegalArgumentException if the name is blank
     */
    public static Formula atom(String name) {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Atom name must not be blank");
        }
        return new Formula(Connective.ATOM, name, null, null);
    }

    /**
     * Returns the absurdity constant.
     */
    public static Formula falsum() {
        return FALSUM;
    }

    public static Formula not(Formula inner) {
        return new Formula(Connective.NOT, null, Objects.requireNonNull(inner, "inner"), null);
    }

    public static Formula and(Formula left, Formula right) {
        return binary(Connective.AND, left, right);
    }

    public static Formula or(Formula left, Formula right) {
        return binary(Connective.OR, left, right);
    }

    public static Formula imp(Formula left, Formula right) {
        return binary(Connective.IMP, left, right);
    }

    public static Formula iff(Formula left, Formula right) {
        return binary(Connective.IFF, left, right);
    }

    private static Formula binary(Connective connective, Formula left, Formula right) {
        return new Formula(connective,
                null,
                Objects.requireNonNull(left, "left"),
                Objects.requireNonNull(right, "right"));
    }

    public Connective connective() {
        return connective;
    }

    public boolean is(Connective other) {
        return connective == other;
    }

    public boolean isFalsum() {
        return connective == Connective.FALSUM;
    }

    /**
     * Returns the atom name.
     *
     * @throws IllegalStateException if this formula is not an atom
     */
    public String name() {
        if (connective != Connective.ATOM) {
            throw new IllegalStateException("Not an atom: " + this);
        }
        return name;
    }

    /**
     * Returns the operand of a negation.
     *
     * @throws IllegalStateException if this formula is not a negation
     */
    public Formula inner() {
        if (connective != Connective.NOT) {
            throw new IllegalStateException("Not a negation: " + this);
        }
        return left;
    }

    /**
     * Returns the left operand of a binary connective.
     *
     * @throws IllegalStateException if this formula is not binary
     */
    public Formula left() {
        requireBinary();
        return left;
    }

    /**
     * Returns the right operand of a binary connective.
     *
     * @throws IllegalStateException if this formula is not binary
     */
    public Formula right() {
        requireBinary();
        return right;
    }

    private void requireBinary() {
        if (!connective.isBinary()) {
            throw new IllegalStateException("Not a binary formula: " + this);
        }
    }

    /**
     * Returns the names of all atoms occurring in this formula, sorted.
     */
    public SortedSet<String> atoms() {
        SortedSet<String> out = new TreeSet<>();
        collectAtoms(out);
        return Collections.unmodifiableSortedSet(out);
    }

    void collectAtoms(SortedSet<String> out) {
        switch (connective) {
            case ATOM -> out.add(name);
            case FALSUM -> {
            }
            case NOT -> left.collectAtoms(out);
            case AND, OR, IMP, IFF -> {
                left.collectAtoms(out);
                right.collectAtoms(out);
            }
        }
    }

    /**
     * Renders the formula with outermost parentheses omitted, e.g. {@code (P ∧ Q) → ¬R}.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        render(sb, true);
        return sb.toString();
    }

    private void render(StringBuilder sb, boolean top) {
        switch (connective) {
            case ATOM -> sb.append(name);
            case FALSUM -> sb.append(connective.getSymbol());
            case NOT -> {
                sb.append(connective.getSymbol());
                left.render(sb, false);
            }
            case AND, OR, IMP, IFF -> {
                if (!top) {
                    sb.append('(');
                }
                left.render(sb, false);
                sb.append(' ').append(connective.getSymbol()).append(' ');
                right.render(sb, false);
                if (!top) {
                    sb.append(')');
                }
            }
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Formula other)) {
            return false;
        }
        return hash == other.hash
                && connective == other.connective
                && Objects.equals(name, other.name)
                && Objects.equals(left, other.left)
                && Objects.equals(right, other.right);
    }

    @Override
    public int hashCode() {
        return hash;
    }
}
