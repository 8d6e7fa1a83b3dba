package dumb.iota;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * One-step outermost-leftmost rewriting. The three computation rules are tried at the root in
 * order; only when none applies does reduction descend, into the left child first and into the
 * right child only if the left one is in normal form.
 */
public enum Reducer {
    ;

    public enum Rule {
        /** {@code i X -> X S K} */
        IOTA,
        /** {@code K X Y -> X} */
        K,
        /** {@code S X Y Z -> X Z (Y Z)} */
        S
    }

    /** A single rewrite: the successor term and the rule applied to the chosen redex. */
    public record Reduction(Term term, Rule rule) {
        public Reduction {
            requireNonNull(term);
            requireNonNull(rule);
        }
    }

    /** The next term, or empty if {@code t} is in normal form. */
    public static Optional<Term> step(Term t) {
        return reduction(t).map(Reduction::term);
    }

    public static Optional<Reduction> reduction(Term t) {
        return Optional.ofNullable(reduce(requireNonNull(t)));
    }

    /** The rule the next step would fire. */
    public static Optional<Rule> redex(Term t) {
        return reduction(t).map(Reduction::rule);
    }

    public static boolean isNormal(Term t) {
        return reduce(requireNonNull(t)) == null;
    }

    @Nullable
    private static Reduction reduce(Term t) {
        if (!(t instanceof Term.App app)) return null;

        var root = rewriteRoot(app);
        if (root != null) return root;

        var left = reduce(app.left());
        if (left != null) return new Reduction(new Term.App(left.term(), app.right()), left.rule());

        var right = reduce(app.right());
        if (right != null) return new Reduction(new Term.App(app.left(), right.term()), right.rule());

        return null;
    }

    @Nullable
    private static Reduction rewriteRoot(Term.App t) {
        if (t.left() instanceof Term.Iota) {
            var x = t.right();
            return new Reduction(Term.app(x, Term.S, Term.K), Rule.IOTA);
        }
        if (t.left() instanceof Term.App l1) {
            if (l1.left() instanceof Term.K) {
                return new Reduction(l1.right(), Rule.K);
            }
            if (l1.left() instanceof Term.App l2 && l2.left() instanceof Term.S) {
                var x = l2.right();
                var y = l1.right();
                var z = t.right();
                return new Reduction(new Term.App(new Term.App(x, z), new Term.App(y, z)), Rule.S);
            }
        }
        return null;
    }
}
