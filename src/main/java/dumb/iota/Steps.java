package dumb.iota;

import dumb.iota.Reducer.Rule;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static java.util.Objects.requireNonNull;

/**
 * Lazy reduction sequence: the initial term, then each successor produced by {@link Reducer},
 * ending only at a normal form. A successor is computed when it is asked for, and only the most
 * recent term is retained. Single use.
 */
public final class Steps implements Iterator<Steps.Step> {

    @Nullable
    private Step last;
    @Nullable
    private Step pending;
    private boolean done;

    public Steps(Term start) {
        this.pending = new Step(0, requireNonNull(start), null);
    }

    public static Iterator<Term> of(Term start) {
        var steps = new Steps(start);
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return steps.hasNext();
            }

            @Override
            public Term next() {
                return steps.next().term();
            }
        };
    }

    public static Stream<Term> stream(Term start) {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(of(start), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /** At most the first {@code n} terms. */
    public static List<Term> limit(Term start, int n) {
        if (n < 0) throw new IllegalArgumentException("Negative limit: " + n);
        return stream(start).limit(n).toList();
    }

    /**
     * Reduces for at most {@code maxSteps} rewrites. The result records whether the last term
     * kept is a normal form or the limit cut the sequence short.
     */
    public static Trace normalize(Term start, int maxSteps) {
        if (maxSteps < 0) throw new IllegalArgumentException("Negative step limit: " + maxSteps);
        var steps = new Steps(start);
        var kept = new ArrayList<Step>();
        kept.add(steps.next());
        while (kept.size() - 1 < maxSteps && steps.hasNext()) kept.add(steps.next());
        return new Trace(kept, !steps.hasNext());
    }

    @Override
    public boolean hasNext() {
        if (pending != null) return true;
        if (done || last == null) return false;
        var r = Reducer.reduction(last.term());
        if (r.isEmpty()) {
            done = true;
            return false;
        }
        pending = new Step(last.index() + 1, r.get().term(), r.get().rule());
        return true;
    }

    @Override
    public Step next() {
        if (!hasNext()) throw new NoSuchElementException("Term is in normal form");
        last = pending;
        pending = null;
        return last;
    }

    /**
     * One element of a reduction sequence. {@code rule} is the rule that produced {@code term}
     * from its predecessor, and is null for the initial term.
     */
    public record Step(int index, Term term, @Nullable Rule rule) {
        public Step {
            requireNonNull(term);
        }
    }

    public record Trace(List<Step> steps, boolean normalForm) {
        public Trace {
            steps = List.copyOf(steps);
            if (steps.isEmpty()) throw new IllegalArgumentException("A trace holds at least its initial term");
        }

        public Term last() {
            return steps.get(steps.size() - 1).term();
        }

        public List<Term> terms() {
            return steps.stream().map(Step::term).toList();
        }
    }
}
