package dumb.iota;

import dumb.iota.Reducer.Rule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static dumb.iota.Term.IOTA;
import static dumb.iota.Term.K;
import static dumb.iota.Term.S;
import static org.junit.jupiter.api.Assertions.*;

class StepsTest extends AbstractTest {

    @Test
    void identityTrace() {
        var expected = List.of(
                ii(),
                app(app(IOTA, S), K),
                Term.app(S, S, K, K),
                app(app(S, K), app(K, K)));
        assertEquals(expected, Steps.stream(parse(I_SRC)).toList());
    }

    @Test
    void identityTraceRendered() {
        var lines = Steps.stream(parse(I_SRC)).map(Renderer::unparse).toList();
        assertEquals(List.of("* i i ", "* * i S K ", "* * * S S K K ", "* * S K * K K "), lines);
    }

    @Test
    void lastTermIsNormal() {
        var terms = Steps.stream(parse(I_SRC)).toList();
        assertTrue(terms.size() >= 2);
        var last = terms.get(terms.size() - 1);
        assertTrue(Reducer.isNormal(last));
        for (var t : terms.subList(0, terms.size() - 1)) assertFalse(Reducer.isNormal(t));
    }

    @Test
    void stepsRecordRules() {
        var steps = new Steps(parse(I_SRC));
        var first = steps.next();
        assertEquals(0, first.index());
        assertNull(first.rule());
        assertEquals(Rule.IOTA, steps.next().rule());
        assertEquals(Rule.IOTA, steps.next().rule());
        var last = steps.next();
        assertEquals(3, last.index());
        assertEquals(Rule.S, last.rule());
        assertFalse(steps.hasNext());
        assertThrows(NoSuchElementException.class, steps::next);
    }

    @Test
    void normalTermYieldsOnlyItself() {
        var it = Steps.of(IOTA);
        assertTrue(it.hasNext());
        assertEquals(IOTA, it.next());
        assertFalse(it.hasNext());
    }

    @Test
    void kProgramNormalizesToK() {
        var trace = Steps.normalize(parse(K_SRC), 100);
        assertTrue(trace.normalForm());
        assertEquals(K, trace.last());
        assertEquals(10, trace.steps().size());
    }

    @Test
    void sProgramNormalizesToS() {
        var trace = Steps.normalize(parse(S_SRC), 100);
        assertTrue(trace.normalForm());
        assertEquals(S, trace.last());
        assertEquals(12, trace.steps().size());
    }

    @Test
    void identityAppliedToIota() {
        var trace = Steps.normalize(parse("**iii"), 100);
        assertEquals(IOTA, trace.last());
        assertEquals(6, trace.terms().size());
    }

    @Test
    void divergentTermIsConsumedLazily() {
        var omega = parse(OMEGA_SRC);
        var prefix = Steps.limit(omega, 500);
        assertEquals(500, prefix.size());
        assertTrue(prefix.stream().noneMatch(Reducer::isNormal));
    }

    @Test
    void stepLimitTruncates() {
        var trace = Steps.normalize(parse(OMEGA_SRC), 50);
        assertFalse(trace.normalForm());
        assertEquals(51, trace.steps().size());
    }

    @Test
    void exactLimitStillReportsNormalForm() {
        var trace = Steps.normalize(parse(I_SRC), 3);
        assertTrue(trace.normalForm());
        assertEquals(4, trace.steps().size());

        var cut = Steps.normalize(parse(I_SRC), 2);
        assertFalse(cut.normalForm());
        assertEquals(3, cut.steps().size());
    }

    @Test
    void zeroLimitKeepsInitialTerm() {
        var trace = Steps.normalize(ii(), 0);
        assertEquals(List.of(ii()), trace.terms());
        assertFalse(trace.normalForm());
    }

    @Test
    void rejectsNegativeLimits() {
        assertThrows(IllegalArgumentException.class, () -> Steps.limit(IOTA, -1));
        assertThrows(IllegalArgumentException.class, () -> Steps.normalize(IOTA, -1));
    }

    @Test
    void largestLimitStopsAtNormalForm() {
        var trace = Steps.normalize(parse(I_SRC), Integer.MAX_VALUE);
        assertTrue(trace.normalForm());
        assertEquals(4, trace.steps().size());
    }
}
