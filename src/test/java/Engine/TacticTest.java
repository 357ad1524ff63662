package Engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import solver.SolverConfig;
import value.Kind;

public class TacticTest {

    @Test
    public void mapRewritesNestedConditions() {
        Tactic<Integer> inner = Tactic.caseSplit(true, List.of(new CaseBranch<>("deep", 3, List.of())));
        Tactic<Integer> t = Tactic.caseSplit(false, List.of(
                new CaseBranch<>("a", 1, List.of(inner, Tactic.stopAfter(5))),
                new CaseBranch<>("b", 2, List.of())));

        Tactic<String> m = t.map(i -> "c" + i);
        assertEquals(Tactic.Tag.CASE_SPLIT, m.getTag());
        assertFalse(m.getFlag());
        assertEquals("c1", m.getCases().get(0).getCondition());
        assertEquals("c2", m.getCases().get(1).getCondition());

        Tactic<String> mi = m.getCases().get(0).getTactics().get(0);
        assertTrue(mi.getFlag());
        assertEquals("deep", mi.getCases().get(0).getName());
        assertEquals("c3", mi.getCases().get(0).getCondition());
        assertEquals(5, m.getCases().get(0).getTactics().get(1).getSeconds());
    }

    @Test
    public void parallelCaseIsFoundAtAnyDepth() {
        assertTrue(Tactic.parallelCase().isParallelCaseAnywhere());
        assertFalse(Tactic.checkCaseVacuity(true).isParallelCaseAnywhere());

        Tactic<Integer> deep = Tactic.caseSplit(false,
                List.of(new CaseBranch<>("b", 2, List.of(Tactic.<Integer>parallelCase()))));
        Tactic<Integer> nested = Tactic.caseSplit(false, List.of(new CaseBranch<>("a", 1, List.of(deep))));
        assertTrue(nested.isParallelCaseAnywhere());

        Tactic<Integer> flat = Tactic.caseSplit(false, List.of(new CaseBranch<>("a", 1, List.of())));
        assertFalse(flat.isParallelCaseAnywhere());
    }

    @Test
    public void stopAfterNeedsPositiveSeconds() {
        assertThrows(ValidationException.class, () -> Tactic.stopAfter(0));
        assertThrows(ValidationException.class, () -> Tactic.stopAfter(-3));
        assertEquals("StopAfter 7", Tactic.stopAfter(7).toString());
    }

    @Test
    public void addedTacticsAreResolved() {
        SimState st = SimState.newState(RunMode.proof(false, SolverConfig.z3()), value.SimpleValueDomain.INSTANCE);
        SymVal b = st.mkSymVar(null, Kind.BOOL, "b");
        st.addTactic(Tactic.caseSplit(false, List.of(
                new CaseBranch<>("yes", b, List.of()),
                new CaseBranch<>("no", SymGen.not(b), List.of()))));
        st.addTactic(Tactic.parallelCase());

        Result r = st.extract();
        assertEquals(2, r.getTactics().size());
        Tactic<SymWord> split = r.getTactics().get(0);
        assertEquals(st.toSW(b), split.getCases().get(0).getCondition());
        assertEquals(st.toSW(SymGen.not(b)), split.getCases().get(1).getCondition());
        assertEquals(Tactic.Tag.PARALLEL_CASE, r.getTactics().get(1).getTag());
    }

    @Test
    public void rendering() {
        assertEquals("CheckUsing \"qfbv\"", Tactic.checkUsing("qfbv").toString());
        assertEquals("ParallelCase", Tactic.parallelCase().toString());
        assertEquals("SetOptions [(set-option :a 1)]",
                Tactic.setOptions(List.of("(set-option :a 1)")).toString());
    }
}
