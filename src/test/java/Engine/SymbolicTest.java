package Engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import solver.SolverConfig;
import value.Kind;
import value.SimpleValue;

public class SymbolicTest {

    private static final Kind W8 = Kind.word(8);

    @Test
    public void sumOfTwoInputs() {
        Result r = Symbolic.runSymbolic(RunMode.proof(false, SolverConfig.z3()), st -> {
            SymVal x = st.mkSymVar(null, W8, "x");
            SymVal y = st.mkSymVar(null, W8, "y");
            st.output(SymGen.plus(x, y));
            return null;
        });
        assertEquals(2, r.getInputs().size());
        assertEquals(3, r.getInputs().get(0).getWord().getId());
        assertEquals(4, r.getInputs().get(1).getWord().getId());
        assertEquals(Quantifier.ALL, r.getInputs().get(0).getQuantifier());

        assertEquals(1, r.getProgram().size());
        SymProgram.Assignment a = r.getProgram().getAssignments().get(0);
        assertEquals(5, a.getWord().getId());
        assertEquals(SymOp.Tag.PLUS, a.getExpr().getOp().getTag());
        assertEquals(List.of(new SymWord(W8, 5)), r.getOutputs());

        // only the two reserved booleans
        assertEquals(2, r.getConsts().size());
        assertTrue(r.getKinds().contains(W8));
        assertTrue(r.getKinds().contains(Kind.BOOL));
    }

    @Test
    public void renderingFollowsSectionOrder() {
        Result r = Symbolic.runSymbolic(RunMode.proof(true, SolverConfig.z3()), st -> {
            SymVal x = st.mkSymVar(null, W8, "x");
            SymVal one = SymVal.constant(SimpleValue.ofInteger(W8, 1));
            st.imposeConstraint("pos", SymGen.lessThan(one, x));
            st.output(SymGen.plus(x, one));
            return null;
        });
        String s = r.toString();
        String[] sections = {"INPUTS", "CONSTANTS", "TABLES", "ARRAYS", "UNINTERPRETED CONSTANTS",
            "USER GIVEN CODE SEGMENTS", "AXIOMS", "TACTICS", "GOALS", "DEFINE", "CONSTRAINTS",
            "ASSERTIONS", "OUTPUTS"};
        int last = -1;
        for (String sec : sections) {
            int at = s.indexOf("\n" + sec + "\n");
            if (sec.equals("INPUTS")) {
                at = s.indexOf(sec + "\n");
            }
            assertTrue(sec + " missing or out of order", at > last);
            last = at;
        }
        assertFalse(s.contains("SORTS"));
        assertTrue(s.contains("s3 :: " + W8 + ", existential, aliasing \"x\""));
        assertTrue(s.contains("  s1 = False"));
    }

    @Test
    public void loneConstantOutputPrintsAsTheConstant() {
        SimpleValue five = SimpleValue.ofInteger(W8, 5);
        Result r = Symbolic.runSymbolic(RunMode.proof(false, SolverConfig.z3()), st -> {
            st.output(SymVal.constant(five));
            return null;
        });
        assertEquals(five.toString(), r.toString());
    }

    @Test
    public void userSortsAreListedFirst() {
        Kind color = Kind.enumeratedSort("Color", List.of("Red", "Green"));
        Result r = Symbolic.runSymbolic(RunMode.proof(false, SolverConfig.z3()), st -> {
            st.output(st.mkSymVar(null, color, "c"));
            return null;
        });
        String s = r.toString();
        assertTrue(s.startsWith("SORTS\n  Color (Red, Green)\nINPUTS"));
    }

    @Test
    public void primedRunKeepsValueAndState() {
        Symbolic.SymbolicRun<SymVal> run = Symbolic.runSymbolicPrime(RunMode.proof(false, SolverConfig.z3()),
                st -> st.mkSymVar(null, W8, "x"));
        assertNotNull(run.getValue());
        assertEquals(1, run.getResult().getInputs().size());
        assertEquals(new SymWord(W8, 3), run.getState().toSW(run.getValue()));
        // the result is a snapshot
        run.getState().mkSymVar(null, W8, "y");
        assertEquals(1, run.getResult().getInputs().size());
        assertEquals(2, run.getState().getInputs().size());
    }

    @Test
    public void startedContextExtractsLater() {
        SimState st = Symbolic.startSymbolic(RunMode.codeGen());
        assertTrue(st.isCodeGenMode());
        SymVal x = st.mkSymVar(Quantifier.ALL, W8, "x");
        st.output(SymGen.times(x, x));
        Result r = Symbolic.extractSymbolicSimulationState(st);
        assertEquals(1, r.getProgram().size());
        assertEquals(1, r.getOutputs().size());
        assertSame(SymOp.Tag.TIMES, r.getProgram().getAssignments().get(0).getExpr().getOp().getTag());
    }
}
