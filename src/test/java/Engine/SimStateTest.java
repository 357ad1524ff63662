package Engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import init.Config;
import solver.SolverConfig;
import value.ConcreteValue;
import value.Kind;
import value.SimpleValue;
import value.SimpleValueDomain;

public class SimStateTest {

    private static final Kind W8 = Kind.word(8);

    private Set<Mutation> savedAllowed;

    @Before
    public void saveConfig() {
        savedAllowed = Config.interactiveAllowed;
        Config.interactiveAllowed = EnumSet.noneOf(Mutation.class);
    }

    @After
    public void restoreConfig() {
        Config.interactiveAllowed = savedAllowed;
    }

    private static SimState proof() {
        return SimState.newState(RunMode.proof(false, SolverConfig.z3()), SimpleValueDomain.INSTANCE);
    }

    private static SimState sat() {
        return SimState.newState(RunMode.proof(true, SolverConfig.z3()), SimpleValueDomain.INSTANCE);
    }

    private static SimState concrete(long seed) {
        return SimState.newState(RunMode.concrete(seed), SimpleValueDomain.INSTANCE);
    }

    private static SimState codeGen() {
        return SimState.newState(RunMode.codeGen(), SimpleValueDomain.INSTANCE);
    }

    private static SymVal w8(long v) {
        return SymVal.constant(SimpleValue.ofInteger(W8, v));
    }

    @Test
    public void reservedBooleansComeFirst() {
        SimState st = proof();
        assertEquals(3, st.getCounter());
        Map<SymWord, ConcreteValue> consts = st.extract().getConsts();
        assertEquals(SimpleValue.FALSE, consts.get(SymWord.FALSE));
        assertEquals(SimpleValue.TRUE, consts.get(SymWord.TRUE));
        assertEquals(SymWord.TRUE, st.newConst(SimpleValue.TRUE));
    }

    @Test
    public void idsIncreaseAfterReserved() {
        SimState st = proof();
        SymWord a = st.newConst(SimpleValue.ofInteger(W8, 10));
        SymWord b = st.newConst(SimpleValue.ofInteger(W8, 11));
        assertEquals(3, a.getId());
        assertEquals(4, b.getId());
    }

    @Test
    public void constantsAreInternedOnce() {
        SimState st = proof();
        SymWord a = st.newConst(SimpleValue.ofInteger(W8, 7));
        SymWord b = st.newConst(SimpleValue.ofInteger(W8, 7));
        assertEquals(a, b);
        assertEquals(4, st.getCounter());
    }

    @Test
    public void signedZerosAreDistinct() {
        SimState st = proof();
        SymWord pz = st.newConst(SimpleValue.ofFloat(0.0f));
        SymWord nz = st.newConst(SimpleValue.ofFloat(-0.0f));
        assertNotEquals(pz, nz);
        assertEquals(pz, st.newConst(SimpleValue.ofFloat(0.0f)));
        assertEquals(nz, st.newConst(SimpleValue.ofFloat(-0.0f)));
        assertEquals(4, st.extract().getConsts().size());
    }

    @Test
    public void commutativeOperandsShareOneNode() {
        SimState st = proof();
        SymWord x = st.toSW(st.mkSymVar(null, W8, "x"));
        SymWord y = st.toSW(st.mkSymVar(null, W8, "y"));
        assertEquals(3, x.getId());
        assertEquals(4, y.getId());

        SymWord xy = st.newExpr(W8, SymExpr.app(SymOp.of(SymOp.Tag.PLUS), x, y));
        SymWord yx = st.newExpr(W8, SymExpr.app(SymOp.of(SymOp.Tag.PLUS), y, x));
        assertEquals(5, xy.getId());
        assertEquals(xy, yx);
        assertEquals(1, st.getProgram().size());
    }

    @Test
    public void nonCommutativeOperandsStayApart() {
        SimState st = proof();
        SymWord x = st.toSW(st.mkSymVar(null, W8, "x"));
        SymWord y = st.toSW(st.mkSymVar(null, W8, "y"));
        SymWord xy = st.newExpr(W8, SymExpr.app(SymOp.of(SymOp.Tag.MINUS), x, y));
        SymWord yx = st.newExpr(W8, SymExpr.app(SymOp.of(SymOp.Tag.MINUS), y, x));
        assertNotEquals(xy, yx);
        assertEquals(2, st.getProgram().size());
    }

    @Test
    public void operandsMustBeAllocated() {
        SimState st = proof();
        SymWord ghost = new SymWord(W8, 99);
        assertThrows(ValidationException.class,
                () -> st.newExpr(W8, SymExpr.app(SymOp.of(SymOp.Tag.UNEG), ghost)));
    }

    @Test
    public void kindsAreRegisteredOnce() {
        SimState st = proof();
        st.mkSymVar(null, W8, "a");
        st.mkSymVar(null, W8, "b");
        st.mkSymVar(null, Kind.INTEGER, "c");
        assertEquals(Set.of(Kind.BOOL, W8, Kind.INTEGER), st.extract().getKinds());
    }

    @Test
    public void uninterpretedRedeclaration() {
        SimState st = proof();
        SymType t = SymType.of(W8, Kind.BOOL);
        st.newUninterpreted("f", t, null);
        st.newUninterpreted("f", t, null);
        assertEquals(1, st.getUninterpretedCount());

        ValidationException e = assertThrows(ValidationException.class,
                () -> st.newUninterpreted("f", SymType.of(Kind.INTEGER, Kind.BOOL), null));
        assertTrue(e.getMessage().contains("\"f\""));
        assertEquals(1, st.getUninterpretedCount());
    }

    @Test
    public void uninterpretedNamesAreChecked() {
        SimState st = proof();
        assertThrows(ValidationException.class, () -> st.newUninterpreted("", SymType.of(W8), null));
        assertThrows(ValidationException.class, () -> st.newUninterpreted("1abc", SymType.of(W8), null));
        assertThrows(ValidationException.class, () -> st.newUninterpreted("a-b", SymType.of(W8), null));
        st.newUninterpreted("|weird name|", SymType.of(W8), null);
        st.newUninterpreted("g_1", SymType.of(W8), List.of("return 0;"));
        Result r = st.extract();
        assertEquals(2, r.getUiConsts().size());
        assertEquals(List.of("return 0;"), r.getUiSegs().get("g_1"));
    }

    @Test
    public void tablesAreInternedByContent() {
        SimState st = proof();
        SymWord a = st.newConst(SimpleValue.ofInteger(W8, 1));
        SymWord b = st.newConst(SimpleValue.ofInteger(W8, 2));
        int t0 = st.getTableIndex(W8, W8, List.of(a, b));
        int again = st.getTableIndex(W8, W8, List.of(a, b));
        assertEquals(0, t0);
        assertEquals(t0, again);

        int before = st.getTableCount();
        int t1 = st.getTableIndex(W8, W8, List.of(b, a));
        assertEquals(before, t1);
        assertEquals(2, st.getTableCount());

        List<TableInfo> tables = st.extract().getTables();
        assertEquals(0, tables.get(0).getIndex());
        assertEquals(List.of(b, a), tables.get(1).getElements());
    }

    @Test
    public void inputNamesAreUnique() {
        SimState st = proof();
        st.mkSymVar(null, W8, "x");
        st.mkSymVar(null, W8, "y");
        ValidationException e = assertThrows(ValidationException.class, () -> st.mkSymVar(null, Kind.BOOL, "x"));
        assertTrue(e.getMessage().contains("Repeated user given name"));
        assertEquals(2, st.getInputs().size());
    }

    @Test
    public void unnamedInputsUseTheirNode() {
        SimState st = proof();
        SymWord w = st.toSW(st.mkSymVar(null, W8, null));
        assertEquals("s3", st.getInputs().get(0).getName());
        assertEquals(w, st.getInputs().get(0).getWord());
    }

    @Test
    public void defaultQuantifiers() {
        SimState s = sat();
        s.mkSymVar(null, W8, "x");
        assertEquals(Quantifier.EX, s.getInputs().get(0).getQuantifier());

        SimState p = proof();
        p.mkSymVar(null, W8, "x");
        assertEquals(Quantifier.ALL, p.getInputs().get(0).getQuantifier());

        SimState c = codeGen();
        c.mkSymVar(null, W8, "x");
        assertEquals(Quantifier.ALL, c.getInputs().get(0).getQuantifier());

        assertEquals(Quantifier.ALL, concrete(1).defaultQuantifier());
    }

    @Test
    public void explicitQuantifierWins() {
        SimState p = proof();
        p.mkSymVar(Quantifier.EX, W8, "x");
        assertEquals(Quantifier.EX, p.getInputs().get(0).getQuantifier());
    }

    @Test
    public void existentialsAreRejectedInConcreteMode() {
        SimState st = concrete(7);
        assertThrows(ModeViolationException.class, () -> st.mkSymVar(Quantifier.EX, W8, "x"));
    }

    @Test
    public void concreteVariablesAreSampled() {
        SimState st = concrete(7);
        SymVal x = st.mkSymVar(null, W8, "x");
        assertTrue(x.isConcrete());
        assertEquals(W8, x.getKind());
        assertTrue(st.getInputs().isEmpty());

        Result r = st.extract();
        assertEquals(1, r.getTraces().size());
        assertEquals("x", r.getTraces().get(0).getKey());
        assertEquals(x.getConstant(), r.getTraces().get(0).getValue());
    }

    @Test
    public void concreteSamplingIsReproducible() {
        SimState a = concrete(1234);
        SimState b = concrete(1234);
        for (int i = 0; i < 5; i++) {
            assertEquals(a.mkSymVar(null, Kind.word(32), "v" + i).getConstant(),
                    b.mkSymVar(null, Kind.word(32), "v" + i).getConstant());
        }
    }

    @Test
    public void userSortsAreRejectedOutsideProofs() {
        Kind u = Kind.userSort("U");
        assertThrows(ModeViolationException.class, () -> codeGen().mkSymVar(Quantifier.ALL, u, "u"));
        assertThrows(ModeViolationException.class, () -> concrete(3).mkSymVar(Quantifier.ALL, u, "u"));

        SimState p = proof();
        p.mkSymVar(null, u, "u");
        assertTrue(p.extract().getKinds().contains(u));
    }

    @Test
    public void reservedSortNamesAreRejected() {
        SimState st = proof();
        assertThrows(ValidationException.class, () -> st.mkUserSortVar(Kind.userSort("Int"), null, "i"));
    }

    @Test
    public void internalVariablesAreHiddenInputs() {
        SimState st = sat();
        SymWord w = st.internalVariable(Kind.BOOL);
        NamedInput in = st.getInputs().get(0);
        assertEquals("__internal_" + w, in.getName());
        assertEquals(Quantifier.EX, in.getQuantifier());
    }

    @Test
    public void constraintsAreRecorded() {
        SimState st = proof();
        SymVal b = st.mkSymVar(null, Kind.BOOL, "b");
        st.imposeConstraint(null, b);
        st.imposeConstraint("named", SymGen.not(b));
        List<Constraint> cs = st.getConstraints();
        assertEquals(2, cs.size());
        assertNull(cs.get(0).getName());
        assertEquals("named", cs.get(1).getName());
    }

    @Test
    public void constraintsMustBeBoolean() {
        SimState st = proof();
        assertThrows(ValidationException.class, () -> st.imposeConstraint(null, w8(3)));
    }

    @Test
    public void labelsAreChecked() {
        SimState st = proof();
        SymVal b = st.mkSymVar(null, Kind.BOOL, "b");
        st.imposeConstraint("c1", b);
        assertThrows(ValidationException.class, () -> st.imposeConstraint("c1", b));
        assertThrows(ValidationException.class, () -> st.imposeConstraint("assert", b));
        assertThrows(ValidationException.class, () -> st.imposeConstraint("a|b", b));
        assertThrows(ValidationException.class, () -> st.imposeConstraint("", b));
        assertEquals(1, st.getConstraints().size());
    }

    @Test
    public void codeGenRejectsConstraintsAndAssertions() {
        SimState st = codeGen();
        SymVal b = st.mkSymVar(null, Kind.BOOL, "b");
        assertThrows(ModeViolationException.class, () -> st.imposeConstraint(null, b));
        assertThrows(ModeViolationException.class, () -> st.addAssertion("a", null, b));
        assertThrows(ModeViolationException.class, () -> st.addOptGoal(Objective.minimize("m", b)));
    }

    @Test
    public void assertionLabelsMayRepeat() {
        SimState st = proof();
        SymVal b = st.mkSymVar(null, Kind.BOOL, "b");
        StackTraceElement here = new Throwable().getStackTrace()[0];
        st.addAssertion("same", here, b);
        st.addAssertion("same", null, SymGen.not(b));
        List<Assertion> as = st.extract().getAssertions();
        assertEquals(2, as.size());
        assertSame(here, as.get(0).getLocation());
        assertTrue(as.get(1).toString().contains("[No location]"));
    }

    @Test
    public void probabilityThresholdOutOfRange() {
        SimState st = concrete(5);
        SymVal t = SymVal.constant(SimpleValue.TRUE);
        SymVal f = SymVal.constant(SimpleValue.FALSE);
        assertThrows(ValidationException.class, () -> st.addConstraint(null, -0.1, t, f));
        assertThrows(ValidationException.class, () -> st.addConstraint(null, 1.1, t, f));
        assertThrows(ValidationException.class, () -> st.addConstraint(null, Double.NaN, t, f));
        assertTrue(st.getConstraints().isEmpty());
    }

    @Test
    public void probabilityEndpointsAreDeterministic() {
        SimState st = concrete(5);
        SymVal t = SymVal.constant(SimpleValue.TRUE);
        SymVal f = SymVal.constant(SimpleValue.FALSE);
        for (int i = 0; i < 10; i++) {
            st.addConstraint(null, 0.0, t, f);
            st.addConstraint(null, 1.0, t, f);
        }
        List<Constraint> cs = st.getConstraints();
        for (int i = 0; i < cs.size(); i += 2) {
            assertEquals(SymWord.FALSE, cs.get(i).getCondition());
            assertEquals(SymWord.TRUE, cs.get(i + 1).getCondition());
        }
    }

    @Test
    public void probabilityDrawsFollowTheSeed() {
        SymVal t = SymVal.constant(SimpleValue.TRUE);
        SymVal f = SymVal.constant(SimpleValue.FALSE);
        SimState a = concrete(99);
        SimState b = concrete(99);
        for (int i = 0; i < 20; i++) {
            a.addConstraint(null, 0.5, t, f);
            b.addConstraint(null, 0.5, t, f);
        }
        for (int i = 0; i < 20; i++) {
            assertEquals(a.getConstraints().get(i).getCondition(), b.getConstraints().get(i).getCondition());
        }
    }

    @Test
    public void probabilityNeedsConcreteMode() {
        SimState st = proof();
        SymVal t = SymVal.constant(SimpleValue.TRUE);
        assertThrows(ModeViolationException.class, () -> st.addConstraint(null, 0.5, t, t));
        st.addConstraint(null, null, t, null);
        assertEquals(1, st.getConstraints().size());
    }

    @Test
    public void goalsGetTrackingVariables() {
        SimState st = proof();
        SymVal x = st.mkSymVar(null, W8, "x");
        st.addOptGoal(Objective.maximize("best", x));
        Result r = st.extract();
        Objective<TrackedGoal> g = r.getGoals().get(0);
        assertEquals(st.toSW(x), g.getValue().getOriginal());
        NamedInput tracker = r.getInputs().get(1);
        assertEquals("best", tracker.getName());
        assertEquals(Quantifier.EX, tracker.getQuantifier());
        assertEquals(tracker.getWord(), g.getValue().getTracker());
    }

    @Test
    public void goalsNeedAnOptimizingSolver() {
        SimState st = SimState.newState(RunMode.proof(false, SolverConfig.boolector()), SimpleValueDomain.INSTANCE);
        SymVal x = st.mkSymVar(null, W8, "x");
        assertThrows(ValidationException.class, () -> st.addOptGoal(Objective.minimize("m", x)));
    }

    @Test
    public void outputsKeepOrder() {
        SimState st = proof();
        SymVal x = st.mkSymVar(null, W8, "x");
        st.output(w8(9));
        st.output(x);
        List<SymWord> os = st.extract().getOutputs();
        assertEquals(2, os.size());
        assertEquals(st.toSW(x), os.get(1));
    }

    @Test
    public void pathConditionStack() {
        SimState st = proof();
        SymVal base = st.getPathCondition();
        assertTrue(base.isConcrete());
        SymVal b = st.mkSymVar(null, Kind.BOOL, "b");
        SymVal ext = st.extendPathCondition(pc -> SymGen.and(pc, b));
        assertSame(ext, st.getPathCondition());
        st.restorePathCondition();
        assertSame(base, st.getPathCondition());
        assertThrows(IllegalStateException.class, st::restorePathCondition);
    }

    @Test
    public void reseedRestartsTheGenerator() {
        SimState st = concrete(11);
        long first = st.forkRandom().nextLong();
        st.reseed(11);
        assertEquals(first, st.forkRandom().nextLong());
    }

    @Test
    public void interactiveSwitchOnlyFromProof() {
        assertThrows(ModeViolationException.class, () -> codeGen().switchToInteractiveMode());
        assertThrows(ModeViolationException.class, () -> concrete(1).switchToInteractiveMode());

        SimState st = sat();
        st.switchToInteractiveMode();
        assertTrue(st.getRunMode().isInteractive());
        assertTrue(st.getRunMode().isSat());
        assertFalse(st.inNonInteractiveProofMode());
        assertNotNull(st.getProofConfig());
        assertThrows(ModeViolationException.class, st::switchToInteractiveMode);
    }

    @Test
    public void interactiveModeRejectsNewInputs() {
        SimState st = proof();
        st.mkSymVar(null, W8, "x");
        st.switchToInteractiveMode();
        InteractiveModeException e = assertThrows(InteractiveModeException.class,
                () -> st.mkSymVar(null, W8, "y"));
        assertEquals(Mutation.INPUT, e.getMutation());
        assertTrue(e.getMessage().contains("Unsupported interactive/query mode feature."));
        assertEquals(1, st.getInputs().size());
    }

    @Test
    public void interactiveAllowListIsConfigurable() {
        Config.interactiveAllowed = EnumSet.of(Mutation.INPUT);
        SimState st = proof();
        st.mkSymVar(null, W8, "x");
        st.switchToInteractiveMode();
        st.mkSymVar(null, W8, "y");
        assertEquals(2, st.getInputs().size());
        // a fresh kind still needs its own permission
        assertThrows(InteractiveModeException.class, () -> st.mkSymVar(null, Kind.INTEGER, "z"));
    }

    @Test
    public void interactiveRoundsCollectDeltas() {
        SimState st = proof();
        SymVal x = st.mkSymVar(null, W8, "x");
        SymVal y = st.mkSymVar(null, W8, "y");
        st.switchToInteractiveMode();

        IncState.Round<SymWord> round = st.withNewIncState(s -> {
            s.newConst(SimpleValue.ofInteger(W8, 42));
            return s.toSW(SymGen.plus(x, y));
        });
        IncState delta = round.getDelta();
        assertEquals(1, delta.getNewConsts().size());
        assertEquals(1, delta.getNewAsgns().size());
        assertEquals(round.getValue(), delta.getNewAsgns().getAssignments().get(0).getWord());

        IncState.Round<Void> empty = st.withNewIncState(s -> null);
        assertTrue(empty.getDelta().isEmpty());
        assertSame(empty.getDelta(), st.getIncState());
    }

    @Test
    public void sharedValuesAreObservedOnce() {
        SimState st = proof();
        SymVal x = st.mkSymVar(null, W8, "x");
        SymVal sum = SymGen.plus(x, x);
        SymWord first = st.toSW(sum);
        int ctr = st.getCounter();
        assertEquals(first, st.toSW(sum));
        assertEquals(ctr, st.getCounter());
        assertTrue(st.getSWCache().getHitCount() > 0);
    }

    @Test
    public void inputNamesMustBeUsable() {
        SimState st = proof();
        assertThrows(ValidationException.class, () -> st.mkSymVar(null, W8, "assert"));
        assertThrows(ValidationException.class, () -> st.mkSymVar(null, W8, "Int"));
        assertThrows(ValidationException.class, () -> st.mkSymVar(null, W8, "a|b"));
        ValidationException e = assertThrows(ValidationException.class, () -> st.mkSymVar(null, W8, "a\\b"));
        assertTrue(e.getMessage().contains("a\\b"));
        assertThrows(ValidationException.class, () -> st.mkUserSortVar(Kind.userSort("U"), null, "forall"));
        assertThrows(ValidationException.class, () -> concrete(3).mkSymVar(null, W8, "select"));
        assertTrue(st.getInputs().isEmpty());
        assertEquals(SymWord.TRUE_ID + 1, st.getCounter());

        st.mkSymVar(null, W8, "assert_ok");
        assertEquals(1, st.getInputs().size());
    }
}
