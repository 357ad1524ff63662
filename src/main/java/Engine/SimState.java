package Engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SplittableRandom;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.function.IntFunction;
import java.util.function.UnaryOperator;

import cache.Cached;
import cache.IdentityCache;
import init.Config;
import solver.SolverConfig;
import utils.Log;
import value.ConcreteValue;
import value.Kind;
import value.ValueDomain;

/**
 * The construction context. Owns every store of one symbolic run and is
 * driven by a single thread; nothing here is synchronized.
 */
public class SimState {

    private static final Runnable NOTHING = () -> { };

    /** Constants are keyed by sign of zero as well as value: +0.0 and -0.0 compare equal. */
    private static final class ConstKey {
        private final boolean negZero;
        private final ConcreteValue value;

        ConstKey(ConcreteValue value) {
            this.negZero = value.isNegativeZero();
            this.value = value;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ConstKey)) return false;
            ConstKey k = (ConstKey) o;
            return negZero == k.negZero && value.equals(k.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(negZero, value);
        }
    }

    private RunMode runMode;
    private final ValueDomain domain;
    private final Set<Mutation> interactiveAllowed;

    // path condition, bottom of the stack is always the constant true
    private final Deque<SymVal> pathConds = new ArrayDeque<>();
    private IncState incState = new IncState();
    private SplittableRandom rng;

    private int ctr = SymWord.FALSE_ID;
    private final List<Map.Entry<String, ConcreteValue>> cInfo = new ArrayList<>();
    private final Set<Kind> usedKinds = new TreeSet<>();
    private final Set<String> usedLabels = new HashSet<>();
    private final List<NamedInput> inputs = new ArrayList<>();
    private final Set<String> inputNames = new HashSet<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private final List<SymWord> outputs = new ArrayList<>();
    private final SymProgram program = new SymProgram();
    private final Map<ConstKey, SymWord> constMap = new HashMap<>();
    private final Map<SymExpr, SymWord> exprMap = new HashMap<>();
    // insertion order is index order
    private final Map<TableInfo.Key, Integer> tableMap = new LinkedHashMap<>();
    private final Map<Integer, ArrayInfo> arrayMap = new TreeMap<>();
    private final Map<String, SymType> uiMap = new TreeMap<>();
    private final Map<String, List<String>> cgMap = new TreeMap<>();
    private final List<Axiom> axioms = new ArrayList<>();
    private final List<Tactic<SymWord>> tactics = new ArrayList<>();
    private final List<Objective<TrackedGoal>> goals = new ArrayList<>();
    private final List<Assertion> assertions = new ArrayList<>();

    private final IdentityCache<SymWord> swCache = new IdentityCache<>("SWCache");
    private final IdentityCache<Integer> arrayCache = new IdentityCache<>("ArrayCache");

    private SimState(RunMode runMode, ValueDomain domain) {
        this.runMode = runMode;
        this.domain = domain;
        this.interactiveAllowed = EnumSet.noneOf(Mutation.class);
        this.interactiveAllowed.addAll(Config.interactiveAllowed);
        this.rng = runMode.isConcrete() ? new SplittableRandom(runMode.getSeed())
                : new SplittableRandom(Config.defaultSeed);
        this.pathConds.push(SymVal.constant(domain.ofBoolean(true)));
    }

    /**
     * A fresh context with {@code false} and {@code true} interned, so they own
     * the two lowest ids.
     */
    public static SimState newState(RunMode runMode, ValueDomain domain) {
        SimState st = new SimState(runMode, domain);
        SymWord f = st.newConst(domain.ofBoolean(false));
        SymWord t = st.newConst(domain.ofBoolean(true));
        if (!f.equals(SymWord.FALSE) || !t.equals(SymWord.TRUE)) {
            throw new IllegalStateException("Reserved boolean constants got ids " + f + " and " + t);
        }
        Log.debug("New context in mode: " + runMode);
        return st;
    }

    // ---------------------------------------------------------------- modes

    public RunMode getRunMode() {
        return runMode;
    }

    public ValueDomain getDomain() {
        return domain;
    }

    public boolean isConcreteMode() {
        return runMode.isConcrete();
    }

    public boolean isCodeGenMode() {
        return runMode.isCodeGen();
    }

    public boolean inProofMode() {
        return runMode.isProof() || runMode.isInteractive();
    }

    public boolean inNonInteractiveProofMode() {
        return runMode.isProof();
    }

    /** Proof mode may turn interactive once; every other mode stays put. */
    public void switchToInteractiveMode() {
        if (!runMode.isProof()) {
            throw fail(new ModeViolationException(runMode, "Trying to switch to interactive mode"));
        }
        runMode = runMode.toInteractive();
        Log.info("Switched to interactive mode");
    }

    /** The solver configuration of a proof run, null in every other mode. */
    public SolverConfig getProofConfig() {
        return inProofMode() ? runMode.getConfig() : null;
    }

    public Quantifier defaultQuantifier() {
        if (inProofMode()) {
            return runMode.isSat() ? Quantifier.EX : Quantifier.ALL;
        }
        return Quantifier.ALL;
    }

    // ------------------------------------------------------- path condition

    public SymVal getPathCondition() {
        return pathConds.peek();
    }

    /** Pushes {@code f} applied to the current path condition. */
    public SymVal extendPathCondition(UnaryOperator<SymVal> f) {
        SymVal next = f.apply(pathConds.peek());
        if (!next.getKind().isBoolean()) {
            throw fail(new ValidationException("Path condition must be boolean, got: " + next.getKind()));
        }
        pathConds.push(next);
        return next;
    }

    public void restorePathCondition() {
        if (pathConds.size() == 1) {
            throw new IllegalStateException("Path condition stack is already at its base");
        }
        pathConds.pop();
    }

    // ------------------------------------------------------------------ rng

    public void reseed(long seed) {
        rng = new SplittableRandom(seed);
    }

    /** Splits off an independent generator; the context keeps drawing from its own. */
    public SplittableRandom forkRandom() {
        return rng.split();
    }

    double throwDice() {
        return rng.nextDouble();
    }

    // ----------------------------------------------------- guarded mutation

    /**
     * Applies {@code update}; in interactive mode {@code interactiveUpdate}
     * runs first, so a forbidden mutation fails before touching any store.
     */
    private void modifyState(Runnable update, Runnable interactiveUpdate) {
        if (runMode.isInteractive()) {
            interactiveUpdate.run();
        }
        update.run();
    }

    private Runnable noInteractive(Mutation what, String... details) {
        return () -> {
            if (!interactiveAllowed.contains(what)) {
                throw fail(new InteractiveModeException(what, details));
            }
            Log.debug("Interactive mutation allowed: " + what);
        };
    }

    private static <E extends SymbolicException> E fail(E e) {
        Log.error(e.getMessage());
        return e;
    }

    // ----------------------------------------------------------- allocation

    private int incCtr() {
        return ctr++;
    }

    /** The id the next node will get. */
    public int getCounter() {
        return ctr;
    }

    private SymWord newSW(Kind k) {
        SymWord sw = new SymWord(k, incCtr());
        registerKind(k);
        return sw;
    }

    public void registerKind(Kind k) {
        if (usedKinds.contains(k)) {
            return;
        }
        if (TypeUtils.isReservedSort(k)) {
            throw fail(new ValidationException("\"" + k.getSortName()
                    + "\" is a reserved sort; please use a different name."));
        }
        modifyState(() -> usedKinds.add(k),
                noInteractive(Mutation.KIND, "Registering a new kind: " + k));
        Log.debug("Registered kind " + k);
    }

    public void registerLabel(String nm) {
        if (nm.isEmpty() || TypeUtils.isReservedName(nm) || nm.indexOf('|') >= 0 || nm.indexOf('\\') >= 0) {
            throw fail(new ValidationException("Label \"" + nm
                    + "\" is not a valid name: it must be non-empty, not a reserved word, and free of '|' and '\\'."));
        }
        if (usedLabels.contains(nm)) {
            throw fail(new ValidationException("Label \"" + nm + "\" is used multiple times. Please use unique names."));
        }
        modifyState(() -> usedLabels.add(nm),
                noInteractive(Mutation.LABEL, "Registering the label: " + nm));
    }

    public SymWord newConst(ConcreteValue c) {
        ConstKey key = new ConstKey(c);
        SymWord known = constMap.get(key);
        if (known != null) {
            return known;
        }
        SymWord sw = newSW(c.getKind());
        modifyState(() -> constMap.put(key, sw), () -> incState.recordConst(c, sw));
        Log.debug("New constant " + sw + " = " + c);
        return sw;
    }

    public int getTableIndex(Kind at, Kind rt, List<SymWord> elements) {
        TableInfo.Key key = new TableInfo.Key(at, rt, elements);
        Integer known = tableMap.get(key);
        if (known != null) {
            return known;
        }
        int i = tableMap.size();
        modifyState(() -> tableMap.put(key, i),
                noInteractive(Mutation.TABLE, "Adding a new table:", "  Index: " + i, "  Type : " + at + " -> " + rt));
        Log.debug("New table " + i + " of size " + elements.size());
        return i;
    }

    /**
     * Returns the node for {@code app}, allocating one only if no equal
     * application (after canonical operand order) exists yet.
     */
    public SymWord newExpr(Kind k, SymExpr app) {
        SymExpr e = app.reorder();
        SymWord known = exprMap.get(e);
        if (known != null) {
            return known;
        }
        for (SymWord a : e.getArgs()) {
            if (a.getId() >= ctr) {
                throw fail(new ValidationException("Operand " + a + " of " + e + " was not allocated in this context"));
            }
        }
        SymWord sw = newSW(k);
        modifyState(() -> program.append(sw, e), () -> incState.recordAssignment(sw, e));
        modifyState(() -> exprMap.put(e, sw), NOTHING);
        Log.debug("New node " + sw + " = " + e);
        return sw;
    }

    // --------------------------------------------------------- value access

    public SymWord toSW(SymVal v) {
        if (v.isConcrete()) {
            return newConst(v.getConstant());
        }
        return swCache.uncache(v.getComputation(), this);
    }

    public SymWord uncache(Cached<SymWord> f) {
        return swCache.uncache(f, this);
    }

    public int uncacheArray(Cached<Integer> f) {
        return arrayCache.uncache(f, this);
    }

    // ------------------------------------------------------------ variables

    /**
     * Creates an input of kind {@code k}. A null quantifier picks the mode's
     * default and a null name picks {@code s<id>}. Concrete mode returns a
     * random constant instead and records it in the trace.
     */
    public SymVal mkSymVar(Quantifier mbQ, Kind k, String mbNm) {
        if (k.isUserSort()) {
            return mkUserSortVar(k, mbQ, mbNm);
        }
        checkInputName(mbNm, k);
        Quantifier q = mbQ != null ? mbQ : defaultQuantifier();
        if (runMode.isConcrete()) {
            if (q == Quantifier.EX) {
                throw fail(new ModeViolationException(runMode, mbNm == null
                        ? "Cannot quick-check in the presence of existential variables, type: " + k
                        : "Cannot quick-check in the presence of existential variable " + mbNm + " :: " + k));
            }
            ConcreteValue cw = domain.randomValue(k, rng);
            String nm = mbNm == null ? "_" : mbNm;
            modifyState(() -> cInfo.add(Map.entry(nm, cw)), NOTHING);
            return SymVal.constant(cw);
        }
        SymWord sw = newSW(k);
        return introduceUserName(mbNm == null ? sw.toString() : mbNm, q, sw);
    }

    public SymVal mkUserSortVar(Kind k, Quantifier mbQ, String mbNm) {
        if (!k.isUserSort()) {
            throw new IllegalArgumentException("Not an uninterpreted sort: " + k);
        }
        if (runMode.isCodeGen() || runMode.isConcrete()) {
            throw fail(new ModeViolationException(runMode,
                    "Uninterpreted sort " + k.getSortName() + " can not be used in this mode"));
        }
        checkInputName(mbNm, k);
        Quantifier q = mbQ != null ? mbQ : defaultQuantifier();
        SymWord sw = newSW(k);
        return introduceUserName(mbNm == null ? sw.toString() : mbNm, q, sw);
    }

    private void checkInputName(String nm, Kind k) {
        if (nm == null) {
            return;
        }
        if (nm.isEmpty()) {
            throw fail(new ValidationException("Input names must not be empty, kind: " + k));
        }
        if (TypeUtils.isReservedName(nm) || nm.indexOf('|') >= 0 || nm.indexOf('\\') >= 0) {
            throw fail(new ValidationException("Input name \"" + nm + "\" :: " + k
                    + " is not a valid name: it must not be a reserved word or contain '|' or '\\'."));
        }
    }

    private SymVal introduceUserName(String nm, Quantifier q, SymWord sw) {
        if (inputNames.contains(nm)) {
            throw fail(new ValidationException("Repeated user given name: \"" + nm + "\". Please use unique names."));
        }
        NamedInput input = new NamedInput(q, sw, nm);
        modifyState(() -> {
            inputs.add(input);
            inputNames.add(nm);
        }, noInteractive(Mutation.INPUT, "Adding a new input variable:", "  Name : " + nm,
                "  Kind : " + sw.getKind(), "  Quant: " + q));
        Log.debug("New input " + input);
        return SymVal.ofWord(sw);
    }

    /** An input with no user-visible name, quantified by the mode default. */
    public SymWord internalVariable(Kind k) {
        SymWord sw = newSW(k);
        String nm = "__internal_" + sw;
        NamedInput input = new NamedInput(defaultQuantifier(), sw, nm);
        modifyState(() -> {
            inputs.add(input);
            inputNames.add(nm);
        }, noInteractive(Mutation.INTERNAL_VARIABLE, "Adding an internal variable:", "  Kind: " + k));
        return sw;
    }

    // ------------------------------------------- declarations & constraints

    /**
     * Declares an uninterpreted constant or function. The same name must
     * always come with the same type; optional {@code code} is kept for code
     * generation.
     */
    public void newUninterpreted(String nm, SymType t, List<String> code) {
        if (!TypeUtils.isValidIdentifier(nm)) {
            throw fail(new ValidationException("Bad uninterpreted constant name: \"" + nm
                    + "\". Must be a valid identifier."));
        }
        SymType prev = uiMap.get(nm);
        if (prev != null) {
            if (!prev.equals(t)) {
                throw fail(new ValidationException("Uninterpreted constant \"" + nm
                        + "\" used at incompatible types. Current type: " + t + ". Previously used at: " + prev));
            }
            return;
        }
        modifyState(() -> uiMap.put(nm, t), noInteractive(Mutation.UNINTERPRETED,
                "Uninterpreted function introduction:", "  Named: " + nm, "  Type : " + t));
        if (code != null) {
            List<String> body = List.copyOf(code);
            modifyState(() -> cgMap.put(nm, body), NOTHING);
        }
        Log.debug("New uninterpreted " + nm + " :: " + t);
    }

    public void addAxiom(String nm, List<String> lines) {
        Axiom ax = new Axiom(nm, lines);
        modifyState(() -> axioms.add(ax), noInteractive(Mutation.AXIOM, "Adding a new axiom:", "  Named: " + nm));
    }

    /** Records a labelled assertion; labels need not be unique. */
    public void addAssertion(String label, StackTraceElement location, SymVal cond) {
        if (runMode.isCodeGen()) {
            throw fail(new ModeViolationException(runMode, "Assertions are not allowed in code-generation: " + label));
        }
        SymWord sw = requireBoolean(toSW(cond), "assertion " + label);
        Assertion a = new Assertion(label, location, sw);
        modifyState(() -> assertions.add(a), noInteractive(Mutation.ASSERTION,
                "Adding a new assertion:", "  Label: " + label));
    }

    public void imposeConstraint(String mbNm, SymVal c) {
        if (runMode.isCodeGen()) {
            throw fail(new ModeViolationException(runMode, "Constraints are not allowed in code-generation"
                    + (mbNm == null ? "" : ": " + mbNm)));
        }
        if (mbNm != null) {
            registerLabel(mbNm);
        }
        internalConstraint(mbNm, c);
    }

    /** Adds a constraint without the label and mode checks. */
    public void internalConstraint(String mbNm, SymVal b) {
        SymWord sw = requireBoolean(toSW(b), "constraint");
        Constraint c = new Constraint(mbNm, sw);
        modifyState(() -> constraints.add(c), noInteractive(Mutation.CONSTRAINT,
                "Adding an internal constraint:", "  Named: " + (mbNm == null ? "<unnamed>" : mbNm)));
    }

    /**
     * Adds {@code c}, or with a threshold {@code t} in [0, 1] adds {@code c}
     * with probability {@code t} and {@code alt} otherwise. Thresholds are only
     * meaningful in concrete mode.
     */
    public void addConstraint(String mbNm, Double t, SymVal c, SymVal alt) {
        if (t == null) {
            imposeConstraint(mbNm, c);
            return;
        }
        if (Double.isNaN(t) || t < 0 || t > 1) {
            throw fail(new ValidationException("Invalid probability threshold: " + t + ", must be in [0, 1]."));
        }
        if (!runMode.isConcrete()) {
            throw fail(new ModeViolationException(runMode,
                    "Probabilistic constraints are only allowed in concrete evaluation"));
        }
        if (t == 0) {
            imposeConstraint(mbNm, alt);
        } else if (t == 1) {
            imposeConstraint(mbNm, c);
        } else {
            double d = throwDice();
            imposeConstraint(mbNm, d <= t ? c : alt);
        }
    }

    private SymWord requireBoolean(SymWord sw, String what) {
        if (!sw.getKind().isBoolean()) {
            throw fail(new ValidationException("Expected a boolean for " + what + ", got " + sw + " :: " + sw.getKind()));
        }
        return sw;
    }

    // ------------------------------------------------- tactics and goals

    public void addTactic(Tactic<SymVal> tac) {
        Tactic<SymWord> resolved = tac.map(this::toSW);
        modifyState(() -> tactics.add(resolved), noInteractive(Mutation.TACTIC,
                "Adding a new tactic:", "  Tactic: " + resolved));
    }

    /**
     * Resolves the goal and introduces an existential tracking variable named
     * after it.
     */
    public void addOptGoal(Objective<SymVal> obj) {
        if (runMode.isCodeGen()) {
            throw fail(new ModeViolationException(runMode,
                    "Optimization goals are not allowed in code-generation: " + obj.getName()));
        }
        SolverConfig cfg = getProofConfig();
        if (cfg != null && !cfg.getCapabilities().supportsOptimization()) {
            throw fail(new ValidationException("The solver " + cfg.getName()
                    + " does not support optimization, goal: " + obj.getName()));
        }
        SymVal target = obj.getValue();
        SymWord orig = toSW(target);
        SymWord track = toSW(mkSymVar(Quantifier.EX, target.getKind(), obj.getName()));
        Objective<TrackedGoal> goal = obj.map(v -> new TrackedGoal(orig, track));
        modifyState(() -> goals.add(goal), noInteractive(Mutation.GOAL,
                "Adding an optimization goal:", "  Goal: " + goal));
    }

    public void output(SymVal v) {
        SymWord sw = toSW(v);
        modifyState(() -> outputs.add(sw), NOTHING);
    }

    // --------------------------------------------------------------- arrays

    /** Allocates the next array handle, which is the current store size. */
    int allocateArray(IntFunction<ArrayInfo> mk) {
        int j = arrayMap.size();
        ArrayInfo info = mk.apply(j);
        if (runMode.isConcrete()) {
            throw fail(new ValidationException("Arrays are not supported in concrete evaluation: "
                    + info.getName() + " :: " + info.getIndexKind() + " -> " + info.getResultKind()));
        }
        modifyState(() -> arrayMap.put(j, info), noInteractive(Mutation.ARRAY,
                "Adding a new array:", "  " + info));
        Log.debug("New array " + info.getName() + " from " + info.getContext());
        return j;
    }

    public int getArrayCount() {
        return arrayMap.size();
    }

    public ArrayInfo getArray(int handle) {
        return arrayMap.get(handle);
    }

    // ------------------------------------------------------- inspection

    public SymProgram getProgram() {
        return program.snapshot();
    }

    public int getUninterpretedCount() {
        return uiMap.size();
    }

    public int getTableCount() {
        return tableMap.size();
    }

    public List<NamedInput> getInputs() {
        return Collections.unmodifiableList(inputs);
    }

    public List<Constraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public IdentityCache<SymWord> getSWCache() {
        return swCache;
    }

    // --------------------------------------------------------- incremental

    public IncState getIncState() {
        return incState;
    }

    /** Runs {@code cont} against a fresh incremental store and hands back what it collected. */
    public <T> IncState.Round<T> withNewIncState(Function<SimState, T> cont) {
        incState = new IncState();
        T r = cont.apply(this);
        return new IncState.Round<>(incState, r);
    }

    // ----------------------------------------------------------- extraction

    /** Reads every store once and freezes the result. */
    public Result extract() {
        SortedMap<SymWord, ConcreteValue> consts = new TreeMap<>();
        for (Map.Entry<ConstKey, SymWord> e : constMap.entrySet()) {
            consts.put(e.getValue(), e.getKey().value);
        }
        List<TableInfo> tbls = new ArrayList<>();
        for (Map.Entry<TableInfo.Key, Integer> e : tableMap.entrySet()) {
            tbls.add(e.getKey().toInfo(e.getValue()));
        }
        Result r = new Result(usedKinds, cInfo, cgMap, inputs, consts, tbls, arrayMap.values(), uiMap,
                axioms, program.snapshot(), constraints, tactics, goals, assertions, outputs);
        swCache.logStats();
        arrayCache.logStats();
        Log.debug("Extracted result with " + program.size() + " assignments");
        return r;
    }
}
