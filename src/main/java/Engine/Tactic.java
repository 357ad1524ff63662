package Engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

import solver.Query;
import solver.SmtResult;
import solver.SolverConfig;

/**
 * A user directive on how the solver is invoked. Symbolic payloads only occur
 * in case-split conditions; {@link #map} resolves them.
 */
public final class Tactic<T> {

    public enum Tag {
        CASE_SPLIT,
        CHECK_CASE_VACUITY,
        PARALLEL_CASE,
        CHECK_CONSTR_VACUITY,
        STOP_AFTER,
        CHECK_USING,
        USE_SOLVER,
        SET_OPTIONS,
        OPTIMIZE_PRIORITY,
        QUERY_USING
    }

    private final Tag tag;
    private final boolean flag;
    private final List<CaseBranch<T>> cases;
    private final int seconds;
    private final String command;
    private final SolverConfig solverConfig;
    private final List<String> options;
    private final OptimizeStyle style;
    private final Query<List<SmtResult>> query;

    private Tactic(Tag tag, boolean flag, List<CaseBranch<T>> cases, int seconds, String command,
                   SolverConfig solverConfig, List<String> options, OptimizeStyle style,
                   Query<List<SmtResult>> query) {
        this.tag = tag;
        this.flag = flag;
        this.cases = cases;
        this.seconds = seconds;
        this.command = command;
        this.solverConfig = solverConfig;
        this.options = options;
        this.style = style;
        this.query = query;
    }

    private static <T> Tactic<T> simple(Tag tag) {
        return new Tactic<>(tag, false, Collections.emptyList(), 0, null, null,
                Collections.emptyList(), null, null);
    }

    private static <T> Tactic<T> flagged(Tag tag, boolean flag) {
        return new Tactic<>(tag, flag, Collections.emptyList(), 0, null, null,
                Collections.emptyList(), null, null);
    }

    /** Case split with implicit coverage; {@code verbose} reports each case as it is checked. */
    public static <T> Tactic<T> caseSplit(boolean verbose, List<CaseBranch<T>> cases) {
        return new Tactic<>(Tag.CASE_SPLIT, verbose, Collections.unmodifiableList(new ArrayList<>(cases)), 0,
                null, null, Collections.emptyList(), null, null);
    }

    public static <T> Tactic<T> checkCaseVacuity(boolean check) {
        return flagged(Tag.CHECK_CASE_VACUITY, check);
    }

    public static <T> Tactic<T> parallelCase() {
        return simple(Tag.PARALLEL_CASE);
    }

    public static <T> Tactic<T> checkConstrVacuity(boolean check) {
        return flagged(Tag.CHECK_CONSTR_VACUITY, check);
    }

    /** Time budget handed to the solver, in seconds. */
    public static <T> Tactic<T> stopAfter(int seconds) {
        if (seconds <= 0) {
            throw new ValidationException("StopAfter expects a positive number of seconds, received: " + seconds);
        }
        return new Tactic<>(Tag.STOP_AFTER, false, Collections.emptyList(), seconds, null, null,
                Collections.emptyList(), null, null);
    }

    public static <T> Tactic<T> checkUsing(String command) {
        return new Tactic<>(Tag.CHECK_USING, false, Collections.emptyList(), 0, command, null,
                Collections.emptyList(), null, null);
    }

    public static <T> Tactic<T> useSolver(SolverConfig config) {
        return new Tactic<>(Tag.USE_SOLVER, false, Collections.emptyList(), 0, null, config,
                Collections.emptyList(), null, null);
    }

    public static <T> Tactic<T> setOptions(List<String> options) {
        return new Tactic<>(Tag.SET_OPTIONS, false, Collections.emptyList(), 0, null, null,
                Collections.unmodifiableList(new ArrayList<>(options)), null, null);
    }

    public static <T> Tactic<T> optimizePriority(OptimizeStyle style) {
        return new Tactic<>(Tag.OPTIMIZE_PRIORITY, false, Collections.emptyList(), 0, null, null,
                Collections.emptyList(), style, null);
    }

    public static <T> Tactic<T> queryUsing(Query<List<SmtResult>> query) {
        return new Tactic<>(Tag.QUERY_USING, false, Collections.emptyList(), 0, null, null,
                Collections.emptyList(), null, query);
    }

    /**
     * Rewrites every case condition, depth first, keeping the shape intact.
     */
    public <R> Tactic<R> map(Function<? super T, ? extends R> f) {
        if (tag != Tag.CASE_SPLIT) {
            return new Tactic<>(tag, flag, Collections.emptyList(), seconds, command, solverConfig,
                    options, style, query);
        }
        List<CaseBranch<R>> mapped = new ArrayList<>();
        for (CaseBranch<T> c : cases) {
            List<Tactic<R>> inner = new ArrayList<>();
            for (Tactic<T> t : c.getTactics()) {
                inner.add(t.map(f));
            }
            R cond = f.apply(c.getCondition());
            mapped.add(new CaseBranch<>(c.getName(), cond, inner));
        }
        return caseSplit(flag, mapped);
    }

    public boolean isParallelCaseAnywhere() {
        if (tag == Tag.PARALLEL_CASE) {
            return true;
        }
        for (CaseBranch<T> c : cases) {
            for (Tactic<T> t : c.getTactics()) {
                if (t.isParallelCaseAnywhere()) {
                    return true;
                }
            }
        }
        return false;
    }

    public Tag getTag() {
        return tag;
    }

    /** Verbosity of a case split, or the switch of a vacuity check. */
    public boolean getFlag() {
        return flag;
    }

    public List<CaseBranch<T>> getCases() {
        return cases;
    }

    public int getSeconds() {
        return seconds;
    }

    public String getCommand() {
        return command;
    }

    public SolverConfig getSolverConfig() {
        return solverConfig;
    }

    public List<String> getOptions() {
        return options;
    }

    public OptimizeStyle getStyle() {
        return style;
    }

    public Query<List<SmtResult>> getQuery() {
        return query;
    }

    @Override
    public String toString() {
        switch (tag) {
            case CASE_SPLIT:
                return "CaseSplit " + flag + " " + cases;
            case CHECK_CASE_VACUITY:
                return "CheckCaseVacuity " + flag;
            case PARALLEL_CASE:
                return "ParallelCase";
            case CHECK_CONSTR_VACUITY:
                return "CheckConstrVacuity " + flag;
            case STOP_AFTER:
                return "StopAfter " + seconds;
            case CHECK_USING:
                return "CheckUsing \"" + command + "\"";
            case USE_SOLVER:
                return "UseSolver " + solverConfig;
            case SET_OPTIONS:
                return "SetOptions " + options;
            case OPTIMIZE_PRIORITY:
                return "OptimizePriority " + style;
            default:
                return "QueryUsing <Query>";
        }
    }
}
