package Engine;

import utils.Log;
import value.SimpleValueDomain;
import value.ValueDomain;

/**
 * Entry points that run a construction in a fresh context and freeze it.
 */
public final class Symbolic {

    /** A user construction over a context. */
    @FunctionalInterface
    public interface SymbolicComputation<T> {
        T run(SimState st);
    }

    /** What a run produced: the computation's value, the frozen result, and the final context. */
    public static final class SymbolicRun<T> {
        private final T value;
        private final Result result;
        private final SimState state;

        SymbolicRun(T value, Result result, SimState state) {
            this.value = value;
            this.result = result;
            this.state = state;
        }

        public T getValue() {
            return value;
        }

        public Result getResult() {
            return result;
        }

        public SimState getState() {
            return state;
        }
    }

    private Symbolic() {
    }

    public static Result runSymbolic(RunMode mode, SymbolicComputation<?> comp) {
        return runSymbolicWithState(mode, SimpleValueDomain.INSTANCE, comp).getResult();
    }

    public static <T> SymbolicRun<T> runSymbolicPrime(RunMode mode, SymbolicComputation<T> comp) {
        return runSymbolicWithState(mode, SimpleValueDomain.INSTANCE, comp);
    }

    /**
     * Runs {@code comp} in a fresh context and extracts the result. The
     * context is handed back for callers that keep interacting with it.
     */
    public static <T> SymbolicRun<T> runSymbolicWithState(RunMode mode, ValueDomain domain,
                                                          SymbolicComputation<T> comp) {
        long start = System.currentTimeMillis();
        Log.info("Symbolic run started: " + mode);
        SimState st = SimState.newState(mode, domain);
        T v = comp.run(st);
        Result r = extractSymbolicSimulationState(st);
        Log.info("Symbolic run finished in " + (System.currentTimeMillis() - start) + "ms, "
                + r.getProgram().size() + " assignment(s)");
        return new SymbolicRun<>(v, r, st);
    }

    /** A live context for incremental rounds; nothing is extracted yet. */
    public static SimState startSymbolic(RunMode mode, ValueDomain domain) {
        Log.info("Starting a live context: " + mode);
        return SimState.newState(mode, domain);
    }

    public static SimState startSymbolic(RunMode mode) {
        return startSymbolic(mode, SimpleValueDomain.INSTANCE);
    }

    public static Result extractSymbolicSimulationState(SimState st) {
        return st.extract();
    }
}
