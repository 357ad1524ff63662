package solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import Engine.CaseBranch;
import Engine.Result;
import Engine.SymWord;
import Engine.SymbolicException;
import Engine.Tactic;
import init.Config;
import utils.Log;

/**
 * Solves the branches of the case splits in a result. Branches only ever see
 * the frozen {@link Result}, never a live context, so they can run on a pool
 * when a parallel-case directive is present.
 */
public class CaseSplitExecutor {

    /** Solves one branch against the frozen result. */
    @FunctionalInterface
    public interface BranchSolver {
        SmtResult solve(Result result, CaseBranch<SymWord> branch);
    }

    private final int threads;
    private final CaseAggregation aggregation;

    public CaseSplitExecutor() {
        this(Config.threads, Config.caseAggregation);
    }

    public CaseSplitExecutor(int threads, CaseAggregation aggregation) {
        if (threads <= 0) {
            throw new IllegalArgumentException("Thread count must be positive, got " + threads);
        }
        this.threads = threads;
        this.aggregation = aggregation;
    }

    public static boolean isParallel(Result result) {
        for (Tactic<SymWord> t : result.getTactics()) {
            if (t.isParallelCaseAnywhere()) {
                return true;
            }
        }
        return false;
    }

    /** Branches of every top-level case split, in declaration order. */
    public static List<CaseBranch<SymWord>> branchesOf(Result result) {
        List<CaseBranch<SymWord>> bs = new ArrayList<>();
        for (Tactic<SymWord> t : result.getTactics()) {
            if (t.getTag() == Tactic.Tag.CASE_SPLIT) {
                bs.addAll(t.getCases());
            }
        }
        return bs;
    }

    public List<BranchOutcome> run(Result result, BranchSolver solver) {
        List<CaseBranch<SymWord>> branches = branchesOf(result);
        if (branches.isEmpty()) {
            return Collections.emptyList();
        }
        if (!isParallel(result)) {
            Log.debug("Solving " + branches.size() + " case(s) sequentially");
            List<BranchOutcome> out = new ArrayList<>();
            for (int i = 0; i < branches.size(); i++) {
                out.add(solveOne(result, i, branches.get(i), solver));
            }
            return out;
        }
        return runParallel(result, branches, solver);
    }

    private List<BranchOutcome> runParallel(Result result, List<CaseBranch<SymWord>> branches, BranchSolver solver) {
        int n = Math.min(threads, branches.size());
        Log.debug("Solving " + branches.size() + " case(s) on " + n + " thread(s)");
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                n,
                n,
                0L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
        List<BranchOutcome> completed = Collections.synchronizedList(new ArrayList<>());
        List<Future<BranchOutcome>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < branches.size(); i++) {
                int idx = i;
                CaseBranch<SymWord> b = branches.get(i);
                futures.add(executor.submit(() -> {
                    BranchOutcome o = solveOne(result, idx, b, solver);
                    completed.add(o);
                    return o;
                }));
            }
            List<BranchOutcome> inOrder = new ArrayList<>();
            for (Future<BranchOutcome> f : futures) {
                inOrder.add(f.get());
            }
            if (aggregation == CaseAggregation.COMPLETION_ORDER) {
                synchronized (completed) {
                    return new ArrayList<>(completed);
                }
            }
            return inOrder;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Log.errorStack("Case split interrupted", e);
            throw new SymbolicException("Case split interrupted", e);
        } catch (ExecutionException e) {
            Log.errorStack("Case split branch failed", e);
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new SymbolicException("Case split branch failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    private static BranchOutcome solveOne(Result result, int index, CaseBranch<SymWord> b, BranchSolver solver) {
        long start = System.currentTimeMillis();
        SmtResult r = solver.solve(result, b);
        long elapsed = System.currentTimeMillis() - start;
        Log.debug("Case " + b.getName() + " finished in " + elapsed + "ms");
        return new BranchOutcome(index, b.getName(), b.getCondition(), r, elapsed);
    }
}
