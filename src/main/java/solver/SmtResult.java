package solver;

import java.util.Collections;
import java.util.List;

/** Outcome of one solving round. */
public final class SmtResult {

    public enum Tag {
        UNSATISFIABLE,
        SATISFIABLE,
        SAT_EXT_FIELD,
        UNKNOWN,
        PROOF_ERROR,
        TIME_OUT
    }

    private final Tag tag;
    private final SolverConfig config;
    private final SmtModel model;
    private final List<String> unsatCore;
    private final List<String> reasons;

    private SmtResult(Tag tag, SolverConfig config, SmtModel model, List<String> unsatCore, List<String> reasons) {
        this.tag = tag;
        this.config = config;
        this.model = model;
        this.unsatCore = unsatCore;
        this.reasons = reasons;
    }

    /** {@code unsatCore} may be null when none was requested. */
    public static SmtResult unsatisfiable(SolverConfig config, List<String> unsatCore) {
        return new SmtResult(Tag.UNSATISFIABLE, config, null,
                unsatCore == null ? null : List.copyOf(unsatCore), Collections.emptyList());
    }

    public static SmtResult satisfiable(SolverConfig config, SmtModel model) {
        return new SmtResult(Tag.SATISFIABLE, config, model, null, Collections.emptyList());
    }

    /** Satisfiable in an extension field, for optimization goals that are unbounded. */
    public static SmtResult satExtField(SolverConfig config, SmtModel model) {
        return new SmtResult(Tag.SAT_EXT_FIELD, config, model, null, Collections.emptyList());
    }

    /** The model is the solver's best effort and may be empty. */
    public static SmtResult unknown(SolverConfig config, SmtModel model, String reason) {
        return new SmtResult(Tag.UNKNOWN, config, model, null, List.of(reason));
    }

    public static SmtResult proofError(SolverConfig config, List<String> reasons) {
        return new SmtResult(Tag.PROOF_ERROR, config, null, null, List.copyOf(reasons));
    }

    public static SmtResult timeOut(SolverConfig config) {
        return new SmtResult(Tag.TIME_OUT, config, null, null, Collections.emptyList());
    }

    public Tag getTag() {
        return tag;
    }

    public SolverConfig getConfig() {
        return config;
    }

    public SmtModel getModel() {
        return model;
    }

    public List<String> getUnsatCore() {
        return unsatCore;
    }

    public List<String> getReasons() {
        return reasons;
    }

    public boolean isSatisfiable() {
        return tag == Tag.SATISFIABLE || tag == Tag.SAT_EXT_FIELD;
    }

    @Override
    public String toString() {
        switch (tag) {
            case UNSATISFIABLE:
                return unsatCore == null ? "Unsatisfiable" : "Unsatisfiable. Unsat core: " + unsatCore;
            case SATISFIABLE:
                return "Satisfiable. Model:\n" + model;
            case SAT_EXT_FIELD:
                return "Satisfiable in an extension field. Model:\n" + model;
            case UNKNOWN:
                return "Unknown. Reason: " + String.join(", ", reasons);
            case PROOF_ERROR:
                return "*** Error:\n" + String.join("\n", reasons);
            case TIME_OUT:
                return "Timeout";
            default:
                throw new IllegalStateException("Unhandled outcome " + tag);
        }
    }
}
