package solver;

/** Order in which case-split branch outcomes are reported. */
public enum CaseAggregation {
    /** Branches as they were declared. */
    BRANCH_ORDER,
    /** Branches as they finished; only differs from branch order when run in parallel. */
    COMPLETION_ORDER
}
