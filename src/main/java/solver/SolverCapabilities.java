package solver;

import java.util.ArrayList;
import java.util.List;

/**
 * What a solver can do. Only the flags that decide whether an operation is
 * legal are read while building; the rest travel to the back end as is.
 */
public final class SolverCapabilities {

    private final boolean defineFun;
    private final boolean produceModels;
    private final boolean quantifiers;
    private final boolean uninterpretedSorts;
    private final boolean unboundedInts;
    private final boolean reals;
    private final boolean floats;
    private final boolean doubles;
    private final boolean optimization;
    private final boolean pseudoBooleans;
    private final boolean unsatCores;
    private final boolean proofs;
    private final boolean customQueries;

    private SolverCapabilities(Builder b) {
        this.defineFun = b.defineFun;
        this.produceModels = b.produceModels;
        this.quantifiers = b.quantifiers;
        this.uninterpretedSorts = b.uninterpretedSorts;
        this.unboundedInts = b.unboundedInts;
        this.reals = b.reals;
        this.floats = b.floats;
        this.doubles = b.doubles;
        this.optimization = b.optimization;
        this.pseudoBooleans = b.pseudoBooleans;
        this.unsatCores = b.unsatCores;
        this.proofs = b.proofs;
        this.customQueries = b.customQueries;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Published capabilities of each known solver. */
    public static SolverCapabilities of(SolverKind kind) {
        switch (kind) {
            case Z3:
                return builder().defineFun(true).produceModels(true).quantifiers(true).uninterpretedSorts(true)
                        .unboundedInts(true).reals(true).floats(true).doubles(true).optimization(true)
                        .pseudoBooleans(true).unsatCores(true).proofs(true).customQueries(true).build();
            case YICES:
                return builder().defineFun(true).produceModels(true).uninterpretedSorts(true)
                        .unboundedInts(true).reals(true).unsatCores(true).customQueries(true).build();
            case BOOLECTOR:
                return builder().defineFun(true).produceModels(true).customQueries(true).build();
            case CVC4:
                return builder().defineFun(true).produceModels(true).quantifiers(true).uninterpretedSorts(true)
                        .unboundedInts(true).reals(true).floats(true).doubles(true).unsatCores(true)
                        .customQueries(true).build();
            case MATHSAT:
                return builder().defineFun(true).produceModels(true).uninterpretedSorts(true)
                        .unboundedInts(true).reals(true).floats(true).doubles(true).unsatCores(true)
                        .proofs(true).customQueries(true).build();
            case ABC:
                return builder().defineFun(true).produceModels(true).build();
            default:
                throw new IllegalArgumentException("Unknown solver: " + kind);
        }
    }

    public boolean supportsDefineFun() {
        return defineFun;
    }

    public boolean supportsProduceModels() {
        return produceModels;
    }

    public boolean supportsQuantifiers() {
        return quantifiers;
    }

    public boolean supportsUninterpretedSorts() {
        return uninterpretedSorts;
    }

    public boolean supportsUnboundedInts() {
        return unboundedInts;
    }

    public boolean supportsReals() {
        return reals;
    }

    public boolean supportsFloats() {
        return floats;
    }

    public boolean supportsDoubles() {
        return doubles;
    }

    public boolean supportsOptimization() {
        return optimization;
    }

    public boolean supportsPseudoBooleans() {
        return pseudoBooleans;
    }

    public boolean supportsUnsatCores() {
        return unsatCores;
    }

    public boolean supportsProofs() {
        return proofs;
    }

    public boolean supportsCustomQueries() {
        return customQueries;
    }

    @Override
    public String toString() {
        List<String> on = new ArrayList<>();
        if (defineFun) on.add("define-fun");
        if (produceModels) on.add("models");
        if (quantifiers) on.add("quantifiers");
        if (uninterpretedSorts) on.add("uninterpreted-sorts");
        if (unboundedInts) on.add("unbounded-ints");
        if (reals) on.add("reals");
        if (floats) on.add("floats");
        if (doubles) on.add("doubles");
        if (optimization) on.add("optimization");
        if (pseudoBooleans) on.add("pseudo-booleans");
        if (unsatCores) on.add("unsat-cores");
        if (proofs) on.add("proofs");
        if (customQueries) on.add("custom-queries");
        return "Capabilities" + on;
    }

    public static final class Builder {
        private boolean defineFun;
        private boolean produceModels;
        private boolean quantifiers;
        private boolean uninterpretedSorts;
        private boolean unboundedInts;
        private boolean reals;
        private boolean floats;
        private boolean doubles;
        private boolean optimization;
        private boolean pseudoBooleans;
        private boolean unsatCores;
        private boolean proofs;
        private boolean customQueries;

        private Builder() {
        }

        public Builder defineFun(boolean b) {
            defineFun = b;
            return this;
        }

        public Builder produceModels(boolean b) {
            produceModels = b;
            return this;
        }

        public Builder quantifiers(boolean b) {
            quantifiers = b;
            return this;
        }

        public Builder uninterpretedSorts(boolean b) {
            uninterpretedSorts = b;
            return this;
        }

        public Builder unboundedInts(boolean b) {
            unboundedInts = b;
            return this;
        }

        public Builder reals(boolean b) {
            reals = b;
            return this;
        }

        public Builder floats(boolean b) {
            floats = b;
            return this;
        }

        public Builder doubles(boolean b) {
            doubles = b;
            return this;
        }

        public Builder optimization(boolean b) {
            optimization = b;
            return this;
        }

        public Builder pseudoBooleans(boolean b) {
            pseudoBooleans = b;
            return this;
        }

        public Builder unsatCores(boolean b) {
            unsatCores = b;
            return this;
        }

        public Builder proofs(boolean b) {
            proofs = b;
            return this;
        }

        public Builder customQueries(boolean b) {
            customQueries = b;
            return this;
        }

        public SolverCapabilities build() {
            return new SolverCapabilities(this);
        }
    }
}
