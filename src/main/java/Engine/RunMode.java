package Engine;

import solver.SolverConfig;

/**
 * How a symbolic computation is being run. Proof and interactive runs carry a
 * flag telling satisfiability search (existential default) from theorem
 * proving (universal default); concrete runs carry the seed of their
 * generator.
 */
public final class RunMode {

    public enum Tag {
        PROOF,
        INTERACTIVE,
        CODE_GEN,
        CONCRETE
    }

    private static final RunMode CODE_GEN = new RunMode(Tag.CODE_GEN, false, null, 0L);

    private final Tag tag;
    private final boolean sat;
    private final SolverConfig config;
    private final long seed;

    private RunMode(Tag tag, boolean sat, SolverConfig config, long seed) {
        this.tag = tag;
        this.sat = sat;
        this.config = config;
        this.seed = seed;
    }

    public static RunMode proof(boolean isSat, SolverConfig config) {
        return new RunMode(Tag.PROOF, isSat, config, 0L);
    }

    public static RunMode interactive(boolean isSat, SolverConfig config) {
        return new RunMode(Tag.INTERACTIVE, isSat, config, 0L);
    }

    public static RunMode codeGen() {
        return CODE_GEN;
    }

    public static RunMode concrete(long seed) {
        return new RunMode(Tag.CONCRETE, false, null, seed);
    }

    public Tag getTag() {
        return tag;
    }

    public boolean isSat() {
        return sat;
    }

    /** Null outside proof and interactive runs. */
    public SolverConfig getConfig() {
        return config;
    }

    public long getSeed() {
        return seed;
    }

    public boolean isProof() {
        return tag == Tag.PROOF;
    }

    public boolean isInteractive() {
        return tag == Tag.INTERACTIVE;
    }

    public boolean isCodeGen() {
        return tag == Tag.CODE_GEN;
    }

    public boolean isConcrete() {
        return tag == Tag.CONCRETE;
    }

    /** Same solver settings, interactive from now on. Only proof runs may switch. */
    RunMode toInteractive() {
        return new RunMode(Tag.INTERACTIVE, sat, config, seed);
    }

    @Override
    public String toString() {
        switch (tag) {
            case PROOF:
            case INTERACTIVE:
                return sat ? "Satisfiability" : "Proof";
            case CODE_GEN:
                return "Code generation";
            default:
                return "Concrete evaluation";
        }
    }
}
