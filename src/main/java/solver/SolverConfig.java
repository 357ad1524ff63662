package solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import Engine.RoundingMode;

/**
 * Per-run solver configuration. Setters return this so a configuration can be
 * tweaked inline, e.g. {@code SolverConfig.z3().setTimeout(10).setVerbose(true)}.
 */
public class SolverConfig {

    private final SolverKind kind;
    private String executable;
    private List<String> options = new ArrayList<>();
    private SolverCapabilities capabilities;
    private boolean verbose = false;
    private Integer timeout = null;
    private int printBase = 10;
    private int printRealPrec = 16;
    private String satCmd = "(check-sat)";
    private String smtFile = null;
    private RoundingMode roundingMode = RoundingMode.ROUND_NEAREST_TIES_TO_EVEN;
    private List<String> tweaks = new ArrayList<>();
    private List<String> optimizeArgs = new ArrayList<>();
    private List<String> setOptions = new ArrayList<>();
    private boolean ignoreExitCode = false;

    public SolverConfig(SolverKind kind) {
        this.kind = kind;
        this.executable = kind.getExecutable();
        this.capabilities = SolverCapabilities.of(kind);
    }

    public static SolverConfig z3() {
        return new SolverConfig(SolverKind.Z3).setOptions(List.of("-nw", "-in", "-smt2"));
    }

    public static SolverConfig yices() {
        return new SolverConfig(SolverKind.YICES).setOptions(List.of("--incremental"));
    }

    public static SolverConfig boolector() {
        return new SolverConfig(SolverKind.BOOLECTOR).setOptions(List.of("--smt2", "--smt2-model", "--no-exit-codes", "--incremental"));
    }

    public static SolverConfig cvc4() {
        return new SolverConfig(SolverKind.CVC4).setOptions(List.of("--lang", "smt", "--incremental", "--interactive", "--no-interactive-prompt"));
    }

    public static SolverConfig mathSAT() {
        return new SolverConfig(SolverKind.MATHSAT).setOptions(List.of("-input=smt2", "-theory.fp.minmax_zero_mode=4"));
    }

    public static SolverConfig abc() {
        return new SolverConfig(SolverKind.ABC).setOptions(List.of("-S", "%blast; &sweep -C 5000; &syn4; &cec -s -m -C 2000"));
    }

    public SolverKind getKind() {
        return kind;
    }

    public String getName() {
        return kind.name();
    }

    public String getExecutable() {
        return executable;
    }

    public SolverConfig setExecutable(String executable) {
        this.executable = executable;
        return this;
    }

    public List<String> getOptions() {
        return Collections.unmodifiableList(options);
    }

    public SolverConfig setOptions(List<String> options) {
        this.options = new ArrayList<>(options);
        return this;
    }

    public SolverCapabilities getCapabilities() {
        return capabilities;
    }

    public SolverConfig setCapabilities(SolverCapabilities capabilities) {
        this.capabilities = capabilities;
        return this;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public SolverConfig setVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    /** Seconds, or null for no limit. */
    public Integer getTimeout() {
        return timeout;
    }

    public SolverConfig setTimeout(Integer timeout) {
        this.timeout = timeout;
        return this;
    }

    public int getPrintBase() {
        return printBase;
    }

    public SolverConfig setPrintBase(int printBase) {
        if (printBase != 2 && printBase != 10 && printBase != 16) {
            throw new IllegalArgumentException("Print base must be 2, 10 or 16, got " + printBase);
        }
        this.printBase = printBase;
        return this;
    }

    public int getPrintRealPrec() {
        return printRealPrec;
    }

    public SolverConfig setPrintRealPrec(int printRealPrec) {
        this.printRealPrec = printRealPrec;
        return this;
    }

    public String getSatCmd() {
        return satCmd;
    }

    public SolverConfig setSatCmd(String satCmd) {
        this.satCmd = satCmd;
        return this;
    }

    public String getSmtFile() {
        return smtFile;
    }

    public SolverConfig setSmtFile(String smtFile) {
        this.smtFile = smtFile;
        return this;
    }

    public RoundingMode getRoundingMode() {
        return roundingMode;
    }

    public SolverConfig setRoundingMode(RoundingMode roundingMode) {
        this.roundingMode = roundingMode;
        return this;
    }

    public List<String> getTweaks() {
        return Collections.unmodifiableList(tweaks);
    }

    public SolverConfig setTweaks(List<String> tweaks) {
        this.tweaks = new ArrayList<>(tweaks);
        return this;
    }

    public List<String> getOptimizeArgs() {
        return Collections.unmodifiableList(optimizeArgs);
    }

    public SolverConfig setOptimizeArgs(List<String> optimizeArgs) {
        this.optimizeArgs = new ArrayList<>(optimizeArgs);
        return this;
    }

    /** Extra {@code set-option} lines sent at the start of a session. */
    public List<String> getSetOptions() {
        return Collections.unmodifiableList(setOptions);
    }

    public SolverConfig setSetOptions(List<String> setOptions) {
        this.setOptions = new ArrayList<>(setOptions);
        return this;
    }

    public boolean isIgnoreExitCode() {
        return ignoreExitCode;
    }

    public SolverConfig setIgnoreExitCode(boolean ignoreExitCode) {
        this.ignoreExitCode = ignoreExitCode;
        return this;
    }

    @Override
    public String toString() {
        return getName() + " (" + executable + " " + String.join(" ", options) + ")";
    }
}
