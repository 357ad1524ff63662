package solver;

/** Solvers a configuration can name. */
public enum SolverKind {
    Z3("z3"),
    YICES("yices-smt2"),
    BOOLECTOR("boolector"),
    CVC4("cvc4"),
    MATHSAT("mathsat"),
    ABC("abc");

    private final String executable;

    SolverKind(String executable) {
        this.executable = executable;
    }

    /** Default executable name looked up on the path. */
    public String getExecutable() {
        return executable;
    }
}
