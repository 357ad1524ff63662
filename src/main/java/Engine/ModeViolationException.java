package Engine;

/**
 * An operation that the current {@link RunMode} does not permit.
 */
public class ModeViolationException extends SymbolicException {

    private final RunMode mode;

    public ModeViolationException(RunMode mode, String message) {
        super(message + " [mode: " + mode + "]");
        this.mode = mode;
    }

    public RunMode getMode() {
        return mode;
    }
}
