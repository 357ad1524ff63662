package Engine;

/**
 * Root of the fatal errors raised while building a symbolic program.
 * There is no recovery: the construction that raised it is abandoned.
 */
public class SymbolicException extends RuntimeException {

    public SymbolicException(String message) {
        super(message);
    }

    public SymbolicException(String message, Throwable cause) {
        super(message, cause);
    }
}
