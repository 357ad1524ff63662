package Engine;

/**
 * Malformed names, duplicate names, signature mismatches, out-of-range
 * thresholds.
 */
public class ValidationException extends SymbolicException {

    public ValidationException(String message) {
        super(message);
    }
}
