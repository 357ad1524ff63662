package Engine;

/**
 * IEEE-754 rounding modes for floating-point conversions.
 */
public enum RoundingMode {
    ROUND_NEAREST_TIES_TO_EVEN,
    ROUND_NEAREST_TIES_TO_AWAY,
    ROUND_TOWARD_POSITIVE,
    ROUND_TOWARD_NEGATIVE,
    ROUND_TOWARD_ZERO
}
