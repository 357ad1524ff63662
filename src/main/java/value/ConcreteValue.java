package value;

/**
 * A concrete constant. Implementations must make equality and ordering total
 * and consistent with each other; positive and negative zero compare equal,
 * the engine tells them apart through {@link #isNegativeZero()}.
 */
public interface ConcreteValue extends Comparable<ConcreteValue> {

    Kind getKind();

    boolean isNegativeZero();
}
