package value;

import java.util.SplittableRandom;

/**
 * The concrete-value capability consumed by the engine.
 */
public interface ValueDomain {

    ConcreteValue ofBoolean(boolean b);

    /**
     * Draws a value of the given kind; used for variables created while
     * running in concrete mode.
     */
    ConcreteValue randomValue(Kind kind, SplittableRandom rng);
}
