package Engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import value.ConcreteValue;

/**
 * What an interactive round added since the previous round started: new
 * constants and new assignments, in creation order.
 */
public final class IncState {

    /** The delta of one round together with what the round computed. */
    public static final class Round<T> {
        private final IncState delta;
        private final T value;

        Round(IncState delta, T value) {
            this.delta = delta;
            this.value = value;
        }

        public IncState getDelta() {
            return delta;
        }

        public T getValue() {
            return value;
        }
    }

    private final Map<SymWord, ConcreteValue> newConsts = new LinkedHashMap<>();
    private final SymProgram newAsgns = new SymProgram();

    void recordConst(ConcreteValue value, SymWord word) {
        newConsts.put(word, value);
    }

    void recordAssignment(SymWord word, SymExpr expr) {
        newAsgns.append(word, expr);
    }

    public Map<SymWord, ConcreteValue> getNewConsts() {
        return Collections.unmodifiableMap(newConsts);
    }

    public SymProgram getNewAsgns() {
        return newAsgns;
    }

    public boolean isEmpty() {
        return newConsts.isEmpty() && newAsgns.isEmpty();
    }
}
