package Engine;

import cache.Cached;
import value.ConcreteValue;
import value.Kind;

/**
 * A value as seen by the user program: either a known constant, or a cached
 * computation that yields a node once it is observed in a context.
 */
public final class SymVal {

    private final Kind kind;
    private final ConcreteValue constant;
    private final Cached<SymWord> computation;

    private SymVal(Kind kind, ConcreteValue constant, Cached<SymWord> computation) {
        this.kind = kind;
        this.constant = constant;
        this.computation = computation;
    }

    public static SymVal constant(ConcreteValue value) {
        return new SymVal(value.getKind(), value, null);
    }

    public static SymVal symbolic(Kind kind, Cached<SymWord> computation) {
        return new SymVal(kind, null, computation);
    }

    /** Wraps a node that already exists. */
    public static SymVal ofWord(SymWord word) {
        return symbolic(word.getKind(), Cached.constant(word));
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isConcrete() {
        return constant != null;
    }

    public ConcreteValue getConstant() {
        return constant;
    }

    public Cached<SymWord> getComputation() {
        return computation;
    }

    /** Interns the constant, or observes the cached computation. */
    public SymWord toSW(SimState st) {
        return st.toSW(this);
    }

    @Override
    public String toString() {
        if (constant != null) {
            return kind.isBoolean() ? constant.toString() : constant + " :: " + kind;
        }
        return "<symbolic> :: " + kind;
    }
}
