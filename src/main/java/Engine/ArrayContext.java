package Engine;

import java.util.Objects;

/**
 * How an array handle was derived. Source handles always precede the handle
 * they produce.
 */
public final class ArrayContext {

    public enum Tag {
        FREE,
        RESET,
        MUTATE,
        MERGE
    }

    private final Tag tag;
    private final int source;
    private final int otherSource;
    private final SymWord first;
    private final SymWord second;

    private ArrayContext(Tag tag, int source, int otherSource, SymWord first, SymWord second) {
        this.tag = tag;
        this.source = source;
        this.otherSource = otherSource;
        this.first = first;
        this.second = second;
    }

    /** A new array, every cell initialized to {@code init} when it is not null. */
    public static ArrayContext free(SymWord init) {
        return new ArrayContext(Tag.FREE, -1, -1, init, null);
    }

    public static ArrayContext reset(int source, SymWord value) {
        return new ArrayContext(Tag.RESET, source, -1, value, null);
    }

    public static ArrayContext mutate(int source, SymWord address, SymWord value) {
        return new ArrayContext(Tag.MUTATE, source, -1, address, value);
    }

    public static ArrayContext merge(SymWord condition, int thenArray, int elseArray) {
        return new ArrayContext(Tag.MERGE, thenArray, elseArray, condition, null);
    }

    public Tag getTag() {
        return tag;
    }

    /** Source handle of a reset/mutate, the then-branch of a merge. */
    public int getSource() {
        return source;
    }

    /** Else-branch handle of a merge. */
    public int getOtherSource() {
        return otherSource;
    }

    /** Initializer, reset value or mutated address. */
    public SymWord getInitializer() {
        return first;
    }

    public SymWord getAddress() {
        return first;
    }

    public SymWord getValue() {
        return tag == Tag.MUTATE ? second : first;
    }

    public SymWord getCondition() {
        return first;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ArrayContext)) return false;
        ArrayContext a = (ArrayContext) o;
        return tag == a.tag && source == a.source && otherSource == a.otherSource
                && Objects.equals(first, a.first) && Objects.equals(second, a.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, source, otherSource, first, second);
    }

    @Override
    public String toString() {
        switch (tag) {
            case FREE:
                return first == null ? " initialized with random elements"
                        : " initialized with " + first + " :: " + first.getKind();
            case RESET:
                return " reset array_" + source + " with " + first + " :: " + first.getKind();
            case MUTATE:
                return " cloned from array_" + source + " with " + first + " :: " + first.getKind()
                        + " |-> " + second + " :: " + second.getKind();
            default:
                return " merged arrays " + source + " and " + otherSource + " on condition " + first;
        }
    }
}
