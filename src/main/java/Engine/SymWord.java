package Engine;

import value.Kind;

/**
 * A typed reference to one node of the expression graph.
 * Equality is by node id alone; ordering is by id, then kind.
 */
public final class SymWord implements Comparable<SymWord> {

    public static final int FALSE_ID = 1;
    public static final int TRUE_ID = 2;

    public static final SymWord FALSE = new SymWord(Kind.BOOL, FALSE_ID);
    public static final SymWord TRUE = new SymWord(Kind.BOOL, TRUE_ID);

    private final Kind kind;
    private final int id;

    public SymWord(Kind kind, int id) {
        this.kind = kind;
        this.id = id;
    }

    public Kind getKind() {
        return kind;
    }

    public int getId() {
        return id;
    }

    @Override
    public int compareTo(SymWord o) {
        int c = Integer.compare(id, o.id);
        return c != 0 ? c : kind.compareTo(o.kind);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SymWord && ((SymWord) o).id == id;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(id);
    }

    @Override
    public String toString() {
        return "s" + id;
    }
}
