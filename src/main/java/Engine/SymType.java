package Engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import value.Kind;

/**
 * Signature of an uninterpreted declaration: argument kinds followed by the
 * result kind. A constant has exactly one entry.
 */
public final class SymType {

    private final List<Kind> kinds;

    public SymType(List<Kind> kinds) {
        if (kinds.isEmpty()) {
            throw new IllegalArgumentException("Empty signature");
        }
        this.kinds = Collections.unmodifiableList(new ArrayList<>(kinds));
    }

    public static SymType of(Kind... kinds) {
        return new SymType(Arrays.asList(kinds));
    }

    public List<Kind> getKinds() {
        return kinds;
    }

    public Kind getResultKind() {
        return kinds.get(kinds.size() - 1);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SymType && ((SymType) o).kinds.equals(kinds);
    }

    @Override
    public int hashCode() {
        return kinds.hashCode();
    }

    @Override
    public String toString() {
        return kinds.stream().map(Kind::toString).collect(Collectors.joining(" -> "));
    }
}
