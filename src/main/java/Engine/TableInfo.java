package Engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import value.Kind;

/**
 * A lookup table; doubles as the hash-consing key when the index is ignored.
 */
public final class TableInfo {

    private final int index;
    private final Kind indexKind;
    private final Kind resultKind;
    private final List<SymWord> elements;

    public TableInfo(int index, Kind indexKind, Kind resultKind, List<SymWord> elements) {
        this.index = index;
        this.indexKind = indexKind;
        this.resultKind = resultKind;
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public int getIndex() {
        return index;
    }

    public Kind getIndexKind() {
        return indexKind;
    }

    public Kind getResultKind() {
        return resultKind;
    }

    public List<SymWord> getElements() {
        return elements;
    }

    static final class Key {
        private final Kind indexKind;
        private final Kind resultKind;
        private final List<SymWord> elements;

        Key(Kind indexKind, Kind resultKind, List<SymWord> elements) {
            this.indexKind = indexKind;
            this.resultKind = resultKind;
            this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
        }

        TableInfo toInfo(int index) {
            return new TableInfo(index, indexKind, resultKind, elements);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Key)) return false;
            Key k = (Key) o;
            return indexKind.equals(k.indexKind) && resultKind.equals(k.resultKind) && elements.equals(k.elements);
        }

        @Override
        public int hashCode() {
            return Objects.hash(indexKind, resultKind, elements);
        }
    }

    @Override
    public String toString() {
        return "Table " + index + " : " + indexKind + "->" + resultKind + " = " + elements;
    }
}
