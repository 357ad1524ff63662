package value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Sort descriptor of a symbolic or concrete value.
 * Ordered by family first, then signedness, width and sort name.
 */
public final class Kind implements Comparable<Kind> {

    public enum Family {
        BOOL,
        BOUNDED,
        UNBOUNDED,
        REAL,
        FLOAT,
        DOUBLE,
        USER_SORT
    }

    public static final Kind BOOL = new Kind(Family.BOOL, false, 1, null, null);
    public static final Kind INTEGER = new Kind(Family.UNBOUNDED, true, 0, null, null);
    public static final Kind REAL = new Kind(Family.REAL, true, 0, null, null);
    public static final Kind FLOAT = new Kind(Family.FLOAT, true, 32, null, null);
    public static final Kind DOUBLE = new Kind(Family.DOUBLE, true, 64, null, null);

    private final Family family;
    private final boolean signed;
    private final int width;
    private final String sortName;
    // null for a fully uninterpreted sort
    private final List<String> enumValues;

    private Kind(Family family, boolean signed, int width, String sortName, List<String> enumValues) {
        this.family = family;
        this.signed = signed;
        this.width = width;
        this.sortName = sortName;
        this.enumValues = enumValues;
    }

    public static Kind bounded(boolean signed, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("Bit-vector width must be positive: " + width);
        }
        return new Kind(Family.BOUNDED, signed, width, null, null);
    }

    public static Kind word(int width) {
        return bounded(false, width);
    }

    public static Kind signedWord(int width) {
        return bounded(true, width);
    }

    public static Kind userSort(String name) {
        return new Kind(Family.USER_SORT, false, 0, Objects.requireNonNull(name), null);
    }

    public static Kind enumeratedSort(String name, List<String> values) {
        return new Kind(Family.USER_SORT, false, 0, Objects.requireNonNull(name),
                Collections.unmodifiableList(new ArrayList<>(values)));
    }

    public Family getFamily() {
        return family;
    }

    public boolean isBoolean() {
        return family == Family.BOOL;
    }

    public boolean isBounded() {
        return family == Family.BOUNDED;
    }

    public boolean isSigned() {
        return signed;
    }

    public int getWidth() {
        return width;
    }

    public boolean isFloatingPoint() {
        return family == Family.FLOAT || family == Family.DOUBLE;
    }

    public boolean isUserSort() {
        return family == Family.USER_SORT;
    }

    public String getSortName() {
        return sortName;
    }

    public List<String> getEnumValues() {
        return enumValues;
    }

    @Override
    public int compareTo(Kind o) {
        int c = family.compareTo(o.family);
        if (c != 0) return c;
        c = Boolean.compare(signed, o.signed);
        if (c != 0) return c;
        c = Integer.compare(width, o.width);
        if (c != 0) return c;
        if (sortName == null || o.sortName == null) {
            return 0;
        }
        return sortName.compareTo(o.sortName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Kind)) return false;
        Kind k = (Kind) o;
        return family == k.family && signed == k.signed && width == k.width
                && Objects.equals(sortName, k.sortName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(family, signed, width, sortName);
    }

    @Override
    public String toString() {
        switch (family) {
            case BOOL:
                return "SBool";
            case BOUNDED:
                return (signed ? "SInt" : "SWord") + width;
            case UNBOUNDED:
                return "SInteger";
            case REAL:
                return "SReal";
            case FLOAT:
                return "SFloat";
            case DOUBLE:
                return "SDouble";
            default:
                return sortName;
        }
    }
}
