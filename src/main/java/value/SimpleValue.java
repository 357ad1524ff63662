package value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Reference {@link ConcreteValue}: booleans, bit-vectors and unbounded
 * integers as {@link BigInteger}, reals as {@link BigDecimal}, floats and
 * doubles as themselves, and enumerated sort members as their name.
 */
public final class SimpleValue implements ConcreteValue {

    public static final SimpleValue FALSE = new SimpleValue(Kind.BOOL, Boolean.FALSE);
    public static final SimpleValue TRUE = new SimpleValue(Kind.BOOL, Boolean.TRUE);

    private final Kind kind;
    private final Object value;

    private SimpleValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static SimpleValue ofBoolean(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static SimpleValue ofInteger(Kind kind, long v) {
        return ofInteger(kind, BigInteger.valueOf(v));
    }

    public static SimpleValue ofInteger(Kind kind, BigInteger v) {
        if (kind.getFamily() != Kind.Family.BOUNDED && kind.getFamily() != Kind.Family.UNBOUNDED) {
            throw new IllegalArgumentException("Not an integral kind: " + kind);
        }
        return new SimpleValue(kind, normalize(kind, v));
    }

    public static SimpleValue ofReal(BigDecimal v) {
        return new SimpleValue(Kind.REAL, v.stripTrailingZeros());
    }

    public static SimpleValue ofFloat(float f) {
        return new SimpleValue(Kind.FLOAT, f);
    }

    public static SimpleValue ofDouble(double d) {
        return new SimpleValue(Kind.DOUBLE, d);
    }

    public static SimpleValue ofEnum(Kind kind, String member) {
        if (!kind.isUserSort() || kind.getEnumValues() == null || !kind.getEnumValues().contains(member)) {
            throw new IllegalArgumentException(member + " is not a member of " + kind);
        }
        return new SimpleValue(kind, member);
    }

    // wrap into the representable range of a bounded kind
    private static BigInteger normalize(Kind kind, BigInteger v) {
        if (!kind.isBounded()) {
            return v;
        }
        BigInteger modulus = BigInteger.ONE.shiftLeft(kind.getWidth());
        BigInteger r = v.mod(modulus);
        if (kind.isSigned() && r.testBit(kind.getWidth() - 1)) {
            r = r.subtract(modulus);
        }
        return r;
    }

    @Override
    public Kind getKind() {
        return kind;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean isNegativeZero() {
        if (value instanceof Float f) {
            return f == 0.0f && Float.floatToRawIntBits(f) != 0;
        }
        if (value instanceof Double d) {
            return d == 0.0d && Double.doubleToRawLongBits(d) != 0L;
        }
        return false;
    }

    @Override
    public int compareTo(ConcreteValue o) {
        int c = kind.compareTo(o.getKind());
        if (c != 0 || !(o instanceof SimpleValue)) {
            return c != 0 ? c : getClass().getName().compareTo(o.getClass().getName());
        }
        if (equals(o)) {
            return 0;
        }
        Object other = ((SimpleValue) o).value;
        if (value instanceof Boolean b) {
            return Boolean.compare(b, (Boolean) other);
        }
        if (value instanceof BigInteger i) {
            return i.compareTo((BigInteger) other);
        }
        if (value instanceof BigDecimal r) {
            return r.compareTo((BigDecimal) other);
        }
        if (value instanceof Float f) {
            return Float.compare(f, (Float) other);
        }
        if (value instanceof Double d) {
            return Double.compare(d, (Double) other);
        }
        return value.toString().compareTo(other.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SimpleValue)) return false;
        SimpleValue s = (SimpleValue) o;
        if (!kind.equals(s.kind)) return false;
        if (value instanceof Float f && s.value instanceof Float g) {
            return f.floatValue() == g.floatValue() || (f.isNaN() && g.isNaN());
        }
        if (value instanceof Double d && s.value instanceof Double e) {
            return d.doubleValue() == e.doubleValue() || (d.isNaN() && e.isNaN());
        }
        return Objects.equals(value, s.value);
    }

    @Override
    public int hashCode() {
        if (value instanceof Float f) {
            return Objects.hash(kind, f == 0.0f ? 0.0f : f);
        }
        if (value instanceof Double d) {
            return Objects.hash(kind, d == 0.0d ? 0.0d : d);
        }
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        if (value instanceof Boolean b) {
            return b ? "True" : "False";
        }
        return value.toString();
    }
}
