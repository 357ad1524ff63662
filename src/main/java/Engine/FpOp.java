package Engine;

import java.util.Objects;

import value.Kind;

/**
 * IEEE-754 operations. Names render as their SMT-Lib counterparts.
 */
public final class FpOp {

    public enum Tag {
        CAST(null),
        REINTERPRET(null),
        ABS("fp.abs"),
        NEG("fp.neg"),
        ADD("fp.add"),
        SUB("fp.sub"),
        MUL("fp.mul"),
        DIV("fp.div"),
        FMA("fp.fma"),
        SQRT("fp.sqrt"),
        REM("fp.rem"),
        ROUND_TO_INTEGRAL("fp.roundToIntegral"),
        MIN("fp.min"),
        MAX("fp.max"),
        OBJ_EQUAL("="),
        IS_NORMAL("fp.isNormal"),
        IS_SUBNORMAL("fp.isSubnormal"),
        IS_ZERO("fp.isZero"),
        IS_INFINITE("fp.isInfinite"),
        IS_NAN("fp.isNaN"),
        IS_NEGATIVE("fp.isNegative"),
        IS_POSITIVE("fp.isPositive");

        private final String smtName;

        Tag(String smtName) {
            this.smtName = smtName;
        }
    }

    private final Tag tag;
    private final Kind from;
    private final Kind to;
    private final SymWord roundingMode;

    private FpOp(Tag tag, Kind from, Kind to, SymWord roundingMode) {
        this.tag = tag;
        this.from = from;
        this.to = to;
        this.roundingMode = roundingMode;
    }

    public static FpOp of(Tag tag) {
        if (tag == Tag.CAST || tag == Tag.REINTERPRET) {
            throw new IllegalArgumentException(tag + " needs source and target kinds");
        }
        return new FpOp(tag, null, null, null);
    }

    /** Value conversion, rounding with the mode held in {@code roundingMode}. */
    public static FpOp cast(Kind from, Kind to, SymWord roundingMode) {
        return new FpOp(Tag.CAST, from, to, roundingMode);
    }

    /** Bit reinterpretation through the IEEE-754 interchange format. */
    public static FpOp reinterpret(Kind from, Kind to) {
        return new FpOp(Tag.REINTERPRET, from, to, null);
    }

    public Tag getTag() {
        return tag;
    }

    public Kind getFrom() {
        return from;
    }

    public Kind getTo() {
        return to;
    }

    public SymWord getRoundingMode() {
        return roundingMode;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FpOp)) return false;
        FpOp f = (FpOp) o;
        return tag == f.tag && Objects.equals(from, f.from) && Objects.equals(to, f.to)
                && Objects.equals(roundingMode, f.roundingMode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, from, to, roundingMode);
    }

    @Override
    public String toString() {
        if (tag == Tag.CAST) {
            return "(FP_Cast: " + from + " -> " + to + ", using RM [" + roundingMode + "])";
        }
        if (tag == Tag.REINTERPRET) {
            if (from.equals(Kind.word(32)) && to.equals(Kind.FLOAT)) {
                return "(_ to_fp 8 24)";
            }
            if (from.equals(Kind.word(64)) && to.equals(Kind.DOUBLE)) {
                return "(_ to_fp 11 53)";
            }
            throw new IllegalStateException("Unexpected reinterpretation: " + from + " to " + to);
        }
        return tag.smtName;
    }
}
