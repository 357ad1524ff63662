package Engine;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import value.Kind;

/**
 * Operation tag of an expression node, with the payload some tags carry
 * (shift amounts, extract bounds, table and array handles, cast kinds,
 * uninterpreted names, floating-point and pseudo-boolean sub-operations).
 */
public final class SymOp {

    public enum Tag {
        PLUS("+"),
        TIMES("*"),
        MINUS("-"),
        UNEG("-"),
        ABS("abs"),
        QUOT("quot"),
        REM("rem"),
        EQUAL("=="),
        NOT_EQUAL("/="),
        LESS_THAN("<"),
        GREATER_THAN(">"),
        LESS_EQ("<="),
        GREATER_EQ(">="),
        ITE("if_then_else"),
        AND("&"),
        OR("|"),
        XOR("^"),
        NOT("~"),
        SHL("<<"),
        SHR(">>"),
        ROL("<<<"),
        ROR(">>>"),
        EXTRACT(null),
        JOIN("#"),
        LOOKUP(null),
        ARR_EQ(null),
        ARR_READ(null),
        KIND_CAST(null),
        UNINTERPRETED(null),
        LABEL(null),
        IEEE_FP(null),
        PSEUDO_BOOLEAN(null);

        private final String symbol;

        Tag(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private static final Set<Tag> COMMUTATIVE =
            EnumSet.of(Tag.PLUS, Tag.TIMES, Tag.EQUAL, Tag.NOT_EQUAL, Tag.AND, Tag.OR, Tag.XOR);

    private static final Set<Tag> PLAIN = EnumSet.of(Tag.PLUS, Tag.TIMES, Tag.MINUS, Tag.UNEG, Tag.ABS,
            Tag.QUOT, Tag.REM, Tag.EQUAL, Tag.NOT_EQUAL, Tag.LESS_THAN, Tag.GREATER_THAN, Tag.LESS_EQ,
            Tag.GREATER_EQ, Tag.ITE, Tag.AND, Tag.OR, Tag.XOR, Tag.NOT, Tag.JOIN);

    private static final Map<Tag, SymOp> PLAIN_OPS = new EnumMap<>(Tag.class);

    static {
        for (Tag t : PLAIN) {
            PLAIN_OPS.put(t, new SymOp(t, new int[0], new Kind[0], new SymWord[0], null, null, null));
        }
    }

    private final Tag tag;
    private final int[] ints;
    private final Kind[] kinds;
    private final SymWord[] words;
    private final String name;
    private final FpOp fpOp;
    private final PbOp pbOp;

    private SymOp(Tag tag, int[] ints, Kind[] kinds, SymWord[] words, String name, FpOp fpOp, PbOp pbOp) {
        this.tag = tag;
        this.ints = ints;
        this.kinds = kinds;
        this.words = words;
        this.name = name;
        this.fpOp = fpOp;
        this.pbOp = pbOp;
    }

    /** Operations without payload. */
    public static SymOp of(Tag tag) {
        SymOp op = PLAIN_OPS.get(tag);
        if (op == null) {
            throw new IllegalArgumentException("Operation " + tag + " carries a payload, use its factory");
        }
        return op;
    }

    public static SymOp shl(int amount) {
        return withInts(Tag.SHL, amount);
    }

    public static SymOp shr(int amount) {
        return withInts(Tag.SHR, amount);
    }

    public static SymOp rol(int amount) {
        return withInts(Tag.ROL, amount);
    }

    public static SymOp ror(int amount) {
        return withInts(Tag.ROR, amount);
    }

    /** Bits {@code hi} down to {@code lo}; bit 0 is the least significant. */
    public static SymOp extract(int hi, int lo) {
        return withInts(Tag.EXTRACT, hi, lo);
    }

    public static SymOp lookup(int tableIndex, Kind indexKind, Kind resultKind, int length,
                               SymWord index, SymWord outOfBounds) {
        return new SymOp(Tag.LOOKUP, new int[]{tableIndex, length}, new Kind[]{indexKind, resultKind},
                new SymWord[]{index, outOfBounds}, null, null, null);
    }

    public static SymOp arrayEquals(int left, int right) {
        return withInts(Tag.ARR_EQ, left, right);
    }

    public static SymOp arrayRead(int array) {
        return withInts(Tag.ARR_READ, array);
    }

    public static SymOp kindCast(Kind from, Kind to) {
        return new SymOp(Tag.KIND_CAST, new int[0], new Kind[]{from, to}, new SymWord[0], null, null, null);
    }

    public static SymOp uninterpreted(String name) {
        return new SymOp(Tag.UNINTERPRETED, new int[0], new Kind[0], new SymWord[0],
                Objects.requireNonNull(name), null, null);
    }

    public static SymOp label(String text) {
        return new SymOp(Tag.LABEL, new int[0], new Kind[0], new SymWord[0],
                Objects.requireNonNull(text), null, null);
    }

    public static SymOp ieeeFp(FpOp op) {
        return new SymOp(Tag.IEEE_FP, new int[0], new Kind[0], new SymWord[0], null,
                Objects.requireNonNull(op), null);
    }

    public static SymOp pseudoBoolean(PbOp op) {
        return new SymOp(Tag.PSEUDO_BOOLEAN, new int[0], new Kind[0], new SymWord[0], null, null,
                Objects.requireNonNull(op));
    }

    private static SymOp withInts(Tag tag, int... ints) {
        return new SymOp(tag, ints, new Kind[0], new SymWord[0], null, null, null);
    }

    public Tag getTag() {
        return tag;
    }

    public boolean isCommutative() {
        return COMMUTATIVE.contains(tag);
    }

    /** Shift or rotate amount. */
    public int getAmount() {
        return ints[0];
    }

    public int getExtractHigh() {
        return ints[0];
    }

    public int getExtractLow() {
        return ints[1];
    }

    public int getTableIndex() {
        return ints[0];
    }

    public int getTableLength() {
        return ints[1];
    }

    /** Array handle of a read, or the left handle of an array equality. */
    public int getArray() {
        return ints[0];
    }

    public int getOtherArray() {
        return ints[1];
    }

    public Kind getFromKind() {
        return kinds[0];
    }

    public Kind getToKind() {
        return kinds[1];
    }

    public SymWord getLookupIndex() {
        return words[0];
    }

    public SymWord getLookupDefault() {
        return words[1];
    }

    public String getName() {
        return name;
    }

    public FpOp getFpOp() {
        return fpOp;
    }

    public PbOp getPbOp() {
        return pbOp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymOp)) return false;
        SymOp s = (SymOp) o;
        return tag == s.tag && Arrays.equals(ints, s.ints) && Arrays.equals(kinds, s.kinds)
                && Arrays.equals(words, s.words) && Objects.equals(name, s.name)
                && Objects.equals(fpOp, s.fpOp) && Objects.equals(pbOp, s.pbOp);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(tag, name, fpOp, pbOp);
        h = 31 * h + Arrays.hashCode(ints);
        h = 31 * h + Arrays.hashCode(kinds);
        return 31 * h + Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        switch (tag) {
            case SHL:
            case SHR:
            case ROL:
            case ROR:
                return tag.symbol + ints[0];
            case EXTRACT:
                return "choose [" + ints[0] + ":" + ints[1] + "]";
            case LOOKUP:
                return "lookup(table" + ints[0] + "(" + kinds[0] + " -> " + kinds[1] + ", " + ints[1] + "), "
                        + words[0] + ", " + words[1] + ")";
            case ARR_EQ:
                return "array_" + ints[0] + " == array_" + ints[1];
            case ARR_READ:
                return "select array_" + ints[0];
            case KIND_CAST:
                return "cast_" + kinds[0] + "_" + kinds[1];
            case UNINTERPRETED:
                return "[uninterpreted] " + name;
            case LABEL:
                return "[label] " + name;
            case IEEE_FP:
                return fpOp.toString();
            case PSEUDO_BOOLEAN:
                return pbOp.toString();
            default:
                return tag.symbol;
        }
    }
}
