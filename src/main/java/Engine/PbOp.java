package Engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Pseudo-boolean operations. The weighted forms generalize the plain ones.
 */
public final class PbOp {

    public enum Tag {
        AT_MOST("PB_AtMost"),
        AT_LEAST("PB_AtLeast"),
        EXACTLY("PB_Exactly"),
        LE("PB_Le"),
        GE("PB_Ge"),
        EQ("PB_Eq");

        private final String display;

        Tag(String display) {
            this.display = display;
        }
    }

    private final Tag tag;
    private final List<Integer> coefficients;
    private final int bound;

    private PbOp(Tag tag, List<Integer> coefficients, int bound) {
        this.tag = tag;
        this.coefficients = coefficients;
        this.bound = bound;
    }

    public static PbOp atMost(int k) {
        return new PbOp(Tag.AT_MOST, Collections.emptyList(), k);
    }

    public static PbOp atLeast(int k) {
        return new PbOp(Tag.AT_LEAST, Collections.emptyList(), k);
    }

    public static PbOp exactly(int k) {
        return new PbOp(Tag.EXACTLY, Collections.emptyList(), k);
    }

    public static PbOp le(List<Integer> coefficients, int k) {
        return new PbOp(Tag.LE, copy(coefficients), k);
    }

    public static PbOp ge(List<Integer> coefficients, int k) {
        return new PbOp(Tag.GE, copy(coefficients), k);
    }

    public static PbOp eq(List<Integer> coefficients, int k) {
        return new PbOp(Tag.EQ, copy(coefficients), k);
    }

    private static List<Integer> copy(List<Integer> coefficients) {
        return Collections.unmodifiableList(new ArrayList<>(coefficients));
    }

    public Tag getTag() {
        return tag;
    }

    public List<Integer> getCoefficients() {
        return coefficients;
    }

    public int getBound() {
        return bound;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PbOp)) return false;
        PbOp p = (PbOp) o;
        return tag == p.tag && bound == p.bound && coefficients.equals(p.coefficients);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, coefficients, bound);
    }

    @Override
    public String toString() {
        if (coefficients.isEmpty() && (tag == Tag.AT_MOST || tag == Tag.AT_LEAST || tag == Tag.EXACTLY)) {
            return tag.display + " " + bound;
        }
        return tag.display + " " + coefficients + " " + bound;
    }
}
