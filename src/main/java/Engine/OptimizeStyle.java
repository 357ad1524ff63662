package Engine;

import java.util.Objects;

/**
 * How several objectives are combined. Pareto optimization may carry a limit
 * on the number of fronts requested.
 */
public final class OptimizeStyle {

    public enum Tag {
        LEXICOGRAPHIC,
        INDEPENDENT,
        PARETO
    }

    public static final OptimizeStyle LEXICOGRAPHIC = new OptimizeStyle(Tag.LEXICOGRAPHIC, null);
    public static final OptimizeStyle INDEPENDENT = new OptimizeStyle(Tag.INDEPENDENT, null);

    private final Tag tag;
    private final Integer maxFronts;

    private OptimizeStyle(Tag tag, Integer maxFronts) {
        this.tag = tag;
        this.maxFronts = maxFronts;
    }

    public static OptimizeStyle pareto(Integer maxFronts) {
        return new OptimizeStyle(Tag.PARETO, maxFronts);
    }

    public Tag getTag() {
        return tag;
    }

    /** Null when unbounded. */
    public Integer getMaxFronts() {
        return maxFronts;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof OptimizeStyle)) return false;
        OptimizeStyle s = (OptimizeStyle) o;
        return tag == s.tag && Objects.equals(maxFronts, s.maxFronts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, maxFronts);
    }

    @Override
    public String toString() {
        switch (tag) {
            case LEXICOGRAPHIC:
                return "Lexicographic";
            case INDEPENDENT:
                return "Independent";
            default:
                return "Pareto " + (maxFronts == null ? "Nothing" : "(Just " + maxFronts + ")");
        }
    }
}
