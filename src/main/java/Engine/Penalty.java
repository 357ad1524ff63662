package Engine;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Penalty for violating a soft assertion. The default is a weight of 1 with no group.
 */
public final class Penalty {

    public static final Penalty DEFAULT = new Penalty(null, null);

    private final BigDecimal weight;
    private final String group;

    private Penalty(BigDecimal weight, String group) {
        this.weight = weight;
        this.group = group;
    }

    public static Penalty of(BigDecimal weight, String group) {
        if (weight.signum() <= 0) {
            throw new ValidationException("Soft assertion penalty must be positive: " + weight);
        }
        return new Penalty(weight, group);
    }

    public boolean isDefault() {
        return weight == null;
    }

    public BigDecimal getWeight() {
        return weight == null ? BigDecimal.ONE : weight;
    }

    public String getGroup() {
        return group;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Penalty)) return false;
        Penalty p = (Penalty) o;
        return Objects.equals(weight, p.weight) && Objects.equals(group, p.group);
    }

    @Override
    public int hashCode() {
        return Objects.hash(weight, group);
    }

    @Override
    public String toString() {
        if (isDefault()) {
            return "DefaultPenalty";
        }
        return "Penalty " + weight + (group == null ? "" : " " + group);
    }
}
