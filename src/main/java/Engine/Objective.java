package Engine;

import java.util.Objects;
import java.util.function.Function;

/**
 * Minimize, maximize, or soft-assert a value.
 */
public final class Objective<T> {

    public enum Tag {
        MINIMIZE("Minimize"),
        MAXIMIZE("Maximize"),
        ASSERT_SOFT("AssertSoft");

        private final String display;

        Tag(String display) {
            this.display = display;
        }
    }

    private final Tag tag;
    private final String name;
    private final T value;
    private final Penalty penalty;

    private Objective(Tag tag, String name, T value, Penalty penalty) {
        this.tag = tag;
        this.name = Objects.requireNonNull(name);
        this.value = value;
        this.penalty = penalty;
    }

    public static <T> Objective<T> minimize(String name, T value) {
        return new Objective<>(Tag.MINIMIZE, name, value, null);
    }

    public static <T> Objective<T> maximize(String name, T value) {
        return new Objective<>(Tag.MAXIMIZE, name, value, null);
    }

    public static <T> Objective<T> assertSoft(String name, T value, Penalty penalty) {
        return new Objective<>(Tag.ASSERT_SOFT, name, value, penalty == null ? Penalty.DEFAULT : penalty);
    }

    public <R> Objective<R> map(Function<? super T, ? extends R> f) {
        return new Objective<>(tag, name, f.apply(value), penalty);
    }

    public Tag getTag() {
        return tag;
    }

    public String getName() {
        return name;
    }

    public T getValue() {
        return value;
    }

    /** Only soft assertions carry a penalty. */
    public Penalty getPenalty() {
        return penalty;
    }

    @Override
    public String toString() {
        String s = tag.display + " \"" + name + "\" " + value;
        return penalty == null ? s : s + " " + penalty;
    }
}
