package cache;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import Engine.SimState;

/**
 * A suspended computation over a {@link SimState}, stamped with a token at
 * creation time. Observing it through an {@link IdentityCache} runs it at most
 * once per context; every later observation sees the first result.
 */
public final class Cached<T> {

    private static final AtomicLong TOKENS = new AtomicLong(0);

    private final long token;
    private final Function<SimState, T> computation;

    Cached(long token, Function<SimState, T> computation) {
        this.token = token;
        this.computation = Objects.requireNonNull(computation);
    }

    /** Wraps {@code computation} without running it. */
    public static <T> Cached<T> cache(Function<SimState, T> computation) {
        return new Cached<>(TOKENS.incrementAndGet(), computation);
    }

    /** A computation that ignores the context and always yields {@code value}. */
    public static <T> Cached<T> constant(T value) {
        return cache(st -> value);
    }

    public long getToken() {
        return token;
    }

    /** Bucket the token falls in; distinct tokens may share one. */
    int bucket() {
        return Long.hashCode(token);
    }

    T run(SimState st) {
        return computation.apply(st);
    }

    @Override
    public String toString() {
        return "<cached#" + token + ">";
    }
}
