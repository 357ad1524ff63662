package solver;

/** A user query run against a live solver session. */
@FunctionalInterface
public interface Query<T> {

    T run(QueryState qs);
}
