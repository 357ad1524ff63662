package solver;

/**
 * Synchronous request/response link to a solver: one command in, one
 * response out.
 */
public interface QueryChannel extends AutoCloseable {

    String ask(String command);

    @Override
    default void close() {
    }
}
