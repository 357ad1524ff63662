package solver;

import Engine.SimState;

/**
 * A live query session: the channel, the solver configuration, and the
 * construction context the session keeps extending.
 */
public class QueryState {

    private final QueryChannel channel;
    private final SolverConfig config;
    private final SimState context;
    private final boolean ignoreExitCode;
    private int assertionStackDepth = 0;

    public QueryState(QueryChannel channel, SolverConfig config, SimState context) {
        this.channel = channel;
        this.config = config;
        this.context = context;
        this.ignoreExitCode = config.isIgnoreExitCode();
    }

    public QueryChannel getChannel() {
        return channel;
    }

    public SolverConfig getConfig() {
        return config;
    }

    public SimState getContext() {
        return context;
    }

    public boolean isIgnoreExitCode() {
        return ignoreExitCode;
    }

    public int getAssertionStackDepth() {
        return assertionStackDepth;
    }

    void setAssertionStackDepth(int depth) {
        this.assertionStackDepth = depth;
    }
}
