package solver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import Engine.HandshakeException;
import Engine.SimState;
import Engine.SymVal;
import Engine.SymbolicException;
import Engine.Tactic;
import Engine.ValidationException;
import utils.Log;

/**
 * Commands of an interactive session. Every command is one synchronous round:
 * it is sent and the single response is awaited before anything else happens.
 */
public final class Queries {

    public static final String HANDSHAKE = "(set-option :print-success true)";
    public static final String SUCCESS = "success";

    private Queries() {
    }

    /**
     * Opens a session over {@code st}. A context still in proof mode is
     * switched to interactive mode here.
     */
    public static QueryState newQueryState(SimState st, QueryChannel channel, SolverConfig config) {
        if (!st.getRunMode().isInteractive()) {
            st.switchToInteractiveMode();
        }
        return new QueryState(channel, config, st);
    }

    /** Registers {@code q} to be run instead of the default solving round. */
    public static void query(SimState st, Query<List<SmtResult>> q) {
        st.addTactic(Tactic.<SymVal>queryUsing(q));
    }

    /**
     * Performs the handshake, sends the configured options and runs the query.
     */
    public static <T> T runQuery(QueryState qs, Query<T> q) {
        String r = ask(qs, HANDSHAKE);
        if (!SUCCESS.equals(r)) {
            HandshakeException e = new HandshakeException(HANDSHAKE, SUCCESS, r);
            Log.error(e.getMessage());
            throw e;
        }
        Log.info("Solver session established with " + qs.getConfig().getName());
        if (qs.getConfig().getTimeout() != null) {
            send(qs, "(set-option :timeout " + qs.getConfig().getTimeout() * 1000 + ")");
        }
        for (String opt : qs.getConfig().getSetOptions()) {
            send(qs, opt);
        }
        return q.run(qs);
    }

    public static String ask(QueryState qs, String command) {
        if (qs.getConfig().isVerbose()) {
            Log.info("[SEND] " + command);
        } else {
            Log.debug("[SEND] " + command);
        }
        String r = qs.getChannel().ask(command);
        r = r == null ? "" : r.trim();
        if (qs.getConfig().isVerbose()) {
            Log.info("[RECV] " + r);
        } else {
            Log.debug("[RECV] " + r);
        }
        return r;
    }

    /** Sends a command whose only acceptable reply is {@code success}. */
    public static void send(QueryState qs, String command) {
        String r = ask(qs, command);
        if (!SUCCESS.equals(r)) {
            throw unexpected(command, SUCCESS, r);
        }
    }

    public static void push(QueryState qs, int n) {
        if (n <= 0) {
            throw new ValidationException("push requires a positive count, got " + n);
        }
        send(qs, "(push " + n + ")");
        qs.setAssertionStackDepth(qs.getAssertionStackDepth() + n);
    }

    public static void pop(QueryState qs, int n) {
        if (n <= 0 || n > qs.getAssertionStackDepth()) {
            throw new ValidationException("Illegal pop " + n + " at assertion stack depth "
                    + qs.getAssertionStackDepth());
        }
        send(qs, "(pop " + n + ")");
        qs.setAssertionStackDepth(qs.getAssertionStackDepth() - n);
    }

    /**
     * Issues {@code check-sat}; when satisfiable, the model holds the values
     * of {@code names}.
     */
    public static SmtResult checkSat(QueryState qs, List<String> names) {
        String r = ask(qs, qs.getConfig().getSatCmd());
        switch (r) {
            case "sat":
                return SmtResult.satisfiable(qs.getConfig(), getValues(qs, names));
            case "unsat":
                return SmtResult.unsatisfiable(qs.getConfig(), null);
            case "unknown":
                String reason = ask(qs, "(get-info :reason-unknown)");
                if (reason.contains("timeout") || reason.contains("canceled")) {
                    return SmtResult.timeOut(qs.getConfig());
                }
                return SmtResult.unknown(qs.getConfig(), SmtModel.empty(), reason);
            default:
                return SmtResult.proofError(qs.getConfig(), List.of("Unexpected response to check-sat:", r));
        }
    }

    /** Asks {@code get-value} once per name. */
    public static SmtModel getValues(QueryState qs, List<String> names) {
        Map<String, String> vals = new LinkedHashMap<>();
        for (String nm : names) {
            String cmd = "(get-value (" + nm + "))";
            String r = ask(qs, cmd);
            vals.put(nm, parseValue(cmd, nm, r));
        }
        return new SmtModel(Map.of(), vals);
    }

    /** Picks the value out of a {@code ((name value))} response. */
    static String parseValue(String cmd, String name, String response) {
        String r = response.trim();
        if (!r.startsWith("((") || !r.endsWith("))")) {
            throw unexpected(cmd, "((" + name + " <value>))", r);
        }
        String inner = r.substring(2, r.length() - 2).trim();
        if (!inner.startsWith(name)) {
            throw unexpected(cmd, "((" + name + " <value>))", r);
        }
        return inner.substring(name.length()).trim();
    }

    private static SymbolicException unexpected(String command, String expected, String received) {
        SymbolicException e = new SymbolicException("Unexpected response from the solver."
                + "\n  Sent     : " + command
                + "\n  Expected : " + expected
                + "\n  Received : " + received);
        Log.error(e.getMessage());
        return e;
    }
}
