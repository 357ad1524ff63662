package solver;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Status;
import com.microsoft.z3.Symbol;
import com.microsoft.z3.Z3Exception;

import utils.Log;

/**
 * Query channel backed by an in-process Z3 context. Declarations and
 * assertions are kept as SMT-Lib text in push/pop frames; {@code check-sat}
 * parses the live script into a fresh solver.
 */
public class Z3QueryChannel implements QueryChannel {

    private final Context ctx;
    // head is the innermost frame
    private final Deque<List<String>> frames = new ArrayDeque<>();
    private Solver lastSolver = null;
    private Status lastStatus = null;
    private Integer timeoutMs = null;
    private boolean closed = false;

    public Z3QueryChannel() {
        this(new HashMap<>());
    }

    public Z3QueryChannel(Map<String, String> settings) {
        Map<String, String> cfg = new HashMap<>(settings);
        cfg.putIfAbsent("model", "true");
        this.ctx = new Context(cfg);
        frames.push(new ArrayList<>());
    }

    @Override
    public String ask(String command) {
        if (closed) {
            throw new IllegalStateException("Z3 channel is closed");
        }
        String cmd = command.trim();
        String head = headOf(cmd);
        switch (head) {
            case "set-option":
                return setOption(cmd);
            case "set-logic":
            case "set-info":
                return Queries.SUCCESS;
            case "declare-fun":
            case "declare-const":
            case "define-fun":
            case "declare-sort":
            case "define-sort":
            case "declare-datatypes":
            case "assert":
                return addToScript(cmd);
            case "push":
                for (int i = count(cmd); i > 0; i--) {
                    frames.push(new ArrayList<>());
                }
                return Queries.SUCCESS;
            case "pop":
                int n = count(cmd);
                if (n >= frames.size()) {
                    return error("cannot pop " + n + " level(s), only " + (frames.size() - 1) + " pushed");
                }
                for (int i = 0; i < n; i++) {
                    frames.pop();
                }
                lastSolver = null;
                return Queries.SUCCESS;
            case "check-sat":
                return checkSat();
            case "get-model":
                if (lastStatus != Status.SATISFIABLE) {
                    return error("model is not available");
                }
                return lastSolver.getModel().toString().trim();
            case "get-value":
                return getValue(cmd);
            case "get-info":
                if (cmd.contains(":reason-unknown")) {
                    String reason = lastSolver == null ? "unknown" : lastSolver.getReasonUnknown();
                    return "(:reason-unknown \"" + reason + "\")";
                }
                return error("unsupported info request: " + cmd);
            case "reset":
                frames.clear();
                frames.push(new ArrayList<>());
                lastSolver = null;
                lastStatus = null;
                return Queries.SUCCESS;
            case "exit":
                close();
                return Queries.SUCCESS;
            default:
                return error("unsupported command: " + head);
        }
    }

    private String setOption(String cmd) {
        String[] parts = cmd.substring(1, cmd.length() - 1).trim().split("\\s+");
        if (parts.length >= 3 && parts[1].equals(":timeout")) {
            try {
                timeoutMs = Integer.parseInt(parts[2]);
            } catch (NumberFormatException e) {
                return error("bad timeout: " + parts[2]);
            }
        }
        return Queries.SUCCESS;
    }

    private String addToScript(String cmd) {
        List<String> top = frames.peek();
        top.add(cmd);
        try {
            parse(script());
        } catch (Z3Exception e) {
            top.remove(top.size() - 1);
            Log.debug("Z3 rejected " + cmd + ": " + e.getMessage());
            return error(e.getMessage());
        }
        lastSolver = null;
        return Queries.SUCCESS;
    }

    private String checkSat() {
        Solver s = ctx.mkSolver();
        if (timeoutMs != null) {
            Params p = ctx.mkParams();
            p.add("timeout", timeoutMs);
            s.setParameters(p);
        }
        try {
            s.add(parse(script()));
        } catch (Z3Exception e) {
            return error(e.getMessage());
        }
        Status st = s.check();
        lastSolver = s;
        lastStatus = st;
        switch (st) {
            case SATISFIABLE:
                return "sat";
            case UNSATISFIABLE:
                return "unsat";
            default:
                return "unknown";
        }
    }

    /** Only simple names are supported: {@code (get-value (x y))}. */
    private String getValue(String cmd) {
        if (lastStatus != Status.SATISFIABLE || lastSolver == null) {
            return error("model is not available");
        }
        int open = cmd.indexOf('(', 1);
        int close = cmd.lastIndexOf(')', cmd.length() - 2);
        if (open < 0 || close <= open) {
            return error("malformed get-value: " + cmd);
        }
        Model m = lastSolver.getModel();
        StringBuilder sb = new StringBuilder("(");
        for (String nm : cmd.substring(open + 1, close).trim().split("\\s+")) {
            Expr<?> term;
            try {
                term = termOf(nm);
            } catch (Z3Exception e) {
                return error(e.getMessage());
            }
            if (sb.length() > 1) {
                sb.append(' ');
            }
            sb.append('(').append(nm).append(' ').append(m.eval(term, true)).append(')');
        }
        return sb.append(')').toString();
    }

    // recovers the term for a name by parsing a throwaway assertion that mentions it
    private Expr<?> termOf(String name) {
        BoolExpr[] fs = parse(script() + "\n(assert (= " + name + " " + name + "))");
        return fs[fs.length - 1].getArgs()[0];
    }

    private BoolExpr[] parse(String script) {
        return ctx.parseSMTLIB2String(script, new Symbol[0], new Sort[0], new Symbol[0], new FuncDecl[0]);
    }

    private String script() {
        StringBuilder sb = new StringBuilder();
        Iterator<List<String>> it = frames.descendingIterator();
        while (it.hasNext()) {
            for (String l : it.next()) {
                sb.append(l).append('\n');
            }
        }
        return sb.toString();
    }

    /** Number of frames assertions live in, the base frame included. */
    public int getFrameCount() {
        return frames.size();
    }

    static String headOf(String cmd) {
        if (!cmd.startsWith("(") || !cmd.endsWith(")")) {
            return "";
        }
        String body = cmd.substring(1).trim();
        int end = 0;
        while (end < body.length() && !Character.isWhitespace(body.charAt(end))
                && body.charAt(end) != '(' && body.charAt(end) != ')') {
            end++;
        }
        return body.substring(0, end);
    }

    private static int count(String cmd) {
        String body = cmd.substring(1, cmd.length() - 1).trim();
        String[] parts = body.split("\\s+");
        if (parts.length < 2) {
            return 1;
        }
        return Integer.parseInt(parts[1]);
    }

    private static String error(String msg) {
        return "(error \"" + msg.replace("\"", "'") + "\")";
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            ctx.close();
        }
    }
}
