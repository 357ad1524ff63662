package solver;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import org.junit.Test;

import Engine.HandshakeException;
import Engine.Result;
import Engine.RunMode;
import Engine.SimState;
import Engine.Symbolic;
import Engine.SymbolicException;
import Engine.Tactic;
import Engine.ValidationException;

public class QueryTest {

    /** Replays canned responses and records what was sent. */
    private static final class ScriptedChannel implements QueryChannel {
        private final Deque<String> responses;
        private final List<String> sent = new ArrayList<>();

        ScriptedChannel(String... responses) {
            this.responses = new ArrayDeque<>(Arrays.asList(responses));
        }

        @Override
        public String ask(String command) {
            sent.add(command);
            return responses.isEmpty() ? "success" : responses.poll();
        }
    }

    private static QueryState session(ScriptedChannel ch, SolverConfig cfg) {
        SimState st = Symbolic.startSymbolic(RunMode.proof(true, cfg));
        return Queries.newQueryState(st, ch, cfg);
    }

    @Test
    public void newSessionSwitchesToInteractive() {
        SolverConfig cfg = SolverConfig.z3();
        SimState st = Symbolic.startSymbolic(RunMode.proof(false, cfg));
        QueryState qs = Queries.newQueryState(st, new ScriptedChannel(), cfg);
        assertTrue(st.getRunMode().isInteractive());
        assertEquals(st, qs.getContext());
        assertEquals(0, qs.getAssertionStackDepth());
    }

    @Test
    public void handshakeThenOptionsThenQuery() {
        ScriptedChannel ch = new ScriptedChannel("success", "success", "success", "sat");
        SolverConfig cfg = SolverConfig.z3().setTimeout(2).setSetOptions(List.of("(set-option :produce-models true)"));
        String r = Queries.runQuery(session(ch, cfg), qs -> Queries.ask(qs, "(check-sat)"));
        assertEquals("sat", r);
        assertEquals(List.of(Queries.HANDSHAKE, "(set-option :timeout 2000)",
                "(set-option :produce-models true)", "(check-sat)"), ch.sent);
    }

    @Test
    public void failedHandshakeStopsTheSession() {
        ScriptedChannel ch = new ScriptedChannel("(error \"unsupported\")");
        HandshakeException e = assertThrows(HandshakeException.class,
                () -> Queries.runQuery(session(ch, SolverConfig.z3()), qs -> "never"));
        assertEquals(Queries.HANDSHAKE, e.getSent());
        assertEquals(Queries.SUCCESS, e.getExpected());
        assertEquals("(error \"unsupported\")", e.getReceived());
        assertTrue(e.getMessage().startsWith("Failed to establish the solver session."));
        assertEquals(1, ch.sent.size());
    }

    @Test
    public void sendRejectsAnythingButSuccess() {
        QueryState qs = session(new ScriptedChannel("  success \n", "unsupported"), SolverConfig.z3());
        Queries.send(qs, "(set-logic ALL)");
        SymbolicException e = assertThrows(SymbolicException.class, () -> Queries.send(qs, "(set-logic FOO)"));
        assertTrue(e.getMessage().contains("Received : unsupported"));
    }

    @Test
    public void pushAndPopTrackDepth() {
        ScriptedChannel ch = new ScriptedChannel();
        QueryState qs = session(ch, SolverConfig.z3());
        Queries.push(qs, 2);
        Queries.pop(qs, 1);
        assertEquals(1, qs.getAssertionStackDepth());
        assertThrows(ValidationException.class, () -> Queries.pop(qs, 2));
        assertThrows(ValidationException.class, () -> Queries.push(qs, 0));
        assertEquals(List.of("(push 2)", "(pop 1)"), ch.sent);
    }

    @Test
    public void satFetchesRequestedValues() {
        ScriptedChannel ch = new ScriptedChannel("sat", "((x #x05))", "((y (_ bv3 8)))");
        SmtResult r = Queries.checkSat(session(ch, SolverConfig.z3()), List.of("x", "y"));
        assertTrue(r.isSatisfiable());
        assertEquals("#x05", r.getModel().get("x"));
        assertEquals("(_ bv3 8)", r.getModel().get("y"));
    }

    @Test
    public void otherCheckSatOutcomes() {
        assertEquals(SmtResult.Tag.UNSATISFIABLE,
                Queries.checkSat(session(new ScriptedChannel("unsat"), SolverConfig.z3()), List.of()).getTag());
        assertNull(Queries.checkSat(session(new ScriptedChannel("unsat"), SolverConfig.z3()), List.of())
                .getUnsatCore());
        assertEquals(SmtResult.Tag.TIME_OUT, Queries.checkSat(session(
                new ScriptedChannel("unknown", "(:reason-unknown \"timeout\")"), SolverConfig.z3()), List.of()).getTag());

        SmtResult unk = Queries.checkSat(session(
                new ScriptedChannel("unknown", "(:reason-unknown \"incomplete\")"), SolverConfig.z3()), List.of());
        assertEquals(SmtResult.Tag.UNKNOWN, unk.getTag());

        SmtResult err = Queries.checkSat(session(new ScriptedChannel("(error \"x\")"), SolverConfig.z3()), List.of());
        assertEquals(SmtResult.Tag.PROOF_ERROR, err.getTag());
        assertEquals("(error \"x\")", err.getReasons().get(1));
    }

    @Test
    public void valueParsing() {
        assertEquals("true", Queries.parseValue("(get-value (b))", "b", "((b true))"));
        assertEquals("(- 4)", Queries.parseValue("(get-value (n))", "n", " ((n (- 4))) "));
        assertThrows(SymbolicException.class, () -> Queries.parseValue("(get-value (b))", "b", "(error \"no\")"));
        assertThrows(SymbolicException.class, () -> Queries.parseValue("(get-value (b))", "b", "((c true))"));
    }

    @Test
    public void queryIsRecordedAsTactic() {
        SimState st = Symbolic.startSymbolic(RunMode.proof(false, SolverConfig.z3()));
        Query<List<SmtResult>> q = qs -> List.of();
        Queries.query(st, q);
        Result r = st.extract();
        assertEquals(1, r.getTactics().size());
        assertEquals(Tactic.Tag.QUERY_USING, r.getTactics().get(0).getTag());
        assertEquals(q, r.getTactics().get(0).getQuery());
    }
}
