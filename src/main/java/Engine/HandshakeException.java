package Engine;

/**
 * The solver did not acknowledge the opening command of a query session.
 */
public class HandshakeException extends SymbolicException {

    private final String sent;
    private final String expected;
    private final String received;

    public HandshakeException(String sent, String expected, String received) {
        super("Failed to establish the solver session."
                + "\n  Sent     : " + sent
                + "\n  Expected : " + expected
                + "\n  Received : " + received);
        this.sent = sent;
        this.expected = expected;
        this.received = received;
    }

    public String getSent() {
        return sent;
    }

    public String getExpected() {
        return expected;
    }

    public String getReceived() {
        return received;
    }
}
