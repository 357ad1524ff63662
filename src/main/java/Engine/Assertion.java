package Engine;

public final class Assertion {

    private final String label;
    private final StackTraceElement location;
    private final SymWord condition;

    public Assertion(String label, StackTraceElement location, SymWord condition) {
        this.label = label;
        this.location = location;
        this.condition = condition;
    }

    public String getLabel() {
        return label;
    }

    /** Call site supplied by the caller, or null. */
    public StackTraceElement getLocation() {
        return location;
    }

    public SymWord getCondition() {
        return condition;
    }

    @Override
    public String toString() {
        return "-- assertion: " + label + " " + (location == null ? "[No location]" : location.toString())
                + ": " + condition;
    }
}
