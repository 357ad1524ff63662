package Engine;

public final class Constraint {

    private final String name;
    private final SymWord condition;

    public Constraint(String name, SymWord condition) {
        this.name = name;
        this.condition = condition;
    }

    /** May be null. */
    public String getName() {
        return name;
    }

    public SymWord getCondition() {
        return condition;
    }

    @Override
    public String toString() {
        return name == null ? condition.toString() : name + ": " + condition;
    }
}
