package Engine;

/**
 * An objective target paired with the existential variable that tracks it.
 */
public final class TrackedGoal {

    private final SymWord original;
    private final SymWord tracker;

    public TrackedGoal(SymWord original, SymWord tracker) {
        this.original = original;
        this.tracker = tracker;
    }

    public SymWord getOriginal() {
        return original;
    }

    public SymWord getTracker() {
        return tracker;
    }

    @Override
    public String toString() {
        return "(" + original + "," + tracker + ")";
    }
}
