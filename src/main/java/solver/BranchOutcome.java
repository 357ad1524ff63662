package solver;

import Engine.SymWord;

/** What solving one case-split branch produced. */
public final class BranchOutcome {

    private final int index;
    private final String name;
    private final SymWord condition;
    private final SmtResult result;
    private final long elapsedMillis;

    public BranchOutcome(int index, String name, SymWord condition, SmtResult result, long elapsedMillis) {
        this.index = index;
        this.name = name;
        this.condition = condition;
        this.result = result;
        this.elapsedMillis = elapsedMillis;
    }

    /** Position of the branch in its case split. */
    public int getIndex() {
        return index;
    }

    public String getName() {
        return name;
    }

    public SymWord getCondition() {
        return condition;
    }

    public SmtResult getResult() {
        return result;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    @Override
    public String toString() {
        return "Case " + name + " (" + condition + "): " + result;
    }
}
