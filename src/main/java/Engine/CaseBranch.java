package Engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One named case of a case-split tactic with the tactics local to it.
 */
public final class CaseBranch<T> {

    private final String name;
    private final T condition;
    private final List<Tactic<T>> tactics;

    public CaseBranch(String name, T condition, List<Tactic<T>> tactics) {
        this.name = name;
        this.condition = condition;
        this.tactics = Collections.unmodifiableList(new ArrayList<>(tactics));
    }

    public String getName() {
        return name;
    }

    public T getCondition() {
        return condition;
    }

    public List<Tactic<T>> getTactics() {
        return tactics;
    }

    @Override
    public String toString() {
        return "(\"" + name + "\"," + condition + "," + tactics + ")";
    }
}
