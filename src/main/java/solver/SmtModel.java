package solver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Values the solver reported, as the text it printed them in. */
public final class SmtModel {

    private final Map<String, String> objectives;
    private final Map<String, String> assignments;

    public SmtModel(Map<String, String> objectives, Map<String, String> assignments) {
        this.objectives = Collections.unmodifiableMap(new LinkedHashMap<>(objectives));
        this.assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
    }

    public static SmtModel empty() {
        return new SmtModel(Collections.emptyMap(), Collections.emptyMap());
    }

    public Map<String, String> getObjectives() {
        return objectives;
    }

    public Map<String, String> getAssignments() {
        return assignments;
    }

    public String get(String name) {
        return assignments.get(name);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : assignments.entrySet()) {
            sb.append("  ").append(e.getKey()).append(" = ").append(e.getValue()).append('\n');
        }
        for (Map.Entry<String, String> e : objectives.entrySet()) {
            sb.append("  [objective] ").append(e.getKey()).append(" = ").append(e.getValue()).append('\n');
        }
        return sb.toString();
    }
}
