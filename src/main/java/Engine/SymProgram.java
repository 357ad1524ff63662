package Engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Single-static-assignment program: node definitions in creation order.
 */
public final class SymProgram {

    public static final class Assignment {
        private final SymWord word;
        private final SymExpr expr;

        public Assignment(SymWord word, SymExpr expr) {
            this.word = word;
            this.expr = expr;
        }

        public SymWord getWord() {
            return word;
        }

        public SymExpr getExpr() {
            return expr;
        }

        @Override
        public String toString() {
            return word + " :: " + word.getKind() + " = " + expr;
        }
    }

    private final List<Assignment> assignments;

    public SymProgram() {
        this.assignments = new ArrayList<>();
    }

    private SymProgram(List<Assignment> frozen) {
        this.assignments = frozen;
    }

    void append(SymWord word, SymExpr expr) {
        assignments.add(new Assignment(word, expr));
    }

    public List<Assignment> getAssignments() {
        return Collections.unmodifiableList(assignments);
    }

    public int size() {
        return assignments.size();
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    public SymProgram snapshot() {
        return new SymProgram(Collections.unmodifiableList(new ArrayList<>(assignments)));
    }
}
