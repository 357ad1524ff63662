package Engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

import value.ConcreteValue;
import value.Kind;

/**
 * Frozen snapshot of a construction context. Fields are kept in the order the
 * back end emits them.
 */
public final class Result {

    private final Set<Kind> kinds;
    private final List<Map.Entry<String, ConcreteValue>> traces;
    private final SortedMap<String, List<String>> uiSegs;
    private final List<NamedInput> inputs;
    private final SortedMap<SymWord, ConcreteValue> consts;
    private final List<TableInfo> tables;
    private final List<ArrayInfo> arrays;
    private final SortedMap<String, SymType> uiConsts;
    private final List<Axiom> axioms;
    private final SymProgram program;
    private final List<Constraint> constraints;
    private final List<Tactic<SymWord>> tactics;
    private final List<Objective<TrackedGoal>> goals;
    private final List<Assertion> assertions;
    private final List<SymWord> outputs;

    Result(Collection<Kind> kinds, List<Map.Entry<String, ConcreteValue>> traces,
           Map<String, List<String>> uiSegs, List<NamedInput> inputs, SortedMap<SymWord, ConcreteValue> consts,
           List<TableInfo> tables, Collection<ArrayInfo> arrays, Map<String, SymType> uiConsts,
           List<Axiom> axioms, SymProgram program, List<Constraint> constraints,
           List<Tactic<SymWord>> tactics, List<Objective<TrackedGoal>> goals,
           List<Assertion> assertions, List<SymWord> outputs) {
        this.kinds = Collections.unmodifiableSet(new LinkedHashSet<>(kinds));
        this.traces = freeze(traces);
        this.uiSegs = Collections.unmodifiableSortedMap(new TreeMap<>(uiSegs));
        this.inputs = freeze(inputs);
        this.consts = Collections.unmodifiableSortedMap(new TreeMap<>(consts));
        this.tables = freeze(tables);
        this.arrays = Collections.unmodifiableList(new ArrayList<>(arrays));
        this.uiConsts = Collections.unmodifiableSortedMap(new TreeMap<>(uiConsts));
        this.axioms = freeze(axioms);
        this.program = program;
        this.constraints = freeze(constraints);
        this.tactics = freeze(tactics);
        this.goals = freeze(goals);
        this.assertions = freeze(assertions);
        this.outputs = freeze(outputs);
    }

    private static <T> List<T> freeze(List<T> xs) {
        return Collections.unmodifiableList(new ArrayList<>(xs));
    }

    /** Used kinds, in kind order. */
    public Set<Kind> getKinds() {
        return kinds;
    }

    /** Names and values drawn for concrete-mode variables. */
    public List<Map.Entry<String, ConcreteValue>> getTraces() {
        return traces;
    }

    public SortedMap<String, List<String>> getUiSegs() {
        return uiSegs;
    }

    public List<NamedInput> getInputs() {
        return inputs;
    }

    public SortedMap<SymWord, ConcreteValue> getConsts() {
        return consts;
    }

    public List<TableInfo> getTables() {
        return tables;
    }

    /** Arrays by ascending handle. */
    public List<ArrayInfo> getArrays() {
        return arrays;
    }

    public SortedMap<String, SymType> getUiConsts() {
        return uiConsts;
    }

    public List<Axiom> getAxioms() {
        return axioms;
    }

    public SymProgram getProgram() {
        return program;
    }

    public List<Constraint> getConstraints() {
        return constraints;
    }

    public List<Tactic<SymWord>> getTactics() {
        return tactics;
    }

    public List<Objective<TrackedGoal>> getGoals() {
        return goals;
    }

    public List<Assertion> getAssertions() {
        return assertions;
    }

    public List<SymWord> getOutputs() {
        return outputs;
    }

    @Override
    public String toString() {
        // a lone constant output with nothing else around it prints as that constant
        if (outputs.size() == 1 && uiSegs.isEmpty() && inputs.isEmpty() && tables.isEmpty()
                && arrays.isEmpty() && axioms.isEmpty() && program.isEmpty() && constraints.isEmpty()
                && tactics.isEmpty() && goals.isEmpty() && assertions.isEmpty()) {
            ConcreteValue c = consts.get(outputs.get(0));
            if (c != null) {
                return c.toString();
            }
        }
        List<String> out = new ArrayList<>();
        List<String> usorts = new ArrayList<>();
        for (Kind k : kinds) {
            if (k.isUserSort()) {
                List<String> es = k.getEnumValues();
                usorts.add("  " + (es == null ? k.getSortName() : k.getSortName() + " (" + String.join(", ", es) + ")"));
            }
        }
        if (!usorts.isEmpty()) {
            out.add("SORTS");
            out.addAll(usorts);
        }
        out.add("INPUTS");
        for (NamedInput i : inputs) {
            out.add("  " + i);
        }
        out.add("CONSTANTS");
        for (Map.Entry<SymWord, ConcreteValue> e : consts.entrySet()) {
            out.add("  " + e.getKey() + " = " + e.getValue());
        }
        out.add("TABLES");
        for (TableInfo t : tables) {
            out.add("  " + t);
        }
        out.add("ARRAYS");
        for (ArrayInfo a : arrays) {
            out.add("  " + a);
        }
        out.add("UNINTERPRETED CONSTANTS");
        for (Map.Entry<String, SymType> e : uiConsts.entrySet()) {
            out.add("  [uninterpreted] " + e.getKey() + " :: " + e.getValue());
        }
        out.add("USER GIVEN CODE SEGMENTS");
        for (Map.Entry<String, List<String>> e : uiSegs.entrySet()) {
            out.add("Variable: " + e.getKey());
            for (String l : e.getValue()) {
                out.add("  " + l);
            }
        }
        out.add("AXIOMS");
        for (Axiom ax : axioms) {
            out.add("  -- user defined axiom: " + ax.getName() + "\n  " + String.join("\n  ", ax.getLines()));
        }
        out.add("TACTICS");
        for (Tactic<SymWord> t : tactics) {
            out.add(t.toString());
        }
        out.add("GOALS");
        for (Objective<TrackedGoal> g : goals) {
            out.add(g.toString());
        }
        out.add("DEFINE");
        for (SymProgram.Assignment a : program.getAssignments()) {
            out.add("  " + a);
        }
        out.add("CONSTRAINTS");
        for (Constraint c : constraints) {
            out.add("  " + c);
        }
        out.add("ASSERTIONS");
        for (Assertion a : assertions) {
            out.add("    " + a);
        }
        out.add("OUTPUTS");
        for (SymWord o : outputs) {
            out.add("  " + o);
        }
        return String.join("\n", out);
    }
}
