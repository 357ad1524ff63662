package utils;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;

import Engine.ArrayInfo;
import Engine.Assertion;
import Engine.Axiom;
import Engine.Constraint;
import Engine.NamedInput;
import Engine.Objective;
import Engine.Result;
import Engine.SymProgram;
import Engine.SymWord;
import Engine.TableInfo;
import Engine.Tactic;
import Engine.TrackedGoal;
import value.ConcreteValue;
import value.Kind;

/**
 * Writes a {@link Result} as JSON. Keys follow the order of the result's
 * fields, which is the order a back end consumes them in.
 */
public class ResultExporter {

    private final File outputFile;

    public ResultExporter(String outputPath) {
        this.outputFile = initOutputFile(outputPath);
    }

    private File initOutputFile(String outputPath) {
        File file = new File(outputPath);
        File parentDir = file.getParentFile();

        if (parentDir != null && !parentDir.exists()) {
            if (!parentDir.mkdirs()) {
                Log.error("Failed to create directory: " + parentDir.getAbsolutePath());
                throw new RuntimeException("Directory creation failed");
            }
        }
        return file;
    }

    public File getOutputFile() {
        return outputFile;
    }

    /** Overwrites the output file with the JSON form of {@code r}. */
    public void export(Result r) {
        try (BufferedWriter bw = new BufferedWriter(new FileWriter(outputFile, StandardCharsets.UTF_8, false))) {
            bw.write(toJson(r, true));
            bw.newLine();
        } catch (IOException e) {
            Log.errorStack("Failed to write result to " + outputFile.getAbsolutePath(), e);
            throw new RuntimeException("Result export failed", e);
        }
        Log.info("Result written to " + outputFile.getAbsolutePath());
    }

    public static String toJson(Result r, boolean pretty) {
        Map<String, Object> doc = toDocument(r);
        return pretty ? JSON.toJSONString(doc, JSONWriter.Feature.PrettyFormat) : JSON.toJSONString(doc);
    }

    public static JSONObject parse(String json) {
        return JSON.parseObject(json);
    }

    static Map<String, Object> toDocument(Result r) {
        Map<String, Object> doc = new LinkedHashMap<>();

        List<String> kinds = new ArrayList<>();
        for (Kind k : r.getKinds()) {
            kinds.add(k.toString());
        }
        doc.put("kinds", kinds);

        List<Object> traces = new ArrayList<>();
        for (Map.Entry<String, ConcreteValue> e : r.getTraces()) {
            Map<String, Object> t = new LinkedHashMap<>();
            t.put("name", e.getKey());
            t.put("kind", e.getValue().getKind().toString());
            t.put("value", e.getValue().toString());
            traces.add(t);
        }
        doc.put("traces", traces);

        doc.put("uiSegs", new LinkedHashMap<>(r.getUiSegs()));

        List<Object> inputs = new ArrayList<>();
        for (NamedInput i : r.getInputs()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("quantifier", i.getQuantifier().name());
            m.put("node", i.getWord().toString());
            m.put("kind", i.getWord().getKind().toString());
            m.put("name", i.getName());
            inputs.add(m);
        }
        doc.put("inputs", inputs);

        List<Object> consts = new ArrayList<>();
        for (Map.Entry<SymWord, ConcreteValue> e : r.getConsts().entrySet()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("node", e.getKey().toString());
            m.put("kind", e.getKey().getKind().toString());
            m.put("value", e.getValue().toString());
            consts.add(m);
        }
        doc.put("consts", consts);

        List<Object> tables = new ArrayList<>();
        for (TableInfo t : r.getTables()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("index", t.getIndex());
            m.put("indexKind", t.getIndexKind().toString());
            m.put("resultKind", t.getResultKind().toString());
            m.put("elements", words(t.getElements()));
            tables.add(m);
        }
        doc.put("tables", tables);

        List<Object> arrays = new ArrayList<>();
        for (ArrayInfo a : r.getArrays()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("handle", a.getHandle());
            m.put("name", a.getName());
            m.put("indexKind", a.getIndexKind().toString());
            m.put("resultKind", a.getResultKind().toString());
            m.put("context", a.getContext().toString());
            arrays.add(m);
        }
        doc.put("arrays", arrays);

        Map<String, Object> uis = new LinkedHashMap<>();
        r.getUiConsts().forEach((nm, t) -> uis.put(nm, t.toString()));
        doc.put("uiConsts", uis);

        List<Object> axioms = new ArrayList<>();
        for (Axiom ax : r.getAxioms()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("name", ax.getName());
            m.put("lines", ax.getLines());
            axioms.add(m);
        }
        doc.put("axioms", axioms);

        List<Object> program = new ArrayList<>();
        for (SymProgram.Assignment a : r.getProgram().getAssignments()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("node", a.getWord().toString());
            m.put("kind", a.getWord().getKind().toString());
            m.put("expr", a.getExpr().toString());
            program.add(m);
        }
        doc.put("program", program);

        List<Object> constraints = new ArrayList<>();
        for (Constraint c : r.getConstraints()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("name", c.getName());
            m.put("condition", c.getCondition().toString());
            constraints.add(m);
        }
        doc.put("constraints", constraints);

        List<String> tactics = new ArrayList<>();
        for (Tactic<SymWord> t : r.getTactics()) {
            tactics.add(t.toString());
        }
        doc.put("tactics", tactics);

        List<Object> goals = new ArrayList<>();
        for (Objective<TrackedGoal> g : r.getGoals()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("tag", g.getTag().name());
            m.put("name", g.getName());
            m.put("original", g.getValue().getOriginal().toString());
            m.put("tracker", g.getValue().getTracker().toString());
            if (g.getTag() == Objective.Tag.ASSERT_SOFT) {
                m.put("penalty", g.getPenalty().toString());
            }
            goals.add(m);
        }
        doc.put("goals", goals);

        List<Object> assertions = new ArrayList<>();
        for (Assertion a : r.getAssertions()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("label", a.getLabel());
            m.put("location", a.getLocation() == null ? null : a.getLocation().toString());
            m.put("condition", a.getCondition().toString());
            assertions.add(m);
        }
        doc.put("assertions", assertions);

        doc.put("outputs", words(r.getOutputs()));
        return doc;
    }

    private static List<String> words(List<SymWord> ws) {
        List<String> out = new ArrayList<>();
        for (SymWord w : ws) {
            out.add(w.toString());
        }
        return out;
    }
}
