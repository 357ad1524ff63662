package utils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import Engine.Result;
import Engine.RunMode;
import Engine.SymArray;
import Engine.SymGen;
import Engine.SymVal;
import Engine.Symbolic;
import solver.SolverConfig;
import value.Kind;
import value.SimpleValue;

public class ResultExporterTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private static final Kind W8 = Kind.word(8);

    private static Result sample() {
        return Symbolic.runSymbolic(RunMode.proof(false, SolverConfig.z3()), st -> {
            SymVal x = st.mkSymVar(null, W8, "x");
            SymVal one = SymVal.constant(SimpleValue.ofInteger(W8, 1));
            SymVal y = SymGen.plus(x, one);
            SymVal r = SymArray.newArray(st, W8, W8).write(x, y).read(one);
            st.imposeConstraint("nz", SymGen.notEq(x, one));
            st.output(r);
            return null;
        });
    }

    @Test
    public void keysFollowResultOrder() {
        JSONObject doc = ResultExporter.parse(ResultExporter.toJson(sample(), false));
        List<String> keys = new ArrayList<>(doc.keySet());
        assertEquals(List.of("kinds", "traces", "uiSegs", "inputs", "consts", "tables", "arrays", "uiConsts",
                "axioms", "program", "constraints", "tactics", "goals", "assertions", "outputs"), keys);
    }

    @Test
    public void contentsMatchTheResult() {
        Result r = sample();
        JSONObject doc = ResultExporter.parse(ResultExporter.toJson(r, true));

        JSONArray inputs = doc.getJSONArray("inputs");
        assertEquals(1, inputs.size());
        assertEquals("x", inputs.getJSONObject(0).getString("name"));
        assertEquals("ALL", inputs.getJSONObject(0).getString("quantifier"));
        assertEquals("s3", inputs.getJSONObject(0).getString("node"));

        JSONArray arrays = doc.getJSONArray("arrays");
        assertEquals(2, arrays.size());
        assertEquals(1, arrays.getJSONObject(1).getIntValue("handle"));

        assertEquals(r.getProgram().size(), doc.getJSONArray("program").size());
        assertEquals("nz", doc.getJSONArray("constraints").getJSONObject(0).getString("name"));
        assertEquals(r.getOutputs().get(0).toString(), doc.getJSONArray("outputs").getString(0));
        assertEquals("False", doc.getJSONArray("consts").getJSONObject(0).getString("value"));
    }

    @Test
    public void exportWritesThroughMissingDirectories() throws IOException {
        File target = new File(tmp.getRoot(), "nested/dir/result.json");
        ResultExporter exporter = new ResultExporter(target.getPath());
        assertTrue(target.getParentFile().isDirectory());

        exporter.export(sample());
        String text = new String(Files.readAllBytes(target.toPath()), StandardCharsets.UTF_8);
        assertTrue(text.contains("\n"));
        assertEquals(15, ResultExporter.parse(text).size());

        // a second export replaces the first
        exporter.export(Symbolic.runSymbolic(RunMode.codeGen(), st -> null));
        String again = new String(Files.readAllBytes(target.toPath()), StandardCharsets.UTF_8);
        assertEquals(0, ResultExporter.parse(again).getJSONArray("inputs").size());
    }

    @Test
    public void exportIsUtf8() throws IOException {
        String label = "gr\u00f6\u00dfer_\u4e0a\u754c";
        Result r = Symbolic.runSymbolic(RunMode.proof(false, SolverConfig.z3()), st -> {
            SymVal x = st.mkSymVar(null, W8, "x");
            st.imposeConstraint(label, SymGen.lessThan(SymVal.constant(SimpleValue.ofInteger(W8, 3)), x));
            return null;
        });
        File target = tmp.newFile("labels.json");
        new ResultExporter(target.getPath()).export(r);

        byte[] raw = Files.readAllBytes(target.toPath());
        JSONObject doc = ResultExporter.parse(new String(raw, StandardCharsets.UTF_8));
        assertEquals(label, doc.getJSONArray("constraints").getJSONObject(0).getString("name"));
        assertTrue(new String(raw, StandardCharsets.UTF_8).contains(label));
    }
}
