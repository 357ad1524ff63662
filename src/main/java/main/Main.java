package main;

import java.util.List;

import Engine.CaseBranch;
import Engine.Result;
import Engine.RunMode;
import Engine.SimState;
import Engine.SymArray;
import Engine.SymGen;
import Engine.SymVal;
import Engine.Symbolic;
import Engine.Tactic;
import init.Config;
import solver.SolverConfig;
import utils.Log;
import utils.ResultExporter;
import value.Kind;
import value.SimpleValue;

public class Main {

    public static void init() {
        Log.initLogLevel();
    }

    static RunMode parseMode(String mode) {
        if (mode.startsWith("concrete")) {
            int colon = mode.indexOf(':');
            return RunMode.concrete(colon < 0 ? Config.defaultSeed : Long.parseLong(mode.substring(colon + 1)));
        }
        switch (mode) {
            case "proof":
                return RunMode.proof(false, SolverConfig.z3());
            case "sat":
                return RunMode.proof(true, SolverConfig.z3());
            case "codegen":
                return RunMode.codeGen();
            default:
                throw new IllegalArgumentException("Unknown mode: " + mode
                        + " (expected proof, sat, codegen or concrete[:seed])");
        }
    }

    /**
     * A small program touching most stores: two byte inputs, their sum, a
     * table lookup, an array written and read back outside concrete mode,
     * and a case split.
     */
    static Object demo(SimState st) {
        Kind w8 = Kind.word(8);
        SymVal x = st.mkSymVar(null, w8, "x");
        SymVal y = st.mkSymVar(null, w8, "y");
        SymVal sum = SymGen.plus(x, y);

        SymVal one = SymVal.constant(SimpleValue.ofInteger(w8, 1));
        SymVal zero = SymVal.constant(SimpleValue.ofInteger(w8, 0));
        SymVal picked = SymGen.lookup(List.of(zero, one, sum), x, zero);

        st.output(sum);
        st.output(picked);
        // arrays have no concrete counterpart
        if (!st.isConcreteMode()) {
            SymArray mem = SymArray.newArray(st, w8, w8).write(x, sum);
            st.output(mem.read(x));
        }

        if (!st.isCodeGenMode()) {
            st.imposeConstraint("x_below_y", SymGen.lessThan(x, y));
            SymVal big = SymGen.lessThan(one, sum);
            st.addTactic(Tactic.caseSplit(false, List.of(
                    new CaseBranch<>("big", big, List.of()),
                    new CaseBranch<>("small", SymGen.not(big), List.of()))));
        }
        return null;
    }

    public static void main(String[] args) {
        init();
        long startTime = System.currentTimeMillis();
        RunMode mode = parseMode(args.length > 0 ? args[0] : "proof");
        Result r = Symbolic.runSymbolic(mode, Main::demo);
        System.out.println(r);
        if (args.length > 1) {
            new ResultExporter(args[1]).export(r);
        }
        Log.printTime("[-] Time cost:", startTime);
    }
}
