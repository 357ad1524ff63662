package init;

import java.util.EnumSet;
import java.util.Set;

import Engine.Mutation;
import solver.CaseAggregation;

public class Config {

    // Basic Config
    public static String logLevel = "OFF";
    public static int threads = Runtime.getRuntime().availableProcessors();

    // Engine Config
    // seed for the context generator outside concrete mode, where the mode carries its own
    public static long defaultSeed = 42L;
    // mutations still accepted once an interactive session has started; none by default
    public static Set<Mutation> interactiveAllowed = EnumSet.noneOf(Mutation.class);

    // Solver Config
    public static CaseAggregation caseAggregation = CaseAggregation.BRANCH_ORDER;

    // Path Config
    public static String resultPath = "output/result.json";
}
