package Engine;

import java.util.Arrays;
import java.util.List;

/**
 * A state change attempted after an interactive session started that is not
 * on the allowed list.
 */
public class InteractiveModeException extends SymbolicException {

    private final Mutation mutation;

    public InteractiveModeException(Mutation mutation, String... details) {
        super(render(details));
        this.mutation = mutation;
    }

    public Mutation getMutation() {
        return mutation;
    }

    private static String render(String... details) {
        List<String> lines = Arrays.asList(details);
        StringBuilder sb = new StringBuilder("Unsupported interactive/query mode feature.");
        for (String line : lines) {
            sb.append(System.lineSeparator()).append("  ").append(line);
        }
        return sb.toString();
    }
}
