package Engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * User supplied SMT-Lib text, passed through untouched.
 */
public final class Axiom {

    private final String name;
    private final List<String> lines;

    public Axiom(String name, List<String> lines) {
        this.name = name;
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public String getName() {
        return name;
    }

    public List<String> getLines() {
        return lines;
    }
}
