package Engine;

import java.util.Collection;

public enum Quantifier {
    ALL,
    EX;

    public static boolean needsExistentials(Collection<Quantifier> qs) {
        return qs.contains(EX);
    }
}
