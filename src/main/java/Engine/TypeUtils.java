package Engine;

import java.util.Locale;
import java.util.Set;

import value.Kind;

/**
 * Name and kind checks shared by the declaration paths of {@link SimState}.
 */
public class TypeUtils {

    // compared case-insensitively
    private static final Set<String> SMTLIB_RESERVED_NAMES = Set.of(
        "int", "real", "list", "array", "bool", "fp", "floatingpoint", "string", "bitvec",
        "!", "_", "as", "binary", "decimal", "exists", "hexadecimal", "forall", "let", "numeral", "par",
        "assert", "check-sat", "check-sat-assuming", "declare-const", "declare-datatype",
        "declare-datatypes", "declare-fun", "declare-sort", "define-fun", "define-fun-rec",
        "define-sort", "echo", "exit", "get-assertions", "get-assignment", "get-info", "get-model",
        "get-option", "get-proof", "get-unsat-assumptions", "get-unsat-core", "get-value", "pop",
        "push", "reset", "reset-assertions", "set-info", "set-logic", "set-option",
        "true", "false", "not", "and", "or", "xor", "=>", "=", "distinct", "ite",
        "select", "store", "concat", "extract", "abs", "div", "mod", "to_real", "to_int", "is_int"
    );

    public static boolean isReservedName(String name) {
        return SMTLIB_RESERVED_NAMES.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * A letter followed by letters, digits and underscores, or any text
     * enclosed in bars that itself contains neither a bar nor a backslash.
     */
    public static boolean isValidIdentifier(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        if (isEnclosed(name)) {
            return true;
        }
        if (!Character.isLetter(name.charAt(0))) {
            return false;
        }
        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return false;
            }
        }
        return true;
    }

    private static boolean isEnclosed(String name) {
        if (name.length() <= 2 || name.charAt(0) != '|' || name.charAt(name.length() - 1) != '|') {
            return false;
        }
        String inner = name.substring(1, name.length() - 1);
        return inner.indexOf('|') < 0 && inner.indexOf('\\') < 0;
    }

    public static boolean isReservedSort(Kind kind) {
        return kind.isUserSort() && isReservedName(kind.getSortName());
    }
}
