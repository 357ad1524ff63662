package Engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An operation applied to already allocated nodes.
 */
public final class SymExpr {

    private final SymOp op;
    private final List<SymWord> args;

    public SymExpr(SymOp op, List<SymWord> args) {
        this.op = Objects.requireNonNull(op);
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static SymExpr app(SymOp op, SymWord... args) {
        return new SymExpr(op, Arrays.asList(args));
    }

    public SymOp getOp() {
        return op;
    }

    public List<SymWord> getArgs() {
        return args;
    }

    /**
     * Binary commutative applications put their smaller operand first so that
     * both construction orders hash-cons to one node.
     */
    public SymExpr reorder() {
        if (op.isCommutative() && args.size() == 2 && args.get(0).compareTo(args.get(1)) > 0) {
            return new SymExpr(op, Arrays.asList(args.get(1), args.get(0)));
        }
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymExpr)) return false;
        SymExpr e = (SymExpr) o;
        return op.equals(e.op) && args.equals(e.args);
    }

    @Override
    public int hashCode() {
        return 31 * op.hashCode() + args.hashCode();
    }

    @Override
    public String toString() {
        SymOp.Tag tag = op.getTag();
        if (tag == SymOp.Tag.ITE && args.size() == 3) {
            return "if " + args.get(0) + " then " + args.get(1) + " else " + args.get(2);
        }
        if ((tag == SymOp.Tag.SHL || tag == SymOp.Tag.SHR || tag == SymOp.Tag.ROL || tag == SymOp.Tag.ROR)
                && args.size() == 1) {
            return args.get(0) + " " + tag.getSymbol() + " " + op.getAmount();
        }
        if (tag == SymOp.Tag.PSEUDO_BOOLEAN) {
            return op + joinArgs();
        }
        if (args.size() == 2) {
            return args.get(0) + " " + op + " " + args.get(1);
        }
        return op + joinArgs();
    }

    private String joinArgs() {
        return args.stream().map(a -> " " + a).collect(Collectors.joining());
    }
}
