package Engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import cache.Cached;
import value.ConcreteValue;
import value.Kind;

/**
 * Smart constructors for symbolic values. Every builder returns a lazily
 * cached value: nothing is allocated until a context observes it, and a value
 * observed twice yields the same node.
 */
public class SymGen {

    private SymGen() {
    }

    public static SymVal literal(ConcreteValue v) {
        return SymVal.constant(v);
    }

    /** Applies {@code op} to {@code args}, giving a node of kind {@code k}. */
    public static SymVal apply(Kind k, SymOp op, SymVal... args) {
        List<SymVal> xs = Arrays.asList(args.clone());
        return SymVal.symbolic(k, Cached.cache(st -> {
            SymWord[] sws = new SymWord[xs.size()];
            for (int i = 0; i < sws.length; i++) {
                sws[i] = st.toSW(xs.get(i));
            }
            return st.newExpr(k, SymExpr.app(op, sws));
        }));
    }

    private static SymVal arith(SymOp.Tag tag, SymVal a, SymVal b) {
        sameKind(tag, a, b);
        return apply(a.getKind(), SymOp.of(tag), a, b);
    }

    private static SymVal compare(SymOp.Tag tag, SymVal a, SymVal b) {
        sameKind(tag, a, b);
        return apply(Kind.BOOL, SymOp.of(tag), a, b);
    }

    private static SymVal logic(SymOp.Tag tag, SymVal a, SymVal b) {
        requireBoolean(tag, a);
        requireBoolean(tag, b);
        return apply(Kind.BOOL, SymOp.of(tag), a, b);
    }

    public static SymVal plus(SymVal a, SymVal b) {
        return arith(SymOp.Tag.PLUS, a, b);
    }

    public static SymVal times(SymVal a, SymVal b) {
        return arith(SymOp.Tag.TIMES, a, b);
    }

    public static SymVal minus(SymVal a, SymVal b) {
        return arith(SymOp.Tag.MINUS, a, b);
    }

    public static SymVal negate(SymVal a) {
        return apply(a.getKind(), SymOp.of(SymOp.Tag.UNEG), a);
    }

    public static SymVal eq(SymVal a, SymVal b) {
        return compare(SymOp.Tag.EQUAL, a, b);
    }

    public static SymVal notEq(SymVal a, SymVal b) {
        return compare(SymOp.Tag.NOT_EQUAL, a, b);
    }

    public static SymVal lessThan(SymVal a, SymVal b) {
        return compare(SymOp.Tag.LESS_THAN, a, b);
    }

    public static SymVal lessEq(SymVal a, SymVal b) {
        return compare(SymOp.Tag.LESS_EQ, a, b);
    }

    public static SymVal and(SymVal a, SymVal b) {
        return logic(SymOp.Tag.AND, a, b);
    }

    public static SymVal or(SymVal a, SymVal b) {
        return logic(SymOp.Tag.OR, a, b);
    }

    public static SymVal xor(SymVal a, SymVal b) {
        return logic(SymOp.Tag.XOR, a, b);
    }

    public static SymVal not(SymVal a) {
        requireBoolean(SymOp.Tag.NOT, a);
        return apply(Kind.BOOL, SymOp.of(SymOp.Tag.NOT), a);
    }

    public static SymVal ite(SymVal c, SymVal t, SymVal e) {
        requireBoolean(SymOp.Tag.ITE, c);
        sameKind(SymOp.Tag.ITE, t, e);
        return apply(t.getKind(), SymOp.of(SymOp.Tag.ITE), c, t, e);
    }

    /** {@code elements[index]}, or {@code outOfBounds} when the index is past the end. */
    public static SymVal lookup(List<SymVal> elements, SymVal index, SymVal outOfBounds) {
        if (elements.isEmpty()) {
            return outOfBounds;
        }
        Kind rk = outOfBounds.getKind();
        for (SymVal x : elements) {
            sameKind(SymOp.Tag.LOOKUP, x, outOfBounds);
        }
        List<SymVal> es = new ArrayList<>(elements);
        return SymVal.symbolic(rk, Cached.cache(st -> {
            List<SymWord> sws = new ArrayList<>();
            for (SymVal x : es) {
                sws.add(st.toSW(x));
            }
            int t = st.getTableIndex(index.getKind(), rk, sws);
            SymWord i = st.toSW(index);
            SymWord d = st.toSW(outOfBounds);
            return st.newExpr(rk, SymExpr.app(SymOp.lookup(t, index.getKind(), rk, sws.size(), i, d)));
        }));
    }

    /**
     * Applies the uninterpreted function {@code name}, declaring it on first
     * use. The type is the argument kinds followed by {@code resultKind}.
     */
    public static SymVal uninterpreted(String name, Kind resultKind, List<String> code, SymVal... args) {
        List<Kind> sig = new ArrayList<>();
        for (SymVal a : args) {
            sig.add(a.getKind());
        }
        sig.add(resultKind);
        SymType t = new SymType(sig);
        List<SymVal> xs = Arrays.asList(args.clone());
        return SymVal.symbolic(resultKind, Cached.cache(st -> {
            st.newUninterpreted(name, t, code);
            SymWord[] sws = new SymWord[xs.size()];
            for (int i = 0; i < sws.length; i++) {
                sws[i] = st.toSW(xs.get(i));
            }
            return st.newExpr(resultKind, SymExpr.app(SymOp.uninterpreted(name), sws));
        }));
    }

    /** Tags {@code v} with a label that survives into the generated script. */
    public static SymVal label(String text, SymVal v) {
        return apply(v.getKind(), SymOp.label(text), v);
    }

    public static SymVal cast(Kind to, SymVal v) {
        return apply(to, SymOp.kindCast(v.getKind(), to), v);
    }

    private static void sameKind(SymOp.Tag tag, SymVal a, SymVal b) {
        if (!a.getKind().equals(b.getKind())) {
            throw new ValidationException("Operands of " + tag + " have different kinds: "
                    + a.getKind() + " and " + b.getKind());
        }
    }

    private static void requireBoolean(SymOp.Tag tag, SymVal a) {
        if (!a.getKind().isBoolean()) {
            throw new ValidationException("Operand of " + tag + " must be boolean, got " + a.getKind());
        }
    }
}
