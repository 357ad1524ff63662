package Engine;

import java.util.function.Function;
import java.util.function.IntFunction;

import cache.Cached;
import value.Kind;

/**
 * A symbolic array. Never mutated: every write, reset or merge yields a new
 * array whose provenance points back at the arrays it came from. Fresh arrays
 * are allocated on creation; derived handles are computed lazily and cached,
 * so observing the same array twice does not allocate twice.
 */
public final class SymArray {

    private final Kind indexKind;
    private final Kind resultKind;
    private final Cached<Integer> handle;

    private SymArray(Kind indexKind, Kind resultKind, Cached<Integer> handle) {
        this.indexKind = indexKind;
        this.resultKind = resultKind;
        this.handle = handle;
    }

    /**
     * A fresh array, allocated in {@code st} right away so handles follow
     * creation order. {@code name} maps the allocated handle to a display
     * name; a null {@code name} gives {@code array_<handle>}. A null
     * {@code init} leaves the cells unconstrained.
     */
    public static SymArray newArray(SimState st, Kind indexKind, Kind resultKind, IntFunction<String> name,
                                    SymVal init) {
        if (init != null && !init.getKind().equals(resultKind)) {
            throw new ValidationException("Array initializer of kind " + init.getKind()
                    + " does not match element kind " + resultKind);
        }
        IntFunction<String> nm = name != null ? name : SymArray::defaultName;
        SymWord iv = init == null ? null : st.toSW(init);
        int j = st.allocateArray(h -> new ArrayInfo(h, nm.apply(h), indexKind, resultKind, ArrayContext.free(iv)));
        return new SymArray(indexKind, resultKind, Cached.constant(j));
    }

    public static SymArray newArray(SimState st, Kind indexKind, Kind resultKind) {
        return newArray(st, indexKind, resultKind, null, null);
    }

    static String defaultName(int handle) {
        return "array_" + handle;
    }

    public Kind getIndexKind() {
        return indexKind;
    }

    public Kind getResultKind() {
        return resultKind;
    }

    /** The handle of this array in {@code st}, allocating it on first use. */
    public int handle(SimState st) {
        return st.uncacheArray(handle);
    }

    public SymVal read(SymVal address) {
        checkIndex(address);
        return SymVal.symbolic(resultKind, Cached.cache(st -> {
            int f = handle(st);
            SymWord i = st.toSW(address);
            return st.newExpr(resultKind, SymExpr.app(SymOp.arrayRead(f), i));
        }));
    }

    /** Every cell set to {@code value}. */
    public SymArray reset(SymVal value) {
        checkElement(value);
        return derive(st -> {
            int f = handle(st);
            SymWord v = st.toSW(value);
            return st.allocateArray(j -> new ArrayInfo(j, defaultName(j), indexKind, resultKind,
                    ArrayContext.reset(f, v)));
        });
    }

    public SymArray write(SymVal address, SymVal value) {
        checkIndex(address);
        checkElement(value);
        return derive(st -> {
            int f = handle(st);
            SymWord a = st.toSW(address);
            SymWord v = st.toSW(value);
            return st.allocateArray(j -> new ArrayInfo(j, defaultName(j), indexKind, resultKind,
                    ArrayContext.mutate(f, a, v)));
        });
    }

    /** {@code cond ? thenArray : elseArray}, cell by cell. */
    public static SymArray merge(SymVal cond, SymArray thenArray, SymArray elseArray) {
        if (!cond.getKind().isBoolean()) {
            throw new ValidationException("Array merge condition must be boolean, got " + cond.getKind());
        }
        if (!thenArray.indexKind.equals(elseArray.indexKind) || !thenArray.resultKind.equals(elseArray.resultKind)) {
            throw new ValidationException("Cannot merge arrays of different kinds: "
                    + thenArray + " and " + elseArray);
        }
        return thenArray.derive(st -> {
            SymWord c = st.toSW(cond);
            int t = thenArray.handle(st);
            int e = elseArray.handle(st);
            return st.allocateArray(j -> new ArrayInfo(j, defaultName(j), thenArray.indexKind,
                    thenArray.resultKind, ArrayContext.merge(c, t, e)));
        });
    }

    /** A boolean that holds when both arrays agree on every index. */
    public SymVal equalTo(SymArray other) {
        return SymVal.symbolic(Kind.BOOL, Cached.cache(st -> {
            int l = handle(st);
            int r = other.handle(st);
            return st.newExpr(Kind.BOOL, SymExpr.app(SymOp.arrayEquals(l, r)));
        }));
    }

    private SymArray derive(Function<SimState, Integer> alloc) {
        return new SymArray(indexKind, resultKind, Cached.cache(alloc));
    }

    private void checkIndex(SymVal address) {
        if (!address.getKind().equals(indexKind)) {
            throw new ValidationException("Array index of kind " + address.getKind()
                    + " does not match index kind " + indexKind);
        }
    }

    private void checkElement(SymVal value) {
        if (!value.getKind().equals(resultKind)) {
            throw new ValidationException("Array element of kind " + value.getKind()
                    + " does not match element kind " + resultKind);
        }
    }

    @Override
    public String toString() {
        return "SArray " + indexKind + " " + resultKind;
    }
}
