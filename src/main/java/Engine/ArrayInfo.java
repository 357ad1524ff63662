package Engine;

import value.Kind;

public final class ArrayInfo {

    private final int handle;
    private final String name;
    private final Kind indexKind;
    private final Kind resultKind;
    private final ArrayContext context;

    public ArrayInfo(int handle, String name, Kind indexKind, Kind resultKind, ArrayContext context) {
        this.handle = handle;
        this.name = name;
        this.indexKind = indexKind;
        this.resultKind = resultKind;
        this.context = context;
    }

    public int getHandle() {
        return handle;
    }

    public String getName() {
        return name;
    }

    public Kind getIndexKind() {
        return indexKind;
    }

    public Kind getResultKind() {
        return resultKind;
    }

    public ArrayContext getContext() {
        return context;
    }

    @Override
    public String toString() {
        String ni = "array_" + handle;
        String alias = ni.equals(name) ? "" : ", aliasing \"" + name + "\"";
        return ni + " :: " + indexKind + " -> " + resultKind + alias
                + System.lineSeparator() + "     Context: " + context;
    }
}
