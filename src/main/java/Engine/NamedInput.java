package Engine;

public final class NamedInput {

    private final Quantifier quantifier;
    private final SymWord word;
    private final String name;

    public NamedInput(Quantifier quantifier, SymWord word, String name) {
        this.quantifier = quantifier;
        this.word = word;
        this.name = name;
    }

    public Quantifier getQuantifier() {
        return quantifier;
    }

    public SymWord getWord() {
        return word;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        String ni = word.toString();
        String ex = quantifier == Quantifier.ALL ? "" : ", existential";
        String alias = ni.equals(name) ? "" : ", aliasing \"" + name + "\"";
        return ni + " :: " + word.getKind() + ex + alias;
    }
}
