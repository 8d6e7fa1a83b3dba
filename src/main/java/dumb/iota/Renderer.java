package dumb.iota;

import static java.util.Objects.requireNonNull;

/** Prints a term back in prefix surface syntax, each symbol followed by a space. */
public final class Renderer {

    public static final Renderer DEFAULT = new Renderer(Symbols.DEFAULT);

    private final Symbols symbols;

    public Renderer(Symbols symbols) {
        this.symbols = requireNonNull(symbols);
    }

    public static String unparse(Term t) {
        return DEFAULT.render(t);
    }

    public String render(Term t) {
        var sb = new StringBuilder(2 * requireNonNull(t).size());
        t.unparse(symbols, sb);
        return sb.toString();
    }
}
