package dumb.iota;

/**
 * Surface symbol table. The language only needs two distinct input symbols; {@code sSym} and
 * {@code kSym} are display-only placeholders for the combinators reduction introduces.
 */
public record Symbols(char apply, char iota, char sSym, char kSym) {

    public static final Symbols DEFAULT = new Symbols('*', 'i', 'S', 'K');

    public Symbols {
        if (apply == iota)
            throw new IllegalArgumentException("Application and iota symbols must differ: '" + apply + "'");
        if (Character.isWhitespace(apply) || Character.isWhitespace(iota))
            throw new IllegalArgumentException("Input symbols must not be whitespace");
        if (sSym == kSym)
            throw new IllegalArgumentException("S and K placeholders must differ: '" + sSym + "'");
        for (var p : new char[]{sSym, kSym}) {
            if (p == apply || p == iota)
                throw new IllegalArgumentException("Placeholder '" + p + "' collides with an input symbol");
        }
    }

    public static Symbols of(char apply, char iota) {
        return new Symbols(apply, iota, DEFAULT.sSym, DEFAULT.kSym);
    }
}
