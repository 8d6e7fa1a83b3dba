package dumb.iota;

import static dumb.iota.Term.IOTA;
import static org.junit.jupiter.api.Assertions.fail;

abstract class AbstractTest {

    /** {@code I} as an Iota program. */
    static final String I_SRC = "*ii";
    /** {@code K} as an Iota program. */
    static final String K_SRC = "*i*i*ii";
    /** {@code S} as an Iota program. */
    static final String S_SRC = "*i*i*i*ii";
    /** {@code S I I}. */
    static final String SII_SRC = "**" + S_SRC + I_SRC + I_SRC;
    /** {@code (S I I)(S I I)}, which has no normal form. */
    static final String OMEGA_SRC = "*" + SII_SRC + SII_SRC;

    static Term parse(String src) {
        try {
            return Parser.parse(src);
        } catch (IotaException e) {
            return fail("Failed to parse '" + src + "': " + e.getMessage());
        }
    }

    static Term.App app(Term l, Term r) {
        return Term.app(l, r);
    }

    /** {@code i i}, reducible at the root. */
    static Term.App ii() {
        return app(IOTA, IOTA);
    }
}
