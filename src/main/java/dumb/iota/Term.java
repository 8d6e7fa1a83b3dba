package dumb.iota;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.iota.util.Json;

import static java.util.Objects.requireNonNull;

/**
 * Immutable binary term tree. {@link Iota} is the only leaf the surface syntax produces;
 * {@link S} and {@link K} appear only in terms built by the {@link Reducer}.
 */
sealed public interface Term permits Term.Iota, Term.S, Term.K, Term.App {

    Iota IOTA = new Iota();
    S S = new S();
    K K = new K();

    static App app(Term left, Term right) {
        return new App(left, right);
    }

    /** Left-nested application: {@code app(a, b, c)} is {@code App(App(a, b), c)}. */
    static Term app(Term head, Term... args) {
        var t = requireNonNull(head);
        for (var a : args) t = new App(t, a);
        return t;
    }

    /** Number of nodes. */
    int size();

    int depth();

    /** True iff the term contains only {@link Iota} and {@link App} nodes, i.e. it could have been parsed. */
    boolean surface();

    JsonNode toJson();

    /** Appends this term in prefix surface syntax, each symbol followed by a space. */
    void unparse(Symbols symbols, StringBuilder sb);

    record Iota() implements Term {
        @Override
        public int size() {
            return 1;
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        public boolean surface() {
            return true;
        }

        @Override
        public JsonNode toJson() {
            return Json.node().put("type", "iota");
        }

        @Override
        public String toString() {
            return "Iota";
        }

        @Override
        public void unparse(Symbols symbols, StringBuilder sb) {
            sb.append(symbols.iota()).append(' ');
        }
    }

    record S() implements Term {
        @Override
        public int size() {
            return 1;
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        public boolean surface() {
            return false;
        }

        @Override
        public JsonNode toJson() {
            return Json.node().put("type", "S");
        }

        @Override
        public String toString() {
            return "S";
        }

        @Override
        public void unparse(Symbols symbols, StringBuilder sb) {
            sb.append(symbols.sSym()).append(' ');
        }
    }

    record K() implements Term {
        @Override
        public int size() {
            return 1;
        }

        @Override
        public int depth() {
            return 1;
        }

        @Override
        public boolean surface() {
            return false;
        }

        @Override
        public JsonNode toJson() {
            return Json.node().put("type", "K");
        }

        @Override
        public String toString() {
            return "K";
        }

        @Override
        public void unparse(Symbols symbols, StringBuilder sb) {
            sb.append(symbols.kSym()).append(' ');
        }
    }

    /**
     * Application of {@code left} to {@code right}. A subterm may sit under more than one parent after
     * a rewrite; terms are immutable, so the sharing cannot be observed.
     */
    record App(Term left, Term right) implements Term {
        public App {
            requireNonNull(left);
            requireNonNull(right);
        }

        @Override
        public int size() {
            return 1 + left.size() + right.size();
        }

        @Override
        public int depth() {
            return 1 + Math.max(left.depth(), right.depth());
        }

        @Override
        public boolean surface() {
            return left.surface() && right.surface();
        }

        @Override
        public JsonNode toJson() {
            var n = Json.node().put("type", "app");
            n.set("left", left.toJson());
            n.set("right", right.toJson());
            return n;
        }

        @Override
        public String toString() {
            return "App(" + left + ", " + right + ')';
        }

        @Override
        public void unparse(Symbols symbols, StringBuilder sb) {
            sb.append(symbols.apply()).append(' ');
            left.unparse(symbols, sb);
            right.unparse(symbols, sb);
        }
    }
}
