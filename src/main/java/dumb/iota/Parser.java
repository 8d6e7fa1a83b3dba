package dumb.iota;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Recursive descent over {@code term ::= IDENTITY | STAR term term}. Accepts exactly one term.
 */
public final class Parser {
    private static final Logger logger = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public static Term parse(List<Token> tokens) throws ParseException {
        requireNonNull(tokens);
        if (tokens.isEmpty()) throw new ParseException(Reason.EMPTY_PROGRAM, 0);

        var result = new Parser(tokens).term(0);
        if (result instanceof Parsed.Fail f) throw new ParseException(f.reason(), f.at());

        var ok = (Parsed.Ok) result;
        if (ok.next() != tokens.size())
            throw new ParseException(Reason.TRAILING_TOKENS, ok.next());

        logger.debug("Parsed {} tokens into a term of size {}", tokens.size(), ok.term().size());
        return ok.term();
    }

    /** Text to tokens to term; a scan failure never reaches the parser. */
    public static Term parse(String text) throws IotaException {
        return parse(Lexer.scan(text));
    }

    private Parsed term(int pos) {
        if (pos >= tokens.size()) return new Parsed.Fail(Reason.INCOMPLETE_APPLICATION, pos);
        return switch (tokens.get(pos)) {
            case IDENTITY -> new Parsed.Ok(Term.IOTA, pos + 1);
            case STAR -> application(pos);
        };
    }

    private Parsed application(int star) {
        var left = term(star + 1);
        if (left instanceof Parsed.Fail) return left;
        var l = (Parsed.Ok) left;

        var right = term(l.next());
        if (right instanceof Parsed.Fail) return right;
        var r = (Parsed.Ok) right;

        return new Parsed.Ok(new Term.App(l.term(), r.term()), r.next());
    }

    /** Outcome of parsing one subterm: the term and the position after it, or why it failed. */
    private sealed interface Parsed permits Parsed.Ok, Parsed.Fail {
        record Ok(Term term, int next) implements Parsed {
        }

        record Fail(Reason reason, int at) implements Parsed {
        }
    }

    public enum Reason {
        EMPTY_PROGRAM("empty program"),
        INCOMPLETE_APPLICATION("incomplete application"),
        TRAILING_TOKENS("trailing tokens");

        public final String text;

        Reason(String text) {
            this.text = text;
        }
    }

    public static class ParseException extends IotaException {
        private final Reason reason;
        private final int tokenIndex;

        public ParseException(Reason reason, int tokenIndex) {
            super(reason.text);
            this.reason = reason;
            this.tokenIndex = tokenIndex;
        }

        public Reason reason() {
            return reason;
        }

        public int tokenIndex() {
            return tokenIndex;
        }

        @Override
        public Interpreter.Phase phase() {
            return Interpreter.Phase.PARSE;
        }

        @Override
        public String getMessage() {
            var detail = switch (reason) {
                case EMPTY_PROGRAM -> "";
                case INCOMPLETE_APPLICATION -> ": an application requires two terms after it, input ended at token " + tokenIndex;
                case TRAILING_TOKENS -> ": a complete term ends before token " + tokenIndex;
            };
            return super.getMessage() + detail;
        }
    }
}
