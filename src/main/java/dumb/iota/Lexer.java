package dumb.iota;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Turns source text into tokens. Whitespace is skipped; any character that is neither of the
 * two input symbols stops the scan.
 */
public class Lexer {
    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);
    private static final int CONTEXT_BUFFER_SIZE = 20;

    public static final Lexer DEFAULT = new Lexer(Symbols.DEFAULT);

    private final Symbols symbols;

    public Lexer(Symbols symbols) {
        this.symbols = requireNonNull(symbols);
    }

    public static List<Token> scan(String text) throws ScanException {
        return DEFAULT.tokens(text);
    }

    public List<Token> tokens(String text) throws ScanException {
        requireNonNull(text);
        var tokens = new ArrayList<Token>(text.length());
        var line = 1;
        var col = 0;
        for (var pos = 0; pos < text.length(); pos++) {
            var c = text.charAt(pos);
            col++;
            if (c == symbols.apply()) {
                tokens.add(Token.STAR);
            } else if (c == symbols.iota()) {
                tokens.add(Token.IDENTITY);
            } else if (c == '\n') {
                line++;
                col = 0;
            } else if (!Character.isWhitespace(c)) {
                throw new ScanException(c, pos, line, col, context(text, pos));
            }
        }
        logger.debug("Scanned {} tokens from {} chars", tokens.size(), text.length());
        return tokens;
    }

    private static String context(String text, int pos) {
        var from = Math.max(0, pos - CONTEXT_BUFFER_SIZE);
        return text.substring(from, pos + 1);
    }

    public static class ScanException extends IotaException {
        private final char symbol;
        private final int offset;
        private final int line;
        private final int col;
        private final String context;

        public ScanException(char symbol, int offset, int line, int col, String context) {
            super("[" + symbol + "] is an invalid symbol in the syntax");
            this.symbol = symbol;
            this.offset = offset;
            this.line = line;
            this.col = col;
            this.context = context;
        }

        public char symbol() {
            return symbol;
        }

        public int offset() {
            return offset;
        }

        public int line() {
            return line;
        }

        public int col() {
            return col;
        }

        @Override
        public Interpreter.Phase phase() {
            return Interpreter.Phase.SCAN;
        }

        @Override
        public String getMessage() {
            var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
            return super.getMessage() + " at line " + line + ", col " + col + contextSnippet;
        }
    }
}
