package dumb.iota;

import com.fasterxml.jackson.databind.JsonNode;
import dumb.iota.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Source text in, reduction sequence out. Scanning and parsing each fail fast; a failed phase
 * stops every later one. Reduction itself never fails, but may not terminate, so the sequence
 * is handed back lazily.
 */
public final class Interpreter {
    private static final Logger logger = LoggerFactory.getLogger(Interpreter.class);

    public static final Interpreter DEFAULT = new Interpreter(Symbols.DEFAULT);

    private final Lexer lexer;
    private final Renderer renderer;

    public Interpreter(Symbols symbols) {
        this.lexer = new Lexer(symbols);
        this.renderer = new Renderer(symbols);
    }

    public Outcome run(String source) {
        requireNonNull(source);
        try {
            var tokens = lexer.tokens(source);
            logger.debug("Scan complete: {} tokens", tokens.size());
            var term = Parser.parse(tokens);
            logger.debug("Parse complete: term of size {}, depth {}", term.size(), term.depth());
            return new Outcome.Success(term, renderer);
        } catch (IotaException e) {
            logger.warn("{} error: {}", e.phase().label, e.getMessage());
            return new Outcome.Failure(e.phase(), e.getMessage());
        }
    }

    public Renderer renderer() {
        return renderer;
    }

    public enum Phase {
        SCAN("scan"),
        PARSE("parse");

        public final String label;

        Phase(String label) {
            this.label = label;
        }
    }

    public sealed interface Outcome permits Outcome.Success, Outcome.Failure {

        boolean ok();

        record Success(Term term, Renderer renderer) implements Outcome {
            public Success {
                requireNonNull(term);
                requireNonNull(renderer);
            }

            @Override
            public boolean ok() {
                return true;
            }

            /** A fresh lazy sequence starting at the parsed term. */
            public Iterator<Term> steps() {
                return Steps.of(term);
            }

            public Steps.Trace trace(int maxSteps) {
                var t = Steps.normalize(term, maxSteps);
                if (!t.normalForm())
                    logger.warn("Stopped after {} steps without reaching a normal form", maxSteps);
                return t;
            }

            /** The first {@code limit} terms, rendered. */
            public List<String> render(int limit) {
                return Steps.limit(term, limit).stream().map(renderer::render).toList();
            }
        }

        record Failure(Phase phase, String message) implements Outcome {
            public Failure {
                requireNonNull(phase);
                requireNonNull(message);
            }

            @Override
            public boolean ok() {
                return false;
            }

            @Override
            public String toString() {
                return phase.label + " error: " + message;
            }
        }
    }

    /** JSON document for a trace: source, rendered steps with the rule behind each, and termination. */
    public JsonNode toJson(String source, Steps.Trace trace) {
        var doc = Json.node().put("source", source);
        var steps = doc.putArray("steps");
        for (var s : trace.steps()) {
            var n = steps.addObject()
                    .put("index", s.index())
                    .put("term", renderer.render(s.term()).stripTrailing());
            if (s.rule() != null) n.put("rule", s.rule().name());
        }
        doc.put("normalForm", trace.normalForm());
        doc.put("truncated", !trace.normalForm());
        return doc;
    }
}
