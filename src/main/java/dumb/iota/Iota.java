package dumb.iota;

import dumb.iota.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Command line: evaluates a file, or the argument itself when no such file exists, and prints
 * each step of the reduction.
 */
public class Iota {
    private static final Logger logger = LoggerFactory.getLogger(Iota.class);

    public static void main(String[] args) {
        var code = run(args, System.out, System.err);
        if (code != 0) System.exit(code);
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        String configFile = null;
        Integer maxSteps = null;
        var json = false;
        String input = null;

        for (var i = 0; i < args.length; i++) {
            try {
                switch (args[i]) {
                    case "-n", "--max-steps" -> maxSteps = Integer.parseInt(args[++i]);
                    case "-c", "--config" -> configFile = args[++i];
                    case "-j", "--json" -> json = true;
                    case "-h", "--help" -> {
                        printUsage(out);
                        return 0;
                    }
                    default -> {
                        if (input != null) {
                            err.println("Unexpected argument: " + args[i]);
                            printUsage(err);
                            return 1;
                        }
                        input = args[i];
                    }
                }
            } catch (ArrayIndexOutOfBoundsException | NumberFormatException e) {
                err.printf("Error parsing argument for %s: %s%n", (i > 0 ? args[i - 1] : args[i]), e.getMessage());
                printUsage(err);
                return 1;
            }
        }
        if (input == null) {
            printUsage(err);
            return 1;
        }

        Config config;
        Symbols symbols;
        try {
            config = configFile != null ? Config.load(Path.of(configFile)) : Config.DEFAULT;
            if (maxSteps != null) config = config.withMaxSteps(maxSteps);
            if (json) config = config.withJson(true);
            symbols = config.symbols();
        } catch (IOException | IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return 1;
        }

        String source;
        try {
            source = source(input);
        } catch (IOException e) {
            err.println("Cannot read " + input + ": " + e.getMessage());
            return 1;
        }

        var interpreter = new Interpreter(symbols);
        var outcome = interpreter.run(source);
        if (outcome instanceof Interpreter.Outcome.Failure f) {
            err.println(f);
            return 1;
        }
        var success = (Interpreter.Outcome.Success) outcome;

        if (config.json()) {
            out.println(Json.str(interpreter.toJson(source, success.trace(config.maxSteps()))));
            return 0;
        }

        out.println(source);
        out.println();
        var steps = new Steps(success.term());
        var n = 0L;
        while (steps.hasNext() && n <= config.maxSteps()) {
            out.println(interpreter.renderer().render(steps.next().term()));
            n++;
        }
        if (steps.hasNext())
            err.printf("No normal form after %d steps; output truncated%n", config.maxSteps());
        return 0;
    }

    /** The file's lines concatenated when {@code arg} names a readable file, else {@code arg} itself. */
    static String source(String arg) throws IOException {
        Path p;
        try {
            p = Path.of(arg);
        } catch (InvalidPathException e) {
            return arg;
        }
        if (!Files.isRegularFile(p)) return arg;
        logger.debug("Reading source from {}", p);
        return String.join("", Files.readAllLines(p));
    }

    private static void printUsage(PrintStream s) {
        s.printf("Usage: java %s [-n max_steps] [-j] [-c config.json] <file | source>%n", Iota.class.getName());
        s.println("  -n, --max-steps N   stop after N rewrites (default " + Config.DEFAULT_MAX_STEPS + ")");
        s.println("  -j, --json          print the trace as JSON");
        s.println("  -c, --config FILE   read settings from a JSON file");
    }
}
