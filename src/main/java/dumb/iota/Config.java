package dumb.iota;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dumb.iota.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/** Interpreter settings, read from a JSON file. Missing fields take their defaults. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Config(int maxSteps, String applySymbol, String iotaSymbol, boolean json) {
    private static final Logger logger = LoggerFactory.getLogger(Config.class);

    public static final int DEFAULT_MAX_STEPS = 10_000;
    /** Upper bound on {@code maxSteps}; a JSON trace keeps every term it reaches. */
    public static final int MAX_STEPS_LIMIT = 1_000_000;
    public static final Config DEFAULT = new Config(DEFAULT_MAX_STEPS,
            String.valueOf(Symbols.DEFAULT.apply()), String.valueOf(Symbols.DEFAULT.iota()), false);

    public Config {
        requireNonNull(applySymbol);
        requireNonNull(iotaSymbol);
        if (maxSteps < 0) throw new IllegalArgumentException("maxSteps must not be negative: " + maxSteps);
        if (maxSteps > MAX_STEPS_LIMIT)
            throw new IllegalArgumentException("maxSteps must not exceed " + MAX_STEPS_LIMIT + ": " + maxSteps);
        if (applySymbol.length() != 1 || iotaSymbol.length() != 1)
            throw new IllegalArgumentException("Symbols must be single characters: '" + applySymbol + "', '" + iotaSymbol + "'");
    }

    @JsonCreator
    public static Config create(
            @JsonProperty("maxSteps") Integer maxSteps,
            @JsonProperty("applySymbol") String applySymbol,
            @JsonProperty("iotaSymbol") String iotaSymbol,
            @JsonProperty("json") Boolean json
    ) {
        return new Config(
                maxSteps != null ? maxSteps : DEFAULT.maxSteps,
                applySymbol != null ? applySymbol : DEFAULT.applySymbol,
                iotaSymbol != null ? iotaSymbol : DEFAULT.iotaSymbol,
                json != null ? json : DEFAULT.json
        );
    }

    public static Config load(Path file) throws IOException {
        var c = Json.obj(file, Config.class);
        logger.info("Loaded configuration from {}: maxSteps={}, symbols='{}'/'{}'", file, c.maxSteps, c.applySymbol, c.iotaSymbol);
        return c;
    }

    @JsonIgnore
    public Symbols symbols() {
        return Symbols.of(applySymbol.charAt(0), iotaSymbol.charAt(0));
    }

    public Config withMaxSteps(int maxSteps) {
        return new Config(maxSteps, applySymbol, iotaSymbol, json);
    }

    public Config withJson(boolean json) {
        return new Config(maxSteps, applySymbol, iotaSymbol, json);
    }
}
