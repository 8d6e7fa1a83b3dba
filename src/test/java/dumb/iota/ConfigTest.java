package dumb.iota;

import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.iota.util.Json;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @Test
    void missingFieldsTakeDefaults() throws JsonProcessingException {
        var c = Json.obj("{\"maxSteps\": 25}", Config.class);
        assertEquals(25, c.maxSteps());
        assertEquals("*", c.applySymbol());
        assertEquals("i", c.iotaSymbol());
        assertFalse(c.json());
        assertEquals(Symbols.DEFAULT, c.symbols());
    }

    @Test
    void emptyObjectIsDefault() throws JsonProcessingException {
        assertEquals(Config.DEFAULT, Json.obj("{}", Config.class));
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        var file = dir.resolve("iota.json");
        Files.writeString(file, "{\"applySymbol\": \"`\", \"iotaSymbol\": \"x\", \"json\": true}");
        var c = Config.load(file);
        assertEquals(Symbols.of('`', 'x'), c.symbols());
        assertTrue(c.json());
        assertEquals(Config.DEFAULT_MAX_STEPS, c.maxSteps());
    }

    @Test
    void rejectsMultiCharacterSymbols() {
        assertThrows(JsonProcessingException.class, () -> Json.obj("{\"applySymbol\": \"**\"}", Config.class));
    }

    @Test
    void rejectsNegativeLimit() {
        assertThrows(IllegalArgumentException.class, () -> Config.DEFAULT.withMaxSteps(-1));
    }

    @Test
    void serializesFields() throws JsonProcessingException {
        var tree = Json.tree(Json.str(Config.DEFAULT));
        assertEquals(Config.DEFAULT_MAX_STEPS, tree.get("maxSteps").asInt());
        assertEquals("*", tree.get("applySymbol").asText());
        assertFalse(tree.has("symbols"));
    }

    @Test
    void capsStepLimit() {
        assertEquals(Config.MAX_STEPS_LIMIT, Config.DEFAULT.withMaxSteps(Config.MAX_STEPS_LIMIT).maxSteps());
        assertThrows(IllegalArgumentException.class, () -> Config.DEFAULT.withMaxSteps(Config.MAX_STEPS_LIMIT + 1));
        assertThrows(JsonProcessingException.class, () -> Json.obj("{\"maxSteps\": 2147483647}", Config.class));
    }
}
