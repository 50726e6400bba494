package com.team.identity.knowledge;

import com.team.identity.core.model.ManualMapping;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OverrideFileLoaderTest {

    private final OverrideFileLoader loader = new OverrideFileLoader();

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should read a flat object in file order")
    void flatObject() throws IOException {
        Path file = dir.resolve("overrides.json");
        Files.writeString(file, "{\"Wolverhampton Wanderers\": \"Wolves\", \"1. FC Köln\": \"Köln\"}");

        List<ManualMapping> mappings = loader.load(file);

        assertEquals(List.of(
                new ManualMapping(null, "Wolverhampton Wanderers", "Wolves"),
                new ManualMapping(null, "1. FC Köln", "Köln")
        ), mappings);
    }

    @Test
    @DisplayName("Should read the test fixture from the classpath directory")
    void fixtureFile() throws Exception {
        Path fixture = Path.of(getClass().getResource("/override-mappings.json").toURI());

        List<ManualMapping> mappings = loader.load(fixture);

        assertEquals(2, mappings.size());
        assertEquals("Spurs", mappings.get(0).sourceName());
    }

    @Test
    @DisplayName("Missing file should raise OverrideFileException")
    void missingFile() {
        assertThrows(OverrideFileException.class, () -> loader.load(dir.resolve("absent.json")));
    }

    @Test
    @DisplayName("Invalid JSON should raise OverrideFileException")
    void invalidJson() throws IOException {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{\"Spurs\": ");

        OverrideFileException e = assertThrows(OverrideFileException.class, () -> loader.load(file));
        assertNotNull(e.getCause());
    }

    @Test
    @DisplayName("Nested values should raise OverrideFileException")
    void nestedValues() throws IOException {
        Path file = dir.resolve("nested.json");
        Files.writeString(file, "{\"Premier League\": {\"Spurs\": \"Tottenham\"}}");

        assertThrows(OverrideFileException.class, () -> loader.load(file));
    }
}
