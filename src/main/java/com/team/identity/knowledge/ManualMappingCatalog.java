package com.team.identity.knowledge;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.identity.core.model.ManualMapping;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The curated manual mapping table shipped on the classpath, organized by competition.
 */
public final class ManualMappingCatalog {

    /** Classpath location of the built-in table. */
    public static final String DEFAULT_RESOURCE = "/manual-team-mappings.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ManualMappingCatalog() {
        // Utility class
    }

    /**
     * Loads the built-in table.
     */
    public static List<ManualMapping> loadBuiltIn() {
        return loadResource(DEFAULT_RESOURCE);
    }

    /**
     * Loads a competition-keyed table from the classpath, flattened in file order.
     *
     * @throws IllegalStateException if the resource does not exist
     * @throws UncheckedIOException  if the resource cannot be parsed
     */
    public static List<ManualMapping> loadResource(String resource) {
        try (InputStream in = ManualMappingCatalog.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Manual mapping resource not found: " + resource);
            }
            Map<String, LinkedHashMap<String, String>> byCompetition = MAPPER.readValue(in,
                    new TypeReference<LinkedHashMap<String, LinkedHashMap<String, String>>>() {});

            List<ManualMapping> mappings = new ArrayList<>();
            byCompetition.forEach((competition, entries) ->
                    entries.forEach((source, canonical) ->
                            mappings.add(new ManualMapping(competition, source, canonical))));
            return mappings;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read manual mapping resource " + resource, e);
        }
    }
}
