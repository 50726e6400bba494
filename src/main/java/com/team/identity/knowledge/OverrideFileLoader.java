package com.team.identity.knowledge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.identity.core.model.ManualMapping;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads the operator-maintained override file: a flat JSON object of
 * provider name to canonical name.
 *
 * <pre>
 * {
 *   "Wolverhampton Wanderers": "Wolves",
 *   "Nottingham Forest": "Nottm Forest"
 * }
 * </pre>
 */
public class OverrideFileLoader {

    private final ObjectMapper objectMapper;

    public OverrideFileLoader() {
        this(new ObjectMapper());
    }

    public OverrideFileLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the entries in file order. Override entries carry no competition.
     *
     * @throws OverrideFileException if the file is missing, unreadable or malformed
     */
    public List<ManualMapping> load(Path path) {
        if (!Files.isReadable(path)) {
            throw new OverrideFileException("Override file not readable: " + path);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(path.toFile());
        } catch (IOException e) {
            throw new OverrideFileException("Override file is not valid JSON: " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new OverrideFileException("Override file must contain a JSON object: " + path);
        }

        List<ManualMapping> mappings = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new OverrideFileException(
                        "Override entry '" + field.getKey() + "' must map to a string in " + path);
            }
            mappings.add(new ManualMapping(null, field.getKey(), field.getValue().asText()));
        }
        return mappings;
    }
}
