package com.team.identity.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes {@link MappingReport}s to indented JSON with ISO-8601 timestamps.
 */
public class MappingReportWriter {

    private final ObjectMapper objectMapper;

    public MappingReportWriter() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(MappingReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize mapping report", e);
        }
    }

    /**
     * Writes the report to a file, replacing any existing content.
     */
    public void write(MappingReport report, Path target) {
        try {
            Files.writeString(target, toJson(report));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write mapping report to " + target, e);
        }
    }
}
