package com.adlanda.transcriptsearch.service;

import com.adlanda.transcriptsearch.config.IngestionProperties;
import com.adlanda.transcriptsearch.model.Segment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads transcript segments from a JSON Lines file.
 *
 * Each line is an object with at least {@code id}, {@code text}, {@code start},
 * {@code end} and the configured group field. Every other non-null field is kept
 * as passthrough metadata.
 */
@Service
public class SegmentLoader {

    private static final Logger log = LoggerFactory.getLogger(SegmentLoader.class);

    private static final Set<String> CORE_FIELDS = Set.of("id", "text", "start", "end");

    private final ObjectMapper objectMapper;
    private final IngestionProperties properties;

    public SegmentLoader(ObjectMapper objectMapper, IngestionProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Loads all segments in file order.
     *
     * @param path JSON Lines file
     * @return the segments, in file order
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if a line is not a valid segment
     */
    public List<Segment> load(Path path) throws IOException {
        List<Segment> segments = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                segments.add(parse(line, lineNumber));
            }
        }

        log.info("Loaded {} segments from {}", segments.size(), path.getFileName());
        return segments;
    }

    Segment parse(String line, int lineNumber) {
        JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Line " + lineNumber + ": malformed JSON", e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Line " + lineNumber + ": expected a JSON object");
        }

        String groupField = properties.getGroupField();
        Map<String, Object> metadata = new LinkedHashMap<>();
        node.fields().forEachRemaining(field -> {
            if (!CORE_FIELDS.contains(field.getKey()) && !field.getValue().isNull()) {
                metadata.put(field.getKey(), objectMapper.convertValue(field.getValue(), Object.class));
            }
        });

        return new Segment(
                requiredText(node, "id", lineNumber),
                requiredText(node, groupField, lineNumber),
                requiredText(node, "text", lineNumber),
                requiredNumber(node, "start", lineNumber),
                requiredNumber(node, "end", lineNumber),
                metadata
        );
    }

    private String requiredText(JsonNode node, String field, int lineNumber) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw new IllegalArgumentException("Line " + lineNumber + ": missing field '" + field + "'");
        }
        return value.asText();
    }

    private double requiredNumber(JsonNode node, String field, int lineNumber) {
        JsonNode value = node.get(field);
        if (value != null && value.isNumber()) {
            return value.asDouble();
        }
        if (value != null && value.isTextual()) {
            try {
                return Double.parseDouble(value.asText());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                        "Line " + lineNumber + ": field '" + field + "' is not a number", e);
            }
        }
        throw new IllegalArgumentException("Line " + lineNumber + ": missing numeric field '" + field + "'");
    }
}
