package com.traveltech.opsmonitor.service.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traveltech.opsmonitor.core.model.ContentItem;
import com.traveltech.opsmonitor.core.util.JsonUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the parsed-items file: one JSON object per line, blank lines ignored.
 */
public class JsonlItemReader {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;

    public JsonlItemReader(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public List<ContentItem> readAll() {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading items from " + file, e);
        }
        List<ContentItem> items = new ArrayList<>();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            ContentItem item;
            try {
                item = MAPPER.readValue(line.strip(), ContentItem.class);
            } catch (JsonProcessingException decodeError) {
                throw new IllegalStateException("Invalid JSONL item at line " + lineNumber + " of " + file, decodeError);
            }
            if (item == null) {
                throw new IllegalStateException("Invalid JSONL item at line " + lineNumber + " of " + file);
            }
            items.add(item);
        }
        return items;
    }
}
