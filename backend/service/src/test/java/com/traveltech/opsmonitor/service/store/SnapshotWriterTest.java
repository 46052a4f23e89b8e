package com.traveltech.opsmonitor.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.traveltech.opsmonitor.core.model.ContentItem;
import com.traveltech.opsmonitor.core.model.MetricsSnapshot;
import com.traveltech.opsmonitor.core.util.JsonUtils;
import com.traveltech.opsmonitor.metrics.config.MetricsSettings;
import com.traveltech.opsmonitor.metrics.engine.MetricsAggregator;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotWriterTest {
    private static final Instant NOW = Instant.parse("2026-02-15T12:00:00Z");

    @Test
    void writesPrettyJsonCreatingParentsAndReplacingPreviousFile() throws Exception {
        Path file = Files.createTempDirectory("snapshot-").resolve("processed/metrics.json");
        MetricsSnapshot snapshot = MetricsAggregator.create(MetricsSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC))
                .aggregate(List.of(ContentItem.of("medium", "Sintra Palaces", "https://m.example/sintra",
                        "2026-02-14T10:00:00Z", "2026-02-15T06:00:00Z")));
        SnapshotWriter writer = new SnapshotWriter(file);

        writer.write(snapshot);
        writer.write(snapshot);

        String json = Files.readString(file);
        JsonNode tree = JsonUtils.objectMapper().readTree(json);
        assertTrue(json.contains("\n  \"items_total\" : 1"));
        assertEquals("2026-02-15T12:00:00Z", tree.get("generated_at").asText());
        assertEquals(1, tree.path("items_by_source").path("medium").asInt());
        assertEquals("sintra", tree.path("keywords").path("top_global").get(0).path("term").asText());
        assertFalse(Files.exists(file.resolveSibling("metrics.json.tmp")));
    }

    @Test
    void unwritableTargetFailsWithPath() throws Exception {
        Path blocker = Files.createTempFile("snapshot-blocker-", ".txt");
        Path file = blocker.resolve("metrics.json");
        MetricsSnapshot snapshot = MetricsAggregator.create(MetricsSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC))
                .aggregate(List.of());

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> new SnapshotWriter(file).write(snapshot));

        assertTrue(error.getMessage().contains("metrics.json"));
    }

    @Test
    void failedMoveLeavesNoTempFileBehind() throws Exception {
        Path dir = Files.createTempDirectory("snapshot-move-");
        Path file = dir.resolve("metrics.json");
        Files.createDirectories(file);
        Files.writeString(file.resolve("occupant.txt"), "x");
        MetricsSnapshot snapshot = MetricsAggregator.create(MetricsSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC))
                .aggregate(List.of());

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> new SnapshotWriter(file).write(snapshot));

        assertTrue(error.getMessage().contains("metrics.json"));
        assertFalse(Files.exists(dir.resolve("metrics.json.tmp")));
        assertTrue(Files.isDirectory(file));
    }
}
