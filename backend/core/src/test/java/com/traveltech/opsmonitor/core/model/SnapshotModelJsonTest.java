package com.traveltech.opsmonitor.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.traveltech.opsmonitor.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotModelJsonTest {
    private final ObjectMapper mapper = JsonUtils.objectMapper();

    @Test
    void itemReadsUpstreamFieldNamesAndIgnoresExtras() throws Exception {
        ContentItem item = mapper.readValue("""
                {"source":"lonelyplanet","title":"Lisbon on a budget","url":"https://example.com/lisbon",
                 "published_at":"Wed, 11 Feb 2026 09:07:10 GMT","parsed_at":"2026-02-12T10:00:00+00:00",
                 "author":"Ana","origin_file":"raw/lp.html","tags":["x"]}
                """, ContentItem.class);

        assertEquals("lonelyplanet", item.source());
        assertEquals("Wed, 11 Feb 2026 09:07:10 GMT", item.publishedAt());
        assertEquals("2026-02-12T10:00:00+00:00", item.parsedAt());
        assertEquals("raw/lp.html", item.originFile());
        assertNull(item.summary());
    }

    @Test
    void missingOrEmptySourceFallsBackToUnknown() {
        assertEquals("unknown", ContentItem.of(null, "t", null, null, null).sourceOrUnknown());
        assertEquals("unknown", ContentItem.of("", "t", null, null, null).sourceOrUnknown());
        assertEquals(" ", ContentItem.of(" ", "t", null, null, null).sourceOrUnknown());
        assertEquals("medium", ContentItem.of("medium", "t", null, null, null).sourceOrUnknown());
    }

    @Test
    void snapshotUsesRendererFieldNames() {
        MetricsSnapshot snapshot = new MetricsSnapshot(
                Instant.parse("2026-02-15T12:00:00Z"),
                1,
                Map.of("a", 1),
                Map.of("a", 1),
                Map.of("a", new RecentItem("Rome", "https://example.com/rome", null, "2026-02-14T00:00:00Z")),
                new CadenceMetrics(Map.of("2026-02-14", 1), Map.of("a", Map.of("2026-02-14", 1))),
                new KeywordMetrics(
                        List.of(new TermCount("rome", 1)),
                        Map.of("a", List.of(new TermCount("rome", 1))),
                        List.of(new TermDelta("rome", 1)),
                        Map.of("a", List.of(new TermDelta("rome", 1)))
                ),
                new DuplicateSummary(0, 0, List.of(), List.of()),
                new DateQuality(0, 1, 1)
        );

        JsonNode tree = mapper.valueToTree(snapshot);

        assertEquals("2026-02-15T12:00:00Z", tree.get("generated_at").asText());
        assertEquals(1, tree.get("items_total").asInt());
        assertEquals(1, tree.path("items_last_7d_by_source").path("a").asInt());
        assertTrue(tree.path("most_recent_item_by_source").path("a").path("published_at").isNull());
        assertEquals(1, tree.path("cadence_last_30d").path("items_per_day_by_source").path("a").path("2026-02-14").asInt());
        assertEquals("rome", tree.path("keywords").path("top_global").get(0).path("term").asText());
        assertEquals(1, tree.path("keywords").path("trending_last_7d_vs_prev_7d_global").get(0).path("delta").asInt());
        assertTrue(tree.path("keywords").path("trending_last_7d_vs_prev_7d_by_source").has("a"));
        assertTrue(tree.path("duplicates").has("top_duplicate_titles"));
        assertEquals(1, tree.path("debug").path("effective_dt_parsed").asInt());
        assertEquals(0, snapshot.itemsLast7d("missing"));
    }
}
