package com.traveltech.opsmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Result of one aggregation run over a batch of {@link ContentItem}s.
 * Read-only input for the report and dashboard renderers.
 */
public record MetricsSnapshot(
        @JsonProperty("generated_at") Instant generatedAt,
        @JsonProperty("items_total") int itemsTotal,
        @JsonProperty("items_by_source") Map<String, Integer> itemsBySource,
        @JsonProperty("items_last_7d_by_source") Map<String, Integer> itemsLast7dBySource,
        @JsonProperty("most_recent_item_by_source") Map<String, RecentItem> mostRecentItemBySource,
        @JsonProperty("cadence_last_30d") CadenceMetrics cadenceLast30d,
        KeywordMetrics keywords,
        DuplicateSummary duplicates,
        DateQuality debug
) {
    public int itemsLast7d(String source) {
        return itemsLast7dBySource.getOrDefault(source, 0);
    }
}
