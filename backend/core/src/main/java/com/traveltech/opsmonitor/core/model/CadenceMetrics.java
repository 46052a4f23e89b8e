package com.traveltech.opsmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Item counts per UTC calendar day ({@code yyyy-MM-dd}) over the cadence window.
 */
public record CadenceMetrics(
        @JsonProperty("items_per_day_global") Map<String, Integer> itemsPerDayGlobal,
        @JsonProperty("items_per_day_by_source") Map<String, Map<String, Integer>> itemsPerDayBySource
) {
}
