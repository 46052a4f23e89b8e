package com.traveltech.opsmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record KeywordMetrics(
        @JsonProperty("top_global") List<TermCount> topGlobal,
        @JsonProperty("top_by_source") Map<String, List<TermCount>> topBySource,
        @JsonProperty("trending_last_7d_vs_prev_7d_global") List<TermDelta> trendingGlobal,
        @JsonProperty("trending_last_7d_vs_prev_7d_by_source") Map<String, List<TermDelta>> trendingBySource
) {
}
