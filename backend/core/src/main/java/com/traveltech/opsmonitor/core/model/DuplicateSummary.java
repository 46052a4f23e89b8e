package com.traveltech.opsmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Counts are distinct repeated keys, not total occurrences.
 */
public record DuplicateSummary(
        @JsonProperty("duplicate_urls") int duplicateUrls,
        @JsonProperty("duplicate_titles") int duplicateTitles,
        @JsonProperty("top_duplicate_urls") List<String> topDuplicateUrls,
        @JsonProperty("top_duplicate_titles") List<String> topDuplicateTitles
) {
}
