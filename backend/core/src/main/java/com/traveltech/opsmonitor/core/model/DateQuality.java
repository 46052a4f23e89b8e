package com.traveltech.opsmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DateQuality(
        @JsonProperty("published_at_parsed") int publishedAtParsed,
        @JsonProperty("parsed_at_parsed") int parsedAtParsed,
        @JsonProperty("effective_dt_parsed") int effectiveParsed
) {
}
