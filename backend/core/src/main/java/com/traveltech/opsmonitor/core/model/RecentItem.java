package com.traveltech.opsmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RecentItem(
        String title,
        String url,
        @JsonProperty("published_at") String publishedAt,
        @JsonProperty("parsed_at") String parsedAt
) {
    public static RecentItem from(ContentItem item) {
        return new RecentItem(item.title(), item.url(), item.publishedAt(), item.parsedAt());
    }
}
