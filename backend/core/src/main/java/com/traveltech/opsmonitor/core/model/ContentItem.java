package com.traveltech.opsmonitor.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One scraped travel-content item as produced by the fetch/parse stage.
 * Date fields are kept as the raw strings the source supplied.
 */
public record ContentItem(
        String source,
        String title,
        String url,
        @JsonProperty("published_at") String publishedAt,
        @JsonProperty("parsed_at") String parsedAt,
        String author,
        String summary,
        @JsonProperty("origin_file") String originFile
) {
    public static final String UNKNOWN_SOURCE = "unknown";

    public static ContentItem of(String source, String title, String url, String publishedAt, String parsedAt) {
        return new ContentItem(source, title, url, publishedAt, parsedAt, null, null, null);
    }

    public String sourceOrUnknown() {
        return source == null || source.isEmpty() ? UNKNOWN_SOURCE : source;
    }
}
