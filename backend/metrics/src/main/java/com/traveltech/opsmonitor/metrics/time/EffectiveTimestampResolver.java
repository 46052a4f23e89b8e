package com.traveltech.opsmonitor.metrics.time;

import com.traveltech.opsmonitor.core.model.ContentItem;

import java.time.Instant;
import java.util.Optional;

/**
 * Picks the instant an item is bucketed by: the source's publish date when it parses,
 * otherwise the scrape time.
 */
public final class EffectiveTimestampResolver {
    private EffectiveTimestampResolver() {
    }

    public static Optional<Instant> effective(ContentItem item) {
        Optional<Instant> published = publishedAt(item);
        return published.isPresent() ? published : parsedAt(item);
    }

    public static Optional<Instant> publishedAt(ContentItem item) {
        return DateNormalizer.normalize(item.publishedAt());
    }

    public static Optional<Instant> parsedAt(ContentItem item) {
        return DateNormalizer.normalize(item.parsedAt());
    }
}
