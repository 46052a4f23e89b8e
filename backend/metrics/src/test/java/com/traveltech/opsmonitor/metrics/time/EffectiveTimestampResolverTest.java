package com.traveltech.opsmonitor.metrics.time;

import com.traveltech.opsmonitor.core.model.ContentItem;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EffectiveTimestampResolverTest {
    @Test
    void publishedDateWinsWhenItParses() {
        ContentItem item = ContentItem.of("a", "t", null, "Wed, 11 Feb 2026 09:07:10 GMT", "2026-02-14T00:00:00Z");

        assertEquals(Optional.of(Instant.parse("2026-02-11T09:07:10Z")), EffectiveTimestampResolver.effective(item));
    }

    @Test
    void invalidPublishedDateFallsBackToParsedAt() {
        ContentItem item = ContentItem.of("a", "t", null, "last Tuesday", "2026-02-14T00:00:00Z");

        assertEquals(Optional.of(Instant.parse("2026-02-14T00:00:00Z")), EffectiveTimestampResolver.effective(item));
        assertTrue(EffectiveTimestampResolver.publishedAt(item).isEmpty());
    }

    @Test
    void bothInvalidResolvesToAbsent() {
        ContentItem item = ContentItem.of("a", "t", null, "soon", "n/a");

        assertTrue(EffectiveTimestampResolver.effective(item).isEmpty());
        assertTrue(EffectiveTimestampResolver.effective(ContentItem.of("a", "t", null, null, null)).isEmpty());
    }
}
