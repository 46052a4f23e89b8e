package com.traveltech.opsmonitor.metrics.engine;

import com.traveltech.opsmonitor.core.model.ContentItem;
import com.traveltech.opsmonitor.core.model.RecentItem;

import java.time.Instant;
import java.util.List;

/**
 * Accumulators for a single source within one aggregation pass.
 */
final class SourceStats {
    int total;
    int recent;
    final Tally<String> itemsPerDay = new Tally<>();
    final Tally<String> keywords = new Tally<>();
    final Tally<String> recentKeywords = new Tally<>();
    final Tally<String> previousKeywords = new Tally<>();

    private RecentItem mostRecent;
    private Instant mostRecentAt;

    /**
     * The first item seen always becomes the current pick, dated or not. Later items
     * replace it only when they carry a date newer than the pick's, or the pick has none.
     */
    void offerMostRecent(ContentItem item, Instant effective) {
        boolean replace = mostRecent == null
                || (effective != null && (mostRecentAt == null || effective.isAfter(mostRecentAt)));
        if (replace) {
            mostRecent = RecentItem.from(item);
            mostRecentAt = effective;
        }
    }

    RecentItem mostRecent() {
        return mostRecent;
    }

    void addKeywords(List<String> tokens, boolean inRecentWindow, boolean inPreviousWindow) {
        keywords.addAll(tokens);
        if (inRecentWindow) {
            recentKeywords.addAll(tokens);
        } else if (inPreviousWindow) {
            previousKeywords.addAll(tokens);
        }
    }
}
