package com.traveltech.opsmonitor.service.runtime;

import com.traveltech.opsmonitor.core.model.ContentItem;
import com.traveltech.opsmonitor.core.model.MetricsSnapshot;
import com.traveltech.opsmonitor.metrics.engine.MetricsAggregator;
import com.traveltech.opsmonitor.service.store.JsonlItemReader;
import com.traveltech.opsmonitor.service.store.SnapshotWriter;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Metrics step of the weekly pipeline: parsed items in, snapshot file out.
 */
public final class MetricsRun {
    private static final Logger LOGGER = Logger.getLogger(MetricsRun.class.getName());

    private final JsonlItemReader reader;
    private final MetricsAggregator aggregator;
    private final SnapshotWriter writer;

    public MetricsRun(JsonlItemReader reader, MetricsAggregator aggregator, SnapshotWriter writer) {
        this.reader = Objects.requireNonNull(reader, "reader is required");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator is required");
        this.writer = Objects.requireNonNull(writer, "writer is required");
    }

    public RunSummary run() {
        List<ContentItem> items = reader.readAll();
        LOGGER.info(() -> "Loaded " + items.size() + " items from " + reader.file());

        MetricsSnapshot snapshot = aggregator.aggregate(items);
        int undated = snapshot.itemsTotal() - snapshot.debug().effectiveParsed();
        if (undated > 0) {
            LOGGER.warning(() -> undated + " of " + snapshot.itemsTotal()
                    + " items have no parseable published_at or parsed_at; they only count toward totals and keywords");
        }

        writer.write(snapshot);
        LOGGER.info(() -> "[OK] metrics -> " + writer.file());
        return new RunSummary(snapshot.generatedAt(), snapshot.itemsTotal(), undated, writer.file());
    }

    public record RunSummary(Instant generatedAt, int itemsTotal, int undatedItems, Path output) {
    }
}
