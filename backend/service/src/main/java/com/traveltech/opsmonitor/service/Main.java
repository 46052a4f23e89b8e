package com.traveltech.opsmonitor.service;

import com.traveltech.opsmonitor.metrics.config.MetricsSettings;
import com.traveltech.opsmonitor.metrics.engine.MetricsAggregator;
import com.traveltech.opsmonitor.service.config.ConfigLoader;
import com.traveltech.opsmonitor.service.runtime.MetricsRun;
import com.traveltech.opsmonitor.service.store.JsonlItemReader;
import com.traveltech.opsmonitor.service.store.SnapshotWriter;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    static final String DEFAULT_INPUT = "data/processed/parsed_items.jsonl";
    static final String DEFAULT_OUTPUT = "data/processed/metrics.json";
    static final String DEFAULT_CONFIG_DIR = "config";

    private Main() {
    }

    public static void main(String[] args) {
        RuntimePaths paths = resolveRuntimePaths(System.getenv());
        try {
            MetricsSettings settings = ConfigLoader.loadMetrics(paths.configDir());
            MetricsRun run = new MetricsRun(
                    new JsonlItemReader(paths.input()),
                    MetricsAggregator.create(settings, Clock.systemUTC()),
                    new SnapshotWriter(paths.output())
            );
            run.run();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Metrics run failed", e);
            System.exit(1);
        }
    }

    static RuntimePaths resolveRuntimePaths(Map<String, String> env) {
        return new RuntimePaths(
                Path.of(valueOrDefault(env, "METRICS_INPUT", DEFAULT_INPUT)),
                Path.of(valueOrDefault(env, "METRICS_OUTPUT", DEFAULT_OUTPUT)),
                Path.of(valueOrDefault(env, "CONFIG_DIR", DEFAULT_CONFIG_DIR))
        );
    }

    private static String valueOrDefault(Map<String, String> env, String key, String fallback) {
        String value = env.get(key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    record RuntimePaths(Path input, Path output, Path configDir) {
    }
}
