package com.traveltech.opsmonitor.metrics.config;

import com.traveltech.opsmonitor.metrics.text.StopWords;

import java.time.Duration;
import java.util.List;

/**
 * Aggregation knobs, read from {@code metrics.json}. Absent values take the defaults.
 * The previous trending window is the {@code recentWindow} immediately before the recent one.
 */
public record MetricsSettings(
        Duration recentWindow,
        Duration cadenceWindow,
        Integer topGlobal,
        Integer topPerSource,
        Integer trendingGlobal,
        Integer trendingPerSource,
        Integer duplicateSamples,
        List<String> stopWords,
        List<String> extraStopWords
) {
    public static final Duration DEFAULT_RECENT_WINDOW = Duration.ofDays(7);
    public static final Duration DEFAULT_CADENCE_WINDOW = Duration.ofDays(30);

    public MetricsSettings {
        recentWindow = positive("recentWindow", recentWindow == null ? DEFAULT_RECENT_WINDOW : recentWindow);
        cadenceWindow = positive("cadenceWindow", cadenceWindow == null ? DEFAULT_CADENCE_WINDOW : cadenceWindow);
        topGlobal = positive("topGlobal", topGlobal == null ? 20 : topGlobal);
        topPerSource = positive("topPerSource", topPerSource == null ? 15 : topPerSource);
        trendingGlobal = positive("trendingGlobal", trendingGlobal == null ? 20 : trendingGlobal);
        trendingPerSource = positive("trendingPerSource", trendingPerSource == null ? 15 : trendingPerSource);
        duplicateSamples = positive("duplicateSamples", duplicateSamples == null ? 10 : duplicateSamples);
        stopWords = stopWords == null ? null : List.copyOf(stopWords);
        extraStopWords = extraStopWords == null ? List.of() : List.copyOf(extraStopWords);
    }

    public static MetricsSettings defaults() {
        return new MetricsSettings(null, null, null, null, null, null, null, null, null);
    }

    public StopWords stopWordSet() {
        StopWords base = stopWords == null ? StopWords.defaults() : StopWords.of(stopWords);
        return base.withExtras(extraStopWords);
    }

    private static Duration positive(String name, Duration value) {
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
        return value;
    }

    private static Integer positive(String name, Integer value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
        return value;
    }
}
