package com.traveltech.opsmonitor.metrics.engine;

import com.traveltech.opsmonitor.core.model.CadenceMetrics;
import com.traveltech.opsmonitor.core.model.ContentItem;
import com.traveltech.opsmonitor.core.model.DateQuality;
import com.traveltech.opsmonitor.core.model.DuplicateSummary;
import com.traveltech.opsmonitor.core.model.KeywordMetrics;
import com.traveltech.opsmonitor.core.model.MetricsSnapshot;
import com.traveltech.opsmonitor.core.model.RecentItem;
import com.traveltech.opsmonitor.core.model.TermCount;
import com.traveltech.opsmonitor.core.model.TermDelta;
import com.traveltech.opsmonitor.metrics.config.MetricsSettings;
import com.traveltech.opsmonitor.metrics.text.TitleTokenizer;
import com.traveltech.opsmonitor.metrics.time.EffectiveTimestampResolver;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Builds a {@link MetricsSnapshot} from a batch of scraped items in a single pass.
 *
 * <p>"Now" is read once per call from the injected clock. Every call starts from empty
 * accumulators, so one instance can serve independent batches concurrently. Items with
 * missing fields or unparseable dates are absorbed into the counts instead of failing the run.
 *
 * <p>Windows are lower-bounded only: an item dated after "now" still counts as recent.
 */
public final class MetricsAggregator {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final ContentItem EMPTY_ITEM = new ContentItem(null, null, null, null, null, null, null, null);

    private final MetricsSettings settings;
    private final TitleTokenizer tokenizer;
    private final Clock clock;

    public MetricsAggregator(MetricsSettings settings, TitleTokenizer tokenizer, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings is required");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    public static MetricsAggregator create(MetricsSettings settings, Clock clock) {
        return new MetricsAggregator(settings, new TitleTokenizer(settings.stopWordSet()), clock);
    }

    public MetricsSnapshot aggregate(List<ContentItem> items) {
        Objects.requireNonNull(items, "items is required");
        Pass pass = new Pass(clock.instant());
        for (ContentItem item : items) {
            pass.add(item == null ? EMPTY_ITEM : item);
        }
        return pass.snapshot();
    }

    static String normalizeTitle(String title) {
        return WHITESPACE.matcher(strip(title).toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    /**
     * Strips Unicode whitespace, NBSP included, which {@link String#strip()} keeps.
     */
    static String strip(String value) {
        return value == null ? "" : EDGE_WHITESPACE.matcher(value).replaceAll("");
    }

    private final class Pass {
        private final Instant now;
        private final Instant recentStart;
        private final Instant previousStart;
        private final Instant cadenceStart;

        private final Map<String, SourceStats> sources = new LinkedHashMap<>();
        private final Tally<String> urls = new Tally<>();
        private final Tally<String> titles = new Tally<>();
        private final Tally<String> itemsPerDay = new Tally<>();
        private final Tally<String> keywords = new Tally<>();
        private final Tally<String> recentKeywords = new Tally<>();
        private final Tally<String> previousKeywords = new Tally<>();
        private int itemsTotal;
        private int publishedParsed;
        private int parsedAtParsed;
        private int effectiveParsed;

        private Pass(Instant now) {
            this.now = now;
            this.recentStart = now.minus(settings.recentWindow());
            this.previousStart = recentStart.minus(settings.recentWindow());
            this.cadenceStart = now.minus(settings.cadenceWindow());
        }

        private void add(ContentItem item) {
            itemsTotal++;
            SourceStats stats = sources.computeIfAbsent(item.sourceOrUnknown(), ignored -> new SourceStats());
            stats.total++;

            String url = strip(item.url());
            if (!url.isEmpty()) {
                urls.increment(url);
            }
            String title = strip(item.title());
            if (!title.isEmpty()) {
                titles.increment(normalizeTitle(title));
            }

            Optional<Instant> published = EffectiveTimestampResolver.publishedAt(item);
            Optional<Instant> parsedAt = EffectiveTimestampResolver.parsedAt(item);
            if (published.isPresent()) {
                publishedParsed++;
            }
            if (parsedAt.isPresent()) {
                parsedAtParsed++;
            }
            Instant effective = published.or(() -> parsedAt).orElse(null);

            boolean inRecentWindow = false;
            boolean inPreviousWindow = false;
            if (effective != null) {
                effectiveParsed++;
                inRecentWindow = !effective.isBefore(recentStart);
                inPreviousWindow = !inRecentWindow && !effective.isBefore(previousStart);
                if (inRecentWindow) {
                    stats.recent++;
                }
                if (!effective.isBefore(cadenceStart)) {
                    String day = effective.atZone(ZoneOffset.UTC).toLocalDate().toString();
                    itemsPerDay.increment(day);
                    stats.itemsPerDay.increment(day);
                }
            }

            stats.offerMostRecent(item, effective);

            List<String> tokens = tokenizer.tokenize(title);
            if (!tokens.isEmpty()) {
                stats.addKeywords(tokens, inRecentWindow, inPreviousWindow);
                keywords.addAll(tokens);
                if (inRecentWindow) {
                    recentKeywords.addAll(tokens);
                } else if (inPreviousWindow) {
                    previousKeywords.addAll(tokens);
                }
            }
        }

        private MetricsSnapshot snapshot() {
            Map<String, Integer> bySource = new LinkedHashMap<>();
            Map<String, Integer> recentBySource = new LinkedHashMap<>();
            Map<String, RecentItem> mostRecent = new LinkedHashMap<>();
            Map<String, Map<String, Integer>> perDayBySource = new LinkedHashMap<>();
            Map<String, List<TermCount>> topBySource = new LinkedHashMap<>();
            Map<String, List<TermDelta>> trendingBySource = new LinkedHashMap<>();

            for (Map.Entry<String, SourceStats> entry : sources.entrySet()) {
                String source = entry.getKey();
                SourceStats stats = entry.getValue();
                bySource.put(source, stats.total);
                if (stats.recent > 0) {
                    recentBySource.put(source, stats.recent);
                }
                mostRecent.put(source, stats.mostRecent());
                if (!stats.itemsPerDay.isEmpty()) {
                    perDayBySource.put(source, stats.itemsPerDay.asMap());
                }
                if (!stats.keywords.isEmpty()) {
                    topBySource.put(source, topTerms(stats.keywords, settings.topPerSource()));
                }
                trendingBySource.put(source, trendingTerms(
                        stats.recentKeywords, stats.previousKeywords, settings.trendingPerSource()));
            }

            CadenceMetrics cadence = new CadenceMetrics(itemsPerDay.asMap(), Collections.unmodifiableMap(perDayBySource));
            KeywordMetrics keywordMetrics = new KeywordMetrics(
                    topTerms(keywords, settings.topGlobal()),
                    Collections.unmodifiableMap(topBySource),
                    trendingTerms(recentKeywords, previousKeywords, settings.trendingGlobal()),
                    Collections.unmodifiableMap(trendingBySource)
            );
            DuplicateSummary duplicates = new DuplicateSummary(
                    urls.countAbove(1),
                    titles.countAbove(1),
                    urls.keysWithCountAbove(1, settings.duplicateSamples()),
                    titles.keysWithCountAbove(1, settings.duplicateSamples())
            );

            return new MetricsSnapshot(
                    now,
                    itemsTotal,
                    Collections.unmodifiableMap(bySource),
                    Collections.unmodifiableMap(recentBySource),
                    Collections.unmodifiableMap(mostRecent),
                    cadence,
                    keywordMetrics,
                    duplicates,
                    new DateQuality(publishedParsed, parsedAtParsed, effectiveParsed)
            );
        }
    }

    private static List<TermCount> topTerms(Tally<String> tally, int limit) {
        return tally.ranked(limit).stream()
                .map(entry -> new TermCount(entry.getKey(), entry.getValue()))
                .toList();
    }

    private static List<TermDelta> trendingTerms(Tally<String> recent, Tally<String> previous, int limit) {
        return recent.positiveDifference(previous).ranked(limit).stream()
                .map(entry -> new TermDelta(entry.getKey(), entry.getValue()))
                .toList();
    }
}
