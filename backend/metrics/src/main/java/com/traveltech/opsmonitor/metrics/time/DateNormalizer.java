package com.traveltech.opsmonitor.metrics.time;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Parses the date strings found in scraped items into UTC instants.
 *
 * <p>ISO-8601 is tried first ({@code 2026-02-11T09:07:10Z}, {@code 2026-02-11 09:07:10+01:00},
 * {@code 2026-02-11}), then the RFC-822 style used by RSS {@code pubDate}
 * ({@code Wed, 11 Feb 2026 09:07:10 GMT}, {@code 11 Feb 2026 09:07:10 +0000}).
 * Values without an offset are read as UTC. Anything else yields an empty result.
 */
public final class DateNormalizer {
    private static final DateTimeFormatter ISO = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
            .appendLiteral('T')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart()
            .appendOffset("+HH:MM:ss", "Z")
            .optionalEnd()
            .optionalStart()
            .appendOffset("+HHmm", "Z")
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    private static final DateTimeFormatter RFC_822 = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d MMM yyyy HH:mm")
            .optionalStart()
            .appendPattern(":ss")
            .optionalEnd()
            .optionalStart()
            .appendLiteral(' ')
            .appendOffset("+HHMM", "GMT")
            .optionalEnd()
            .toFormatter(Locale.ENGLISH);

    private static final Pattern DAY_NAME_PREFIX = Pattern.compile("^[A-Za-z]{2,9},\\s*");
    private static final Pattern UTC_ALIAS_SUFFIX = Pattern.compile("\\s+(UTC|UT|Z)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern ISO_SPACE_SEPARATOR = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}) (\\d)");

    private static final List<Function<String, Instant>> PARSERS = List.of(
            DateNormalizer::parseIso,
            DateNormalizer::parseRfc822
    );

    private DateNormalizer() {
    }

    public static Optional<Instant> normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        return PARSERS.stream()
                .map(parser -> safelyParse(parser, value))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .findFirst();
    }

    private static Instant parseIso(String value) {
        String candidate = ISO_SPACE_SEPARATOR.matcher(value).replaceFirst("$1T$2");
        TemporalAccessor parsed = ISO.parseBest(candidate, OffsetDateTime::from, LocalDateTime::from, LocalDate::from);
        return toInstant(parsed);
    }

    private static Instant parseRfc822(String value) {
        String candidate = DAY_NAME_PREFIX.matcher(value).replaceFirst("");
        candidate = UTC_ALIAS_SUFFIX.matcher(candidate).replaceFirst(" GMT");
        TemporalAccessor parsed = RFC_822.parseBest(candidate, OffsetDateTime::from, LocalDateTime::from);
        return toInstant(parsed);
    }

    private static Instant toInstant(TemporalAccessor parsed) {
        if (parsed instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (parsed instanceof LocalDateTime localDateTime) {
            return localDateTime.toInstant(ZoneOffset.UTC);
        }
        return ((LocalDate) parsed).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    private static Optional<Instant> safelyParse(Function<String, Instant> parser, String value) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }
}
