package com.traveltech.opsmonitor.metrics.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a title into lower-cased keyword tokens: runs of three or more Latin letters
 * (accents included, apostrophes allowed) that are not stop words. Order and repeats are kept.
 */
public class TitleTokenizer {
    private static final Pattern WORD = Pattern.compile("[A-Za-zÀ-ÖØ-öø-ÿ']{3,}");

    private final StopWords stopWords;

    public TitleTokenizer(StopWords stopWords) {
        this.stopWords = Objects.requireNonNull(stopWords, "stopWords is required");
    }

    public List<String> tokenize(String title) {
        if (title == null || title.isBlank()) {
            return List.of();
        }
        Matcher matcher = WORD.matcher(title);
        List<String> tokens = new ArrayList<>();
        while (matcher.find()) {
            String token = matcher.group().toLowerCase(Locale.ROOT);
            if (!stopWords.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
