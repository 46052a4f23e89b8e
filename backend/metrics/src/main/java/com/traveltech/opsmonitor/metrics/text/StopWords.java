package com.traveltech.opsmonitor.metrics.text;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Terms dropped from title keywords. The bundled list covers English and Spanish function
 * words plus generic travel vocabulary that would otherwise dominate every ranking.
 */
public final class StopWords {
    public static final String DEFAULT_RESOURCE = "/stopwords/en-es-travel.txt";

    private final Set<String> words;

    private StopWords(Set<String> words) {
        this.words = Set.copyOf(words);
    }

    public static StopWords defaults() {
        return fromResource(DEFAULT_RESOURCE);
    }

    public static StopWords fromResource(String classpathResource) {
        Set<String> out = new HashSet<>();
        try (InputStream in = StopWords.class.getResourceAsStream(classpathResource)) {
            if (in == null) {
                throw new IllegalStateException("Stop-word list not found: " + classpathResource);
            }
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    line = line.strip();
                    if (!line.isEmpty() && !line.startsWith("#")) {
                        out.add(line.toLowerCase(Locale.ROOT));
                    }
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading stop-word list " + classpathResource, e);
        }
        return new StopWords(out);
    }

    public static StopWords of(Collection<String> words) {
        Objects.requireNonNull(words, "words is required");
        return new StopWords(normalized(words));
    }

    public StopWords withExtras(Collection<String> extras) {
        if (extras == null || extras.isEmpty()) {
            return this;
        }
        Set<String> merged = new HashSet<>(words);
        merged.addAll(normalized(extras));
        return new StopWords(merged);
    }

    public boolean contains(String token) {
        return words.contains(token);
    }

    public Set<String> asSet() {
        return words;
    }

    private static Set<String> normalized(Collection<String> words) {
        Set<String> out = new HashSet<>();
        for (String word : words) {
            if (word != null && !word.isBlank()) {
                out.add(word.strip().toLowerCase(Locale.ROOT));
            }
        }
        return out;
    }
}
