package com.traveltech.opsmonitor.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.traveltech.opsmonitor.core.util.JsonUtils;
import com.traveltech.opsmonitor.metrics.config.MetricsSettings;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {
    public static final String METRICS_FILE = "metrics.json";

    private ConfigLoader() {
    }

    /**
     * Reads {@code metrics.json} from the config directory, falling back to defaults when the
     * file does not exist. A file that exists but cannot be read or bound fails fast.
     */
    public static MetricsSettings loadMetrics(Path configDir) {
        Path path = configDir.resolve(METRICS_FILE);
        if (!Files.exists(path)) {
            return MetricsSettings.defaults();
        }
        return read(path, new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            T value = JsonUtils.objectMapper().readValue(in, ref);
            if (value == null) {
                throw new IllegalStateException("Empty config in " + path);
            }
            return value;
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
