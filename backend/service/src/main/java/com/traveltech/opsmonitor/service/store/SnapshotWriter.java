package com.traveltech.opsmonitor.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.traveltech.opsmonitor.core.model.MetricsSnapshot;
import com.traveltech.opsmonitor.core.util.JsonUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes the snapshot as pretty-printed UTF-8 JSON. The file is written beside the target and
 * moved into place, so readers never see a half-written snapshot.
 */
public class SnapshotWriter {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;

    public SnapshotWriter(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    public void write(MetricsSnapshot snapshot) {
        Path target = file.toAbsolutePath();
        Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.createDirectories(target.getParent());
            try (OutputStream out = Files.newOutputStream(temp)) {
                MAPPER.writerWithDefaultPrettyPrinter().writeValue(out, snapshot);
            }
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            discard(temp, e);
            throw new IllegalStateException("Failed writing metrics to " + file, e);
        }
    }

    private static void discard(Path temp, IOException cause) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupError) {
            cause.addSuppressed(cleanupError);
        }
    }
}
