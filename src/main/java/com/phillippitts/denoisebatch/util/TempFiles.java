package com.phillippitts.denoisebatch.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Cleanup of per-job temp directories. Failures are logged, never thrown, since cleanup runs in
 * finally blocks.
 */
public final class TempFiles {

    private static final Logger LOG = LogManager.getLogger(TempFiles.class);

    private TempFiles() {
        // Utility class - prevent instantiation
    }

    /**
     * Creates a temp directory under {@code parent}, or under the system temp directory when
     * {@code parent} is null or blank.
     */
    public static Path createDirectory(String parent, String prefix) throws IOException {
        if (parent == null || parent.isBlank()) {
            return Files.createTempDirectory(prefix);
        }
        Path base = Path.of(parent);
        Files.createDirectories(base);
        return Files.createTempDirectory(base, prefix);
    }

    public static void deleteRecursively(Path root) {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.reverseOrder()).forEach(TempFiles::deleteQuietly);
        } catch (IOException e) {
            LOG.warn("Failed to walk temp directory {}: {}", root, e.toString());
        }
    }

    public static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Failed to delete {}: {}", path, e.toString());
        }
    }
}
