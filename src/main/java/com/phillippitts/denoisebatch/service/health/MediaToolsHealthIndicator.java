package com.phillippitts.denoisebatch.service.health;

import com.phillippitts.denoisebatch.config.properties.MediaProperties;
import com.phillippitts.denoisebatch.config.properties.NeuralEngineProperties;
import com.phillippitts.denoisebatch.service.process.ExternalProcessRunner;
import com.phillippitts.denoisebatch.service.process.ProcessFactory;
import com.phillippitts.denoisebatch.service.process.ProcessResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Health indicator for external media tools and engine models.
 *
 * <ul>
 *   <li>UP: media backend usable and RNNoise models directory present</li>
 *   <li>DEGRADED: media backend usable but models directory missing (neural engine unavailable)</li>
 *   <li>DOWN: ffmpeg or ffprobe cannot be run while the ffmpeg backend is selected</li>
 * </ul>
 *
 * <p>Tool checks run {@code -version} and are cached for a minute.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class MediaToolsHealthIndicator implements HealthIndicator {

    static final Duration VERSION_TIMEOUT = Duration.ofSeconds(5);
    static final Duration CACHE_TTL = Duration.ofMinutes(1);
    private static final int MAX_OUTPUT_CHARS = 4096;

    private final MediaProperties media;
    private final NeuralEngineProperties neural;
    private final ExternalProcessRunner runner;

    private volatile Health cached;
    private volatile Instant cachedAt = Instant.EPOCH;

    public MediaToolsHealthIndicator(MediaProperties media, NeuralEngineProperties neural,
                                     ProcessFactory processFactory) {
        this.media = media;
        this.neural = neural;
        this.runner = new ExternalProcessRunner(processFactory, MAX_OUTPUT_CHARS);
    }

    @Override
    public Health health() {
        Health current = cached;
        if (current != null && Instant.now().isBefore(cachedAt.plus(CACHE_TTL))) {
            return current;
        }
        current = check();
        cached = current;
        cachedAt = Instant.now();
        return current;
    }

    Health check() {
        Health.Builder builder = new Health.Builder();
        boolean toolsOk = true;
        builder.withDetail("backend", media.backend());
        if (media.usesFfmpeg()) {
            String ffmpeg = versionStatus(media.ffmpegPath());
            String ffprobe = versionStatus(media.ffprobePath());
            toolsOk = isOk(ffmpeg) && isOk(ffprobe);
            builder.withDetail("ffmpeg", ffmpeg).withDetail("ffprobe", ffprobe);
        }
        Path modelsDir = Paths.get(neural.modelsDir());
        boolean modelsOk = Files.isDirectory(modelsDir);
        builder.withDetail("modelsDir", modelsOk ? "accessible at " + modelsDir : "NOT FOUND at " + modelsDir);

        if (!toolsOk) {
            builder.down().withDetail("status", "Media tools unavailable");
        } else if (!modelsOk) {
            builder.status("DEGRADED").withDetail("status", "Neural denoise models missing");
        } else {
            builder.up().withDetail("status", "Media tools and models available");
        }
        return builder.build();
    }

    private String versionStatus(String executable) {
        try {
            ProcessResult result = runner.run(List.of(executable, "-version"), null, VERSION_TIMEOUT);
            if (!result.succeeded()) {
                return "unavailable (" + (result.timedOut() ? "timeout" : "exit " + result.exitCode()) + ")";
            }
            String firstLine = result.stdout().lines().findFirst().orElse("").trim();
            return "ok: " + firstLine;
        } catch (IOException e) {
            return "unavailable (" + e.getMessage() + ")";
        }
    }

    private static boolean isOk(String status) {
        return status.startsWith("ok");
    }
}
