package com.phillippitts.denoisebatch.config.media;

import com.phillippitts.denoisebatch.config.properties.MediaProperties;
import com.phillippitts.denoisebatch.exception.MediaException;
import com.phillippitts.denoisebatch.service.process.ExternalProcessRunner;
import com.phillippitts.denoisebatch.service.process.ProcessFactory;
import com.phillippitts.denoisebatch.service.process.ProcessResult;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Checks at startup that the configured media tools can be executed.
 *
 * Fail-fast: startup aborts with an actionable message when the ffmpeg backend is selected
 * but ffmpeg or ffprobe cannot be run. Disable with {@code media.validation.enabled=false}.
 */
@Component
@ConditionalOnProperty(name = "media.validation.enabled", havingValue = "true", matchIfMissing = true)
class MediaToolsValidationService {

    private static final Logger LOG = LogManager.getLogger(MediaToolsValidationService.class);

    private static final Duration VERSION_TIMEOUT = Duration.ofSeconds(10);
    private static final int MAX_OUTPUT_CHARS = 4096;

    private final MediaProperties media;
    private final ExternalProcessRunner runner;

    MediaToolsValidationService(MediaProperties media, ProcessFactory processFactory) {
        this.media = media;
        this.runner = new ExternalProcessRunner(processFactory, MAX_OUTPUT_CHARS);
    }

    @PostConstruct
    void validateOnStartup() {
        if (!media.usesFfmpeg()) {
            LOG.info("Media backend '{}' needs no external tools", media.backend());
            return;
        }
        LOG.info("Validating media tools... os={}, arch={}",
                System.getProperty("os.name"), System.getProperty("os.arch"));
        validateTool(media.ffmpegPath());
        validateTool(media.ffprobePath());
        LOG.info("Media tool validation complete: ffmpeg='{}', ffprobe='{}'",
                media.ffmpegPath(), media.ffprobePath());
    }

    // Visible for tests
    void validateTool(String executable) {
        ProcessResult result;
        try {
            result = runner.run(List.of(executable, "-version"), null, VERSION_TIMEOUT);
        } catch (IOException e) {
            throw new MediaException("Cannot run '" + executable + "': " + e.getMessage()
                    + ". Install FFmpeg or set media.ffmpeg-path / media.ffprobe-path.", executable, e);
        }
        if (!result.succeeded()) {
            throw result.describeFailure(executable).buildMediaException(executable);
        }
        LOG.debug("{}: {}", executable, result.stdout().lines().findFirst().orElse(""));
    }
}
