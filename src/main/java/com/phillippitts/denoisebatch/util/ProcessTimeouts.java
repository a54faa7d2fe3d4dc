package com.phillippitts.denoisebatch.util;

import java.time.Duration;

/**
 * Standard timeout values for external tool processes and their stream readers.
 *
 * @see com.phillippitts.denoisebatch.service.process.ExternalProcessRunner
 * @see com.phillippitts.denoisebatch.service.media.ffmpeg.FfmpegMediaIoAdapter
 */
public final class ProcessTimeouts {

    /** Time allowed for stderr/stdout readers to flush after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort join of reader threads during cleanup; they are daemon threads. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /** Time a decoder process gets to exit once its output has been fully read. */
    public static final Duration DECODER_EXIT_TIMEOUT = Duration.ofSeconds(5);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
