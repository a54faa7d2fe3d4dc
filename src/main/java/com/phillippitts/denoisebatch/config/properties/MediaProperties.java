package com.phillippitts.denoisebatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the media I/O backend.
 * Binds to properties prefixed with "media".
 *
 * <p>Example application.properties:
 * <pre>
 * media.backend=ffmpeg
 * media.ffmpeg-path=ffmpeg
 * media.ffprobe-path=ffprobe
 * media.probe-timeout-seconds=30
 * media.encode-timeout-seconds=600
 * media.chunk-millis=1000
 * media.max-stderr-bytes=65536
 * </pre>
 *
 * @param backend {@code ffmpeg} for any allow-listed container, {@code wav} for the pure-Java WAV codec
 * @param ffmpegPath ffmpeg executable (name on PATH or absolute path)
 * @param ffprobePath ffprobe executable
 * @param probeTimeoutSeconds maximum time for one ffprobe call
 * @param encodeTimeoutSeconds maximum time the encoder may take to finish after its input is closed
 * @param chunkMillis length of each decoded buffer
 * @param maxStderrBytes cap on captured stderr per process
 */
@ConfigurationProperties(prefix = "media")
@Validated
public record MediaProperties(
        @DefaultValue("ffmpeg")
        @Pattern(regexp = "ffmpeg|wav", message = "Media backend must be 'ffmpeg' or 'wav'")
        String backend,

        @DefaultValue("ffmpeg")
        @NotBlank(message = "ffmpeg path must not be blank")
        String ffmpegPath,

        @DefaultValue("ffprobe")
        @NotBlank(message = "ffprobe path must not be blank")
        String ffprobePath,

        @DefaultValue("30")
        @Positive(message = "Probe timeout must be positive")
        int probeTimeoutSeconds,

        @DefaultValue("600")
        @Positive(message = "Encode timeout must be positive")
        int encodeTimeoutSeconds,

        @DefaultValue("1000")
        @Positive(message = "Chunk length must be positive")
        int chunkMillis,

        @DefaultValue("65536")
        @Positive(message = "Max stderr bytes must be positive")
        int maxStderrBytes
) {

    public static MediaProperties defaults() {
        return new MediaProperties("ffmpeg", "ffmpeg", "ffprobe", 30, 600, 1000, 65536);
    }

    public Duration probeTimeout() {
        return Duration.ofSeconds(probeTimeoutSeconds);
    }

    public Duration encodeTimeout() {
        return Duration.ofSeconds(encodeTimeoutSeconds);
    }

    public boolean usesFfmpeg() {
        return "ffmpeg".equals(backend);
    }
}
