package com.phillippitts.denoisebatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the RNNoise engine.
 * Binds to properties prefixed with "engine.neural".
 *
 * <p>Example application.properties:
 * <pre>
 * engine.neural.ffmpeg-path=ffmpeg
 * engine.neural.models-dir=models
 * engine.neural.timeout-seconds=120
 * </pre>
 *
 * @param ffmpegPath ffmpeg executable with the arnndn filter compiled in
 * @param modelsDir directory holding the standard {@code bd/cb/mp/sh.rnnn} models
 * @param timeoutSeconds maximum time for filtering one chunk
 * @param maxStderrBytes cap on captured ffmpeg output
 */
@ConfigurationProperties(prefix = "engine.neural")
@Validated
public record NeuralEngineProperties(
        @DefaultValue("ffmpeg")
        @NotBlank(message = "ffmpeg path must not be blank")
        String ffmpegPath,

        @DefaultValue("models")
        @NotBlank(message = "Models directory must not be blank")
        String modelsDir,

        @DefaultValue("120")
        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @DefaultValue("65536")
        @Positive(message = "Max stderr bytes must be positive")
        int maxStderrBytes
) {

    public static NeuralEngineProperties defaults() {
        return new NeuralEngineProperties("ffmpeg", "models", 120, 65536);
    }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }
}
