package com.phillippitts.denoisebatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Configuration properties for the source separation engine.
 * Binds to properties prefixed with "engine.separation".
 *
 * <p>Example application.properties:
 * <pre>
 * engine.separation.command=python -m demucs.separate
 * engine.separation.timeout-seconds=900
 * engine.separation.work-dir=
 * </pre>
 *
 * @param command separation CLI, whitespace-separated; model and file arguments are appended
 * @param timeoutSeconds maximum time for separating one chunk
 * @param workDir parent directory for temp files; blank means the system temp directory
 * @param maxStderrBytes cap on captured CLI output
 */
@ConfigurationProperties(prefix = "engine.separation")
@Validated
public record SeparationEngineProperties(
        @DefaultValue("python -m demucs.separate")
        @NotBlank(message = "Separation command must not be blank")
        String command,

        @DefaultValue("900")
        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @DefaultValue("")
        String workDir,

        @DefaultValue("65536")
        @Positive(message = "Max stderr bytes must be positive")
        int maxStderrBytes
) {

    public static SeparationEngineProperties defaults() {
        return new SeparationEngineProperties("python -m demucs.separate", 900, "", 65536);
    }

    public List<String> commandParts() {
        return Arrays.asList(command.trim().split("\\s+"));
    }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }
}
