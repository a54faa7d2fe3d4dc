package com.phillippitts.denoisebatch.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Bounds for preview windows.
 * Binds to properties prefixed with "preview".
 *
 * @param minDurationSeconds shortest window a caller may request
 * @param maxDurationSeconds longest window a caller may request
 * @param defaultDurationSeconds window used when the caller does not specify one
 */
@ConfigurationProperties(prefix = "preview")
@Validated
public record PreviewProperties(
        @DefaultValue("5")
        @Positive(message = "Minimum preview duration must be positive")
        double minDurationSeconds,

        @DefaultValue("30")
        @Positive(message = "Maximum preview duration must be positive")
        double maxDurationSeconds,

        @DefaultValue("10")
        @Positive(message = "Default preview duration must be positive")
        double defaultDurationSeconds
) {

    public PreviewProperties {
        if (minDurationSeconds > maxDurationSeconds) {
            throw new IllegalArgumentException("preview.min-duration-seconds must not exceed "
                    + "preview.max-duration-seconds");
        }
        if (defaultDurationSeconds < minDurationSeconds || defaultDurationSeconds > maxDurationSeconds) {
            throw new IllegalArgumentException("preview.default-duration-seconds must lie within the min/max bounds");
        }
    }

    public static PreviewProperties defaults() {
        return new PreviewProperties(5, 30, 10);
    }
}
