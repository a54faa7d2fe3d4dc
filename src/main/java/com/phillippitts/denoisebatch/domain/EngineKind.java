package com.phillippitts.denoisebatch.domain;

import java.util.Locale;

/**
 * Tag of an {@link EngineConfig} variant and the key under which engines are registered.
 */
public enum EngineKind {
    SPECTRAL_GATE("spectral_gate"),
    NEURAL_DENOISE("neural_denoise"),
    SOURCE_SEPARATION("source_separation");

    private final String id;

    EngineKind(String id) {
        this.id = id;
    }

    /**
     * Stable lowercase identifier used in configuration, JSON and metric tags.
     */
    public String id() {
        return id;
    }

    /**
     * Resolves an identifier (case-insensitive, '-' or '_' separated) to a kind.
     *
     * @param value identifier such as {@code spectral_gate} or {@code SPECTRAL-GATE}
     * @return matching kind
     * @throws IllegalArgumentException if no kind matches
     */
    public static EngineKind fromId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Engine kind must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (EngineKind kind : values()) {
            if (kind.id.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown engine kind: " + value);
    }
}
