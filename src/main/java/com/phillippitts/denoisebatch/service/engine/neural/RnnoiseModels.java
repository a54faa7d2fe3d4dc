package com.phillippitts.denoisebatch.service.engine.neural;

import java.nio.file.Path;
import java.util.Map;

/**
 * The standard RNNoise model set and resolution of a model id to a file.
 */
public final class RnnoiseModels {

    public static final String EXTENSION = ".rnnn";

    /** Standard model ids and what they are tuned for. */
    public static final Map<String, String> STANDARD = Map.of(
            "bd", "Broadband (general purpose)",
            "cb", "Cassette tape",
            "mp", "Music performance",
            "sh", "Speech heavy");

    private RnnoiseModels() {}

    /**
     * Resolves a standard id to {@code modelsDir/<id>.rnnn}; any other value is treated as a path.
     */
    public static Path resolve(String modelId, Path modelsDir) {
        if (STANDARD.containsKey(modelId)) {
            return modelsDir.resolve(modelId + EXTENSION);
        }
        return Path.of(modelId);
    }
}
