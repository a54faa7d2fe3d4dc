package com.phillippitts.denoisebatch.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for exceptions raised when an external tool (ffmpeg, ffprobe, demucs) fails.
 *
 * <p>The same diagnostic context (exit code, duration, stderr snippet, arguments) is wanted
 * whether the failure surfaces as a media error or as an engine failure, so the builder
 * collects it once and renders either type.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ToolFailureExceptionBuilder.create("Non-zero exit: 1")
 *         .tool("ffmpeg")
 *         .exitCode(1)
 *         .durationMs(350)
 *         .metadata("stderr", snippet)
 *         .buildMediaException(inputPath);
 * </pre>
 */
public final class ToolFailureExceptionBuilder {

    private final String message;
    private String tool;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ToolFailureExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ToolFailureExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ToolFailureExceptionBuilder(message);
    }

    public ToolFailureExceptionBuilder tool(String tool) {
        this.tool = tool;
        return this;
    }

    public ToolFailureExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ToolFailureExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public ToolFailureExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair; null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public ToolFailureExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds a {@link MediaException} for the given file.
     *
     * @param path file being probed, decoded or encoded
     * @return constructed exception
     */
    public MediaException buildMediaException(String path) {
        String detailed = buildDetailedMessage();
        return cause != null
                ? new MediaException(detailed, path, cause)
                : new MediaException(detailed, path);
    }

    /**
     * Builds an {@link EngineFailureException} attributed to the given engine.
     *
     * @param engineName engine that invoked the tool
     * @return constructed exception
     */
    public EngineFailureException buildEngineFailure(String engineName) {
        String detailed = buildDetailedMessage();
        return cause != null
                ? new EngineFailureException(detailed, engineName, cause)
                : new EngineFailureException(detailed, engineName);
    }

    /**
     * Renders {@code message (tool=.., exitCode=.., durationMs=.., k=v, ...)}.
     */
    String buildDetailedMessage() {
        boolean hasDetails = tool != null || exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (tool != null) {
            sb.append("tool=").append(tool);
            first = false;
        }
        if (exitCode != null) {
            sb.append(first ? "" : ", ").append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            sb.append(first ? "" : ", ").append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            sb.append(first ? "" : ", ").append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
