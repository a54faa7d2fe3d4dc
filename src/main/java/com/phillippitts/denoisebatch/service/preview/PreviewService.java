package com.phillippitts.denoisebatch.service.preview;

import com.phillippitts.denoisebatch.config.properties.PreviewProperties;
import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.MediaInfo;
import com.phillippitts.denoisebatch.domain.NoiseWindow;
import com.phillippitts.denoisebatch.domain.PreviewRequest;
import com.phillippitts.denoisebatch.domain.PreviewResult;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.exception.MediaException;
import com.phillippitts.denoisebatch.exception.OutOfRangeException;
import com.phillippitts.denoisebatch.service.audio.AudioConversions;
import com.phillippitts.denoisebatch.service.audio.LevelMeter;
import com.phillippitts.denoisebatch.service.engine.EngineHandle;
import com.phillippitts.denoisebatch.service.engine.EngineRegistry;
import com.phillippitts.denoisebatch.service.engine.NoiseReductionEngine;
import com.phillippitts.denoisebatch.service.engine.NoiseWindowSampler;
import com.phillippitts.denoisebatch.service.media.AudioStream;
import com.phillippitts.denoisebatch.service.media.MediaIoAdapter;
import com.phillippitts.denoisebatch.util.LogSanitizer;
import com.phillippitts.denoisebatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs a short window of a file through one engine on the caller's thread.
 *
 * <p>A preview never touches the batch queue, the statistics or the output directory. Each
 * call opens its own decoder and a fresh engine instance, and closes both before returning.
 */
public class PreviewService {

    private static final Logger LOG = LogManager.getLogger(PreviewService.class);

    private final MediaIoAdapter media;
    private final EngineRegistry registry;
    private final PreviewProperties properties;

    public PreviewService(MediaIoAdapter media, EngineRegistry registry, PreviewProperties properties) {
        this.media = Objects.requireNonNull(media, "media");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    /**
     * @throws OutOfRangeException if the duration is outside the configured bounds or the offset
     *         is negative or not before the end of the file
     * @throws MediaException if the file cannot be probed or decoded
     * @throws com.phillippitts.denoisebatch.exception.UnsupportedConfigurationException if the
     *         engine rejects the config for this file
     * @throws com.phillippitts.denoisebatch.exception.EngineFailureException if processing fails
     */
    public PreviewResult preview(PreviewRequest request) {
        long start = System.nanoTime();
        OutOfRangeException.requireInRange("durationSeconds", request.durationSeconds(),
                properties.minDurationSeconds(), properties.maxDurationSeconds());

        MediaInfo info = media.probe(request.file());
        if (!info.hasAudio()) {
            throw new MediaException("File has no audio stream", request.file().toString());
        }
        double offset = request.offsetSeconds();
        if (offset < 0 || offset >= info.durationSeconds()) {
            throw new OutOfRangeException("offsetSeconds", String.format(
                    "offset %.2f s is outside the file (duration %.2f s)", offset, info.durationSeconds()));
        }
        double duration = Math.min(request.durationSeconds(), info.durationSeconds() - offset);

        List<AudioBuffer> originalChunks = new ArrayList<>();
        StreamInfo stream;
        try (AudioStream in = media.decodeRange(request.file(), offset, duration, null)) {
            stream = in.info();
            AudioBuffer chunk;
            while ((chunk = in.read()) != null) {
                originalChunks.add(chunk);
            }
        } catch (IOException e) {
            throw new MediaException("Preview decode failed: " + e.getMessage(), request.file().toString(), e);
        }
        AudioBuffer original = AudioBuffer.concat(originalChunks, stream.channels(), stream.sampleRate());
        AudioBuffer processed = runEngine(request, stream, originalChunks, original.frames());

        PreviewResult result = new PreviewResult(original, processed, LevelMeter.measure(original),
                LevelMeter.measure(processed), offset, original.durationSeconds());
        LOG.info("Preview of {} [{}s +{}s] with {} in {} ms: {} dB reduction",
                LogSanitizer.fileName(request.file()), offset, String.format("%.2f", result.durationSeconds()),
                request.engineConfig().kind().id(), TimeUtils.elapsedMillis(start),
                String.format("%.1f", result.reductionDb()));
        return result;
    }

    private AudioBuffer runEngine(PreviewRequest request, StreamInfo stream, List<AudioBuffer> chunks,
                                  int frames) {
        StreamInfo windowInfo = new StreamInfo(stream.sampleRate(), stream.channels(), frames);
        try (NoiseReductionEngine engine = registry.create(request.engineConfig().kind())) {
            engine.initialize();
            try (EngineHandle handle = engine.prepare(request.engineConfig(), windowInfo)) {
                Optional<NoiseWindow> window = request.engineConfig().noiseWindow();
                if (window.isPresent()) {
                    try {
                        NoiseWindowSampler.learn(media, request.file(), stream.sampleRate(), window.get(), engine,
                                handle);
                    } catch (IOException e) {
                        throw new MediaException("Noise window decode failed: " + e.getMessage(),
                                request.file().toString(), e);
                    }
                }
                List<AudioBuffer> out = new ArrayList<>(chunks.size() + 1);
                for (AudioBuffer chunk : chunks) {
                    out.add(engine.process(handle, chunk));
                }
                out.add(engine.finish(handle));
                AudioBuffer joined = AudioBuffer.concat(out, stream.channels(), stream.sampleRate());
                return AudioConversions.fitFrames(joined, frames);
            }
        }
    }

    public PreviewProperties properties() {
        return properties;
    }
}
