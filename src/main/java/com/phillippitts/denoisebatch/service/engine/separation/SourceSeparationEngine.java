package com.phillippitts.denoisebatch.service.engine.separation;

import com.phillippitts.denoisebatch.config.properties.SeparationEngineProperties;
import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.EngineKind;
import com.phillippitts.denoisebatch.domain.SourceSeparationConfig;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.exception.EngineFailureException;
import com.phillippitts.denoisebatch.exception.UnsupportedConfigurationException;
import com.phillippitts.denoisebatch.service.audio.AudioConversions;
import com.phillippitts.denoisebatch.service.engine.AbstractNoiseReductionEngine;
import com.phillippitts.denoisebatch.service.media.wav.WavReader;
import com.phillippitts.denoisebatch.service.media.wav.WavWriter;
import com.phillippitts.denoisebatch.service.process.ExternalProcessRunner;
import com.phillippitts.denoisebatch.service.process.ProcessFactory;
import com.phillippitts.denoisebatch.service.process.ProcessResult;
import com.phillippitts.denoisebatch.util.TempFiles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Two-stem source separation through the Demucs CLI.
 *
 * <p>Each buffer is separated into {@code vocals} and {@code no_vocals}; the result is
 * {@code vocals + (1 - reductionStrength) * no_vocals}. The model may return a different rate
 * or channel count, which is converted back to the input layout.
 */
public class SourceSeparationEngine
        extends AbstractNoiseReductionEngine<SourceSeparationConfig, SourceSeparationHandle> {

    private static final Logger LOG = LogManager.getLogger(SourceSeparationEngine.class);

    static final Set<String> DEVICES = Set.of("cpu", "cuda", "mps");
    static final int MAX_CHANNELS = 2;
    static final int MIN_SAMPLE_RATE = 8_000;
    static final double MIN_SEGMENT_SECONDS = 1.0;
    static final String KEPT_STEM = "vocals";
    static final String REDUCED_STEM = "no_vocals";

    private final SeparationEngineProperties props;
    private final ExternalProcessRunner runner;

    public SourceSeparationEngine(SeparationEngineProperties props, ProcessFactory processFactory,
                                  ApplicationEventPublisher publisher) {
        super(SourceSeparationConfig.class, SourceSeparationHandle.class, publisher);
        this.props = Objects.requireNonNull(props, "props");
        this.runner = new ExternalProcessRunner(processFactory, props.maxStderrBytes());
    }

    @Override
    public EngineKind kind() {
        return EngineKind.SOURCE_SEPARATION;
    }

    @Override
    protected void doInitialize() {
        // the CLI is only resolved per call; a missing install surfaces as a process start failure
        LOG.info("Source separation engine ready (command='{}')", props.command());
    }

    @Override
    protected void doClose() {
        LOG.debug("Source separation engine closed");
    }

    @Override
    protected SourceSeparationHandle doPrepare(SourceSeparationConfig config, StreamInfo stream) {
        if (stream.channels() > MAX_CHANNELS) {
            throw new UnsupportedConfigurationException("Source separation supports mono or stereo, got "
                    + stream.channels() + " channels", kind().id());
        }
        if (stream.sampleRate() < MIN_SAMPLE_RATE) {
            throw new UnsupportedConfigurationException("Sample rate " + stream.sampleRate()
                    + " Hz is below the minimum of " + MIN_SAMPLE_RATE + " Hz", kind().id());
        }
        if (!DEVICES.contains(config.device().toLowerCase(Locale.ROOT))) {
            throw new UnsupportedConfigurationException("Unknown device '" + config.device()
                    + "', expected one of " + DEVICES, kind().id());
        }
        if (config.segmentSeconds() != null && config.segmentSeconds() < MIN_SEGMENT_SECONDS) {
            throw new UnsupportedConfigurationException("Segment length must be at least "
                    + MIN_SEGMENT_SECONDS + "s, got " + config.segmentSeconds(), kind().id());
        }
        try {
            return new SourceSeparationHandle(config, stream, TempFiles.createDirectory(props.workDir(), "denoise-sep-"));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create work directory", e);
        }
    }

    @Override
    protected AudioBuffer doProcess(SourceSeparationHandle h, AudioBuffer buffer) {
        int index = h.chunkIndex++;
        String stem = "chunk-" + index;
        Path input = h.workDir.resolve(stem + ".wav");
        Path outDir = h.workDir.resolve("out-" + index);
        try {
            WavWriter.write(input, buffer);
            ProcessResult result = runner.run(command(props.commandParts(), h.config, outDir, input), h.workDir,
                    props.timeout());
            if (!result.succeeded()) {
                throw result.describeFailure("demucs").metadata("chunk", index).buildEngineFailure(getEngineName());
            }
            Path stemDir = outDir.resolve(h.config.modelId()).resolve(stem);
            AudioBuffer vocals = readStem(stemDir.resolve(KEPT_STEM + ".wav"), buffer);
            AudioBuffer rest = readStem(stemDir.resolve(REDUCED_STEM + ".wav"), buffer);
            return combine(vocals, rest, h.config.reductionStrength());
        } catch (IOException e) {
            throw new UncheckedIOException("Separation of chunk " + index + " failed", e);
        } finally {
            TempFiles.deleteQuietly(input);
            TempFiles.deleteRecursively(outDir);
        }
    }

    private AudioBuffer readStem(Path path, AudioBuffer like) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new EngineFailureException("Separation produced no " + path.getFileName(), getEngineName());
        }
        AudioBuffer stem = WavReader.readAll(path);
        stem = AudioConversions.resample(stem, like.sampleRate());
        stem = AudioConversions.toChannels(stem, like.channels());
        return AudioConversions.fitFrames(stem, like.frames());
    }

    static AudioBuffer combine(AudioBuffer vocals, AudioBuffer rest, double reductionStrength) {
        float[] v = vocals.samples();
        float[] r = rest.samples();
        float keep = (float) (1.0 - reductionStrength);
        float[] out = new float[v.length];
        for (int i = 0; i < v.length; i++) {
            out[i] = v[i] + keep * r[i];
        }
        return new AudioBuffer(out, vocals.channels(), vocals.sampleRate());
    }

    static List<String> command(List<String> base, SourceSeparationConfig config, Path outDir, Path input) {
        List<String> cmd = new ArrayList<>(base);
        cmd.add("--two-stems");
        cmd.add(KEPT_STEM);
        cmd.add("-n");
        cmd.add(config.modelId());
        cmd.add("--device");
        cmd.add(config.device().toLowerCase(Locale.ROOT));
        cmd.add("--overlap");
        cmd.add(String.format(Locale.ROOT, "%.2f", config.overlap()));
        if (config.segmentSeconds() != null) {
            cmd.add("--segment");
            cmd.add(Long.toString(Math.round(config.segmentSeconds())));
        }
        cmd.add("--float32");
        cmd.add("-o");
        cmd.add(outDir.toString());
        cmd.add(input.toString());
        return cmd;
    }
}
