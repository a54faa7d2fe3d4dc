package com.phillippitts.denoisebatch.service.engine.neural;

import com.phillippitts.denoisebatch.config.properties.NeuralEngineProperties;
import com.phillippitts.denoisebatch.domain.AudioBuffer;
import com.phillippitts.denoisebatch.domain.EngineKind;
import com.phillippitts.denoisebatch.domain.NeuralDenoiseConfig;
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
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * RNNoise denoiser run through ffmpeg's {@code arnndn} filter.
 *
 * <p>Each buffer is written to a temp WAV, filtered by one ffmpeg call, read back and blended
 * with the original by {@code mixFactor}. The recurrent state restarts at every buffer, so
 * longer chunks ({@code media.chunk-millis}) give smoother results.
 */
public class NeuralDenoiseEngine extends AbstractNoiseReductionEngine<NeuralDenoiseConfig, NeuralDenoiseHandle> {

    private static final Logger LOG = LogManager.getLogger(NeuralDenoiseEngine.class);

    static final int MAX_CHANNELS = 2;
    private static final Duration FILTER_LIST_TIMEOUT = Duration.ofSeconds(10);

    private final NeuralEngineProperties props;
    private final ExternalProcessRunner runner;

    public NeuralDenoiseEngine(NeuralEngineProperties props, ProcessFactory processFactory,
                               ApplicationEventPublisher publisher) {
        super(NeuralDenoiseConfig.class, NeuralDenoiseHandle.class, publisher);
        this.props = Objects.requireNonNull(props, "props");
        this.runner = new ExternalProcessRunner(processFactory, props.maxStderrBytes());
    }

    @Override
    public EngineKind kind() {
        return EngineKind.NEURAL_DENOISE;
    }

    @Override
    protected void doInitialize() {
        ProcessResult result;
        try {
            result = runner.run(List.of(props.ffmpegPath(), "-hide_banner", "-filters"), null, FILTER_LIST_TIMEOUT);
        } catch (IOException e) {
            throw new EngineFailureException("ffmpeg not available: " + e.getMessage(), getEngineName(), e);
        }
        if (!result.succeeded()) {
            throw result.describeFailure("ffmpeg").buildEngineFailure(getEngineName());
        }
        if (!result.stdout().contains("arnndn")) {
            throw new EngineFailureException("ffmpeg was built without the arnndn filter", getEngineName());
        }
        LOG.info("RNNoise engine ready (ffmpeg={}, models={})", props.ffmpegPath(), props.modelsDir());
    }

    @Override
    protected void doClose() {
        LOG.debug("RNNoise engine closed");
    }

    @Override
    protected NeuralDenoiseHandle doPrepare(NeuralDenoiseConfig config, StreamInfo stream) {
        if (stream.sampleRate() != config.targetSampleRate()) {
            throw new UnsupportedConfigurationException("Input sample rate " + stream.sampleRate()
                    + " Hz does not match model rate " + config.targetSampleRate() + " Hz", kind().id());
        }
        if (stream.channels() > MAX_CHANNELS) {
            throw new UnsupportedConfigurationException("RNNoise supports mono or stereo, got "
                    + stream.channels() + " channels", kind().id());
        }
        Path model = RnnoiseModels.resolve(config.modelId(), Path.of(props.modelsDir()));
        if (!Files.isRegularFile(model)) {
            throw new EngineFailureException("RNNoise model not found: " + model, getEngineName());
        }
        try {
            return new NeuralDenoiseHandle(config, stream, model, TempFiles.createDirectory(null, "denoise-rnn-"));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create temp directory", e);
        }
    }

    @Override
    protected AudioBuffer doProcess(NeuralDenoiseHandle h, AudioBuffer buffer) {
        int index = h.chunkIndex++;
        Path in = h.workDir.resolve("in-" + index + ".wav");
        Path out = h.workDir.resolve("out-" + index + ".wav");
        try {
            WavWriter.write(in, buffer);
            ProcessResult result = runner.run(filterCommand(props.ffmpegPath(), in, out, h.model), h.workDir,
                    props.timeout());
            if (!result.succeeded()) {
                throw result.describeFailure("ffmpeg").metadata("chunk", index).buildEngineFailure(getEngineName());
            }
            AudioBuffer filtered = WavReader.readAll(out);
            filtered = AudioConversions.toChannels(filtered, buffer.channels());
            filtered = AudioConversions.fitFrames(filtered, buffer.frames());
            filtered = new AudioBuffer(filtered.samples(), buffer.channels(), buffer.sampleRate());
            return AudioConversions.mix(filtered, buffer, h.config.mixFactor());
        } catch (IOException e) {
            throw new UncheckedIOException("RNNoise chunk " + index + " failed", e);
        } finally {
            TempFiles.deleteQuietly(in);
            TempFiles.deleteQuietly(out);
        }
    }

    static List<String> filterCommand(String ffmpeg, Path in, Path out, Path model) {
        return List.of(ffmpeg, "-nostdin", "-v", "error", "-y",
                "-i", in.toString(),
                "-af", "arnndn=m=" + escapeFilterValue(model.toString()),
                "-c:a", "pcm_f32le",
                out.toString());
    }

    // ':' separates filter options and '\' escapes, so both must be escaped inside a value
    static String escapeFilterValue(String value) {
        return value.replace("\\", "\\\\").replace(":", "\\:").replace("'", "\\'");
    }
}
