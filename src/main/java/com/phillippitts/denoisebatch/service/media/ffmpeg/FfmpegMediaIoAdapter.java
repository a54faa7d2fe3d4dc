package com.phillippitts.denoisebatch.service.media.ffmpeg;

import com.phillippitts.denoisebatch.config.properties.MediaProperties;
import com.phillippitts.denoisebatch.domain.MediaInfo;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.exception.MediaException;
import com.phillippitts.denoisebatch.service.media.AudioStream;
import com.phillippitts.denoisebatch.service.media.MediaEncoder;
import com.phillippitts.denoisebatch.service.media.MediaIoAdapter;
import com.phillippitts.denoisebatch.service.media.SupportedFormats;
import com.phillippitts.denoisebatch.service.process.ExternalProcessRunner;
import com.phillippitts.denoisebatch.service.process.ProcessFactory;
import com.phillippitts.denoisebatch.service.process.ProcessResult;
import com.phillippitts.denoisebatch.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Media backend that shells out to ffprobe and ffmpeg.
 *
 * <p>Decoding streams raw float PCM from ffmpeg's stdout; encoding pipes it back into a second
 * ffmpeg that writes the target container and, for video sources, copies the original video,
 * subtitle and metadata streams alongside the new audio.
 */
public final class FfmpegMediaIoAdapter implements MediaIoAdapter {

    private static final Logger LOG = LogManager.getLogger(FfmpegMediaIoAdapter.class);

    private final MediaProperties props;
    private final ProcessFactory processFactory;
    private final ExternalProcessRunner runner;

    public FfmpegMediaIoAdapter(MediaProperties props, ProcessFactory processFactory) {
        this.props = Objects.requireNonNull(props, "props");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.runner = new ExternalProcessRunner(processFactory, props.maxStderrBytes());
    }

    @Override
    public MediaInfo probe(Path path) {
        requireSupportedFile(path);
        ProcessResult result;
        try {
            result = runner.run(FfmpegCommands.probe(props.ffprobePath(), path), null, props.probeTimeout());
        } catch (IOException e) {
            throw new MediaException("Cannot run ffprobe", path.toString(), e);
        }
        if (!result.succeeded()) {
            throw result.describeFailure("ffprobe").buildMediaException(path.toString());
        }
        MediaInfo info = FfprobeParser.parse(result.stdout(), path);
        LOG.debug("Probed {}: {} Hz, {} ch, {}s, video={}", LogSanitizer.fileName(path), info.sampleRate(),
                info.channels(), info.durationSeconds(), info.hasVideo());
        return info;
    }

    @Override
    public AudioStream decode(Path path, Integer sampleRate) {
        MediaInfo info = requireAudio(probe(path));
        return openDecoder(path, info, null, null, sampleRate);
    }

    @Override
    public AudioStream decodeRange(Path path, double offsetSeconds, double durationSeconds, Integer sampleRate) {
        if (offsetSeconds < 0 || durationSeconds <= 0) {
            throw new IllegalArgumentException("invalid range: offset=" + offsetSeconds + " duration=" + durationSeconds);
        }
        MediaInfo info = requireAudio(probe(path));
        return openDecoder(path, info, offsetSeconds, durationSeconds, sampleRate);
    }

    @Override
    public MediaEncoder openEncoder(Path target, StreamInfo stream, MediaInfo source, boolean preserveVideo) {
        boolean keepVideo = preserveVideo && source != null && source.hasVideo();
        List<String> cmd = FfmpegCommands.encode(props.ffmpegPath(), target, stream, source, keepVideo);
        LOG.debug("Starting encoder for {}: {}", LogSanitizer.fileName(target), cmd);
        try {
            Process process = processFactory.start(cmd, null);
            return new FfmpegEncoder(process, target, stream, props.encodeTimeout(), props.maxStderrBytes());
        } catch (IOException e) {
            throw new MediaException("Cannot start ffmpeg encoder", target.toString(), e);
        }
    }

    @Override
    public String name() {
        return "ffmpeg";
    }

    private AudioStream openDecoder(Path path, MediaInfo info, Double offset, Double duration, Integer sampleRate) {
        StreamInfo streamInfo = info.streamInfo(sampleRate);
        if (duration != null) {
            long frames = Math.round(duration * streamInfo.sampleRate());
            streamInfo = new StreamInfo(streamInfo.sampleRate(), streamInfo.channels(), frames);
        }
        int chunkFrames = Math.max(1, (int) ((long) streamInfo.sampleRate() * props.chunkMillis() / 1000));
        List<String> cmd = FfmpegCommands.decode(props.ffmpegPath(), path, offset, duration, sampleRate);
        LOG.debug("Starting decoder for {}: {}", LogSanitizer.fileName(path), cmd);
        try {
            Process process = processFactory.start(cmd, null);
            return new FfmpegAudioStream(process, streamInfo, path, chunkFrames, props.maxStderrBytes());
        } catch (IOException e) {
            throw new MediaException("Cannot start ffmpeg decoder", path.toString(), e);
        }
    }

    private static MediaInfo requireAudio(MediaInfo info) {
        if (!info.hasAudio() || info.sampleRate() <= 0 || info.channels() <= 0) {
            throw new MediaException("No audio stream", info.path().toString());
        }
        return info;
    }

    private static void requireSupportedFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new MediaException("File not found", path.toString());
        }
        if (!SupportedFormats.isSupported(path)) {
            throw new MediaException("Unsupported format " + SupportedFormats.extensionOf(path), path.toString());
        }
    }
}
