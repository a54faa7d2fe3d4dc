package com.phillippitts.denoisebatch.service.media;

import com.phillippitts.denoisebatch.domain.MediaInfo;
import com.phillippitts.denoisebatch.domain.StreamInfo;
import com.phillippitts.denoisebatch.exception.MediaException;

import java.nio.file.Path;

/**
 * Boundary to the media toolchain: probe a container, decode its audio into buffers and write
 * processed audio back, remuxing untouched video, subtitle and metadata streams.
 *
 * <p>Implementations must be safe for concurrent use by several workers; each call opens its
 * own decoder or encoder.
 *
 * @see com.phillippitts.denoisebatch.service.media.ffmpeg.FfmpegMediaIoAdapter
 * @see com.phillippitts.denoisebatch.service.media.wav.WavMediaIoAdapter
 */
public interface MediaIoAdapter {

    /**
     * Reads container metadata. Rejects files outside the supported allow-list.
     *
     * @param path media file
     * @return metadata of the first audio stream and the container
     * @throws MediaException if the file is missing, unsupported or unreadable
     */
    MediaInfo probe(Path path);

    /**
     * Opens a decoder over the whole audio stream.
     *
     * @param path media file
     * @param sampleRate decode sample rate, or null to keep the source rate
     * @return lazy stream of buffers
     * @throws MediaException if the decoder cannot be opened
     */
    AudioStream decode(Path path, Integer sampleRate);

    /**
     * Opens a decoder over {@code [offsetSeconds, offsetSeconds + durationSeconds)} only.
     *
     * @param path media file
     * @param offsetSeconds window start
     * @param durationSeconds window length
     * @param sampleRate decode sample rate, or null to keep the source rate
     * @return lazy stream of buffers covering at most the window
     */
    AudioStream decodeRange(Path path, double offsetSeconds, double durationSeconds, Integer sampleRate);

    /**
     * Opens an encoder writing {@code target}. When {@code preserveVideo} is set and the source
     * has a video stream, that stream is copied unchanged next to the new audio.
     *
     * @param target output file; its extension selects the container and codec
     * @param stream layout of the buffers that will be written
     * @param source probe result of the input, used for remuxing
     * @param preserveVideo keep the source's video stream
     * @return open encoder
     */
    MediaEncoder openEncoder(Path target, StreamInfo stream, MediaInfo source, boolean preserveVideo);

    /**
     * @return short backend name for logs and health output
     */
    String name();
}
