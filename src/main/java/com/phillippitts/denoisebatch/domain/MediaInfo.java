package com.phillippitts.denoisebatch.domain;

import java.nio.file.Path;

/**
 * Container metadata returned by a media probe.
 *
 * @param path probed file
 * @param sampleRate audio sample rate of the first audio stream
 * @param channels audio channel count
 * @param durationSeconds container duration
 * @param hasVideo true if the container holds a video stream
 * @param hasAudio true if the container holds an audio stream
 * @param audioCodec codec name of the first audio stream, may be null
 * @param formatName container format name, may be null
 */
public record MediaInfo(
        Path path,
        int sampleRate,
        int channels,
        double durationSeconds,
        boolean hasVideo,
        boolean hasAudio,
        String audioCodec,
        String formatName
) {

    public StreamInfo streamInfo(Integer decodeSampleRate) {
        int rate = decodeSampleRate != null ? decodeSampleRate : sampleRate;
        long frames = durationSeconds > 0 ? Math.round(durationSeconds * rate) : -1;
        return new StreamInfo(rate, channels, frames);
    }
}
