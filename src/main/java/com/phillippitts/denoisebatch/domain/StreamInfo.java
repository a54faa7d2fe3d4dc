package com.phillippitts.denoisebatch.domain;

/**
 * Layout of a decoded audio stream as seen by an engine.
 *
 * @param sampleRate frames per second after decoding (may differ from the container's rate)
 * @param channels channel count
 * @param totalFrames expected frame count, or -1 when unknown
 */
public record StreamInfo(int sampleRate, int channels, long totalFrames) {

    public StreamInfo {
        if (sampleRate < 1 || channels < 1) {
            throw new IllegalArgumentException("invalid stream layout: " + sampleRate + " Hz, " + channels + " ch");
        }
    }

    public StreamInfo(int sampleRate, int channels) {
        this(sampleRate, channels, -1);
    }
}
