package com.phillippitts.transcriptionagent.room;

import java.util.Objects;

/**
 * One chunk of raw audio received from a track: 16-bit signed PCM, little-endian, interleaved.
 *
 * @param data              PCM bytes
 * @param sampleRate        samples per second per channel
 * @param numChannels       channel count
 * @param samplesPerChannel samples per channel contained in {@code data}
 */
public record AudioFrame(byte[] data, int sampleRate, int numChannels, int samplesPerChannel) {

    public AudioFrame {
        Objects.requireNonNull(data, "data");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive, got: " + sampleRate);
        }
        if (numChannels <= 0) {
            throw new IllegalArgumentException("numChannels must be positive, got: " + numChannels);
        }
    }
}
