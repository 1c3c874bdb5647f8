package com.phillippitts.voiceorders.domain.frame;

import java.util.Arrays;
import java.util.Objects;

/**
 * Raw PCM16LE audio.
 *
 * @param pcm        audio bytes (never null, may be empty)
 * @param sampleRate sample rate in Hz
 * @param channels   channel count
 */
public record AudioChunk(byte[] pcm, int sampleRate, int channels) implements Frame {

    public AudioChunk {
        Objects.requireNonNull(pcm, "pcm");
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
        if (channels <= 0) {
            throw new IllegalArgumentException("channels must be positive: " + channels);
        }
    }

    public int size() {
        return pcm.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AudioChunk other)) {
            return false;
        }
        return sampleRate == other.sampleRate
                && channels == other.channels
                && Arrays.equals(pcm, other.pcm);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(sampleRate, channels) + Arrays.hashCode(pcm);
    }

    @Override
    public String toString() {
        return "AudioChunk[bytes=" + pcm.length + ", sampleRate=" + sampleRate + ", channels=" + channels + "]";
    }
}
