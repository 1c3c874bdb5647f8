package com.phillippitts.voiceorders.service.audio;

/**
 * Audio format constants for the voice transport.
 * Inbound audio is 16-bit signed PCM, little-endian; sample rate and channel count travel with each chunk.
 */
public final class AudioFormat {

    /** Sample rate assumed when a client omits it. */
    public static final int DEFAULT_SAMPLE_RATE = 16_000;
    /** Channel count assumed when a client omits it. */
    public static final int DEFAULT_CHANNELS = 1;
    /** Bits per sample of all PCM handled by the service. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Bytes per sample of one channel. */
    public static final int BYTES_PER_SAMPLE = BITS_PER_SAMPLE / 8;

    private AudioFormat() {}

    /**
     * Number of bytes that hold {@code durationMs} of audio.
     */
    public static int bytesFor(int durationMs, int sampleRate, int channels) {
        long samples = (long) sampleRate * durationMs / 1000;
        return (int) (samples * BYTES_PER_SAMPLE * channels);
    }

    /**
     * Playback duration of a PCM buffer in nanoseconds. Exact enough to sum over many small chunks.
     */
    public static long durationNanos(int byteCount, int sampleRate, int channels) {
        long bytesPerSecond = (long) sampleRate * BYTES_PER_SAMPLE * channels;
        return bytesPerSecond == 0 ? 0 : byteCount * 1_000_000_000L / bytesPerSecond;
    }
}
