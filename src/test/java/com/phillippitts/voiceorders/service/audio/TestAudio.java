package com.phillippitts.voiceorders.service.audio;

import com.phillippitts.voiceorders.domain.frame.AudioChunk;

/**
 * PCM16LE fixtures with a constant sample value.
 */
final class TestAudio {

    static final int SAMPLE_RATE = 16_000;

    private TestAudio() {}

    static byte[] tone(int amplitude, int samples) {
        byte[] pcm = new byte[samples * 2];
        for (int i = 0; i < samples; i++) {
            pcm[2 * i] = (byte) amplitude;
            pcm[2 * i + 1] = (byte) (amplitude >> 8);
        }
        return pcm;
    }

    /** A 16 kHz mono chunk of {@code ms} milliseconds. */
    static AudioChunk chunk(int amplitude, int ms) {
        return new AudioChunk(tone(amplitude, SAMPLE_RATE * ms / 1000), SAMPLE_RATE, 1);
    }
}
