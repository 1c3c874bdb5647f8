package com.phillippitts.voiceorders.service.backend;

import java.util.Objects;

/**
 * PCM16LE audio returned by a {@link TextToSpeechClient}.
 *
 * @param pcm        raw audio
 * @param sampleRate sample rate in Hz
 * @param channels   channel count
 */
public record SynthesizedAudio(byte[] pcm, int sampleRate, int channels) {

    public SynthesizedAudio {
        Objects.requireNonNull(pcm, "pcm");
    }
}
