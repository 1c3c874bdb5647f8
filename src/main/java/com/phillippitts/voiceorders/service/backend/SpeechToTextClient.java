package com.phillippitts.voiceorders.service.backend;

import java.util.concurrent.CompletableFuture;

/**
 * Transcribes one user turn of PCM16LE audio.
 *
 * <p>Implementations must not block the caller; failures complete the future exceptionally,
 * normally with a {@link com.phillippitts.voiceorders.exception.BackendCallException}.
 */
public interface SpeechToTextClient {

    CompletableFuture<String> transcribe(byte[] pcm, int sampleRate, int channels);
}
