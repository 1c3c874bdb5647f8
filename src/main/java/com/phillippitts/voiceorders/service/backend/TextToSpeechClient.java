package com.phillippitts.voiceorders.service.backend;

import java.util.concurrent.CompletableFuture;

/**
 * Synthesizes speech for one assistant reply.
 */
public interface TextToSpeechClient {

    CompletableFuture<SynthesizedAudio> synthesize(String text);
}
