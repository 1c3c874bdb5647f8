package com.phillippitts.voiceorders.domain.frame;

/**
 * One unit of data flowing through a voice session pipeline.
 *
 * <p>The set of frame kinds is closed. Stages inspect the kinds they care about with
 * {@code instanceof} and forward every other kind unchanged.
 *
 * @see AudioChunk
 * @see TextChunk
 * @see LifecycleEvent
 * @see TransportMessage
 */
public sealed interface Frame permits AudioChunk, TextChunk, LifecycleEvent, TransportMessage {
}
