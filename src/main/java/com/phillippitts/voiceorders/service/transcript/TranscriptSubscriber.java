package com.phillippitts.voiceorders.service.transcript;

import java.io.IOException;

/**
 * A passive observer connection of the transcript hub.
 *
 * <p>Handles are one-way: once unsubscribed (or dropped after a failed send) the same handle
 * is never delivered to again.
 */
public interface TranscriptSubscriber {

    /** Identifier used in logs. */
    String id();

    /**
     * Sends one full transcript snapshot.
     *
     * @throws IOException if the connection can no longer be written to
     */
    void send(String payload) throws IOException;
}
