package com.phillippitts.voiceorders.domain.frame;

import java.util.Objects;

/**
 * JSON message exchanged with the session client (state notifications, transcript snapshots, errors).
 *
 * @param jsonPayload serialized JSON document
 */
public record TransportMessage(String jsonPayload) implements Frame {

    public TransportMessage {
        Objects.requireNonNull(jsonPayload, "jsonPayload");
    }
}
