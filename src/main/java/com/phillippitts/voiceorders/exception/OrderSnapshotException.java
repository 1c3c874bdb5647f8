package com.phillippitts.voiceorders.exception;

import com.phillippitts.voiceorders.service.orders.SnapshotStatus;

/**
 * Thrown when the static order snapshot cannot be read or parsed.
 */
public class OrderSnapshotException extends VoiceOrdersException {

    private final SnapshotStatus status;

    public OrderSnapshotException(SnapshotStatus status, String message) {
        super(message);
        this.status = status;
    }

    public OrderSnapshotException(SnapshotStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public SnapshotStatus getStatus() {
        return status;
    }
}
