package com.phillippitts.voiceorders.domain.transcript;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One finalized utterance in the live transcript.
 *
 * @param speaker   who spoke
 * @param text      the utterance
 * @param timestamp when the utterance was recorded (local time)
 */
public record TranscriptEntry(Speaker speaker, String text, LocalDateTime timestamp) {

    public TranscriptEntry {
        Objects.requireNonNull(speaker, "speaker");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
