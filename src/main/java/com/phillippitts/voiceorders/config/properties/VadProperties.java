package com.phillippitts.voiceorders.config.properties;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Voice activity detection tuning.
 * Binds to properties prefixed with "voice.vad".
 *
 * @param enabled          whether speech boundaries are detected in-process
 * @param silenceThreshold RMS amplitude below which audio counts as silence (0-32767)
 * @param startMs          speech needed before the user counts as speaking
 * @param stopMs           silence needed before the user counts as stopped
 */
@ConfigurationProperties(prefix = "voice.vad")
@Validated
public record VadProperties(
        @DefaultValue("true") boolean enabled,

        @PositiveOrZero(message = "Silence threshold must not be negative")
        @DefaultValue("800") int silenceThreshold,

        @Positive(message = "Start window must be positive")
        @DefaultValue("150") int startMs,

        @Positive(message = "Stop window must be positive")
        @DefaultValue("600") int stopMs
) {
}
