package com.phillippitts.voiceorders.domain.frame;

import java.util.Objects;

/**
 * Control frame marking a speaking transition or the start of a session.
 *
 * @param kind the transition
 */
public record LifecycleEvent(LifecycleKind kind) implements Frame {

    public LifecycleEvent {
        Objects.requireNonNull(kind, "kind");
    }

    public static LifecycleEvent of(LifecycleKind kind) {
        return new LifecycleEvent(kind);
    }

    public boolean is(LifecycleKind other) {
        return kind == other;
    }
}
