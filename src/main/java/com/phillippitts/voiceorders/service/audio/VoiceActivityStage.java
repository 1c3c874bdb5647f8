package com.phillippitts.voiceorders.service.audio;

import com.phillippitts.voiceorders.domain.frame.AudioChunk;
import com.phillippitts.voiceorders.domain.frame.Frame;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;
import com.phillippitts.voiceorders.domain.frame.LifecycleEvent;
import com.phillippitts.voiceorders.domain.frame.LifecycleKind;
import com.phillippitts.voiceorders.service.pipeline.Emission;
import com.phillippitts.voiceorders.service.pipeline.SynchronousStage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Energy-based voice activity detection on inbound audio.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Compute the RMS amplitude of each inbound chunk.</li>
 *   <li>While silent, chunks above the threshold are held back. Once they add up to
 *       {@code startMs}, a {@code USER_STARTED} event is emitted followed by the held chunks.
 *       A quiet chunk before that releases the held chunks unchanged.</li>
 *   <li>While speaking, chunks are forwarded. After {@code stopMs} of consecutive quiet audio,
 *       {@code USER_STOPPED} is emitted after the chunk that completed the gap.</li>
 * </ol>
 * Durations are summed in nanoseconds, so held audio never exceeds {@code startMs} whatever the
 * chunk size. Empty chunks pass through untouched. No audio is ever dropped; when disabled, the
 * stage forwards everything.
 */
public final class VoiceActivityStage extends SynchronousStage {

    private static final Logger LOG = LogManager.getLogger(VoiceActivityStage.class);

    private final boolean enabled;
    private final double silenceThreshold;
    private final long startNanos;
    private final long stopNanos;

    private final List<AudioChunk> held = new ArrayList<>();
    private boolean speaking;
    private long speechNanos;
    private long silenceNanos;

    public VoiceActivityStage(boolean enabled, double silenceThreshold, long startMs, long stopMs) {
        this.enabled = enabled;
        this.silenceThreshold = silenceThreshold;
        this.startNanos = TimeUnit.MILLISECONDS.toNanos(startMs);
        this.stopNanos = TimeUnit.MILLISECONDS.toNanos(stopMs);
    }

    @Override
    protected List<Emission> process(Frame frame, FrameDirection direction) {
        if (!enabled || !(frame instanceof AudioChunk chunk) || direction != FrameDirection.DOWNSTREAM
                || chunk.size() == 0) {
            return pass(frame, direction);
        }
        boolean loud = AudioEnergy.rms(chunk.pcm()) >= silenceThreshold;
        long duration = AudioFormat.durationNanos(chunk.size(), chunk.sampleRate(), chunk.channels());
        return speaking ? whileSpeaking(chunk, loud, duration) : whileSilent(chunk, loud, duration);
    }

    private List<Emission> whileSilent(AudioChunk chunk, boolean loud, long duration) {
        if (!loud) {
            speechNanos = 0;
            List<Emission> out = releaseHeld();
            out.add(Emission.downstream(chunk));
            return out;
        }
        held.add(chunk);
        speechNanos += duration;
        if (speechNanos < startNanos) {
            return List.of();
        }
        speaking = true;
        silenceNanos = 0;
        LOG.debug("Speech detected after {} ms", TimeUnit.NANOSECONDS.toMillis(speechNanos));
        List<Emission> out = new ArrayList<>();
        out.add(Emission.downstream(LifecycleEvent.of(LifecycleKind.USER_STARTED)));
        out.addAll(releaseHeld());
        return out;
    }

    private List<Emission> whileSpeaking(AudioChunk chunk, boolean loud, long duration) {
        silenceNanos = loud ? 0 : silenceNanos + duration;
        if (silenceNanos < stopNanos) {
            return List.of(Emission.downstream(chunk));
        }
        speaking = false;
        speechNanos = 0;
        LOG.debug("Silence for {} ms; user stopped", TimeUnit.NANOSECONDS.toMillis(silenceNanos));
        return List.of(Emission.downstream(chunk),
                Emission.downstream(LifecycleEvent.of(LifecycleKind.USER_STOPPED)));
    }

    private List<Emission> releaseHeld() {
        List<Emission> out = new ArrayList<>(held.size() + 2);
        for (AudioChunk h : held) {
            out.add(Emission.downstream(h));
        }
        held.clear();
        return out;
    }

    public boolean isSpeaking() {
        return speaking;
    }
}
