package com.phillippitts.voiceorders.service.audio;

import com.phillippitts.voiceorders.domain.frame.AudioChunk;
import com.phillippitts.voiceorders.domain.frame.Frame;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;
import com.phillippitts.voiceorders.service.pipeline.Emission;
import com.phillippitts.voiceorders.service.pipeline.SynchronousStage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Logs inbound audio reception. Every frame is forwarded unchanged.
 *
 * <p>Logs the first chunk and then every {@code logInterval}-th chunk.
 */
public final class AudioLoggingStage extends SynchronousStage {

    private static final Logger LOG = LogManager.getLogger(AudioLoggingStage.class);

    private final int logInterval;
    private long chunkCount;
    private long totalBytes;

    public AudioLoggingStage(int logInterval) {
        if (logInterval <= 0) {
            throw new IllegalArgumentException("logInterval must be positive: " + logInterval);
        }
        this.logInterval = logInterval;
    }

    @Override
    protected List<Emission> process(Frame frame, FrameDirection direction) {
        if (frame instanceof AudioChunk chunk && direction == FrameDirection.DOWNSTREAM) {
            chunkCount++;
            totalBytes += chunk.size();
            if (chunkCount % logInterval == 1 || logInterval == 1) {
                LOG.info("Receiving audio: chunk={}, bytes={}, sampleRate={}Hz, totalKb={}",
                        chunkCount, chunk.size(), chunk.sampleRate(), String.format("%.2f", totalBytes / 1024.0));
            }
        }
        return pass(frame, direction);
    }

    public long chunkCount() {
        return chunkCount;
    }

    public long totalBytes() {
        return totalBytes;
    }
}
