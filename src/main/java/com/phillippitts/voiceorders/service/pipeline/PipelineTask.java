package com.phillippitts.voiceorders.service.pipeline;

import com.phillippitts.voiceorders.domain.frame.Frame;
import com.phillippitts.voiceorders.domain.frame.FrameDirection;
import com.phillippitts.voiceorders.domain.frame.LifecycleEvent;
import com.phillippitts.voiceorders.domain.frame.LifecycleKind;
import com.phillippitts.voiceorders.exception.PipelineTerminatedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs frames of one session through the pipeline stages.
 *
 * <p><b>Ordering:</b> frames queued with {@link #queueFrame} are processed one at a time in
 * arrival order. A frame, and every frame its stages emit, is carried to completion before the
 * next queued frame enters. Emissions of a stage are processed depth-first in list order.
 *
 * <p><b>Suspension:</b> a stage waiting for an external service only delays this session. The
 * queue is a chain of {@link CompletableFuture}s, so no thread is parked while waiting.
 *
 * <p><b>Termination:</b> an exception from a stage or from the output sink terminates the task.
 * {@link #whenTerminated()} then completes exceptionally with a {@link PipelineTerminatedException}
 * and later frames are rejected. {@link #stop()} ends the task normally.
 */
public final class PipelineTask {

    private static final Logger LOG = LogManager.getLogger(PipelineTask.class);

    private final String sessionId;
    private final List<FrameStage> stages;
    private final FrameSink outputSink;

    private final Lock lock = new ReentrantLock();
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    PipelineTask(String sessionId, List<FrameStage> stages, FrameSink outputSink) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.stages = List.copyOf(stages);
        this.outputSink = Objects.requireNonNull(outputSink, "outputSink");
    }

    void start() {
        LOG.info("Pipeline started: session={}, stages={}", sessionId,
                stages.stream().map(FrameStage::name).toList());
        queueFrame(LifecycleEvent.of(LifecycleKind.SESSION_START), FrameDirection.DOWNSTREAM);
    }

    public String sessionId() {
        return sessionId;
    }

    /**
     * Queues a frame at the pipeline edge matching its direction (head for downstream, tail for upstream).
     *
     * @return completes when the frame and everything it produced has been processed; completes
     *         exceptionally if the task terminated
     */
    public CompletableFuture<Void> queueFrame(Frame frame, FrameDirection direction) {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(direction, "direction");
        int entry = direction == FrameDirection.DOWNSTREAM ? 0 : stages.size() - 1;

        lock.lock();
        try {
            if (termination.isDone()) {
                return CompletableFuture.failedFuture(
                        new PipelineTerminatedException(sessionId, "Pipeline no longer accepts frames"));
            }
            CompletableFuture<Void> processed = tail.thenCompose(ignored -> dispatch(frame, direction, entry));
            tail = processed.handle((ok, error) -> {
                if (error != null) {
                    terminate(unwrap(error));
                }
                return null;
            });
            return processed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends the task normally. Frames already queued are skipped.
     */
    public void stop() {
        if (termination.complete(null)) {
            LOG.info("Pipeline stopped: session={}", sessionId);
        }
    }

    /**
     * Completes normally after {@link #stop()}, exceptionally with {@link PipelineTerminatedException}
     * when a stage failed.
     */
    public CompletableFuture<Void> whenTerminated() {
        return termination.thenApply(ignored -> null);
    }

    public boolean isRunning() {
        return !termination.isDone();
    }

    private CompletableFuture<Void> dispatch(Frame frame, FrameDirection direction, int index) {
        if (termination.isDone()) {
            return CompletableFuture.completedFuture(null);
        }
        if (index >= stages.size()) {
            outputSink.deliver(frame);
            return CompletableFuture.completedFuture(null);
        }
        if (index < 0) {
            LOG.debug("Frame left pipeline head upstream: session={}, frame={}", sessionId, frame);
            return CompletableFuture.completedFuture(null);
        }
        FrameStage stage = stages.get(index);
        return invoke(stage, frame, direction).thenCompose(emissions -> continueWith(emissions, index));
    }

    private CompletableFuture<List<Emission>> invoke(FrameStage stage, Frame frame, FrameDirection direction) {
        CompletableFuture<List<Emission>> result;
        try {
            result = stage.handle(frame, direction).toCompletableFuture();
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        return result.handle((emissions, error) -> {
            if (error != null) {
                throw new PipelineTerminatedException(sessionId, stage.name(), unwrap(error));
            }
            return emissions == null ? List.of() : emissions;
        });
    }

    private CompletableFuture<Void> continueWith(List<Emission> emissions, int index) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (Emission emission : emissions) {
            int next = emission.direction() == FrameDirection.DOWNSTREAM ? index + 1 : index - 1;
            chain = chain.thenCompose(ignored -> dispatch(emission.frame(), emission.direction(), next));
        }
        return chain;
    }

    private void terminate(Throwable error) {
        PipelineTerminatedException terminated = error instanceof PipelineTerminatedException pte
                ? pte
                : new PipelineTerminatedException(sessionId, "output", error);
        if (termination.completeExceptionally(terminated)) {
            LOG.error("Pipeline terminated: session={}, stage={}", sessionId, terminated.getStageName(),
                    terminated.getCause());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
