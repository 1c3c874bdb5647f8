package com.phillippitts.voiceorders.service.backend;

import com.phillippitts.voiceorders.domain.frame.TransportMessage;
import com.phillippitts.voiceorders.service.events.BackendFailureEvent;
import com.phillippitts.voiceorders.service.metrics.VoicePipelineMetrics;
import com.phillippitts.voiceorders.service.pipeline.Emission;
import com.phillippitts.voiceorders.service.pipeline.FrameStage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Base class for stages that wait on an external backend.
 *
 * <p>A failed backend call does not end the session: it is logged, counted, published as a
 * {@link BackendFailureEvent} and answered with an {@code {"type":"error"}} message to the
 * client. Exceptions thrown while turning a successful response into frames are not caught
 * and terminate the pipeline.
 */
public abstract class BackendStage implements FrameStage {

    private static final Logger LOG = LogManager.getLogger(BackendStage.class);

    private final String backendName;
    private final String sessionId;
    private final VoicePipelineMetrics metrics;
    private final ApplicationEventPublisher events;

    protected BackendStage(String backendName, String sessionId,
                           VoicePipelineMetrics metrics, ApplicationEventPublisher events) {
        this.backendName = Objects.requireNonNull(backendName, "backendName");
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.events = Objects.requireNonNull(events, "events");
    }

    /**
     * Issues a backend call and maps its result to emissions.
     *
     * @param call      starts the request; may throw, which counts as a backend failure
     * @param onSuccess builds the emissions for a successful response
     * @param onFailure emissions to send ahead of the error message when the call fails
     */
    protected <T> CompletionStage<List<Emission>> call(Supplier<CompletableFuture<T>> call,
                                                       Function<T, List<Emission>> onSuccess,
                                                       List<Emission> onFailure) {
        long started = System.nanoTime();
        CompletableFuture<T> pending;
        try {
            pending = call.get();
        } catch (RuntimeException e) {
            pending = CompletableFuture.failedFuture(e);
        }
        return pending.handle((result, error) -> {
            metrics.recordBackendLatency(backendName, System.nanoTime() - started);
            if (error != null) {
                return failed(unwrap(error), onFailure);
            }
            return onSuccess.apply(result);
        });
    }

    private List<Emission> failed(Throwable error, List<Emission> onFailure) {
        LOG.warn("{} call failed: session={}, error={}", backendName, sessionId, error.toString());
        metrics.incrementBackendFailure(backendName, error.getClass().getSimpleName());
        events.publishEvent(new BackendFailureEvent(sessionId, backendName,
                String.valueOf(error.getMessage()), Instant.now()));
        JSONObject payload = new JSONObject()
                .put("type", "error")
                .put("message", apology());
        List<Emission> out = new ArrayList<>(onFailure);
        out.add(Emission.downstream(new TransportMessage(payload.toString())));
        return out;
    }

    /** Message shown to the caller when this backend fails. */
    protected String apology() {
        return "Sorry, I'm having trouble with the " + backendName + " service right now. Please try again.";
    }

    protected String backendName() {
        return backendName;
    }

    protected String sessionId() {
        return sessionId;
    }

    @Override
    public String name() {
        return getClass().getSimpleName();
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
