package com.phillippitts.voiceorders.service.backend.groq;

import com.phillippitts.voiceorders.exception.BackendCallException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Shared plumbing of the Groq clients: blocking {@link RestClient} calls are moved onto the
 * backend executor and HTTP failures become {@link BackendCallException}s.
 */
abstract class GroqClientSupport {

    private final RestClient restClient;
    private final Executor executor;
    private final String backendName;

    GroqClientSupport(RestClient restClient, Executor executor, String backendName) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.backendName = Objects.requireNonNull(backendName, "backendName");
    }

    protected RestClient rest() {
        return restClient;
    }

    protected <T> CompletableFuture<T> async(Supplier<T> request) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return request.get();
                } catch (RestClientResponseException e) {
                    throw new BackendCallException("HTTP " + e.getStatusCode().value() + ": "
                            + e.getResponseBodyAsString(), backendName, e);
                } catch (RestClientException e) {
                    throw new BackendCallException("Request failed: " + e.getMessage(), backendName, e);
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(
                    new BackendCallException("Backend executor saturated", backendName, e));
        }
    }

    protected String backendName() {
        return backendName;
    }
}
