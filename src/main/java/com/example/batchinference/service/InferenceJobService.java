package com.example.batchinference.service;

import com.example.batchinference.config.InferenceProperties;
import com.example.batchinference.model.BatchResult;
import com.example.batchinference.model.DeliveryOutcome;
import com.example.batchinference.model.InferenceRequest;
import com.example.batchinference.service.callback.CallbackDispatcher;
import com.example.batchinference.service.pipeline.BatchOrchestrator;
import com.example.batchinference.service.tracker.RequestTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for accepted jobs. Synchronous jobs run on the caller's thread.
 * Asynchronous jobs run on the job executor and hand their result to the
 * callback executor; the delivery outcome is logged, never retried as a new
 * inference.
 */
@Service
public class InferenceJobService {

    private static final Logger log = LoggerFactory.getLogger(InferenceJobService.class);

    private final BatchOrchestrator orchestrator;
    private final CallbackDispatcher dispatcher;
    private final RequestTracker tracker;
    private final TaskExecutor jobExecutor;
    private final TaskExecutor callbackExecutor;
    private final boolean trackResults;

    public InferenceJobService(BatchOrchestrator orchestrator,
                               CallbackDispatcher dispatcher,
                               RequestTracker tracker,
                               @Qualifier("jobExecutor") TaskExecutor jobExecutor,
                               @Qualifier("callbackExecutor") TaskExecutor callbackExecutor,
                               InferenceProperties properties) {
        this.orchestrator = orchestrator;
        this.dispatcher = dispatcher;
        this.tracker = tracker;
        this.jobExecutor = jobExecutor;
        this.callbackExecutor = callbackExecutor;
        this.trackResults = properties.getLocalMode().isEnabled();
    }

    public BatchResult runSync(InferenceRequest request) {
        log.info("Running request {} synchronously with {} sources", request.requestId(), request.sources().size());
        BatchResult result = orchestrator.run(request);
        track(result);
        return result;
    }

    /**
     * Schedules the job and returns immediately. The returned future completes
     * with the delivery outcome; it is exposed for supervision and tests.
     */
    public CompletableFuture<DeliveryOutcome> submit(InferenceRequest request) {
        if (!request.isAsynchronous()) {
            throw new IllegalArgumentException("callback_url is required for asynchronous requests");
        }
        log.info("Accepted request {} with {} sources, callback {}", request.requestId(), request.sources().size(),
                request.callbackUrl());
        return CompletableFuture
                .supplyAsync(() -> orchestrator.run(request), jobExecutor)
                .thenApplyAsync(result -> deliver(result, request.callbackUrl()), callbackExecutor)
                .whenComplete((outcome, error) -> {
                    if (error != null) {
                        log.error("Job {} terminated without a delivery outcome", request.requestId(), error);
                    } else if (!outcome.delivered()) {
                        log.warn("Job {} completed but callback delivery failed after {} attempt(s): {}",
                                request.requestId(), outcome.attempts(), outcome.error());
                    }
                });
    }

    private DeliveryOutcome deliver(BatchResult result, String callbackUrl) {
        DeliveryOutcome outcome = dispatcher.deliver(result, callbackUrl);
        track(result);
        return outcome;
    }

    private void track(BatchResult result) {
        if (trackResults) {
            tracker.put(result.requestId(), result);
        }
    }
}
