package com.example.batchinference.service;

import com.example.batchinference.config.AsyncConfiguration;
import com.example.batchinference.config.InferenceProperties;
import com.example.batchinference.model.BatchResult;
import com.example.batchinference.model.DeliveryOutcome;
import com.example.batchinference.model.InferenceParams;
import com.example.batchinference.model.InferenceRequest;
import com.example.batchinference.service.callback.CallbackDispatcher;
import com.example.batchinference.service.pipeline.BatchOrchestrator;
import com.example.batchinference.service.tracker.RequestTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class InferenceJobServiceTest {

    private static final InferenceParams PARAMS = new InferenceParams(640, 0.25, 0.45);
    private static final String CALLBACK = "http://receiver.test/hook";

    @Mock
    private BatchOrchestrator orchestrator;

    @Mock
    private CallbackDispatcher dispatcher;

    private InferenceProperties properties;
    private RequestTracker tracker;

    @BeforeEach
    void setUp() {
        properties = new InferenceProperties();
        tracker = new RequestTracker(properties);
    }

    @Test
    void asyncJobRunsThenDeliversThenTracks() throws Exception {
        InferenceRequest request = new InferenceRequest("job-1", List.of("file:///a.jpg"), CALLBACK, PARAMS);
        BatchResult result = new BatchResult("job-1", List.of());
        when(orchestrator.run(request)).thenReturn(result);
        when(dispatcher.deliver(result, CALLBACK)).thenReturn(DeliveryOutcome.delivered(1, 200));

        DeliveryOutcome outcome = service().submit(request).get();

        assertThat(outcome.delivered()).isTrue();
        InOrder order = inOrder(orchestrator, dispatcher);
        order.verify(orchestrator).run(request);
        order.verify(dispatcher).deliver(result, CALLBACK);
        assertThat(tracker.get("job-1")).containsSame(result);
    }

    @Test
    void failedDeliveryIsReportedNotRethrown() throws Exception {
        InferenceRequest request = new InferenceRequest("job-2", List.of("file:///a.jpg"), CALLBACK, PARAMS);
        BatchResult result = new BatchResult("job-2", List.of());
        when(orchestrator.run(request)).thenReturn(result);
        when(dispatcher.deliver(result, CALLBACK)).thenReturn(DeliveryOutcome.failed(1, 503, "HTTP 503"));

        DeliveryOutcome outcome = service().submit(request).get();

        assertThat(outcome.delivered()).isFalse();
        assertThat(outcome.statusCode()).isEqualTo(503);
    }

    @Test
    void syncJobSkipsDeliveryAndTracksResult() {
        InferenceRequest request = new InferenceRequest("job-3", List.of("file:///a.jpg"), null, PARAMS);
        BatchResult result = new BatchResult("job-3", List.of());
        when(orchestrator.run(request)).thenReturn(result);

        assertThat(service().runSync(request)).isSameAs(result);
        verifyNoInteractions(dispatcher);
        assertThat(tracker.get("job-3")).containsSame(result);
    }

    @Test
    void doesNotTrackWhenLocalModeDisabled() {
        properties.getLocalMode().setEnabled(false);
        InferenceRequest request = new InferenceRequest("job-4", List.of(), null, PARAMS);
        when(orchestrator.run(request)).thenReturn(new BatchResult("job-4", List.of()));

        service().runSync(request);

        assertThat(tracker.get("job-4")).isEmpty();
    }

    @Test
    void rejectsAsyncSubmissionWithoutCallback() {
        InferenceRequest request = new InferenceRequest("job-5", List.of("file:///a.jpg"), " ", PARAMS);

        assertThatThrownBy(() -> service().submit(request)).isInstanceOf(IllegalArgumentException.class);
        verify(orchestrator, never()).run(request);
    }

    @Test
    void hangingCallbacksDoNotHoldBackLaterJobs() throws Exception {
        AsyncConfiguration async = new AsyncConfiguration();
        properties.setJobConcurrency(2);
        properties.getCallback().setConcurrency(2);
        ThreadPoolTaskExecutor jobExecutor = async.jobExecutor(properties);
        ThreadPoolTaskExecutor callbackExecutor = async.callbackExecutor(properties);
        CountDownLatch receiverDown = new CountDownLatch(1);
        CountDownLatch thirdJobStarted = new CountDownLatch(1);
        when(orchestrator.run(any())).thenAnswer(invocation -> {
            InferenceRequest request = invocation.getArgument(0);
            if (request.requestId().equals("job-c")) {
                thirdJobStarted.countDown();
            }
            return new BatchResult(request.requestId(), List.of());
        });
        when(dispatcher.deliver(any(), eq(CALLBACK))).thenAnswer(invocation -> {
            receiverDown.await();
            return DeliveryOutcome.failed(1, null, "timed out");
        });
        InferenceJobService service = new InferenceJobService(orchestrator, dispatcher, tracker,
                jobExecutor, callbackExecutor, properties);
        try {
            CompletableFuture<DeliveryOutcome> first = service.submit(asyncRequest("job-a"));
            CompletableFuture<DeliveryOutcome> second = service.submit(asyncRequest("job-b"));
            verify(dispatcher, timeout(2000).times(2)).deliver(any(), eq(CALLBACK));

            CompletableFuture<DeliveryOutcome> third = service.submit(asyncRequest("job-c"));

            assertThat(thirdJobStarted.await(2, TimeUnit.SECONDS)).isTrue();
            receiverDown.countDown();
            CompletableFuture.allOf(first, second, third).get(5, TimeUnit.SECONDS);
            assertThat(third.get().delivered()).isFalse();
        } finally {
            receiverDown.countDown();
            jobExecutor.shutdown();
            callbackExecutor.shutdown();
        }
    }

    private static InferenceRequest asyncRequest(String requestId) {
        return new InferenceRequest(requestId, List.of("file:///a.jpg"), CALLBACK, PARAMS);
    }

    private InferenceJobService service() {
        return new InferenceJobService(orchestrator, dispatcher, tracker, new SyncTaskExecutor(), new SyncTaskExecutor(),
                properties);
    }
}
