package com.example.batchinference.service.inference;

import com.example.batchinference.exception.ModelException;
import com.example.batchinference.model.InferenceParams;
import com.example.batchinference.model.ResolvedImage;
import com.example.batchinference.support.RecordingImageModel;
import com.example.batchinference.support.TestImages;
import com.example.batchinference.support.TestProperties;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InferenceExecutorTest {

    private static final InferenceParams PARAMS = new InferenceParams(640, 0.25, 0.45);
    private static final ResolvedImage IMAGE = new ResolvedImage("file:///a.jpg", TestImages.solid(4, 4, Color.GRAY));

    @Test
    void singlePermitSerializesModelCalls() throws Exception {
        RecordingImageModel model = new RecordingImageModel(30);
        InferenceExecutor executor = new InferenceExecutor(model, TestProperties.withMaxInflight(1));

        runConcurrently(executor, 5);

        assertThat(model.calls()).isEqualTo(5);
        assertThat(model.peakConcurrency()).isEqualTo(1);
    }

    @Test
    void neverExceedsAdmissionLimitUnderLoad() throws Exception {
        RecordingImageModel model = new RecordingImageModel(20);
        InferenceExecutor executor = new InferenceExecutor(model, TestProperties.withMaxInflight(2));

        runConcurrently(executor, 20);

        assertThat(model.calls()).isEqualTo(20);
        assertThat(model.peakConcurrency()).isBetween(1, 2);
        assertThat(executor.availablePermits()).isEqualTo(2);
    }

    @Test
    void releasesPermitWhenModelThrows() {
        ImageModel model = mock(ImageModel.class);
        when(model.predict(any(), any())).thenThrow(new IllegalStateException("CUDA out of memory"));
        InferenceExecutor executor = new InferenceExecutor(model, TestProperties.withMaxInflight(2));

        assertThatThrownBy(() -> executor.infer(IMAGE, PARAMS))
                .isInstanceOf(ModelException.class)
                .hasMessageContaining("CUDA out of memory");
        assertThat(executor.availablePermits()).isEqualTo(2);
    }

    @Test
    void rejectsMissingModelOutput() {
        ImageModel model = mock(ImageModel.class);
        InferenceExecutor executor = new InferenceExecutor(model, TestProperties.withMaxInflight(1));

        assertThatThrownBy(() -> executor.infer(IMAGE, PARAMS)).isInstanceOf(ModelException.class);
        assertThat(executor.availablePermits()).isEqualTo(1);
    }

    private void runConcurrently(InferenceExecutor executor, int calls) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(calls);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < calls; i++) {
                futures.add(pool.submit(() -> executor.infer(IMAGE, PARAMS)));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
