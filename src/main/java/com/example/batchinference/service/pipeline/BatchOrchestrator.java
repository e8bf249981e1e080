package com.example.batchinference.service.pipeline;

import com.example.batchinference.exception.ModelException;
import com.example.batchinference.exception.SourceException;
import com.example.batchinference.model.BatchResult;
import com.example.batchinference.model.InferenceOutcome;
import com.example.batchinference.model.InferenceParams;
import com.example.batchinference.model.InferenceRequest;
import com.example.batchinference.model.RawModelOutput;
import com.example.batchinference.model.ResolvedImage;
import com.example.batchinference.model.TaskResult;
import com.example.batchinference.service.inference.InferenceExecutor;
import com.example.batchinference.service.inference.ResultNormalizer;
import com.example.batchinference.service.source.ImageSourceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Runs resolve, infer and normalize for every source of a request. Units run
 * concurrently on the pipeline executor, whose pool size bounds how many
 * decoded images exist at once; the model calls themselves are additionally
 * gated by {@link InferenceExecutor}. Outcomes are written to the slot of their
 * source so the result order always matches the request order.
 */
@Service
public class BatchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final ImageSourceResolver resolver;
    private final InferenceExecutor executor;
    private final ResultNormalizer normalizer;
    private final TaskExecutor pipelineExecutor;

    public BatchOrchestrator(ImageSourceResolver resolver,
                             InferenceExecutor executor,
                             ResultNormalizer normalizer,
                             @Qualifier("pipelineExecutor") TaskExecutor pipelineExecutor) {
        this.resolver = resolver;
        this.executor = executor;
        this.normalizer = normalizer;
        this.pipelineExecutor = pipelineExecutor;
    }

    public BatchResult run(InferenceRequest request) {
        long start = System.nanoTime();
        List<String> sources = request.sources();
        InferenceOutcome[] slots = new InferenceOutcome[sources.size()];
        List<CompletableFuture<Void>> pending = new ArrayList<>(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            int slot = i;
            String source = sources.get(i);
            CompletableFuture<Void> unit;
            try {
                unit = CompletableFuture.runAsync(() -> slots[slot] = process(source, request.params()), pipelineExecutor);
            } catch (RuntimeException ex) {
                // executor refused the unit (e.g. during shutdown)
                slots[slot] = failure(source, ex.getMessage(), "rejected");
                continue;
            }
            pending.add(unit.exceptionally(ex -> {
                slots[slot] = failure(source, ex.getMessage(), "internal");
                return null;
            }));
        }
        CompletableFuture.allOf(pending.toArray(CompletableFuture[]::new)).join();

        BatchResult result = new BatchResult(request.requestId(), Arrays.asList(slots));
        log.info("Request {} finished: {}/{} sources succeeded in {} ms", request.requestId(), result.successCount(),
                sources.size(), (System.nanoTime() - start) / 1_000_000);
        return result;
    }

    InferenceOutcome process(String source, InferenceParams params) {
        try {
            ResolvedImage image = resolver.resolve(source);
            RawModelOutput raw = executor.infer(image, params);
            TaskResult result = normalizer.normalize(raw, executor.classNames(), params);
            return new InferenceOutcome.Success(source, result);
        } catch (SourceException ex) {
            log.warn("Source {} failed ({}): {}", source, ex.getReason(), ex.getMessage());
            return failure(source, ex.getMessage(), "source_" + ex.getReason().name().toLowerCase(Locale.ROOT));
        } catch (ModelException ex) {
            log.warn("Model failed on {}: {}", source, ex.getMessage());
            return failure(source, ex.getMessage(), "model_error");
        } catch (RuntimeException ex) {
            log.warn("Unexpected failure processing {}", source, ex);
            return failure(source, ex.toString(), "internal");
        }
    }

    private static InferenceOutcome failure(String source, String message, String reason) {
        return new InferenceOutcome.Failure(source, message, reason);
    }
}
