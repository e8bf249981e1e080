package com.example.batchinference.service.inference;

import com.example.batchinference.config.InferenceProperties;
import com.example.batchinference.exception.ModelException;
import com.example.batchinference.model.InferenceParams;
import com.example.batchinference.model.RawModelOutput;
import com.example.batchinference.model.ResolvedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.Semaphore;

/**
 * Runs the model under a global admission limit. At most
 * {@code inference.max-inflight} model calls execute at any time across all
 * batches; additional callers block until a permit is released.
 */
@Component
public class InferenceExecutor {

    private static final Logger log = LoggerFactory.getLogger(InferenceExecutor.class);

    private final ImageModel model;
    private final Semaphore admission;
    private final int maxInflight;

    public InferenceExecutor(ImageModel model, InferenceProperties properties) {
        this.model = model;
        this.maxInflight = properties.getMaxInflight();
        this.admission = new Semaphore(maxInflight, true);
    }

    public RawModelOutput infer(ResolvedImage image, InferenceParams params) {
        try {
            admission.acquire();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ModelException("Interrupted while waiting for an inference slot", ex);
        }
        try {
            long start = System.nanoTime();
            RawModelOutput output = model.predict(image.image(), params);
            if (output == null) {
                throw new ModelException("Model returned no output for " + image.source());
            }
            log.debug("Inference for {} took {} ms", image.source(), (System.nanoTime() - start) / 1_000_000.0);
            return output;
        } catch (ModelException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ModelException("Model invocation failed: " + ex.getMessage(), ex);
        } finally {
            admission.release();
        }
    }

    public ClassNames classNames() {
        return model.classNames();
    }

    public int maxInflight() {
        return maxInflight;
    }

    public int availablePermits() {
        return admission.availablePermits();
    }
}
